package com.saleslog.pipeline.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * The input root could not be enumerated. Fatal for the whole run.
 */
public class DiscoveryException extends IOException {

    private final Path root;

    public DiscoveryException(Path root, String message, Throwable cause) {
        super("Cannot list bucket root " + root + ": " + message, cause);
        this.root = root;
    }

    public Path getRoot() {
        return root;
    }
}
