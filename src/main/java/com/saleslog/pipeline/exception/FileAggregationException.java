package com.saleslog.pipeline.exception;

import java.io.IOException;
import java.nio.file.Path;

/**
 * A log file could not be opened or read. Only the file is skipped.
 */
public class FileAggregationException extends IOException {

    private final Path file;

    public FileAggregationException(Path file, Throwable cause) {
        super("Cannot read log file " + file + ": " + cause.getMessage(), cause);
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
