package com.saleslog.pipeline.utils;

import com.saleslog.pipeline.model.SummaryLine;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermission;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Shared rendering and file replacement for summary and report writers.
 */
public final class SummaryFileUtils {

    private static final String TEMP_SUFFIX = ".tmp";

    private SummaryFileUtils() {
    }

    /**
     * Renders lines with a trailing newline after each one, including the last.
     */
    public static String toText(List<SummaryLine> lines) {
        StringBuilder sb = new StringBuilder(lines.size() * 48);
        for (SummaryLine line : lines) {
            sb.append(line.toLine()).append('\n');
        }
        return sb.toString();
    }

    /**
     * Writes content to a temporary sibling and moves it over the target, so readers see either the
     * previous file or the complete new one. Existing content is replaced, never appended to.
     */
    public static void replaceFile(Path target, String content) throws IOException {
        Path dir = target.toAbsolutePath().getParent();
        Files.createDirectories(dir);
        // Files.createTempFile would force rw-------; a plain create keeps the umask defaults.
        Path temp = dir.resolve("." + target.getFileName() + "." + UUID.randomUUID() + TEMP_SUFFIX);
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            copyPermissions(target, temp);
            moveReplacing(temp, target);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException cleanup) {
                e.addSuppressed(cleanup);
            }
            throw e;
        }
    }

    private static void copyPermissions(Path from, Path to) throws IOException {
        if (!Files.exists(from) || Files.getFileAttributeView(from, PosixFileAttributeView.class) == null) {
            return;
        }
        Set<PosixFilePermission> permissions = Files.getPosixFilePermissions(from);
        Files.setPosixFilePermissions(to, permissions);
    }

    private static void moveReplacing(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
