package com.saleslog.pipeline.writer;

import com.saleslog.pipeline.exception.BucketWriteException;
import com.saleslog.pipeline.model.BucketId;
import com.saleslog.pipeline.model.BucketSummary;
import com.saleslog.pipeline.model.PipelineConfig;
import com.saleslog.pipeline.model.ProductTotals;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class BucketWriterTest {

    private static final BucketId BUCKET = new BucketId("2024112314");

    @TempDir
    Path dir;

    private BucketWriter writer(Path outputRoot) {
        return new BucketWriter(PipelineConfig.of(dir.resolve("in"), outputRoot));
    }

    private static BucketSummary summary(Object... productsAndTotals) {
        ProductTotals totals = new ProductTotals();
        for (int i = 0; i < productsAndTotals.length; i += 2) {
            totals.add((String) productsAndTotals[i], (Double) productsAndTotals[i + 1]);
        }
        return BucketSummary.of(BUCKET, totals);
    }

    @Test
    @DisplayName("Writes one line per product, sorted by product name, into <outputRoot>/<bucketId>.txt")
    void write_sortedLines() throws Exception {
        Path output = dir.resolve("output");

        Path written = writer(output).write(summary("Widget", 15.0, "Gadget", 2.5, "Anvil", 100.125));

        assertThat(written).isEqualTo(output.resolve("2024112314.txt"));
        assertThat(Files.readString(written)).isEqualTo("""
                2024/11/23 14|Anvil|100.12
                2024/11/23 14|Gadget|2.50
                2024/11/23 14|Widget|15.00
                """);
    }

    @Test
    @DisplayName("Rewriting a bucket replaces the previous content instead of appending")
    void write_overwritesExistingFile() throws Exception {
        Path output = Files.createDirectories(dir.resolve("output"));
        Files.writeString(output.resolve("2024112314.txt"), "stale|line|1.00\nanother|stale|2.00\n");
        BucketWriter writer = writer(output);

        writer.write(summary("Widget", 15.0));
        byte[] first = Files.readAllBytes(output.resolve("2024112314.txt"));
        writer.write(summary("Widget", 15.0));
        byte[] second = Files.readAllBytes(output.resolve("2024112314.txt"));

        assertThat(new String(first)).isEqualTo("2024/11/23 14|Widget|15.00\n");
        assertThat(second).isEqualTo(first);
    }

    @Test
    @DisplayName("Leaves no temporary files behind")
    void write_noTemporaryFiles() throws Exception {
        Path output = dir.resolve("output");

        writer(output).write(summary("Widget", 1.0));

        try (Stream<Path> files = Files.list(output)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("2024112314.txt");
        }
    }

    @Test
    @DisplayName("Refuses to write an empty summary")
    void write_rejectsEmptySummary() {
        assertThatThrownBy(() -> writer(dir).write(BucketSummary.empty(BUCKET)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(dir.resolve("2024112314.txt")).doesNotExist();
    }

    @Test
    @DisplayName("Fails with BucketWriteException when the output root cannot be created")
    void write_failsWhenOutputRootIsAFile() throws Exception {
        Path blocker = Files.writeString(dir.resolve("blocker"), "x");

        assertThatThrownBy(() -> writer(blocker.resolve("output")).write(summary("Widget", 1.0)))
                .isInstanceOf(BucketWriteException.class)
                .hasMessageContaining("2024112314")
                .extracting(e -> ((BucketWriteException) e).getBucketId())
                .isEqualTo(BUCKET);
    }

    @Test
    @DisplayName("Summary files get the same permissions as any other file created in the directory")
    void write_usesDefaultFilePermissions() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path output = Files.createDirectories(dir.resolve("output"));
        Path plain = Files.writeString(output.resolve("plain.txt"), "x");

        Path written = writer(output).write(summary("Widget", 15.0));

        assertThat(Files.getPosixFilePermissions(written)).isEqualTo(Files.getPosixFilePermissions(plain));
    }

    @Test
    @DisplayName("Rewriting a bucket keeps the permissions of the existing summary file")
    void write_keepsExistingPermissions() throws Exception {
        assumeTrue(FileSystems.getDefault().supportedFileAttributeViews().contains("posix"));
        Path output = Files.createDirectories(dir.resolve("output"));
        Path existing = Files.writeString(output.resolve("2024112314.txt"), "old\n");
        Set<PosixFilePermission> shared = PosixFilePermissions.fromString("rw-rw-r--");
        Files.setPosixFilePermissions(existing, shared);

        Path written = writer(output).write(summary("Widget", 15.0));

        assertThat(Files.getPosixFilePermissions(written)).isEqualTo(shared);
    }
}
