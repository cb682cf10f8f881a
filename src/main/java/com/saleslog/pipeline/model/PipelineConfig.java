package com.saleslog.pipeline.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

/**
 * Everything a run needs, resolved once and threaded through the pipeline explicitly.
 *
 * @param inputRoot         directory holding one sub-directory per hour bucket
 * @param outputRoot        directory receiving one summary file per bucket
 * @param bucketConcurrency number of buckets processed at the same time
 * @param fileConcurrency   number of files aggregated at the same time, across all buckets
 * @param deadline          maximum run duration, {@code null} for none
 * @param reportFile        where to write the JSON run report, {@code null} to skip it
 */
public record PipelineConfig(
        Path inputRoot,
        Path outputRoot,
        int bucketConcurrency,
        int fileConcurrency,
        Duration deadline,
        Path reportFile
) {

    public static final int DEFAULT_BUCKET_CONCURRENCY = 2;
    public static final int DEFAULT_FILE_CONCURRENCY = 4;

    public PipelineConfig {
        if (inputRoot == null || outputRoot == null) {
            throw new IllegalArgumentException("Input and output roots are required");
        }
        if (bucketConcurrency < 1) {
            throw new IllegalArgumentException("Bucket concurrency must be at least 1: " + bucketConcurrency);
        }
        if (fileConcurrency < 1) {
            throw new IllegalArgumentException("File concurrency must be at least 1: " + fileConcurrency);
        }
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("Deadline must be positive: " + deadline);
        }
    }

    public static PipelineConfig of(Path inputRoot, Path outputRoot) {
        return new PipelineConfig(inputRoot, outputRoot, DEFAULT_BUCKET_CONCURRENCY, DEFAULT_FILE_CONCURRENCY,
                null, null);
    }

    public PipelineConfig withConcurrency(int buckets, int files) {
        return new PipelineConfig(inputRoot, outputRoot, buckets, files, deadline, reportFile);
    }

    public PipelineConfig withDeadline(Duration runDeadline) {
        return new PipelineConfig(inputRoot, outputRoot, bucketConcurrency, fileConcurrency, runDeadline, reportFile);
    }

    public Optional<Path> runReportFile() {
        return Optional.ofNullable(reportFile);
    }
}
