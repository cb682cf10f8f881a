package com.saleslog.pipeline.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate result of one pipeline run. Lets an operator tell "no data" apart from
 * "data lost to errors".
 */
public record RunReport(
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("buckets_discovered") int bucketsDiscovered,
        @JsonProperty("buckets_written") int bucketsWritten,
        @JsonProperty("buckets_skipped") int bucketsSkipped,
        @JsonProperty("buckets_failed") int bucketsFailed,
        @JsonProperty("buckets_cancelled") int bucketsCancelled,
        @JsonProperty("parse_errors") long parseErrors,
        @JsonProperty("files_failed") int filesFailed,
        List<BucketResult> failures
) {

    public RunReport {
        failures = List.copyOf(failures);
    }

    public static RunReport from(Instant startedAt, Instant finishedAt, List<BucketResult> results) {
        return new RunReport(
                startedAt,
                finishedAt,
                results.size(),
                count(results, BucketOutcome.WRITTEN),
                count(results, BucketOutcome.SKIPPED),
                count(results, BucketOutcome.FAILED),
                count(results, BucketOutcome.CANCELLED),
                results.stream().mapToLong(BucketResult::parseErrors).sum(),
                results.stream().mapToInt(BucketResult::filesFailed).sum(),
                results.stream()
                        .filter(result -> result.outcome() == BucketOutcome.FAILED)
                        .collect(Collectors.toList()));
    }

    private static int count(List<BucketResult> results, BucketOutcome outcome) {
        return (int) results.stream().filter(result -> result.outcome() == outcome).count();
    }

    public boolean hasFailures() {
        return bucketsFailed > 0;
    }
}
