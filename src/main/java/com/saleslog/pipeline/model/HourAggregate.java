package com.saleslog.pipeline.model;

import java.util.List;

/**
 * Merged result of every file in a bucket together with the diagnostics gathered on the way.
 * A cancelled aggregate carries the counts of the files that completed and an empty summary.
 */
public record HourAggregate(
        BucketSummary summary,
        int filesAggregated,
        int filesFailed,
        long parseErrors,
        List<String> fileErrors,
        boolean cancelled
) {

    public HourAggregate {
        fileErrors = List.copyOf(fileErrors);
    }

    public static HourAggregate completed(BucketSummary summary, int filesAggregated, int filesFailed,
                                          long parseErrors, List<String> fileErrors) {
        return new HourAggregate(summary, filesAggregated, filesFailed, parseErrors, fileErrors, false);
    }

    public static HourAggregate cancelled(BucketId bucketId, int filesAggregated, int filesFailed,
                                          long parseErrors, List<String> fileErrors) {
        return new HourAggregate(BucketSummary.empty(bucketId), filesAggregated, filesFailed, parseErrors,
                fileErrors, true);
    }

    public boolean hasData() {
        return !cancelled && !summary.isEmpty();
    }
}
