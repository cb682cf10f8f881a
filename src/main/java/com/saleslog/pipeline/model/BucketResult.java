package com.saleslog.pipeline.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BucketResult(
        @JsonProperty("bucket_id") String bucketId,
        BucketOutcome outcome,
        @JsonProperty("parse_errors") long parseErrors,
        @JsonProperty("files_failed") int filesFailed,
        @JsonProperty("file_errors") List<String> fileErrors,
        String output,
        String error
) {

    public static BucketResult written(BucketId bucketId, HourAggregate aggregate, String output) {
        return new BucketResult(bucketId.value(), BucketOutcome.WRITTEN, aggregate.parseErrors(),
                aggregate.filesFailed(), aggregate.fileErrors(), output, null);
    }

    public static BucketResult skipped(BucketId bucketId, HourAggregate aggregate) {
        return new BucketResult(bucketId.value(), BucketOutcome.SKIPPED, aggregate.parseErrors(),
                aggregate.filesFailed(), aggregate.fileErrors(), null, null);
    }

    public static BucketResult failed(BucketId bucketId, HourAggregate aggregate, String error) {
        return new BucketResult(bucketId.value(), BucketOutcome.FAILED, aggregate.parseErrors(),
                aggregate.filesFailed(), aggregate.fileErrors(), null, error);
    }

    public static BucketResult failed(BucketId bucketId, String error) {
        return new BucketResult(bucketId.value(), BucketOutcome.FAILED, 0L, 0, List.of(), null, error);
    }

    public static BucketResult cancelled(BucketId bucketId, HourAggregate aggregate) {
        return new BucketResult(bucketId.value(), BucketOutcome.CANCELLED, aggregate.parseErrors(),
                aggregate.filesFailed(), aggregate.fileErrors(), null, null);
    }

    public static BucketResult cancelled(BucketId bucketId) {
        return new BucketResult(bucketId.value(), BucketOutcome.CANCELLED, 0L, 0, List.of(), null, null);
    }
}
