package com.saleslog.pipeline.model;

public enum BucketOutcome {
    WRITTEN,
    SKIPPED,
    FAILED,
    CANCELLED
}
