package com.saleslog.pipeline.exception;

import com.saleslog.pipeline.model.BucketId;

import java.io.IOException;

/**
 * The summary file of a bucket could not be written. The bucket is marked failed.
 */
public class BucketWriteException extends IOException {

    private final BucketId bucketId;

    public BucketWriteException(BucketId bucketId, Throwable cause) {
        super("Cannot write summary for bucket " + bucketId + ": " + cause.getMessage(), cause);
        this.bucketId = bucketId;
    }

    public BucketId getBucketId() {
        return bucketId;
    }
}
