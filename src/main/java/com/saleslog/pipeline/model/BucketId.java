package com.saleslog.pipeline.model;

/**
 * Identifier of an hour bucket: ten ASCII digits laid out as {@code YYYYMMDDHH}.
 */
public record BucketId(String value) implements Comparable<BucketId> {

    private static final int LENGTH = 10;
    private static final String FILE_SUFFIX = ".txt";

    public BucketId {
        if (!isValid(value)) {
            throw new IllegalArgumentException("Bucket id must be " + LENGTH + " ASCII digits: " + value);
        }
    }

    /**
     * Returns true if the name is exactly ten characters, all of them '0'-'9'.
     */
    public static boolean isValid(String name) {
        if (name == null || name.length() != LENGTH) {
            return false;
        }
        for (int i = 0; i < LENGTH; i++) {
            char c = name.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    /**
     * Human readable label used as the first column of summary lines, e.g. "2024/11/23 14".
     */
    public String dateLabel() {
        return value.substring(0, 4) + "/" + value.substring(4, 6) + "/" + value.substring(6, 8)
                + " " + value.substring(8, 10);
    }

    public String fileName() {
        return value + FILE_SUFFIX;
    }

    @Override
    public int compareTo(BucketId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
