package com.saleslog.pipeline.model;

/**
 * Outcome of parsing one log line: either a record or the reason the line was rejected.
 */
public record ParseResult(LogRecord record, String line, String error) {

    public static ParseResult success(LogRecord record) {
        return new ParseResult(record, null, null);
    }

    public static ParseResult failure(String line, String error) {
        return new ParseResult(null, line, error);
    }

    public boolean isSuccess() {
        return record != null;
    }
}
