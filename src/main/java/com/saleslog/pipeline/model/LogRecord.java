package com.saleslog.pipeline.model;

public record LogRecord(
        String timestamp,
        String eventId,
        String productName,
        double price
) {
}
