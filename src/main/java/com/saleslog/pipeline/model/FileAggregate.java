package com.saleslog.pipeline.model;

import java.nio.file.Path;

public record FileAggregate(
        Path file,
        ProductTotals totals,
        long linesRead,
        long errorCount
) {
}
