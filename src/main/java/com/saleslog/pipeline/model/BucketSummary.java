package com.saleslog.pipeline.model;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Final totals of one hour bucket, ordered by product name.
 */
public record BucketSummary(BucketId bucketId, SortedMap<String, Double> totals) {

    public BucketSummary {
        totals = Collections.unmodifiableSortedMap(new TreeMap<>(totals));
    }

    public static BucketSummary of(BucketId bucketId, ProductTotals totals) {
        return new BucketSummary(bucketId, totals.toSortedMap());
    }

    public static BucketSummary empty(BucketId bucketId) {
        return new BucketSummary(bucketId, new TreeMap<>());
    }

    public boolean isEmpty() {
        return totals.isEmpty();
    }

    public List<SummaryLine> toLines() {
        String dateLabel = bucketId.dateLabel();
        return totals.entrySet().stream()
                .map(entry -> new SummaryLine(dateLabel, entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }
}
