package com.saleslog.pipeline.model;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Running revenue per product name. Not thread-safe: each file aggregation owns its own
 * instance and the bucket merge happens on a single thread.
 */
public final class ProductTotals {

    private final Map<String, Double> totals = new HashMap<>();

    public void add(String productName, double amount) {
        totals.merge(productName, amount, Double::sum);
    }

    public void merge(ProductTotals other) {
        other.totals.forEach(this::add);
    }

    public double get(String productName) {
        return totals.getOrDefault(productName, 0.0);
    }

    public int size() {
        return totals.size();
    }

    public boolean isEmpty() {
        return totals.isEmpty();
    }

    public SortedMap<String, Double> toSortedMap() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(totals));
    }

    @Override
    public String toString() {
        return "ProductTotals" + toSortedMap();
    }
}
