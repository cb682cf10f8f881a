package com.saleslog.pipeline.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One line of an hourly summary file: {@code YYYY/MM/DD HH|product|total}.
 */
public record SummaryLine(
        String dateLabel,
        String productName,
        double total
) {

    public static final char SEPARATOR = '|';

    /**
     * Renders the total from the exact binary value of the double, rounded half-even to two
     * decimals, so 0.125 becomes "0.12" and 2.675 becomes "2.67". A negative total that rounds
     * to zero keeps its sign ("-0.00").
     */
    public static String formatTotal(double total) {
        BigDecimal rounded = new BigDecimal(total).setScale(2, RoundingMode.HALF_EVEN);
        String text = rounded.toPlainString();
        if (rounded.signum() == 0 && Math.copySign(1.0, total) < 0) {
            return "-" + text;
        }
        return text;
    }

    public String toLine() {
        return dateLabel + SEPARATOR + productName + SEPARATOR + formatTotal(total);
    }
}
