package com.saleslog.pipeline.parse;

import com.saleslog.pipeline.model.LogRecord;
import com.saleslog.pipeline.model.ParseResult;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Parses {@code timestamp|eventId|productName|price} lines. Stateless.
 */
@Component
public class LogRecordParser {

    private static final int FIELD_COUNT = 4;
    private static final Pattern FIELD_SPLITTER = Pattern.compile("\\|");
    // Plain decimal text only: Double.parseDouble alone would also take "NaN", "0x1p3" or "1.5d".
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

    public ParseResult parse(String line) {
        String[] fields = FIELD_SPLITTER.split(line, -1);
        if (fields.length != FIELD_COUNT) {
            return ParseResult.failure(line, "expected " + FIELD_COUNT + " fields but found " + fields.length);
        }
        String priceText = fields[3].trim();
        if (!DECIMAL.matcher(priceText).matches()) {
            return ParseResult.failure(line, "price is not a number: '" + fields[3] + "'");
        }
        double price = Double.parseDouble(priceText);
        if (!Double.isFinite(price)) {
            return ParseResult.failure(line, "price is out of range: '" + fields[3] + "'");
        }
        return ParseResult.success(new LogRecord(fields[0], fields[1], fields[2], price));
    }
}
