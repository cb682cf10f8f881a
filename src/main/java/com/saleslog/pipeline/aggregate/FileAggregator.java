package com.saleslog.pipeline.aggregate;

import com.saleslog.pipeline.exception.FileAggregationException;
import com.saleslog.pipeline.model.FileAggregate;
import com.saleslog.pipeline.model.LogRecord;
import com.saleslog.pipeline.model.ParseResult;
import com.saleslog.pipeline.model.ProductTotals;
import com.saleslog.pipeline.parse.LogRecordParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Folds one log file into per-product totals. Malformed lines are counted and skipped; only a
 * file that cannot be read at all fails.
 */
@Component
public class FileAggregator {

    private static final Logger log = LoggerFactory.getLogger(FileAggregator.class);

    private final LogRecordParser parser;

    public FileAggregator(LogRecordParser parser) {
        this.parser = parser;
    }

    public FileAggregate aggregate(Path file) throws FileAggregationException {
        ProductTotals totals = new ProductTotals();
        long lineNumber = 0;
        long errors = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                ParseResult result = parser.parse(line);
                if (result.isSuccess()) {
                    LogRecord record = result.record();
                    totals.add(record.productName(), record.price());
                } else {
                    errors++;
                    log.debug("Skipping {}:{} ({}): {}", file, lineNumber, result.error(), result.line());
                }
            }
        } catch (IOException e) {
            throw new FileAggregationException(file, e);
        }
        if (errors > 0) {
            log.debug("Aggregated {} with {} malformed line(s) out of {}", file, errors, lineNumber);
        }
        return new FileAggregate(file, totals, lineNumber, errors);
    }
}
