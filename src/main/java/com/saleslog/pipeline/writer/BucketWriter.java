package com.saleslog.pipeline.writer;

import com.saleslog.pipeline.exception.BucketWriteException;
import com.saleslog.pipeline.model.BucketSummary;
import com.saleslog.pipeline.model.PipelineConfig;
import com.saleslog.pipeline.utils.SummaryFileUtils;
import io.micrometer.core.instrument.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Persists a bucket summary as {@code <outputRoot>/<bucketId>.txt}, one
 * {@code YYYY/MM/DD HH|product|total} line per product, replacing any earlier file for the bucket.
 */
@Component
public class BucketWriter {

    private static final Logger log = LoggerFactory.getLogger(BucketWriter.class);

    private static final String METRIC_WRITES = "pipeline.summary.writes";
    private static final String METRIC_WRITE_ERRORS = "pipeline.summary.write.errors";

    private final Path outputRoot;

    public BucketWriter(PipelineConfig config) {
        this.outputRoot = config.outputRoot();
    }

    public Path outputPath(BucketSummary summary) {
        return outputRoot.resolve(summary.bucketId().fileName());
    }

    public Path write(BucketSummary summary) throws BucketWriteException {
        if (summary.isEmpty()) {
            throw new IllegalArgumentException("Refusing to write empty summary for bucket " + summary.bucketId());
        }
        Path target = outputPath(summary);
        try {
            SummaryFileUtils.replaceFile(target, SummaryFileUtils.toText(summary.toLines()));
        } catch (IOException e) {
            Metrics.counter(METRIC_WRITE_ERRORS).increment();
            throw new BucketWriteException(summary.bucketId(), e);
        }
        Metrics.counter(METRIC_WRITES).increment();
        log.debug("Wrote {} product total(s) to {}", summary.totals().size(), target);
        return target;
    }
}
