package com.saleslog.pipeline.driver;

import com.saleslog.pipeline.aggregate.HourAggregator;
import com.saleslog.pipeline.exception.BucketWriteException;
import com.saleslog.pipeline.exception.DiscoveryException;
import com.saleslog.pipeline.model.BucketId;
import com.saleslog.pipeline.model.BucketResult;
import com.saleslog.pipeline.model.HourAggregate;
import com.saleslog.pipeline.model.PipelineConfig;
import com.saleslog.pipeline.model.PipelineState;
import com.saleslog.pipeline.model.RunReport;
import com.saleslog.pipeline.scan.HourBucketScanner;
import com.saleslog.pipeline.writer.BucketWriter;
import io.micrometer.core.instrument.Metrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs the whole pipeline: scan the input root, then aggregate and write every bucket on a bounded
 * pool. A bucket failure is recorded in the report and never stops the other buckets; only a root
 * that cannot be listed aborts the run.
 */
@Component
public class PipelineDriver {

    private static final Logger log = LoggerFactory.getLogger(PipelineDriver.class);

    private static final String METRIC_BUCKETS = "pipeline.buckets";
    private static final String METRIC_PARSE_ERRORS = "pipeline.parse.errors";
    private static final String METRIC_FILE_ERRORS = "pipeline.file.errors";
    private static final String TAG_OUTCOME = "outcome";

    private final PipelineConfig config;
    private final HourBucketScanner scanner;
    private final HourAggregator hourAggregator;
    private final BucketWriter writer;
    private final Clock clock;

    private final Object lifecycleLock = new Object();
    private final AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.IDLE);
    // guarded by lifecycleLock
    private CancellationToken activeCancellation;

    public PipelineDriver(PipelineConfig config,
                          HourBucketScanner scanner,
                          HourAggregator hourAggregator,
                          BucketWriter writer,
                          Clock clock) {
        this.config = config;
        this.scanner = scanner;
        this.hourAggregator = hourAggregator;
        this.writer = writer;
        this.clock = clock;
    }

    public PipelineState state() {
        return state.get();
    }

    /**
     * Stops the active run from starting further buckets or files. Work already in flight
     * completes; buckets that did not finish aggregating produce no output. Has no effect when
     * no run is active.
     */
    @PreDestroy
    public void cancel() {
        synchronized (lifecycleLock) {
            if (activeCancellation != null) {
                log.warn("Cancellation requested, no new bucket or file work will be started");
                activeCancellation.cancel();
            }
        }
    }

    public RunReport run() throws DiscoveryException {
        CancellationToken cancellation;
        Instant startedAt;
        synchronized (lifecycleLock) {
            PipelineState current = state.get();
            if (current != PipelineState.IDLE && current != PipelineState.DONE) {
                throw new IllegalStateException("A pipeline run is already in progress (" + current + ")");
            }
            state.set(PipelineState.SCANNING);
            cancellation = new CancellationToken(clock, config.deadline());
            activeCancellation = cancellation;
            startedAt = clock.instant();
        }
        try (RunContext context = new RunContext(config, cancellation)) {
            List<BucketId> buckets = scanner.scan(config.inputRoot());
            log.info("Discovered {} bucket(s) under {}", buckets.size(), config.inputRoot());

            state.set(PipelineState.PROCESSING);
            List<BucketResult> results = processAll(buckets, context);

            RunReport report = RunReport.from(startedAt, clock.instant(), results);
            recordMetrics(results);
            log.info("Run finished: {} written, {} skipped, {} failed, {} cancelled, {} parse error(s), {} failed file(s)",
                    report.bucketsWritten(), report.bucketsSkipped(), report.bucketsFailed(),
                    report.bucketsCancelled(), report.parseErrors(), report.filesFailed());
            return report;
        } catch (DiscoveryException e) {
            log.error("Aborting run: {}", e.getMessage());
            throw e;
        } finally {
            synchronized (lifecycleLock) {
                activeCancellation = null;
                state.set(PipelineState.DONE);
            }
        }
    }

    private List<BucketResult> processAll(List<BucketId> buckets, RunContext context) {
        List<Future<BucketResult>> pending = new ArrayList<>(buckets.size());
        for (BucketId bucketId : buckets) {
            pending.add(context.bucketPool().submit(() -> processBucket(bucketId, context)));
        }

        List<BucketResult> results = new ArrayList<>(buckets.size());
        for (int i = 0; i < pending.size(); i++) {
            BucketId bucketId = buckets.get(i);
            try {
                results.add(pending.get(i).get());
            } catch (ExecutionException e) {
                log.warn("Bucket {} failed unexpectedly", bucketId, e.getCause());
                results.add(BucketResult.failed(bucketId, String.valueOf(e.getCause())));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                context.cancellation().cancel();
                results.add(BucketResult.cancelled(bucketId));
            }
        }
        return results;
    }

    private BucketResult processBucket(BucketId bucketId, RunContext context) {
        if (context.cancellation().isCancelled()) {
            return BucketResult.cancelled(bucketId);
        }

        HourAggregate aggregate;
        try {
            aggregate = hourAggregator.aggregate(bucketId, config.inputRoot().resolve(bucketId.value()), context);
        } catch (CancellationException e) {
            log.warn("Bucket {} cancelled: {}", bucketId, e.getMessage());
            return BucketResult.cancelled(bucketId);
        } catch (IOException e) {
            log.warn("Bucket {} failed: cannot list files: {}", bucketId, e.getMessage());
            return BucketResult.failed(bucketId, "Cannot list bucket directory: " + e.getMessage());
        }

        if (aggregate.cancelled()) {
            log.warn("Bucket {} cancelled before all files were aggregated ({} parse error(s) so far), nothing written",
                    bucketId, aggregate.parseErrors());
            return BucketResult.cancelled(bucketId, aggregate);
        }
        if (!aggregate.hasData()) {
            log.info("Bucket {} has no aggregated records ({} parse error(s), {} failed file(s)), nothing written",
                    bucketId, aggregate.parseErrors(), aggregate.filesFailed());
            return BucketResult.skipped(bucketId, aggregate);
        }

        try {
            Path output = writer.write(aggregate.summary());
            log.info("Bucket {}: wrote {} product total(s) to {}", bucketId, aggregate.summary().totals().size(), output);
            return BucketResult.written(bucketId, aggregate, output.toString());
        } catch (BucketWriteException e) {
            log.warn("Bucket {} failed: {}", bucketId, e.getMessage());
            return BucketResult.failed(bucketId, aggregate, e.getMessage());
        }
    }

    private void recordMetrics(List<BucketResult> results) {
        for (BucketResult result : results) {
            Metrics.counter(METRIC_BUCKETS, TAG_OUTCOME, result.outcome().name().toLowerCase(Locale.ROOT)).increment();
            Metrics.counter(METRIC_PARSE_ERRORS).increment(result.parseErrors());
            Metrics.counter(METRIC_FILE_ERRORS).increment(result.filesFailed());
        }
    }
}
