package com.saleslog.pipeline.aggregate;

import com.saleslog.pipeline.driver.CancellationToken;
import com.saleslog.pipeline.driver.RunContext;
import com.saleslog.pipeline.model.BucketId;
import com.saleslog.pipeline.model.BucketSummary;
import com.saleslog.pipeline.model.FileAggregate;
import com.saleslog.pipeline.model.HourAggregate;
import com.saleslog.pipeline.model.ProductTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Aggregates every {@code *.txt} file of a bucket on the run's file pool and merges the results.
 * The merge runs on the calling thread in file-name order, so the totals do not depend on which
 * file finishes first.
 */
@Component
public class HourAggregator {

    private static final Logger log = LoggerFactory.getLogger(HourAggregator.class);

    private static final String LOG_FILE_GLOB = "*.txt";

    private final FileAggregator fileAggregator;

    public HourAggregator(FileAggregator fileAggregator) {
        this.fileAggregator = fileAggregator;
    }

    /**
     * Returns a {@link HourAggregate#cancelled() cancelled} aggregate, keeping the counts of the files
     * that did complete, when the run was cancelled before every file was started.
     *
     * @throws IOException           if the bucket directory cannot be listed
     * @throws CancellationException if the calling thread is interrupted while waiting for files
     */
    public HourAggregate aggregate(BucketId bucketId, Path bucketDir, RunContext context) throws IOException {
        List<Path> files = listLogFiles(bucketDir);
        if (files.isEmpty()) {
            log.debug("Bucket {} has no log files", bucketId);
            return HourAggregate.completed(BucketSummary.empty(bucketId), 0, 0, 0L, List.of());
        }

        CancellationToken cancellation = context.cancellation();
        List<Future<FileAggregate>> pending = new ArrayList<>(files.size());
        for (Path file : files) {
            pending.add(context.filePool().submit(() -> {
                if (cancellation.isCancelled()) {
                    throw new CancellationException("Run cancelled before " + file + " was read");
                }
                return fileAggregator.aggregate(file);
            }));
        }

        ProductTotals totals = new ProductTotals();
        int aggregated = 0;
        long parseErrors = 0;
        List<String> fileErrors = new ArrayList<>();
        boolean cancelled = false;
        for (int i = 0; i < pending.size(); i++) {
            try {
                FileAggregate result = pending.get(i).get();
                totals.merge(result.totals());
                parseErrors += result.errorCount();
                aggregated++;
            } catch (ExecutionException e) {
                if (e.getCause() instanceof CancellationException) {
                    cancelled = true;
                } else {
                    log.warn("Skipping file in bucket {}: {}", bucketId, e.getCause().getMessage());
                    fileErrors.add(String.valueOf(e.getCause().getMessage()));
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                pending.forEach(future -> future.cancel(true));
                throw new CancellationException("Interrupted while aggregating bucket " + bucketId);
            }
        }
        if (cancelled) {
            return HourAggregate.cancelled(bucketId, aggregated, fileErrors.size(), parseErrors, fileErrors);
        }

        log.debug("Bucket {}: {} file(s) aggregated, {} failed, {} product(s), {} parse error(s)",
                bucketId, aggregated, fileErrors.size(), totals.size(), parseErrors);
        return HourAggregate.completed(BucketSummary.of(bucketId, totals), aggregated, fileErrors.size(),
                parseErrors, fileErrors);
    }

    private List<Path> listLogFiles(Path bucketDir) throws IOException {
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(bucketDir, LOG_FILE_GLOB)) {
            for (Path entry : entries) {
                if (Files.isRegularFile(entry)) {
                    files.add(entry);
                }
            }
        }
        Collections.sort(files);
        return files;
    }
}
