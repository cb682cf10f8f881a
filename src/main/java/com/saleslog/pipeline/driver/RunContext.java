package com.saleslog.pipeline.driver;

import com.saleslog.pipeline.model.PipelineConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Resources owned by a single run: the bucket and file worker pools and the cancellation token.
 * Acquired when the run starts and released when it ends.
 */
public class RunContext implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RunContext.class);

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final ExecutorService bucketPool;
    private final ExecutorService filePool;
    private final CancellationToken cancellation;

    public RunContext(PipelineConfig config, Clock clock) {
        this(config, new CancellationToken(clock, config.deadline()));
    }

    public RunContext(PipelineConfig config, CancellationToken cancellation) {
        this.bucketPool = Executors.newFixedThreadPool(config.bucketConcurrency(), namedThreads("bucket-worker"));
        this.filePool = Executors.newFixedThreadPool(config.fileConcurrency(), namedThreads("file-worker"));
        this.cancellation = cancellation;
    }

    public ExecutorService bucketPool() {
        return bucketPool;
    }

    public ExecutorService filePool() {
        return filePool;
    }

    public CancellationToken cancellation() {
        return cancellation;
    }

    @Override
    public void close() {
        shutdown(bucketPool, "bucket");
        shutdown(filePool, "file");
    }

    private static void shutdown(ExecutorService pool, String name) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("The {} pool did not terminate within {}s, interrupting workers", name, SHUTDOWN_TIMEOUT_SECONDS);
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
