package com.saleslog.pipeline.driver;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Stop signal of a run, tripped either explicitly or by an elapsed deadline.
 */
public class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final Clock clock;
    private final Instant deadline;

    public CancellationToken(Clock clock, Duration timeout) {
        this.clock = clock;
        this.deadline = timeout == null ? null : clock.instant().plus(timeout);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        if (cancelled.get()) {
            return true;
        }
        if (deadline != null && !clock.instant().isBefore(deadline)) {
            cancelled.set(true);
            return true;
        }
        return false;
    }
}
