package com.logicsynth.eval;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Deadline and cancellation flag shared by everything one query or trace does.
 * Long-running loops call {@link #checkDeadline()} between steps.
 */
public final class QueryContext {

    private final Clock clock;
    private final Instant deadline;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    QueryContext(Clock clock, Instant deadline) {
        this.clock = clock;
        this.deadline = deadline;
    }

    public static QueryContext withTimeout(Duration timeout) {
        Clock clock = Clock.systemUTC();
        return new QueryContext(clock, clock.instant().plus(timeout));
    }

    public static QueryContext withDeadline(Clock clock, Instant deadline) {
        return new QueryContext(clock, deadline);
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isExpired() {
        return !clock.instant().isBefore(deadline);
    }

    public Instant deadline() {
        return deadline;
    }

    /**
     * @throws QueryTimeoutException when cancelled or past the deadline
     */
    public void checkDeadline() {
        if (cancelled.get()) {
            throw new QueryTimeoutException("query cancelled");
        }
        if (isExpired()) {
            throw new QueryTimeoutException("query exceeded its deadline of " + deadline);
        }
    }
}
