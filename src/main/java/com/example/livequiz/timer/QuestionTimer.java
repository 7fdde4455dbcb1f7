package com.example.livequiz.timer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.LongConsumer;

/**
 * Single-shot, cancelable deadline owned by one session.
 *
 * Every {@link #arm} hands out a fresh token and cancels the previous deadline. When the
 * deadline elapses the callback receives its token; the owner must {@link #claim} it before
 * acting, so a fire that lost the race against {@link #cancel} or a re-arm is recognised as stale.
 */
public class QuestionTimer {

    private static final Logger log = LoggerFactory.getLogger(QuestionTimer.class);

    /** Token value meaning "nothing armed". */
    public static final long NONE = 0L;

    private final ScheduledExecutorService scheduler;

    private ScheduledFuture<?> pending;
    private long liveToken = NONE;
    private long lastToken = NONE;

    public QuestionTimer(ScheduledExecutorService scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    }

    /** Cancels whatever is armed and schedules {@code onFire} after {@code delayMs}. Returns the new token. */
    public synchronized long arm(long delayMs, LongConsumer onFire) {
        Objects.requireNonNull(onFire, "onFire");
        cancel();
        final long token = ++lastToken;
        liveToken = token;
        pending = scheduler.schedule(() -> onFire.accept(token), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        log.debug("Timer armed token={} delayMs={}", token, delayMs);
        return token;
    }

    /**
     * Consumes the live token. Returns true exactly once per armed deadline, and only for the
     * token of the latest arm that has not been canceled.
     */
    public synchronized boolean claim(long token) {
        if (token == NONE || token != liveToken) return false;
        liveToken = NONE;
        pending = null;
        return true;
    }

    /** Idempotent; safe after the deadline fired or the owner was torn down. */
    public synchronized void cancel() {
        liveToken = NONE;
        ScheduledFuture<?> f = pending;
        pending = null;
        if (f != null) f.cancel(false);
    }

    public synchronized boolean isArmed() {
        return liveToken != NONE;
    }
}
