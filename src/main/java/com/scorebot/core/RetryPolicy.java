package com.scorebot.core;

import com.scorebot.core.error.CallTimeoutException;
import com.scorebot.core.error.EngineException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Timeout and retry policy for one kind of external collaborator call.
 * Only {@link EngineException}s that report {@link EngineException#retryable()} are attempted again;
 * the wait between attempts grows linearly with the attempt number. A timed attempt runs on the calling thread
 * and is interrupted at its deadline.
 */
public final class RetryPolicy {
    private static final Logger LOG = LogManager.getLogger(RetryPolicy.class);
    private static final ScheduledThreadPoolExecutor WATCHDOG = newWatchdog();

    private final int maxAttempts;
    private final long backoffMs;
    private final long timeoutMs;

    public RetryPolicy(int maxAttempts, long backoffMs, long timeoutMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(0L, backoffMs);
        this.timeoutMs = Math.max(0L, timeoutMs);
    }

    public static RetryPolicy once() {
        return new RetryPolicy(1, 0L, 0L);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public long timeoutMs() {
        return timeoutMs;
    }

    public <T> T call(String label, Supplier<T> action) {
        EngineException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return attempt(label, action);
            } catch (EngineException e) {
                last = e;
                if (!e.retryable() || attempt >= maxAttempts) {
                    throw e;
                }
                LOG.warn("Call retry label={} attempt={}/{} err={}", label, attempt, maxAttempts, e.getMessage());
                if (Thread.currentThread().isInterrupted() || !sleepBackoff(attempt)) {
                    throw e;
                }
            }
        }
        throw last;
    }

    private <T> T attempt(String label, Supplier<T> action) {
        if (timeoutMs <= 0L) {
            return action.get();
        }
        Deadline deadline = new Deadline(Thread.currentThread());
        ScheduledFuture<?> watchdog = WATCHDOG.schedule(deadline::expire, timeoutMs, TimeUnit.MILLISECONDS);
        T value = null;
        RuntimeException failure = null;
        boolean expired;
        try {
            value = action.get();
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            watchdog.cancel(false);
            expired = deadline.finish();
        }
        if (expired) {
            throw new CallTimeoutException(label + " timed out after " + timeoutMs + "ms", failure);
        }
        if (failure != null) {
            throw failure;
        }
        return value;
    }

    private static ScheduledThreadPoolExecutor newWatchdog() {
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new WatchdogThreadFactory());
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    private boolean sleepBackoff(int attempt) {
        if (backoffMs <= 0L) {
            return true;
        }
        try {
            Thread.sleep(backoffMs * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Interrupts the calling thread once the attempt's time is up. The attempt keeps running on the caller's
     * thread, so a retry never overlaps a timed-out attempt.
     */
    private static final class Deadline {
        private final Thread caller;
        private boolean done;
        private boolean expired;

        private Deadline(Thread caller) {
            this.caller = caller;
        }

        private synchronized void expire() {
            if (!done) {
                expired = true;
                caller.interrupt();
            }
        }

        /**
         * Ends the attempt and clears the interrupt raised by {@link #expire()}.
         *
         * @return true when the attempt ran past its deadline
         */
        private synchronized boolean finish() {
            done = true;
            if (expired) {
                Thread.interrupted();
            }
            return expired;
        }
    }

    private static final class WatchdogThreadFactory implements ThreadFactory {
        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "collaborator-call-watchdog");
            thread.setDaemon(true);
            return thread;
        }
    }
}
