package com.tokenwatch.indexer.util;

import com.tokenwatch.indexer.modules.chain.rpc.RpcException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.LongUnaryOperator;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff with jitter for RPC calls.
 *
 * <p>Attempt 1 is the first call. The delay before attempt {@code k} ({@code k >= 2}) is
 * {@code initialDelay * 2^(k-1) + uniform[0, jitter]}. Only failures accepted by the retryable
 * predicate are retried; anything else is rethrown at once.
 */
public class RetryPolicy {

    private static final Logger logger = LoggerFactory.getLogger(RetryPolicy.class);
    private static final int MAX_SHIFT = 20;

    private final int maxAttempts;
    private final long initialDelayMs;
    private final long jitterMs;
    private final Sleeper sleeper;
    private final Predicate<Exception> retryable;
    private final LongUnaryOperator jitterSource;

    public RetryPolicy(int maxAttempts, long initialDelayMs, long jitterMs, Sleeper sleeper) {
        this(maxAttempts, initialDelayMs, jitterMs, sleeper, RetryPolicy::isTransient,
                ceiling -> ThreadLocalRandom.current().nextLong(ceiling + 1));
    }

    RetryPolicy(int maxAttempts, long initialDelayMs, long jitterMs, Sleeper sleeper,
                Predicate<Exception> retryable, LongUnaryOperator jitterSource) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.maxAttempts = maxAttempts;
        this.initialDelayMs = initialDelayMs;
        this.jitterMs = jitterMs;
        this.sleeper = sleeper;
        this.retryable = retryable;
        this.jitterSource = jitterSource;
    }

    /**
     * Execute the task, retrying transient failures.
     *
     * @param description short label used in log lines
     * @param task        operation to run
     * @param <T>         result type
     * @return the first successful result
     * @throws RuntimeException the last failure once attempts are exhausted (checked failures
     *                          are wrapped in {@link RpcException})
     */
    public <T> T execute(String description, RetryableTask<T> task) {
        Exception lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (attempt > 1) {
                long delay = delayBeforeAttempt(attempt);
                logger.warn("Retrying {} in {}ms... ({} attempt(s) left): {}",
                        description, delay, maxAttempts - attempt + 1, messageOf(lastException));
                pause(description, delay);
            }
            try {
                return task.execute();
            } catch (Exception e) {
                lastException = e;
                if (!retryable.test(e)) {
                    logger.debug("{} failed with a non-retryable error: {}", description, messageOf(e));
                    break;
                }
            }
        }

        if (lastException instanceof RuntimeException) {
            throw (RuntimeException) lastException;
        }
        throw new RpcException(description + " failed: " + messageOf(lastException), lastException, false);
    }

    /**
     * Delay in milliseconds applied before the given one-based attempt.
     */
    public long delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return 0L;
        }
        long exponential = initialDelayMs * (1L << Math.min(attempt - 1, MAX_SHIFT));
        long jitter = jitterMs > 0 ? jitterSource.applyAsLong(jitterMs) : 0L;
        return exponential + jitter;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Network, timeout and rate-limit failures are worth another attempt.
     */
    public static boolean isTransient(Exception e) {
        if (e instanceof RpcException) {
            return ((RpcException) e).isTransient();
        }
        return e instanceof IOException;
    }

    private void pause(String description, long delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RpcException("Interrupted while retrying " + description, e, false);
        }
    }

    private static String messageOf(Exception e) {
        if (e == null) {
            return "unknown error";
        }
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }

    /**
     * Functional interface for retryable task
     */
    @FunctionalInterface
    public interface RetryableTask<T> {
        T execute() throws Exception;
    }
}
