package com.pulsewatch.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * Bounded exponential backoff.
 *
 * <p>
 * Attempt {@code n} (1-based) that fails is followed by a delay of
 * {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}. After
 * {@code maxAttempts} failures the last exception is rethrown.
 * </p>
 *
 * @since 1.0.0
 */
public final class RetryPolicy {

    private static final Logger LOG = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;

    /**
     * @throws IllegalArgumentException if {@code maxAttempts < 1} or
     *                                  {@code multiplier < 1}
     */
    public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1, got: " + multiplier);
        }
        this.maxAttempts = maxAttempts;
        this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        this.multiplier = multiplier;
    }

    /**
     * Policy that never retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay to wait after the given failed attempt.
     *
     * @param failedAttempt 1-based attempt number
     * @return backoff delay, never above {@code maxDelay}
     */
    public Duration delayAfter(int failedAttempt) {
        double factor = Math.pow(multiplier, Math.max(0, failedAttempt - 1));
        long millis = (long) Math.min(initialDelay.toMillis() * factor, (double) maxDelay.toMillis());
        return Duration.ofMillis(millis);
    }

    /**
     * Run {@code action}, sleeping between attempts while {@code retryable}
     * accepts the thrown exception.
     *
     * @param action    the work to perform
     * @param retryable decides whether an exception may be retried
     * @param <T>       result type
     * @return the action result
     * @throws Exception the last failure once attempts are exhausted, or any
     *                   non-retryable failure immediately
     */
    public <T> T call(Callable<T> action, Predicate<Exception> retryable) throws Exception {
        Objects.requireNonNull(action, "action must not be null");
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return action.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    throw e;
                }
                Duration delay = delayAfter(attempt);
                LOG.debug("Attempt {}/{} failed ({}), retrying in {} ms",
                        attempt, maxAttempts, e.getMessage(), delay.toMillis());
                Thread.sleep(delay.toMillis());
            }
        }
    }

    @Override
    public String toString() {
        return "RetryPolicy{" +
                "maxAttempts=" + maxAttempts +
                ", initialDelay=" + initialDelay +
                ", maxDelay=" + maxDelay +
                ", multiplier=" + multiplier +
                '}';
    }
}
