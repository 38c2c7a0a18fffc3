package com.kmg.dms.service;

import com.kmg.dms.config.DmsProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff for whole scan runs. Only {@link ScanFailedException} is retried.
 */
public final class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double multiplier;
    private final Duration maxBackoff;

    public RetryPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be at least 1.0");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.multiplier = multiplier;
        this.maxBackoff = maxBackoff;
    }

    public static RetryPolicy from(DmsProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getInitialBackoff(), retry.getMultiplier(),
                retry.getMaxBackoff());
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Delay before attempt {@code failedAttempts + 1}.
     */
    public Duration backoff(int failedAttempts) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, failedAttempts - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    public <T> T execute(Supplier<T> action, Sleeper sleeper) throws InterruptedException {
        int attempt = 1;
        while (true) {
            try {
                return action.get();
            } catch (ScanFailedException e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }
                Duration delay = backoff(attempt);
                log.warn("Attempt {}/{} failed ({}), retrying in {}s", attempt, maxAttempts, e.getMessage(),
                        delay.toSeconds());
                sleeper.sleep(delay);
                attempt++;
            }
        }
    }

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;

        Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());
    }
}
