package com.kmg.dms.service;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(60), 2.0, Duration.ofMinutes(10));

    @Test
    void backoffGrowsAndIsCapped() {
        assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(60));
        assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(120));
        assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(240));
        assertThat(policy.backoff(5)).isEqualTo(Duration.ofMinutes(10));
    }

    @Test
    void retriesFailedScansUntilSuccess() throws InterruptedException {
        AtomicInteger attempts = new AtomicInteger();
        List<Duration> sleeps = new ArrayList<>();

        String result = policy.execute(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new ScanFailedException("job-" + attempts.get(), "boom", null);
            }
            return "done";
        }, sleeps::add);

        assertThat(result).isEqualTo("done");
        assertThat(sleeps).containsExactly(Duration.ofSeconds(60), Duration.ofSeconds(120));
    }

    @Test
    void givesUpAfterMaxAttempts() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new ScanFailedException("job", "boom", null);
        }, duration -> {
        })).isInstanceOf(ScanFailedException.class);
        assertThat(attempts).hasValue(3);
    }

    @Test
    void otherFailuresAreNotRetried() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> policy.execute(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("bug");
        }, duration -> {
        })).isInstanceOf(IllegalStateException.class);
        assertThat(attempts).hasValue(1);
    }

    @Test
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, 2.0, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
