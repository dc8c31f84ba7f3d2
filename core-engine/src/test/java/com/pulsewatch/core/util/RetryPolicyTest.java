package com.pulsewatch.core.util;

import com.pulsewatch.core.error.StorageException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    @Test
    @DisplayName("Should back off exponentially up to the cap")
    void shouldCapBackoff() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ofMillis(100), Duration.ofMillis(500), 2.0);

        assertThat(policy.delayAfter(1)).isEqualTo(Duration.ofMillis(100));
        assertThat(policy.delayAfter(2)).isEqualTo(Duration.ofMillis(200));
        assertThat(policy.delayAfter(3)).isEqualTo(Duration.ofMillis(400));
        assertThat(policy.delayAfter(4)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("Should succeed after transient failures")
    void shouldRetryTransientFailures() throws Exception {
        RetryPolicy policy = new RetryPolicy(3, Duration.ZERO, Duration.ZERO, 1.0);
        AtomicInteger calls = new AtomicInteger();

        String result = policy.call(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new StorageException("unavailable");
            }
            return "ok";
        }, e -> e instanceof StorageException);

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("Should rethrow the last failure once attempts are exhausted")
    void shouldGiveUpAfterMaxAttempts() {
        RetryPolicy policy = new RetryPolicy(2, Duration.ZERO, Duration.ZERO, 1.0);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call(() -> {
            calls.incrementAndGet();
            throw new StorageException("down");
        }, e -> true))
                .isInstanceOf(StorageException.class)
                .hasMessageContaining("down");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("Should not retry exceptions the predicate rejects")
    void shouldNotRetryNonRetryable() {
        RetryPolicy policy = new RetryPolicy(5, Duration.ZERO, Duration.ZERO, 1.0);
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> policy.call(() -> {
            calls.incrementAndGet();
            throw new IllegalArgumentException("bad input");
        }, e -> e instanceof StorageException))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("Should reject fewer than one attempt")
    void shouldRejectInvalidAttempts() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, 2.0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxAttempts");
    }
}
