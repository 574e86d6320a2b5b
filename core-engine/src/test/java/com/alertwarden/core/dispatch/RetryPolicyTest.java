package com.alertwarden.core.dispatch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RetryPolicy}.
 */
class RetryPolicyTest {

    private final RetryPolicy policy = new RetryPolicy(Duration.ofSeconds(30), Duration.ofHours(1), 10);

    @Test
    @DisplayName("Backoff doubles from the base and is capped")
    void exponentialBackoff() {
        assertThat(policy.backoffAfter(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(policy.backoffAfter(2)).isEqualTo(Duration.ofMinutes(1));
        assertThat(policy.backoffAfter(4)).isEqualTo(Duration.ofMinutes(4));
        assertThat(policy.backoffAfter(7)).isEqualTo(Duration.ofMinutes(32));
        assertThat(policy.backoffAfter(8)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.backoffAfter(60)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Retries are allowed until the attempt cap")
    void retryCap() {
        assertThat(policy.canRetry(9)).isTrue();
        assertThat(policy.canRetry(10)).isFalse();
        assertThat(new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 1).canRetry(1)).isFalse();
    }

    @Test
    @DisplayName("Invalid arguments are rejected")
    void validation() {
        assertThatThrownBy(() -> new RetryPolicy(Duration.ZERO, Duration.ofSeconds(1), 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofMinutes(2), Duration.ofMinutes(1), 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(1), 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> policy.backoffAfter(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
