package com.alertwarden.core.support;

import com.google.common.util.concurrent.MoreExecutors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BoundedCall}.
 */
class BoundedCallTest {

    private final ExecutorService executor = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    @DisplayName("Should return the call's result")
    void returnsResult() throws Exception {
        assertThat(BoundedCall.call(() -> 42, Duration.ofSeconds(1), MoreExecutors.directExecutor()))
                .isEqualTo(42);
    }

    @Test
    @DisplayName("Should wrap the call's exception")
    void wrapsException() {
        assertThatThrownBy(() -> BoundedCall.call(() -> {
            throw new IOException("boom");
        }, Duration.ofSeconds(1), MoreExecutors.directExecutor()))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Should time out and interrupt a slow call")
    void timesOut() throws InterruptedException {
        CountDownLatch never = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);

        assertThatThrownBy(() -> BoundedCall.call(() -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return 1;
        }, Duration.ofMillis(50), executor))
                .isInstanceOf(TimeoutException.class);

        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
    }
}
