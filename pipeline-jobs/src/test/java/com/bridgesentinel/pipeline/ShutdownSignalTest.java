package com.bridgesentinel.pipeline;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Unit tests for {@link ShutdownSignal}.
 */
class ShutdownSignalTest {

    @Test
    @DisplayName("sleep should time out normally when no shutdown is requested")
    void sleepTimesOut() {
        ShutdownSignal signal = new ShutdownSignal();

        assertThat(signal.sleep(Duration.ofMillis(20))).isFalse();
        assertThat(signal.isShutdownRequested()).isFalse();
    }

    @Test
    @DisplayName("A shutdown request should wake a sleeping worker")
    void requestWakesSleeper() {
        ShutdownSignal signal = new ShutdownSignal();
        CompletableFuture<Boolean> sleeper = CompletableFuture.supplyAsync(
                () -> signal.sleep(Duration.ofMinutes(5)));

        signal.requestShutdown();

        await().atMost(5, TimeUnit.SECONDS).until(sleeper::isDone);
        assertThat(sleeper.join()).isTrue();
    }

    @Test
    @DisplayName("Repeated requests should be harmless")
    void idempotentRequest() {
        ShutdownSignal signal = new ShutdownSignal();
        signal.requestShutdown();
        signal.requestShutdown();

        assertThat(signal.isShutdownRequested()).isTrue();
        assertThat(signal.sleep(Duration.ZERO)).isTrue();
    }
}
