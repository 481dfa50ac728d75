package org.csits.kex.server.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.csits.kex.server.config.ExportConfig;
import org.csits.kex.server.exception.ExportCancelledException;
import org.csits.kex.server.worker.core.ExportCancellationToken;
import org.junit.jupiter.api.Test;

class RetryServiceTest {

    private final RetryService retryService = new RetryService();

    @Test
    void succeedsAfterTransientFailures() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        String result = retryService.executeWithRetry(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IllegalStateException("transient");
            }
            return "ok";
        }, retry(2), "read", new ExportCancellationToken());

        assertThat(result).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void rethrowsLastFailureWhenRetriesExhausted() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryService.executeWithRetry(() -> {
            throw new IllegalStateException("attempt " + attempts.incrementAndGet());
        }, retry(1), "read", null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("attempt 2");
    }

    @Test
    void noRetryConfigMeansSingleAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryService.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("down");
        }, null, "read", null)).isInstanceOf(IllegalStateException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void cancellationStopsRetrying() {
        ExportCancellationToken token = new ExportCancellationToken();
        AtomicInteger attempts = new AtomicInteger();

        assertThatThrownBy(() -> retryService.executeWithRetry(() -> {
            attempts.incrementAndGet();
            token.cancel();
            throw new IllegalStateException("down");
        }, retry(5), "read", token)).isInstanceOf(ExportCancelledException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void interruptDuringRetryWait_failsAndKeepsInterruptFlag() throws Exception {
        ExportConfig.RetryConfig slow = new ExportConfig.RetryConfig();
        slow.setMaxRetries(3);
        slow.setRetryIntervalMs(60_000L);
        CountDownLatch firstAttempt = new CountDownLatch(1);
        AtomicInteger attempts = new AtomicInteger();
        AtomicReference<Exception> failure = new AtomicReference<>();
        AtomicBoolean interruptedAfter = new AtomicBoolean();

        Thread worker = new Thread(() -> {
            try {
                retryService.executeWithRetry(() -> {
                    attempts.incrementAndGet();
                    firstAttempt.countDown();
                    throw new IllegalStateException("down");
                }, slow, "read", new ExportCancellationToken());
            } catch (Exception e) {
                failure.set(e);
            }
            interruptedAfter.set(Thread.currentThread().isInterrupted());
        });
        worker.start();
        assertThat(firstAttempt.await(5, TimeUnit.SECONDS)).isTrue();
        worker.interrupt();
        worker.join(TimeUnit.SECONDS.toMillis(5));

        assertThat(worker.isAlive()).isFalse();
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(failure.get()).hasMessage("重试被中断")
            .hasCauseInstanceOf(InterruptedException.class);
        assertThat(interruptedAfter.get()).isTrue();
    }

    private static ExportConfig.RetryConfig retry(int maxRetries) {
        ExportConfig.RetryConfig retry = new ExportConfig.RetryConfig();
        retry.setMaxRetries(maxRetries);
        retry.setRetryIntervalMs(1L);
        return retry;
    }
}
