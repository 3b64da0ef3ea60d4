package com.cecil.assembler.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryExecutorTest {

    private final List<Duration> waits = new ArrayList<>();
    private RetryExecutor retryExecutor;

    @BeforeEach
    void setUp() {
        retryExecutor = new RetryExecutor(waits::add);
    }

    @Test
    void succeedsAfterTransientFailuresWithGrowingBackoff() throws IOException {
        AtomicInteger calls = new AtomicInteger();

        String result = retryExecutor.execute(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new IOException("timeout");
            }
            return "header";
        }, 5, Duration.ofMillis(100), 3.0);

        assertThat(result).isEqualTo("header");
        assertThat(calls.get()).isEqualTo(3);
        assertThat(waits).containsExactly(Duration.ofMillis(100), Duration.ofMillis(300));
    }

    @Test
    void rethrowsTheLastFailureUnchangedWhenAttemptsRunOut() {
        IOException last = new IOException("still down");
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw last;
        }, 4, Duration.ofSeconds(1), 2.0))
                .isSameAs(last);

        assertThat(calls.get()).isEqualTo(4);
        assertThat(waits).containsExactly(Duration.ofSeconds(1), Duration.ofSeconds(2), Duration.ofSeconds(4));
    }

    @Test
    void singleAttemptNeverWaits() {
        assertThatThrownBy(() -> retryExecutor.execute(() -> {
            throw new IOException("boom");
        }, 1, Duration.ofSeconds(1), 2.0))
                .isInstanceOf(IOException.class);

        assertThat(waits).isEmpty();
    }

    @Test
    void failuresRejectedByThePredicateAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> retryExecutor.execute(() -> {
            calls.incrementAndGet();
            throw new BandOutOfRangeException("a.tif", 4, 3);
        }, 5, Duration.ofMillis(10), 2.0, BandReader::isTransient))
                .isInstanceOf(BandOutOfRangeException.class);

        assertThat(calls.get()).isEqualTo(1);
        assertThat(waits).isEmpty();
    }

    @Test
    void interruptionDuringBackoffCancelsTheRun() {
        RetryExecutor interrupted = new RetryExecutor(delay -> {
            throw new InterruptedException();
        });

        assertThatThrownBy(() -> interrupted.execute(() -> {
            throw new IOException("flaky");
        }, 3, Duration.ofMillis(5), 2.0))
                .isInstanceOf(AssemblyCancelledException.class);

        assertThat(Thread.interrupted()).isTrue();
    }

    @Test
    void rejectsNonPositiveAttemptCount() {
        assertThatThrownBy(() -> retryExecutor.execute(() -> "x", 0, Duration.ZERO, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
