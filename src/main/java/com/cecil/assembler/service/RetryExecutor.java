package com.cecil.assembler.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Runs flaky remote loads with exponential backoff.
 */
@Service
public class RetryExecutor {

    private static final Logger logger = LoggerFactory.getLogger(RetryExecutor.class);

    /**
     * A unit of work that may fail with {@code E}.
     */
    @FunctionalInterface
    public interface Operation<T, E extends Exception> {
        T run() throws E;
    }

    /**
     * Blocks the calling thread between attempts.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration delay) throws InterruptedException;
    }

    private final Sleeper sleeper;

    @Autowired
    public RetryExecutor() {
        this(delay -> Thread.sleep(delay.toMillis(), delay.toNanosPart() % 1_000_000));
    }

    public RetryExecutor(Sleeper sleeper) {
        this.sleeper = sleeper;
    }

    /**
     * Retries every failure.
     *
     * @see #execute(Operation, int, Duration, double, Predicate)
     */
    public <T, E extends Exception> T execute(Operation<T, E> operation,
                                              int maxAttempts,
                                              Duration initialDelay,
                                              double multiplier) throws E {
        return execute(operation, maxAttempts, initialDelay, multiplier, e -> true);
    }

    /**
     * Attempts {@code operation} up to {@code maxAttempts} times, waiting {@code initialDelay} after the first
     * failure and multiplying the wait by {@code multiplier} after each further one. Failures rejected by
     * {@code retryable} are rethrown at once. When attempts run out the last failure is rethrown as is.
     *
     * @throws AssemblyCancelledException if the thread is interrupted while waiting
     */
    @SuppressWarnings("unchecked")
    public <T, E extends Exception> T execute(Operation<T, E> operation,
                                              int maxAttempts,
                                              Duration initialDelay,
                                              double multiplier,
                                              Predicate<Exception> retryable) throws E {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must be zero or positive");
        }
        if (multiplier <= 0) {
            throw new IllegalArgumentException("multiplier must be positive, got " + multiplier);
        }

        Duration delay = initialDelay;
        for (int attempt = 1; ; attempt++) {
            try {
                return operation.run();
            } catch (Exception e) {
                if (attempt >= maxAttempts || !retryable.test(e)) {
                    if (attempt > 1) {
                        logger.warn("Giving up after attempt {}/{}: {}", attempt, maxAttempts, e.toString());
                    }
                    if (e instanceof RuntimeException) {
                        throw (RuntimeException) e;
                    }
                    throw (E) e;
                }
                logger.warn("Attempt {}/{} failed ({}). Backing off for {} ms.",
                        attempt, maxAttempts, e.toString(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new AssemblyCancelledException("Interrupted during backoff", ie);
                }
                delay = scale(delay, multiplier);
            }
        }
    }

    private static Duration scale(Duration delay, double multiplier) {
        double nanos = delay.toNanos() * multiplier;
        if (nanos >= Long.MAX_VALUE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.round(nanos));
    }
}
