package com.microsoft.cloudgovernance.inventory;

import com.microsoft.cloudgovernance.adapters.ResourceGraphException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for Resource Graph calls.
 *
 * RETRY RULES:
 * - Only ResourceGraphException kinds marked retryable (throttling, timeouts, 5xx) are retried
 * - Delay = min(maxDelay, baseDelay * 2^(attempt-1)), spread by +/- jitter
 * - A server Retry-After is honoured when it is longer than the computed delay
 * - Cancellation is checked before every attempt and every wait
 */
@Slf4j
public final class RetryPolicy {

    /**
     * Waits between attempts. Replaced in tests to avoid real sleeping.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private static final Duration CANCELLATION_POLL = Duration.ofMillis(500);

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitter;
    private final Sleeper sleeper;
    private final DoubleSupplier random;

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter,
                       Sleeper sleeper, DoubleSupplier random) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be between 0 and 1");
        }
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
        this.jitter = jitter;
        this.sleeper = sleeper;
        this.random = random;
    }

    public RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay, double jitter) {
        this(maxAttempts, baseDelay, maxDelay, jitter,
                d -> Thread.sleep(d.toMillis()),
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Run the call, retrying retryable failures.
     *
     * @throws ResourceGraphException the last failure once attempts are exhausted,
     *         or the first non-retryable failure
     * @throws CancellationException when the signal fires
     */
    public <T> T execute(String operation, CancellationSignal signal, Supplier<T> call) {
        for (int attempt = 1; ; attempt++) {
            signal.throwIfCancelled();
            try {
                return call.get();
            } catch (ResourceGraphException e) {
                if (!e.getKind().isRetryable() || attempt >= maxAttempts) {
                    throw e;
                }
                Duration delay = delayFor(attempt, e.getRetryAfter());
                log.warn("{} failed ({}), attempt {}/{}; retrying in {} ms",
                        operation, e.getKind(), attempt, maxAttempts, delay.toMillis());
                pause(operation, delay, signal);
            }
        }
    }

    /**
     * Sleep in short slices so a cancellation does not wait out a long backoff.
     */
    private void pause(String operation, Duration delay, CancellationSignal signal) {
        Duration remaining = delay;
        try {
            while (!remaining.isNegative() && !remaining.isZero()) {
                signal.throwIfCancelled();
                Duration slice = remaining.compareTo(CANCELLATION_POLL) > 0 ? CANCELLATION_POLL : remaining;
                sleeper.sleep(slice);
                remaining = remaining.minus(slice);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " interrupted during backoff");
        }
        signal.throwIfCancelled();
    }

    Duration delayFor(int attempt, Duration retryAfter) {
        long exponential = baseDelay.toMillis() * (1L << Math.min(attempt - 1, 20));
        long capped = Math.min(exponential, maxDelay.toMillis());
        double factor = 1.0 + jitter * (2 * random.getAsDouble() - 1);
        long jittered = Math.max(0, Math.round(capped * factor));
        if (retryAfter != null && retryAfter.toMillis() > jittered) {
            return Duration.ofMillis(Math.min(retryAfter.toMillis(), maxDelay.toMillis()));
        }
        return Duration.ofMillis(jittered);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }
}
