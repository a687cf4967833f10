package fr.tictak.pulse.client.resilience;

import io.github.resilience4j.core.IntervalFunction;

import java.time.Duration;

/**
 * Capped exponential backoff: attempt n waits {@code initialDelay * multiplier^(n-1)}, at most {@code maxDelay},
 * optionally randomized by {@code jitter} (0 disables it, must stay below 1).
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, double multiplier, Duration maxDelay, double jitter) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (initialDelay.toMillis() < 1 || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("delays must be >= 1ms and maxDelay >= initialDelay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (jitter < 0.0 || jitter >= 1.0) {
            throw new IllegalArgumentException("jitter must be in [0, 1)");
        }
    }

    /**
     * Request retries: 5 attempts, 1s doubling up to 16s, no jitter.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(5, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(16), 0.0);
    }

    /**
     * Reconnects: same doubling, longer tail and jitter so clients dropped together do not reconnect together.
     */
    public static RetryPolicy reconnectDefaults() {
        return new RetryPolicy(8, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(30), 0.2);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, initialDelay, multiplier, maxDelay, jitter);
    }

    public IntervalFunction intervalFunction() {
        if (jitter == 0.0) {
            return IntervalFunction.ofExponentialBackoff(initialDelay.toMillis(), multiplier, maxDelay.toMillis());
        }
        return IntervalFunction.ofExponentialRandomBackoff(initialDelay.toMillis(), multiplier, jitter, maxDelay.toMillis());
    }

    /**
     * Wait before retry number {@code attempt} (1-based).
     */
    public Duration delayFor(int attempt) {
        return Duration.ofMillis(intervalFunction().apply(Math.max(1, attempt)));
    }
}
