package fr.lapetina.llm.gateway.domain.resilience;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * Bounded retry policy with exponential backoff and jitter. Immutable.
 *
 * @param maxAttempts    calls allowed to one provider for one request, first call included
 * @param baseDelay      delay before the second attempt
 * @param maxDelay       upper bound of any delay, jitter included
 * @param multiplier     growth factor between consecutive delays
 * @param jitterFraction relative spread applied around the computed delay, in [0, 1]
 * @param attemptTimeout budget of a single provider call
 */
public record RetryPolicy(
        int maxAttempts,
        Duration baseDelay,
        Duration maxDelay,
        double multiplier,
        double jitterFraction,
        Duration attemptTimeout
) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(
            3, Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, 0.25, Duration.ofSeconds(30)
    );

    public RetryPolicy {
        Objects.requireNonNull(baseDelay, "Base delay is required");
        Objects.requireNonNull(maxDelay, "Max delay is required");
        Objects.requireNonNull(attemptTimeout, "Attempt timeout is required");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("Max attempts must be at least 1: " + maxAttempts);
        }
        if (baseDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("Max delay " + maxDelay + " is below base delay " + baseDelay);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier must be at least 1.0: " + multiplier);
        }
        if (jitterFraction < 0.0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException("Jitter fraction must be within [0, 1]: " + jitterFraction);
        }
        if (attemptTimeout.isNegative() || attemptTimeout.isZero()) {
            throw new IllegalArgumentException("Attempt timeout must be positive: " + attemptTimeout);
        }
    }

    /**
     * A policy making a single attempt, no retry.
     */
    public static RetryPolicy noRetry(Duration attemptTimeout) {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0, attemptTimeout);
    }

    /**
     * Delay after the given failed attempt before jitter:
     * {@code min(base * multiplier^(attempt-1), max)}.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration backoffDelay(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("Attempt numbers start at 1: " + attempt);
        }
        double millis = baseDelay.toMillis() * Math.pow(multiplier, attempt - 1);
        long capped = (long) Math.min(millis, maxDelay.toMillis());
        return Duration.ofMillis(capped);
    }

    /**
     * Backoff delay spread by +/- jitterFraction, clamped to [0, maxDelay].
     */
    public Duration jitteredDelay(int attempt, Random random) {
        long delay = backoffDelay(attempt).toMillis();
        if (jitterFraction == 0.0 || delay == 0) {
            return Duration.ofMillis(delay);
        }
        double spread = delay * jitterFraction;
        double jittered = delay + (random.nextDouble() * 2 - 1) * spread;
        long clamped = Math.max(0L, Math.min((long) jittered, maxDelay.toMillis()));
        return Duration.ofMillis(clamped);
    }

    public RetryPolicy withMaxAttempts(int attempts) {
        return new RetryPolicy(attempts, baseDelay, maxDelay, multiplier, jitterFraction, attemptTimeout);
    }

    public RetryPolicy withoutJitter() {
        return new RetryPolicy(maxAttempts, baseDelay, maxDelay, multiplier, 0.0, attemptTimeout);
    }
}
