package fr.lapetina.llm.gateway.domain.resilience;

import java.time.Duration;
import java.util.Objects;

/**
 * Thresholds for a provider's circuit breaker. Immutable.
 *
 * @param failureThreshold consecutive provider failures that open a CLOSED circuit
 * @param successThreshold consecutive probe successes that close a HALF_OPEN circuit
 * @param openTimeout      time spent OPEN before the next permission check may probe
 */
public record CircuitBreakerConfig(int failureThreshold, int successThreshold, Duration openTimeout) {

    public static final CircuitBreakerConfig DEFAULT =
            new CircuitBreakerConfig(5, 3, Duration.ofSeconds(30));

    public CircuitBreakerConfig {
        Objects.requireNonNull(openTimeout, "Open timeout is required");
        if (failureThreshold < 1) {
            throw new IllegalArgumentException("Failure threshold must be at least 1: " + failureThreshold);
        }
        if (successThreshold < 1) {
            throw new IllegalArgumentException("Success threshold must be at least 1: " + successThreshold);
        }
        if (openTimeout.isNegative()) {
            throw new IllegalArgumentException("Open timeout must not be negative: " + openTimeout);
        }
    }
}
