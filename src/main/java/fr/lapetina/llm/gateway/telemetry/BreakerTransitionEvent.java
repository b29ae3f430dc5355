package fr.lapetina.llm.gateway.telemetry;

import fr.lapetina.llm.gateway.domain.resilience.CircuitState;

import java.time.Instant;

/**
 * A circuit breaker changed state.
 */
public record BreakerTransitionEvent(
        String providerId,
        CircuitState oldState,
        CircuitState newState,
        String reason,
        Instant timestamp
) {
}
