package fr.lapetina.llm.gateway.telemetry;

import fr.lapetina.llm.gateway.domain.model.FailureKind;
import fr.lapetina.llm.gateway.domain.resilience.CircuitState;

import java.time.Duration;
import java.time.Instant;

/**
 * One provider call made for a request.
 *
 * @param failureKind       null when the call succeeded
 * @param attemptNumber     1-based attempt number on this provider
 * @param breakerStateAfter breaker state once the outcome was recorded
 */
public record AttemptEvent(
        String requestId,
        String correlationId,
        String providerId,
        String model,
        FailureKind failureKind,
        Duration latency,
        int attemptNumber,
        CircuitState breakerStateAfter,
        Instant timestamp
) {

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * Outcome label used for logs and metric tags.
     */
    public String outcome() {
        return failureKind == null ? "success" : failureKind.name().toLowerCase();
    }
}
