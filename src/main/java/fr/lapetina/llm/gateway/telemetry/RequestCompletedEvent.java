package fr.lapetina.llm.gateway.telemetry;

import fr.lapetina.llm.gateway.domain.error.GatewayErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Final result of a routed request.
 *
 * @param providerId         provider that answered, or the last one involved on failure; may be null
 * @param errorKind          null on success
 * @param attemptedProviders providers actually called, in order
 * @param totalAttempts      provider calls made across all providers
 */
public record RequestCompletedEvent(
        String requestId,
        String correlationId,
        String model,
        String providerId,
        GatewayErrorKind errorKind,
        List<String> attemptedProviders,
        int totalAttempts,
        Duration latency,
        Instant timestamp
) {
    public RequestCompletedEvent {
        attemptedProviders = attemptedProviders != null ? List.copyOf(attemptedProviders) : List.of();
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public String result() {
        return errorKind == null ? "success" : errorKind.name().toLowerCase();
    }
}
