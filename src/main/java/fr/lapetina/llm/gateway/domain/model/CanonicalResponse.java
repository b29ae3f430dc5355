package fr.lapetina.llm.gateway.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Provider-neutral response produced by a provider adapter.
 * Immutable and thread-safe.
 *
 * @param payload    opaque response body, untouched by the routing core
 * @param tokenCount total tokens reported by the provider, 0 when unknown
 */
public record CanonicalResponse(
        String requestId,
        String providerId,
        String model,
        Object payload,
        int tokenCount,
        Instant completedAt
) {
    public CanonicalResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        Objects.requireNonNull(providerId, "Provider ID is required");
        if (completedAt == null) {
            completedAt = Instant.now();
        }
    }

    /**
     * Creates a response for the request answered by the given provider.
     */
    public static CanonicalResponse of(CanonicalRequest request, String providerId, Object payload) {
        return new CanonicalResponse(
                request.requestId(), providerId, request.model(), payload, 0, null
        );
    }

    public CanonicalResponse withTokenCount(int tokens) {
        return new CanonicalResponse(requestId, providerId, model, payload, tokens, completedAt);
    }
}
