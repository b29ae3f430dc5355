package fr.lapetina.llm.gateway.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Provider-neutral chat/completion request as seen by the routing core.
 * Immutable and thread-safe.
 *
 * @param payload  opaque handle passed untouched to the provider adapter
 * @param deadline overall budget for the request, null for the configured default
 */
public record CanonicalRequest(
        String requestId,
        String model,
        Object payload,
        Duration deadline,
        RoutingHints hints,
        Instant createdAt,
        String correlationId
) {
    public CanonicalRequest {
        Objects.requireNonNull(model, "Model is required");
        if (model.isBlank()) {
            throw new IllegalArgumentException("Model must not be blank");
        }
        if (deadline != null && (deadline.isNegative() || deadline.isZero())) {
            throw new IllegalArgumentException("Deadline must be positive: " + deadline);
        }
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (hints == null) {
            hints = RoutingHints.NONE;
        }
    }

    /**
     * Creates a request for the model with default deadline and no hints.
     */
    public static CanonicalRequest of(String model, Object payload) {
        return new CanonicalRequest(null, model, payload, null, null, null, null);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String model;
        private Object payload;
        private Duration deadline;
        private RoutingHints hints;
        private Instant createdAt;
        private String correlationId;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder deadline(Duration deadline) {
            this.deadline = deadline;
            return this;
        }

        public Builder hints(RoutingHints hints) {
            this.hints = hints;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public CanonicalRequest build() {
            return new CanonicalRequest(
                    requestId, model, payload, deadline, hints, createdAt, correlationId
            );
        }
    }
}
