package fr.lapetina.llm.gateway.domain.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of a single provider call. Never persisted.
 *
 * @param failureKind          null on success
 * @param providerAttributable whether the failure counts against the provider's breaker
 * @param tokenCount           tokens reported by the provider, 0 when unknown
 */
public record CallOutcome(
        FailureKind failureKind,
        boolean providerAttributable,
        Duration latency,
        int tokenCount
) {
    public CallOutcome {
        Objects.requireNonNull(latency, "Latency is required");
        if (failureKind == null && providerAttributable) {
            throw new IllegalArgumentException("A success cannot be provider-attributable");
        }
    }

    public static CallOutcome success(Duration latency, int tokenCount) {
        return new CallOutcome(null, false, latency, tokenCount);
    }

    public static CallOutcome success(Duration latency) {
        return success(latency, 0);
    }

    public static CallOutcome failure(FailureKind kind, Duration latency) {
        return new CallOutcome(kind, kind.isProviderAttributable(), latency, 0);
    }

    public static CallOutcome failure(FailureKind kind, boolean providerAttributable, Duration latency) {
        return new CallOutcome(kind, providerAttributable, latency, 0);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public boolean isFailure() {
        return failureKind != null;
    }
}
