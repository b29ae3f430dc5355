package fr.lapetina.llm.gateway.domain.error;

import java.util.List;

/**
 * Failure of a routed request.
 *
 * Carries the error kind, the provider involved where there is one, every
 * provider that was actually called for the request and, as cause, the last
 * provider error.
 */
public final class GatewayException extends RuntimeException {

    private final GatewayErrorKind kind;
    private final String providerId;
    private final List<String> attemptedProviders;

    public GatewayException(
            GatewayErrorKind kind,
            String details,
            String providerId,
            List<String> attemptedProviders,
            Throwable cause
    ) {
        super(kind.getMessage() + (details != null ? " - " + details : ""), cause);
        this.kind = kind;
        this.providerId = providerId;
        this.attemptedProviders = attemptedProviders != null ? List.copyOf(attemptedProviders) : List.of();
    }

    public static GatewayException modelNotFound(String model) {
        return new GatewayException(GatewayErrorKind.MODEL_NOT_FOUND, "model=" + model, null, null, null);
    }

    public static GatewayException noHealthyProviders(String model, List<String> attempted) {
        return new GatewayException(GatewayErrorKind.NO_HEALTHY_PROVIDERS, "model=" + model, null, attempted, null);
    }

    public static GatewayException circuitOpen(String providerId) {
        return new GatewayException(
                GatewayErrorKind.CIRCUIT_OPEN, "providerId=" + providerId, providerId, null, null);
    }

    public static GatewayException retriesExhausted(List<String> attempted, Throwable lastError) {
        String last = attempted.isEmpty() ? null : attempted.get(attempted.size() - 1);
        return new GatewayException(
                GatewayErrorKind.RETRIES_EXHAUSTED, "attempted=" + attempted, last, attempted, lastError);
    }

    public static GatewayException providerError(String providerId, List<String> attempted, Throwable error) {
        return new GatewayException(
                GatewayErrorKind.PROVIDER_ERROR, "providerId=" + providerId, providerId, attempted, error);
    }

    public static GatewayException timeout(String providerId, List<String> attempted, Throwable lastError) {
        return new GatewayException(GatewayErrorKind.TIMEOUT, null, providerId, attempted, lastError);
    }

    public GatewayErrorKind getKind() {
        return kind;
    }

    /**
     * Provider involved in the failure, null when none was.
     */
    public String getProviderId() {
        return providerId;
    }

    public List<String> getAttemptedProviders() {
        return attemptedProviders;
    }
}
