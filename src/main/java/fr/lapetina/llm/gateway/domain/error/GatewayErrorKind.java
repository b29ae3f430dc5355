package fr.lapetina.llm.gateway.domain.error;

/**
 * Typed failure categories returned to the caller of the gateway.
 */
public enum GatewayErrorKind {
    /** No registered provider serves the requested model. */
    MODEL_NOT_FOUND("No provider serves the requested model"),

    /** Providers exist for the model but none could be called. */
    NO_HEALTHY_PROVIDERS("No healthy provider available"),

    /** The breaker of the targeted provider rejected the call. */
    CIRCUIT_OPEN("Circuit breaker is open"),

    /** Every candidate was called and failed with retryable errors. */
    RETRIES_EXHAUSTED("Retries exhausted on all providers"),

    /** A provider rejected the request with a non-retryable error. */
    PROVIDER_ERROR("Provider rejected the request"),

    /** The overall request deadline expired. */
    TIMEOUT("Request deadline exceeded");

    private final String message;

    GatewayErrorKind(String message) {
        this.message = message;
    }

    public String getMessage() {
        return message;
    }
}
