package fr.lapetina.llm.gateway.domain.model;

/**
 * Classification of a failed provider call.
 *
 * Adapters pre-classify their errors so the core never inspects
 * provider-specific error bodies.
 */
public enum FailureKind {
    /** Transient provider-side failure (5xx, connection reset, throttling). */
    RETRYABLE(true, true),

    /** Request-specific failure (bad request, authentication); retrying cannot help. */
    NON_RETRYABLE(false, false),

    /** The provider did not answer within the attempt timeout. */
    TIMEOUT(true, true);

    private final boolean retryable;
    private final boolean providerAttributable;

    FailureKind(boolean retryable, boolean providerAttributable) {
        this.retryable = retryable;
        this.providerAttributable = providerAttributable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Default attribution; only provider-attributable failures move a breaker toward OPEN.
     */
    public boolean isProviderAttributable() {
        return providerAttributable;
    }
}
