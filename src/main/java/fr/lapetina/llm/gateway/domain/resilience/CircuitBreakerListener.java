package fr.lapetina.llm.gateway.domain.resilience;

/**
 * Listener notified of every circuit breaker transition.
 */
@FunctionalInterface
public interface CircuitBreakerListener {

    CircuitBreakerListener NOOP = (providerId, from, to, reason) -> { };

    /**
     * Called once per transition, by the thread that performed it.
     *
     * @param providerId provider owning the breaker
     * @param from       state before the transition
     * @param to         state after the transition
     * @param reason     human-readable cause
     */
    void onStateChanged(String providerId, CircuitState from, CircuitState to, String reason);
}
