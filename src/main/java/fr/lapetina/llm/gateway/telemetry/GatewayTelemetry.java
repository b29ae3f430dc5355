package fr.lapetina.llm.gateway.telemetry;

import fr.lapetina.llm.gateway.domain.resilience.CircuitBreakerListener;

import java.time.Clock;

/**
 * Sink for routing events.
 *
 * Called inline from request and completion threads, so implementations
 * must be thread-safe and must not block.
 */
public interface GatewayTelemetry {

    GatewayTelemetry NOOP = new GatewayTelemetry() {
        @Override
        public void onAttempt(AttemptEvent event) {
        }

        @Override
        public void onBreakerTransition(BreakerTransitionEvent event) {
        }

        @Override
        public void onRequestCompleted(RequestCompletedEvent event) {
        }
    };

    void onAttempt(AttemptEvent event);

    void onBreakerTransition(BreakerTransitionEvent event);

    void onRequestCompleted(RequestCompletedEvent event);

    /**
     * Adapts this sink to receive circuit breaker transitions.
     */
    default CircuitBreakerListener asBreakerListener(Clock clock) {
        return (providerId, from, to, reason) ->
                onBreakerTransition(new BreakerTransitionEvent(providerId, from, to, reason, clock.instant()));
    }
}
