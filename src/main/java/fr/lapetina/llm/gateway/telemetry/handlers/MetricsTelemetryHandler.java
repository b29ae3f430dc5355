package fr.lapetina.llm.gateway.telemetry.handlers;

import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.gateway.telemetry.AttemptEvent;
import fr.lapetina.llm.gateway.telemetry.BreakerTransitionEvent;
import fr.lapetina.llm.gateway.telemetry.RequestCompletedEvent;
import fr.lapetina.llm.gateway.telemetry.TelemetryEvent;

/**
 * Turns telemetry events into Micrometer meters.
 */
public final class MetricsTelemetryHandler implements EventHandler<TelemetryEvent> {

    private final MetricsRegistry metricsRegistry;

    public MetricsTelemetryHandler(MetricsRegistry metricsRegistry) {
        this.metricsRegistry = metricsRegistry;
    }

    @Override
    public void onEvent(TelemetryEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        switch (event.getType()) {
            case ATTEMPT -> {
                AttemptEvent attempt = event.getAttempt();
                metricsRegistry.recordAttempt(
                        attempt.providerId(), attempt.model(), attempt.outcome(), attempt.latency());
            }
            case BREAKER_TRANSITION -> {
                BreakerTransitionEvent transition = event.getTransition();
                metricsRegistry.recordBreakerTransition(
                        transition.providerId(), transition.oldState(), transition.newState());
            }
            case REQUEST_COMPLETED -> {
                RequestCompletedEvent completed = event.getCompleted();
                metricsRegistry.recordRequest(completed.model(), completed.result(), completed.latency());
            }
        }
    }
}
