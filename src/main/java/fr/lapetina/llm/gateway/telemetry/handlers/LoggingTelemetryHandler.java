package fr.lapetina.llm.gateway.telemetry.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lmax.disruptor.EventHandler;
import fr.lapetina.llm.gateway.telemetry.AttemptEvent;
import fr.lapetina.llm.gateway.telemetry.BreakerTransitionEvent;
import fr.lapetina.llm.gateway.telemetry.RequestCompletedEvent;
import fr.lapetina.llm.gateway.telemetry.TelemetryEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes telemetry events to the log as JSON.
 *
 * Sets MDC context (requestId, correlationId, providerId, model) for the
 * duration of each event so structured appenders can index them.
 */
public final class LoggingTelemetryHandler implements EventHandler<TelemetryEvent> {

    private static final Logger log = LoggerFactory.getLogger("fr.lapetina.llm.gateway.telemetry.events");

    private final ObjectMapper objectMapper;

    public LoggingTelemetryHandler() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
    }

    @Override
    public void onEvent(TelemetryEvent event, long sequence, boolean endOfBatch) {
        if (event.getType() == null) {
            return;
        }
        try {
            switch (event.getType()) {
                case ATTEMPT -> logAttempt(event.getAttempt());
                case BREAKER_TRANSITION -> logTransition(event.getTransition());
                case REQUEST_COMPLETED -> logCompleted(event.getCompleted());
            }
        } finally {
            clearMDC();
        }
    }

    private void logAttempt(AttemptEvent attempt) {
        MDC.put("requestId", attempt.requestId());
        MDC.put("correlationId", attempt.correlationId());
        MDC.put("providerId", attempt.providerId());
        MDC.put("model", attempt.model());
        if (attempt.isSuccess()) {
            log.debug("attempt {}", render(attempt));
        } else {
            log.info("attempt {}", render(attempt));
        }
    }

    private void logTransition(BreakerTransitionEvent transition) {
        MDC.put("providerId", transition.providerId());
        log.info("breaker_transition {}", render(transition));
    }

    private void logCompleted(RequestCompletedEvent completed) {
        MDC.put("requestId", completed.requestId());
        MDC.put("correlationId", completed.correlationId());
        MDC.put("model", completed.model());
        if (completed.providerId() != null) {
            MDC.put("providerId", completed.providerId());
        }
        if (completed.isSuccess()) {
            log.debug("request_completed {}", render(completed));
        } else {
            log.warn("request_completed {}", render(completed));
        }
    }

    /**
     * JSON form of an event, falling back to {@code toString()} if it cannot be serialized.
     */
    public String render(Object event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize telemetry event: type={}, error={}",
                    event.getClass().getSimpleName(), e.getMessage());
            return String.valueOf(event);
        }
    }

    private void clearMDC() {
        MDC.remove("requestId");
        MDC.remove("correlationId");
        MDC.remove("providerId");
        MDC.remove("model");
    }
}
