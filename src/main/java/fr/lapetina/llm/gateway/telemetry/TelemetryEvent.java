package fr.lapetina.llm.gateway.telemetry;

/**
 * Slot of the telemetry ring buffer.
 *
 * Mutable and reused by the Disruptor; only the publisher and the pipeline
 * handlers touch it. Exactly one of the payload fields is set per type.
 */
public final class TelemetryEvent {

    public enum Type {
        ATTEMPT,
        BREAKER_TRANSITION,
        REQUEST_COMPLETED
    }

    private Type type;
    private AttemptEvent attempt;
    private BreakerTransitionEvent transition;
    private RequestCompletedEvent completed;

    void setAttempt(AttemptEvent attempt) {
        clear();
        this.type = Type.ATTEMPT;
        this.attempt = attempt;
    }

    void setTransition(BreakerTransitionEvent transition) {
        clear();
        this.type = Type.BREAKER_TRANSITION;
        this.transition = transition;
    }

    void setCompleted(RequestCompletedEvent completed) {
        clear();
        this.type = Type.REQUEST_COMPLETED;
        this.completed = completed;
    }

    /**
     * Clears the slot for reuse.
     */
    public void clear() {
        this.type = null;
        this.attempt = null;
        this.transition = null;
        this.completed = null;
    }

    public Type getType() {
        return type;
    }

    public AttemptEvent getAttempt() {
        return attempt;
    }

    public BreakerTransitionEvent getTransition() {
        return transition;
    }

    public RequestCompletedEvent getCompleted() {
        return completed;
    }

    @Override
    public String toString() {
        return "TelemetryEvent{type=" + type + '}';
    }
}
