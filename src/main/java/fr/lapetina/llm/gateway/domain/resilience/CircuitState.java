package fr.lapetina.llm.gateway.domain.resilience;

/**
 * Circuit breaker states.
 *
 * CLOSED: normal operation, calls pass through
 * OPEN: failure threshold reached, calls rejected until the open timeout elapses
 * HALF_OPEN: probing recovery, one trial call admitted at a time
 */
public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
