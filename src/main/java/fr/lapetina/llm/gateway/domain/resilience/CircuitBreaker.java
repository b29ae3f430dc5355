package fr.lapetina.llm.gateway.domain.resilience;

import fr.lapetina.llm.gateway.domain.model.CallOutcome;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Circuit breaker guarding calls to a single provider.
 *
 * States:
 * - CLOSED: normal operation, calls pass through
 * - OPEN: failure threshold reached, calls rejected immediately
 * - HALF_OPEN: after the open timeout, one probe call at a time is admitted
 *
 * There is no background timer: OPEN moves to HALF_OPEN on the first
 * {@link #permit()} issued after the open timeout. Every transition is a
 * single compare-and-set on the provider's {@link ProviderHealthState}, so
 * concurrent failures produce exactly one transition.
 *
 * Thread-safe via atomic operations.
 */
public final class CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final ProviderHealthState health;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final CircuitBreakerListener listener;

    public CircuitBreaker(
            ProviderHealthState health,
            CircuitBreakerConfig config,
            Clock clock,
            CircuitBreakerListener listener
    ) {
        this.health = Objects.requireNonNull(health, "Health state is required");
        this.config = Objects.requireNonNull(config, "Config is required");
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.listener = listener != null ? listener : CircuitBreakerListener.NOOP;
    }

    public CircuitBreaker(ProviderHealthState health, CircuitBreakerConfig config) {
        this(health, config, Clock.systemUTC(), CircuitBreakerListener.NOOP);
    }

    /**
     * Asks whether a call may be sent to the provider now.
     *
     * @return an allowed or probe permission to be settled after the call, or a denial
     */
    public Permission permit() {
        ProviderHealthState.Circuit current = health.getCircuit();

        switch (current.state()) {
            case CLOSED:
                return Permission.allowed(current);

            case OPEN:
                if (!openTimeoutElapsed(current)) {
                    return Permission.denied(current);
                }
                // Lazy OPEN -> HALF_OPEN, only one caller wins the CAS
                transition(current, CircuitState.HALF_OPEN, "open timeout elapsed");
                return claimProbe();

            case HALF_OPEN:
                return claimProbe();

            default:
                return Permission.denied(current);
        }
    }

    private Permission claimProbe() {
        ProviderHealthState.Circuit current = health.getCircuit();
        if (current.state() == CircuitState.CLOSED) {
            return Permission.allowed(current);
        }
        if (current.state() != CircuitState.HALF_OPEN || !health.tryClaimProbe()) {
            return Permission.denied(current);
        }
        // The circuit may have moved between the read and the claim
        if (health.getCircuit() != current) {
            health.releaseProbe();
            return Permission.denied(health.getCircuit());
        }
        log.debug("Probe admitted: providerId={}", health.getProviderId());
        return Permission.probe(current);
    }

    /**
     * Records the outcome of a call made under {@code permission} and settles it.
     * Client-attributable failures are neutral: they never move the circuit toward OPEN.
     */
    public void recordOutcome(Permission permission, CallOutcome outcome) {
        if (!permission.settle()) {
            return;
        }
        try {
            if (outcome.isSuccess()) {
                onSuccess(permission.isProbe() && permission.getGrantedIn() == health.getCircuit());
            } else if (outcome.providerAttributable()) {
                onFailure(outcome.failureKind().name().toLowerCase());
            } else {
                log.debug("Client-attributable failure ignored by breaker: providerId={}, kind={}",
                        health.getProviderId(), outcome.failureKind());
            }
        } finally {
            if (permission.isProbe()) {
                health.releaseProbe();
            }
        }
    }

    /**
     * Settles a permission whose call ended without an outcome (cancelled, never sent).
     */
    public void release(Permission permission) {
        if (permission.settle() && permission.isProbe()) {
            health.releaseProbe();
            log.debug("Probe released without outcome: providerId={}", health.getProviderId());
        }
    }

    /**
     * Feeds a proactive health check result into the state machine.
     * HEALTHY counts as a success, UNHEALTHY as a provider failure, DEGRADED is neutral.
     */
    public void recordHealthCheck(ProviderHealth result) {
        health.setLastHealthCheck(result);
        switch (result) {
            case HEALTHY -> onSuccess(true);
            case UNHEALTHY -> onFailure("health check unhealthy");
            case DEGRADED -> log.debug("Degraded health check: providerId={}", health.getProviderId());
        }
    }

    private void onSuccess(boolean countsInHalfOpen) {
        ProviderHealthState.Circuit current = health.getCircuit();

        if (current.state() == CircuitState.CLOSED) {
            health.resetFailures();
            return;
        }

        if (current.state() == CircuitState.HALF_OPEN && countsInHalfOpen) {
            int successes = health.incrementSuccesses();
            log.debug("Half-open success: providerId={}, successes={}, threshold={}",
                    health.getProviderId(), successes, config.successThreshold());
            if (successes >= config.successThreshold()) {
                transition(current, CircuitState.CLOSED, "recovered after " + successes + " successes");
            }
        }
    }

    private void onFailure(String cause) {
        ProviderHealthState.Circuit current = health.getCircuit();

        switch (current.state()) {
            case CLOSED -> {
                int failures = health.incrementFailures();
                if (failures >= config.failureThreshold()) {
                    transition(current, CircuitState.OPEN,
                            "failure threshold reached: " + failures + " consecutive, last=" + cause);
                }
            }
            // Any failure while probing reopens
            case HALF_OPEN -> transition(current, CircuitState.OPEN, "probe failed: " + cause);
            case OPEN -> health.incrementFailures();
        }
    }

    private boolean transition(ProviderHealthState.Circuit expected, CircuitState target, String reason) {
        ProviderHealthState.Circuit next = new ProviderHealthState.Circuit(target, clock.instant());
        if (!health.compareAndSetCircuit(expected, next)) {
            return false;
        }
        resetCountersFor(target);

        if (target == CircuitState.OPEN) {
            log.warn("Circuit breaker OPENED: providerId={}, from={}, reason={}",
                    health.getProviderId(), expected.state(), reason);
        } else {
            log.info("Circuit breaker {}: providerId={}, from={}, reason={}",
                    target, health.getProviderId(), expected.state(), reason);
        }
        notifyListener(expected.state(), target, reason);
        return true;
    }

    private void resetCountersFor(CircuitState target) {
        health.resetSuccesses();
        if (target == CircuitState.CLOSED) {
            health.resetFailures();
        }
    }

    private void notifyListener(CircuitState from, CircuitState to, String reason) {
        try {
            listener.onStateChanged(health.getProviderId(), from, to, reason);
        } catch (Exception e) {
            log.error("Error notifying circuit breaker listener: providerId={}", health.getProviderId(), e);
        }
    }

    private boolean openTimeoutElapsed(ProviderHealthState.Circuit circuit) {
        Instant reopenAt = circuit.since().plus(config.openTimeout());
        return !clock.instant().isBefore(reopenAt);
    }

    /**
     * Forces the circuit to a specific state. For tests and administration.
     */
    public void forceState(CircuitState newState) {
        ProviderHealthState.Circuit old = health.getAndSetCircuit(
                new ProviderHealthState.Circuit(newState, clock.instant()));
        resetCountersFor(newState);
        log.info("Circuit breaker forced from {} to {}: providerId={}",
                old.state(), newState, health.getProviderId());
        if (old.state() != newState) {
            notifyListener(old.state(), newState, "forced");
        }
    }

    /**
     * Effective state without side effects: an OPEN circuit whose timeout
     * elapsed reports HALF_OPEN, although the transition itself only happens
     * on the next {@link #permit()}.
     */
    public CircuitState getState() {
        ProviderHealthState.Circuit current = health.getCircuit();
        if (current.state() == CircuitState.OPEN && openTimeoutElapsed(current)) {
            return CircuitState.HALF_OPEN;
        }
        return current.state();
    }

    /**
     * True while calls are rejected outright; used to pre-filter routing candidates.
     */
    public boolean isOpen() {
        return getState() == CircuitState.OPEN;
    }

    /**
     * Time left before an OPEN circuit may probe again, zero otherwise.
     */
    public Duration getRemainingOpenTime() {
        ProviderHealthState.Circuit current = health.getCircuit();
        if (current.state() != CircuitState.OPEN) {
            return Duration.ZERO;
        }
        Duration remaining = Duration.between(clock.instant(), current.since().plus(config.openTimeout()));
        return remaining.isNegative() ? Duration.ZERO : remaining;
    }

    public int getFailureCount() {
        return health.getConsecutiveFailures();
    }

    public ProviderHealthState getHealth() {
        return health;
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }

    public String getProviderId() {
        return health.getProviderId();
    }

    @Override
    public String toString() {
        return "CircuitBreaker{" +
                "providerId='" + health.getProviderId() + '\'' +
                ", state=" + health.getCircuit().state() +
                ", failures=" + health.getConsecutiveFailures() +
                '}';
    }
}
