package fr.lapetina.llm.gateway.domain.resilience;

import fr.lapetina.llm.gateway.domain.model.ProviderHealth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mutable runtime health of one registered provider.
 *
 * Created once per registration and shared by reference between the
 * {@link CircuitBreaker} and the load balancing strategies. Every field is an
 * atomic scoped to this provider; there is no lock shared across providers.
 * The circuit state and its transition time are swapped together as one
 * {@link Circuit} value so readers never see a state paired with a stale
 * timestamp.
 */
public final class ProviderHealthState {

    /** Weight of the newest sample in the rolling latency average. */
    public static final double LATENCY_ALPHA = 0.3;

    private static final long NO_SAMPLE = Double.doubleToLongBits(-1.0);

    private final String providerId;
    private final AtomicReference<Circuit> circuit;
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);
    private final AtomicInteger consecutiveSuccesses = new AtomicInteger(0);
    private final AtomicInteger inFlight = new AtomicInteger(0);
    private final AtomicBoolean probeInFlight = new AtomicBoolean(false);
    private final AtomicLong rollingLatencyBits = new AtomicLong(NO_SAMPLE);
    private final AtomicReference<ProviderHealth> lastHealthCheck = new AtomicReference<>();

    public ProviderHealthState(String providerId, Instant createdAt) {
        this.providerId = Objects.requireNonNull(providerId, "Provider ID is required");
        this.circuit = new AtomicReference<>(new Circuit(CircuitState.CLOSED, createdAt));
    }

    public ProviderHealthState(String providerId) {
        this(providerId, Instant.now());
    }

    public String getProviderId() {
        return providerId;
    }

    public Circuit getCircuit() {
        return circuit.get();
    }

    /**
     * Atomically replaces the circuit value if it is still {@code expected}.
     * Exactly one of several concurrent callers holding the same expected value wins.
     */
    boolean compareAndSetCircuit(Circuit expected, Circuit next) {
        return circuit.compareAndSet(expected, next);
    }

    Circuit getAndSetCircuit(Circuit next) {
        return circuit.getAndSet(next);
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    int incrementFailures() {
        return consecutiveFailures.incrementAndGet();
    }

    void resetFailures() {
        consecutiveFailures.set(0);
    }

    public int getConsecutiveSuccesses() {
        return consecutiveSuccesses.get();
    }

    int incrementSuccesses() {
        return consecutiveSuccesses.incrementAndGet();
    }

    void resetSuccesses() {
        consecutiveSuccesses.set(0);
    }

    public boolean isProbeInFlight() {
        return probeInFlight.get();
    }

    boolean tryClaimProbe() {
        return probeInFlight.compareAndSet(false, true);
    }

    void releaseProbe() {
        probeInFlight.set(false);
    }

    public int getInFlight() {
        return inFlight.get();
    }

    /**
     * Marks a call as dispatched to this provider.
     */
    public int incrementInFlight() {
        return inFlight.incrementAndGet();
    }

    /**
     * Marks a dispatched call as finished. Never drops below zero.
     */
    public int decrementInFlight() {
        return inFlight.updateAndGet(current -> current > 0 ? current - 1 : 0);
    }

    /**
     * Folds a latency sample into the exponentially weighted moving average.
     */
    public void recordLatency(Duration latency) {
        double sample = latency.toNanos() / 1_000_000.0;
        rollingLatencyBits.updateAndGet(bits -> {
            if (bits == NO_SAMPLE) {
                return Double.doubleToLongBits(sample);
            }
            double previous = Double.longBitsToDouble(bits);
            return Double.doubleToLongBits(LATENCY_ALPHA * sample + (1 - LATENCY_ALPHA) * previous);
        });
    }

    public boolean hasLatencySample() {
        return rollingLatencyBits.get() != NO_SAMPLE;
    }

    /**
     * Rolling latency in milliseconds, 0 when no call completed yet.
     */
    public double getRollingLatencyMillis() {
        long bits = rollingLatencyBits.get();
        return bits == NO_SAMPLE ? 0.0 : Double.longBitsToDouble(bits);
    }

    public ProviderHealth getLastHealthCheck() {
        return lastHealthCheck.get();
    }

    void setLastHealthCheck(ProviderHealth health) {
        lastHealthCheck.set(health);
    }

    @Override
    public String toString() {
        Circuit current = circuit.get();
        return "ProviderHealthState{" +
                "providerId='" + providerId + '\'' +
                ", state=" + current.state() +
                ", failures=" + consecutiveFailures.get() +
                ", inFlight=" + inFlight.get() +
                ", latencyMs=" + String.format("%.1f", getRollingLatencyMillis()) +
                '}';
    }

    /**
     * Circuit state together with the instant it was entered.
     * Compared by identity in CAS operations.
     */
    public record Circuit(CircuitState state, Instant since) {
        public Circuit {
            Objects.requireNonNull(state, "State is required");
            Objects.requireNonNull(since, "Transition time is required");
        }
    }
}
