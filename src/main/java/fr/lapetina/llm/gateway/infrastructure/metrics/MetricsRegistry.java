package fr.lapetina.llm.gateway.infrastructure.metrics;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.resilience.CircuitState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Centralized metrics registry using Micrometer.
 *
 * Provides:
 * - Attempt counters and latency per provider and outcome
 * - Request results and end-to-end latency per model
 * - Circuit breaker transition counters
 * - Per-provider in-flight, breaker state and rolling latency gauges
 * - JVM and system metrics, Prometheus exposition
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    // Cache for dynamic meters
    private final ConcurrentHashMap<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> attemptTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> requestTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> transitionCounters = new ConcurrentHashMap<>();
    private final Map<String, List<Meter>> providerGauges = new ConcurrentHashMap<>();

    private final Counter droppedEvents;
    private final AtomicLong ringBufferRemaining = new AtomicLong(0);

    public MetricsRegistry(String prefix, boolean jvmMetrics) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        if (jvmMetrics) {
            new JvmMemoryMetrics().bindTo(registry);
            new JvmGcMetrics().bindTo(registry);
            new JvmThreadMetrics().bindTo(registry);
            new ProcessorMetrics().bindTo(registry);
        }

        this.droppedEvents = Counter.builder(prefix + "_telemetry_dropped_total")
                .description("Telemetry events dropped because the ring buffer was full")
                .register(registry);

        Gauge.builder(prefix + "_telemetry_ringbuffer_remaining", ringBufferRemaining, AtomicLong::get)
                .description("Remaining capacity in the telemetry ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized: prefix={}, jvmMetrics={}", prefix, jvmMetrics);
    }

    public MetricsRegistry(String prefix) {
        this(prefix, true);
    }

    public MetricsRegistry() {
        this("llm_gateway");
    }

    /**
     * Records one provider call.
     */
    public void recordAttempt(String providerId, String model, String outcome, Duration latency) {
        String key = providerId + ":" + model + ":" + outcome;
        attemptCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_attempts_total")
                        .description("Provider calls by outcome")
                        .tag("provider", providerId)
                        .tag("model", model)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();

        attemptTimers.computeIfAbsent(providerId, k ->
                Timer.builder(prefix + "_attempt_latency")
                        .description("Provider call latency")
                        .tag("provider", providerId)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    /**
     * Records the final result of a routed request.
     */
    public void recordRequest(String model, String result, Duration latency) {
        String key = model + ":" + result;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Routed requests by result")
                        .tag("model", model)
                        .tag("result", result)
                        .register(registry)
        ).increment();

        requestTimers.computeIfAbsent(model, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("End-to-end routing latency, fail-overs included")
                        .tag("model", model)
                        .publishPercentileHistogram()
                        .register(registry)
        ).record(latency);
    }

    /**
     * Counts a circuit breaker transition.
     */
    public void recordBreakerTransition(String providerId, CircuitState from, CircuitState to) {
        String key = providerId + ":" + from + ":" + to;
        transitionCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_breaker_transitions_total")
                        .description("Circuit breaker transitions")
                        .tag("provider", providerId)
                        .tag("from", from.name())
                        .tag("to", to.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Registers the per-provider gauges. Values are read from the registry
     * lookup so a re-registered provider keeps reporting.
     */
    public void registerProvider(String providerId, Supplier<ProviderRef> lookup) {
        providerGauges.computeIfAbsent(providerId, id -> List.of(
                Gauge.builder(prefix + "_provider_inflight",
                                () -> valueOf(lookup, ref -> ref.getHealth().getInFlight()))
                        .description("In-flight requests per provider")
                        .tag("provider", id)
                        .strongReference(true)
                        .register(registry),
                Gauge.builder(prefix + "_provider_breaker_state",
                                () -> valueOf(lookup, ref -> stateValue(ref.getCircuitState())))
                        .description("Circuit breaker state (0=CLOSED, 1=HALF_OPEN, 2=OPEN)")
                        .tag("provider", id)
                        .strongReference(true)
                        .register(registry),
                Gauge.builder(prefix + "_provider_latency_ms",
                                () -> valueOf(lookup, ref -> ref.getHealth().getRollingLatencyMillis()))
                        .description("Rolling provider latency in milliseconds")
                        .tag("provider", id)
                        .strongReference(true)
                        .register(registry)
        ));
    }

    /**
     * Removes the per-provider gauges of a deregistered provider.
     */
    public void unregisterProvider(String providerId) {
        List<Meter> meters = providerGauges.remove(providerId);
        if (meters != null) {
            meters.forEach(registry::remove);
        }
    }

    private static Number valueOf(Supplier<ProviderRef> lookup, Function<ProviderRef, Number> f) {
        ProviderRef ref = lookup.get();
        return ref != null ? f.apply(ref) : 0;
    }

    private static int stateValue(CircuitState state) {
        return switch (state) {
            case CLOSED -> 0;
            case HALF_OPEN -> 1;
            case OPEN -> 2;
        };
    }

    public void incrementDroppedEvents() {
        droppedEvents.increment();
    }

    public double getDroppedEvents() {
        return droppedEvents.count();
    }

    public void setRingBufferRemaining(long value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Returns the Prometheus scrape output.
     */
    public String scrape() {
        return registry.scrape();
    }

    /**
     * Returns the underlying Micrometer registry.
     */
    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
