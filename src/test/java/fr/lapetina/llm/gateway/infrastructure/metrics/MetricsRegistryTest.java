package fr.lapetina.llm.gateway.infrastructure.metrics;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.resilience.CircuitState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import static fr.lapetina.llm.gateway.support.TestProviders.ref;
import static org.assertj.core.api.Assertions.assertThat;

class MetricsRegistryTest {

    private MetricsRegistry metrics;

    @BeforeEach
    void setUp() {
        metrics = new MetricsRegistry("llm_gateway", false);
    }

    @AfterEach
    void tearDown() {
        metrics.close();
    }

    @Test
    @DisplayName("should record attempts and requests and expose them in the Prometheus scrape")
    void shouldScrapeAttemptsAndRequests() {
        metrics.recordAttempt("p1", "gpt-4o", "success", Duration.ofMillis(80));
        metrics.recordAttempt("p1", "gpt-4o", "success", Duration.ofMillis(120));
        metrics.recordAttempt("p1", "gpt-4o", "timeout", Duration.ofMillis(900));
        metrics.recordRequest("gpt-4o", "success", Duration.ofMillis(1000));

        assertThat(metrics.getRegistry().get("llm_gateway_attempts_total")
                .tags("provider", "p1", "model", "gpt-4o", "outcome", "success").counter().count()).isEqualTo(2.0);
        assertThat(metrics.getRegistry().get("llm_gateway_attempts_total")
                .tag("outcome", "timeout").counter().count()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("llm_gateway_attempt_latency")
                .tag("provider", "p1").timer().count()).isEqualTo(3);
        assertThat(metrics.scrape())
                .contains("llm_gateway_attempts_total{")
                .contains("llm_gateway_attempt_latency_seconds_count{")
                .contains("llm_gateway_requests_total{")
                .contains("llm_gateway_request_latency_seconds_bucket{");
    }

    @Test
    @DisplayName("should count breaker transitions by provider and states")
    void shouldCountTransitions() {
        metrics.recordBreakerTransition("p1", CircuitState.CLOSED, CircuitState.OPEN);
        metrics.recordBreakerTransition("p1", CircuitState.CLOSED, CircuitState.OPEN);

        assertThat(metrics.getRegistry().get("llm_gateway_breaker_transitions_total")
                .tag("provider", "p1").tag("from", "CLOSED").tag("to", "OPEN")
                .counter().count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("should report provider gauges from the current registry entry")
    void shouldReportProviderGauges() {
        ProviderRef p1 = ref("p1", "gpt-4o");
        AtomicReference<ProviderRef> current = new AtomicReference<>(p1);
        metrics.registerProvider("p1", current::get);

        p1.getHealth().incrementInFlight();
        p1.getHealth().incrementInFlight();
        p1.getHealth().recordLatency(Duration.ofMillis(200));
        p1.getCircuitBreaker().forceState(CircuitState.OPEN);

        assertThat(gauge("llm_gateway_provider_inflight")).isEqualTo(2.0);
        assertThat(gauge("llm_gateway_provider_latency_ms")).isEqualTo(200.0);
        assertThat(gauge("llm_gateway_provider_breaker_state")).isEqualTo(2.0);

        // Re-registered provider: same gauges, new entry
        current.set(ref("p1", "gpt-4o"));
        assertThat(gauge("llm_gateway_provider_inflight")).isZero();
        assertThat(gauge("llm_gateway_provider_breaker_state")).isZero();
    }

    @Test
    @DisplayName("should remove provider gauges on unregister")
    void shouldUnregisterProvider() {
        metrics.registerProvider("p1", () -> null);
        assertThat(gauge("llm_gateway_provider_inflight")).isZero();

        metrics.unregisterProvider("p1");

        assertThat(metrics.getRegistry().find("llm_gateway_provider_inflight").gauge()).isNull();
        assertThat(metrics.scrape()).doesNotContain("llm_gateway_provider_inflight");
    }

    @Test
    @DisplayName("should track dropped telemetry and ring buffer capacity")
    void shouldTrackTelemetryHealth() {
        metrics.incrementDroppedEvents();
        metrics.setRingBufferRemaining(1000);

        assertThat(metrics.getDroppedEvents()).isEqualTo(1.0);
        assertThat(metrics.getRegistry().get("llm_gateway_telemetry_ringbuffer_remaining").gauge().value())
                .isEqualTo(1000.0);
    }

    @Test
    @DisplayName("should leave JVM meters out when disabled")
    void shouldSkipJvmMetrics() {
        assertThat(metrics.scrape()).doesNotContain("jvm_memory_used_bytes");
    }

    private double gauge(String name) {
        return metrics.getRegistry().get(name).tag("provider", "p1").gauge().value();
    }
}
