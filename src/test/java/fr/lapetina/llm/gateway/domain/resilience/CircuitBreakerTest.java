package fr.lapetina.llm.gateway.domain.resilience;

import fr.lapetina.llm.gateway.domain.model.CallOutcome;
import fr.lapetina.llm.gateway.domain.model.FailureKind;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CircuitBreakerTest {

    private static final Duration OPEN_TIMEOUT = Duration.ofSeconds(30);
    private static final CallOutcome FAILURE = CallOutcome.failure(FailureKind.RETRYABLE, Duration.ofMillis(5));
    private static final CallOutcome SUCCESS = CallOutcome.success(Duration.ofMillis(5));

    private MutableClock clock;
    private ProviderHealthState health;
    private List<String> transitions;
    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        health = new ProviderHealthState("p1", clock.instant());
        transitions = new CopyOnWriteArrayList<>();
        // 3 failures to open, 2 probe successes to close
        circuitBreaker = new CircuitBreaker(
                health,
                new CircuitBreakerConfig(3, 2, OPEN_TIMEOUT),
                clock,
                (providerId, from, to, reason) -> transitions.add(from + "->" + to)
        );
    }

    private void fail(int times) {
        for (int i = 0; i < times; i++) {
            circuitBreaker.recordOutcome(circuitBreaker.permit(), FAILURE);
        }
    }

    private void openAndWait() {
        fail(3);
        clock.advance(OPEN_TIMEOUT);
    }

    @Test
    @DisplayName("should start in CLOSED state")
    void shouldStartClosed() {
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuitBreaker.permit().getType()).isEqualTo(Permission.Type.ALLOWED);
    }

    @Nested
    @DisplayName("CLOSED")
    class ClosedTests {

        @Test
        @DisplayName("should open after threshold provider failures")
        void shouldOpenAfterThresholdFailures() {
            fail(2);
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);

            fail(1);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(circuitBreaker.permit().isAllowed()).isFalse();
            assertThat(circuitBreaker.getRemainingOpenTime()).isEqualTo(OPEN_TIMEOUT);
            assertThat(transitions).containsExactly("CLOSED->OPEN");
        }

        @Test
        @DisplayName("should ignore client-attributable failures")
        void shouldIgnoreClientFailures() {
            for (int i = 0; i < 10; i++) {
                circuitBreaker.recordOutcome(circuitBreaker.permit(),
                        CallOutcome.failure(FailureKind.NON_RETRYABLE, Duration.ofMillis(1)));
            }

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(circuitBreaker.getFailureCount()).isZero();
        }

        @Test
        @DisplayName("should reset failure count on success")
        void shouldResetFailureCountOnSuccess() {
            fail(2);
            assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);

            circuitBreaker.recordOutcome(circuitBreaker.permit(), SUCCESS);

            assertThat(circuitBreaker.getFailureCount()).isZero();
        }

        @Test
        @DisplayName("should settle a permission only once")
        void shouldSettleOnce() {
            Permission permission = circuitBreaker.permit();

            circuitBreaker.recordOutcome(permission, FAILURE);
            circuitBreaker.recordOutcome(permission, FAILURE);
            circuitBreaker.release(permission);

            assertThat(permission.isSettled()).isTrue();
            assertThat(circuitBreaker.getFailureCount()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("OPEN and HALF_OPEN")
    class RecoveryTests {

        @Test
        @DisplayName("should stay OPEN until the open timeout elapses")
        void shouldStayOpenBeforeTimeout() {
            fail(3);
            clock.advance(OPEN_TIMEOUT.minusMillis(1));

            assertThat(circuitBreaker.permit().isAllowed()).isFalse();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        }

        @Test
        @DisplayName("should admit a single probe after the open timeout")
        void shouldAdmitSingleProbe() {
            openAndWait();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            Permission probe = circuitBreaker.permit();
            Permission second = circuitBreaker.permit();

            assertThat(probe.isProbe()).isTrue();
            assertThat(second.isAllowed()).isFalse();
            assertThat(health.isProbeInFlight()).isTrue();
            assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN");
        }

        @Test
        @DisplayName("should close after enough probe successes")
        void shouldCloseAfterProbeSuccesses() {
            openAndWait();

            circuitBreaker.recordOutcome(circuitBreaker.permit(), SUCCESS);
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);

            circuitBreaker.recordOutcome(circuitBreaker.permit(), SUCCESS);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
            assertThat(circuitBreaker.getFailureCount()).isZero();
            assertThat(health.isProbeInFlight()).isFalse();
            assertThat(transitions).endsWith("HALF_OPEN->CLOSED");
        }

        @Test
        @DisplayName("should reopen on a failed probe")
        void shouldReopenOnFailedProbe() {
            openAndWait();

            circuitBreaker.recordOutcome(circuitBreaker.permit(), FAILURE);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(circuitBreaker.getRemainingOpenTime()).isEqualTo(OPEN_TIMEOUT);
            assertThat(health.isProbeInFlight()).isFalse();
        }

        @Test
        @DisplayName("should free the probe slot when a probe is released without outcome")
        void shouldFreeProbeOnRelease() {
            openAndWait();
            Permission probe = circuitBreaker.permit();

            circuitBreaker.release(probe);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
            assertThat(circuitBreaker.permit().isProbe()).isTrue();
        }

        @Test
        @DisplayName("should not count a probe granted before the circuit moved")
        void shouldIgnoreStaleProbeSuccess() {
            openAndWait();
            Permission staleProbe = circuitBreaker.permit();
            circuitBreaker.forceState(CircuitState.OPEN);
            clock.advance(OPEN_TIMEOUT);
            // Enters a new HALF_OPEN period
            circuitBreaker.release(circuitBreaker.permit());

            circuitBreaker.recordOutcome(staleProbe, SUCCESS);

            assertThat(health.getConsecutiveSuccesses()).isZero();
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.HALF_OPEN);
        }
    }

    @Nested
    @DisplayName("Health checks")
    class HealthCheckTests {

        @Test
        @DisplayName("should count UNHEALTHY as a provider failure")
        void shouldCountUnhealthy() {
            circuitBreaker.recordHealthCheck(ProviderHealth.UNHEALTHY);
            circuitBreaker.recordHealthCheck(ProviderHealth.UNHEALTHY);
            circuitBreaker.recordHealthCheck(ProviderHealth.UNHEALTHY);

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(health.getLastHealthCheck()).isEqualTo(ProviderHealth.UNHEALTHY);
        }

        @Test
        @DisplayName("should treat DEGRADED as neutral")
        void shouldTreatDegradedAsNeutral() {
            fail(2);

            circuitBreaker.recordHealthCheck(ProviderHealth.DEGRADED);

            assertThat(circuitBreaker.getFailureCount()).isEqualTo(2);
            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        }

        @Test
        @DisplayName("should reset failures on HEALTHY")
        void shouldResetOnHealthy() {
            fail(2);

            circuitBreaker.recordHealthCheck(ProviderHealth.HEALTHY);

            assertThat(circuitBreaker.getFailureCount()).isZero();
        }
    }

    @Test
    @DisplayName("should allow forcing state")
    void shouldAllowForcingState() {
        circuitBreaker.forceState(CircuitState.OPEN);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
        assertThat(circuitBreaker.isOpen()).isTrue();

        circuitBreaker.forceState(CircuitState.CLOSED);
        assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.CLOSED);
        assertThat(circuitBreaker.getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should survive a failing listener")
    void shouldSurviveFailingListener() {
        CircuitBreaker breaker = new CircuitBreaker(
                new ProviderHealthState("p2", clock.instant()),
                new CircuitBreakerConfig(1, 1, OPEN_TIMEOUT),
                clock,
                (providerId, from, to, reason) -> {
                    throw new IllegalStateException("listener down");
                });

        breaker.recordOutcome(breaker.permit(), FAILURE);

        assertThat(breaker.getState()).isEqualTo(CircuitState.OPEN);
    }

    @Nested
    @DisplayName("Concurrency")
    class ConcurrencyTests {

        @Test
        @DisplayName("should open exactly once under concurrent failures")
        void shouldOpenExactlyOnce() throws InterruptedException {
            int threads = 32;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch ready = new CountDownLatch(threads);
            CountDownLatch go = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    Permission permission = circuitBreaker.permit();
                    ready.countDown();
                    try {
                        go.await();
                        circuitBreaker.recordOutcome(permission, FAILURE);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            ready.await(5, TimeUnit.SECONDS);
            go.countDown();
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(circuitBreaker.getState()).isEqualTo(CircuitState.OPEN);
            assertThat(transitions).containsExactly("CLOSED->OPEN");
        }

        @Test
        @DisplayName("should grant one probe to concurrent callers")
        void shouldGrantOneProbe() throws InterruptedException {
            openAndWait();
            int threads = 32;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            CountDownLatch go = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(threads);
            AtomicInteger probes = new AtomicInteger();

            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        go.await();
                        if (circuitBreaker.permit().isProbe()) {
                            probes.incrementAndGet();
                        }
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }

            go.countDown();
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            executor.shutdown();

            assertThat(probes.get()).isEqualTo(1);
            assertThat(transitions).containsExactly("CLOSED->OPEN", "OPEN->HALF_OPEN");
        }
    }
}
