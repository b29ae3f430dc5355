package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.error.ProviderCallException;
import fr.lapetina.llm.gateway.domain.model.CallOutcome;
import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.FailureKind;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreakerConfig;
import fr.lapetina.llm.gateway.domain.resilience.CircuitState;
import fr.lapetina.llm.gateway.domain.resilience.ProviderHealthState;
import fr.lapetina.llm.gateway.domain.resilience.RetryPolicy;
import fr.lapetina.llm.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.SelectionContext;
import fr.lapetina.llm.gateway.support.RecordingTelemetry;
import fr.lapetina.llm.gateway.support.StubProviderClient;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.llm.gateway.support.TestProviders.provider;
import static org.assertj.core.api.Assertions.assertThat;

class RetryExecutorTest {

    private static final RetryPolicy POLICY = new RetryPolicy(
            3, Duration.ofMillis(10), Duration.ofMillis(100), 2.0, 0.0, Duration.ofSeconds(2));

    private ScheduledExecutorService scheduler;
    private StubProviderClient client;
    private RecordingTelemetry telemetry;
    private RetryExecutor executor;
    private ProviderRef p1;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        client = new StubProviderClient();
        telemetry = new RecordingTelemetry();
        executor = new RetryExecutor(client, scheduler, telemetry, Clock.systemUTC(), () -> new Random(1));
        p1 = refWithThreshold("p1", 5);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static ProviderRef refWithThreshold(String id, int failureThreshold) {
        ProviderHealthState health = new ProviderHealthState(id);
        CircuitBreaker breaker = new CircuitBreaker(
                health, new CircuitBreakerConfig(failureThreshold, 1, Duration.ofSeconds(30)));
        return new ProviderRef(provider(id, "gpt-4o").build(), health, breaker);
    }

    private static AttemptScope scope(Duration budget) {
        return new AttemptScope(Deadline.after(budget));
    }

    private RetryResult run(ProviderRef ref, RetryPolicy policy, AttemptScope scope) throws Exception {
        return executor.execute(ref, CanonicalRequest.of("gpt-4o", "hi"), policy, scope)
                .get(5, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("should succeed on the first attempt")
    void shouldSucceedFirstAttempt() throws Exception {
        RetryResult result = run(p1, POLICY, scope(Duration.ofSeconds(5)));

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.SUCCESS);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.response().providerId()).isEqualTo("p1");
        assertThat(result.delays()).isEmpty();
        assertThat(p1.getHealth().getInFlight()).isZero();
        assertThat(p1.getHealth().hasLatencySample()).isTrue();
    }

    @Test
    @DisplayName("should retry with exponential backoff until success")
    void shouldRetryWithBackoff() throws Exception {
        client.failTimes("p1", 2, () -> ProviderCallException.forStatus("p1", 503, "unavailable"));

        RetryResult result = run(p1, POLICY, scope(Duration.ofSeconds(5)));

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.SUCCESS);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(result.delays()).containsExactly(Duration.ofMillis(10), Duration.ofMillis(20));
        assertThat(p1.getCircuitBreaker().getFailureCount()).isZero();
        assertThat(telemetry.attempts).extracting(e -> e.attemptNumber() + ":" + e.outcome())
                .containsExactly("1:retryable", "2:retryable", "3:success");
    }

    @Test
    @DisplayName("should stop after max attempts")
    void shouldExhaustRetries() throws Exception {
        client.fail("p1", () -> ProviderCallException.retryable("p1", "overloaded"));
        AttemptScope scope = scope(Duration.ofSeconds(5));

        RetryResult result = run(p1, POLICY, scope);

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.RETRIES_EXHAUSTED);
        assertThat(result.attempts()).isEqualTo(3);
        assertThat(client.calls("p1")).isEqualTo(3);
        assertThat(scope.getDispatchedProviders()).containsExactly("p1");
        assertThat(scope.getDispatchCount()).isEqualTo(3);
        assertThat(result.lastError()).isInstanceOf(ProviderCallException.class);
        assertThat(p1.getCircuitBreaker().getFailureCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should not retry non-retryable errors nor count them against the provider")
    void shouldNotRetryNonRetryable() throws Exception {
        client.fail("p1", () -> ProviderCallException.forStatus("p1", 401, "bad key"));

        RetryResult result = run(p1, POLICY, scope(Duration.ofSeconds(5)));

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.NON_RETRYABLE);
        assertThat(client.calls("p1")).isEqualTo(1);
        assertThat(p1.getCircuitBreaker().getFailureCount()).isZero();
    }

    @Test
    @DisplayName("should make no call when the breaker is open")
    void shouldNotCallOpenProvider() throws Exception {
        p1.getCircuitBreaker().forceState(CircuitState.OPEN);

        RetryResult result = run(p1, POLICY, scope(Duration.ofSeconds(5)));

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.CIRCUIT_OPEN);
        assertThat(result.attempts()).isZero();
        assertThat(client.calls("p1")).isZero();
    }

    @Test
    @DisplayName("should stop retrying once the breaker opens mid-loop")
    void shouldStopWhenBreakerOpens() throws Exception {
        ProviderRef fragile = refWithThreshold("p2", 2);
        client.fail("p2", () -> ProviderCallException.retryable("p2", "502"));

        RetryResult result = run(fragile, POLICY.withMaxAttempts(5), scope(Duration.ofSeconds(5)));

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.CIRCUIT_OPEN);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(client.calls("p2")).isEqualTo(2);
        assertThat(fragile.getCircuitState()).isEqualTo(CircuitState.OPEN);
    }

    @Test
    @DisplayName("should time out a slow attempt and count it against the provider")
    void shouldTimeOutSlowAttempt() throws Exception {
        client.hang("p1");
        RetryPolicy quick = new RetryPolicy(
                2, Duration.ofMillis(10), Duration.ofMillis(10), 1.0, 0.0, Duration.ofMillis(50));

        RetryResult result = run(p1, quick, scope(Duration.ofSeconds(5)));

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.RETRIES_EXHAUSTED);
        assertThat(result.attempts()).isEqualTo(2);
        assertThat(((ProviderCallException) result.lastError()).getFailureKind()).isEqualTo(FailureKind.TIMEOUT);
        assertThat(p1.getCircuitBreaker().getFailureCount()).isEqualTo(2);
        assertThat(p1.getHealth().getInFlight()).isZero();
    }

    @Test
    @DisplayName("should cap the attempt timeout by the remaining deadline")
    void shouldCapAttemptTimeout() throws Exception {
        run(p1, POLICY, scope(Duration.ofMillis(500)));

        assertThat(client.getTimeouts()).hasSize(1);
        assertThat(client.getTimeouts().get(0)).isLessThanOrEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("should abandon the pending call without blaming the provider when cancelled")
    void shouldAbandonOnCancel() throws Exception {
        client.hang("p1");
        AttemptScope scope = scope(Duration.ofSeconds(5));
        scheduler.schedule(scope::cancel, 100, TimeUnit.MILLISECONDS);

        RetryResult result = run(p1, POLICY, scope);

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.DEADLINE_EXCEEDED);
        assertThat(client.getPending()).allMatch(f -> f.isCancelled());
        assertThat(p1.getHealth().getInFlight()).isZero();
        assertThat(p1.getCircuitBreaker().getFailureCount()).isZero();
        assertThat(telemetry.attempts).isEmpty();
    }

    @Test
    @DisplayName("should give up during backoff when the scope is cancelled")
    void shouldAbandonDuringBackoff() throws Exception {
        client.fail("p1", () -> ProviderCallException.retryable("p1", "503"));
        RetryPolicy slowBackoff = new RetryPolicy(
                3, Duration.ofSeconds(2), Duration.ofSeconds(2), 1.0, 0.0, Duration.ofSeconds(1));
        AttemptScope scope = scope(Duration.ofSeconds(10));
        scheduler.schedule(scope::cancel, 100, TimeUnit.MILLISECONDS);

        RetryResult result = run(p1, slowBackoff, scope);

        assertThat(result.kind()).isEqualTo(RetryResult.Kind.DEADLINE_EXCEEDED);
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(client.calls("p1")).isEqualTo(1);
    }

    @Test
    @DisplayName("should release a half-open probe when the attempt is abandoned")
    void shouldReleaseProbeOnAbandon() throws Exception {
        ProviderRef probing = refWithThreshold("p3", 1);
        probing.getCircuitBreaker().forceState(CircuitState.HALF_OPEN);
        client.hang("p3");
        AttemptScope scope = scope(Duration.ofSeconds(5));
        scheduler.schedule(scope::cancel, 50, TimeUnit.MILLISECONDS);

        run(probing, POLICY, scope);

        assertThat(probing.getHealth().isProbeInFlight()).isFalse();
        assertThat(probing.getCircuitState()).isEqualTo(CircuitState.HALF_OPEN);
    }

    @Test
    @DisplayName("should feed every outcome to the selecting strategy")
    void shouldFeedStrategy() throws Exception {
        List<CallOutcome> outcomes = new CopyOnWriteArrayList<>();
        client.failTimes("p1", 1, () -> ProviderCallException.retryable("p1", "503"));

        executor.execute(p1, CanonicalRequest.of("gpt-4o", "hi"), POLICY, scope(Duration.ofSeconds(5)),
                        new FeedbackRecorder(outcomes))
                .get(5, TimeUnit.SECONDS);

        assertThat(outcomes).extracting(CallOutcome::isSuccess).containsExactly(false, true);
    }

    /**
     * Strategy that only records feedback.
     */
    private static final class FeedbackRecorder implements LoadBalancingStrategy {
        private final List<CallOutcome> outcomes;

        FeedbackRecorder(List<CallOutcome> outcomes) {
            this.outcomes = outcomes;
        }

        @Override
        public String getName() {
            return "recorder";
        }

        @Override
        public Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context) {
            return candidates.stream().findFirst();
        }

        @Override
        public void recordResult(ProviderRef provider, CallOutcome outcome) {
            outcomes.add(outcome);
        }
    }
}
