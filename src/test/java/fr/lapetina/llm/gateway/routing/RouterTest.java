package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.error.GatewayErrorKind;
import fr.lapetina.llm.gateway.domain.error.GatewayException;
import fr.lapetina.llm.gateway.domain.error.ProviderCallException;
import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.model.RoutingHints;
import fr.lapetina.llm.gateway.domain.resilience.CircuitState;
import fr.lapetina.llm.gateway.domain.resilience.RetryPolicy;
import fr.lapetina.llm.gateway.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llm.gateway.support.RecordingTelemetry;
import fr.lapetina.llm.gateway.support.StubProviderClient;
import fr.lapetina.llm.gateway.telemetry.RequestCompletedEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static fr.lapetina.llm.gateway.support.TestProviders.await;
import static fr.lapetina.llm.gateway.support.TestProviders.provider;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowable;

class RouterTest {

    private static final RetryPolicy POLICY = new RetryPolicy(
            2, Duration.ofMillis(5), Duration.ofMillis(20), 2.0, 0.0, Duration.ofSeconds(2));

    private ScheduledExecutorService scheduler;
    private StubProviderClient client;
    private RecordingTelemetry telemetry;
    private ProviderRegistry registry;
    private Router router;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newScheduledThreadPool(2);
        client = new StubProviderClient();
        telemetry = new RecordingTelemetry();
        registry = new ProviderRegistry();
        registry.register(provider("p1", "gpt-4o").build());
        registry.register(provider("p2", "gpt-4o").build());
        registry.register(provider("p3", "gpt-4o").build());

        router = new Router(
                registry,
                new RetryExecutor(client, scheduler, telemetry),
                scheduler,
                telemetry,
                tableWith(),
                Clock.systemUTC()
        );
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    private static RoutingTable tableWith(RoutingRule... rules) {
        return RoutingTable.builder()
                .rules(List.of(rules))
                .retryPolicy(POLICY)
                .defaultDeadline(Duration.ofSeconds(5))
                .build();
    }

    private CanonicalResponse route(CanonicalRequest request) throws Exception {
        return router.route(request).get(5, TimeUnit.SECONDS);
    }

    private GatewayException routeExpectingFailure(CanonicalRequest request) {
        CompletableFuture<CanonicalResponse> future = router.route(request);
        Throwable thrown = catchThrowable(() -> future.get(5, TimeUnit.SECONDS));
        assertThat(thrown).isInstanceOf(ExecutionException.class);
        assertThat(thrown.getCause()).isInstanceOf(GatewayException.class);
        return (GatewayException) thrown.getCause();
    }

    private ProviderRef ref(String id) {
        return registry.get(id).orElseThrow();
    }

    @Nested
    @DisplayName("Selection")
    class SelectionTests {

        @Test
        @DisplayName("should rotate requests round-robin across healthy providers")
        void shouldRotateRoundRobin() throws Exception {
            List<String> served = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                served.add(route(CanonicalRequest.of("gpt-4o", "hi " + i)).providerId());
            }

            assertThat(served).containsExactly("p1", "p2", "p3", "p1", "p2", "p3");
        }

        @Test
        @DisplayName("should skip a provider whose breaker is open without calling it")
        void shouldSkipOpenProvider() throws Exception {
            ref("p1").getCircuitBreaker().forceState(CircuitState.OPEN);

            CanonicalResponse response = route(CanonicalRequest.of("gpt-4o", "hi"));

            assertThat(response.providerId()).isEqualTo("p2");
            assertThat(client.calls("p1")).isZero();
        }

        @Test
        @DisplayName("should honor the preferred provider hint")
        void shouldHonorPreferredProvider() throws Exception {
            CanonicalRequest request = CanonicalRequest.builder()
                    .model("gpt-4o")
                    .hints(RoutingHints.preferring("p3"))
                    .build();

            assertThat(route(request).providerId()).isEqualTo("p3");
        }

        @Test
        @DisplayName("should route tenant traffic through its rule")
        void shouldRouteTenantRule() throws Exception {
            router.setRoutingTable(tableWith(RoutingRule.chain("acme-only", 1, "*", "p2").forTenant("acme")));

            CanonicalRequest acme = CanonicalRequest.builder()
                    .model("gpt-4o").hints(RoutingHints.forTenant("acme")).build();

            assertThat(route(acme).providerId()).isEqualTo("p2");
            assertThat(route(acme).providerId()).isEqualTo("p2");
        }

        @Test
        @DisplayName("should apply a new routing table to the next request")
        void shouldApplyNewTable() throws Exception {
            assertThat(route(CanonicalRequest.of("gpt-4o", "hi")).providerId()).isEqualTo("p1");

            router.setRoutingTable(tableWith(RoutingRule.chain("pin", 1, "gpt-4o", "p3")));

            assertThat(route(CanonicalRequest.of("gpt-4o", "hi")).providerId()).isEqualTo("p3");
            assertThat(router.getRoutingTable().getRules()).hasSize(1);
        }

        @Test
        @DisplayName("should keep the round-robin rotation after a fail-over")
        void shouldKeepRotationAfterFailOver() throws Exception {
            client.failTimes("p1", 2, () -> ProviderCallException.retryable("p1", "502"));

            List<String> served = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                served.add(route(CanonicalRequest.of("gpt-4o", "hi " + i)).providerId());
            }

            // First request fails over from p1, the next ones carry on from p2
            assertThat(served).containsExactly("p2", "p2", "p3", "p1");
            assertThat(client.getCallOrder()).containsExactly("p1", "p1", "p2", "p2", "p3", "p1");
        }
    }

    @Nested
    @DisplayName("Fail-over")
    class FailoverTests {

        @Test
        @DisplayName("should fail over to the next provider once retries are exhausted")
        void shouldFailOver() throws Exception {
            router.setRoutingTable(tableWith(RoutingRule.chain("chain", 1, "gpt-4o", "p1", "p2")));
            client.fail("p1", () -> ProviderCallException.forStatus("p1", 503, "unavailable"));

            CanonicalResponse response = route(CanonicalRequest.of("gpt-4o", "hi"));

            assertThat(response.providerId()).isEqualTo("p2");
            assertThat(client.calls("p1")).isEqualTo(2);
            assertThat(client.getCallOrder()).containsExactly("p1", "p1", "p2");

            RequestCompletedEvent completed = telemetry.completed.get(0);
            assertThat(completed.isSuccess()).isTrue();
            assertThat(completed.attemptedProviders()).containsExactly("p1", "p2");
            assertThat(completed.totalAttempts()).isEqualTo(3);
        }

        @Test
        @DisplayName("should stop on a non-retryable error")
        void shouldStopOnNonRetryable() {
            router.setRoutingTable(tableWith(RoutingRule.chain("chain", 1, "gpt-4o", "p1", "p2")));
            client.fail("p1", () -> ProviderCallException.forStatus("p1", 400, "bad request"));

            GatewayException error = routeExpectingFailure(CanonicalRequest.of("gpt-4o", "hi"));

            assertThat(error.getKind()).isEqualTo(GatewayErrorKind.PROVIDER_ERROR);
            assertThat(error.getProviderId()).isEqualTo("p1");
            assertThat(client.calls("p2")).isZero();
        }

        @Test
        @DisplayName("should report exhaustion after every provider failed")
        void shouldReportExhaustion() {
            for (String id : List.of("p1", "p2", "p3")) {
                client.fail(id, () -> ProviderCallException.retryable(id, "502"));
            }

            GatewayException error = routeExpectingFailure(CanonicalRequest.of("gpt-4o", "hi"));

            assertThat(error.getKind()).isEqualTo(GatewayErrorKind.RETRIES_EXHAUSTED);
            assertThat(error.getAttemptedProviders()).containsExactlyInAnyOrder("p1", "p2", "p3");
            assertThat(error.getCause()).isInstanceOf(ProviderCallException.class);
            assertThat(client.totalCalls()).isEqualTo(6);
        }

        @Test
        @DisplayName("should try every provider at most once per request")
        void shouldTryEachProviderOnce() {
            router.setRoutingTable(tableWith(RoutingRule.chain("chain", 1, "gpt-4o", "p1", "p2", "p1")));
            client.fail("p1", () -> ProviderCallException.retryable("p1", "502"));
            client.fail("p2", () -> ProviderCallException.retryable("p2", "502"));

            routeExpectingFailure(CanonicalRequest.of("gpt-4o", "hi"));

            assertThat(client.calls("p1")).isEqualTo(2);
            assertThat(client.calls("p2")).isEqualTo(2);
            assertThat(client.calls("p3")).isZero();
        }
    }

    @Nested
    @DisplayName("Rejections")
    class RejectionTests {

        @Test
        @DisplayName("should reject a model no provider serves")
        void shouldRejectUnknownModel() {
            GatewayException error = routeExpectingFailure(CanonicalRequest.of("gpt-9", "hi"));

            assertThat(error.getKind()).isEqualTo(GatewayErrorKind.MODEL_NOT_FOUND);
            assertThat(client.totalCalls()).isZero();
            assertThat(telemetry.completed).hasSize(1);
        }

        @Test
        @DisplayName("should reject when every breaker is open")
        void shouldRejectAllOpen() {
            registry.getAll().forEach(ref -> ref.getCircuitBreaker().forceState(CircuitState.OPEN));

            GatewayException error = routeExpectingFailure(CanonicalRequest.of("gpt-4o", "hi"));

            assertThat(error.getKind()).isEqualTo(GatewayErrorKind.NO_HEALTHY_PROVIDERS);
            assertThat(error.getAttemptedProviders()).isEmpty();
            assertThat(client.totalCalls()).isZero();
        }
    }

    @Nested
    @DisplayName("Deadline")
    class DeadlineTests {

        @Test
        @DisplayName("should time out when the request deadline expires and clean up pending calls")
        void shouldTimeOut() throws Exception {
            client.hang("p1").hang("p2").hang("p3");
            CanonicalRequest request = CanonicalRequest.builder()
                    .model("gpt-4o")
                    .deadline(Duration.ofMillis(500))
                    .build();

            long start = System.nanoTime();
            GatewayException error = routeExpectingFailure(request);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

            assertThat(error.getKind()).isEqualTo(GatewayErrorKind.TIMEOUT);
            assertThat(elapsed).isLessThan(Duration.ofSeconds(2));
            assertThat(await(() -> registry.getAll().stream()
                    .allMatch(ref -> ref.getHealth().getInFlight() == 0), Duration.ofSeconds(1))).isTrue();
            assertThat(client.getPending()).allMatch(CompletableFuture::isDone);
            // The expired deadline is not the provider's fault
            assertThat(registry.getAll()).allMatch(ref -> ref.getCircuitBreaker().getFailureCount() == 0);
        }

        @Test
        @DisplayName("should name the provider whose call was still pending at the deadline")
        void shouldNamePendingProviderOnTimeout() {
            client.hang("p1").hang("p2").hang("p3");

            for (int i = 0; i < 10; i++) {
                router.setRoutingTable(tableWith(RoutingRule.chain("pin", 1, "gpt-4o", "p1")));
                CanonicalRequest request = CanonicalRequest.builder()
                        .model("gpt-4o")
                        .deadline(Duration.ofMillis(100))
                        .build();

                GatewayException error = routeExpectingFailure(request);

                assertThat(error.getKind()).isEqualTo(GatewayErrorKind.TIMEOUT);
                assertThat(error.getProviderId()).isEqualTo("p1");
                assertThat(error.getAttemptedProviders()).containsExactly("p1");
            }

            assertThat(telemetry.completed).hasSize(10);
            assertThat(telemetry.completed).allSatisfy(completed -> {
                assertThat(completed.attemptedProviders()).containsExactly("p1");
                assertThat(completed.totalAttempts()).isEqualTo(1);
            });
        }

        @Test
        @DisplayName("should name every provider tried before the deadline, including the pending one")
        void shouldNameFailedOverProvidersOnTimeout() {
            router.setRoutingTable(tableWith(RoutingRule.chain("chain", 1, "gpt-4o", "p1", "p2")));
            client.fail("p1", () -> ProviderCallException.retryable("p1", "502"));
            client.hang("p2");
            CanonicalRequest request = CanonicalRequest.builder()
                    .model("gpt-4o")
                    .deadline(Duration.ofMillis(300))
                    .build();

            GatewayException error = routeExpectingFailure(request);

            assertThat(error.getKind()).isEqualTo(GatewayErrorKind.TIMEOUT);
            assertThat(error.getAttemptedProviders()).containsExactly("p1", "p2");
            assertThat(error.getCause()).isInstanceOf(ProviderCallException.class);
        }

        @Test
        @DisplayName("should complete exactly once")
        void shouldCompleteOnce() throws Exception {
            client.hang("p1");
            CanonicalRequest request = CanonicalRequest.builder()
                    .model("gpt-4o")
                    .deadline(Duration.ofMillis(200))
                    .build();

            routeExpectingFailure(request);
            Thread.sleep(300);

            assertThat(telemetry.completed).hasSize(1);
            assertThat(telemetry.completed.get(0).errorKind()).isEqualTo(GatewayErrorKind.TIMEOUT);
        }
    }

    @Test
    @DisplayName("should reject requests without a model")
    void shouldRejectMissingModel() {
        assertThatThrownBy(() -> CanonicalRequest.of(" ", "hi")).isInstanceOf(IllegalArgumentException.class);
    }
}
