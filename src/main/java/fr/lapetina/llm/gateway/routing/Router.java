package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.error.GatewayException;
import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llm.gateway.telemetry.GatewayTelemetry;
import fr.lapetina.llm.gateway.telemetry.RequestCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point of the routing core.
 *
 * For each request: capture the routing table and the provider registry
 * once, resolve the candidates, drop those whose breaker is open, then
 * try them one by one through the {@link RetryExecutor} under a single
 * request deadline.
 *
 * Thread-safe. The routing table is replaced atomically; requests already
 * started keep the table they captured.
 */
public final class Router {

    private static final Logger log = LoggerFactory.getLogger(Router.class);

    private final ProviderRegistry registry;
    private final RetryExecutor retryExecutor;
    private final ScheduledExecutorService scheduler;
    private final GatewayTelemetry telemetry;
    private final Clock clock;
    private final AtomicReference<RoutingTable> table;

    public Router(
            ProviderRegistry registry,
            RetryExecutor retryExecutor,
            ScheduledExecutorService scheduler,
            GatewayTelemetry telemetry,
            RoutingTable initialTable,
            Clock clock
    ) {
        this.registry = Objects.requireNonNull(registry, "Registry is required");
        this.retryExecutor = Objects.requireNonNull(retryExecutor, "Retry executor is required");
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler is required");
        this.telemetry = telemetry != null ? telemetry : GatewayTelemetry.NOOP;
        this.table = new AtomicReference<>(Objects.requireNonNull(initialTable, "Routing table is required"));
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Routes the request to a provider.
     *
     * @return a future completing with the provider's response, or exceptionally
     *         with a {@link GatewayException}
     */
    public CompletableFuture<CanonicalResponse> route(CanonicalRequest request) {
        RoutingTable current = table.get();
        ProviderRegistry.Snapshot providers = registry.snapshot();

        CandidateResolver.Resolution resolution = CandidateResolver.resolve(request, current, providers);
        if (resolution.isEmpty()) {
            return reject(request, GatewayException.modelNotFound(request.model()));
        }

        CandidateResolver.Resolution available = resolution.withoutOpen();
        if (available.isEmpty()) {
            return reject(request, GatewayException.noHealthyProviders(request.model(), List.of()));
        }

        Duration budget = request.deadline() != null ? request.deadline() : current.getDefaultDeadline();
        log.debug("Routing request: requestId={}, model={}, rule={}, candidates={}, deadline={}ms",
                request.requestId(), request.model(),
                resolution.rule() != null ? resolution.rule().id() : "default",
                available.all().size(), budget.toMillis());

        return new RouteExecution(
                request, available, current, budget, retryExecutor, scheduler, telemetry, clock
        ).start();
    }

    private CompletableFuture<CanonicalResponse> reject(CanonicalRequest request, GatewayException error) {
        log.warn("Request rejected: requestId={}, model={}, kind={}",
                request.requestId(), request.model(), error.getKind());
        try {
            telemetry.onRequestCompleted(new RequestCompletedEvent(
                    request.requestId(), request.correlationId(), request.model(), null,
                    error.getKind(), List.of(), 0, Duration.ZERO, clock.instant()));
        } catch (Exception e) {
            log.error("Telemetry failed for rejected request: requestId={}", request.requestId(), e);
        }
        return CompletableFuture.failedFuture(error);
    }

    /**
     * Replaces the routing table. In-flight requests are not affected.
     */
    public void setRoutingTable(RoutingTable newTable) {
        RoutingTable old = table.getAndSet(Objects.requireNonNull(newTable, "Routing table is required"));
        log.info("Routing table replaced: rules={}, defaultStrategy={} -> {}",
                newTable.getRules().size(), old.getDefaultStrategyName(), newTable.getDefaultStrategyName());
    }

    public RoutingTable getRoutingTable() {
        return table.get();
    }

    public ProviderRegistry getRegistry() {
        return registry;
    }
}
