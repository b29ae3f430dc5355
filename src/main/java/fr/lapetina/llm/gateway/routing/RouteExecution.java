package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.error.GatewayErrorKind;
import fr.lapetina.llm.gateway.domain.error.GatewayException;
import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.SelectionContext;
import fr.lapetina.llm.gateway.telemetry.GatewayTelemetry;
import fr.lapetina.llm.gateway.telemetry.RequestCompletedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Fail-over loop of one request over its resolved candidates.
 *
 * Providers are tried one at a time, each at most once. The request
 * completes exactly once: on the first success, on a terminal error, when
 * candidates run out, or when the deadline timer fires, whichever comes first.
 */
final class RouteExecution {

    private static final Logger log = LoggerFactory.getLogger(RouteExecution.class);

    private final CanonicalRequest request;
    private final CandidateResolver.Resolution resolution;
    private final RoutingTable table;
    private final RetryExecutor retryExecutor;
    private final ScheduledExecutorService scheduler;
    private final GatewayTelemetry telemetry;
    private final Clock clock;
    private final SelectionContext context;
    private final AttemptScope scope;
    private final long startNanos = System.nanoTime();

    private final CompletableFuture<CanonicalResponse> result = new CompletableFuture<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);
    private final Set<String> tried = new HashSet<>();
    private volatile Throwable lastError;
    private volatile String currentProvider;
    private volatile ScheduledFuture<?> deadlineTimer;

    RouteExecution(
            CanonicalRequest request,
            CandidateResolver.Resolution resolution,
            RoutingTable table,
            Duration budget,
            RetryExecutor retryExecutor,
            ScheduledExecutorService scheduler,
            GatewayTelemetry telemetry,
            Clock clock
    ) {
        this.request = request;
        this.resolution = resolution;
        this.table = table;
        this.retryExecutor = retryExecutor;
        this.scheduler = scheduler;
        this.telemetry = telemetry;
        this.clock = clock;
        this.context = SelectionContext.of(request.model(), resolution.pool(), request.hints());
        this.scope = new AttemptScope(Deadline.after(budget));
    }

    CompletableFuture<CanonicalResponse> start() {
        deadlineTimer = scheduler.schedule(
                this::onDeadline, scope.getDeadline().remaining().toMillis(), TimeUnit.MILLISECONDS);
        next();
        return result;
    }

    private void next() {
        if (finished.get()) {
            return;
        }
        if (scope.isOver()) {
            finish(null, GatewayException.timeout(currentProvider, attempted(), lastError));
            return;
        }

        ProviderRef provider = pick();
        if (provider == null) {
            exhausted();
            return;
        }

        tried.add(provider.getId());
        currentProvider = provider.getId();
        log.debug("Provider selected: requestId={}, providerId={}, strategy={}, tried={}",
                request.requestId(), provider.getId(), resolution.strategy().getName(), tried.size());

        retryExecutor.execute(provider, request, table.retryPolicyFor(provider.getId()), scope, resolution.strategy())
                .whenComplete((retryResult, error) -> {
                    if (error != null) {
                        log.error("Retry loop failed unexpectedly: requestId={}, providerId={}",
                                request.requestId(), provider.getId(), error);
                        finish(null, GatewayException.providerError(provider.getId(), attempted(), error));
                    } else {
                        onResult(provider, retryResult);
                    }
                });
    }

    private ProviderRef pick() {
        for (ProviderRef ref : resolution.head()) {
            if (!tried.contains(ref.getId()) && !ref.isOpen()) {
                return ref;
            }
        }

        List<ProviderRef> remaining = resolution.pool().stream()
                .filter(ref -> !tried.contains(ref.getId()))
                .collect(Collectors.toList());
        if (!remaining.isEmpty()) {
            LoadBalancingStrategy strategy = resolution.strategy();
            // Fail-over picks rotate on their own key and leave the full pool's cursor alone
            SelectionContext pickContext = remaining.size() == resolution.pool().size()
                    ? context
                    : SelectionContext.of(request.model(), remaining, request.hints());
            Optional<ProviderRef> selected = strategy.select(remaining, pickContext);
            if (selected.isPresent()) {
                return selected.get();
            }
        }

        for (ProviderRef ref : resolution.tail()) {
            if (!tried.contains(ref.getId()) && !ref.isOpen()) {
                return ref;
            }
        }
        return null;
    }

    private void onResult(ProviderRef provider, RetryResult retryResult) {
        if (retryResult.lastError() != null) {
            lastError = retryResult.lastError();
        }

        switch (retryResult.kind()) {
            case SUCCESS -> finish(retryResult.response(), null);
            case NON_RETRYABLE -> finish(null,
                    GatewayException.providerError(provider.getId(), attempted(), retryResult.lastError()));
            case DEADLINE_EXCEEDED -> finish(null,
                    GatewayException.timeout(provider.getId(), attempted(), lastError));
            case CIRCUIT_OPEN, RETRIES_EXHAUSTED -> {
                log.info("Failing over: requestId={}, fromProvider={}, reason={}, attempts={}",
                        request.requestId(), provider.getId(), retryResult.kind(), retryResult.attempts());
                next();
            }
        }
    }

    private void exhausted() {
        List<String> attempted = attempted();
        if (attempted.isEmpty()) {
            finish(null, GatewayException.noHealthyProviders(request.model(), attempted));
        } else {
            finish(null, GatewayException.retriesExhausted(attempted, lastError));
        }
    }

    private void onDeadline() {
        if (finished.get()) {
            return;
        }
        // Cancel before reading the attempted providers: no call is sent after cancel() returns.
        // The pending call or backoff is aborted and releases its permission and in-flight slot.
        scope.cancel();
        finish(null, GatewayException.timeout(currentProvider, attempted(), lastError));
    }

    /**
     * Providers a call was actually sent to, including one still pending.
     */
    private List<String> attempted() {
        return scope.getDispatchedProviders();
    }

    private boolean finish(CanonicalResponse response, GatewayException error) {
        if (!finished.compareAndSet(false, true)) {
            return false;
        }
        ScheduledFuture<?> timer = deadlineTimer;
        if (timer != null) {
            timer.cancel(false);
        }

        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        GatewayErrorKind errorKind = error != null ? error.getKind() : null;
        String providerId = response != null ? response.providerId()
                : error.getProviderId() != null ? error.getProviderId() : currentProvider;
        emitCompleted(providerId, errorKind, latency);

        if (error == null) {
            log.debug("Request routed: requestId={}, providerId={}, attempts={}, latency={}ms",
                    request.requestId(), providerId, scope.getDispatchCount(), latency.toMillis());
            result.complete(response);
        } else {
            log.warn("Request failed: requestId={}, model={}, kind={}, attempted={}, latency={}ms",
                    request.requestId(), request.model(), errorKind, attempted(), latency.toMillis());
            result.completeExceptionally(error);
        }
        return true;
    }

    private void emitCompleted(String providerId, GatewayErrorKind errorKind, Duration latency) {
        try {
            telemetry.onRequestCompleted(new RequestCompletedEvent(
                    request.requestId(),
                    request.correlationId(),
                    request.model(),
                    providerId,
                    errorKind,
                    attempted(),
                    scope.getDispatchCount(),
                    latency,
                    clock.instant()
            ));
        } catch (Exception e) {
            log.error("Telemetry failed for completed request: requestId={}", request.requestId(), e);
        }
    }
}
