package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.error.ProviderCallException;
import fr.lapetina.llm.gateway.domain.model.CallOutcome;
import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.domain.resilience.Permission;
import fr.lapetina.llm.gateway.domain.resilience.RetryPolicy;
import fr.lapetina.llm.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llm.gateway.infrastructure.provider.ProviderClient;
import fr.lapetina.llm.gateway.telemetry.AttemptEvent;
import fr.lapetina.llm.gateway.telemetry.GatewayTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs up to {@code maxAttempts} calls against one provider.
 *
 * Each attempt asks the breaker for a permission first; a denial ends the
 * loop without consuming an attempt. Every outcome is recorded on the
 * breaker, on the provider health (in-flight counter, rolling latency) and
 * on the selecting strategy. Backoff waits are scheduled, no thread sleeps.
 *
 * Thread-safe. One instance serves all requests.
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final ProviderClient client;
    private final ScheduledExecutorService scheduler;
    private final GatewayTelemetry telemetry;
    private final Clock clock;
    private final Supplier<Random> random;

    public RetryExecutor(
            ProviderClient client,
            ScheduledExecutorService scheduler,
            GatewayTelemetry telemetry,
            Clock clock,
            Supplier<Random> random
    ) {
        this.client = client;
        this.scheduler = scheduler;
        this.telemetry = telemetry != null ? telemetry : GatewayTelemetry.NOOP;
        this.clock = clock;
        this.random = random;
    }

    public RetryExecutor(ProviderClient client, ScheduledExecutorService scheduler, GatewayTelemetry telemetry) {
        this(client, scheduler, telemetry, Clock.systemUTC(), ThreadLocalRandom::current);
    }

    /**
     * Runs the retry loop without strategy feedback.
     */
    public CompletableFuture<RetryResult> execute(
            ProviderRef provider,
            CanonicalRequest request,
            RetryPolicy policy,
            AttemptScope scope
    ) {
        return execute(provider, request, policy, scope, null);
    }

    /**
     * Runs the retry loop.
     *
     * @param strategy strategy that selected the provider, receives every outcome; may be null
     * @return a future that always completes normally with the loop's result
     */
    public CompletableFuture<RetryResult> execute(
            ProviderRef provider,
            CanonicalRequest request,
            RetryPolicy policy,
            AttemptScope scope,
            LoadBalancingStrategy strategy
    ) {
        CompletableFuture<RetryResult> result = new CompletableFuture<>();
        new AttemptLoop(provider, request, policy, scope, strategy, result).attempt(1);
        return result;
    }

    /**
     * State of one retry loop. Attempts run one after the other, each started
     * from the completion of the previous one.
     */
    private final class AttemptLoop {
        private final ProviderRef provider;
        private final CanonicalRequest request;
        private final RetryPolicy policy;
        private final AttemptScope scope;
        private final LoadBalancingStrategy strategy;
        private final CompletableFuture<RetryResult> result;
        private final List<Duration> delays = new ArrayList<>();
        private Throwable lastError;

        AttemptLoop(
                ProviderRef provider,
                CanonicalRequest request,
                RetryPolicy policy,
                AttemptScope scope,
                LoadBalancingStrategy strategy,
                CompletableFuture<RetryResult> result
        ) {
            this.provider = provider;
            this.request = request;
            this.policy = policy;
            this.scope = scope;
            this.strategy = strategy;
            this.result = result;
        }

        void attempt(int attempt) {
            if (scope.isOver()) {
                finish(RetryResult.Kind.DEADLINE_EXCEEDED, attempt - 1);
                return;
            }

            CircuitBreaker breaker = provider.getCircuitBreaker();
            Permission permission = breaker.permit();
            if (!permission.isAllowed()) {
                log.debug("Attempt denied by circuit breaker: requestId={}, providerId={}, attempt={}",
                        request.requestId(), provider.getId(), attempt);
                finish(RetryResult.Kind.CIRCUIT_OPEN, attempt - 1);
                return;
            }
            if (!scope.dispatch(provider.getId())) {
                breaker.release(permission);
                finish(RetryResult.Kind.DEADLINE_EXCEEDED, attempt - 1);
                return;
            }

            Duration budget = scope.getDeadline().cap(policy.attemptTimeout());
            boolean cappedByDeadline = budget.compareTo(policy.attemptTimeout()) < 0;
            provider.getHealth().incrementInFlight();
            long start = System.nanoTime();

            log.debug("Dispatching attempt: requestId={}, providerId={}, attempt={}, timeout={}ms, probe={}",
                    request.requestId(), provider.getId(), attempt, budget.toMillis(), permission.isProbe());

            CompletableFuture<CanonicalResponse> call;
            try {
                call = client.invoke(provider.getProvider(), request, budget);
                if (call == null) {
                    call = CompletableFuture.failedFuture(
                            ProviderCallException.retryable(provider.getId(), "Provider client returned no future"));
                }
            } catch (Exception e) {
                call = CompletableFuture.failedFuture(e);
            }

            CompletableFuture<CanonicalResponse> timed = call.orTimeout(budget.toMillis(), TimeUnit.MILLISECONDS);
            scope.track(timed);
            timed.whenComplete((response, error) -> {
                scope.untrack(timed);
                onAttemptComplete(attempt, permission, cappedByDeadline, start, response, error);
            });
        }

        private void onAttemptComplete(
                int attempt,
                Permission permission,
                boolean cappedByDeadline,
                long startNanos,
                CanonicalResponse response,
                Throwable error
        ) {
            provider.getHealth().decrementInFlight();
            Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
            CircuitBreaker breaker = provider.getCircuitBreaker();

            if (error != null && isAbandoned(error, cappedByDeadline)) {
                // No outcome: the request gave up on this call
                breaker.release(permission);
                log.debug("Attempt abandoned: requestId={}, providerId={}, attempt={}",
                        request.requestId(), provider.getId(), attempt);
                finish(RetryResult.Kind.DEADLINE_EXCEEDED, attempt);
                return;
            }

            CallOutcome outcome;
            ProviderCallException failure = null;
            if (error == null) {
                outcome = CallOutcome.success(latency, response != null ? response.tokenCount() : 0);
            } else {
                failure = ProviderCallException.classify(provider.getId(), error);
                outcome = CallOutcome.failure(failure.getFailureKind(), failure.isProviderAttributable(), latency);
                lastError = failure;
            }

            breaker.recordOutcome(permission, outcome);
            if (outcome.isSuccess() || outcome.providerAttributable()) {
                provider.getHealth().recordLatency(latency);
            }
            feedStrategy(outcome);
            telemetry.onAttempt(new AttemptEvent(
                    request.requestId(),
                    request.correlationId(),
                    provider.getId(),
                    request.model(),
                    outcome.failureKind(),
                    latency,
                    attempt,
                    breaker.getState(),
                    clock.instant()
            ));

            if (failure == null) {
                log.debug("Attempt succeeded: requestId={}, providerId={}, attempt={}, latency={}ms",
                        request.requestId(), provider.getId(), attempt, latency.toMillis());
                result.complete(RetryResult.success(provider.getId(), response, attempt, delays));
                return;
            }

            if (!failure.isRetryable()) {
                log.warn("Non-retryable provider error: requestId={}, providerId={}, attempt={}, error={}",
                        request.requestId(), provider.getId(), attempt, failure.getMessage());
                finish(RetryResult.Kind.NON_RETRYABLE, attempt);
                return;
            }

            if (attempt >= policy.maxAttempts()) {
                log.warn("Retries exhausted: requestId={}, providerId={}, attempts={}, lastError={}",
                        request.requestId(), provider.getId(), attempt, failure.getMessage());
                finish(RetryResult.Kind.RETRIES_EXHAUSTED, attempt);
                return;
            }

            Duration delay = policy.jitteredDelay(attempt, random.get());
            delays.add(delay);
            log.info("Retrying request: requestId={}, providerId={}, attempt={}/{}, delay={}ms, error={}",
                    request.requestId(), provider.getId(), attempt, policy.maxAttempts(),
                    delay.toMillis(), failure.getMessage());
            backoff(attempt, delay);
        }

        private boolean isAbandoned(Throwable error, boolean cappedByDeadline) {
            if (ProviderCallException.isCancellation(error) || scope.isCancelled()) {
                return true;
            }
            // An attempt cut short by the request deadline says nothing about the provider
            return ProviderCallException.unwrap(error) instanceof TimeoutException
                    && (cappedByDeadline || scope.getDeadline().isExpired());
        }

        private void backoff(int attempt, Duration delay) {
            CompletableFuture<Void> wait = new CompletableFuture<>();
            ScheduledFuture<?> timer = scheduler.schedule(
                    () -> wait.complete(null), delay.toMillis(), TimeUnit.MILLISECONDS);
            scope.track(wait);
            wait.whenComplete((ignored, error) -> {
                scope.untrack(wait);
                if (error != null) {
                    timer.cancel(false);
                    finish(RetryResult.Kind.DEADLINE_EXCEEDED, attempt);
                } else {
                    attempt(attempt + 1);
                }
            });
        }

        private void feedStrategy(CallOutcome outcome) {
            if (strategy == null) {
                return;
            }
            try {
                strategy.recordResult(provider, outcome);
            } catch (Exception e) {
                log.error("Strategy feedback failed: strategy={}, providerId={}",
                        strategy.getName(), provider.getId(), e);
            }
        }

        private void finish(RetryResult.Kind kind, int attempts) {
            result.complete(RetryResult.failure(kind, provider.getId(), attempts, delays, lastError));
        }
    }
}
