package fr.lapetina.llm.gateway.support;

import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.domain.model.Provider;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.infrastructure.provider.ProviderClient;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Scriptable provider client for tests. Providers without a script answer successfully.
 */
public final class StubProviderClient implements ProviderClient {

    private final Map<String, Function<CanonicalRequest, CompletableFuture<CanonicalResponse>>> behaviors =
            new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final Map<String, Supplier<CompletableFuture<ProviderHealth>>> health = new ConcurrentHashMap<>();
    private final List<String> callOrder = new CopyOnWriteArrayList<>();
    private final List<CompletableFuture<CanonicalResponse>> pending = new CopyOnWriteArrayList<>();
    private final List<Duration> timeouts = new CopyOnWriteArrayList<>();

    public StubProviderClient respond(
            String providerId,
            Function<CanonicalRequest, CompletableFuture<CanonicalResponse>> behavior
    ) {
        behaviors.put(providerId, behavior);
        return this;
    }

    public StubProviderClient succeed(String providerId) {
        return respond(providerId, req -> CompletableFuture.completedFuture(
                CanonicalResponse.of(req, providerId, "answer from " + providerId)));
    }

    public StubProviderClient fail(String providerId, Supplier<? extends Throwable> error) {
        return respond(providerId, req -> CompletableFuture.failedFuture(error.get()));
    }

    /**
     * Fails the first {@code times} calls, then answers successfully.
     */
    public StubProviderClient failTimes(String providerId, int times, Supplier<? extends Throwable> error) {
        AtomicInteger remaining = new AtomicInteger(times);
        return respond(providerId, req -> remaining.getAndDecrement() > 0
                ? CompletableFuture.failedFuture(error.get())
                : CompletableFuture.completedFuture(CanonicalResponse.of(req, providerId, "recovered")));
    }

    /**
     * Calls never complete on their own.
     */
    public StubProviderClient hang(String providerId) {
        return respond(providerId, req -> {
            CompletableFuture<CanonicalResponse> never = new CompletableFuture<>();
            pending.add(never);
            return never;
        });
    }

    public StubProviderClient health(String providerId, ProviderHealth result) {
        health.put(providerId, () -> CompletableFuture.completedFuture(result));
        return this;
    }

    public StubProviderClient health(String providerId, Supplier<CompletableFuture<ProviderHealth>> check) {
        health.put(providerId, check);
        return this;
    }

    @Override
    public CompletableFuture<CanonicalResponse> invoke(
            Provider provider,
            CanonicalRequest request,
            Duration attemptTimeout
    ) {
        calls.computeIfAbsent(provider.getId(), id -> new AtomicInteger()).incrementAndGet();
        callOrder.add(provider.getId());
        timeouts.add(attemptTimeout);
        Function<CanonicalRequest, CompletableFuture<CanonicalResponse>> behavior = behaviors.get(provider.getId());
        if (behavior == null) {
            return CompletableFuture.completedFuture(
                    CanonicalResponse.of(request, provider.getId(), "answer from " + provider.getId()));
        }
        return behavior.apply(request);
    }

    @Override
    public CompletableFuture<ProviderHealth> healthCheck(Provider provider) {
        Supplier<CompletableFuture<ProviderHealth>> check = health.get(provider.getId());
        return check != null ? check.get() : CompletableFuture.completedFuture(ProviderHealth.HEALTHY);
    }

    public int calls(String providerId) {
        AtomicInteger count = calls.get(providerId);
        return count != null ? count.get() : 0;
    }

    public int totalCalls() {
        return callOrder.size();
    }

    public List<String> getCallOrder() {
        return List.copyOf(callOrder);
    }

    /**
     * Futures handed out by {@link #hang(String)} providers.
     */
    public List<CompletableFuture<CanonicalResponse>> getPending() {
        return List.copyOf(pending);
    }

    public List<Duration> getTimeouts() {
        return List.copyOf(timeouts);
    }
}
