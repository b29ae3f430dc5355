package fr.lapetina.llm.gateway.infrastructure.health;

import fr.lapetina.llm.gateway.domain.model.ProviderHealth;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.infrastructure.provider.ProviderClient;
import fr.lapetina.llm.gateway.infrastructure.registry.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for registered providers.
 *
 * Periodically calls {@link ProviderClient#healthCheck} for every enabled
 * provider and feeds the result to its circuit breaker. A check that fails
 * or exceeds the timeout counts as UNHEALTHY.
 */
public final class ProviderHealthMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthMonitor.class);

    private final ProviderRegistry registry;
    private final ProviderClient client;
    private final ScheduledExecutorService scheduler;
    private final Duration checkInterval;
    private final Duration checkTimeout;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> task;

    /**
     * @param scheduler shared scheduler, owned by the caller
     */
    public ProviderHealthMonitor(
            ProviderRegistry registry,
            ProviderClient client,
            ScheduledExecutorService scheduler,
            Duration checkInterval,
            Duration checkTimeout
    ) {
        this.registry = registry;
        this.client = client;
        this.scheduler = scheduler;
        this.checkInterval = checkInterval;
        this.checkTimeout = checkTimeout;
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            task = scheduler.scheduleWithFixedDelay(
                    this::checkAllProviders,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health monitor started: interval={}, timeout={}", checkInterval, checkTimeout);
        }
    }

    /**
     * Checks every enabled provider once.
     *
     * @return a future completing when every check has been recorded
     */
    public CompletableFuture<Void> checkAllProviders() {
        List<ProviderRef> providers = registry.getAll().stream()
                .filter(ref -> ref.getProvider().isEnabled())
                .toList();
        log.debug("Starting health check cycle: providerCount={}", providers.size());

        CompletableFuture<?>[] checks = providers.stream()
                .map(this::checkProvider)
                .toArray(CompletableFuture[]::new);
        return CompletableFuture.allOf(checks);
    }

    /**
     * Checks a single provider and records the result on its breaker.
     */
    public CompletableFuture<ProviderHealth> checkProvider(ProviderRef ref) {
        CompletableFuture<ProviderHealth> check;
        try {
            check = client.healthCheck(ref.getProvider());
        } catch (Exception e) {
            check = CompletableFuture.failedFuture(e);
        }

        return check
                .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((health, ex) -> {
                    ProviderHealth result;
                    if (ex != null) {
                        log.warn("Health check failed: providerId={}, error={}", ref.getId(), ex.toString());
                        result = ProviderHealth.UNHEALTHY;
                    } else {
                        result = health != null ? health : ProviderHealth.UNHEALTHY;
                    }
                    ProviderHealth previous = ref.getHealth().getLastHealthCheck();
                    ref.getCircuitBreaker().recordHealthCheck(result);
                    if (previous != result) {
                        log.info("Provider health changed: providerId={}, previousHealth={}, newHealth={}, state={}",
                                ref.getId(), previous, result, ref.getCircuitState());
                    }
                    return result;
                });
    }

    /**
     * Forces a health check of one provider.
     */
    public CompletableFuture<ProviderHealth> forceCheck(String providerId) {
        return registry.get(providerId)
                .map(this::checkProvider)
                .orElseGet(() -> CompletableFuture.completedFuture(ProviderHealth.UNHEALTHY));
    }

    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            ScheduledFuture<?> current = task;
            if (current != null) {
                current.cancel(false);
            }
            log.info("Health monitor stopped");
        }
    }
}
