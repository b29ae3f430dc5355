package fr.lapetina.llm.gateway;

import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.infrastructure.config.ConfigLoader;
import fr.lapetina.llm.gateway.infrastructure.config.GatewayConfig;
import fr.lapetina.llm.gateway.infrastructure.config.GatewaySnapshot;
import fr.lapetina.llm.gateway.infrastructure.health.ProviderHealthMonitor;
import fr.lapetina.llm.gateway.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.llm.gateway.infrastructure.provider.ProviderClient;
import fr.lapetina.llm.gateway.infrastructure.registry.ProviderRegistry;
import fr.lapetina.llm.gateway.routing.RetryExecutor;
import fr.lapetina.llm.gateway.routing.Router;
import fr.lapetina.llm.gateway.telemetry.GatewayTelemetry;
import fr.lapetina.llm.gateway.telemetry.TelemetryPipeline;
import fr.lapetina.llm.gateway.telemetry.handlers.LoggingTelemetryHandler;
import fr.lapetina.llm.gateway.telemetry.handlers.MetricsTelemetryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Fully-wired gateway built from configuration.
 * This is the primary entry point of the routing core.
 *
 * <p>Usage:
 * <pre>{@code
 * try (LlmGateway gateway = LlmGateway.create("gateway.yaml", clients).start()) {
 *     CanonicalResponse response = gateway.route(CanonicalRequest.of("gpt-4o", payload)).join();
 * }
 * }</pre>
 *
 * Instances share no state; several gateways may live in one JVM.
 */
public class LlmGateway implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(LlmGateway.class);

    private final ConfigLoader configLoader;
    private final GatewayConfig config;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final MetricsRegistry metricsRegistry;
    private final TelemetryPipeline telemetryPipeline;
    private final GatewayTelemetry telemetry;
    private final ProviderRegistry providerRegistry;
    private final Router router;
    private final ProviderHealthMonitor healthMonitor;
    private final AtomicReference<GatewaySnapshot> snapshot = new AtomicReference<>();
    private final AtomicBoolean running = new AtomicBoolean(false);

    /**
     * @param configLoader loader to watch for reloads, null when the config was given directly
     */
    protected LlmGateway(ConfigLoader configLoader, GatewayConfig config, ProviderClient client, Clock clock) {
        this.configLoader = configLoader;
        this.config = Objects.requireNonNull(config, "Config is required");
        this.clock = clock != null ? clock : Clock.systemUTC();
        Objects.requireNonNull(client, "Provider client is required");

        GatewaySnapshot initial = GatewaySnapshot.fromConfig(config);

        this.scheduler = Executors.newScheduledThreadPool(2, new SchedulerThreadFactory());

        // Metrics and telemetry first: the registry reports breaker transitions into them
        this.metricsRegistry = config.getMetrics().isEnabled()
                ? new MetricsRegistry(config.getMetrics().getPrefix(), config.getMetrics().isJvmMetrics())
                : null;
        this.telemetryPipeline = createTelemetryPipeline(config.getTelemetry());
        this.telemetry = telemetryPipeline != null ? telemetryPipeline : GatewayTelemetry.NOOP;

        this.providerRegistry = new ProviderRegistry(
                this.clock, initial.defaultBreakerConfig(), telemetry.asBreakerListener(this.clock));
        if (metricsRegistry != null) {
            providerRegistry.addListener(this::onRegistryEvent);
        }

        RetryExecutor retryExecutor = new RetryExecutor(client, scheduler, telemetry);
        this.router = new Router(
                providerRegistry, retryExecutor, scheduler, telemetry, initial.routingTable(), this.clock);

        GatewayConfig.HealthCheckConfig health = config.getHealthCheck();
        this.healthMonitor = health.isEnabled()
                ? new ProviderHealthMonitor(
                        providerRegistry,
                        client,
                        scheduler,
                        Duration.ofMillis(health.getIntervalMs()),
                        Duration.ofMillis(health.getTimeoutMs()))
                : null;

        applySnapshot(initial);

        if (configLoader != null) {
            configLoader.addListener(this::onConfigChanged);
        }

        log.info("LlmGateway initialized: providers={}, strategy={}, telemetry={}, metrics={}",
                providerRegistry.size(), initial.routingTable().getDefaultStrategyName(),
                telemetryPipeline != null, metricsRegistry != null);
    }

    /**
     * Creates a gateway from the specified configuration file (file system or classpath).
     *
     * @throws ConfigLoader.ConfigurationException if the configuration cannot be loaded or is invalid
     */
    public static LlmGateway create(String configPath, ProviderClient client) {
        log.info("Initializing LlmGateway from config: {}", configPath);
        ConfigLoader loader = new ConfigLoader(configPath);
        GatewayConfig config = loader.load();
        return new LlmGateway(loader, config, client, Clock.systemUTC());
    }

    /**
     * Creates a gateway from an in-memory configuration, without hot reload.
     */
    public static LlmGateway create(GatewayConfig config, ProviderClient client) {
        return new LlmGateway(null, config, client, Clock.systemUTC());
    }

    private TelemetryPipeline createTelemetryPipeline(GatewayConfig.TelemetryConfig telemetryConfig) {
        if (!telemetryConfig.isEnabled()) {
            return null;
        }
        TelemetryPipeline.Builder builder = TelemetryPipeline.builder()
                .ringBufferSize(telemetryConfig.getRingBufferSize())
                .waitStrategy(telemetryConfig.getWaitStrategy())
                .metricsRegistry(metricsRegistry);
        if (telemetryConfig.isLogEvents()) {
            builder.handler(new LoggingTelemetryHandler());
        }
        if (metricsRegistry != null) {
            builder.handler(new MetricsTelemetryHandler(metricsRegistry));
        }
        return builder.build();
    }

    /**
     * Starts telemetry, health monitoring and config watching.
     */
    public LlmGateway start() {
        if (running.compareAndSet(false, true)) {
            if (telemetryPipeline != null) {
                telemetryPipeline.start();
            }
            if (healthMonitor != null) {
                healthMonitor.start();
            }
            if (configLoader != null) {
                configLoader.startWatching();
            }
            log.info("LlmGateway started");
        }
        return this;
    }

    /**
     * Routes a request to a provider.
     *
     * @return future completing with the response, or exceptionally with a
     *         {@link fr.lapetina.llm.gateway.domain.error.GatewayException}
     */
    public CompletableFuture<CanonicalResponse> route(CanonicalRequest request) {
        if (!running.get()) {
            return CompletableFuture.failedFuture(new IllegalStateException("Gateway not running"));
        }
        return router.route(request);
    }

    /**
     * Activates a new configuration snapshot. Providers kept by id keep their
     * health state; requests already in flight finish on the snapshot they started with.
     */
    public void applySnapshot(GatewaySnapshot next) {
        Objects.requireNonNull(next, "Snapshot is required");
        providerRegistry.setDefaultBreakerConfig(next.defaultBreakerConfig());
        providerRegistry.replaceAll(next.providers(), next.breakerOverrides());
        router.setRoutingTable(next.routingTable());
        GatewaySnapshot previous = snapshot.getAndSet(next);
        log.info("Gateway snapshot applied: providers={}, rules={}, replacedPrevious={}",
                next.providers().size(), next.routingTable().getRules().size(), previous != null);
    }

    private void onConfigChanged(GatewayConfig oldConfig, GatewayConfig newConfig) {
        log.info("Configuration changed, applying updates...");
        try {
            applySnapshot(GatewaySnapshot.fromConfig(newConfig));
            log.info("Configuration updates applied");
        } catch (RuntimeException e) {
            log.error("Failed to apply configuration, keeping current snapshot: error={}", e.getMessage(), e);
        }
    }

    private void onRegistryEvent(ProviderRegistry.RegistryEvent event) {
        String providerId = event.provider().getId();
        switch (event.type()) {
            case ADDED -> metricsRegistry.registerProvider(
                    providerId, () -> providerRegistry.get(providerId).orElse(null));
            case REMOVED -> metricsRegistry.unregisterProvider(providerId);
            case UPDATED -> log.debug("Provider metrics kept across update: providerId={}", providerId);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Router getRouter() {
        return router;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public Optional<MetricsRegistry> getMetricsRegistry() {
        return Optional.ofNullable(metricsRegistry);
    }

    public Optional<TelemetryPipeline> getTelemetryPipeline() {
        return Optional.ofNullable(telemetryPipeline);
    }

    public Optional<ProviderHealthMonitor> getHealthMonitor() {
        return Optional.ofNullable(healthMonitor);
    }

    public GatewaySnapshot getSnapshot() {
        return snapshot.get();
    }

    public GatewayConfig getConfig() {
        return configLoader != null && configLoader.getCurrentConfig() != null
                ? configLoader.getCurrentConfig()
                : config;
    }

    public Optional<ConfigLoader> getConfigLoader() {
        return Optional.ofNullable(configLoader);
    }

    @Override
    public void close() {
        log.info("Shutting down LlmGateway...");
        running.set(false);

        if (configLoader != null) {
            try {
                configLoader.close();
            } catch (Exception e) {
                log.warn("Error closing config loader", e);
            }
        }

        if (healthMonitor != null) {
            try {
                healthMonitor.close();
            } catch (Exception e) {
                log.warn("Error closing health monitor", e);
            }
        }

        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }

        if (telemetryPipeline != null) {
            try {
                telemetryPipeline.close();
            } catch (Exception e) {
                log.warn("Error closing telemetry pipeline", e);
            }
        }

        if (metricsRegistry != null) {
            try {
                metricsRegistry.close();
            } catch (Exception e) {
                log.warn("Error closing metrics registry", e);
            }
        }

        log.info("LlmGateway shut down");
    }

    /**
     * Daemon threads for backoff waits, deadline timers and health checks.
     */
    private static final class SchedulerThreadFactory implements java.util.concurrent.ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "gateway-scheduler-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
