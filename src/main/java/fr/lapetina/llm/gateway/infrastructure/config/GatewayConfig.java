package fr.lapetina.llm.gateway.infrastructure.config;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration object for the gateway.
 * Designed to be populated from YAML; durations are in milliseconds.
 */
public class GatewayConfig {

    private List<ProviderConfig> providers = new ArrayList<>();
    private RoutingConfig routing = new RoutingConfig();
    private RetryConfig retry = new RetryConfig();
    private CircuitBreakerSettings circuitBreaker = new CircuitBreakerSettings();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private TelemetryConfig telemetry = new TelemetryConfig();
    private MetricsConfig metrics = new MetricsConfig();

    // Getters and Setters
    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public RoutingConfig getRouting() { return routing; }
    public void setRouting(RoutingConfig routing) { this.routing = routing; }

    public RetryConfig getRetry() { return retry; }
    public void setRetry(RetryConfig retry) { this.retry = retry; }

    public CircuitBreakerSettings getCircuitBreaker() { return circuitBreaker; }
    public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) { this.circuitBreaker = circuitBreaker; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public TelemetryConfig getTelemetry() { return telemetry; }
    public void setTelemetry(TelemetryConfig telemetry) { this.telemetry = telemetry; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    /**
     * Individual provider configuration.
     */
    public static class ProviderConfig {
        private String id;
        private String kind = "openai-compatible";
        private String url;
        private List<String> models = new ArrayList<>();
        private int maxConcurrentRequests = 100;
        private int maxContextTokens = 0;
        private int weight = 1;
        private double costPer1kTokens = 0.0;
        private boolean enabled = true;
        private Map<String, String> properties = new HashMap<>();
        private RetryConfig retry;
        private CircuitBreakerSettings circuitBreaker;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getKind() { return kind; }
        public void setKind(String kind) { this.kind = kind; }

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public List<String> getModels() { return models; }
        public void setModels(List<String> models) { this.models = models; }

        public int getMaxConcurrentRequests() { return maxConcurrentRequests; }
        public void setMaxConcurrentRequests(int maxConcurrentRequests) { this.maxConcurrentRequests = maxConcurrentRequests; }

        public int getMaxContextTokens() { return maxContextTokens; }
        public void setMaxContextTokens(int maxContextTokens) { this.maxContextTokens = maxContextTokens; }

        public int getWeight() { return weight; }
        public void setWeight(int weight) { this.weight = weight; }

        public double getCostPer1kTokens() { return costPer1kTokens; }
        public void setCostPer1kTokens(double costPer1kTokens) { this.costPer1kTokens = costPer1kTokens; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Map<String, String> getProperties() { return properties; }
        public void setProperties(Map<String, String> properties) { this.properties = properties; }

        /** Per-provider override, null to use the global policy. */
        public RetryConfig getRetry() { return retry; }
        public void setRetry(RetryConfig retry) { this.retry = retry; }

        /** Per-provider override, null to use the global thresholds. */
        public CircuitBreakerSettings getCircuitBreaker() { return circuitBreaker; }
        public void setCircuitBreaker(CircuitBreakerSettings circuitBreaker) { this.circuitBreaker = circuitBreaker; }
    }

    /**
     * Routing rules and default strategy.
     */
    public static class RoutingConfig {
        private String strategy = "round-robin";
        private long defaultDeadlineMs = 60_000;
        private List<RuleConfig> rules = new ArrayList<>();

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }

        public long getDefaultDeadlineMs() { return defaultDeadlineMs; }
        public void setDefaultDeadlineMs(long defaultDeadlineMs) { this.defaultDeadlineMs = defaultDeadlineMs; }

        public List<RuleConfig> getRules() { return rules; }
        public void setRules(List<RuleConfig> rules) { this.rules = rules; }
    }

    /**
     * One routing rule. Exactly one of {@code providers} and {@code strategy} is set.
     */
    public static class RuleConfig {
        private String id;
        private int priority = 100;
        private String model = "*";
        private String tenant;
        private Map<String, String> tags = new HashMap<>();
        private List<String> providers = new ArrayList<>();
        private String strategy;

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getTenant() { return tenant; }
        public void setTenant(String tenant) { this.tenant = tenant; }

        public Map<String, String> getTags() { return tags; }
        public void setTags(Map<String, String> tags) { this.tags = tags; }

        public List<String> getProviders() { return providers; }
        public void setProviders(List<String> providers) { this.providers = providers; }

        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
    }

    /**
     * Retry configuration.
     */
    public static class RetryConfig {
        private int maxAttempts = 3;
        private long baseDelayMs = 100;
        private long maxDelayMs = 10_000;
        private double multiplier = 2.0;
        private double jitter = 0.25;
        private long attemptTimeoutMs = 30_000;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public void setBaseDelayMs(long baseDelayMs) { this.baseDelayMs = baseDelayMs; }

        public long getMaxDelayMs() { return maxDelayMs; }
        public void setMaxDelayMs(long maxDelayMs) { this.maxDelayMs = maxDelayMs; }

        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }

        public double getJitter() { return jitter; }
        public void setJitter(double jitter) { this.jitter = jitter; }

        public long getAttemptTimeoutMs() { return attemptTimeoutMs; }
        public void setAttemptTimeoutMs(long attemptTimeoutMs) { this.attemptTimeoutMs = attemptTimeoutMs; }
    }

    /**
     * Circuit breaker thresholds.
     */
    public static class CircuitBreakerSettings {
        private int failureThreshold = 5;
        private int successThreshold = 3;
        private long openTimeoutMs = 30_000;

        public int getFailureThreshold() { return failureThreshold; }
        public void setFailureThreshold(int failureThreshold) { this.failureThreshold = failureThreshold; }

        public int getSuccessThreshold() { return successThreshold; }
        public void setSuccessThreshold(int successThreshold) { this.successThreshold = successThreshold; }

        public long getOpenTimeoutMs() { return openTimeoutMs; }
        public void setOpenTimeoutMs(long openTimeoutMs) { this.openTimeoutMs = openTimeoutMs; }
    }

    /**
     * Health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 30_000;
        private long timeoutMs = 5_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    /**
     * Telemetry pipeline configuration.
     */
    public static class TelemetryConfig {
        private boolean enabled = true;
        private int ringBufferSize = 4096;
        private String waitStrategy = "blocking";
        private boolean logEvents = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }

        public boolean isLogEvents() { return logEvents; }
        public void setLogEvents(boolean logEvents) { this.logEvents = logEvents; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "llm_gateway";
        private boolean jvmMetrics = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public boolean isJvmMetrics() { return jvmMetrics; }
        public void setJvmMetrics(boolean jvmMetrics) { this.jvmMetrics = jvmMetrics; }
    }
}
