package fr.lapetina.llm.gateway.infrastructure.config;

import fr.lapetina.llm.gateway.domain.model.Provider;
import fr.lapetina.llm.gateway.domain.model.ProviderEndpoint;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreakerConfig;
import fr.lapetina.llm.gateway.domain.resilience.RetryPolicy;
import fr.lapetina.llm.gateway.routing.ModelPattern;
import fr.lapetina.llm.gateway.routing.RoutingRule;
import fr.lapetina.llm.gateway.routing.RoutingTable;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Immutable, validated configuration resolved into domain objects.
 * Activated as a whole by the gateway.
 *
 * @param breakerOverrides per-provider circuit breaker thresholds, by provider id
 */
public record GatewaySnapshot(
        List<Provider> providers,
        CircuitBreakerConfig defaultBreakerConfig,
        Map<String, CircuitBreakerConfig> breakerOverrides,
        RoutingTable routingTable
) {
    public GatewaySnapshot {
        providers = List.copyOf(providers);
        breakerOverrides = Map.copyOf(breakerOverrides);
    }

    /**
     * Validates and converts a parsed configuration.
     *
     * @throws ConfigLoader.ConfigurationException when the configuration is invalid
     */
    public static GatewaySnapshot fromConfig(GatewayConfig config) {
        ConfigValidator.validateOrThrow(config);

        List<Provider> providers = new ArrayList<>();
        Map<String, CircuitBreakerConfig> breakerOverrides = new HashMap<>();
        RoutingTable.Builder table = RoutingTable.builder()
                .defaultStrategy(config.getRouting().getStrategy())
                .retryPolicy(toRetryPolicy(config.getRetry()))
                .defaultDeadline(Duration.ofMillis(config.getRouting().getDefaultDeadlineMs()));

        for (GatewayConfig.ProviderConfig pc : nullToEmpty(config.getProviders())) {
            providers.add(toProvider(pc));
            if (pc.getCircuitBreaker() != null) {
                breakerOverrides.put(pc.getId(), toBreakerConfig(pc.getCircuitBreaker()));
            }
            if (pc.getRetry() != null) {
                table.retryPolicy(pc.getId(), toRetryPolicy(pc.getRetry()));
            }
        }

        for (GatewayConfig.RuleConfig rc : nullToEmpty(config.getRouting().getRules())) {
            table.rule(new RoutingRule(
                    rc.getId(),
                    rc.getPriority(),
                    ModelPattern.of(rc.getModel()),
                    rc.getTenant(),
                    rc.getTags(),
                    rc.getProviders(),
                    rc.getStrategy()
            ));
        }

        return new GatewaySnapshot(
                providers, toBreakerConfig(config.getCircuitBreaker()), breakerOverrides, table.build());
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static Provider toProvider(GatewayConfig.ProviderConfig pc) {
        return Provider.builder()
                .id(pc.getId())
                .models(new LinkedHashSet<>(pc.getModels()))
                .endpoint(new ProviderEndpoint(
                        pc.getKind(),
                        pc.getUrl() != null ? URI.create(pc.getUrl()) : null,
                        pc.getProperties()))
                .maxConcurrentRequests(pc.getMaxConcurrentRequests())
                .maxContextTokens(pc.getMaxContextTokens())
                .weight(pc.getWeight())
                .costPer1kTokens(pc.getCostPer1kTokens())
                .enabled(pc.isEnabled())
                .build();
    }

    static RetryPolicy toRetryPolicy(GatewayConfig.RetryConfig rc) {
        if (rc == null) {
            return RetryPolicy.DEFAULT;
        }
        return new RetryPolicy(
                rc.getMaxAttempts(),
                Duration.ofMillis(rc.getBaseDelayMs()),
                Duration.ofMillis(rc.getMaxDelayMs()),
                rc.getMultiplier(),
                rc.getJitter(),
                Duration.ofMillis(rc.getAttemptTimeoutMs())
        );
    }

    static CircuitBreakerConfig toBreakerConfig(GatewayConfig.CircuitBreakerSettings settings) {
        if (settings == null) {
            return CircuitBreakerConfig.DEFAULT;
        }
        return new CircuitBreakerConfig(
                settings.getFailureThreshold(),
                settings.getSuccessThreshold(),
                Duration.ofMillis(settings.getOpenTimeoutMs())
        );
    }
}
