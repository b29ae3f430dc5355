package fr.lapetina.llm.gateway.infrastructure.config;

import fr.lapetina.llm.gateway.domain.strategy.StrategyFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Semantic checks run on a parsed configuration before it may be activated.
 */
public final class ConfigValidator {

    private ConfigValidator() {
    }

    /**
     * Collects every problem found in the configuration.
     *
     * @return human-readable errors, empty when the configuration is valid
     */
    public static List<String> validate(GatewayConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("configuration is empty");
            return errors;
        }

        Set<String> providerIds = new HashSet<>();
        List<GatewayConfig.ProviderConfig> providers =
                config.getProviders() != null ? config.getProviders() : List.of();
        for (int i = 0; i < providers.size(); i++) {
            validateProvider(providers.get(i), i, providerIds, errors);
        }

        GatewayConfig.RoutingConfig routing = config.getRouting();
        if (routing == null) {
            errors.add("routing section is missing");
        } else {
            validateRouting(routing, providerIds, errors);
        }

        validateRetry("retry", config.getRetry(), errors);
        validateBreaker("circuitBreaker", config.getCircuitBreaker(), errors);

        GatewayConfig.HealthCheckConfig health = config.getHealthCheck();
        if (health != null && health.isEnabled()) {
            if (health.getIntervalMs() <= 0) {
                errors.add("healthCheck.intervalMs must be positive");
            }
            if (health.getTimeoutMs() <= 0) {
                errors.add("healthCheck.timeoutMs must be positive");
            }
        }

        GatewayConfig.TelemetryConfig telemetry = config.getTelemetry();
        if (telemetry != null && telemetry.isEnabled() && Integer.bitCount(telemetry.getRingBufferSize()) != 1) {
            errors.add("telemetry.ringBufferSize must be a power of 2: " + telemetry.getRingBufferSize());
        }
        return errors;
    }

    /**
     * Validates and throws on the first invalid configuration.
     *
     * @throws ConfigLoader.ConfigurationException listing every problem found
     */
    public static void validateOrThrow(GatewayConfig config) {
        List<String> errors = validate(config);
        if (!errors.isEmpty()) {
            throw new ConfigLoader.ConfigurationException(
                    "Invalid configuration: " + String.join("; ", errors));
        }
    }

    private static void validateProvider(
            GatewayConfig.ProviderConfig provider,
            int index,
            Set<String> providerIds,
            List<String> errors
    ) {
        String id = provider.getId();
        String where = "providers[" + index + "]";
        if (id == null || id.isBlank()) {
            errors.add(where + ".id is required");
        } else {
            where = "provider '" + id + "'";
            if (!providerIds.add(id)) {
                errors.add("duplicate provider id: " + id);
            }
        }
        if (provider.getKind() == null || provider.getKind().isBlank()) {
            errors.add(where + ": kind is required");
        }
        if (provider.getModels() == null || provider.getModels().isEmpty()) {
            errors.add(where + ": at least one model is required");
        }
        if (provider.getUrl() != null) {
            try {
                URI.create(provider.getUrl());
            } catch (IllegalArgumentException e) {
                errors.add(where + ": invalid url " + provider.getUrl());
            }
        }
        if (provider.getMaxConcurrentRequests() <= 0) {
            errors.add(where + ": maxConcurrentRequests must be positive");
        }
        if (provider.getMaxContextTokens() < 0) {
            errors.add(where + ": maxContextTokens must not be negative");
        }
        if (provider.getWeight() < 0) {
            errors.add(where + ": weight must not be negative");
        }
        if (provider.getCostPer1kTokens() < 0) {
            errors.add(where + ": costPer1kTokens must not be negative");
        }
        if (provider.getRetry() != null) {
            validateRetry(where + ".retry", provider.getRetry(), errors);
        }
        if (provider.getCircuitBreaker() != null) {
            validateBreaker(where + ".circuitBreaker", provider.getCircuitBreaker(), errors);
        }
    }

    private static void validateRouting(
            GatewayConfig.RoutingConfig routing,
            Set<String> providerIds,
            List<String> errors
    ) {
        if (!StrategyFactory.isRegistered(routing.getStrategy())) {
            errors.add("routing.strategy is unknown: " + routing.getStrategy());
        }
        if (routing.getDefaultDeadlineMs() <= 0) {
            errors.add("routing.defaultDeadlineMs must be positive");
        }

        Set<String> ruleIds = new HashSet<>();
        List<GatewayConfig.RuleConfig> rules = routing.getRules() != null ? routing.getRules() : List.of();
        for (int i = 0; i < rules.size(); i++) {
            GatewayConfig.RuleConfig rule = rules.get(i);
            String where = rule.getId() != null ? "rule '" + rule.getId() + "'" : "routing.rules[" + i + "]";
            if (rule.getId() == null || rule.getId().isBlank()) {
                errors.add(where + ".id is required");
            } else if (!ruleIds.add(rule.getId())) {
                errors.add("duplicate rule id: " + rule.getId());
            }
            if (rule.getModel() == null || rule.getModel().isBlank()) {
                errors.add(where + ": model pattern is required");
            }

            boolean hasChain = rule.getProviders() != null && !rule.getProviders().isEmpty();
            boolean hasStrategy = rule.getStrategy() != null;
            if (hasChain == hasStrategy) {
                errors.add(where + ": exactly one of providers or strategy must be set");
            }
            if (hasStrategy && !StrategyFactory.isRegistered(rule.getStrategy())) {
                errors.add(where + ": unknown strategy " + rule.getStrategy());
            }
            if (hasChain) {
                for (String providerId : rule.getProviders()) {
                    if (!providerIds.contains(providerId)) {
                        errors.add(where + ": unknown provider " + providerId);
                    }
                }
            }
        }
    }

    private static void validateRetry(String where, GatewayConfig.RetryConfig retry, List<String> errors) {
        if (retry == null) {
            return;
        }
        if (retry.getMaxAttempts() < 1) {
            errors.add(where + ".maxAttempts must be at least 1");
        }
        if (retry.getBaseDelayMs() < 0 || retry.getMaxDelayMs() < 0) {
            errors.add(where + ": delays must not be negative");
        }
        if (retry.getMaxDelayMs() < retry.getBaseDelayMs()) {
            errors.add(where + ".maxDelayMs must not be below baseDelayMs");
        }
        if (retry.getMultiplier() < 1.0) {
            errors.add(where + ".multiplier must be at least 1.0");
        }
        if (retry.getJitter() < 0.0 || retry.getJitter() > 1.0) {
            errors.add(where + ".jitter must be within [0, 1]");
        }
        if (retry.getAttemptTimeoutMs() <= 0) {
            errors.add(where + ".attemptTimeoutMs must be positive");
        }
    }

    private static void validateBreaker(
            String where,
            GatewayConfig.CircuitBreakerSettings breaker,
            List<String> errors
    ) {
        if (breaker == null) {
            return;
        }
        if (breaker.getFailureThreshold() < 1) {
            errors.add(where + ".failureThreshold must be at least 1");
        }
        if (breaker.getSuccessThreshold() < 1) {
            errors.add(where + ".successThreshold must be at least 1");
        }
        if (breaker.getOpenTimeoutMs() < 0) {
            errors.add(where + ".openTimeoutMs must not be negative");
        }
    }
}
