package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.resilience.RetryPolicy;
import fr.lapetina.llm.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llm.gateway.domain.strategy.StrategyFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable routing configuration: rules, strategies, retry policies and
 * the default deadline. The router swaps the whole table atomically;
 * a request keeps the table it started with.
 *
 * Strategy instances are created once per table so their cursors are
 * shared by all requests routed through it.
 */
public final class RoutingTable {

    public static final Duration DEFAULT_DEADLINE = Duration.ofSeconds(60);

    private final List<RoutingRule> rules;
    private final String defaultStrategyName;
    private final Map<String, LoadBalancingStrategy> strategies;
    private final RetryPolicy defaultRetryPolicy;
    private final Map<String, RetryPolicy> providerRetryPolicies;
    private final Duration defaultDeadline;

    private RoutingTable(Builder builder) {
        List<RoutingRule> sorted = new ArrayList<>(builder.rules);
        // Stable sort: equal priorities keep declaration order
        sorted.sort(Comparator.comparingInt(RoutingRule::priority));
        this.rules = List.copyOf(sorted);
        this.defaultStrategyName = builder.defaultStrategy;
        this.defaultRetryPolicy = Objects.requireNonNull(builder.defaultRetryPolicy, "Retry policy is required");
        this.providerRetryPolicies = Map.copyOf(builder.providerRetryPolicies);
        this.defaultDeadline = Objects.requireNonNull(builder.defaultDeadline, "Default deadline is required");

        Map<String, LoadBalancingStrategy> created = new HashMap<>();
        created.put(defaultStrategyName, createStrategy(defaultStrategyName));
        for (RoutingRule rule : rules) {
            if (rule.strategy() != null) {
                created.computeIfAbsent(rule.strategy(), RoutingTable::createStrategy);
            }
        }
        this.strategies = Map.copyOf(created);
    }

    private static LoadBalancingStrategy createStrategy(String name) {
        return StrategyFactory.create(name)
                .orElseThrow(() -> new IllegalArgumentException("Unknown load balancing strategy: " + name));
    }

    /**
     * First rule matching the request, by ascending priority.
     */
    public Optional<RoutingRule> match(CanonicalRequest request) {
        for (RoutingRule rule : rules) {
            if (rule.matches(request)) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    public LoadBalancingStrategy defaultStrategy() {
        return strategies.get(defaultStrategyName);
    }

    /**
     * Strategy of the rule, or the default one for chain rules and unmatched requests.
     */
    public LoadBalancingStrategy strategyFor(RoutingRule rule) {
        if (rule == null || rule.strategy() == null) {
            return defaultStrategy();
        }
        return strategies.get(rule.strategy());
    }

    public RetryPolicy retryPolicyFor(String providerId) {
        return providerRetryPolicies.getOrDefault(providerId, defaultRetryPolicy);
    }

    public List<RoutingRule> getRules() {
        return rules;
    }

    public RetryPolicy getDefaultRetryPolicy() {
        return defaultRetryPolicy;
    }

    public Duration getDefaultDeadline() {
        return defaultDeadline;
    }

    public String getDefaultStrategyName() {
        return defaultStrategyName;
    }

    public static RoutingTable defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<RoutingRule> rules = new ArrayList<>();
        private String defaultStrategy = StrategyFactory.DEFAULT_STRATEGY;
        private RetryPolicy defaultRetryPolicy = RetryPolicy.DEFAULT;
        private final Map<String, RetryPolicy> providerRetryPolicies = new HashMap<>();
        private Duration defaultDeadline = DEFAULT_DEADLINE;

        public Builder rule(RoutingRule rule) {
            this.rules.add(rule);
            return this;
        }

        public Builder rules(List<RoutingRule> rules) {
            this.rules.addAll(rules);
            return this;
        }

        public Builder defaultStrategy(String name) {
            this.defaultStrategy = name;
            return this;
        }

        public Builder retryPolicy(RetryPolicy policy) {
            this.defaultRetryPolicy = policy;
            return this;
        }

        public Builder retryPolicy(String providerId, RetryPolicy policy) {
            this.providerRetryPolicies.put(providerId, policy);
            return this;
        }

        public Builder defaultDeadline(Duration deadline) {
            this.defaultDeadline = deadline;
            return this;
        }

        public RoutingTable build() {
            return new RoutingTable(this);
        }
    }
}
