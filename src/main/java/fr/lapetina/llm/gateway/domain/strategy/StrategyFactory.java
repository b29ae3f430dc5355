package fr.lapetina.llm.gateway.domain.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Creates load balancing strategies from the names used in routing
 * configuration. Names are case-insensitive. Every call returns a new
 * instance, so each routing table owns its cursors and latency state.
 */
public final class StrategyFactory {

    public static final String DEFAULT_STRATEGY = "round-robin";

    private static final Map<String, Supplier<LoadBalancingStrategy>> BUILT_INS = Map.of(
            "round-robin", RoundRobinStrategy::new,
            "least-latency", LeastLatencyStrategy::new,
            "least-connections", LeastConnectionsStrategy::new,
            "cost-optimized", CostOptimizedStrategy::new,
            "weighted-random", WeightedRandomStrategy::new
    );

    private StrategyFactory() {
    }

    /**
     * @return a fresh strategy, or empty when the name is unknown
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        return Optional.ofNullable(name)
                .map(StrategyFactory::normalize)
                .map(BUILT_INS::get)
                .map(Supplier::get);
    }

    /**
     * Used by config validation to reject unknown rule and default strategies.
     */
    public static boolean isRegistered(String name) {
        return name != null && BUILT_INS.containsKey(normalize(name));
    }

    public static Set<String> getRegisteredNames() {
        return BUILT_INS.keySet();
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
