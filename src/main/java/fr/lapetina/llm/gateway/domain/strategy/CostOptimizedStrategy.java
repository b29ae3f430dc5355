package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.model.RoutingHints;

import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Selects the cheapest provider that satisfies the request's quality floor.
 *
 * The floor is the context size and maximum latency found in the routing
 * hints. When no candidate meets it, all eligible candidates are considered.
 * Equal costs are ordered by rolling latency.
 */
public final class CostOptimizedStrategy implements LoadBalancingStrategy {

    private static final Comparator<ProviderRef> CHEAPEST_THEN_FASTEST =
            Comparator.<ProviderRef>comparingDouble(ref -> ref.getProvider().getCostPer1kTokens())
                    .thenComparingDouble(ref -> ref.getHealth().getRollingLatencyMillis());

    @Override
    public String getName() {
        return "cost-optimized";
    }

    @Override
    public Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context) {
        List<ProviderRef> eligible = LoadBalancingStrategy.eligible(candidates);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        RoutingHints hints = context.hints();
        List<ProviderRef> qualified = eligible.stream()
                .filter(ref -> ref.getProvider().acceptsContext(hints.minContextTokens()))
                .filter(ref -> withinLatency(ref, hints.maxLatency()))
                .collect(Collectors.toList());

        List<ProviderRef> pool = qualified.isEmpty() ? eligible : qualified;
        return pool.stream().min(CHEAPEST_THEN_FASTEST);
    }

    private static boolean withinLatency(ProviderRef ref, Duration maxLatency) {
        if (maxLatency == null || !ref.getHealth().hasLatencySample()) {
            return true;
        }
        return ref.getHealth().getRollingLatencyMillis() <= maxLatency.toMillis();
    }
}
