package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;

import java.util.List;
import java.util.Optional;

/**
 * Least-connections load balancing strategy.
 *
 * Selects the provider with the lowest in-flight utilization. This naturally
 * adapts to varying response times and provider capacities.
 *
 * Thread-safe as it only reads atomic counters.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "least-connections";
    }

    @Override
    public Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context) {
        ProviderRef selected = null;
        int minInFlight = Integer.MAX_VALUE;
        double minRatio = Double.MAX_VALUE;

        for (ProviderRef ref : LoadBalancingStrategy.eligible(candidates)) {
            int inFlight = ref.getHealth().getInFlight();
            int maxConcurrent = ref.getProvider().getMaxConcurrentRequests();

            // Utilization ratio for fair comparison across different capacities
            double ratio = (double) inFlight / maxConcurrent;

            // Prefer lower ratio, break ties with absolute in-flight count
            if (ratio < minRatio || (ratio == minRatio && inFlight < minInFlight)) {
                minRatio = ratio;
                minInFlight = inFlight;
                selected = ref;
            }
        }

        return Optional.ofNullable(selected);
    }
}
