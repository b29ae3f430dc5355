package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Weighted random load balancing strategy.
 *
 * A provider with weight 2 is picked twice as often as one with weight 1.
 * Weight 0 providers are only picked when every eligible weight is 0.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class WeightedRandomStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "weighted-random";
    }

    @Override
    public Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context) {
        List<ProviderRef> eligible = LoadBalancingStrategy.eligible(candidates);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        long totalWeight = 0;
        for (ProviderRef ref : eligible) {
            totalWeight += ref.getProvider().getWeight();
        }

        ThreadLocalRandom random = ThreadLocalRandom.current();
        if (totalWeight == 0) {
            return Optional.of(eligible.get(random.nextInt(eligible.size())));
        }

        long point = random.nextLong(totalWeight);
        for (ProviderRef ref : eligible) {
            point -= ref.getProvider().getWeight();
            if (point < 0) {
                return Optional.of(ref);
            }
        }
        return Optional.of(eligible.get(eligible.size() - 1));
    }
}
