package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Simple round-robin load balancing strategy.
 *
 * Cycles through eligible providers in order. One cursor is kept per
 * candidate set so that requests for unrelated models do not disturb each
 * other's rotation.
 *
 * Thread-safe via atomic counters.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final Map<String, AtomicLong> cursors = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "round-robin";
    }

    @Override
    public Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context) {
        List<ProviderRef> eligible = LoadBalancingStrategy.eligible(candidates);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        long position = cursors.computeIfAbsent(context.candidateSetKey(), k -> new AtomicLong())
                .getAndIncrement();
        return Optional.of(eligible.get((int) Math.floorMod(position, (long) eligible.size())));
    }

    @Override
    public void reset() {
        cursors.clear();
    }
}
