package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Selects the provider with the lowest rolling latency.
 *
 * Providers without any latency sample count as zero so they get tried early.
 * Ties are broken round-robin.
 */
public final class LeastLatencyStrategy implements LoadBalancingStrategy {

    private final Map<String, AtomicLong> tieBreakers = new ConcurrentHashMap<>();

    @Override
    public String getName() {
        return "least-latency";
    }

    @Override
    public Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context) {
        List<ProviderRef> eligible = LoadBalancingStrategy.eligible(candidates);
        if (eligible.isEmpty()) {
            return Optional.empty();
        }

        double best = Double.MAX_VALUE;
        List<ProviderRef> fastest = new ArrayList<>();
        for (ProviderRef ref : eligible) {
            double latency = ref.getHealth().getRollingLatencyMillis();
            if (latency < best) {
                best = latency;
                fastest.clear();
                fastest.add(ref);
            } else if (latency == best) {
                fastest.add(ref);
            }
        }

        if (fastest.size() == 1) {
            return Optional.of(fastest.get(0));
        }
        long position = tieBreakers.computeIfAbsent(context.candidateSetKey(), k -> new AtomicLong())
                .getAndIncrement();
        return Optional.of(fastest.get((int) Math.floorMod(position, (long) fastest.size())));
    }

    @Override
    public void reset() {
        tieBreakers.clear();
    }
}
