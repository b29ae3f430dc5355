package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.model.RoutingHints;
import fr.lapetina.llm.gateway.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.llm.gateway.infrastructure.registry.ProviderRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a request into its ordered candidate providers.
 *
 * Order: the preferred provider hint, then the matching rule's explicit
 * chain, or every provider serving the model when the request is balanced,
 * then the request's fallback hints. A provider appears once, at its first
 * position. Only enabled providers serving the requested model qualify.
 */
public final class CandidateResolver {

    private CandidateResolver() {
    }

    public static Resolution resolve(
            CanonicalRequest request,
            RoutingTable table,
            ProviderRegistry.Snapshot providers
    ) {
        String model = request.model();
        RoutingHints hints = request.hints();
        Set<String> seen = new LinkedHashSet<>();

        List<ProviderRef> head = new ArrayList<>();
        if (hints.preferredProvider() != null) {
            lookup(providers, hints.preferredProvider(), model).ifPresent(ref -> add(head, seen, ref));
        }

        RoutingRule rule = table.match(request).orElse(null);
        List<ProviderRef> pool = new ArrayList<>();
        if (rule != null && rule.isExplicitChain()) {
            for (String providerId : rule.providerChain()) {
                lookup(providers, providerId, model).ifPresent(ref -> add(head, seen, ref));
            }
        } else {
            for (ProviderRef ref : providers.providersForModel(model)) {
                add(pool, seen, ref);
            }
        }

        List<ProviderRef> tail = new ArrayList<>();
        for (String providerId : hints.fallbackProviders()) {
            lookup(providers, providerId, model).ifPresent(ref -> add(tail, seen, ref));
        }

        return new Resolution(rule, table.strategyFor(rule), head, pool, tail);
    }

    private static Optional<ProviderRef> lookup(ProviderRegistry.Snapshot providers, String id, String model) {
        return providers.get(id)
                .filter(ref -> ref.getProvider().isEnabled())
                .filter(ref -> ref.getProvider().servesModel(model));
    }

    private static void add(List<ProviderRef> target, Set<String> seen, ProviderRef ref) {
        if (seen.add(ref.getId())) {
            target.add(ref);
        }
    }

    /**
     * Candidates of one request.
     *
     * @param rule     matching rule, null when none matched
     * @param strategy strategy picking within {@code pool}
     * @param head     providers tried first, in order
     * @param pool     providers picked by the strategy
     * @param tail     fallback providers tried last, in order
     */
    public record Resolution(
            RoutingRule rule,
            LoadBalancingStrategy strategy,
            List<ProviderRef> head,
            List<ProviderRef> pool,
            List<ProviderRef> tail
    ) {
        public Resolution {
            head = List.copyOf(head);
            pool = List.copyOf(pool);
            tail = List.copyOf(tail);
        }

        /**
         * Every candidate in routing order.
         */
        public List<ProviderRef> all() {
            List<ProviderRef> all = new ArrayList<>(head.size() + pool.size() + tail.size());
            all.addAll(head);
            all.addAll(pool);
            all.addAll(tail);
            return all;
        }

        public boolean isEmpty() {
            return head.isEmpty() && pool.isEmpty() && tail.isEmpty();
        }

        /**
         * Same resolution without the providers whose breaker is open.
         */
        public Resolution withoutOpen() {
            return new Resolution(rule, strategy, closed(head), closed(pool), closed(tail));
        }

        private static List<ProviderRef> closed(List<ProviderRef> refs) {
            return refs.stream().filter(ref -> !ref.isOpen()).toList();
        }
    }
}
