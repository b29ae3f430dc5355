package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.CallOutcome;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Strategy interface for load balancing across providers.
 *
 * Implementations must be thread-safe as they are called concurrently from
 * caller threads and provider completion threads. Every implementation skips
 * providers whose circuit breaker is open.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects one provider among the candidates.
     *
     * @param candidates providers serving the requested model, in routing order
     * @param context    model, candidate-set key and hints of the request
     * @return Selected provider, or empty if none is eligible
     */
    Optional<ProviderRef> select(List<ProviderRef> candidates, SelectionContext context);

    /**
     * Called after every provider call made on a selection of this strategy.
     * Strategies can use this for feedback-based balancing.
     */
    default void recordResult(ProviderRef provider, CallOutcome outcome) {
        // Default no-op, override for strategies that need feedback
    }

    /**
     * Resets any internal state. Called when the routing configuration is replaced.
     */
    default void reset() {
        // Default no-op
    }

    /**
     * Candidates whose breaker is not open.
     */
    static List<ProviderRef> eligible(List<ProviderRef> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return List.of();
        }
        return candidates.stream()
                .filter(ref -> !ref.isOpen())
                .collect(Collectors.toList());
    }
}
