package fr.lapetina.llm.gateway.domain.strategy;

import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.model.RoutingHints;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * What a strategy knows about the request it selects for.
 *
 * @param model           requested model
 * @param candidateSetKey key of the candidate set being chosen from, scopes round-robin cursors
 * @param hints           caller routing hints
 */
public record SelectionContext(String model, String candidateSetKey, RoutingHints hints) {

    public SelectionContext {
        Objects.requireNonNull(model, "Model is required");
        if (candidateSetKey == null) {
            candidateSetKey = model;
        }
        if (hints == null) {
            hints = RoutingHints.NONE;
        }
    }

    public static SelectionContext of(String model, List<ProviderRef> candidates, RoutingHints hints) {
        return new SelectionContext(model, keyOf(model, candidates), hints);
    }

    public static SelectionContext forModel(String model) {
        return new SelectionContext(model, model, RoutingHints.NONE);
    }

    /**
     * Key identifying a candidate set: the model plus the ordered provider ids.
     */
    public static String keyOf(String model, List<ProviderRef> candidates) {
        return model + "|" + candidates.stream().map(ProviderRef::getId).collect(Collectors.joining(","));
    }
}
