package fr.lapetina.llm.gateway.routing;

import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Prioritized routing rule. Lower priority values are evaluated first.
 *
 * The predicate matches the model glob, and optionally the tenant and a set
 * of required tags. The action is either an explicit provider chain, tried
 * in order, or the name of a balancing strategy applied to every provider
 * serving the model.
 *
 * @param tenantId     null matches any tenant
 * @param requiredTags every entry must be present in the request tags
 */
public record RoutingRule(
        String id,
        int priority,
        ModelPattern modelPattern,
        String tenantId,
        Map<String, String> requiredTags,
        List<String> providerChain,
        String strategy
) {
    public RoutingRule {
        Objects.requireNonNull(id, "Rule ID is required");
        Objects.requireNonNull(modelPattern, "Model pattern is required");
        requiredTags = requiredTags != null ? Map.copyOf(requiredTags) : Map.of();
        providerChain = providerChain != null ? List.copyOf(providerChain) : List.of();
        if (providerChain.isEmpty() == (strategy == null)) {
            throw new IllegalArgumentException(
                    "Rule " + id + " must define exactly one of a provider chain or a strategy");
        }
    }

    /**
     * Rule sending matching requests along a fixed chain of providers.
     */
    public static RoutingRule chain(String id, int priority, String modelGlob, String... providers) {
        return new RoutingRule(id, priority, ModelPattern.of(modelGlob), null, null, List.of(providers), null);
    }

    /**
     * Rule balancing matching requests with the named strategy.
     */
    public static RoutingRule balanced(String id, int priority, String modelGlob, String strategy) {
        return new RoutingRule(id, priority, ModelPattern.of(modelGlob), null, null, null, strategy);
    }

    public RoutingRule forTenant(String tenant) {
        return new RoutingRule(id, priority, modelPattern, tenant, requiredTags, providerChain, strategy);
    }

    public RoutingRule withRequiredTags(Map<String, String> tags) {
        return new RoutingRule(id, priority, modelPattern, tenantId, tags, providerChain, strategy);
    }

    public boolean isExplicitChain() {
        return !providerChain.isEmpty();
    }

    public boolean matches(CanonicalRequest request) {
        if (!modelPattern.matches(request.model())) {
            return false;
        }
        if (tenantId != null && !tenantId.equals(request.hints().tenantId())) {
            return false;
        }
        Map<String, String> tags = request.hints().tags();
        for (Map.Entry<String, String> required : requiredTags.entrySet()) {
            if (!required.getValue().equals(tags.get(required.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
