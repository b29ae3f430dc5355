package fr.lapetina.llm.gateway.domain.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Optional caller-supplied routing preferences.
 *
 * @param preferredProvider provider to try first when it serves the model
 * @param fallbackProviders providers appended after the resolved candidates
 * @param tenantId          tenant used by tenant-scoped routing rules
 * @param tags              free-form labels matched by routing rules
 * @param maxLatency        latency ceiling used by cost-optimized selection
 * @param minContextTokens  context size the chosen provider must accept
 */
public record RoutingHints(
        String preferredProvider,
        List<String> fallbackProviders,
        String tenantId,
        Map<String, String> tags,
        Duration maxLatency,
        int minContextTokens
) {
    public static final RoutingHints NONE = new RoutingHints(null, null, null, null, null, 0);

    public RoutingHints {
        fallbackProviders = fallbackProviders != null ? List.copyOf(fallbackProviders) : List.of();
        tags = tags != null ? Map.copyOf(tags) : Map.of();
    }

    public static RoutingHints preferring(String providerId, String... fallbacks) {
        return new RoutingHints(providerId, List.of(fallbacks), null, null, null, 0);
    }

    public static RoutingHints forTenant(String tenantId) {
        return new RoutingHints(null, null, tenantId, null, null, 0);
    }
}
