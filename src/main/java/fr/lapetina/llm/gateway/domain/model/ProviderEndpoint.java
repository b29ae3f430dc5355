package fr.lapetina.llm.gateway.domain.model;

import java.net.URI;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque description of how to reach a provider.
 *
 * The routing core never interprets it; {@code kind} selects the
 * {@code ProviderClient} adapter and the rest is handed to that adapter.
 */
public record ProviderEndpoint(String kind, URI baseUrl, Map<String, String> properties) {

    public ProviderEndpoint {
        Objects.requireNonNull(kind, "Endpoint kind is required");
        properties = properties != null ? Map.copyOf(properties) : Map.of();
    }

    public static ProviderEndpoint of(String kind, String baseUrl) {
        return new ProviderEndpoint(kind, baseUrl != null ? URI.create(baseUrl) : null, null);
    }
}
