package fr.lapetina.llm.gateway.infrastructure.provider;

import fr.lapetina.llm.gateway.domain.error.ProviderCallException;
import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.domain.model.Provider;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adapters by endpoint kind. Itself a {@link ProviderClient} that dispatches
 * on {@code provider.getEndpoint().kind()}.
 */
public final class ProviderClients implements ProviderClient {

    private final Map<String, ProviderClient> clients = new ConcurrentHashMap<>();

    public ProviderClients register(String kind, ProviderClient client) {
        clients.put(kind.toLowerCase(), client);
        return this;
    }

    /**
     * A registry holding one client for one endpoint kind.
     */
    public static ProviderClients single(String kind, ProviderClient client) {
        return new ProviderClients().register(kind, client);
    }

    public Optional<ProviderClient> forKind(String kind) {
        return Optional.ofNullable(clients.get(kind.toLowerCase()));
    }

    public boolean supports(String kind) {
        return clients.containsKey(kind.toLowerCase());
    }

    public Set<String> getKinds() {
        return Set.copyOf(clients.keySet());
    }

    @Override
    public CompletableFuture<CanonicalResponse> invoke(
            Provider provider,
            CanonicalRequest request,
            Duration attemptTimeout
    ) {
        Optional<ProviderClient> client = forKind(provider.getEndpoint().kind());
        if (client.isEmpty()) {
            return CompletableFuture.failedFuture(ProviderCallException.nonRetryable(
                    provider.getId(), "No client for endpoint kind: " + provider.getEndpoint().kind()));
        }
        return client.get().invoke(provider, request, attemptTimeout);
    }

    @Override
    public CompletableFuture<ProviderHealth> healthCheck(Provider provider) {
        return forKind(provider.getEndpoint().kind())
                .map(client -> client.healthCheck(provider))
                .orElseGet(() -> CompletableFuture.completedFuture(ProviderHealth.UNHEALTHY));
    }
}
