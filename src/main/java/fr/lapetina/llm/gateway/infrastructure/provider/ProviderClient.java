package fr.lapetina.llm.gateway.infrastructure.provider;

import fr.lapetina.llm.gateway.domain.model.CanonicalRequest;
import fr.lapetina.llm.gateway.domain.model.CanonicalResponse;
import fr.lapetina.llm.gateway.domain.model.Provider;
import fr.lapetina.llm.gateway.domain.model.ProviderHealth;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Adapter translating canonical requests to one provider API.
 *
 * Implementations must be non-blocking and thread-safe. Failures complete
 * the future with a {@link fr.lapetina.llm.gateway.domain.error.ProviderCallException}
 * carrying the classification; any other exception is treated as a
 * retryable provider failure. Cancelling the returned future should abort
 * the underlying call.
 */
public interface ProviderClient {

    /**
     * Sends the request to the provider.
     *
     * @param attemptTimeout budget left for this call; the caller also enforces it
     */
    CompletableFuture<CanonicalResponse> invoke(Provider provider, CanonicalRequest request, Duration attemptTimeout);

    /**
     * Proactively checks the provider.
     */
    CompletableFuture<ProviderHealth> healthCheck(Provider provider);
}
