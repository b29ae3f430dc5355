package fr.lapetina.llm.gateway.domain.model;

import fr.lapetina.llm.gateway.domain.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.domain.resilience.CircuitState;
import fr.lapetina.llm.gateway.domain.resilience.ProviderHealthState;

import java.util.Objects;

/**
 * A registered provider together with its runtime health and breaker.
 *
 * This is what strategies and the router work with. The provider and breaker
 * config are fixed for the lifetime of the ref; the health state is shared
 * across re-registrations of the same provider id.
 */
public final class ProviderRef {

    private final Provider provider;
    private final ProviderHealthState health;
    private final CircuitBreaker circuitBreaker;

    public ProviderRef(Provider provider, ProviderHealthState health, CircuitBreaker circuitBreaker) {
        this.provider = Objects.requireNonNull(provider, "Provider is required");
        this.health = Objects.requireNonNull(health, "Health state is required");
        this.circuitBreaker = Objects.requireNonNull(circuitBreaker, "Circuit breaker is required");
        if (!provider.getId().equals(health.getProviderId())) {
            throw new IllegalArgumentException(
                    "Health state " + health.getProviderId() + " does not belong to " + provider.getId());
        }
    }

    public String getId() {
        return provider.getId();
    }

    public Provider getProvider() {
        return provider;
    }

    public ProviderHealthState getHealth() {
        return health;
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    /**
     * True when the breaker currently rejects calls.
     */
    public boolean isOpen() {
        return circuitBreaker.isOpen();
    }

    public CircuitState getCircuitState() {
        return circuitBreaker.getState();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ProviderRef that = (ProviderRef) o;
        return provider.getId().equals(that.provider.getId());
    }

    @Override
    public int hashCode() {
        return provider.getId().hashCode();
    }

    @Override
    public String toString() {
        return "ProviderRef{" +
                "id='" + provider.getId() + '\'' +
                ", state=" + circuitBreaker.getState() +
                ", inFlight=" + health.getInFlight() +
                '}';
    }
}
