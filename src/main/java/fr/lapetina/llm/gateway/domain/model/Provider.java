package fr.lapetina.llm.gateway.domain.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A backend LLM provider the gateway can dispatch to.
 *
 * Immutable. Reconfiguration replaces the whole instance; the mutable
 * runtime state of a provider lives in {@link ProviderHealthState}.
 */
public final class Provider {
    private final String id;
    private final Set<String> models;
    private final ProviderEndpoint endpoint;
    private final int maxConcurrentRequests;
    private final int maxContextTokens;
    private final int weight;
    private final double costPer1kTokens;
    private final boolean enabled;

    private Provider(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Provider ID is required");
        this.endpoint = Objects.requireNonNull(builder.endpoint, "Endpoint is required");
        this.models = Collections.unmodifiableSet(new LinkedHashSet<>(builder.models));
        if (builder.weight < 0) {
            throw new IllegalArgumentException("Weight must not be negative: " + builder.weight);
        }
        if (builder.costPer1kTokens < 0) {
            throw new IllegalArgumentException("Cost must not be negative: " + builder.costPer1kTokens);
        }
        if (builder.maxConcurrentRequests <= 0) {
            throw new IllegalArgumentException(
                    "Max concurrent requests must be positive: " + builder.maxConcurrentRequests);
        }
        this.maxConcurrentRequests = builder.maxConcurrentRequests;
        this.maxContextTokens = builder.maxContextTokens;
        this.weight = builder.weight;
        this.costPer1kTokens = builder.costPer1kTokens;
        this.enabled = builder.enabled;
    }

    public String getId() {
        return id;
    }

    public Set<String> getModels() {
        return models;
    }

    public boolean servesModel(String model) {
        return models.contains(model);
    }

    public ProviderEndpoint getEndpoint() {
        return endpoint;
    }

    public int getMaxConcurrentRequests() {
        return maxConcurrentRequests;
    }

    /**
     * Largest context window accepted by this provider, 0 when unknown.
     */
    public int getMaxContextTokens() {
        return maxContextTokens;
    }

    public int getWeight() {
        return weight;
    }

    public double getCostPer1kTokens() {
        return costPer1kTokens;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /**
     * Checks if a request needing the given context size fits this provider.
     */
    public boolean acceptsContext(int requiredTokens) {
        return requiredTokens <= 0 || maxContextTokens <= 0 || requiredTokens <= maxContextTokens;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Provider that = (Provider) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Provider{" +
                "id='" + id + '\'' +
                ", kind=" + endpoint.kind() +
                ", models=" + models +
                ", weight=" + weight +
                ", cost=" + costPer1kTokens +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private final Set<String> models = new LinkedHashSet<>();
        private ProviderEndpoint endpoint;
        private int maxConcurrentRequests = 100;
        private int maxContextTokens;
        private int weight = 1;
        private double costPer1kTokens;
        private boolean enabled = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder addModel(String model) {
            this.models.add(model);
            return this;
        }

        public Builder models(Set<String> models) {
            this.models.addAll(models);
            return this;
        }

        public Builder endpoint(ProviderEndpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String kind, String baseUrl) {
            this.endpoint = ProviderEndpoint.of(kind, baseUrl);
            return this;
        }

        public Builder maxConcurrentRequests(int max) {
            this.maxConcurrentRequests = max;
            return this;
        }

        public Builder maxContextTokens(int maxContextTokens) {
            this.maxContextTokens = maxContextTokens;
            return this;
        }

        public Builder weight(int weight) {
            this.weight = weight;
            return this;
        }

        public Builder costPer1kTokens(double cost) {
            this.costPer1kTokens = cost;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Provider build() {
            return new Provider(this);
        }
    }
}
