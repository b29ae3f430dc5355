package fr.lapetina.llm.gateway.infrastructure.registry;

import fr.lapetina.llm.gateway.domain.model.Provider;
import fr.lapetina.llm.gateway.domain.model.ProviderRef;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreaker;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreakerConfig;
import fr.lapetina.llm.gateway.domain.resilience.CircuitBreakerListener;
import fr.lapetina.llm.gateway.domain.resilience.ProviderHealthState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Registry of the providers the gateway can route to.
 *
 * Readers never block: the whole registry is an immutable {@link Snapshot}
 * (providers by id plus a precomputed model index) behind an atomic
 * reference. Writers serialize among themselves, build the next snapshot
 * and publish it with a single swap.
 *
 * Re-registering an existing provider id keeps its {@link ProviderHealthState},
 * so breaker state and latency history survive a configuration reload.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final AtomicReference<Snapshot> snapshot = new AtomicReference<>(Snapshot.EMPTY);
    private final List<Consumer<RegistryEvent>> listeners = new CopyOnWriteArrayList<>();
    private final Object writeLock = new Object();
    private final Clock clock;
    private final CircuitBreakerListener breakerListener;
    private volatile CircuitBreakerConfig defaultBreakerConfig;

    public ProviderRegistry(Clock clock, CircuitBreakerConfig defaultBreakerConfig, CircuitBreakerListener breakerListener) {
        this.clock = Objects.requireNonNull(clock, "Clock is required");
        this.defaultBreakerConfig = Objects.requireNonNull(defaultBreakerConfig, "Breaker config is required");
        this.breakerListener = breakerListener != null ? breakerListener : CircuitBreakerListener.NOOP;
    }

    public ProviderRegistry() {
        this(Clock.systemUTC(), CircuitBreakerConfig.DEFAULT, CircuitBreakerListener.NOOP);
    }

    /**
     * Registers a new provider or replaces an existing one with the default breaker config.
     */
    public ProviderRef register(Provider provider) {
        return register(provider, null);
    }

    /**
     * Registers a new provider or replaces an existing one.
     *
     * @param breakerConfig per-provider override, null for the registry default
     */
    public ProviderRef register(Provider provider, CircuitBreakerConfig breakerConfig) {
        Objects.requireNonNull(provider, "Provider is required");
        ProviderRef ref;
        boolean existed;
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            ProviderRef previous = current.byId.get(provider.getId());
            existed = previous != null;
            ref = newRef(provider, breakerConfig, previous);

            Map<String, ProviderRef> next = new LinkedHashMap<>(current.byId);
            next.put(provider.getId(), ref);
            snapshot.set(Snapshot.of(next));
        }

        if (existed) {
            log.info("Provider updated: {}", provider);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.UPDATED, ref));
        } else {
            log.info("Provider registered: {}", provider);
            notifyListeners(new RegistryEvent(RegistryEvent.Type.ADDED, ref));
        }
        return ref;
    }

    /**
     * Removes a provider by ID. Its health state is dropped with it.
     */
    public Optional<ProviderRef> deregister(String providerId) {
        ProviderRef removed;
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            removed = current.byId.get(providerId);
            if (removed == null) {
                return Optional.empty();
            }
            Map<String, ProviderRef> next = new LinkedHashMap<>(current.byId);
            next.remove(providerId);
            snapshot.set(Snapshot.of(next));
        }
        log.info("Provider removed: {}", removed.getProvider());
        notifyListeners(new RegistryEvent(RegistryEvent.Type.REMOVED, removed));
        return Optional.of(removed);
    }

    /**
     * Replaces all providers with a new set in one swap.
     * Used for configuration reload; providers kept by id keep their health state.
     *
     * @param breakerConfigs per-provider overrides by id, may be empty
     */
    public void replaceAll(Collection<Provider> providers, Map<String, CircuitBreakerConfig> breakerConfigs) {
        List<RegistryEvent> events = new ArrayList<>();
        synchronized (writeLock) {
            Snapshot current = snapshot.get();
            Map<String, ProviderRef> next = new LinkedHashMap<>();
            for (Provider provider : providers) {
                ProviderRef previous = current.byId.get(provider.getId());
                ProviderRef ref = newRef(provider, breakerConfigs.get(provider.getId()), previous);
                next.put(provider.getId(), ref);
                events.add(new RegistryEvent(
                        previous == null ? RegistryEvent.Type.ADDED : RegistryEvent.Type.UPDATED, ref));
            }
            Set<String> kept = new HashSet<>(next.keySet());
            for (ProviderRef existing : current.byId.values()) {
                if (!kept.contains(existing.getId())) {
                    events.add(new RegistryEvent(RegistryEvent.Type.REMOVED, existing));
                }
            }
            snapshot.set(Snapshot.of(next));
        }

        log.info("Provider registry replaced: {} providers active", snapshot.get().byId.size());
        events.forEach(this::notifyListeners);
    }

    public void replaceAll(Collection<Provider> providers) {
        replaceAll(providers, Map.of());
    }

    private ProviderRef newRef(Provider provider, CircuitBreakerConfig breakerConfig, ProviderRef previous) {
        ProviderHealthState health = previous != null
                ? previous.getHealth()
                : new ProviderHealthState(provider.getId(), clock.instant());
        CircuitBreakerConfig config = breakerConfig != null ? breakerConfig : defaultBreakerConfig;
        return new ProviderRef(provider, health, new CircuitBreaker(health, config, clock, breakerListener));
    }

    public Optional<ProviderRef> get(String providerId) {
        return Optional.ofNullable(snapshot.get().byId.get(providerId));
    }

    /**
     * Enabled providers serving the model, in registration order. O(1) lookup.
     */
    public List<ProviderRef> providersForModel(String model) {
        return snapshot.get().byModel.getOrDefault(model, List.of());
    }

    /**
     * Enabled providers serving the model whose breaker is not open.
     */
    public List<ProviderRef> healthyProvidersForModel(String model) {
        return providersForModel(model).stream()
                .filter(ref -> !ref.isOpen())
                .collect(Collectors.toList());
    }

    /**
     * Gets all registered providers, enabled or not.
     */
    public List<ProviderRef> getAll() {
        return List.copyOf(snapshot.get().byId.values());
    }

    /**
     * Current immutable view, for callers that need several consistent reads.
     */
    public Snapshot snapshot() {
        return snapshot.get();
    }

    public int size() {
        return snapshot.get().byId.size();
    }

    public void setDefaultBreakerConfig(CircuitBreakerConfig config) {
        this.defaultBreakerConfig = Objects.requireNonNull(config, "Breaker config is required");
    }

    public CircuitBreakerConfig getDefaultBreakerConfig() {
        return defaultBreakerConfig;
    }

    /**
     * Adds a listener for registry events.
     */
    public void addListener(Consumer<RegistryEvent> listener) {
        listeners.add(listener);
    }

    public void removeListener(Consumer<RegistryEvent> listener) {
        listeners.remove(listener);
    }

    private void notifyListeners(RegistryEvent event) {
        for (Consumer<RegistryEvent> listener : listeners) {
            try {
                listener.accept(event);
            } catch (Exception e) {
                log.error("Error notifying registry listener: type={}, providerId={}",
                        event.type(), event.provider().getId(), e);
            }
        }
    }

    /**
     * Immutable registry content.
     */
    public static final class Snapshot {

        static final Snapshot EMPTY = new Snapshot(Map.of(), Map.of());

        private final Map<String, ProviderRef> byId;
        private final Map<String, List<ProviderRef>> byModel;

        private Snapshot(Map<String, ProviderRef> byId, Map<String, List<ProviderRef>> byModel) {
            this.byId = byId;
            this.byModel = byModel;
        }

        static Snapshot of(Map<String, ProviderRef> providers) {
            Map<String, List<ProviderRef>> index = new LinkedHashMap<>();
            for (ProviderRef ref : providers.values()) {
                if (!ref.getProvider().isEnabled()) {
                    continue;
                }
                for (String model : ref.getProvider().getModels()) {
                    index.computeIfAbsent(model, m -> new ArrayList<>()).add(ref);
                }
            }
            Map<String, List<ProviderRef>> frozen = new LinkedHashMap<>();
            index.forEach((model, refs) -> frozen.put(model, List.copyOf(refs)));
            return new Snapshot(
                    Collections.unmodifiableMap(new LinkedHashMap<>(providers)),
                    Collections.unmodifiableMap(frozen));
        }

        public Optional<ProviderRef> get(String providerId) {
            return Optional.ofNullable(byId.get(providerId));
        }

        public List<ProviderRef> providersForModel(String model) {
            return byModel.getOrDefault(model, List.of());
        }

        public Collection<ProviderRef> all() {
            return byId.values();
        }

        public Set<String> models() {
            return byModel.keySet();
        }
    }

    /**
     * Event for provider registry changes.
     */
    public record RegistryEvent(Type type, ProviderRef provider) {
        public enum Type {
            ADDED,
            REMOVED,
            UPDATED
        }
    }
}
