package fr.lapetina.llm.gateway.domain.resilience;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Answer of {@link CircuitBreaker#permit()}.
 *
 * An allowed permission must be settled exactly once, either with
 * {@link CircuitBreaker#recordOutcome(Permission, fr.lapetina.llm.gateway.domain.model.CallOutcome)}
 * or with {@link CircuitBreaker#release(Permission)}. Settling twice is a no-op,
 * so every exit path may call release.
 */
public final class Permission {

    public enum Type {
        /** Normal call through a CLOSED circuit. */
        ALLOWED,
        /** The single trial call of a HALF_OPEN circuit. */
        PROBE,
        /** Call rejected, nothing was claimed. */
        DENIED
    }

    private final Type type;
    private final ProviderHealthState.Circuit grantedIn;
    private final AtomicBoolean settled;

    private Permission(Type type, ProviderHealthState.Circuit grantedIn) {
        this.type = type;
        this.grantedIn = grantedIn;
        this.settled = new AtomicBoolean(type == Type.DENIED);
    }

    static Permission allowed(ProviderHealthState.Circuit circuit) {
        return new Permission(Type.ALLOWED, circuit);
    }

    static Permission probe(ProviderHealthState.Circuit circuit) {
        return new Permission(Type.PROBE, circuit);
    }

    static Permission denied(ProviderHealthState.Circuit circuit) {
        return new Permission(Type.DENIED, circuit);
    }

    public Type getType() {
        return type;
    }

    public boolean isAllowed() {
        return type != Type.DENIED;
    }

    public boolean isProbe() {
        return type == Type.PROBE;
    }

    /**
     * Circuit value observed when the permission was granted.
     */
    public ProviderHealthState.Circuit getGrantedIn() {
        return grantedIn;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * Marks the permission settled.
     *
     * @return true for the first caller only
     */
    boolean settle() {
        return settled.compareAndSet(false, true);
    }

    @Override
    public String toString() {
        return "Permission{" + type + ", state=" + grantedIn.state() + ", settled=" + settled.get() + '}';
    }
}
