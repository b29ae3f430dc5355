package fr.lapetina.llm.gateway.routing;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cancellation handle shared by every attempt of one request.
 *
 * Holds the request {@link Deadline}, whatever is currently pending for
 * the request (a provider call or a backoff wait) and the providers a call
 * was sent to. {@link #cancel()} aborts the pending work and makes every
 * later {@link #track(Future)} cancel immediately.
 *
 * The cancelled flag and the dispatch record live in one snapshot swapped
 * by CAS: once {@link #cancel()} returns, {@link #getDispatchedProviders()}
 * names every provider that was or will ever be called for the request.
 */
public final class AttemptScope {

    private final Deadline deadline;
    private final AtomicReference<State> state = new AtomicReference<>(State.INITIAL);
    private final AtomicReference<Future<?>> current = new AtomicReference<>();

    public AttemptScope(Deadline deadline) {
        this.deadline = Objects.requireNonNull(deadline, "Deadline is required");
    }

    public Deadline getDeadline() {
        return deadline;
    }

    /**
     * Records that a call to {@code providerId} is about to be sent.
     *
     * @return false when the scope is cancelled, the call must then not be sent
     */
    public boolean dispatch(String providerId) {
        while (true) {
            State before = state.get();
            if (before.cancelled()) {
                return false;
            }
            if (state.compareAndSet(before, before.withDispatch(providerId))) {
                return true;
            }
        }
    }

    /**
     * Registers the pending work of the request. Cancels it at once when the
     * scope is already cancelled.
     */
    public void track(Future<?> pending) {
        current.set(pending);
        if (isCancelled()) {
            pending.cancel(true);
        }
    }

    /**
     * Forgets the pending work if it is still the tracked one.
     */
    public void untrack(Future<?> pending) {
        current.compareAndSet(pending, null);
    }

    /**
     * Cancels the scope and its pending work.
     *
     * @return true for the first caller only
     */
    public boolean cancel() {
        State before = state.getAndUpdate(State::cancel);
        if (before.cancelled()) {
            return false;
        }
        Future<?> pending = current.getAndSet(null);
        if (pending != null) {
            pending.cancel(true);
        }
        return true;
    }

    public boolean isCancelled() {
        return state.get().cancelled();
    }

    /**
     * True once the scope was cancelled or its deadline passed.
     */
    public boolean isOver() {
        return isCancelled() || deadline.isExpired();
    }

    /**
     * Distinct providers a call was sent to, in first-call order.
     */
    public List<String> getDispatchedProviders() {
        return state.get().providers();
    }

    /**
     * Calls sent so far, retries included.
     */
    public int getDispatchCount() {
        return state.get().calls();
    }

    private record State(boolean cancelled, List<String> providers, int calls) {

        static final State INITIAL = new State(false, List.of(), 0);

        State withDispatch(String providerId) {
            if (providers.contains(providerId)) {
                return new State(false, providers, calls + 1);
            }
            List<String> next = new ArrayList<>(providers);
            next.add(providerId);
            return new State(false, List.copyOf(next), calls + 1);
        }

        State cancel() {
            return cancelled ? this : new State(true, providers, calls);
        }
    }
}
