package fr.lapetina.llm.gateway.routing;

import java.time.Duration;

/**
 * Wall-clock budget of one request, shared by all its attempts and fail-overs.
 * Based on {@link System#nanoTime()}, immune to clock adjustments.
 */
public final class Deadline {

    private final long expiresAtNanos;
    private final Duration budget;

    private Deadline(Duration budget) {
        this.budget = budget;
        this.expiresAtNanos = System.nanoTime() + budget.toNanos();
    }

    public static Deadline after(Duration budget) {
        if (budget.isNegative()) {
            throw new IllegalArgumentException("Deadline budget must not be negative: " + budget);
        }
        return new Deadline(budget);
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    /**
     * The smaller of the given timeout and the remaining budget.
     */
    public Duration cap(Duration timeout) {
        Duration left = remaining();
        return timeout.compareTo(left) < 0 ? timeout : left;
    }

    public Duration getBudget() {
        return budget;
    }

    @Override
    public String toString() {
        return "Deadline{budget=" + budget + ", remaining=" + remaining() + '}';
    }
}
