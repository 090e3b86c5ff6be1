package com.color.x.utils;

import java.time.Duration;

/**
 * Wall-clock budget for one solve. Engines poll {@link #isExpired()} at loop boundaries.
 */
public final class SolveDeadline {
    private static final SolveDeadline NONE = new SolveDeadline(Long.MAX_VALUE, Duration.ZERO);

    private final long deadlineNanos;
    private final Duration budget;

    private SolveDeadline(long deadlineNanos, Duration budget) {
        this.deadlineNanos = deadlineNanos;
        this.budget = budget;
    }

    public static SolveDeadline after(Duration budget) {
        if (budget.isNegative()) {
            throw new IllegalArgumentException("Budget cannot be negative: " + budget);
        }
        long now = System.nanoTime();
        long nanos;
        try {
            nanos = budget.toNanos();
        } catch (ArithmeticException e) {
            return NONE;
        }
        long deadline = now + nanos;
        return deadline < now ? NONE : new SolveDeadline(deadline, budget);
    }

    public static SolveDeadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return this != NONE && System.nanoTime() - deadlineNanos >= 0;
    }

    public Duration remaining() {
        if (this == NONE) {
            return Duration.ofNanos(Long.MAX_VALUE);
        }
        return Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime()));
    }

    public Duration getBudget() {
        return budget;
    }

    @Override
    public String toString() {
        return this == NONE ? "SolveDeadline{none}" : "SolveDeadline{budget=" + budget + ", remaining=" + remaining() + "}";
    }
}
