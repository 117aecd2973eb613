package io.admission.resource;

/**
 * Lifecycle of a {@link ResourceAllocation}. Transitions only move forward; the last three values are terminal.
 */
public enum AllocationStatus {
    PENDING,
    ALLOCATED,
    RUNNING,
    COMPLETED,
    FAILED,
    EXPIRED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == EXPIRED;
    }

    public boolean isActive() {
        return this == ALLOCATED || this == RUNNING;
    }

    boolean canMoveTo(AllocationStatus next) {
        if (isTerminal()) return false;
        if (next.isTerminal()) return true;
        return next.ordinal() > ordinal();
    }
}
