package io.admission.scheduler;

public enum TaskStatus {
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED,
    /** Resources could not be allocated when the task was dispatched. */
    WAITING_RESOURCES;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED || this == WAITING_RESOURCES;
    }
}
