package io.admission.scheduler;

public enum TaskPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4),
    EMERGENCY(5);

    private final int level;

    TaskPriority(int level) { this.level = level; }

    public int level() { return level; }

    /** Raise by {@code boost} levels, never past {@link #EMERGENCY}. */
    public TaskPriority boosted(int boost) {
        if (boost <= 0) return this;
        return ofLevel(Math.min(EMERGENCY.level, level + boost));
    }

    public static TaskPriority ofLevel(int level) {
        for (TaskPriority p : values()) {
            if (p.level == level) return p;
        }
        throw new IllegalArgumentException("No priority with level " + level);
    }
}
