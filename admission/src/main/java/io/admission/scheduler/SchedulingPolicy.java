package io.admission.scheduler;

import java.util.Locale;

public enum SchedulingPolicy {
    ROUND_ROBIN,
    PRIORITY,
    FAIR_SHARE;

    /** Accepts {@code fair_share}, {@code FAIR-SHARE} and the like. */
    public static SchedulingPolicy parse(String s) {
        return valueOf(s.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
    }
}
