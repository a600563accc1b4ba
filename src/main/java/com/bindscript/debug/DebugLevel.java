package com.bindscript.debug;

/** Severity of a debug record, lowest first. */
public enum DebugLevel {
    TRACE,
    DEBUG,
    INFO,
    WARN,
    ERROR,
    OFF;

    /** Lenient parse used by configuration; unknown names map to {@code fallback}. */
    public static DebugLevel parse(String name, DebugLevel fallback) {
        if (name == null || name.trim().isEmpty()) return fallback;
        try {
            return DebugLevel.valueOf(name.trim().toUpperCase(java.util.Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return fallback;
        }
    }
}
