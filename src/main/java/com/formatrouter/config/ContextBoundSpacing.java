package com.formatrouter.config;

import java.util.Locale;

/**
 * Space before the colon of a context bound, as in {@code A : Ordering}.
 */
public enum ContextBoundSpacing {
    NEVER,
    ALWAYS,
    IF_MULTIPLE_BOUNDS;

    public static ContextBoundSpacing fromConfig(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim();
        if (normalized.equalsIgnoreCase("ifMultipleBounds")) {
            return IF_MULTIPLE_BOUNDS;
        }
        try {
            return valueOf(normalized.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
