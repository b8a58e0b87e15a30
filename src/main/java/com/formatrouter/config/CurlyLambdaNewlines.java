package com.formatrouter.config;

import java.util.Locale;

/**
 * Blank lines after the arrow of a curly-brace lambda.
 */
public enum CurlyLambdaNewlines {
    NEVER,
    ALWAYS,
    PRESERVE;

    public static CurlyLambdaNewlines fromConfig(String value) {
        if (value == null) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
