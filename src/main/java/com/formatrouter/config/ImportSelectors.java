package com.formatrouter.config;

import java.util.Locale;

/**
 * Layout of import selector lists such as {@code import a.{b, c}}.
 */
public enum ImportSelectors {
    NO_BIN_PACK("noBinPack"),   // one selector per line once the list breaks
    BIN_PACK("binPack"),        // as many selectors per line as fit
    SINGLE_LINE("singleLine");  // never break

    private final String configName;

    ImportSelectors(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    /**
     * Parses a configuration value, case-insensitively; unknown values yield
     * {@code null}.
     */
    public static ImportSelectors fromConfig(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ImportSelectors candidate : values()) {
            if (candidate.configName.toLowerCase(Locale.ROOT).equals(normalized)) {
                return candidate;
            }
        }
        return null;
    }
}
