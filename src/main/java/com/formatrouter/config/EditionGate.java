package com.formatrouter.config;

import java.util.EnumSet;
import java.util.Set;

/**
 * Generations of rule behavior. Each gate only adds or overrides behavior, so
 * turning gates off reproduces the output of older releases.
 */
public enum EditionGate {
    EDITION_2019_11("2019-11"),
    EDITION_2020_01("2020-01"),
    EDITION_2020_03("2020-03");

    private final String configName;

    EditionGate(String configName) {
        this.configName = configName;
    }

    public String getConfigName() {
        return configName;
    }

    public static EditionGate fromConfig(String value) {
        if (value == null) {
            return null;
        }
        for (EditionGate gate : values()) {
            if (gate.configName.equals(value.trim())) {
                return gate;
            }
        }
        return null;
    }

    /**
     * Gates active for a given edition: every gate released up to it.
     * {@code "latest"} activates all gates, anything before the first gate
     * none of them.
     */
    public static Set<EditionGate> upTo(String edition) {
        if (edition == null || edition.trim().equalsIgnoreCase("latest")) {
            return EnumSet.allOf(EditionGate.class);
        }
        String normalized = edition.trim();
        Set<EditionGate> result = EnumSet.noneOf(EditionGate.class);
        for (EditionGate gate : values()) {
            // "yyyy-MM" values compare correctly as strings
            if (gate.configName.compareTo(normalized) <= 0) {
                result.add(gate);
            }
        }
        return result;
    }
}
