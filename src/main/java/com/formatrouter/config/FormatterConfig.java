package com.formatrouter.config;

import java.util.HashMap;
import java.util.Map;

/**
 * Raw style configuration: top-level options plus named sections
 * ({@code binPack}, {@code newlines}, ...), as read from YAML.
 */
public class FormatterConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> sectionConfigs;

    public FormatterConfig(Map<String, Object> generalConfig,
                           Map<String, Map<String, Object>> sectionConfigs) {
        this.generalConfig = generalConfig;
        this.sectionConfigs = sectionConfigs;
    }

    /**
     * Gets a copy of the top-level options.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a deep copy of the section maps.
     */
    public Map<String, Map<String, Object>> getSectionConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : sectionConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    public <T> T getGeneralConfig(String key, T defaultValue) {
        return coerce(generalConfig.get(key), defaultValue);
    }

    public <T> T getSectionConfig(String section, String key, T defaultValue) {
        Map<String, Object> sectionConfig = sectionConfigs.get(section);
        if (sectionConfig == null) {
            return defaultValue;
        }
        return coerce(sectionConfig.get(key), defaultValue);
    }

    /**
     * Looks up a dotted path: {@code "maxColumn"} is a top-level option,
     * {@code "binPack.callSite"} an option of the {@code binPack} section.
     */
    public <T> T get(String path, T defaultValue) {
        int dot = path.indexOf('.');
        if (dot < 0) {
            return getGeneralConfig(path, defaultValue);
        }
        return getSectionConfig(path.substring(0, dot), path.substring(dot + 1), defaultValue);
    }

    /**
     * A copy of this configuration with one option replaced.
     */
    public FormatterConfig with(String path, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        Map<String, Map<String, Object>> sections = getSectionConfigsMap();
        int dot = path.indexOf('.');
        if (dot < 0) {
            general.put(path, value);
        } else {
            sections.computeIfAbsent(path.substring(0, dot), k -> new HashMap<>())
                    .put(path.substring(dot + 1), value);
        }
        return new FormatterConfig(general, sections);
    }

    @SuppressWarnings("unchecked")
    private static <T> T coerce(Object value, T defaultValue) {
        if (value == null) {
            return defaultValue;
        }
        try {
            if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {

                if (defaultValue instanceof Integer && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                } else if (defaultValue instanceof Integer && value instanceof String) {
                    return (T) Integer.valueOf(Integer.parseInt(((String) value).trim()));
                } else if (defaultValue instanceof Boolean && value instanceof String) {
                    return (T) Boolean.valueOf(value.toString());
                } else if (defaultValue instanceof String) {
                    return (T) value.toString();
                }

                return defaultValue;
            }

            return (T) value;
        } catch (RuntimeException e) {
            return defaultValue;
        }
    }
}
