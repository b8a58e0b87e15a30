package com.formatrouter.testutil;

import com.formatrouter.config.ConfigurationLoader;
import com.formatrouter.config.FormatStyle;
import com.formatrouter.config.FormatterConfig;

/**
 * Styles derived from the bundled defaults.
 */
public final class Styles {

    private Styles() {
    }

    public static FormatStyle defaults() {
        return FormatStyle.defaults();
    }

    /**
     * The default style with options replaced, given as alternating dotted
     * paths and values: {@code with("binPack.callSite", true)}.
     */
    public static FormatStyle with(Object... pathsAndValues) {
        if (pathsAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected path/value pairs");
        }
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();
        for (int i = 0; i < pathsAndValues.length; i += 2) {
            config = config.with((String) pathsAndValues[i], pathsAndValues[i + 1]);
        }
        return FormatStyle.fromConfig(config);
    }
}
