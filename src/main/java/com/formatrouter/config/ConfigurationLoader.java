package com.formatrouter.config;

import com.formatrouter.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads style configuration from YAML, filling in defaults and dropping
 * out-of-range values.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    static final String GENERAL = "general";
    static final String SECTIONS = "sections";

    private static FormatterConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file, falling back to the bundled defaults
     * when the file is missing or unreadable.
     */
    public static FormatterConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);
            if (config == null) {
                config = new HashMap<>();
            }

            FormatterConfig formatterConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully with " +
                    formatterConfig.getSectionConfigsMap().size() + " sections");

            return formatterConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Parses configuration from YAML text; used for inline styles.
     */
    public static FormatterConfig parseConfig(String yaml) {
        try {
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(yaml, Map.class);
            return _createConfigFromMap(config == null ? new HashMap<>() : config);
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error parsing inline configuration: " + e.getMessage(), e);
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized FormatterConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Creates a configuration from a parsed Map, with validation.
     */
    @SuppressWarnings("unchecked")
    private static FormatterConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get(GENERAL) instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get(GENERAL));
        } else if (config.containsKey(GENERAL)) {
            logger.warning("Invalid '" + GENERAL + "' section in config, using defaults");
        }

        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> sectionConfigs = new HashMap<>();
        if (config.get(SECTIONS) instanceof Map) {
            Map<String, Object> sectionsMap = (Map<String, Object>) config.get(SECTIONS);

            for (Map.Entry<String, Object> entry : sectionsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    sectionConfigs.put(entry.getKey(), _stringKeys((Map<Object, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for section '" + entry.getKey() + "', using defaults");
                    sectionConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        } else if (config.containsKey(SECTIONS)) {
            logger.warning("Invalid '" + SECTIONS + "' section in config, using defaults");
        }

        _ensureDefaultSectionConfigs(sectionConfigs);

        _validateConfigurationValues(generalConfig, sectionConfigs);

        return new FormatterConfig(generalConfig, sectionConfigs);
    }

    // YAML reads keys such as 2020-01 as strings, but plain numbers would not be
    private static Map<String, Object> _stringKeys(Map<Object, Object> source) {
        Map<String, Object> result = new HashMap<>();
        for (Map.Entry<Object, Object> entry : source.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    /**
     * Validates configuration values to ensure they are within acceptable ranges.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> sectionConfigs) {
        _validateIntRange(generalConfig, "maxColumn", 20, 1000);
        _validateIntRange(generalConfig, "forceConfigStyleOnOffset", 0, 10000);
        _validateIntRange(generalConfig, "forceConfigStyleMinArgCount", 1, 100);

        Map<String, Object> continuationIndent = sectionConfigs.get("continuationIndent");
        _validateIntRange(continuationIndent, "callSite", 0, 16);
        _validateIntRange(continuationIndent, "defnSite", 0, 16);
        _validateIntRange(continuationIndent, "extendSite", 0, 16);

        if (ImportSelectors.fromConfig(String.valueOf(generalConfig.get("importSelectors"))) == null) {
            logger.warning("Unknown importSelectors value '" + generalConfig.get("importSelectors") +
                    "'. Using default value.");
            generalConfig.put("importSelectors", ImportSelectors.NO_BIN_PACK.getConfigName());
        }
    }

    /**
     * Validates that an integer configuration value is within the specified range.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    /**
     * Creates an empty configuration with minimum defaults.
     */
    private static FormatterConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> sectionConfigs = new HashMap<>();
        _ensureDefaultSectionConfigs(sectionConfigs);

        return new FormatterConfig(generalConfig, sectionConfigs);
    }

    /**
     * Ensures that top-level options have all required default values.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        _ensure(generalConfig, "maxColumn", Number.class, 80);
        _ensure(generalConfig, "importSelectors", String.class, "noBinPack");
        _ensure(generalConfig, "indentYieldKeyword", Boolean.class, true);
        _ensure(generalConfig, "unindentTopLevelOperators", Boolean.class, false);
        _ensure(generalConfig, "poorMansTrailingCommasInConfigStyle", Boolean.class, false);
        _ensure(generalConfig, "oneArgPerLine", Boolean.class, false);
        _ensure(generalConfig, "forceConfigStyleOnOffset", Number.class, 150);
        _ensure(generalConfig, "forceConfigStyleMinArgCount", Number.class, 2);
        if (!generalConfig.containsKey("edition") || generalConfig.get("edition") == null) {
            generalConfig.put("edition", "latest");
        } else {
            generalConfig.put("edition", String.valueOf(generalConfig.get("edition")));
        }
    }

    /**
     * Ensures that the style sections have all required default values.
     */
    private static void _ensureDefaultSectionConfigs(Map<String, Map<String, Object>> sectionConfigs) {
        Map<String, Object> continuationIndent = sectionConfigs.computeIfAbsent("continuationIndent", k -> new HashMap<>());
        _ensure(continuationIndent, "callSite", Number.class, 2);
        _ensure(continuationIndent, "defnSite", Number.class, 4);
        _ensure(continuationIndent, "extendSite", Number.class, 4);

        Map<String, Object> align = sectionConfigs.computeIfAbsent("align", k -> new HashMap<>());
        _ensure(align, "openParenCallSite", Boolean.class, false);
        _ensure(align, "openParenDefnSite", Boolean.class, false);
        _ensure(align, "ifWhileOpenParen", Boolean.class, true);
        _ensure(align, "arrowEnumeratorGenerator", Boolean.class, false);

        Map<String, Object> dangling = sectionConfigs.computeIfAbsent("danglingParentheses", k -> new HashMap<>());
        _ensure(dangling, "callSite", Boolean.class, true);
        _ensure(dangling, "defnSite", Boolean.class, true);

        Map<String, Object> binPack = sectionConfigs.computeIfAbsent("binPack", k -> new HashMap<>());
        _ensure(binPack, "callSite", Boolean.class, false);
        _ensure(binPack, "defnSite", Boolean.class, false);
        _ensure(binPack, "parentConstructors", Boolean.class, false);

        Map<String, Object> optIn = sectionConfigs.computeIfAbsent("optIn", k -> new HashMap<>());
        _ensure(optIn, "configStyleArguments", Boolean.class, true);
        _ensure(optIn, "breakChainOnFirstMethodDot", Boolean.class, true);
        _ensure(optIn, "breaksInsideChains", Boolean.class, false);
        _ensure(optIn, "annotationNewlines", Boolean.class, true);
        _ensure(optIn, "selfAnnotationNewline", Boolean.class, true);

        Map<String, Object> newlines = sectionConfigs.computeIfAbsent("newlines", k -> new HashMap<>());
        _ensure(newlines, "alwaysBeforeMultilineDef", Boolean.class, true);
        _ensure(newlines, "alwaysBeforeCurlyBraceLambdaParams", Boolean.class, false);
        _ensure(newlines, "sometimesBeforeColonInMethodReturnType", Boolean.class, true);
        _ensure(newlines, "neverInResultType", Boolean.class, false);
        _ensure(newlines, "penalizeSingleSelectMultiArgList", Boolean.class, true);
        _ensure(newlines, "afterCurlyLambda", String.class, "never");
        _ensure(newlines, "alwaysBeforeElseAfterCurlyIf", Boolean.class, false);
        _ensure(newlines, "avoidAfterYield", Boolean.class, true);
        _ensure(newlines, "beforeImplicitParamListModifier", Boolean.class, false);
        _ensure(newlines, "afterImplicitParamListModifier", Boolean.class, false);
        _ensure(newlines, "neverBeforeJsNative", Boolean.class, false);
        _ensure(newlines, "alwaysBeforeTopLevelStatements", Boolean.class, false);
        _ensure(newlines, "beforeSingleArgParenLambdaParams", Boolean.class, false);
        _ensure(newlines, "betweenCurlyAndCatchFinally", Boolean.class, false);

        Map<String, Object> spaces = sectionConfigs.computeIfAbsent("spaces", k -> new HashMap<>());
        _ensure(spaces, "inImportCurlyBraces", Boolean.class, false);
        _ensure(spaces, "inParentheses", Boolean.class, false);
        _ensure(spaces, "afterKeywordBeforeParen", Boolean.class, true);
        _ensure(spaces, "afterTripleEquals", Boolean.class, false);
        _ensure(spaces, "afterSymbolicDefs", Boolean.class, false);
        _ensure(spaces, "beforeContextBoundColon", String.class, "never");
        _ensure(spaces, "inByNameTypes", Boolean.class, true);

        Map<String, Object> indentOperator = sectionConfigs.computeIfAbsent("indentOperator", k -> new HashMap<>());
        _ensure(indentOperator, "include", String.class, ".*");
        _ensure(indentOperator, "exclude", String.class, "^(&&|\\|\\|)$");

        sectionConfigs.computeIfAbsent("editions", k -> new HashMap<>());
    }

    private static void _ensure(Map<String, Object> config, String key, Class<?> type, Object defaultValue) {
        if (!config.containsKey(key) || !type.isInstance(config.get(key))) {
            config.put(key, defaultValue);
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(FormatterConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put(GENERAL, new TreeMap<>(config.getGeneralConfigMap()));
            configMap.put(SECTIONS, new TreeMap<>(config.getSectionConfigsMap()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
