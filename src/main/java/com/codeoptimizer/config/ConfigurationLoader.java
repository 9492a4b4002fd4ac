package com.codeoptimizer.config;

import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.error.ConfigurationException;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.util.LoggerUtil;
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
 * Loads optimizer configuration from YAML, fills in defaults and rejects invalid thresholds.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class);
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    private static final List<String> DEFAULT_PRIORITY = List.of("security", "performance", "complexity", "maintainability");

    /**
     * Loads configuration from a file, falling back to the bundled defaults when the file is absent.
     *
     * @throws ConfigurationException when the file is unreadable or holds invalid values
     */
    public static OptimizerConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.warning("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        Map<String, Object> config;
        try {
            logger.info("Loading configuration from: " + configPath);
            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> parsed = mapper.readValue(configPath.toFile(), Map.class);
            config = parsed != null ? parsed : new HashMap<>();
        } catch (IOException e) {
            throw new ConfigurationException("Error parsing configuration file " + configPath + ": " + e.getMessage(), e);
        }

        OptimizerConfig optimizerConfig = fromMap(config);
        logger.info("Configuration loaded successfully with " +
                optimizerConfig.getPluginConfigsMap().size() + " plugin configurations");
        return optimizerConfig;
    }

    /**
     * Loads the embedded default configuration.
     */
    public static OptimizerConfig loadDefaultConfig() {
        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return fromMap(new HashMap<>());
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);
            logger.fine("Default configuration loaded");
            return fromMap(config != null ? config : new HashMap<>());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return fromMap(new HashMap<>());
        }
    }

    /**
     * Builds a configuration from a parsed map with "general" and "plugins" sections.
     *
     * @throws ConfigurationException when a general option is out of range
     */
    @SuppressWarnings("unchecked")
    public static OptimizerConfig fromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        if (config.get("general") instanceof Map) {
            generalConfig = new HashMap<>((Map<String, Object>) config.get("general"));
        } else if (config.containsKey("general")) {
            logger.warning("Invalid 'general' section in config, using defaults");
        }

        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        if (config.get("plugins") instanceof Map) {
            Map<String, Object> pluginsMap = (Map<String, Object>) config.get("plugins");

            for (Map.Entry<String, Object> entry : pluginsMap.entrySet()) {
                if (entry.getValue() instanceof Map) {
                    pluginConfigs.put(entry.getKey(), new HashMap<>((Map<String, Object>) entry.getValue()));
                } else {
                    logger.warning("Invalid configuration for plugin '" + entry.getKey() + "', using defaults");
                    pluginConfigs.put(entry.getKey(), new HashMap<>());
                }
            }
        }

        _validatePluginConfigs(pluginConfigs);
        _ensureDefaultPluginConfigs(pluginConfigs);

        _validateGeneralConfig(generalConfig);

        return new OptimizerConfig(generalConfig, pluginConfigs);
    }

    private static void _validateGeneralConfig(Map<String, Object> generalConfig) {
        _requireRange(generalConfig, "confidenceThreshold", 0.0, 1.0);
        _requireRange(generalConfig, "maxComplexity", 1, 10_000);
        _requireRange(generalConfig, "maxDepth", 1, 100);
        _requireRange(generalConfig, "timeoutMs", 1, 600_000);
        _requireRange(generalConfig, "workerLimit", 1, 64);
        _requireRange(generalConfig, "behaviorTolerance", 0.0, 100.0);

        int maxComplexity = ((Number) generalConfig.get("maxComplexity")).intValue();
        int criticalComplexity = ((Number) generalConfig.get("criticalComplexity")).intValue();
        if (criticalComplexity < maxComplexity) {
            throw new ConfigurationException("criticalComplexity (" + criticalComplexity +
                    ") must not be lower than maxComplexity (" + maxComplexity + ")");
        }

        try {
            for (Object name : (List<?>) generalConfig.get("severityFilter")) {
                Severity.fromString(String.valueOf(name));
            }
            for (Object name : (List<?>) generalConfig.get("typePriorityOrder")) {
                IssueCategory.fromString(String.valueOf(name));
            }
            for (Object name : (List<?>) generalConfig.get("enabledCategories")) {
                IssueCategory.fromString(String.valueOf(name));
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    /**
     * A general option outside its range is fatal.
     */
    private static void _requireRange(Map<String, Object> config, String key, double min, double max) {
        Object value = config.get(key);
        if (!(value instanceof Number)) {
            throw new ConfigurationException("Configuration value '" + key + "' must be a number, got: " + value);
        }
        double number = ((Number) value).doubleValue();
        if (Double.isNaN(number) || number < min || number > max) {
            throw new ConfigurationException("Configuration value '" + key + "' = " + value +
                    " is outside the acceptable range (" + _format(min) + "-" + _format(max) + ")");
        }
    }

    private static void _validatePluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        _validateIntRange(pluginConfigs.get("nestedLoops"), "maxDepth", 2, 10);
        _validateIntRange(pluginConfigs.get("functionLength"), "maxLines", 5, 1000);
        _validateIntRange(pluginConfigs.get("functionLength"), "criticalLines", 5, 5000);
    }

    /**
     * Plugin options outside their range fall back to the default value.
     */
    private static void _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config != null && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
            }
        }
    }

    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        _putIfInvalid(generalConfig, "maxComplexity", Number.class, 15);
        _putIfInvalid(generalConfig, "criticalComplexity", Number.class, 25);
        _putIfInvalid(generalConfig, "confidenceThreshold", Number.class, 0.7);
        _putIfInvalid(generalConfig, "maxDepth", Number.class, 10);
        _putIfInvalid(generalConfig, "timeoutMs", Number.class, 5000);
        _putIfInvalid(generalConfig, "workerLimit", Number.class, Math.max(1, Math.min(8, Runtime.getRuntime().availableProcessors())));
        _putIfInvalid(generalConfig, "behaviorTolerance", Number.class, 0.1);
        _putIfInvalid(generalConfig, "autoApply", Boolean.class, false);
        _putIfInvalid(generalConfig, "keepBackup", Boolean.class, true);
        _putIfInvalid(generalConfig, "detailedReport", Boolean.class, false);
        _putIfInvalid(generalConfig, "severityFilter", List.class, new ArrayList<String>());
        _putIfInvalid(generalConfig, "typePriorityOrder", List.class, new ArrayList<>(DEFAULT_PRIORITY));
        _putIfInvalid(generalConfig, "enabledCategories", List.class, new ArrayList<>(DEFAULT_PRIORITY));
        _putIfInvalid(generalConfig, "ignoreRules", List.class, new ArrayList<String>());
        _putIfInvalid(generalConfig, "excludePatterns", List.class, new ArrayList<String>());
    }

    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> nestedLoops = pluginConfigs.computeIfAbsent("nestedLoops", k -> new HashMap<>());
        _putIfInvalid(nestedLoops, "maxDepth", Number.class, 3);

        Map<String, Object> functionLength = pluginConfigs.computeIfAbsent("functionLength", k -> new HashMap<>());
        _putIfInvalid(functionLength, "maxLines", Number.class, 50);
        _putIfInvalid(functionLength, "criticalLines", Number.class, 100);
    }

    private static void _putIfInvalid(Map<String, Object> config, String key, Class<?> type, Object defaultValue) {
        Object value = config.get(key);
        if (value == null) {
            config.put(key, defaultValue);
        } else if (!type.isInstance(value)) {
            if (type == Number.class) {
                throw new ConfigurationException("Configuration value '" + key + "' must be a number, got: " + value);
            }
            logger.warning("Configuration value '" + key + "' has the wrong type, using default " + defaultValue);
            config.put(key, defaultValue);
        }
    }

    private static String _format(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }

    /**
     * Saves configuration to a YAML file.
     */
    public static void saveConfig(OptimizerConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", new TreeMap<>(config.getGeneralConfigMap()));
            configMap.put("plugins", new TreeMap<>(config.getPluginConfigsMap()));

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
