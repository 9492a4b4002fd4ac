package com.codeoptimizer.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.error.Severity;

/**
 * Configuration of the optimizer: general pipeline options plus per-plugin settings.
 * Instances are built and validated by {@link ConfigurationLoader}.
 */
public class OptimizerConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;

    OptimizerConfig(Map<String, Object> generalConfig,
                    Map<String, Map<String, Object>> pluginConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : pluginConfigs.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    /**
     * Returns a validated copy with one general option replaced.
     */
    public OptimizerConfig with(String key, Object value) {
        Map<String, Object> general = getGeneralConfigMap();
        general.put(key, value);

        Map<String, Object> raw = new HashMap<>();
        raw.put("general", general);
        raw.put("plugins", getPluginConfigsMap());
        return ConfigurationLoader.fromMap(raw);
    }

    /**
     * Returns a validated copy with one plugin option replaced.
     */
    public OptimizerConfig withPluginOption(String plugin, String key, Object value) {
        Map<String, Map<String, Object>> plugins = getPluginConfigsMap();
        plugins.computeIfAbsent(plugin, k -> new HashMap<>()).put(key, value);

        Map<String, Object> raw = new HashMap<>();
        raw.put("general", getGeneralConfigMap());
        raw.put("plugins", plugins);
        return ConfigurationLoader.fromMap(raw);
    }

    public int getMaxComplexity() {
        return _number("maxComplexity").intValue();
    }

    public int getCriticalComplexity() {
        return _number("criticalComplexity").intValue();
    }

    /**
     * Severities kept after analysis. Empty means every severity.
     */
    public Set<Severity> getSeverityFilter() {
        Set<Severity> filter = EnumSet.noneOf(Severity.class);
        for (String name : _strings("severityFilter")) {
            filter.add(Severity.fromString(name));
        }
        return filter;
    }

    public double getConfidenceThreshold() {
        return _number("confidenceThreshold").doubleValue();
    }

    public List<IssueCategory> getTypePriorityOrder() {
        List<IssueCategory> order = new ArrayList<>();
        for (String name : _strings("typePriorityOrder")) {
            IssueCategory category = IssueCategory.fromString(name);
            if (!order.contains(category)) {
                order.add(category);
            }
        }
        return order;
    }

    public int getMaxDepth() {
        return _number("maxDepth").intValue();
    }

    public long getTimeoutMs() {
        return _number("timeoutMs").longValue();
    }

    public boolean isAutoApply() {
        return Boolean.TRUE.equals(generalConfig.get("autoApply"));
    }

    public boolean isKeepBackup() {
        return Boolean.TRUE.equals(generalConfig.get("keepBackup"));
    }

    public boolean isDetailedReport() {
        return Boolean.TRUE.equals(generalConfig.get("detailedReport"));
    }

    public int getWorkerLimit() {
        return _number("workerLimit").intValue();
    }

    public Set<IssueCategory> getEnabledCategories() {
        Set<IssueCategory> categories = EnumSet.noneOf(IssueCategory.class);
        for (String name : _strings("enabledCategories")) {
            categories.add(IssueCategory.fromString(name));
        }
        return categories;
    }

    public Set<String> getIgnoreRules() {
        return new LinkedHashSet<>(_strings("ignoreRules"));
    }

    public List<String> getExcludePatterns() {
        return _strings("excludePatterns");
    }

    /**
     * Relative cost increase tolerated by the behavior stage before it warns.
     */
    public double getBehaviorTolerance() {
        return _number("behaviorTolerance").doubleValue();
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        return value != null ? (T) value : defaultValue;
    }

    @SuppressWarnings("unchecked")
    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        Map<String, Object> pluginConfig = pluginConfigs.get(plugin);
        if (pluginConfig == null) {
            return defaultValue;
        }

        Object value = pluginConfig.get(key);
        if (value == null) {
            return defaultValue;
        }

        if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {
            if (defaultValue instanceof Integer && value instanceof Number) {
                return (T) Integer.valueOf(((Number) value).intValue());
            } else if (defaultValue instanceof Double && value instanceof Number) {
                return (T) Double.valueOf(((Number) value).doubleValue());
            } else if (defaultValue instanceof Boolean && value instanceof String) {
                return (T) Boolean.valueOf(value.toString());
            } else if (defaultValue instanceof String) {
                return (T) value.toString();
            }

            return defaultValue;
        }

        return (T) value;
    }

    private Number _number(String key) {
        return (Number) generalConfig.get(key);
    }

    private List<String> _strings(String key) {
        Object value = generalConfig.get(key);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item != null) {
                result.add(item.toString());
            }
        }
        return result;
    }
}
