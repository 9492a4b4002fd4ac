package com.codeoptimizer.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.error.ConfigurationException;
import com.codeoptimizer.api.error.Severity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefaultConfig_bundledResource_hasDocumentedDefaults() {
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThat(config.getConfidenceThreshold()).isEqualTo(0.7);
        assertThat(config.getMaxComplexity()).isEqualTo(15);
        assertThat(config.getMaxDepth()).isEqualTo(10);
        assertThat(config.getTimeoutMs()).isEqualTo(5000);
        assertThat(config.isAutoApply()).isFalse();
        assertThat(config.isKeepBackup()).isTrue();
        assertThat(config.getTypePriorityOrder()).containsExactly(
                IssueCategory.SECURITY, IssueCategory.PERFORMANCE, IssueCategory.COMPLEXITY, IssueCategory.MAINTAINABILITY);
        assertThat(config.getSeverityFilter()).isEmpty();
        assertThat(config.getExcludePatterns()).contains("node_modules");
    }

    @Test
    void loadConfig_missingFile_fallsBackToDefaults() {
        OptimizerConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));

        assertThat(config.getConfidenceThreshold()).isEqualTo(0.7);
    }

    @Test
    void loadConfig_partialFile_fillsMissingValues() throws IOException {
        Path file = tempDir.resolve(".optimizer.yml");
        Files.writeString(file, """
                general:
                  confidenceThreshold: 0.9
                  autoApply: true
                  severityFilter: [critical, error]
                plugins:
                  nestedLoops:
                    maxDepth: 4
                """);

        OptimizerConfig config = ConfigurationLoader.loadConfig(file);

        assertThat(config.getConfidenceThreshold()).isEqualTo(0.9);
        assertThat(config.isAutoApply()).isTrue();
        assertThat(config.getSeverityFilter()).containsExactlyInAnyOrder(Severity.CRITICAL, Severity.MAJOR);
        assertThat(config.getMaxComplexity()).isEqualTo(15);
        assertThat(config.getPluginConfig("nestedLoops", "maxDepth", 3)).isEqualTo(4);
        assertThat(config.getPluginConfig("functionLength", "maxLines", 0)).isEqualTo(50);
    }

    @Test
    void loadConfig_thresholdOutOfRange_isFatal() throws IOException {
        Path file = tempDir.resolve("bad.yml");
        Files.writeString(file, "general:\n  confidenceThreshold: 1.5\n");

        assertThatThrownBy(() -> ConfigurationLoader.loadConfig(file))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("confidenceThreshold");
    }

    @Test
    void loadConfig_malformedYaml_isFatal() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n");

        assertThatThrownBy(() -> ConfigurationLoader.loadConfig(file))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fromMap_unknownCategory_isFatal() {
        Map<String, Object> general = new HashMap<>();
        general.put("typePriorityOrder", List.of("security", "speed"));
        Map<String, Object> raw = new HashMap<>();
        raw.put("general", general);

        assertThatThrownBy(() -> ConfigurationLoader.fromMap(raw))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("speed");
    }

    @Test
    void fromMap_criticalBelowMaxComplexity_isFatal() {
        Map<String, Object> general = new HashMap<>();
        general.put("maxComplexity", 30);
        general.put("criticalComplexity", 20);
        Map<String, Object> raw = new HashMap<>();
        raw.put("general", general);

        assertThatThrownBy(() -> ConfigurationLoader.fromMap(raw))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void fromMap_pluginValueOutOfRange_usesDefault() {
        Map<String, Object> nestedLoops = new HashMap<>();
        nestedLoops.put("maxDepth", 50);
        Map<String, Object> plugins = new HashMap<>();
        plugins.put("nestedLoops", nestedLoops);
        Map<String, Object> raw = new HashMap<>();
        raw.put("plugins", plugins);

        OptimizerConfig config = ConfigurationLoader.fromMap(raw);

        assertThat(config.getPluginConfig("nestedLoops", "maxDepth", 0)).isEqualTo(3);
    }

    @Test
    void with_validValue_returnsUpdatedCopy() {
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();

        OptimizerConfig updated = config.with("autoApply", true).with("confidenceThreshold", 0.5);

        assertThat(updated.isAutoApply()).isTrue();
        assertThat(updated.getConfidenceThreshold()).isEqualTo(0.5);
        assertThat(config.isAutoApply()).isFalse();
    }

    @Test
    void with_invalidValue_isRejected() {
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig();

        assertThatThrownBy(() -> config.with("timeoutMs", 0))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void saveConfig_thenLoad_keepsValues() throws IOException {
        Path file = tempDir.resolve("nested/.optimizer.yml");
        OptimizerConfig config = ConfigurationLoader.loadDefaultConfig()
                .with("maxDepth", 7)
                .withPluginOption("functionLength", "maxLines", 80);

        ConfigurationLoader.saveConfig(config, file);
        OptimizerConfig loaded = ConfigurationLoader.loadConfig(file);

        assertThat(loaded.getMaxDepth()).isEqualTo(7);
        assertThat(loaded.getPluginConfig("functionLength", "maxLines", 0)).isEqualTo(80);
    }
}
