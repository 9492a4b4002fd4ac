package com.codeoptimizer.transform;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceRange;
import com.codeoptimizer.api.Transformation;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.config.ConfigurationLoader;
import org.junit.jupiter.api.Test;

class TransformationPrioritizerTest {

    private static final String TEXT = "abcdefghijklmnopqrstuvwxyz";

    private final TransformationPrioritizer prioritizer =
            TransformationPrioritizer.fromConfig(ConfigurationLoader.loadDefaultConfig());

    @Test
    void prioritize_ordersBySeverityFirst() {
        Transformation minorSecurity = _fix("minor-security", IssueCategory.SECURITY, Severity.MINOR, 0.9, 0, 1);
        Transformation criticalMaintainability = _fix("critical-maint", IssueCategory.MAINTAINABILITY, Severity.CRITICAL, 0.8, 2, 3);

        List<Transformation> ordered = prioritizer.prioritize(List.of(minorSecurity, criticalMaintainability));

        assertThat(ordered).extracting(Transformation::getId).containsExactly("critical-maint", "minor-security");
    }

    @Test
    void prioritize_sameSeverity_followsCategoryOrder() {
        Transformation complexity = _fix("complexity", IssueCategory.COMPLEXITY, Severity.MINOR, 0.9, 0, 1);
        Transformation performance = _fix("performance", IssueCategory.PERFORMANCE, Severity.MINOR, 0.9, 2, 3);
        Transformation maintainability = _fix("maintainability", IssueCategory.MAINTAINABILITY, Severity.MINOR, 0.9, 4, 5);

        List<Transformation> ordered = prioritizer.prioritize(List.of(maintainability, complexity, performance));

        assertThat(ordered).extracting(Transformation::getId)
                .containsExactly("performance", "complexity", "maintainability");
    }

    @Test
    void prioritize_sameCategory_prefersHigherConfidence() {
        Transformation low = _fix("low", IssueCategory.PERFORMANCE, Severity.MINOR, 0.71, 0, 1);
        Transformation high = _fix("high", IssueCategory.PERFORMANCE, Severity.MINOR, 0.95, 2, 3);

        assertThat(prioritizer.prioritize(List.of(low, high))).extracting(Transformation::getId)
                .containsExactly("high", "low");
    }

    @Test
    void prioritize_customOrder_isRespected() {
        TransformationPrioritizer custom = new TransformationPrioritizer(
                List.of(IssueCategory.MAINTAINABILITY, IssueCategory.SECURITY));
        Transformation security = _fix("security", IssueCategory.SECURITY, Severity.MAJOR, 0.9, 0, 1);
        Transformation maintainability = _fix("maintainability", IssueCategory.MAINTAINABILITY, Severity.MAJOR, 0.9, 2, 3);
        Transformation unlisted = _fix("unlisted", IssueCategory.COMPLEXITY, Severity.MAJOR, 0.9, 4, 5);

        assertThat(custom.prioritize(List.of(unlisted, security, maintainability))).extracting(Transformation::getId)
                .containsExactly("maintainability", "security", "unlisted");
    }

    @Test
    void prioritize_leavesInputUntouched() {
        List<Transformation> input = new ArrayList<>(List.of(
                _fix("b", IssueCategory.COMPLEXITY, Severity.MINOR, 0.9, 0, 1),
                _fix("a", IssueCategory.SECURITY, Severity.CRITICAL, 0.9, 2, 3)));

        prioritizer.prioritize(input);

        assertThat(input).extracting(Transformation::getId).containsExactly("b", "a");
    }

    @Test
    void resolveConflicts_dropsOverlapWithHigherPriority() {
        Transformation winner = _fix("winner", IssueCategory.SECURITY, Severity.CRITICAL, 0.8, 2, 8);
        Transformation loser = _fix("loser", IssueCategory.MAINTAINABILITY, Severity.MINOR, 0.9, 5, 10);
        Transformation separate = _fix("separate", IssueCategory.MAINTAINABILITY, Severity.MINOR, 0.9, 10, 12);

        List<Transformation> kept = prioritizer.resolveConflicts(List.of(loser, separate, winner));

        assertThat(kept).extracting(Transformation::getId).containsExactly("winner", "separate");
    }

    private static Transformation _fix(String id, IssueCategory type, Severity severity, double confidence,
                                       int start, int end) {
        return Transformation.builder()
                .id(id)
                .filePath(Paths.get("sample.js"))
                .original(SourceRange.of(TEXT, start, end))
                .replacement("_")
                .type(type)
                .severity(severity)
                .confidence(confidence)
                .build();
    }
}
