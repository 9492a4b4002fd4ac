package com.codeoptimizer.analyzer;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import com.codeoptimizer.api.AnalysisFragment;
import com.codeoptimizer.api.DetectorPlugin;
import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.IssueCategory;
import com.codeoptimizer.api.SourceUnit;
import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.config.ConfigurationLoader;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.dependency.CircularDependency;
import com.codeoptimizer.parser.ParserRegistry;
import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IssueDetectorTest {

    private final ParserRegistry parsers = ParserRegistry.withDefaults();
    private OptimizerConfig config;
    private IssueDetector detector;

    @BeforeEach
    void setUp() {
        config = ConfigurationLoader.loadDefaultConfig();
        detector = IssueDetector.withDefaultRules(config);
    }

    @Test
    void analyze_singleFunction_hasComplexityTwo() throws ParseException {
        FileAnalysis analysis = detector.analyze(_unit("add.js", "function f(a, b) { return a + b; }\n"));

        assertThat(analysis.getMetrics().getComplexity()).isEqualTo(2);
        assertThat(analysis.getMetrics().getFunctionCount()).isEqualTo(1);
        assertThat(analysis.getIssues()).isEmpty();
    }

    @Test
    void analyze_functionWithBranch_hasComplexityThree() throws ParseException {
        String code = """
                function f(a) {
                  if (a > 0) {
                    return a;
                  }
                  return -a;
                }
                """;

        FileAnalysis analysis = detector.analyze(_unit("abs.js", code));

        assertThat(analysis.getMetrics().getComplexity()).isEqualTo(3);
    }

    @Test
    void analyze_evalCall_reportsCriticalSecurityIssue() throws ParseException {
        FileAnalysis analysis = detector.analyze(_unit("eval.js", "let x = eval(\"1 + 2\");\n"));

        List<Issue> evals = analysis.getIssues(IssueCodes.EVAL_USAGE);
        assertThat(evals).hasSize(1);
        assertThat(evals.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(evals.get(0).getCategory()).isEqualTo(IssueCategory.SECURITY);
        assertThat(evals.get(0).getCodeSnippet()).isEqualTo("eval(\"1 + 2\")");
        assertThat(analysis.getMetrics().getSecurityScore()).isLessThan(100.0);
    }

    @Test
    void analyze_evalInsideString_isIgnored() throws ParseException {
        FileAnalysis analysis = detector.analyze(_unit("text.js", "let s = 'eval(x)'; // eval(y)\n"));

        assertThat(analysis.getIssues(IssueCodes.EVAL_USAGE)).isEmpty();
    }

    @Test
    void analyze_consoleLog_reportsDebugPrintAsInfo() throws ParseException {
        String code = """
                function f(a) {
                  console.log(a);
                  return a;
                }
                """;

        List<Issue> prints = detector.analyze(_unit("log.js", code)).getIssues(IssueCodes.DEBUG_PRINT);

        assertThat(prints).hasSize(1);
        assertThat(prints.get(0).getSeverity()).isEqualTo(Severity.INFO);
        assertThat(prints.get(0).getLocation().getLine()).isEqualTo(2);
        assertThat(prints.get(0).getCodeSnippet()).isEqualTo("console.log(a);");
    }

    @Test
    void analyze_javaSystemOut_reportsDebugPrint() throws ParseException {
        String code = """
                class A {
                    void run() {
                        System.out.println("x");
                    }
                }
                """;

        FileAnalysis analysis = detector.analyze(_unit("A.java", code));

        assertThat(analysis.getIssues(IssueCodes.DEBUG_PRINT)).hasSize(1);
        assertThat(analysis.getIssues(IssueCodes.VAR_DECLARATION)).isEmpty();
    }

    @Test
    void analyze_legacySyntax_reportsVarAndLooseEquality() throws ParseException {
        FileAnalysis analysis = detector.analyze(_unit("legacy.js", "var a = 1;\nif (a == 1) { a = 2; }\n"));

        assertThat(analysis.getIssues(IssueCodes.VAR_DECLARATION)).hasSize(1);
        assertThat(analysis.getIssues(IssueCodes.LOOSE_EQUALITY)).hasSize(1);
    }

    @Test
    void analyze_redundantTernary_isReported() throws ParseException {
        FileAnalysis analysis = detector.analyze(
                _unit("ternary.js", "function f(a) { return a > 1 ? true : false; }\n"));

        List<Issue> ternaries = analysis.getIssues(IssueCodes.REDUNDANT_TERNARY);
        assertThat(ternaries).hasSize(1);
        assertThat(ternaries.get(0).getCategory()).isEqualTo(IssueCategory.COMPLEXITY);
    }

    @Test
    void analyze_loopReadingLength_reportsRecomputedBound() throws ParseException {
        String code = """
                function sum(items) {
                  let total = 0;
                  for (let i = 0; i < items.length; i++) {
                    total += items[i];
                  }
                  return total;
                }
                """;

        FileAnalysis analysis = detector.analyze(_unit("sum.js", code));

        assertThat(analysis.getIssues(IssueCodes.LOOP_BOUND_RECOMPUTED)).hasSize(1);
    }

    @Test
    void analyze_loopMutatingCollection_keepsBound() throws ParseException {
        String code = """
                function drain(items) {
                  for (let i = 0; i < items.length; i++) {
                    items.pop();
                  }
                }
                """;

        FileAnalysis analysis = detector.analyze(_unit("drain.js", code));

        assertThat(analysis.getIssues(IssueCodes.LOOP_BOUND_RECOMPUTED)).isEmpty();
    }

    @Test
    void analyze_threeNestedLoops_reportsNestedLoops() throws ParseException {
        String code = """
                function cube(n) {
                  let c = 0;
                  for (let i = 0; i < n; i++) {
                    for (let j = 0; j < n; j++) {
                      for (let k = 0; k < n; k++) {
                        c++;
                      }
                    }
                  }
                  return c;
                }
                """;

        List<Issue> nested = detector.analyze(_unit("cube.js", code)).getIssues(IssueCodes.NESTED_LOOPS);

        assertThat(nested).hasSize(1);
        assertThat(nested.get(0).getSeverity()).isEqualTo(Severity.MINOR);
    }

    @Test
    void analyze_complexityAboveCritical_reportsCriticalIssue() throws ParseException {
        detector = IssueDetector.withDefaultRules(config.with("maxComplexity", 2).with("criticalComplexity", 3));
        String code = """
                function f(a) {
                  if (a > 1) { return 1; }
                  if (a > 2) { return 2; }
                  return 0;
                }
                """;

        List<Issue> issues = detector.analyze(_unit("branches.js", code)).getIssues(IssueCodes.EXCESSIVE_COMPLEXITY);

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void analyze_complexityAboveMaximum_reportsMajorIssue() throws ParseException {
        detector = IssueDetector.withDefaultRules(config.with("maxComplexity", 2).with("criticalComplexity", 10));
        String code = "function f(a) { if (a) { return 1; } return 0; }\n";

        List<Issue> issues = detector.analyze(_unit("branch.js", code)).getIssues(IssueCodes.EXCESSIVE_COMPLEXITY);

        assertThat(issues).hasSize(1);
        assertThat(issues.get(0).getSeverity()).isEqualTo(Severity.MAJOR);
    }

    @Test
    void analyze_failingPlugin_isSkipped() throws ParseException {
        detector.registerPlugin(new DetectorPlugin() {
            @Override
            public String getName() {
                return "broken";
            }

            @Override
            public AnalysisFragment detect(SourceUnit unit) {
                throw new IllegalStateException("boom");
            }
        });

        FileAnalysis analysis = detector.analyze(_unit("eval.js", "let x = eval(s);\n"));

        assertThat(analysis.getIssues(IssueCodes.EVAL_USAGE)).hasSize(1);
    }

    @Test
    void analyze_pluginFragment_isMerged() throws ParseException {
        detector.registerPlugin(new DetectorPlugin() {
            @Override
            public String getName() {
                return "custom";
            }

            @Override
            public AnalysisFragment detect(SourceUnit unit) {
                return AnalysisFragment.ofIssues(List.of(IssueFactory.atFile(unit)
                        .code("CUSTOM")
                        .category(IssueCategory.MAINTAINABILITY)
                        .severity(Severity.MINOR)
                        .message("custom finding")
                        .build()));
            }
        });

        FileAnalysis analysis = detector.analyze(_unit("plain.js", "let x = 1;\n"));

        assertThat(analysis.getIssues("CUSTOM")).hasSize(1);
    }

    @Test
    void analyze_severityFilter_keepsOnlyListedSeverities() throws ParseException {
        detector = IssueDetector.withDefaultRules(config.with("severityFilter", List.of("critical")));

        FileAnalysis analysis = detector.analyze(_unit("mixed.js", "var x = eval(s);\nconsole.log(x);\n"));

        assertThat(analysis.getIssues()).extracting(Issue::getCode).containsExactly(IssueCodes.EVAL_USAGE);
    }

    @Test
    void analyze_ignoredRuleAndDisabledCategory_areDropped() throws ParseException {
        detector = IssueDetector.withDefaultRules(config
                .with("ignoreRules", List.of(IssueCodes.VAR_DECLARATION))
                .with("enabledCategories", List.of("maintainability")));

        FileAnalysis analysis = detector.analyze(_unit("mixed.js", "var x = eval(s);\nconsole.log(x);\n"));

        assertThat(analysis.getIssues()).extracting(Issue::getCode).containsExactly(IssueCodes.DEBUG_PRINT);
    }

    @Test
    void analyze_cycleStartingAtFile_reportsCircularDependency() throws ParseException {
        CircularDependency cycle = new CircularDependency(List.of(Paths.get("b.js"), Paths.get("a.js")));

        FileAnalysis first = detector.analyze(_unit("a.js", "let x = 1;\n"), List.of(cycle));
        FileAnalysis second = detector.analyze(_unit("b.js", "let y = 2;\n"), List.of(cycle));

        assertThat(first.getIssues(IssueCodes.CIRCULAR_DEPENDENCY)).hasSize(1);
        assertThat(first.getIssues(IssueCodes.CIRCULAR_DEPENDENCY).get(0).getSeverity()).isEqualTo(Severity.MAJOR);
        assertThat(second.getIssues(IssueCodes.CIRCULAR_DEPENDENCY)).isEmpty();
    }

    private SourceUnit _unit(String name, String text) throws ParseException {
        Path path = Paths.get(name);
        SyntaxTree tree = parsers.forType(FileType.detect(path)).orElseThrow().parse(path, text);
        return new SourceUnit(path, text, tree.getFileType(), tree);
    }
}
