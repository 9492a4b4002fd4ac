package com.codeoptimizer.dependency;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.codeoptimizer.api.SourceFile;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CycleDetectorTest {

    @TempDir
    Path root;

    private final CycleDetector detector = new CycleDetector(10, List.of(), false);

    @Test
    void detect_twoFileCycle_reportsHighSeverity() {
        List<SourceFile> files = List.of(
                _file("a.js", "import { b } from './b';\nexport const a = 1;\n"),
                _file("b.js", "import { a } from './a.js';\nexport const b = 2;\n"));

        DependencyReport report = detector.detect(files);

        assertThat(report.getCycles()).hasSize(1);
        CircularDependency cycle = report.getCycles().get(0);
        assertThat(cycle.length()).isEqualTo(2);
        assertThat(cycle.getSeverity()).isEqualTo(CycleSeverity.HIGH);
        assertThat(cycle.getFiles()).containsExactly(root.resolve("a.js"), root.resolve("b.js"));
    }

    @Test
    void detect_threeFileCycle_isHighSeverity() {
        List<SourceFile> files = List.of(
                _file("a.js", "const b = require('./b');\n"),
                _file("b.js", "const c = require('./c');\n"),
                _file("c.js", "const a = require('./a');\n"));

        List<CircularDependency> cycles = detector.detect(files).getCycles();

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0).length()).isEqualTo(3);
        assertThat(cycles.get(0).getSeverity()).isEqualTo(CycleSeverity.HIGH);
    }

    @Test
    void detect_sixFileCycle_isLowSeverity() {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            files.add(_file("m" + i + ".js", "import x from './m" + ((i + 1) % 6) + "';\n"));
        }

        List<CircularDependency> cycles = detector.detect(files).getCycles();

        assertThat(cycles).hasSize(1);
        assertThat(cycles.get(0).length()).isEqualTo(6);
        assertThat(cycles.get(0).getSeverity()).isEqualTo(CycleSeverity.LOW);
    }

    @Test
    void detect_fourFileCycle_isMediumSeverity() {
        List<SourceFile> files = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            files.add(_file("n" + i + ".js", "import x from './n" + ((i + 1) % 4) + "';\n"));
        }

        assertThat(detector.detect(files).getCycles().get(0).getSeverity()).isEqualTo(CycleSeverity.MEDIUM);
    }

    @Test
    void detect_diamondWithoutBackEdge_hasNoCycle() {
        List<SourceFile> files = List.of(
                _file("a.js", "import b from './b';\nimport c from './c';\n"),
                _file("b.js", "import c from './c';\n"),
                _file("c.js", "export default 1;\n"));

        DependencyReport report = detector.detect(files);

        assertThat(report.getCycles()).isEmpty();
        assertThat(report.getTotalDependencies()).isEqualTo(3);
    }

    @Test
    void detect_runTwice_givesSameCycles() {
        List<SourceFile> files = List.of(
                _file("a.js", "import './b';\n"),
                _file("b.js", "import './c';\nimport './a';\n"),
                _file("c.js", "import './b';\n"));

        List<CircularDependency> first = detector.detect(files).getCycles();
        List<CircularDependency> second = detector.detect(files).getCycles();

        assertThat(first).hasSize(2);
        assertThat(second).containsExactlyElementsOf(first);
    }

    @Test
    void detect_excludedFile_neverJoinsACycle() {
        CycleDetector excluding = new CycleDetector(10, List.of("vendor/"), false);
        List<SourceFile> files = List.of(
                _file("a.js", "import v from './vendor/lib';\n"),
                _file("vendor/lib.js", "import a from '../a';\n"));

        DependencyReport report = excluding.detect(files);

        assertThat(report.getCycles()).isEmpty();
        assertThat(report.getGraph().getNodes()).containsExactly(root.resolve("a.js"));
    }

    @Test
    void detect_directoryImport_resolvesIndexFile() {
        List<SourceFile> files = List.of(
                _file("app.js", "import util from './util';\n"),
                _file("util/index.js", "import app from '../app';\n"));

        DependencyReport report = detector.detect(files);

        assertThat(report.getGraph().getDependencies(root.resolve("app.js")))
                .containsExactly(root.resolve("util/index.js"));
        assertThat(report.getCycles()).hasSize(1);
    }

    @Test
    void detect_bareAndCommentedImports_areIgnored() {
        List<SourceFile> files = List.of(
                _file("a.js", "import React from 'react';\n// import b from './b';\n"),
                _file("b.js", "import a from './a';\n"));

        DependencyReport report = detector.detect(files);

        assertThat(report.getGraph().getDependencies(root.resolve("a.js"))).isEmpty();
        assertThat(report.getCycles()).isEmpty();
    }

    @Test
    void detect_javaImports_followPackagesAndStaticImports() {
        List<SourceFile> files = List.of(
                _file("src/demo/Order.java", "package demo;\n\nimport demo.util.Prices;\n\nclass Order { }\n"),
                _file("src/demo/util/Prices.java",
                        "package demo.util;\n\nimport static demo.Order.create;\nimport java.util.List;\n\nclass Prices { }\n"));

        DependencyReport report = detector.detect(files);

        assertThat(report.getCycles()).hasSize(1);
        assertThat(report.getCycles().get(0).length()).isEqualTo(2);
    }

    @Test
    void findCycles_depthLimit_leavesLongCycleUnresolved() {
        CycleDetector shallow = new CycleDetector(2, List.of(), false);
        List<SourceFile> files = List.of(
                _file("a.js", "import './b';\n"),
                _file("b.js", "import './c';\n"),
                _file("c.js", "import './a';\n"));

        DependencyReport report = shallow.detect(files);

        assertThat(report.getCycles()).isEmpty();
        assertThat(report.getUnresolved()).contains(root.resolve("b.js"));
    }

    @Test
    void report_statistics_describeGraph() {
        List<SourceFile> files = List.of(
                _file("a.js", "import './b';\nimport './c';\n"),
                _file("b.js", "import './c';\n"),
                _file("c.js", "export default 1;\n"),
                _file("d.js", "export default 2;\n"));

        DependencyReport report = detector.detect(files);

        assertThat(report.getTotalFiles()).isEqualTo(4);
        assertThat(report.getTotalDependencies()).isEqualTo(3);
        assertThat(report.getMaxDependencies()).isEqualTo(2);
        assertThat(report.getAverageDependencies()).isEqualTo(0.75);
        assertThat(report.getSuggestions()).isEmpty();
    }

    @Test
    void report_detailed_suggestsFixPerCycle() {
        CycleDetector detailed = new CycleDetector(10, List.of(), true);
        List<SourceFile> files = List.of(
                _file("a.js", "import './b';\n"),
                _file("b.js", "import './a';\n"));

        DependencyReport report = detailed.detect(files);

        assertThat(report.getSuggestions()).hasSize(1);
        assertThat(report.getSuggestions().values().iterator().next()).contains("a.js", "b.js");
    }

    @Test
    void toDot_marksCycleEdges() {
        List<SourceFile> files = List.of(
                _file("a.js", "import './b';\nimport './c';\n"),
                _file("b.js", "import './a';\n"),
                _file("c.js", "export default 1;\n"));

        DependencyReport report = detector.detect(files);
        String dot = report.getGraph().toDot(report.getCycles());

        assertThat(dot).startsWith("digraph dependencies {");
        assertThat(dot).contains("\"" + root.resolve("a.js") + "\" -> \"" + root.resolve("b.js") + "\" [color=red");
        assertThat(dot).contains("\"" + root.resolve("a.js") + "\" -> \"" + root.resolve("c.js") + "\";");
    }

    private SourceFile _file(String relative, String text) {
        return new SourceFile(root.resolve(relative), text);
    }
}
