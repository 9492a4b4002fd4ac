package com.codeoptimizer.cli;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OptimizerCliTest {

    private static final String TERNARY = "function f(a) { return a > 1 ? true : false; }\n";

    @TempDir
    Path tempDir;

    @Test
    void run_help_succeeds() {
        assertThat(OptimizerCli.run(new String[]{"help", "--no-color"})).isZero();
    }

    @Test
    void run_unknownCommandOrNoArguments_fails() {
        assertThat(OptimizerCli.run(new String[]{"format"})).isEqualTo(1);
        assertThat(OptimizerCli.run(new String[0])).isEqualTo(1);
    }

    @Test
    void run_optimizeMissingPath_fails() {
        assertThat(OptimizerCli.run(new String[]{"optimize", tempDir.resolve("nowhere").toString()})).isEqualTo(1);
    }

    @Test
    void run_invalidThreshold_reportsConfigurationError() throws IOException {
        Files.writeString(tempDir.resolve("f.js"), TERNARY);

        int exitCode = OptimizerCli.run(new String[]{"optimize", tempDir.toString(), "--threshold=high", "--no-color"});

        assertThat(exitCode).isEqualTo(2);
    }

    @Test
    void run_optimizeWithApply_rewritesFilesAndWritesOutputs() throws IOException {
        Path file = tempDir.resolve("f.js");
        Files.writeString(file, TERNARY);
        Path dot = tempDir.resolve("deps.dot");
        Path log = tempDir.resolve("learning.jsonl");
        Path diagnostics = tempDir.resolve("logs/optimizer.log");

        int exitCode = OptimizerCli.run(new String[]{"optimize", file.toString(), "--apply", "--no-backup",
                "--dot=" + dot, "--log=" + log, "--log-file=" + diagnostics, "--no-color"});

        assertThat(exitCode).isZero();
        assertThat(Files.readString(file)).contains("!!(a > 1)");
        assertThat(Files.readString(dot)).startsWith("digraph dependencies {");
        assertThat(Files.readAllLines(log)).hasSize(1);
        assertThat(Files.readString(diagnostics)).contains("Stage APPLYING");
    }

    @Test
    void findFiles_skipsExcludedAndUnsupportedFiles() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.createDirectories(tempDir.resolve("node_modules/lib"));
        Files.writeString(tempDir.resolve("src/app.js"), TERNARY);
        Files.writeString(tempDir.resolve("src/Main.java"), "class Main {}\n");
        Files.writeString(tempDir.resolve("src/app.min.js"), TERNARY);
        Files.writeString(tempDir.resolve("src/notes.txt"), "notes\n");
        Files.writeString(tempDir.resolve("node_modules/lib/index.js"), TERNARY);

        List<Path> files = OptimizerCli.findFiles(tempDir, List.of("node_modules", "*.min.js"));

        assertThat(files).containsExactly(tempDir.resolve("src/Main.java"), tempDir.resolve("src/app.js"));
    }
}
