package com.codeoptimizer.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.codeoptimizer.api.FileAnalysis;
import com.codeoptimizer.api.Issue;
import com.codeoptimizer.api.OptimizationOutcome;
import com.codeoptimizer.api.SourceFile;
import com.codeoptimizer.api.error.ConfigurationException;
import com.codeoptimizer.api.error.Severity;
import com.codeoptimizer.config.ConfigurationLoader;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.core.InMemoryLearningLog;
import com.codeoptimizer.core.JsonLearningLog;
import com.codeoptimizer.core.LearningLog;
import com.codeoptimizer.core.Orchestrator;
import com.codeoptimizer.core.PipelineResult;
import com.codeoptimizer.core.PlanEntry;
import com.codeoptimizer.dependency.DependencyReport;
import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.util.ConsoleReporter;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Command line entry point: discovers files, runs the optimizer and prints the result.
 */
public class OptimizerCli {
    private static final Logger logger = LoggerUtil.getLogger(OptimizerCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".optimizer.yml";
    private static ConsoleReporter reporter = new ConsoleReporter(false);

    public static void main(String[] args) {
        System.exit(run(args));
    }

    /**
     * Runs one command and returns the process exit code.
     */
    public static int run(String[] args) {
        try {
            reporter = new ConsoleReporter(!_hasOption(args, "--no-color"));

            if (args.length < 1) {
                _printUsage();
                return 1;
            }

            if (_hasOption(args, "--verbose")) {
                LoggerUtil.setConsoleLevel(Level.FINE);
            } else {
                LoggerUtil.setConsoleLevel(Level.WARNING);
            }
            String logFile = _getOptionValue(args, "--log-file");
            if (logFile != null) {
                LoggerUtil.enableFileLogging(Paths.get(logFile));
            }

            switch (args[0]) {
                case "optimize":
                    return _optimize(args);
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    System.out.println("Source Optimizer version " + VERSION);
                    return 0;
                case "help":
                case "--help":
                case "-h":
                    _printUsage();
                    return 0;
                default:
                    _printError("Unknown command: " + args[0]);
                    _printUsage();
                    return 1;
            }
        } catch (ConfigurationException e) {
            _printError("Invalid configuration: " + e.getMessage());
            return 2;
        } catch (IOException | RuntimeException e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);
            _printInfo("Use --verbose or --log-file=<file> for details");
            return 1;
        } finally {
            LoggerUtil.shutdown();
        }
    }

    private static void _printUsage() {
        System.out.println(reporter.colorize(ConsoleReporter.ANSI_BOLD, "Source Optimizer CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  optimizer optimize <path>          - Analyze, validate and (with --apply) fix files in path");
        System.out.println("  optimizer init [--force]           - Write a " + CONFIG_FILE_NAME + " with the defaults");
        System.out.println("  optimizer help                     - Show this help");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                    - Use a specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --apply                            - Write approved transformations to disk");
        System.out.println("  --no-backup                        - Do not keep <file>.bak copies");
        System.out.println("  --threshold=<0..1>                 - Minimum transformation confidence");
        System.out.println("  --exclude=<glob,...>               - Additional exclude patterns");
        System.out.println("  --dot=<file>                       - Write the dependency graph in Graphviz format");
        System.out.println("  --log=<file.jsonl>                 - Append outcomes to a JSON lines learning log");
        System.out.println("  --log-file=<file>                  - Write a detailed diagnostic log");
        System.out.println("  --verbose                          - Show detailed output");
        System.out.println("  --no-color                         - Disable colored output");
    }

    private static int _optimize(String[] args) throws IOException {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return 1;
        }

        Path path = Paths.get(args[1]).toAbsolutePath().normalize();
        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return 1;
        }

        OptimizerConfig config = _loadConfig(args);
        List<Path> paths = findFiles(path, config.getExcludePatterns());
        _printInfo("Found " + paths.size() + " files to analyze");

        List<SourceFile> files = new ArrayList<>();
        for (Path file : paths) {
            try {
                files.add(SourceFile.read(file));
            } catch (IOException e) {
                _printWarning("Cannot read " + file + ": " + e.getMessage());
                logger.log(Level.WARNING, "Cannot read " + file, e);
            }
        }

        String logFile = _getOptionValue(args, "--log");
        LearningLog learningLog = logFile != null ? new JsonLearningLog(Paths.get(logFile)) : new InMemoryLearningLog();

        PipelineResult result;
        try (Orchestrator orchestrator = Orchestrator.create(config, learningLog)) {
            result = orchestrator.run(files);
        }

        _printReport(result, _hasOption(args, "--verbose"));

        String dotFile = _getOptionValue(args, "--dot");
        DependencyReport dependencies = result.getDependencyReport();
        if (dotFile != null && dependencies != null) {
            Files.writeString(Paths.get(dotFile), dependencies.getGraph().toDot(dependencies.getCycles()),
                    StandardCharsets.UTF_8);
            _printSuccess("Dependency graph written to " + dotFile);
        }

        if (!config.isAutoApply() && !result.getEntries(PlanEntry.Status.APPROVED).isEmpty()) {
            _printInfo("Run again with --apply to write the approved transformations");
        }
        OptimizationOutcome outcome = result.getOutcome();
        return outcome.isSuccess() && !"ERROR".equals(outcome.getFinalStage()) ? 0 : 1;
    }

    private static OptimizerConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        OptimizerConfig config;
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            config = ConfigurationLoader.loadConfig(Paths.get(configFile));
        } else {
            config = ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
        }

        if (_hasOption(args, "--apply")) {
            config = config.with("autoApply", true);
        }
        if (_hasOption(args, "--no-backup")) {
            config = config.with("keepBackup", false);
        }

        String threshold = _getOptionValue(args, "--threshold");
        if (threshold != null) {
            try {
                config = config.with("confidenceThreshold", Double.parseDouble(threshold));
            } catch (NumberFormatException e) {
                throw new ConfigurationException("Invalid threshold: " + threshold, e);
            }
        }

        String exclude = _getOptionValue(args, "--exclude");
        if (exclude != null) {
            List<String> patterns = new ArrayList<>(config.getExcludePatterns());
            Arrays.stream(exclude.split(","))
                    .map(String::trim)
                    .filter(p -> !p.isEmpty())
                    .forEach(patterns::add);
            config = config.with("excludePatterns", patterns);
        }
        return config;
    }

    private static void _printReport(PipelineResult result, boolean verbose) {
        for (FileAnalysis analysis : result.getAnalyses()) {
            if (analysis.getIssues().isEmpty()) {
                if (verbose) {
                    _printSuccess("  No issues found: " + analysis.getPath());
                }
                continue;
            }

            System.out.println(reporter.colorize(ConsoleReporter.ANSI_BOLD, analysis.getPath() + ":"));
            Map<Severity, List<Issue>> bySeverity = reporter.groupBySeverity(analysis.getIssues());
            for (Severity severity : Severity.values()) {
                for (Issue issue : bySeverity.getOrDefault(severity, List.of())) {
                    System.out.println("  " + reporter.formatIssue(issue).replace("\n", "\n  "));
                }
            }
        }

        if (!result.getSkippedFiles().isEmpty()) {
            System.out.println(reporter.formatSkipped(result.getSkippedFiles()));
        }

        if (result.getDependencyReport() != null && (verbose || !result.getDependencyReport().getCycles().isEmpty())) {
            System.out.println();
            System.out.print(reporter.formatCycles(result.getDependencyReport()));
        }

        if (!result.getPlan().isEmpty()) {
            System.out.println();
            System.out.println(reporter.colorize(ConsoleReporter.ANSI_BOLD, "Transformations:"));
            for (PlanEntry entry : result.getPlan()) {
                System.out.println("  " + reporter.formatPlanEntry(entry));
            }
        }

        System.out.println();
        System.out.print(reporter.formatSummary(result));
    }

    private static int _initializeConfig(String[] args) throws IOException {
        Path configPath = Paths.get(CONFIG_FILE_NAME);

        if (Files.exists(configPath) && !_hasOption(args, "--force")) {
            _printWarning("Configuration file already exists: " + CONFIG_FILE_NAME);
            System.out.println("Use --force to overwrite it");
            return 1;
        }

        ConfigurationLoader.saveConfig(ConfigurationLoader.loadDefaultConfig(), configPath);
        _printSuccess("Created configuration file: " + CONFIG_FILE_NAME);
        return 0;
    }

    static List<Path> findFiles(Path path, List<String> excludePatterns) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        List<Pattern> excludes = excludePatterns.stream()
                .map(OptimizerCli::_globToPattern)
                .collect(Collectors.toList());

        try (Stream<Path> walk = Files.walk(path)) {
            return walk.filter(Files::isRegularFile)
                    .filter(OptimizerCli::_isSupported)
                    .filter(p -> !_isIgnored(p, path, excludes))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private static boolean _isSupported(Path file) {
        FileType type = FileType.detect(file);
        return type == FileType.JAVA || type.isJavaScriptFamily();
    }

    private static boolean _isIgnored(Path file, Path basePath, List<Pattern> excludes) {
        String relativePath = basePath.relativize(file).toString().replace("\\", "/");
        for (Pattern pattern : excludes) {
            if (pattern.matcher(relativePath).find()) {
                return true;
            }
        }
        return false;
    }

    private static Pattern _globToPattern(String glob) {
        String regex = glob
                .replace(".", "\\.")
                .replace("*", ".*")
                .replace("?", ".");
        return Pattern.compile(regex);
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static void _printSuccess(String message) {
        System.out.println(reporter.colorize(ConsoleReporter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.err.println(reporter.colorize(ConsoleReporter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(reporter.colorize(ConsoleReporter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(reporter.colorize(ConsoleReporter.ANSI_BLUE, message));
    }
}
