package com.codeoptimizer.dependency;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.codeoptimizer.api.SourceFile;
import com.codeoptimizer.config.OptimizerConfig;
import com.codeoptimizer.plugins.FileType;
import com.codeoptimizer.util.LoggerUtil;

/**
 * Builds the import graph of a file set and enumerates its cycles with a depth-limited search.
 */
public class CycleDetector {
    private static final Logger logger = LoggerUtil.getLogger(CycleDetector.class);

    private final int maxDepth;
    private final List<Pattern> excludePatterns;
    private final boolean detailedReport;
    private final ImportExtractor importExtractor = new ImportExtractor();

    public CycleDetector(int maxDepth, List<String> excludePatterns, boolean detailedReport) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        this.maxDepth = maxDepth;
        this.excludePatterns = excludePatterns.stream()
                .map(CycleDetector::_globToPattern)
                .collect(Collectors.toList());
        this.detailedReport = detailedReport;
    }

    public static CycleDetector fromConfig(OptimizerConfig config) {
        return new CycleDetector(config.getMaxDepth(), config.getExcludePatterns(), config.isDetailedReport());
    }

    public DependencyReport detect(Collection<SourceFile> files) {
        DependencyGraph graph = buildGraph(files);
        Set<Path> unresolved = new TreeSet<>();
        List<CircularDependency> cycles = findCycles(graph, unresolved);

        logger.info("Dependency graph: " + graph.getNodes().size() + " files, " + graph.getEdgeCount() +
                " imports, " + cycles.size() + " cycles");
        if (!unresolved.isEmpty()) {
            logger.warning("Cycle search reached the depth limit of " + maxDepth + " at " + unresolved.size() + " files");
        }
        return new DependencyReport(graph, cycles, unresolved, detailedReport);
    }

    /**
     * Resolves the imports of every file. Excluded files neither own nor receive edges.
     */
    public DependencyGraph buildGraph(Collection<SourceFile> files) {
        Map<Path, SourceFile> included = new TreeMap<>();
        for (SourceFile file : files) {
            FileType type = FileType.detect(file.getPath());
            if ((type == FileType.JAVA || type.isJavaScriptFamily()) && !_isExcluded(file.getPath())) {
                included.put(file.getPath(), file);
            }
        }

        ModuleResolver resolver = new ModuleResolver(included.keySet());
        for (SourceFile file : included.values()) {
            if (FileType.detect(file.getPath()) == FileType.JAVA) {
                String typeName = _stripExtension(file.getPath().getFileName().toString());
                String qualifiedName = importExtractor.extractJavaPackage(file.getText())
                        .map(pkg -> pkg + "." + typeName)
                        .orElse(typeName);
                resolver.registerJavaType(qualifiedName, file.getPath());
            }
        }

        Map<Path, Set<Path>> adjacency = new LinkedHashMap<>();
        for (SourceFile file : included.values()) {
            Set<Path> targets = new TreeSet<>();
            FileType type = FileType.detect(file.getPath());

            if (type == FileType.JAVA) {
                for (String imported : importExtractor.extractJavaImports(file.getText())) {
                    resolver.resolveJava(imported).ifPresent(targets::add);
                }
            } else {
                for (String specifier : importExtractor.extractRelativeSpecifiers(file.getText(), type)) {
                    Optional<Path> target = resolver.resolveRelative(file.getPath(), specifier);
                    if (target.isPresent()) {
                        targets.add(target.get());
                    } else {
                        logger.fine("Unresolved import '" + specifier + "' in " + file.getPath());
                    }
                }
            }

            targets.remove(file.getPath());
            targets.removeIf(this::_isExcluded);
            adjacency.put(file.getPath(), targets);
        }

        return new DependencyGraph(adjacency);
    }

    /**
     * Enumerates the cycles of the graph. Roots are taken in path order and a search never
     * enters an earlier root, so every cycle is found from its smallest file only once.
     */
    public List<CircularDependency> findCycles(DependencyGraph graph, Set<Path> unresolved) {
        Map<CircularDependency, CircularDependency> found = new LinkedHashMap<>();
        Set<Path> finishedRoots = new HashSet<>();

        for (Path root : graph.getNodes()) {
            _search(graph, root, new ArrayList<>(), new HashSet<>(), finishedRoots, found, unresolved);
            finishedRoots.add(root);
        }
        return new ArrayList<>(found.keySet());
    }

    private void _search(DependencyGraph graph, Path node, List<Path> path, Set<Path> onPath,
                         Set<Path> finishedRoots, Map<CircularDependency, CircularDependency> found,
                         Set<Path> unresolved) {
        path.add(node);
        onPath.add(node);

        for (Path next : graph.getDependencies(node)) {
            if (finishedRoots.contains(next)) {
                continue;
            }
            if (onPath.contains(next)) {
                CircularDependency cycle = new CircularDependency(path.subList(path.indexOf(next), path.size()));
                found.putIfAbsent(cycle, cycle);
            } else if (path.size() >= maxDepth) {
                unresolved.add(node);
            } else {
                _search(graph, next, path, onPath, finishedRoots, found, unresolved);
            }
        }

        path.remove(path.size() - 1);
        onPath.remove(node);
    }

    private boolean _isExcluded(Path path) {
        String normalized = path.toString().replace('\\', '/');
        for (Pattern pattern : excludePatterns) {
            if (pattern.matcher(normalized).find()) {
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

    private static String _stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
