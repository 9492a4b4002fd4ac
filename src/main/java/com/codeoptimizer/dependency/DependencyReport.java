package com.codeoptimizer.dependency;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Result of one cycle detection run: the graph, its cycles and summary figures.
 */
public class DependencyReport {
    private final DependencyGraph graph;
    private final List<CircularDependency> cycles;
    private final Set<Path> unresolved;
    private final boolean detailed;

    public DependencyReport(DependencyGraph graph, List<CircularDependency> cycles, Set<Path> unresolved,
                            boolean detailed) {
        this.graph = graph;
        this.cycles = List.copyOf(cycles);
        this.unresolved = Set.copyOf(unresolved);
        this.detailed = detailed;
    }

    public DependencyGraph getGraph() { return graph; }
    public List<CircularDependency> getCycles() { return cycles; }

    /**
     * Files where the search stopped at the depth limit. Cycles through them may be unreported.
     */
    public Set<Path> getUnresolved() { return unresolved; }

    public int getTotalFiles() {
        return graph.getNodes().size();
    }

    public int getTotalDependencies() {
        return graph.getEdgeCount();
    }

    public int getMaxDependencies() {
        return graph.getNodes().stream().mapToInt(node -> graph.getDependencies(node).size()).max().orElse(0);
    }

    public double getAverageDependencies() {
        return getTotalFiles() == 0 ? 0.0 : (double) getTotalDependencies() / getTotalFiles();
    }

    /**
     * One fix suggestion per cycle when the detailed report is enabled, otherwise empty.
     */
    public Map<CircularDependency, String> getSuggestions() {
        Map<CircularDependency, String> suggestions = new LinkedHashMap<>();
        if (detailed) {
            for (CircularDependency cycle : cycles) {
                suggestions.put(cycle, suggestFix(cycle));
            }
        }
        return suggestions;
    }

    public static String suggestFix(CircularDependency cycle) {
        List<Path> files = cycle.getFiles();
        String first = _name(files.get(0));
        String last = _name(files.get(files.size() - 1));

        if (files.size() == 2) {
            return "Extract the code shared by " + first + " and " + _name(files.get(1)) +
                    " into a new module, or merge the two files";
        }
        return "Break the import of " + first + " in " + last +
                ", for example by moving the shared declarations into a separate module or depending on an interface";
    }

    private static String _name(Path path) {
        return path.getFileName() != null ? path.getFileName().toString() : path.toString();
    }
}
