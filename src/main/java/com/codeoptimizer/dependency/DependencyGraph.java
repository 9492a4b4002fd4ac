package com.codeoptimizer.dependency;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Directed graph of static imports between project files. Read-only once built.
 */
public class DependencyGraph {
    private final Map<Path, SortedSet<Path>> edges;

    DependencyGraph(Map<Path, ? extends Set<Path>> adjacency) {
        Map<Path, SortedSet<Path>> copy = new TreeMap<>();
        for (Map.Entry<Path, ? extends Set<Path>> entry : adjacency.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSortedSet(new TreeSet<>(entry.getValue())));
        }
        this.edges = Collections.unmodifiableMap(copy);
    }

    /**
     * Every file of the graph in path order.
     */
    public Set<Path> getNodes() {
        return edges.keySet();
    }

    public SortedSet<Path> getDependencies(Path file) {
        SortedSet<Path> dependencies = edges.get(file);
        return dependencies != null ? dependencies : Collections.emptySortedSet();
    }

    public int getEdgeCount() {
        return edges.values().stream().mapToInt(Set::size).sum();
    }

    /**
     * Graphviz rendering with the edges of the given cycles drawn in red.
     */
    public String toDot(Collection<CircularDependency> cycles) {
        StringBuilder dot = new StringBuilder("digraph dependencies {\n");
        dot.append("  rankdir=LR;\n");
        dot.append("  node [shape=box];\n");

        for (Path node : edges.keySet()) {
            dot.append("  ").append(_quote(node.toString()))
                    .append(" [label=").append(_quote(_label(node))).append("];\n");
        }

        for (Map.Entry<Path, SortedSet<Path>> entry : edges.entrySet()) {
            for (Path target : entry.getValue()) {
                boolean inCycle = cycles.stream().anyMatch(cycle -> cycle.hasEdge(entry.getKey(), target));
                dot.append("  ").append(_quote(entry.getKey().toString()))
                        .append(" -> ").append(_quote(target.toString()))
                        .append(inCycle ? " [color=red, penwidth=2]" : "")
                        .append(";\n");
            }
        }

        return dot.append("}\n").toString();
    }

    private static String _label(Path node) {
        return node.getFileName() != null ? node.getFileName().toString() : node.toString();
    }

    private static String _quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }
}
