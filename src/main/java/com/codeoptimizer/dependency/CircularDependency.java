package com.codeoptimizer.dependency;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A cycle of imports. Files are stored in canonical rotation, starting with the smallest path,
 * so the same cycle found from different start files compares equal.
 */
public class CircularDependency {
    private final List<Path> files;
    private final CycleSeverity severity;

    public CircularDependency(List<Path> cycle) {
        if (cycle.isEmpty()) {
            throw new IllegalArgumentException("A cycle needs at least one file");
        }
        this.files = List.copyOf(_canonicalRotation(cycle));
        this.severity = CycleSeverity.forLength(files.size());
    }

    /**
     * Files of the cycle, each once, in import order.
     */
    public List<Path> getFiles() {
        return files;
    }

    public CycleSeverity getSeverity() {
        return severity;
    }

    /**
     * Number of distinct files in the cycle.
     */
    public int length() {
        return files.size();
    }

    /**
     * True when {@code from} imports {@code to} as one of the cycle's edges.
     */
    public boolean hasEdge(Path from, Path to) {
        int index = files.indexOf(from);
        return index >= 0 && files.get((index + 1) % files.size()).equals(to);
    }

    public String describe() {
        return files.stream().map(Path::toString).collect(Collectors.joining(" -> ")) + " -> " + files.get(0);
    }

    private static List<Path> _canonicalRotation(List<Path> cycle) {
        int smallest = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(smallest)) < 0) {
                smallest = i;
            }
        }
        List<Path> rotated = new ArrayList<>(cycle.size());
        for (int i = 0; i < cycle.size(); i++) {
            rotated.add(cycle.get((smallest + i) % cycle.size()));
        }
        return rotated;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CircularDependency)) {
            return false;
        }
        return files.equals(((CircularDependency) o).files);
    }

    @Override
    public int hashCode() {
        return files.hashCode();
    }

    @Override
    public String toString() {
        return severity + " cycle (" + length() + "): " + describe();
    }
}
