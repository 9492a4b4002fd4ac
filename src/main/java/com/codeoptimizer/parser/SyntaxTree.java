package com.codeoptimizer.parser;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.codeoptimizer.plugins.FileType;

/**
 * Immutable, language-neutral view of a parsed file: the recorded constructs ordered by position.
 * Nesting is derived from range containment.
 */
public class SyntaxTree {
    private final Path path;
    private final FileType fileType;
    private final String text;
    private final List<SyntaxElement> elements;
    private final LineIndex lineIndex;

    public SyntaxTree(Path path, FileType fileType, String text, List<SyntaxElement> elements, LineIndex lineIndex) {
        this.path = path;
        this.fileType = fileType;
        this.text = text;
        List<SyntaxElement> sorted = new ArrayList<>(elements);
        sorted.sort(Comparator.comparingInt(SyntaxElement::getStart)
                .thenComparing(Comparator.comparingInt(SyntaxElement::getEnd).reversed()));
        this.elements = List.copyOf(sorted);
        this.lineIndex = lineIndex;
    }

    public Path getPath() { return path; }
    public FileType getFileType() { return fileType; }
    public String getText() { return text; }
    public List<SyntaxElement> getElements() { return elements; }
    public LineIndex getLineIndex() { return lineIndex; }

    public List<SyntaxElement> getElements(ElementKind kind) {
        return elements.stream().filter(e -> e.getKind() == kind).toList();
    }

    /**
     * Smallest element of the given kind whose range covers [start, end).
     */
    public Optional<SyntaxElement> findInnermost(ElementKind kind, int start, int end) {
        SyntaxElement best = null;
        for (SyntaxElement element : elements) {
            if (element.getKind() == kind && element.getStart() <= start && end <= element.getEnd()) {
                if (best == null || element.getSpan().getEnd() - element.getStart() < best.getEnd() - best.getStart()) {
                    best = element;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    /**
     * Elements lying completely inside the span.
     */
    public List<SyntaxElement> elementsWithin(Span span) {
        return elements.stream().filter(e -> span.contains(e.getSpan())).toList();
    }

    /**
     * Elements of the given kind intersecting [start, end).
     */
    public List<SyntaxElement> elementsOverlapping(ElementKind kind, int start, int end) {
        return elements.stream()
                .filter(e -> e.getKind() == kind && e.getStart() < end && start < e.getEnd())
                .toList();
    }

    /**
     * Number of loops enclosing the element, counting the element itself when it is a loop.
     */
    public int loopDepth(SyntaxElement element) {
        int depth = element.getKind() == ElementKind.LOOP ? 1 : 0;
        for (SyntaxElement candidate : elements) {
            if (candidate.getKind() == ElementKind.LOOP && candidate.contains(element)) {
                depth++;
            }
        }
        return depth;
    }
}
