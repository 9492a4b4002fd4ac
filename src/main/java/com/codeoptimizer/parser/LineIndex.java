package com.codeoptimizer.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps character offsets to 1-based line/column positions and back.
 * Line terminators are \n, \r\n and a lone \r.
 */
public class LineIndex {
    private final int[] lineStarts;
    private final int length;

    public LineIndex(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\r') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                starts.add(i + 1);
            } else if (c == '\n') {
                starts.add(i + 1);
            }
        }
        this.lineStarts = starts.stream().mapToInt(Integer::intValue).toArray();
        this.length = text.length();
    }

    public int getLineCount() {
        return lineStarts.length;
    }

    /**
     * 1-based line of an offset.
     */
    public int lineOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        int low = 0;
        int high = lineStarts.length - 1;
        while (low < high) {
            int mid = (low + high + 1) >>> 1;
            if (lineStarts[mid] <= clamped) {
                low = mid;
            } else {
                high = mid - 1;
            }
        }
        return low + 1;
    }

    /**
     * 1-based column of an offset.
     */
    public int columnOf(int offset) {
        int clamped = Math.max(0, Math.min(offset, length));
        return clamped - lineStarts[lineOf(clamped) - 1] + 1;
    }

    /**
     * Offset of a 1-based line and column, clamped to the text.
     */
    public int offsetOf(int line, int column) {
        if (line < 1) {
            return 0;
        }
        if (line > lineStarts.length) {
            return length;
        }
        return Math.min(length, lineStarts[line - 1] + Math.max(0, column - 1));
    }

    public int lineStart(int line) {
        return lineStarts[Math.max(0, Math.min(line, lineStarts.length) - 1)];
    }

    /**
     * Offset just past the line terminator of the given line, or the text length for the last line.
     */
    public int nextLineStart(int line) {
        return line < lineStarts.length ? lineStarts[line] : length;
    }
}
