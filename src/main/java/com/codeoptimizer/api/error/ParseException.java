package com.codeoptimizer.api.error;

import java.nio.file.Path;
import java.util.List;

import com.codeoptimizer.parser.ParseDiagnostic;

/**
 * Thrown when a file cannot be turned into a syntax tree. The file is skipped, the batch continues.
 */
public class ParseException extends OptimizerException {
    private final Path path;
    private final List<ParseDiagnostic> diagnostics;

    public ParseException(Path path, List<ParseDiagnostic> diagnostics) {
        super("Failed to parse " + path + ": " + _summarize(diagnostics));
        this.path = path;
        this.diagnostics = List.copyOf(diagnostics);
    }

    public ParseException(Path path, String message, Throwable cause) {
        super("Failed to parse " + path + ": " + message, cause);
        this.path = path;
        this.diagnostics = List.of(new ParseDiagnostic(message, 1, 1, 0));
    }

    public Path getPath() {
        return path;
    }

    public List<ParseDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    private static String _summarize(List<ParseDiagnostic> diagnostics) {
        if (diagnostics.isEmpty()) {
            return "unknown error";
        }
        ParseDiagnostic first = diagnostics.get(0);
        String summary = first.getMessage() + " (line " + first.getLine() + ")";
        return diagnostics.size() > 1 ? summary + " and " + (diagnostics.size() - 1) + " more" : summary;
    }
}
