package com.codeoptimizer.parser;

import java.nio.file.Path;
import java.util.List;

import com.codeoptimizer.api.error.ParseException;
import com.codeoptimizer.plugins.FileType;

/**
 * Turns the text of one file into a {@link SyntaxTree}.
 */
public interface SyntaxParser {

    /**
     * File types this parser understands.
     */
    List<FileType> getSupportedTypes();

    SyntaxTree parse(Path path, String text) throws ParseException;

    /**
     * Parses without building a tree and returns every diagnostic. An empty list means the text is well formed.
     */
    List<ParseDiagnostic> diagnose(Path path, String text);
}
