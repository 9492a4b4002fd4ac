package com.codeoptimizer.api;

import java.nio.file.Path;

import com.codeoptimizer.parser.SyntaxTree;
import com.codeoptimizer.plugins.FileType;

/**
 * One analyzed file: path, raw text and its syntax tree. Immutable.
 */
public class SourceUnit {
    private final Path path;
    private final String text;
    private final FileType fileType;
    private final SyntaxTree tree;

    public SourceUnit(Path path, String text, FileType fileType, SyntaxTree tree) {
        this.path = path;
        this.text = text;
        this.fileType = fileType;
        this.tree = tree;
    }

    public Path getPath() { return path; }
    public String getText() { return text; }
    public FileType getFileType() { return fileType; }
    public SyntaxTree getTree() { return tree; }
}
