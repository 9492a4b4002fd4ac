package com.codeoptimizer.plugins;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Source file types the optimizer knows about, detected from the file extension.
 */
public enum FileType {
    JAVA("Java", false, "java"),
    JAVASCRIPT("JavaScript", true, "js", "mjs", "cjs"),
    JSX("JSX", true, "jsx"),
    TYPESCRIPT("TypeScript", true, "ts"),
    TSX("TSX", true, "tsx"),
    UNKNOWN("Unknown", false);

    private final String description;
    private final boolean javaScriptFamily;
    private final String[] extensions;

    FileType(String description, boolean javaScriptFamily, String... extensions) {
        this.description = description;
        this.javaScriptFamily = javaScriptFamily;
        this.extensions = extensions;
    }

    public String getDescription() {
        return description;
    }

    /**
     * True for every type whose imports follow ECMAScript module resolution.
     */
    public boolean isJavaScriptFamily() {
        return javaScriptFamily;
    }

    public static FileType detect(Path path) {
        if (path == null || path.getFileName() == null) {
            return UNKNOWN;
        }

        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = fileName.lastIndexOf('.');
        if (dot < 0 || dot == fileName.length() - 1) {
            return UNKNOWN;
        }
        String extension = fileName.substring(dot + 1);

        for (FileType type : values()) {
            for (String candidate : type.extensions) {
                if (candidate.equals(extension)) {
                    return type;
                }
            }
        }
        return UNKNOWN;
    }
}
