package com.codeoptimizer.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Input to a run: an absolute path and the text it currently holds.
 */
public class SourceFile {
    private final Path path;
    private final String text;

    public SourceFile(Path path, String text) {
        this.path = Objects.requireNonNull(path, "path").toAbsolutePath().normalize();
        this.text = Objects.requireNonNull(text, "text");
    }

    public static SourceFile read(Path path) throws IOException {
        return new SourceFile(path, Files.readString(path, StandardCharsets.UTF_8));
    }

    public Path getPath() {
        return path;
    }

    public String getText() {
        return text;
    }
}
