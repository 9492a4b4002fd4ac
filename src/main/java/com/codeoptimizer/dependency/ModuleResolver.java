package com.codeoptimizer.dependency;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves import specifiers to files of the project.
 */
public class ModuleResolver {
    private static final List<String> EXTENSIONS = List.of(".ts", ".tsx", ".js", ".jsx", ".mjs", ".cjs");

    private final Set<Path> knownFiles;
    private final Map<String, Path> javaTypes = new HashMap<>();

    public ModuleResolver(Set<Path> knownFiles) {
        this.knownFiles = knownFiles;
    }

    /**
     * Makes a Java type resolvable by its fully qualified name.
     */
    public void registerJavaType(String qualifiedName, Path file) {
        javaTypes.putIfAbsent(qualifiedName, file);
    }

    /**
     * Resolves a relative specifier: the direct path, then the known extensions, then an index file inside the directory.
     */
    public Optional<Path> resolveRelative(Path fromFile, String specifier) {
        Path directory = fromFile.getParent();
        if (directory == null) {
            return Optional.empty();
        }
        Path base = directory.resolve(specifier).normalize();

        if (_isFile(base)) {
            return Optional.of(base);
        }
        for (String extension : EXTENSIONS) {
            Path candidate = base.resolveSibling(base.getFileName() + extension);
            if (_isFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        for (String extension : EXTENSIONS) {
            Path candidate = base.resolve("index" + extension);
            if (_isFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves an imported Java name. Static member imports and nested types fall back to the enclosing type.
     */
    public Optional<Path> resolveJava(String qualifiedName) {
        String name = qualifiedName;
        while (true) {
            Path file = javaTypes.get(name);
            if (file != null) {
                return Optional.of(file);
            }
            int dot = name.lastIndexOf('.');
            if (dot < 0) {
                return Optional.empty();
            }
            name = name.substring(0, dot);
        }
    }

    private boolean _isFile(Path candidate) {
        return knownFiles.contains(candidate) || Files.isRegularFile(candidate);
    }
}
