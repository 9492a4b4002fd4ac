package com.codeoptimizer.api.error;

import java.nio.file.Path;

/**
 * Writing a rewritten file failed. The file on disk is left as it was.
 */
public class ApplyIOException extends OptimizerException {
    private final Path path;

    public ApplyIOException(Path path, Throwable cause) {
        super("Failed to write " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
