package com.signalmix.output;

import java.nio.file.Path;

public class MissingArtifactException extends Exception {
    private final Path path;

    public MissingArtifactException(Path path) {
        super("combined artifact not found: " + path);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
