package com.vidnyan.grader.application.port.out;

import java.nio.file.Path;

/**
 * The submission does not exist or cannot be read. Fatal: no step runs.
 */
public class SourceNotFoundException extends RuntimeException {

    private final Path path;

    public SourceNotFoundException(Path path, Throwable cause) {
        super("File not found: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
