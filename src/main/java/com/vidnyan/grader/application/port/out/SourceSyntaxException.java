package com.vidnyan.grader.application.port.out;

/**
 * The submission is not valid source. Fatal: no step runs.
 */
public class SourceSyntaxException extends RuntimeException {

    private final int line;

    public SourceSyntaxException(String origin, int line, String reason) {
        super(String.format("%s:%d: invalid syntax: %s", origin, line, reason));
        this.line = line;
    }

    public int getLine() {
        return line;
    }
}
