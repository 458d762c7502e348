package com.vidnyan.grader.application.port.out;

/**
 * An exercise definition is missing or malformed.
 */
public class ExerciseDefinitionException extends RuntimeException {

    public ExerciseDefinitionException(String message) {
        super(message);
    }

    public ExerciseDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
