package com.vidnyan.grader.application.port.out;

import com.vidnyan.grader.domain.step.Exercise;

import java.nio.file.Path;

/**
 * Port for loading exercise definitions.
 */
public interface ExerciseRepository {

    /**
     * @throws ExerciseDefinitionException if the definition is missing or invalid
     */
    Exercise load(Path definitionPath);
}
