package com.vidnyan.grader.application.port.out;

import com.vidnyan.grader.domain.variable.VariableTable;

import java.nio.file.Path;

/**
 * Port for best-effort static resolution of variable values.
 */
public interface VariableResolver {

    /**
     * Resolve every plain-name assignment in source order. Never throws for
     * values it cannot compute; those become unresolvable.
     * @throws SourceSyntaxException if the text is not valid source
     */
    VariableTable resolveVariables(String sourceText);

    /**
     * @throws SourceNotFoundException if the file does not exist or cannot be read
     */
    VariableTable resolveVariables(Path sourcePath);
}
