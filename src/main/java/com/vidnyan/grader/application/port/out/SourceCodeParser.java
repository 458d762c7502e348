package com.vidnyan.grader.application.port.out;

import com.vidnyan.grader.domain.statement.ParsedSource;

import java.nio.file.Path;

/**
 * Port for turning a submission into its statement forest.
 * Implemented by the grammar adapter.
 */
public interface SourceCodeParser {

    /**
     * Read and parse a submission file.
     * @throws SourceNotFoundException if the file does not exist or cannot be read
     * @throws SourceSyntaxException if the file is not valid source
     */
    ParsedSource parse(Path sourcePath);

    /**
     * Parse source text that did not come from a file; {@code origin} labels errors.
     */
    ParsedSource parseText(String sourceText, Path origin);
}
