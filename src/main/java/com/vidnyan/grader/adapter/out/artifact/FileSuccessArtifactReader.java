package com.vidnyan.grader.adapter.out.artifact;

import com.vidnyan.grader.domain.step.SuccessArtifactSource;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the success artifact (the flag) from a file, once per successful run.
 */
@Slf4j
@RequiredArgsConstructor
public class FileSuccessArtifactReader implements SuccessArtifactSource {

    static final String MISSING_ARTIFACT = "Error: Flag file not found.";

    private final Path artifactPath;

    @Override
    public String release() {
        try {
            return Files.readString(artifactPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Success artifact {} is not readable: {}", artifactPath, e.toString());
            return MISSING_ARTIFACT;
        }
    }
}
