package com.vidnyan.grader;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for the grader.
 * Can be configured via application.yml or command line arguments.
 */
@Data
@Component
@ConfigurationProperties(prefix = "grader")
public class GraderProperties {

    /**
     * Submission to grade. Empty: the CLI runner does nothing.
     */
    private String submissionPath = "";

    /**
     * JSON exercise definition.
     */
    private String exercisePath = "";

    /**
     * File released after every step passed.
     */
    private String successArtifactPath = "/flag";

    /**
     * ANSI colours in step lines.
     */
    private boolean colorOutput = true;

    /**
     * Exit the JVM with the run's status code when grading is done.
     */
    private boolean exitOnCompletion = true;
}
