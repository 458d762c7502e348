package com.vidnyan.grader.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.grader.GraderProperties;
import com.vidnyan.grader.adapter.out.artifact.FileSuccessArtifactReader;
import com.vidnyan.grader.adapter.out.report.ConsoleStepReporter;
import com.vidnyan.grader.domain.step.StepListener;
import com.vidnyan.grader.domain.step.SuccessArtifactSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Spring configuration for the grader.
 * Wires the adapters that depend on configuration properties.
 */
@Slf4j
@Configuration
public class GraderConfiguration {

    /**
     * ObjectMapper for exercise definitions.
     */
    @Bean
    public ObjectMapper objectMapper() {
        return new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    @Bean
    public StepListener stepListener(GraderProperties properties) {
        return new ConsoleStepReporter(System.out, properties.isColorOutput());
    }

    @Bean
    public SuccessArtifactSource successArtifactSource(GraderProperties properties) {
        log.debug("Success artifact: {}", properties.getSuccessArtifactPath());
        return new FileSuccessArtifactReader(Path.of(properties.getSuccessArtifactPath()));
    }
}
