package com.vidnyan.grader.adapter.in.cli;

import com.vidnyan.grader.GraderProperties;
import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase;
import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase.VerificationRequest;
import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase.VerificationResult;
import com.vidnyan.grader.application.port.out.ExerciseDefinitionException;
import com.vidnyan.grader.application.port.out.ExerciseRepository;
import com.vidnyan.grader.application.port.out.SourceNotFoundException;
import com.vidnyan.grader.application.port.out.SourceSyntaxException;
import com.vidnyan.grader.domain.step.Exercise;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * CLI runner for grading one submission.
 * Runs when grader.submission-path is set; exits with 0 when every step
 * passed and 1 otherwise.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VerificationCliRunner implements CommandLineRunner {

    private final VerifySubmissionUseCase verifySubmissionUseCase;
    private final ExerciseRepository exerciseRepository;
    private final GraderProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        if (properties.getSubmissionPath() == null || properties.getSubmissionPath().isBlank()) {
            log.info("No submission specified. Set grader.submission-path property.");
            return;
        }

        int exitCode = grade();
        if (properties.isExitOnCompletion()) {
            System.exit(SpringApplication.exit(context, () -> exitCode));
        }
    }

    int grade() {
        try {
            Exercise exercise = exerciseRepository.load(Path.of(properties.getExercisePath()));
            VerificationResult result = verifySubmissionUseCase.verify(
                    new VerificationRequest(Path.of(properties.getSubmissionPath()), exercise));
            return result.outcome().exitCode();
        } catch (SourceNotFoundException | SourceSyntaxException e) {
            log.error("Cannot grade submission: {}", e.getMessage());
            System.out.println(e.getMessage());
            return 1;
        } catch (ExerciseDefinitionException e) {
            log.error("Invalid exercise: {}", e.getMessage());
            System.out.println(e.getMessage());
            return 1;
        }
    }
}
