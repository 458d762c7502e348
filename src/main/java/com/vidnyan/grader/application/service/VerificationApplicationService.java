package com.vidnyan.grader.application.service;

import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase;
import com.vidnyan.grader.application.port.out.SourceCodeParser;
import com.vidnyan.grader.application.port.out.VariableResolver;
import com.vidnyan.grader.domain.statement.ParsedSource;
import com.vidnyan.grader.domain.step.Exercise;
import com.vidnyan.grader.domain.step.SequenceOutcome;
import com.vidnyan.grader.domain.step.StepListener;
import com.vidnyan.grader.domain.step.SuccessArtifactSource;
import com.vidnyan.grader.domain.step.ValidationSequencer;
import com.vidnyan.grader.domain.verification.UserVariableTable;
import com.vidnyan.grader.domain.verification.VerificationContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Orchestrates one grading run. Every run gets its own forest, variable tables
 * and sequencer; nothing is shared between runs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class VerificationApplicationService implements VerifySubmissionUseCase {

    private final SourceCodeParser sourceCodeParser;
    private final VariableResolver variableResolver;
    private final StepListener stepListener;
    private final SuccessArtifactSource successArtifactSource;

    @Override
    public VerificationResult verify(VerificationRequest request) {
        long startTime = System.currentTimeMillis();
        Exercise exercise = request.exercise();
        log.debug("Verifying {} against exercise {}", request.submissionPath(), exercise.name());

        // Step 1: parse, fatal on missing or invalid source
        ParsedSource source = sourceCodeParser.parse(request.submissionPath());
        log.debug("Parsed {} top-level statements from {}", source.size(), source.path());

        // Step 2: run the steps
        VerificationContext context = new VerificationContext(
                source,
                new UserVariableTable(exercise.variables()),
                () -> variableResolver.resolveVariables(source.sourceText()));
        ValidationSequencer sequencer = new ValidationSequencer(
                exercise.steps(), stepListener, successArtifactSource);
        SequenceOutcome outcome = sequencer.run(context);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Exercise {}: {} after {} of {} steps in {}ms",
                exercise.name(), outcome.state(), outcome.executed().size(),
                exercise.steps().size(), duration);

        return new VerificationResult(exercise.name(), outcome, source.size(), duration);
    }
}
