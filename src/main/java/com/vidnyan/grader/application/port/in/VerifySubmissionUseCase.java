package com.vidnyan.grader.application.port.in;

import com.vidnyan.grader.domain.step.Exercise;
import com.vidnyan.grader.domain.step.SequenceOutcome;

import java.nio.file.Path;

/**
 * Primary use case: grade one submission against one exercise.
 */
public interface VerifySubmissionUseCase {

    /**
     * Parse the submission and run the exercise steps, fail-fast.
     * @throws com.vidnyan.grader.application.port.out.SourceNotFoundException if the submission is missing
     * @throws com.vidnyan.grader.application.port.out.SourceSyntaxException if it does not parse
     */
    VerificationResult verify(VerificationRequest request);

    record VerificationRequest(
        Path submissionPath,
        Exercise exercise
    ) {}

    record VerificationResult(
        String exerciseName,
        SequenceOutcome outcome,
        int statementsParsed,
        long durationMs
    ) {
        public boolean passed() {
            return outcome.passed();
        }
    }
}
