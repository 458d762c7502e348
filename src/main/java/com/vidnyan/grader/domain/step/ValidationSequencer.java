package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.verification.MismatchCategory;
import com.vidnyan.grader.domain.verification.StepVerdict;
import com.vidnyan.grader.domain.verification.VerificationContext;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs validation steps in order and stops at the first failure.
 * Steps are a data-dependent chain: a step may read variable names recorded by
 * an earlier one, so they never run out of order or in parallel.
 */
@Slf4j
public final class ValidationSequencer {

    private final List<ValidationStep> steps;
    private final StepListener listener;
    private final SuccessArtifactSource artifactSource;

    private SequencerState state = SequencerState.NOT_STARTED;
    private int currentStep = -1;

    public ValidationSequencer(List<ValidationStep> steps, StepListener listener,
                               SuccessArtifactSource artifactSource) {
        this.steps = List.copyOf(steps);
        this.listener = listener;
        this.artifactSource = artifactSource;
    }

    public SequenceOutcome run(VerificationContext context) {
        if (state != SequencerState.NOT_STARTED) {
            throw new IllegalStateException("Sequencer already ran, state: " + state);
        }
        state = SequencerState.RUNNING;
        List<StepVerdict> executed = new ArrayList<>();

        for (int i = 0; i < steps.size(); i++) {
            currentStep = i;
            ValidationStep step = steps.get(i);
            StepVerdict verdict = runStep(step, context);
            executed.add(verdict);

            if (!verdict.passed()) {
                log.debug("Step {} ({}) failed: {}", i + 1, step.label(), verdict.category());
                listener.stepFailed(step.label(), verdict.message());
                state = SequencerState.FAILED;
                return new SequenceOutcome(state, i, executed, null);
            }
            log.debug("Step {} ({}) passed", i + 1, step.label());
            listener.stepPassed(step.label());
        }

        state = SequencerState.PASSED;
        String artifact = artifactSource.release();
        listener.completed(artifact);
        return new SequenceOutcome(state, -1, executed, artifact);
    }

    public SequencerState state() {
        return state;
    }

    /**
     * Index of the step running or last run; -1 before the run.
     */
    public int currentStep() {
        return currentStep;
    }

    private StepVerdict runStep(ValidationStep step, VerificationContext context) {
        try {
            return step.check().check(step.label(), context);
        } catch (RuntimeException e) {
            log.warn("Check for {} threw: {}", step.label(), e.toString());
            return StepVerdict.fail(MismatchCategory.ERROR,
                    String.format("Could not check %s: %s", step.label(), e.getMessage()));
        }
    }
}
