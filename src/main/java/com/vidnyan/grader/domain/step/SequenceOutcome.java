package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.verification.StepVerdict;

import java.util.List;

/**
 * Final state of a sequencer run.
 *
 * @param failedStepIndex zero-based index of the failing step, or -1
 * @param executed        verdicts of the steps that ran, in order
 * @param artifact        released artifact text, or null when the run failed
 */
public record SequenceOutcome(
    SequencerState state,
    int failedStepIndex,
    List<StepVerdict> executed,
    String artifact
) {

    public SequenceOutcome {
        executed = List.copyOf(executed);
    }

    public boolean passed() {
        return state == SequencerState.PASSED;
    }

    public int exitCode() {
        return passed() ? 0 : 1;
    }
}
