package com.vidnyan.grader.domain.step;

/**
 * Receives step results as the sequencer produces them.
 */
public interface StepListener {

    void stepPassed(String label);

    void stepFailed(String label, String message);

    /**
     * All steps passed; {@code artifact} is the released success artifact or an error text.
     */
    void completed(String artifact);
}
