package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.verification.StepVerdict;
import com.vidnyan.grader.domain.verification.VerificationContext;

/**
 * One check of a validation step. Must not throw for an ordinary mismatch;
 * return a failing verdict instead.
 */
@FunctionalInterface
public interface StepCheck {

    StepVerdict check(String stepLabel, VerificationContext context);
}
