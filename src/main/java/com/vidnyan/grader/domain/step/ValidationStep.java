package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.verification.FunctionCallSpec;

import java.util.Objects;

public record ValidationStep(String label, StepCheck check) {

    public ValidationStep {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(check, "check");
    }

    public static ValidationStep call(String label, FunctionCallSpec spec) {
        return new ValidationStep(label, new CallSpecCheck(spec));
    }
}
