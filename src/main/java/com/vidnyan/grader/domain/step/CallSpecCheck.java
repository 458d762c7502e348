package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.verification.CallSpecMatcher;
import com.vidnyan.grader.domain.verification.FunctionCallSpec;
import com.vidnyan.grader.domain.verification.StepVerdict;
import com.vidnyan.grader.domain.verification.VerificationContext;

public record CallSpecCheck(FunctionCallSpec spec) implements StepCheck {

    @Override
    public StepVerdict check(String stepLabel, VerificationContext context) {
        return CallSpecMatcher.match(context.statements(), spec, stepLabel, context.userVariables());
    }
}
