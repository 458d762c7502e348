package com.vidnyan.grader.domain.verification;

import com.vidnyan.grader.domain.query.StatementQueries;
import com.vidnyan.grader.domain.statement.AssignStatement;
import com.vidnyan.grader.domain.statement.FunctionCallStatement;
import com.vidnyan.grader.domain.statement.Statement;

import java.util.List;

/**
 * Judges the calls of a statement forest against a {@link FunctionCallSpec}.
 * Only the first call with the expected name is inspected; {@code maxCalls}
 * guards against further calls.
 */
public final class CallSpecMatcher {

    private static final String DISCARD = "_";

    private CallSpecMatcher() {
    }

    public static StepVerdict match(List<Statement> forest, FunctionCallSpec spec, String stepLabel,
                                    UserVariableTable userVariables) {
        String fn = spec.functionName() + "()";
        List<Statement> candidates = StatementQueries.findCalls(forest, spec.functionName(), spec.scope());

        if (candidates.isEmpty()) {
            return StepVerdict.fail(MismatchCategory.NOT_CALLED,
                    String.format("%s is not called in %s.", fn, stepLabel));
        }
        if (candidates.size() > spec.maxCalls()) {
            String limit = spec.maxCalls() == 1 ? "only once" : "at most " + spec.maxCalls() + " times";
            return StepVerdict.fail(MismatchCategory.TOO_MANY_CALLS,
                    String.format("%s should be called %s in %s.", fn, limit, stepLabel));
        }

        Statement candidate = candidates.get(0);
        List<String> assigned = assignedNames(candidate);
        FunctionCallStatement call = StatementQueries.callOf(candidate).orElseThrow();

        if (spec.expectsVariables()) {
            int expected = spec.expectedVariableCount();
            if (assigned.isEmpty()) {
                return StepVerdict.fail(MismatchCategory.NOT_ASSIGNED,
                        String.format("%s result must be assigned in %s.", fn, stepLabel));
            }
            if (assigned.size() != expected) {
                // the message describes the shape the submission used, not the expected one
                String shape = assigned.size() == 1 ? "a single variable" : expected + " variables";
                return StepVerdict.fail(MismatchCategory.WRONG_ARITY,
                        String.format("%s should assign to %s in %s.", fn, shape, stepLabel));
            }
        }

        if (!spec.allowAssignment() && !assigned.isEmpty()) {
            return StepVerdict.fail(MismatchCategory.MUST_NOT_ASSIGN,
                    String.format("%s should not be assigned to a variable in %s.", fn, stepLabel));
        }

        if (!argumentsMatch(call, spec)) {
            return StepVerdict.fail(MismatchCategory.WRONG_PARAMETERS,
                    String.format("Incorrect parameters for %s in %s.", fn, stepLabel));
        }

        assigned.forEach(userVariables::record);
        return StepVerdict.pass();
    }

    /**
     * Positional arguments must match exactly, unless the call passes everything
     * by keyword and the keywords match exactly.
     */
    static boolean argumentsMatch(FunctionCallStatement call, FunctionCallSpec spec) {
        if (call.args().equals(spec.expectedArgs())) {
            return true;
        }
        return call.args().isEmpty() && call.kwargs().equals(spec.expectedKwargs());
    }

    /**
     * Target names of the assignment carrying the call; empty for a standalone
     * call or a lone {@code _} target.
     */
    static List<String> assignedNames(Statement candidate) {
        if (candidate instanceof AssignStatement assign) {
            List<String> targets = assign.targets();
            if (targets.size() == 1 && DISCARD.equals(targets.get(0))) {
                return List.of();
            }
            return targets;
        }
        return List.of();
    }
}
