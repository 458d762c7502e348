package com.vidnyan.grader.domain.verification;

import com.vidnyan.grader.domain.query.SearchScope;
import com.vidnyan.grader.domain.statement.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CallSpecMatcherTest {

    private static final String LABEL = "Step 2";

    private final UserVariableTable userVariables = new UserVariableTable(List.of("model"));

    private static FunctionCallStatement call(String function, List<String> args, Map<String, String> kwargs) {
        return new FunctionCallStatement(function, args, kwargs);
    }

    private static AssignStatement assign(List<String> targets, FunctionCallStatement value) {
        return new AssignStatement(targets, value);
    }

    private StepVerdict match(List<Statement> forest, FunctionCallSpec spec) {
        return CallSpecMatcher.match(forest, spec, LABEL, userVariables);
    }

    @Test
    void match_ShouldPassAndRecordAssignedVariable() {
        List<Statement> forest = List.of(assign(List.of("model"), call("LinearRegression", List.of(), Map.of())));

        StepVerdict verdict = match(forest, FunctionCallSpec.builder("LinearRegression").variableCount(1).build());

        assertTrue(verdict.passed());
        assertTrue(userVariables.isAssigned("model"));
    }

    @Test
    void match_ShouldFailWhenNotCalled() {
        StepVerdict verdict = match(List.of(), FunctionCallSpec.builder("fit").build());

        assertFalse(verdict.passed());
        assertEquals(MismatchCategory.NOT_CALLED, verdict.category());
        assertEquals("fit() is not called in Step 2.", verdict.message());
    }

    @Test
    void match_ShouldRejectMoreCallsThanAllowed() {
        List<Statement> forest = List.of(
                call("fit", List.of(), Map.of()),
                call("fit", List.of(), Map.of()));

        StepVerdict once = match(forest, FunctionCallSpec.builder("fit").build());
        StepVerdict twice = match(forest, FunctionCallSpec.builder("fit").maxCalls(2).build());
        StepVerdict three = match(List.of(forest.get(0), forest.get(1), forest.get(0)),
                FunctionCallSpec.builder("fit").maxCalls(2).build());

        assertEquals(MismatchCategory.TOO_MANY_CALLS, once.category());
        assertEquals("fit() should be called only once in Step 2.", once.message());
        assertTrue(twice.passed());
        assertEquals("fit() should be called at most 2 times in Step 2.", three.message());
    }

    @Test
    void match_ShouldRequireAssignmentWhenVariablesExpected() {
        List<Statement> forest = List.of(call("load", List.of(), Map.of()));

        StepVerdict verdict = match(forest, FunctionCallSpec.builder("load").variableCount(1).build());

        assertEquals(MismatchCategory.NOT_ASSIGNED, verdict.category());
        assertEquals("load() result must be assigned in Step 2.", verdict.message());
    }

    @Test
    void match_ShouldTreatDiscardTargetAsNotAssigned() {
        List<Statement> forest = List.of(assign(List.of("_"), call("load", List.of(), Map.of())));

        StepVerdict verdict = match(forest, FunctionCallSpec.builder("load").variableCount(1).build());

        assertEquals(MismatchCategory.NOT_ASSIGNED, verdict.category());
        assertTrue(match(forest, FunctionCallSpec.builder("load").allowAssignment(false).build()).passed());
    }

    @Test
    void match_ShouldCheckNumberOfAssignedVariables() {
        List<Statement> forest = List.of(assign(List.of("a", "b"), call("split", List.of(), Map.of())));

        StepVerdict single = match(forest, FunctionCallSpec.builder("split").variableCount(1).build());
        StepVerdict four = match(forest, FunctionCallSpec.builder("split").variableCount(4).build());

        assertEquals(MismatchCategory.WRONG_ARITY, single.category());
        assertEquals("split() should assign to 1 variables in Step 2.", single.message());
        assertEquals("split() should assign to 4 variables in Step 2.", four.message());
        assertFalse(userVariables.isDeclared("a"));
    }

    @Test
    void match_ShouldReportSingleTargetWhenSeveralExpected() {
        List<Statement> forest = List.of(assign(List.of("parts"), call("split", List.of(), Map.of())));

        StepVerdict verdict = match(forest, FunctionCallSpec.builder("split").variableCount(2).build());

        assertEquals(MismatchCategory.WRONG_ARITY, verdict.category());
        assertEquals("split() should assign to a single variable in Step 2.", verdict.message());
    }

    @Test
    void match_ShouldRejectAssignmentWhenNotAllowed() {
        List<Statement> forest = List.of(assign(List.of("r"), call("fit", List.of(), Map.of())));

        StepVerdict verdict = match(forest, FunctionCallSpec.builder("fit").allowAssignment(false).build());

        assertEquals(MismatchCategory.MUST_NOT_ASSIGN, verdict.category());
        assertEquals("fit() should not be assigned to a variable in Step 2.", verdict.message());
    }

    @Test
    void match_ShouldAcceptKeywordFormOnlyWithoutPositionalArguments() {
        FunctionCallSpec spec = FunctionCallSpec.builder("f").kwargs(Map.of("x", "1")).build();

        StepVerdict keyword = match(List.of(call("f", List.of(), Map.of("x", "1"))), spec);
        StepVerdict positional = match(List.of(call("f", List.of("1"), Map.of())), spec);

        assertTrue(keyword.passed());
        assertEquals(MismatchCategory.WRONG_PARAMETERS, positional.category());
        assertEquals("Incorrect parameters for f() in Step 2.", positional.message());
    }

    @Test
    void match_ShouldIgnoreKeywordsWhenPositionalArgumentsMatch() {
        FunctionCallSpec spec = FunctionCallSpec.builder("split").args("X", "y").build();

        assertTrue(match(List.of(call("split", List.of("X", "y"), Map.of("test_size", "0.2"))), spec).passed());
        assertFalse(match(List.of(call("split", List.of("y", "X"), Map.of())), spec).passed());
    }

    @Test
    void match_ShouldInspectOnlyFirstCandidate() {
        List<Statement> forest = List.of(
                call("fit", List.of("wrong"), Map.of()),
                call("fit", List.of("X"), Map.of()));

        StepVerdict verdict = match(forest, FunctionCallSpec.builder("fit").args("X").maxCalls(2).build());

        assertEquals(MismatchCategory.WRONG_PARAMETERS, verdict.category());
    }

    @Test
    void match_ShouldFindNestedCallsWhenRecursive() {
        List<Statement> forest = List.of(new FunctionDefStatement("main", List.of(), List.of(
                assign(List.of("model"), call("train", List.of(), Map.of())))));

        FunctionCallSpec spec = FunctionCallSpec.builder("train").variableCount(1).scope(SearchScope.RECURSIVE).build();

        assertTrue(match(forest, spec).passed());
        assertFalse(match(forest, FunctionCallSpec.builder("train").build()).passed());
    }

    @Test
    void builder_ShouldRejectInvalidSpecs() {
        assertThrows(IllegalArgumentException.class, () -> FunctionCallSpec.builder(" ").build());
        assertThrows(IllegalArgumentException.class, () -> FunctionCallSpec.builder("f").maxCalls(0).build());
    }
}
