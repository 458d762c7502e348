package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.statement.AssignStatement;
import com.vidnyan.grader.domain.statement.FunctionCallStatement;
import com.vidnyan.grader.domain.statement.ParsedSource;
import com.vidnyan.grader.domain.statement.Statement;
import com.vidnyan.grader.domain.variable.VariableTable;
import com.vidnyan.grader.domain.verification.FunctionCallSpec;
import com.vidnyan.grader.domain.verification.MismatchCategory;
import com.vidnyan.grader.domain.verification.StepVerdict;
import com.vidnyan.grader.domain.verification.UserVariableTable;
import com.vidnyan.grader.domain.verification.VerificationContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ValidationSequencerTest {

    private RecordingListener listener;
    private AtomicInteger releases;
    private SuccessArtifactSource artifactSource;

    @BeforeEach
    void setUp() {
        listener = new RecordingListener();
        releases = new AtomicInteger();
        artifactSource = () -> {
            releases.incrementAndGet();
            return "flag{ok}";
        };
    }

    private static VerificationContext context(List<Statement> statements, String... declared) {
        ParsedSource source = new ParsedSource(Path.of("main.py"), "", statements);
        return new VerificationContext(source, new UserVariableTable(List.of(declared)), VariableTable::new);
    }

    private static StepCheck passing() {
        return (label, ctx) -> StepVerdict.pass();
    }

    @Test
    void run_ShouldReportEveryStepAndReleaseArtifact_WhenAllPass() {
        ValidationSequencer sequencer = new ValidationSequencer(List.of(
                new ValidationStep("Step 1", passing()),
                new ValidationStep("Step 2", passing())), listener, artifactSource);

        SequenceOutcome outcome = sequencer.run(context(List.of()));

        assertTrue(outcome.passed());
        assertEquals(0, outcome.exitCode());
        assertEquals(-1, outcome.failedStepIndex());
        assertEquals("flag{ok}", outcome.artifact());
        assertEquals(List.of("pass Step 1", "pass Step 2", "done flag{ok}"), listener.events);
        assertEquals(1, releases.get());
        assertEquals(SequencerState.PASSED, sequencer.state());
    }

    @Test
    void run_ShouldStopAtFirstFailure() {
        AtomicInteger thirdRuns = new AtomicInteger();
        ValidationSequencer sequencer = new ValidationSequencer(List.of(
                new ValidationStep("Step 1", passing()),
                new ValidationStep("Step 2", (label, ctx) -> StepVerdict.fail(MismatchCategory.NOT_CALLED, "nope")),
                new ValidationStep("Step 3", (label, ctx) -> {
                    thirdRuns.incrementAndGet();
                    return StepVerdict.pass();
                })), listener, artifactSource);

        SequenceOutcome outcome = sequencer.run(context(List.of()));

        assertFalse(outcome.passed());
        assertEquals(1, outcome.exitCode());
        assertEquals(1, outcome.failedStepIndex());
        assertEquals(2, outcome.executed().size());
        assertNull(outcome.artifact());
        assertEquals(0, thirdRuns.get());
        assertEquals(0, releases.get());
        assertEquals(List.of("pass Step 1", "fail Step 2: nope"), listener.events);
        assertEquals(1, sequencer.currentStep());
    }

    @Test
    void run_ShouldTurnThrowingCheckIntoErrorVerdict() {
        ValidationSequencer sequencer = new ValidationSequencer(List.of(
                new ValidationStep("Step 1", (label, ctx) -> {
                    throw new IllegalStateException("boom");
                })), listener, artifactSource);

        SequenceOutcome outcome = sequencer.run(context(List.of()));

        assertEquals(SequencerState.FAILED, outcome.state());
        assertEquals(MismatchCategory.ERROR, outcome.executed().get(0).category());
        assertEquals(List.of("fail Step 1: Could not check Step 1: boom"), listener.events);
    }

    @Test
    void run_ShouldRejectSecondRun() {
        ValidationSequencer sequencer = new ValidationSequencer(List.of(), listener, artifactSource);
        VerificationContext context = context(List.of());

        sequencer.run(context);

        assertThrows(IllegalStateException.class, () -> sequencer.run(context));
    }

    @Test
    void run_ShouldLetLaterStepsSeeVariablesRecordedByEarlierCalls() {
        List<Statement> statements = List.of(new AssignStatement(List.of("model"),
                new FunctionCallStatement("LinearRegression", List.of(), Map.of())));
        ValidationSequencer sequencer = new ValidationSequencer(List.of(
                new ValidationStep("Step 1", StructuralChecks.variableAssigned("model")),
                new ValidationStep("Step 2", passing())), listener, artifactSource);
        ValidationSequencer ordered = new ValidationSequencer(List.of(
                ValidationStep.call("Step 1", FunctionCallSpec.builder("LinearRegression").variableCount(1).build()),
                new ValidationStep("Step 2", StructuralChecks.variableAssigned("model"))),
                new RecordingListener(), artifactSource);

        assertFalse(sequencer.run(context(statements, "model")).passed());
        assertTrue(ordered.run(context(statements, "model")).passed());
    }

    private static class RecordingListener implements StepListener {
        final List<String> events = new ArrayList<>();

        @Override
        public void stepPassed(String label) {
            events.add("pass " + label);
        }

        @Override
        public void stepFailed(String label, String message) {
            events.add("fail " + label + ": " + message);
        }

        @Override
        public void completed(String artifact) {
            events.add("done " + artifact);
        }
    }
}
