package com.vidnyan.grader.application.service;

import com.vidnyan.grader.adapter.out.python.PythonSourceParser;
import com.vidnyan.grader.adapter.out.python.PythonVariableResolver;
import com.vidnyan.grader.adapter.out.report.ConsoleStepReporter;
import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase.VerificationRequest;
import com.vidnyan.grader.application.port.in.VerifySubmissionUseCase.VerificationResult;
import com.vidnyan.grader.application.port.out.SourceNotFoundException;
import com.vidnyan.grader.application.port.out.SourceSyntaxException;
import com.vidnyan.grader.domain.step.Exercise;
import com.vidnyan.grader.domain.step.StructuralChecks;
import com.vidnyan.grader.domain.step.ValidationStep;
import com.vidnyan.grader.domain.verification.FunctionCallSpec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class VerificationApplicationServiceTest {

    private static final String SUBMISSION = """
            from sklearn.linear_model import LinearRegression
            from sklearn.model_selection import train_test_split

            test_size = 0.2
            X, y = load_data()
            X_train, X_test, y_train, y_test = train_test_split(X, y, test_size=0.2, random_state=42)
            model = LinearRegression()
            model.fit(X_train, y_train)
            """;

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream console;
    private VerificationApplicationService service;

    @BeforeEach
    void setUp() {
        console = new ByteArrayOutputStream();
        service = new VerificationApplicationService(
                new PythonSourceParser(),
                new PythonVariableResolver(),
                new ConsoleStepReporter(new PrintStream(console, true, StandardCharsets.UTF_8), false),
                () -> "flag{regression}");
    }

    private static Exercise exercise() {
        return new Exercise("linear-regression", List.of("model"), List.of(
                new ValidationStep("Step 1", StructuralChecks.importsFrom(
                        "sklearn.linear_model", List.of("LinearRegression"), null)),
                new ValidationStep("Step 2", StructuralChecks.variableEquals("test_size", 0.2)),
                ValidationStep.call("Step 3", FunctionCallSpec.builder("train_test_split")
                        .args("X", "y")
                        .kwargs(Map.of("test_size", "0.2", "random_state", "42"))
                        .variableCount(4)
                        .build()),
                ValidationStep.call("Step 4", FunctionCallSpec.builder("LinearRegression").variableCount(1).build()),
                new ValidationStep("Step 5", StructuralChecks.variableAssigned("model")),
                ValidationStep.call("Step 6", FunctionCallSpec.builder("model.fit")
                        .args("X_train", "y_train")
                        .allowAssignment(false)
                        .build())));
    }

    private Path submission(String source) throws IOException {
        Path file = tempDir.resolve("main.py");
        Files.writeString(file, source);
        return file;
    }

    private String output() {
        return console.toString(StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
    }

    @Test
    void verify_ShouldPassEveryStepAndReleaseArtifact() throws IOException {
        // Act
        VerificationResult result = service.verify(new VerificationRequest(submission(SUBMISSION), exercise()));

        // Assert
        assertTrue(result.passed());
        assertEquals(6, result.outcome().executed().size());
        assertEquals(7, result.statementsParsed());
        assertEquals("flag{regression}", result.outcome().artifact());
        assertTrue(output().startsWith("Step 1 Passed\nStep 2 Passed\n"));
        assertTrue(output().endsWith("Step 6 Passed\n" + "Congratulations! You have passed this challenge! Here is your flag:\nflag{regression}\n"));
    }

    @Test
    void verify_ShouldStopAtFirstFailingStep() throws IOException {
        String source = SUBMISSION.replace("model.fit(X_train, y_train)", "result = model.fit(X_train, y_train)");

        VerificationResult result = service.verify(new VerificationRequest(submission(source), exercise()));

        assertFalse(result.passed());
        assertEquals(5, result.outcome().failedStepIndex());
        assertNull(result.outcome().artifact());
        assertTrue(output().endsWith("Step 6 Failed\nmodel.fit() should not be assigned to a variable in Step 6.\n"));
    }

    @Test
    void verify_ShouldFailValueStep_WhenValueIsDynamic() throws IOException {
        String source = SUBMISSION.replace("test_size = 0.2", "test_size = compute()");

        VerificationResult result = service.verify(new VerificationRequest(submission(source), exercise()));

        assertEquals(1, result.outcome().failedStepIndex());
        assertEquals("Step 1 Passed\nStep 2 Failed\nVariable test_size does not have the expected value in Step 2.\n",
                output());
    }

    @Test
    void verify_ShouldThrowBeforeAnyStep_WhenSourceIsInvalid() throws IOException {
        Path broken = submission("model = LinearRegression(\n");

        assertThrows(SourceSyntaxException.class, () -> service.verify(new VerificationRequest(broken, exercise())));
        assertThrows(SourceNotFoundException.class, () -> service.verify(
                new VerificationRequest(tempDir.resolve("absent.py"), exercise())));
        assertEquals("", output());
    }

    @Test
    void verify_ShouldNotShareStateBetweenRuns() throws IOException {
        Path file = submission(SUBMISSION);

        assertTrue(service.verify(new VerificationRequest(file, exercise())).passed());
        assertTrue(service.verify(new VerificationRequest(file, exercise())).passed());
    }
}
