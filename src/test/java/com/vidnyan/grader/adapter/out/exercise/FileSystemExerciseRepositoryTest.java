package com.vidnyan.grader.adapter.out.exercise;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.grader.application.port.out.ExerciseDefinitionException;
import com.vidnyan.grader.domain.query.SearchScope;
import com.vidnyan.grader.domain.step.CallSpecCheck;
import com.vidnyan.grader.domain.step.Exercise;
import com.vidnyan.grader.domain.verification.FunctionCallSpec;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileSystemExerciseRepositoryTest {

    @TempDir
    Path tempDir;

    private final FileSystemExerciseRepository repository = new FileSystemExerciseRepository(
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false));

    private Path write(String json) throws IOException {
        Path file = tempDir.resolve("exercise.json");
        Files.writeString(file, json);
        return file;
    }

    @Test
    void load_ShouldMapCallStep() throws IOException {
        // Arrange
        Path file = write("""
                {"name": "split", "variables": ["X_train"], "steps": [
                  {"label": "Step 2", "type": "call", "function": "train_test_split",
                   "args": ["X", "y"], "kwargs": {"test_size": "0.2"}, "variableCount": 4,
                   "maxCalls": 2, "scope": "recursive"}
                ]}
                """);

        // Act
        Exercise exercise = repository.load(file);

        // Assert
        assertEquals("split", exercise.name());
        assertEquals(List.of("X_train"), exercise.variables());
        assertEquals("Step 2", exercise.steps().get(0).label());
        CallSpecCheck check = assertInstanceOf(CallSpecCheck.class, exercise.steps().get(0).check());
        FunctionCallSpec spec = check.spec();
        assertEquals("train_test_split", spec.functionName());
        assertEquals(List.of("X", "y"), spec.expectedArgs());
        assertEquals(Map.of("test_size", "0.2"), spec.expectedKwargs());
        assertEquals(4, spec.expectedVariableCount());
        assertTrue(spec.allowAssignment());
        assertEquals(2, spec.maxCalls());
        assertEquals(SearchScope.RECURSIVE, spec.scope());
    }

    @Test
    void load_ShouldApplyDefaults() throws IOException {
        Path file = write("""
                {"steps": [
                  {"type": "import", "module": "numpy", "alias": "np"},
                  {"type": "call", "function": "fit", "unknownField": 1}
                ]}
                """);

        Exercise exercise = repository.load(file);

        assertEquals("exercise.json", exercise.name());
        assertTrue(exercise.variables().isEmpty());
        assertEquals("Step 1", exercise.steps().get(0).label());
        assertEquals("Step 2", exercise.steps().get(1).label());
        FunctionCallSpec spec = ((CallSpecCheck) exercise.steps().get(1).check()).spec();
        assertTrue(spec.expectedArgs().isEmpty());
        assertNull(spec.expectedVariableCount());
        assertEquals(1, spec.maxCalls());
        assertEquals(SearchScope.TOP_LEVEL, spec.scope());
    }

    @Test
    void load_ShouldMapEveryStructuralStepType() throws IOException {
        Path file = write("""
                {"steps": [
                  {"type": "import_from", "module": "sklearn.metrics", "names": ["r2_score"]},
                  {"type": "function-def", "name": "score", "args": ["y"]},
                  {"type": "class-def", "name": "Model"},
                  {"type": "variable-value", "name": "ratio", "value": 0.2},
                  {"type": "variable-value", "name": "empty", "value": null},
                  {"type": "variable-assigned", "name": "model"}
                ]}
                """);

        assertEquals(6, repository.load(file).steps().size());
    }

    @Test
    void load_ShouldRejectUnknownStepType() throws IOException {
        Path file = write("""
                {"steps": [{"type": "call", "function": "f"}, {"type": "lint"}]}
                """);

        ExerciseDefinitionException e = assertThrows(ExerciseDefinitionException.class, () -> repository.load(file));

        assertTrue(e.getMessage().endsWith("step 2: unknown step type 'lint'"));
    }

    @Test
    void load_ShouldRejectMissingFields() throws IOException {
        Path noFunction = write("""
                {"steps": [{"type": "call"}]}
                """);
        assertTrue(assertThrows(ExerciseDefinitionException.class, () -> repository.load(noFunction))
                .getMessage().endsWith("step 1: missing field 'function'"));

        Path noValue = write("""
                {"steps": [{"type": "variable-value", "name": "x"}]}
                """);
        assertTrue(assertThrows(ExerciseDefinitionException.class, () -> repository.load(noValue))
                .getMessage().endsWith("step 1: missing field 'value'"));
    }

    @Test
    void load_ShouldRejectInvalidCallSpec() throws IOException {
        Path zeroCalls = write("""
                {"steps": [{"type": "call", "function": "f", "maxCalls": 0}]}
                """);
        Path badScope = write("""
                {"steps": [{"type": "call", "function": "f", "scope": "deep"}]}
                """);

        assertThrows(ExerciseDefinitionException.class, () -> repository.load(zeroCalls));
        assertTrue(assertThrows(ExerciseDefinitionException.class, () -> repository.load(badScope))
                .getMessage().endsWith("unknown scope 'deep'"));
    }

    @Test
    void load_ShouldRejectEmptyOrUnreadableDefinition() throws IOException {
        Path empty = write("""
                {"name": "empty", "steps": []}
                """);

        assertThrows(ExerciseDefinitionException.class, () -> repository.load(empty));
        assertThrows(ExerciseDefinitionException.class, () -> repository.load(tempDir.resolve("missing.json")));
        assertThrows(ExerciseDefinitionException.class, () -> repository.load(write("{not json")));
    }

    @Test
    void load_ShouldReadBundledExercise() {
        Exercise exercise = repository.load(Path.of("src/main/resources/exercises/linear-regression.json"));

        assertEquals("linear-regression", exercise.name());
        assertEquals(5, exercise.steps().size());
    }
}
