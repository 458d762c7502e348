package com.vidnyan.grader.adapter.out.exercise;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.grader.application.port.out.ExerciseDefinitionException;
import com.vidnyan.grader.application.port.out.ExerciseRepository;
import com.vidnyan.grader.domain.query.SearchScope;
import com.vidnyan.grader.domain.step.CallSpecCheck;
import com.vidnyan.grader.domain.step.Exercise;
import com.vidnyan.grader.domain.step.StepCheck;
import com.vidnyan.grader.domain.step.StructuralChecks;
import com.vidnyan.grader.domain.step.ValidationStep;
import com.vidnyan.grader.domain.verification.FunctionCallSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * File system based exercise repository.
 * Loads an exercise definition from a JSON file.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemExerciseRepository implements ExerciseRepository {

    private final ObjectMapper objectMapper;

    @Override
    public Exercise load(Path definitionPath) {
        ExerciseDto dto;
        try {
            dto = objectMapper.readValue(definitionPath.toFile(), ExerciseDto.class);
        } catch (IOException e) {
            log.warn("Failed to read exercise from {}: {}", definitionPath, e.getMessage());
            throw new ExerciseDefinitionException("Cannot read exercise definition " + definitionPath
                    + ": " + e.getMessage(), e);
        }
        if (dto == null || dto.steps == null || dto.steps.isEmpty()) {
            throw new ExerciseDefinitionException("Exercise definition " + definitionPath + " has no steps");
        }

        List<ValidationStep> steps = new ArrayList<>();
        for (int i = 0; i < dto.steps.size(); i++) {
            steps.add(mapToStep(dto.steps.get(i), i, definitionPath));
        }
        String name = dto.name != null ? dto.name : definitionPath.getFileName().toString();
        Exercise exercise = new Exercise(name, dto.variables, steps);
        log.info("Loaded exercise: {} with {} steps", exercise.name(), steps.size());
        return exercise;
    }

    private ValidationStep mapToStep(StepDto dto, int index, Path source) {
        if (dto == null) {
            throw invalid(source, index, "step is empty");
        }
        String label = dto.label != null && !dto.label.isBlank() ? dto.label : "Step " + (index + 1);
        return new ValidationStep(label, mapCheck(dto, index, source));
    }

    private StepCheck mapCheck(StepDto dto, int index, Path source) {
        String type = require(dto.type, "type", index, source);
        return switch (type.toLowerCase().replace("_", "-")) {
            case "call" -> {
                try {
                    yield new CallSpecCheck(mapCallSpec(dto, index, source));
                } catch (IllegalArgumentException e) {
                    throw invalid(source, index, e.getMessage());
                }
            }
            case "import" -> StructuralChecks.importsModule(require(dto.module, "module", index, source), dto.alias);
            case "import-from" -> StructuralChecks.importsFrom(
                    require(dto.module, "module", index, source),
                    require(dto.names, "names", index, source), dto.alias);
            case "function-def" -> StructuralChecks.definesFunction(require(dto.name, "name", index, source), dto.args);
            case "class-def" -> StructuralChecks.definesClass(require(dto.name, "name", index, source), dto.bases);
            case "variable-value" -> {
                if (!dto.hasValue) {
                    throw invalid(source, index, "missing field 'value'");
                }
                yield StructuralChecks.variableEquals(require(dto.name, "name", index, source), dto.value);
            }
            case "variable-assigned" -> StructuralChecks.variableAssigned(require(dto.name, "name", index, source));
            default -> throw invalid(source, index, "unknown step type '" + type + "'");
        };
    }

    private FunctionCallSpec mapCallSpec(StepDto dto, int index, Path source) {
        return FunctionCallSpec.builder(require(dto.function, "function", index, source))
                .args(dto.args != null ? dto.args : List.of())
                .kwargs(dto.kwargs != null ? dto.kwargs : Map.of())
                .variableCount(dto.variableCount)
                .allowAssignment(dto.allowAssignment != null ? dto.allowAssignment : true)
                .maxCalls(dto.maxCalls != null ? dto.maxCalls : 1)
                .scope(mapScope(dto.scope, index, source))
                .build();
    }

    private SearchScope mapScope(String scope, int index, Path source) {
        if (scope == null) return SearchScope.TOP_LEVEL;
        return switch (scope.toUpperCase().replace("-", "_")) {
            case "TOP_LEVEL" -> SearchScope.TOP_LEVEL;
            case "RECURSIVE" -> SearchScope.RECURSIVE;
            default -> throw invalid(source, index, "unknown scope '" + scope + "'");
        };
    }

    private static <T> T require(T value, String field, int index, Path source) {
        if (value == null) {
            throw invalid(source, index, "missing field '" + field + "'");
        }
        return value;
    }

    private static ExerciseDefinitionException invalid(Path source, int index, String reason) {
        log.warn("Invalid step {} in {}: {}", index + 1, source, reason);
        return new ExerciseDefinitionException(
                String.format("Invalid exercise definition %s, step %d: %s", source, index + 1, reason));
    }

    // DTO classes for JSON deserialization
    static class ExerciseDto {
        public String name;
        public List<String> variables;
        public List<StepDto> steps;
    }

    static class StepDto {
        public String label;
        public String type;
        // call
        public String function;
        public List<String> args;
        public Map<String, String> kwargs;
        public Integer variableCount;
        public Boolean allowAssignment;
        public Integer maxCalls;
        public String scope;
        // structural
        public String module;
        public List<String> names;
        public String alias;
        public String name;
        public List<String> bases;
        public Object value;
        boolean hasValue;

        public void setValue(Object value) {
            this.value = value;
            this.hasValue = true;
        }
    }
}
