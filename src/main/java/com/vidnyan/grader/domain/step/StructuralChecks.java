package com.vidnyan.grader.domain.step;

import com.vidnyan.grader.domain.query.StatementQueries;
import com.vidnyan.grader.domain.statement.ClassDefStatement;
import com.vidnyan.grader.domain.statement.FunctionDefStatement;
import com.vidnyan.grader.domain.variable.PythonValues;
import com.vidnyan.grader.domain.variable.VariableValue;
import com.vidnyan.grader.domain.verification.MismatchCategory;
import com.vidnyan.grader.domain.verification.StepVerdict;

import java.util.List;
import java.util.Optional;

/**
 * Predicate steps built on the statement queries and the resolved variables.
 */
public final class StructuralChecks {

    private StructuralChecks() {
    }

    public static StepCheck importsModule(String module, String alias) {
        return (label, ctx) -> StepVerdict.of(
                StatementQueries.findImport(ctx.statements(), module, alias).isPresent(),
                String.format("'import %s%s' is missing in %s.", module, alias != null ? " as " + alias : "", label));
    }

    public static StepCheck importsFrom(String module, List<String> names, String alias) {
        return (label, ctx) -> StepVerdict.of(
                StatementQueries.findImportFrom(ctx.statements(), module, names, alias).isPresent(),
                String.format("'from %s import %s%s' is missing in %s.", module, String.join(", ", names),
                        alias != null ? " as " + alias : "", label));
    }

    /**
     * The function must be defined at top level; when {@code args} is non-null
     * its positional parameters must equal them.
     */
    public static StepCheck definesFunction(String name, List<String> args) {
        return (label, ctx) -> {
            Optional<FunctionDefStatement> def = StatementQueries.findFunctionDef(ctx.statements(), name);
            if (def.isEmpty()) {
                return StepVerdict.of(false, String.format("Function %s() is not defined in %s.", name, label));
            }
            if (args != null && !def.get().args().equals(args)) {
                return StepVerdict.fail(MismatchCategory.WRONG_PARAMETERS,
                        String.format("Function %s() should take parameters (%s) in %s.",
                                name, String.join(", ", args), label));
            }
            return StepVerdict.pass();
        };
    }

    public static StepCheck definesClass(String name, List<String> bases) {
        return (label, ctx) -> {
            Optional<ClassDefStatement> def = StatementQueries.findClassDef(ctx.statements(), name);
            if (def.isEmpty()) {
                return StepVerdict.of(false, String.format("Class %s is not defined in %s.", name, label));
            }
            if (bases != null && !def.get().bases().equals(bases)) {
                return StepVerdict.fail(MismatchCategory.WRONG_PARAMETERS,
                        String.format("Class %s should inherit from (%s) in %s.",
                                name, String.join(", ", bases), label));
            }
            return StepVerdict.pass();
        };
    }

    /**
     * The variable must resolve statically to {@code expected}; an unresolvable
     * value is a mismatch.
     */
    public static StepCheck variableEquals(String name, Object expected) {
        return (label, ctx) -> {
            VariableValue value = ctx.variables().valueOf(name);
            boolean matches = value.value()
                    .map(v -> PythonValues.pyEquals(v, expected))
                    .orElse(false);
            return StepVerdict.of(matches,
                    String.format("Variable %s does not have the expected value in %s.", name, label));
        };
    }

    /**
     * A previous call step must have assigned {@code name}.
     */
    public static StepCheck variableAssigned(String name) {
        return (label, ctx) -> StepVerdict.of(ctx.userVariables().isAssigned(name),
                String.format("Variable %s is not assigned in %s.", name, label));
    }
}
