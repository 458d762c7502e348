package com.vidnyan.grader.domain.query;

import com.vidnyan.grader.domain.statement.*;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Structural lookups over a statement forest.
 * All lookups return the first match in source order; absence is an empty result.
 */
public final class StatementQueries {

    private StatementQueries() {
    }

    /**
     * Find calls to {@code functionName} among the top-level statements, either
     * standalone or as the value of an assignment.
     */
    public static List<Statement> findCalls(List<Statement> forest, String functionName) {
        return findCalls(forest, functionName, SearchScope.TOP_LEVEL);
    }

    public static List<Statement> findCalls(List<Statement> forest, String functionName, SearchScope scope) {
        return candidates(forest, scope).stream()
                .filter(s -> callOf(s).map(c -> c.function().equals(functionName)).orElse(false))
                .toList();
    }

    /**
     * The call carried by a statement: the statement itself, or the value of an assignment.
     */
    public static Optional<FunctionCallStatement> callOf(Statement statement) {
        if (statement instanceof FunctionCallStatement call) {
            return Optional.of(call);
        }
        if (statement instanceof AssignStatement assign) {
            return assign.call();
        }
        return Optional.empty();
    }

    public static Optional<FunctionDefStatement> findFunctionDef(List<Statement> forest, String name) {
        return forest.stream()
                .filter(FunctionDefStatement.class::isInstance)
                .map(FunctionDefStatement.class::cast)
                .filter(f -> f.name().equals(name))
                .findFirst();
    }

    public static Optional<ClassDefStatement> findClassDef(List<Statement> forest, String name) {
        return forest.stream()
                .filter(ClassDefStatement.class::isInstance)
                .map(ClassDefStatement.class::cast)
                .filter(c -> c.name().equals(name))
                .findFirst();
    }

    /**
     * Matches when {@code moduleName} is one of the imported names and the alias
     * is exactly {@code alias} (both may be absent).
     */
    public static Optional<ImportStatement> findImport(List<Statement> forest, String moduleName, String alias) {
        return forest.stream()
                .filter(ImportStatement.class::isInstance)
                .map(ImportStatement.class::cast)
                .filter(i -> i.names().contains(moduleName) && Objects.equals(i.alias(), alias))
                .findFirst();
    }

    /**
     * Matches on exact module and alias; the imported names are compared as sets.
     */
    public static Optional<ImportFromStatement> findImportFrom(
            List<Statement> forest, String module, List<String> submodules, String alias) {
        var expected = new HashSet<>(submodules);
        return forest.stream()
                .filter(ImportFromStatement.class::isInstance)
                .map(ImportFromStatement.class::cast)
                .filter(i -> i.module().equals(module)
                        && new HashSet<>(i.names()).equals(expected)
                        && Objects.equals(i.alias(), alias))
                .findFirst();
    }

    /**
     * Pre-order traversal of the forest and every nested body and else-clause.
     */
    public static List<Statement> walk(List<Statement> forest) {
        List<Statement> out = new ArrayList<>();
        collect(forest, out);
        return out;
    }

    private static void collect(List<Statement> statements, List<Statement> out) {
        for (Statement statement : statements) {
            out.add(statement);
            if (statement instanceof ClassDefStatement c) {
                collect(c.body(), out);
            } else if (statement instanceof FunctionDefStatement f) {
                collect(f.body(), out);
            } else if (statement instanceof ForStatement f) {
                collect(f.body(), out);
                collect(f.orelse(), out);
            } else if (statement instanceof WithStatement w) {
                collect(w.body(), out);
            } else if (statement instanceof IfStatement i) {
                collect(i.body(), out);
                collect(i.orelse(), out);
            }
        }
    }

    private static List<Statement> candidates(List<Statement> forest, SearchScope scope) {
        return scope == SearchScope.RECURSIVE ? walk(forest) : forest;
    }
}
