package com.vidnyan.grader.domain.query;

import com.vidnyan.grader.domain.statement.*;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class StatementQueriesTest {

    private static FunctionCallStatement call(String function, String... args) {
        return new FunctionCallStatement(function, List.of(args), Map.of());
    }

    @Test
    void findCalls_ShouldMatchStandaloneAndAssignedCallsInOrder() {
        Statement standalone = call("fit");
        Statement assigned = new AssignStatement(List.of("m"), call("fit", "X"));
        Statement other = call("predict");
        List<Statement> forest = List.of(standalone, other, assigned);

        assertEquals(List.of(standalone, assigned), StatementQueries.findCalls(forest, "fit"));
        assertTrue(StatementQueries.findCalls(forest, "transform").isEmpty());
    }

    @Test
    void findCalls_ShouldCompareRenderedCalleeExactly() {
        List<Statement> forest = List.of(call("model.fit"));

        assertTrue(StatementQueries.findCalls(forest, "fit").isEmpty());
        assertEquals(1, StatementQueries.findCalls(forest, "model.fit").size());
    }

    @Test
    void findCalls_ShouldSearchNestedBodiesOnlyWhenRecursive() {
        Statement nested = call("train");
        List<Statement> forest = List.of(
                new FunctionDefStatement("main", List.of(), List.of(
                        new IfStatement("ready", List.of(), List.of(nested)))));

        assertTrue(StatementQueries.findCalls(forest, "train").isEmpty());
        assertEquals(List.of(nested), StatementQueries.findCalls(forest, "train", SearchScope.RECURSIVE));
    }

    @Test
    void findCalls_ShouldIgnoreAssignmentsWithoutCall() {
        List<Statement> forest = List.of(new AssignStatement(List.of("f"), new RenderedValue("fit")));

        assertTrue(StatementQueries.findCalls(forest, "fit").isEmpty());
    }

    @Test
    void findFunctionDefAndClassDef_ShouldReturnFirstTopLevelMatch() {
        FunctionDefStatement first = new FunctionDefStatement("run", List.of("a"), List.of());
        FunctionDefStatement second = new FunctionDefStatement("run", List.of("b"), List.of());
        ClassDefStatement cls = new ClassDefStatement("Model", List.of("Base"), List.of(
                new FunctionDefStatement("hidden", List.of(), List.of())));
        List<Statement> forest = List.of(first, cls, second);

        assertSame(first, StatementQueries.findFunctionDef(forest, "run").orElseThrow());
        assertSame(cls, StatementQueries.findClassDef(forest, "Model").orElseThrow());
        assertTrue(StatementQueries.findFunctionDef(forest, "hidden").isEmpty());
        assertTrue(StatementQueries.findClassDef(forest, "run").isEmpty());
    }

    @Test
    void findImport_ShouldRequireExactAlias() {
        ImportStatement numpy = new ImportStatement(List.of("numpy"), "np");
        ImportStatement os = new ImportStatement(List.of("os", "sys"), null);
        List<Statement> forest = List.of(numpy, os);

        assertSame(numpy, StatementQueries.findImport(forest, "numpy", "np").orElseThrow());
        assertTrue(StatementQueries.findImport(forest, "numpy", null).isEmpty());
        assertTrue(StatementQueries.findImport(forest, "numpy", "numpy").isEmpty());
        assertSame(os, StatementQueries.findImport(forest, "sys", null).orElseThrow());
    }

    @Test
    void findImportFrom_ShouldCompareNamesAsSets() {
        ImportFromStatement imp = new ImportFromStatement("sklearn.metrics",
                List.of("mean_squared_error", "r2_score"), null, 0);
        List<Statement> forest = List.of(imp);

        assertTrue(StatementQueries.findImportFrom(forest, "sklearn.metrics",
                List.of("r2_score", "mean_squared_error"), null).isPresent());
        assertTrue(StatementQueries.findImportFrom(forest, "sklearn.metrics",
                List.of("r2_score"), null).isEmpty());
        assertTrue(StatementQueries.findImportFrom(forest, "sklearn",
                List.of("r2_score", "mean_squared_error"), null).isEmpty());
        assertTrue(StatementQueries.findImportFrom(forest, "sklearn.metrics",
                List.of("r2_score", "mean_squared_error"), "m").isEmpty());
    }

    @Test
    void walk_ShouldVisitEveryBodyInPreOrder() {
        Statement a = call("a");
        Statement b = call("b");
        Statement c = call("c");
        Statement d = call("d");
        Statement e = call("e");
        ForStatement loop = new ForStatement("i", "range(3)", List.of(b), List.of(c));
        WithStatement with = new WithStatement(
                List.of(new WithStatement.WithItem("open(p)", "f")), List.of(d));
        ClassDefStatement cls = new ClassDefStatement("K", List.of(), List.of(e));
        List<Statement> forest = List.of(a, loop, with, cls);

        assertEquals(List.of(a, loop, b, c, with, d, cls, e), StatementQueries.walk(forest));
    }
}
