package com.vidnyan.grader.adapter.out.python;

import com.vidnyan.grader.adapter.out.python.syntax.ExpressionBuilder;
import com.vidnyan.grader.adapter.out.python.syntax.PyExpr;
import com.vidnyan.grader.adapter.out.python.syntax.PythonSyntaxTree;
import com.vidnyan.grader.application.port.out.VariableResolver;
import com.vidnyan.grader.domain.variable.VariableTable;
import com.vidnyan.grader.domain.variable.VariableValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Resolves variable values with one pre-order pass over every assignment,
 * nested bodies included. Each right-hand side is tried as a literal first,
 * then with the restricted evaluator over the names bound so far.
 */
@Slf4j
@Component
public class PythonVariableResolver implements VariableResolver {

    private static final String ORIGIN = "<source>";

    @Override
    public VariableTable resolveVariables(String sourceText) {
        PythonSyntaxTree tree = PythonSyntaxTree.parse(sourceText, ORIGIN);
        VariableTable table = new VariableTable();
        visit(tree.root(), tree, new ExpressionBuilder(tree), table);
        log.debug("Resolved {} variables", table.size());
        return table;
    }

    @Override
    public VariableTable resolveVariables(Path sourcePath) {
        return resolveVariables(PythonSourceParser.readSource(sourcePath));
    }

    /**
     * Statements never nest inside expressions, so an expression statement ends the descent.
     */
    private void visit(TSNode node, PythonSyntaxTree tree, ExpressionBuilder expressions, VariableTable table) {
        if ("expression_statement".equals(node.getType())) {
            List<TSNode> parts = tree.namedChildren(node);
            if (parts.size() == 1 && "assignment".equals(parts.get(0).getType())) {
                bind(parts.get(0), tree, expressions, table);
            }
            return;
        }
        for (TSNode child : tree.namedChildren(node)) {
            visit(child, tree, expressions, table);
        }
    }

    /**
     * Chained targets ({@code a = b = expr}) share one evaluation. Annotated
     * assignments bind nothing.
     */
    private void bind(TSNode assignment, PythonSyntaxTree tree, ExpressionBuilder expressions, VariableTable table) {
        List<String> names = new ArrayList<>();
        TSNode current = assignment;
        TSNode value;
        while (true) {
            if (tree.field(current, "type") != null) {
                return;
            }
            PyExpr target = expressions.build(tree.field(current, "left"));
            if (target instanceof PyExpr.Name name) {
                names.add(name.id());
            }
            value = tree.field(current, "right");
            if (value == null || !"assignment".equals(value.getType())) {
                break;
            }
            current = value;
        }
        if (names.isEmpty() || value == null) {
            return;
        }
        VariableValue resolved = resolve(expressions.build(value), table);
        for (String name : names) {
            table.bind(name, resolved);
        }
    }

    private static VariableValue resolve(PyExpr expr, VariableTable table) {
        VariableValue literal = LiteralEvaluator.literal(expr);
        return literal.isResolved() ? literal : LiteralEvaluator.evaluate(expr, table);
    }
}
