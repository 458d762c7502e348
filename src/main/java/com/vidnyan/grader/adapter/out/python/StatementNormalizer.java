package com.vidnyan.grader.adapter.out.python;

import com.vidnyan.grader.adapter.out.python.syntax.Arguments;
import com.vidnyan.grader.adapter.out.python.syntax.ExpressionBuilder;
import com.vidnyan.grader.adapter.out.python.syntax.PyExpr;
import com.vidnyan.grader.adapter.out.python.syntax.PythonSyntaxTree;
import com.vidnyan.grader.domain.statement.*;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.vidnyan.grader.adapter.out.python.syntax.ExpressionRenderer.render;

/**
 * Converts tree-sitter statement nodes into the closed {@link Statement} model.
 * Total: any statement without a dedicated variant becomes a {@link GenericStatement}
 * tagged with the name Python's {@code ast} module gives its node.
 */
final class StatementNormalizer {

    private static final Map<String, String> GENERIC_KINDS = Map.ofEntries(
            Map.entry("while_statement", "While"),
            Map.entry("return_statement", "Return"),
            Map.entry("delete_statement", "Delete"),
            Map.entry("raise_statement", "Raise"),
            Map.entry("pass_statement", "Pass"),
            Map.entry("break_statement", "Break"),
            Map.entry("continue_statement", "Continue"),
            Map.entry("global_statement", "Global"),
            Map.entry("nonlocal_statement", "Nonlocal"),
            Map.entry("assert_statement", "Assert"),
            Map.entry("match_statement", "Match"),
            Map.entry("type_alias_statement", "TypeAlias"));

    private final PythonSyntaxTree tree;
    private final ExpressionBuilder expressions;

    private StatementNormalizer(PythonSyntaxTree tree) {
        this.tree = tree;
        this.expressions = new ExpressionBuilder(tree);
    }

    static List<Statement> normalize(PythonSyntaxTree tree) {
        return new StatementNormalizer(tree).statements(tree.root());
    }

    /**
     * Normalizes the statements of a module or block.
     */
    private List<Statement> statements(TSNode container) {
        if (container == null) {
            return List.of();
        }
        List<TSNode> nodes = tree.namedChildren(container);
        List<Statement> statements = new ArrayList<>(nodes.size());
        for (TSNode node : nodes) {
            statements.add(statement(node));
        }
        return statements;
    }

    private Statement statement(TSNode node) {
        switch (node.getType()) {
            case "expression_statement":
                return expressionStatement(node);
            case "import_statement":
                return importStatement(node);
            case "import_from_statement":
            case "future_import_statement":
                return importFrom(node);
            case "decorated_definition":
                return statement(tree.field(node, "definition"));
            case "class_definition":
                return classDef(node);
            case "function_definition":
                if (isAsync(node)) {
                    return new GenericStatement("AsyncFunctionDef");
                }
                return new FunctionDefStatement(tree.text(tree.field(node, "name")),
                        parameterNames(expressions.arguments(tree.field(node, "parameters"))),
                        statements(tree.field(node, "body")));
            case "for_statement":
                if (isAsync(node)) {
                    return new GenericStatement("AsyncFor");
                }
                return new ForStatement(render(expressions.build(tree.field(node, "left"))),
                        render(expressions.build(tree.field(node, "right"))),
                        statements(tree.field(node, "body")),
                        elseBody(tree.field(node, "alternative")));
            case "with_statement":
                if (isAsync(node)) {
                    return new GenericStatement("AsyncWith");
                }
                return withStatement(node);
            case "if_statement":
                return new IfStatement(render(expressions.build(tree.field(node, "condition"))),
                        statements(tree.field(node, "consequence")),
                        alternatives(tree.fields(node, "alternative"), 0));
            case "try_statement":
                return new GenericStatement(tree.hasChildOfType(node, "except_group_clause") ? "TryStar" : "Try");
            default:
                return new GenericStatement(GENERIC_KINDS.getOrDefault(node.getType(), node.getType()));
        }
    }

    /**
     * A bare call becomes a call statement; several comma-separated expressions form a tuple.
     */
    private Statement expressionStatement(TSNode node) {
        List<TSNode> parts = tree.namedChildren(node);
        TSNode first = parts.get(0);
        if (parts.size() == 1) {
            if ("assignment".equals(first.getType())) {
                return tree.field(first, "type") != null ? new GenericStatement("AnnAssign") : assignment(first);
            }
            if ("augmented_assignment".equals(first.getType())) {
                return new GenericStatement("AugAssign");
            }
        }
        PyExpr value;
        if (parts.size() == 1) {
            value = expressions.build(first);
        } else {
            List<PyExpr> elements = new ArrayList<>(parts.size());
            for (TSNode part : parts) {
                elements.add(expressions.build(part));
            }
            value = new PyExpr.TupleExpr(elements);
        }
        if (value instanceof PyExpr.Call call) {
            return toCall(call);
        }
        return new ExprStatement(render(value));
    }

    static FunctionCallStatement toCall(PyExpr.Call call) {
        List<String> args = call.args().stream().map(a -> render(a)).toList();
        Map<String, String> kwargs = new LinkedHashMap<>();
        for (PyExpr.Keyword keyword : call.keywords()) {
            String key = keyword.arg() != null ? keyword.arg() : FunctionCallStatement.DOUBLE_STAR_KEY;
            kwargs.put(key, render(keyword.value()));
        }
        return new FunctionCallStatement(render(call.func()), args, kwargs);
    }

    /**
     * {@code a = b = value} nests one assignment per extra target; every target
     * is kept, tuple and list targets are flattened one level.
     */
    private AssignStatement assignment(TSNode node) {
        List<String> targets = new ArrayList<>();
        TSNode current = node;
        TSNode value;
        while (true) {
            addTargets(expressions.build(tree.field(current, "left")), targets);
            value = tree.field(current, "right");
            if (value == null || !"assignment".equals(value.getType())) {
                break;
            }
            if (tree.field(value, "type") != null) {
                throw tree.error(value, "invalid syntax");
            }
            current = value;
        }
        if (value == null || "augmented_assignment".equals(value.getType())) {
            throw tree.error(node, "invalid syntax");
        }
        PyExpr rhs = expressions.build(value);
        AssignedValue assigned = rhs instanceof PyExpr.Call call ? toCall(call) : new RenderedValue(render(rhs));
        return new AssignStatement(targets, assigned);
    }

    private static void addTargets(PyExpr target, List<String> targets) {
        List<PyExpr> elements = sequenceElements(target);
        if (elements == null || elements.isEmpty()) {
            targets.add(render(target));
            return;
        }
        for (PyExpr element : elements) {
            targets.add(element instanceof PyExpr.Name name ? name.id() : render(element));
        }
    }

    /**
     * Elements of a tuple or list target, or null for any other target.
     */
    private static List<PyExpr> sequenceElements(PyExpr target) {
        if (target instanceof PyExpr.TupleExpr tuple) {
            return tuple.elts();
        }
        if (target instanceof PyExpr.ListExpr list) {
            return list.elts();
        }
        return null;
    }

    private Statement importStatement(TSNode node) {
        List<String> names = new ArrayList<>();
        String alias = importedNames(node, names);
        return new ImportStatement(names, alias);
    }

    /**
     * {@code from ..pkg import a as b}: the level counts the leading dots.
     */
    private Statement importFrom(TSNode node) {
        String module = "__future__";
        int level = 0;
        TSNode moduleName = tree.field(node, "module_name");
        if (moduleName != null && "relative_import".equals(moduleName.getType())) {
            TSNode prefix = tree.childOfType(moduleName, "import_prefix");
            level = (int) tree.text(prefix).chars().filter(c -> c == '.').count();
            TSNode dotted = tree.childOfType(moduleName, "dotted_name");
            module = dotted != null ? dottedName(dotted) : "";
        } else if (moduleName != null) {
            module = dottedName(moduleName);
        }

        if (tree.hasChildOfType(node, "wildcard_import")) {
            return new ImportFromStatement(module, List.of("*"), null, level);
        }
        List<String> names = new ArrayList<>();
        String alias = importedNames(node, names);
        return new ImportFromStatement(module, names, alias, level);
    }

    /**
     * Collects the imported names into {@code names}; returns the alias of the first, or null.
     */
    private String importedNames(TSNode node, List<String> names) {
        String alias = null;
        List<TSNode> imported = tree.fields(node, "name");
        for (int i = 0; i < imported.size(); i++) {
            TSNode name = imported.get(i);
            if ("aliased_import".equals(name.getType())) {
                names.add(dottedName(tree.field(name, "name")));
                if (i == 0) {
                    alias = tree.text(tree.field(name, "alias"));
                }
            } else {
                names.add(dottedName(name));
            }
        }
        return alias;
    }

    private String dottedName(TSNode node) {
        List<String> parts = new ArrayList<>();
        for (TSNode part : tree.namedChildren(node)) {
            parts.add(tree.text(part));
        }
        return parts.isEmpty() ? tree.text(node) : String.join(".", parts);
    }

    private Statement classDef(TSNode node) {
        List<String> bases = new ArrayList<>();
        TSNode superclasses = tree.field(node, "superclasses");
        if (superclasses != null) {
            for (TSNode base : tree.namedChildren(superclasses)) {
                String type = base.getType();
                if (!"keyword_argument".equals(type) && !"dictionary_splat".equals(type)) {
                    bases.add(render(expressions.build(base)));
                }
            }
        }
        return new ClassDefStatement(tree.text(tree.field(node, "name")), bases, statements(tree.field(node, "body")));
    }

    private Statement withStatement(TSNode node) {
        List<WithStatement.WithItem> items = new ArrayList<>();
        TSNode clause = tree.childOfType(node, "with_clause");
        for (TSNode item : tree.namedChildren(clause)) {
            TSNode value = tree.field(item, "value");
            if ("as_pattern".equals(value.getType())) {
                items.add(new WithStatement.WithItem(
                        render(expressions.build(tree.firstNamedChild(value))),
                        render(expressions.build(tree.field(value, "alias")))));
            } else {
                items.add(new WithStatement.WithItem(render(expressions.build(value)), null));
            }
        }
        return new WithStatement(items, statements(tree.field(node, "body")));
    }

    /**
     * Each {@code elif} becomes the single statement of the enclosing {@code orelse}.
     */
    private List<Statement> alternatives(List<TSNode> clauses, int index) {
        if (index >= clauses.size()) {
            return List.of();
        }
        TSNode clause = clauses.get(index);
        if ("elif_clause".equals(clause.getType())) {
            return List.of(new IfStatement(render(expressions.build(tree.field(clause, "condition"))),
                    statements(tree.field(clause, "consequence")),
                    alternatives(clauses, index + 1)));
        }
        return elseBody(clause);
    }

    private List<Statement> elseBody(TSNode elseClause) {
        return elseClause == null ? List.of() : statements(tree.field(elseClause, "body"));
    }

    private boolean isAsync(TSNode node) {
        List<TSNode> children = tree.children(node);
        return !children.isEmpty() && "async".equals(children.get(0).getType());
    }

    private static List<String> parameterNames(Arguments args) {
        return args.args().stream().map(Arguments.Param::name).toList();
    }
}
