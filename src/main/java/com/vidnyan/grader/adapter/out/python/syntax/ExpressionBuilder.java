package com.vidnyan.grader.adapter.out.python.syntax;

import com.vidnyan.grader.adapter.out.python.syntax.PyExpr.*;
import org.treesitter.TSNode;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lowers tree-sitter expression nodes into {@link PyExpr}: parentheses dropped,
 * literals decoded, boolean chains flattened, f-strings split into their pieces.
 */
public final class ExpressionBuilder {

    private static final Set<String> COMPARISON_TOKENS = Set.of(
            "<", "<=", "==", "!=", ">=", ">", "in", "not", "is", "not in", "is not");

    private final PythonSyntaxTree tree;

    public ExpressionBuilder(PythonSyntaxTree tree) {
        this.tree = tree;
    }

    public PyExpr build(TSNode node) {
        return switch (node.getType()) {
            case "identifier", "keyword_identifier" -> new Name(tree.text(node));
            case "true" -> Constant.TRUE;
            case "false" -> Constant.FALSE;
            case "none" -> Constant.NONE;
            case "ellipsis" -> Constant.ELLIPSIS;
            case "integer", "float" -> number(node);
            case "string" -> strings(List.of(node));
            case "concatenated_string" -> strings(tree.namedChildren(node));
            case "attribute" -> new Attribute(build(tree.field(node, "object")), tree.text(tree.field(node, "attribute")));
            case "subscript" -> subscript(node);
            case "slice" -> slice(node);
            case "call" -> call(node);
            case "binary_operator" -> new BinOp(build(tree.field(node, "left")),
                    tree.text(tree.field(node, "operator")), build(tree.field(node, "right")));
            case "unary_operator" -> new UnaryOp(tree.text(tree.field(node, "operator")),
                    build(tree.field(node, "argument")));
            case "not_operator" -> new UnaryOp("not", build(tree.field(node, "argument")));
            case "boolean_operator" -> boolOp(node);
            case "comparison_operator" -> compare(node);
            case "conditional_expression" -> conditional(node);
            case "named_expression" -> new NamedExpr(build(tree.field(node, "name")), build(tree.field(node, "value")));
            case "lambda" -> lambda(node);
            case "await" -> new Await(build(tree.firstNamedChild(node)));
            case "yield" -> yieldExpression(node);
            case "list", "list_pattern" -> new ListExpr(elements(node));
            case "set" -> new SetExpr(elements(node));
            case "tuple", "tuple_pattern", "expression_list", "pattern_list" -> new TupleExpr(elements(node));
            case "dictionary" -> dictionary(node);
            case "list_comprehension" -> new ListComp(build(tree.field(node, "body")), generators(node));
            case "set_comprehension" -> new SetComp(build(tree.field(node, "body")), generators(node));
            case "generator_expression" -> new GeneratorExp(build(tree.field(node, "body")), generators(node));
            case "dictionary_comprehension" -> dictComp(node);
            case "list_splat", "list_splat_pattern" -> new Starred(build(tree.firstNamedChild(node)));
            case "parenthesized_expression", "parenthesized_list_splat", "type" -> build(tree.firstNamedChild(node));
            case "as_pattern_target" -> {
                TSNode target = tree.firstNamedChild(node);
                yield target != null ? build(target) : new Name(tree.text(node));
            }
            // annotation-only forms (generic_type, union_type, ...) are kept as written
            default -> new Name(tree.text(node));
        };
    }

    /**
     * Parameter list of a {@code def} ({@code parameters}) or {@code lambda} ({@code lambda_parameters}).
     */
    public Arguments arguments(TSNode parameters) {
        if (parameters == null) {
            return Arguments.EMPTY;
        }
        List<Arguments.Param> posonly = new ArrayList<>();
        List<Arguments.Param> args = new ArrayList<>();
        List<Arguments.Param> kwonly = new ArrayList<>();
        Arguments.Param vararg = null;
        Arguments.Param kwarg = null;
        boolean keywordOnly = false;

        for (TSNode p : tree.namedChildren(parameters)) {
            Arguments.Param param = null;
            switch (p.getType()) {
                case "positional_separator" -> {
                    posonly.addAll(args);
                    args.clear();
                }
                case "keyword_separator" -> keywordOnly = true;
                case "list_splat_pattern" -> {
                    vararg = new Arguments.Param(splatName(p), null, null);
                    keywordOnly = true;
                }
                case "dictionary_splat_pattern" -> kwarg = new Arguments.Param(splatName(p), null, null);
                case "identifier" -> param = new Arguments.Param(tree.text(p), null, null);
                case "default_parameter" -> param = new Arguments.Param(
                        tree.text(tree.field(p, "name")), null, build(tree.field(p, "value")));
                case "typed_default_parameter" -> param = new Arguments.Param(
                        tree.text(tree.field(p, "name")), build(tree.field(p, "type")), build(tree.field(p, "value")));
                case "typed_parameter" -> {
                    TSNode inner = tree.firstNamedChild(p);
                    PyExpr annotation = build(tree.field(p, "type"));
                    if ("list_splat_pattern".equals(inner.getType())) {
                        vararg = new Arguments.Param(splatName(inner), annotation, null);
                        keywordOnly = true;
                    } else if ("dictionary_splat_pattern".equals(inner.getType())) {
                        kwarg = new Arguments.Param(splatName(inner), annotation, null);
                    } else {
                        param = new Arguments.Param(tree.text(inner), annotation, null);
                    }
                }
                default -> throw tree.error(p, "invalid parameter '" + tree.text(p) + "'");
            }
            if (param != null) {
                (keywordOnly ? kwonly : args).add(param);
            }
        }
        return new Arguments(posonly, args, vararg, kwonly, kwarg);
    }

    private String splatName(TSNode splat) {
        return tree.text(tree.firstNamedChild(splat));
    }

    // ---------------------------------------------------------------- compound expressions

    private PyExpr subscript(TSNode node) {
        PyExpr value = build(tree.field(node, "value"));
        List<TSNode> indices = tree.fields(node, "subscript");
        List<TSNode> children = tree.children(node);
        boolean trailingComma = children.size() >= 2 && ",".equals(children.get(children.size() - 2).getType());
        if (indices.size() == 1 && !trailingComma) {
            return new Subscript(value, build(indices.get(0)));
        }
        List<PyExpr> elements = new ArrayList<>(indices.size());
        for (TSNode index : indices) {
            elements.add(build(index));
        }
        return new Subscript(value, new TupleExpr(elements));
    }

    private PyExpr slice(TSNode node) {
        PyExpr[] bounds = new PyExpr[3];
        int part = 0;
        for (TSNode child : tree.children(node)) {
            if (":".equals(child.getType())) {
                part++;
            } else {
                bounds[part] = build(child);
            }
        }
        return new Slice(bounds[0], bounds[1], bounds[2]);
    }

    private PyExpr call(TSNode node) {
        PyExpr function = build(tree.field(node, "function"));
        TSNode arguments = tree.field(node, "arguments");
        if ("generator_expression".equals(arguments.getType())) {
            return new Call(function, List.of(build(arguments)), List.of());
        }
        List<PyExpr> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        for (TSNode argument : tree.namedChildren(arguments)) {
            switch (argument.getType()) {
                case "keyword_argument" -> keywords.add(new Keyword(
                        tree.text(tree.field(argument, "name")), build(tree.field(argument, "value"))));
                case "dictionary_splat" -> keywords.add(new Keyword(null, build(tree.firstNamedChild(argument))));
                default -> args.add(build(argument));
            }
        }
        return new Call(function, args, keywords);
    }

    /**
     * {@code a or b or c} is one operation with three operands; a parenthesized
     * operand stays nested.
     */
    private PyExpr boolOp(TSNode node) {
        String op = tree.text(tree.field(node, "operator"));
        TSNode left = tree.field(node, "left");
        List<PyExpr> values = new ArrayList<>();
        PyExpr lowered = build(left);
        if ("boolean_operator".equals(left.getType()) && lowered instanceof BoolOp inner && inner.op().equals(op)) {
            values.addAll(inner.values());
        } else {
            values.add(lowered);
        }
        values.add(build(tree.field(node, "right")));
        return new BoolOp(op, values);
    }

    private PyExpr compare(TSNode node) {
        PyExpr left = null;
        List<String> ops = new ArrayList<>();
        List<PyExpr> comparators = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (TSNode child : tree.children(node)) {
            if (COMPARISON_TOKENS.contains(child.getType())) {
                if (pending.length() > 0) {
                    pending.append(' ');
                }
                pending.append(child.getType());
            } else if (left == null) {
                left = build(child);
            } else {
                ops.add(pending.toString());
                pending.setLength(0);
                comparators.add(build(child));
            }
        }
        return new Compare(left, ops, comparators);
    }

    private PyExpr conditional(TSNode node) {
        List<TSNode> parts = tree.namedChildren(node);
        return new IfExp(build(parts.get(1)), build(parts.get(0)), build(parts.get(2)));
    }

    private PyExpr lambda(TSNode node) {
        return new Lambda(arguments(tree.field(node, "parameters")), build(tree.field(node, "body")));
    }

    private PyExpr yieldExpression(TSNode node) {
        TSNode value = tree.firstNamedChild(node);
        if (tree.hasChildOfType(node, "from")) {
            return new YieldFrom(build(value));
        }
        return new Yield(value != null ? build(value) : null);
    }

    private List<PyExpr> elements(TSNode node) {
        List<PyExpr> elements = new ArrayList<>();
        for (TSNode child : tree.namedChildren(node)) {
            elements.add(build(child));
        }
        return elements;
    }

    private PyExpr dictionary(TSNode node) {
        List<PyExpr> keys = new ArrayList<>();
        List<PyExpr> values = new ArrayList<>();
        for (TSNode entry : tree.namedChildren(node)) {
            if ("pair".equals(entry.getType())) {
                keys.add(build(tree.field(entry, "key")));
                values.add(build(tree.field(entry, "value")));
            } else {
                keys.add(null);
                values.add(build(tree.firstNamedChild(entry)));
            }
        }
        return new DictExpr(keys, values);
    }

    private PyExpr dictComp(TSNode node) {
        TSNode pair = tree.field(node, "body");
        return new DictComp(build(tree.field(pair, "key")), build(tree.field(pair, "value")), generators(node));
    }

    /**
     * The {@code for} and {@code if} clauses after the body; each {@code if}
     * belongs to the {@code for} before it.
     */
    private List<Comprehension> generators(TSNode node) {
        List<Comprehension> generators = new ArrayList<>();
        TSNode clause = null;
        List<PyExpr> conditions = new ArrayList<>();
        for (TSNode child : tree.namedChildren(node)) {
            if ("for_in_clause".equals(child.getType())) {
                if (clause != null) {
                    generators.add(comprehension(clause, conditions));
                }
                clause = child;
                conditions = new ArrayList<>();
            } else if ("if_clause".equals(child.getType())) {
                conditions.add(build(tree.firstNamedChild(child)));
            }
        }
        if (clause != null) {
            generators.add(comprehension(clause, conditions));
        }
        return generators;
    }

    private Comprehension comprehension(TSNode clause, List<PyExpr> conditions) {
        List<TSNode> iterables = tree.fields(clause, "right");
        PyExpr iter;
        if (iterables.size() == 1) {
            iter = build(iterables.get(0));
        } else {
            List<PyExpr> elements = new ArrayList<>();
            for (TSNode iterable : iterables) {
                elements.add(build(iterable));
            }
            iter = new TupleExpr(elements);
        }
        boolean async = tree.hasChildOfType(clause, "async");
        return new Comprehension(build(tree.field(clause, "left")), iter, conditions, async);
    }

    // ---------------------------------------------------------------- literals

    private PyExpr number(TSNode node) {
        String literal = tree.text(node);
        String text = literal.replace("_", "");
        String lower = text.toLowerCase(Locale.ROOT);
        try {
            if (lower.endsWith("j")) {
                return new Constant(Double.parseDouble(lower.substring(0, lower.length() - 1)), ConstKind.COMPLEX);
            }
            if (lower.startsWith("0x")) {
                return new Constant(new BigInteger(text.substring(2), 16), ConstKind.INT);
            }
            if (lower.startsWith("0o")) {
                return new Constant(new BigInteger(text.substring(2), 8), ConstKind.INT);
            }
            if (lower.startsWith("0b")) {
                return new Constant(new BigInteger(text.substring(2), 2), ConstKind.INT);
            }
            if (lower.contains(".") || lower.contains("e")) {
                return new Constant(Double.parseDouble(text), ConstKind.FLOAT);
            }
            if (lower.endsWith("l") || (lower.length() > 1 && lower.startsWith("0") && !lower.matches("0+"))) {
                throw tree.error(node, "invalid decimal literal '" + literal + "'");
            }
            return new Constant(new BigInteger(text), ConstKind.INT);
        } catch (NumberFormatException e) {
            throw tree.error(node, "invalid numeric literal '" + literal + "'");
        }
    }

    /**
     * Adjacent literals concatenate; any f-string part makes the whole a {@link JoinedStr}.
     */
    private PyExpr strings(List<TSNode> parts) {
        boolean bytes = prefix(parts.get(0)).contains("b");
        boolean formatted = false;
        for (TSNode part : parts) {
            String prefix = prefix(part);
            if (prefix.contains("b") != bytes) {
                throw tree.error(part, "cannot mix bytes and nonbytes literals");
            }
            formatted |= prefix.contains("f");
        }
        if (!formatted) {
            StringBuilder value = new StringBuilder();
            for (TSNode part : parts) {
                value.append(StringLiterals.decode(tree.text(part), tree.origin(), tree.line(part)));
            }
            return new Constant(value.toString(), bytes ? ConstKind.BYTES : ConstKind.STR);
        }
        List<PyExpr> values = new ArrayList<>();
        for (TSNode part : parts) {
            if (prefix(part).contains("f")) {
                formattedPieces(part, values);
            } else {
                values.add(new Constant(
                        StringLiterals.decode(tree.text(part), tree.origin(), tree.line(part)), ConstKind.STR));
            }
        }
        return joined(values);
    }

    private String prefix(TSNode string) {
        String text = tree.text(string);
        int i = 0;
        while (i < text.length() && text.charAt(i) != '\'' && text.charAt(i) != '"') {
            i++;
        }
        return text.substring(0, i).toLowerCase(Locale.ROOT);
    }

    /**
     * Literal text is whatever lies between the quotes and the replacement fields.
     */
    private void formattedPieces(TSNode string, List<PyExpr> values) {
        boolean raw = prefix(string).contains("r");
        List<TSNode> children = tree.children(string);
        int cursor = children.get(0).getEndByte();
        int end = children.get(children.size() - 1).getStartByte();
        for (TSNode child : children) {
            if ("interpolation".equals(child.getType())) {
                literal(cursor, child.getStartByte(), raw, child, values);
                replacementField(child, raw, values);
                cursor = child.getEndByte();
            }
        }
        literal(cursor, end, raw, string, values);
    }

    private void literal(int from, int to, boolean raw, TSNode at, List<PyExpr> values) {
        if (from >= to) {
            return;
        }
        String text = tree.text(from, to).replace("{{", "{").replace("}}", "}");
        values.add(new Constant(StringLiterals.decodeBody(text, raw, tree.origin(), tree.line(at)), ConstKind.STR));
    }

    /**
     * {@code {expr=!c:spec}}. The {@code =} form also emits the expression's
     * source text and defaults the conversion to {@code repr}.
     */
    private void replacementField(TSNode node, boolean raw, List<PyExpr> values) {
        TSNode expression = tree.field(node, "expression");
        if (expression == null) {
            expression = tree.firstNamedChild(node);
        }
        TSNode conversion = tree.childOfType(node, "type_conversion");
        TSNode formatSpec = tree.childOfType(node, "format_specifier");
        List<TSNode> children = tree.children(node);

        if (tree.hasChildOfType(node, "=")) {
            TSNode next = conversion != null ? conversion
                    : formatSpec != null ? formatSpec
                    : children.get(children.size() - 1);
            values.add(new Constant(tree.text(children.get(0).getEndByte(), next.getStartByte()), ConstKind.STR));
        }

        int conversionChar = -1;
        if (conversion != null) {
            conversionChar = tree.text(conversion).charAt(1);
        } else if (tree.hasChildOfType(node, "=") && formatSpec == null) {
            conversionChar = 'r';
        }
        JoinedStr spec = formatSpec != null ? formatSpec(formatSpec, raw) : null;
        values.add(new FormattedValue(build(expression), conversionChar, spec));
    }

    private JoinedStr formatSpec(TSNode node, boolean raw) {
        List<PyExpr> values = new ArrayList<>();
        List<TSNode> children = tree.children(node);
        int cursor = !children.isEmpty() && ":".equals(children.get(0).getType())
                ? children.get(0).getEndByte()
                : node.getStartByte();
        for (TSNode child : children) {
            if ("interpolation".equals(child.getType()) || "format_expression".equals(child.getType())) {
                literal(cursor, child.getStartByte(), raw, child, values);
                replacementField(child, raw, values);
                cursor = child.getEndByte();
            }
        }
        literal(cursor, node.getEndByte(), raw, node, values);
        return joined(values);
    }

    /** Adjacent literal pieces merge and empty ones drop out. */
    private static JoinedStr joined(List<PyExpr> values) {
        List<PyExpr> merged = new ArrayList<>(values.size());
        for (PyExpr value : values) {
            if (value instanceof Constant c && ((String) c.value()).isEmpty()) {
                continue;
            }
            int last = merged.size() - 1;
            if (value instanceof Constant c && last >= 0 && merged.get(last) instanceof Constant previous) {
                merged.set(last, new Constant((String) previous.value() + c.value(), ConstKind.STR));
            } else {
                merged.add(value);
            }
        }
        return new JoinedStr(merged);
    }
}
