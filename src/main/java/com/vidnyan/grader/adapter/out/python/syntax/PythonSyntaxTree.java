package com.vidnyan.grader.adapter.out.python.syntax;

import com.vidnyan.grader.application.port.out.SourceSyntaxException;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * A Python module parsed with the tree-sitter Python grammar.
 * <p>
 * tree-sitter recovers from any input, so parsing here is strict on top of it:
 * error and missing nodes, indentation the interpreter would refuse and
 * Python 2 statement forms all raise {@link SourceSyntaxException}.
 */
public final class PythonSyntaxTree {

    private static final ThreadLocal<TSParser> PARSER = ThreadLocal.withInitial(() -> {
        TSParser parser = new TSParser();
        if (!parser.setLanguage(new TreeSitterPython())) {
            throw new IllegalStateException("Failed to set the Python language on TSParser");
        }
        return parser;
    });

    private static final Set<String> EXTRAS = Set.of("comment", "line_continuation");

    private final String origin;
    private final byte[] source;
    // the native tree must stay reachable while its nodes are in use
    private final TSTree tree;
    private final TSNode root;

    private PythonSyntaxTree(String origin, String source, TSTree tree) {
        this.origin = origin;
        this.source = source.getBytes(StandardCharsets.UTF_8);
        this.tree = tree;
        this.root = tree.getRootNode();
    }

    public static PythonSyntaxTree parse(String source, String origin) {
        TSTree tree = PARSER.get().parseString(null, source);
        PythonSyntaxTree syntax = new PythonSyntaxTree(origin, source, tree);
        syntax.check();
        return syntax;
    }

    public TSNode root() {
        return root;
    }

    public String origin() {
        return origin;
    }

    public String text(TSNode node) {
        return text(node.getStartByte(), node.getEndByte());
    }

    public String text(int startByte, int endByte) {
        return new String(source, startByte, endByte - startByte, StandardCharsets.UTF_8);
    }

    /** One-based line of the node's first character. */
    public int line(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** All children except comments and line continuations. */
    public List<TSNode> children(TSNode node) {
        List<TSNode> children = new ArrayList<>(node.getChildCount());
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!EXTRAS.contains(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    public List<TSNode> namedChildren(TSNode node) {
        List<TSNode> children = new ArrayList<>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!EXTRAS.contains(child.getType())) {
                children.add(child);
            }
        }
        return children;
    }

    public TSNode firstNamedChild(TSNode node) {
        List<TSNode> named = namedChildren(node);
        return named.isEmpty() ? null : named.get(0);
    }

    /** The child under {@code field}, or null. */
    public TSNode field(TSNode node, String field) {
        TSNode child = node.getChildByFieldName(field);
        return child == null || child.isNull() ? null : child;
    }

    /** Every child under {@code field}, for fields that repeat. */
    public List<TSNode> fields(TSNode node, String field) {
        List<TSNode> children = new ArrayList<>();
        for (int i = 0; i < node.getChildCount(); i++) {
            if (field.equals(node.getFieldNameForChild(i))) {
                children.add(node.getChild(i));
            }
        }
        return children;
    }

    public TSNode childOfType(TSNode node, String type) {
        for (TSNode child : children(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public boolean hasChildOfType(TSNode node, String type) {
        return childOfType(node, type) != null;
    }

    public SourceSyntaxException error(TSNode node, String reason) {
        return new SourceSyntaxException(origin, line(node), reason);
    }

    // ---------------------------------------------------------------- checks

    private void check() {
        if (root.hasError()) {
            TSNode broken = firstBroken(root);
            if (broken == null) {
                throw error(root, "invalid syntax");
            }
            if (broken.isMissing()) {
                throw error(broken, "expected '" + broken.getType() + "'");
            }
            throw error(broken, "unexpected '" + snippet(broken) + "'");
        }
        checkNode(root);
    }

    private TSNode firstBroken(TSNode node) {
        if (node.isMissing() || "ERROR".equals(node.getType())) {
            return node;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (child.hasError()) {
                TSNode broken = firstBroken(child);
                if (broken != null) {
                    return broken;
                }
            }
        }
        return null;
    }

    private String snippet(TSNode node) {
        String text = text(node).strip();
        int newline = text.indexOf('\n');
        if (newline >= 0) {
            text = text.substring(0, newline);
        }
        return text.length() > 40 ? text.substring(0, 40) + "..." : text;
    }

    private void checkNode(TSNode node) {
        switch (node.getType()) {
            case "module", "block" -> checkIndentation(node);
            case "print_statement" -> throw error(node, "Missing parentheses in call to 'print'");
            case "exec_statement" -> throw error(node, "Missing parentheses in call to 'exec'");
            case "<>" -> throw error(node, "invalid comparison operator '<>'");
            default -> {
            }
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            checkNode(node.getChild(i));
        }
    }

    /**
     * Statements that begin a line must share one column: zero for the module,
     * the first statement's column for a block.
     */
    private void checkIndentation(TSNode container) {
        int expected = "module".equals(container.getType()) ? 0 : -1;
        for (TSNode statement : namedChildren(container)) {
            if (!beginsLine(statement)) {
                continue;
            }
            int column = statement.getStartPoint().getColumn();
            if (expected < 0) {
                expected = column;
            } else if (column > expected) {
                throw error(statement, "unexpected indent");
            } else if (column < expected) {
                throw error(statement, "unindent does not match any outer indentation level");
            }
        }
    }

    private boolean beginsLine(TSNode node) {
        int start = node.getStartByte();
        int lineStart = start - node.getStartPoint().getColumn();
        for (int i = lineStart; i < start; i++) {
            if (source[i] != ' ' && source[i] != '\t' && source[i] != '\f') {
                return false;
            }
        }
        return true;
    }
}
