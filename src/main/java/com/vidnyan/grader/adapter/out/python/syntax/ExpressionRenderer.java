package com.vidnyan.grader.adapter.out.python.syntax;

import com.vidnyan.grader.adapter.out.python.syntax.PyExpr.*;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Renders expressions back to canonical Python source: the text {@code ast.unparse}
 * produces. Parentheses are emitted only where precedence needs them, plus
 * around standalone tuples; strings use {@code repr} quoting.
 */
public final class ExpressionRenderer {

    private static final int NAMED_EXPR = 1;
    private static final int TUPLE = 2;
    private static final int YIELD = 3;
    private static final int TEST = 4;
    private static final int OR = 5;
    private static final int AND = 6;
    private static final int NOT = 7;
    private static final int CMP = 8;
    private static final int EXPR = 9;
    private static final int BOR = EXPR;
    private static final int BXOR = 10;
    private static final int BAND = 11;
    private static final int SHIFT = 12;
    private static final int ARITH = 13;
    private static final int TERM = 14;
    private static final int FACTOR = 15;
    private static final int POWER = 16;
    private static final int AWAIT = 17;
    private static final int ATOM = 18;

    private static final Map<String, Integer> BINOP_PRECEDENCE = Map.ofEntries(
            Map.entry("+", ARITH), Map.entry("-", ARITH),
            Map.entry("*", TERM), Map.entry("@", TERM), Map.entry("/", TERM),
            Map.entry("%", TERM), Map.entry("//", TERM),
            Map.entry("<<", SHIFT), Map.entry(">>", SHIFT),
            Map.entry("|", BOR), Map.entry("^", BXOR), Map.entry("&", BAND),
            Map.entry("**", POWER));

    private static final String INFINITY = "1e309";

    private static final List<String> ALL_QUOTES = List.of("'", "\"", "\"\"\"", "'''");

    private final StringBuilder out = new StringBuilder();

    private ExpressionRenderer() {
    }

    public static String render(PyExpr expr) {
        ExpressionRenderer renderer = new ExpressionRenderer();
        renderer.visit(expr, TEST);
        return renderer.out.toString();
    }

    private void visit(PyExpr e, int precedence) {
        if (e instanceof Name n) {
            out.append(n.id());
        } else if (e instanceof Constant c) {
            constant(c);
        } else if (e instanceof JoinedStr j) {
            joinedStr(j);
        } else if (e instanceof FormattedValue f) {
            formattedValue(f);
        } else if (e instanceof Attribute a) {
            visit(a.value(), ATOM);
            if (a.value() instanceof Constant c && c.kind() == ConstKind.INT) {
                out.append(' ');
            }
            out.append('.').append(a.attr());
        } else if (e instanceof Subscript s) {
            subscript(s);
        } else if (e instanceof Slice s) {
            if (s.lower() != null) {
                visit(s.lower(), TEST);
            }
            out.append(':');
            if (s.upper() != null) {
                visit(s.upper(), TEST);
            }
            if (s.step() != null) {
                out.append(':');
                visit(s.step(), TEST);
            }
        } else if (e instanceof Call c) {
            call(c);
        } else if (e instanceof BinOp b) {
            binOp(b, precedence);
        } else if (e instanceof UnaryOp u) {
            unaryOp(u, precedence);
        } else if (e instanceof BoolOp b) {
            boolOp(b, precedence);
        } else if (e instanceof Compare c) {
            compare(c, precedence);
        } else if (e instanceof IfExp i) {
            open(precedence > TEST);
            visit(i.body(), OR);
            out.append(" if ");
            visit(i.test(), OR);
            out.append(" else ");
            visit(i.orelse(), TEST);
            close(precedence > TEST);
        } else if (e instanceof Lambda l) {
            open(precedence > TEST);
            out.append("lambda");
            if (!l.args().isEmpty()) {
                out.append(' ');
                arguments(l.args());
            }
            out.append(": ");
            visit(l.body(), TEST);
            close(precedence > TEST);
        } else if (e instanceof TupleExpr t) {
            boolean parens = t.elts().isEmpty() || precedence > TUPLE;
            open(parens);
            items(t.elts());
            close(parens);
        } else if (e instanceof ListExpr l) {
            out.append('[');
            commaSeparated(l.elts());
            out.append(']');
        } else if (e instanceof SetExpr s) {
            if (s.elts().isEmpty()) {
                out.append("{*()}");
            } else {
                out.append('{');
                commaSeparated(s.elts());
                out.append('}');
            }
        } else if (e instanceof DictExpr d) {
            out.append('{');
            for (int i = 0; i < d.keys().size(); i++) {
                if (i > 0) {
                    out.append(", ");
                }
                keyValue(d.keys().get(i), d.values().get(i));
            }
            out.append('}');
        } else if (e instanceof ListComp c) {
            out.append('[');
            visit(c.elt(), TEST);
            generators(c.generators());
            out.append(']');
        } else if (e instanceof SetComp c) {
            out.append('{');
            visit(c.elt(), TEST);
            generators(c.generators());
            out.append('}');
        } else if (e instanceof GeneratorExp g) {
            out.append('(');
            visit(g.elt(), TEST);
            generators(g.generators());
            out.append(')');
        } else if (e instanceof DictComp d) {
            out.append('{');
            visit(d.key(), TEST);
            out.append(": ");
            visit(d.value(), TEST);
            generators(d.generators());
            out.append('}');
        } else if (e instanceof Starred s) {
            out.append('*');
            visit(s.value(), EXPR);
        } else if (e instanceof NamedExpr n) {
            open(precedence > NAMED_EXPR);
            visit(n.target(), ATOM);
            out.append(" := ");
            visit(n.value(), ATOM);
            close(precedence > NAMED_EXPR);
        } else if (e instanceof Await a) {
            open(precedence > AWAIT);
            out.append("await");
            if (a.value() != null) {
                out.append(' ');
                visit(a.value(), ATOM);
            }
            close(precedence > AWAIT);
        } else if (e instanceof Yield y) {
            open(precedence > YIELD);
            out.append("yield");
            if (y.value() != null) {
                out.append(' ');
                visit(y.value(), TEST);
            }
            close(precedence > YIELD);
        } else if (e instanceof YieldFrom y) {
            open(precedence > YIELD);
            out.append("yield from ");
            visit(y.value(), TEST);
            close(precedence > YIELD);
        } else {
            throw new IllegalArgumentException("Unknown expression node: " + e);
        }
    }

    private void subscript(Subscript s) {
        visit(s.value(), ATOM);
        out.append('[');
        if (s.slice() instanceof TupleExpr t && !t.elts().isEmpty()) {
            items(t.elts());
        } else {
            visit(s.slice(), TEST);
        }
        out.append(']');
    }

    private void call(Call c) {
        visit(c.func(), ATOM);
        out.append('(');
        boolean comma = false;
        for (PyExpr arg : c.args()) {
            if (comma) {
                out.append(", ");
            }
            comma = true;
            visit(arg, TEST);
        }
        for (Keyword k : c.keywords()) {
            if (comma) {
                out.append(", ");
            }
            comma = true;
            keyword(k);
        }
        out.append(')');
    }

    private void keyword(Keyword k) {
        if (k.arg() == null) {
            out.append("**");
        } else {
            out.append(k.arg()).append('=');
        }
        visit(k.value(), TEST);
    }

    private void binOp(BinOp b, int precedence) {
        int op = BINOP_PRECEDENCE.get(b.op());
        boolean rightAssociative = b.op().equals("**");
        open(precedence > op);
        visit(b.left(), rightAssociative ? op + 1 : op);
        out.append(' ').append(b.op()).append(' ');
        visit(b.right(), rightAssociative ? op : op + 1);
        close(precedence > op);
    }

    private void unaryOp(UnaryOp u, int precedence) {
        int op = u.op().equals("not") ? NOT : FACTOR;
        open(precedence > op);
        out.append(u.op());
        if (op != FACTOR) {
            out.append(' ');
        }
        visit(u.operand(), op);
        close(precedence > op);
    }

    /**
     * Each further operand gets one level tighter, as {@code ast.unparse} does.
     */
    private void boolOp(BoolOp b, int precedence) {
        int op = b.op().equals("and") ? AND : OR;
        open(precedence > op);
        int level = op;
        for (int i = 0; i < b.values().size(); i++) {
            if (i > 0) {
                out.append(' ').append(b.op()).append(' ');
            }
            level++;
            visit(b.values().get(i), level);
        }
        close(precedence > op);
    }

    private void compare(Compare c, int precedence) {
        open(precedence > CMP);
        visit(c.left(), CMP + 1);
        for (int i = 0; i < c.ops().size(); i++) {
            out.append(' ').append(c.ops().get(i)).append(' ');
            visit(c.comparators().get(i), CMP + 1);
        }
        close(precedence > CMP);
    }

    private void keyValue(PyExpr key, PyExpr value) {
        if (key == null) {
            out.append("**");
            visit(value, EXPR);
        } else {
            visit(key, TEST);
            out.append(": ");
            visit(value, TEST);
        }
    }

    private void generators(List<Comprehension> generators) {
        for (Comprehension g : generators) {
            out.append(g.async() ? " async for " : " for ");
            visit(g.target(), TUPLE);
            out.append(" in ");
            visit(g.iter(), TEST + 1);
            for (PyExpr condition : g.ifs()) {
                out.append(" if ");
                visit(condition, TEST + 1);
            }
        }
    }

    private void arguments(Arguments args) {
        boolean first = true;
        List<Arguments.Param> positional = new ArrayList<>(args.posonlyargs());
        positional.addAll(args.args());
        for (int i = 0; i < positional.size(); i++) {
            first = separator(first);
            param(positional.get(i));
            if (i == args.posonlyargs().size() - 1) {
                out.append(", /");
            }
        }
        if (args.vararg() != null || !args.kwonlyargs().isEmpty()) {
            first = separator(first);
            out.append('*');
            if (args.vararg() != null) {
                param(args.vararg());
            }
        }
        for (Arguments.Param p : args.kwonlyargs()) {
            first = separator(first);
            param(p);
        }
        if (args.kwarg() != null) {
            separator(first);
            out.append("**");
            param(args.kwarg());
        }
    }

    private boolean separator(boolean first) {
        if (!first) {
            out.append(", ");
        }
        return false;
    }

    private void param(Arguments.Param p) {
        out.append(p.name());
        if (p.annotation() != null) {
            out.append(": ");
            visit(p.annotation(), TEST);
        }
        if (p.defaultValue() != null) {
            out.append(p.annotation() != null ? " = " : "=");
            visit(p.defaultValue(), TEST);
        }
    }

    private void items(List<PyExpr> elts) {
        if (elts.size() == 1) {
            visit(elts.get(0), TEST);
            out.append(',');
        } else {
            commaSeparated(elts);
        }
    }

    private void commaSeparated(List<PyExpr> elts) {
        for (int i = 0; i < elts.size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            visit(elts.get(i), TEST);
        }
    }

    private void open(boolean parens) {
        if (parens) {
            out.append('(');
        }
    }

    private void close(boolean parens) {
        if (parens) {
            out.append(')');
        }
    }

    // ---------------------------------------------------------------- f-strings

    /**
     * Picks the first quote type that no literal piece needs escaped; when none
     * fits, literal pieces fall back to {@code repr} inside triple single quotes.
     */
    private void joinedStr(JoinedStr j) {
        List<String> parts = new ArrayList<>(j.values().size());
        for (PyExpr value : j.values()) {
            ExpressionRenderer inner = new ExpressionRenderer();
            inner.fstringInner(value, false);
            parts.add(inner.out.toString());
        }

        List<String> quoteTypes = new ArrayList<>(ALL_QUOTES);
        List<String> rendered = new ArrayList<>(parts.size());
        boolean fallbackToRepr = false;
        for (int i = 0; i < parts.size(); i++) {
            String part = parts.get(i);
            if (j.values().get(i) instanceof Constant) {
                List<String> fitting = new ArrayList<>();
                part = fstringLiteral(part, quoteTypes, fitting);
                if (Collections.disjoint(fitting, quoteTypes)) {
                    fallbackToRepr = true;
                    break;
                }
                quoteTypes = fitting;
            } else if (part.indexOf('\n') >= 0) {
                quoteTypes.removeIf(q -> q.length() != 3);
            }
            rendered.add(part);
        }

        if (fallbackToRepr) {
            quoteTypes = List.of("'''");
            rendered.clear();
            for (int i = 0; i < parts.size(); i++) {
                String part = parts.get(i);
                if (j.values().get(i) instanceof Constant) {
                    // a leading double quote forces single-quoted repr
                    String repr = stringRepr("\"" + part, false);
                    part = repr.substring(2, repr.length() - 1);
                }
                rendered.add(part);
            }
        }

        String quote = quoteTypes.get(0);
        out.append('f').append(quote);
        rendered.forEach(out::append);
        out.append(quote);
    }

    private void fstringInner(PyExpr e, boolean formatSpec) {
        if (e instanceof JoinedStr j) {
            for (PyExpr value : j.values()) {
                fstringInner(value, formatSpec);
            }
        } else if (e instanceof Constant c && c.kind() == ConstKind.STR) {
            String value = ((String) c.value()).replace("{", "{{").replace("}", "}}");
            if (formatSpec) {
                value = value.replace("\\", "\\\\")
                        .replace("'", "\\'")
                        .replace("\"", "\\\"")
                        .replace("\n", "\\n");
            }
            out.append(value);
        } else if (e instanceof FormattedValue f) {
            formattedValue(f);
        } else {
            throw new IllegalArgumentException("Unexpected node inside f-string: " + e);
        }
    }

    private void formattedValue(FormattedValue f) {
        ExpressionRenderer inner = new ExpressionRenderer();
        inner.visit(f.value(), TEST + 1);
        String expr = inner.out.toString();
        out.append('{');
        if (expr.startsWith("{")) {
            out.append(' ');
        }
        out.append(expr);
        if (f.conversion() != -1) {
            out.append('!').append((char) f.conversion());
        }
        if (f.formatSpec() != null) {
            out.append(':');
            fstringInner(f.formatSpec(), true);
        }
        out.append('}');
    }

    /**
     * Escapes one literal piece and narrows {@code quoteTypes} to those it can sit
     * between, written to {@code fitting} in order of preference.
     */
    private static String fstringLiteral(String piece, List<String> quoteTypes, List<String> fitting) {
        StringBuilder sb = new StringBuilder(piece.length());
        int i = 0;
        while (i < piece.length()) {
            int cp = piece.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == '\\' || !isPrintable(cp)) {
                sb.append(unicodeEscape(cp));
            } else {
                sb.appendCodePoint(cp);
            }
        }
        String escaped = sb.toString();

        List<String> possible = new ArrayList<>(quoteTypes);
        possible.removeIf(escaped::contains);
        if (possible.isEmpty()) {
            String repr = stringRepr(piece, false);
            char reprQuote = repr.charAt(0);
            fitting.add(quoteTypes.stream()
                    .filter(q -> q.indexOf(reprQuote) >= 0)
                    .findFirst()
                    .orElse(String.valueOf(reprQuote)));
            return repr.substring(1, repr.length() - 1);
        }
        if (!escaped.isEmpty()) {
            char last = escaped.charAt(escaped.length() - 1);
            possible.sort(Comparator.comparing(q -> q.charAt(0) == last));
            if (possible.get(0).charAt(0) == last) {
                escaped = escaped.substring(0, escaped.length() - 1) + "\\" + last;
            }
        }
        fitting.addAll(possible);
        return escaped;
    }

    private static String unicodeEscape(int cp) {
        switch (cp) {
            case '\\':
                return "\\\\";
            case '\t':
                return "\\t";
            case '\n':
                return "\\n";
            case '\r':
                return "\\r";
            default:
                if (cp <= 0xff) {
                    return String.format("\\x%02x", cp);
                }
                return cp <= 0xffff ? String.format("\\u%04x", cp) : String.format("\\U%08x", cp);
        }
    }

    // ---------------------------------------------------------------- constants

    private void constant(Constant c) {
        switch (c.kind()) {
            case NONE -> out.append("None");
            case ELLIPSIS -> out.append("...");
            case BOOL -> out.append((Boolean) c.value() ? "True" : "False");
            case INT -> out.append(c.value().toString());
            case FLOAT -> out.append(floatRepr((Double) c.value()));
            case COMPLEX -> out.append(complexRepr((Double) c.value()));
            case STR -> out.append(stringRepr((String) c.value(), false));
            case BYTES -> out.append('b').append(stringRepr((String) c.value(), true));
        }
    }

    /**
     * Python's {@code repr(float)}: shortest round-trip digits, scientific
     * notation below 1e-4 and from 1e16 on.
     */
    static String floatRepr(double value) {
        if (Double.isNaN(value)) {
            return "(" + INFINITY + "-" + INFINITY + ")";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        if (value == 0.0) {
            return 1 / value < 0 ? "-0.0" : "0.0";
        }
        String sign = value < 0 ? "-" : "";
        BigDecimal decimal = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        String digits = decimal.unscaledValue().toString();
        int exponent = digits.length() - 1 - decimal.scale();
        if (exponent >= -4 && exponent < 16) {
            String plain = decimal.toPlainString();
            return sign + (plain.contains(".") ? plain : plain + ".0");
        }
        String mantissa = digits.length() > 1 ? digits.charAt(0) + "." + digits.substring(1) : digits;
        String exp = String.format("%02d", Math.abs(exponent));
        return sign + mantissa + "e" + (exponent < 0 ? "-" : "+") + exp;
    }

    static String complexRepr(double imaginary) {
        String repr = floatRepr(imaginary);
        if (repr.endsWith(".0")) {
            repr = repr.substring(0, repr.length() - 2);
        }
        return repr + "j";
    }

    /**
     * Python's {@code repr(str)} (or of bytes, given as latin-1 chars, without the {@code b}).
     */
    static String stringRepr(String value, boolean bytes) {
        char quote = value.indexOf('\'') >= 0 && value.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(value.length() + 2).append(quote);
        int i = 0;
        while (i < value.length()) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            if (cp == quote || cp == '\\') {
                sb.append('\\').appendCodePoint(cp);
            } else if (cp == '\n') {
                sb.append("\\n");
            } else if (cp == '\r') {
                sb.append("\\r");
            } else if (cp == '\t') {
                sb.append("\\t");
            } else if (bytes ? cp < 0x20 || cp >= 0x7f : !isPrintable(cp)) {
                if (cp <= 0xff) {
                    sb.append(String.format("\\x%02x", cp));
                } else if (cp <= 0xffff) {
                    sb.append(String.format("\\u%04x", cp));
                } else {
                    sb.append(String.format("\\U%08x", cp));
                }
            } else {
                sb.appendCodePoint(cp);
            }
        }
        return sb.append(quote).toString();
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL:
            case Character.FORMAT:
            case Character.SURROGATE:
            case Character.PRIVATE_USE:
            case Character.UNASSIGNED:
            case Character.LINE_SEPARATOR:
            case Character.PARAGRAPH_SEPARATOR:
            case Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }
}
