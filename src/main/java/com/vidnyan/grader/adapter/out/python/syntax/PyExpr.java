package com.vidnyan.grader.adapter.out.python.syntax;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Raw expression nodes, named and shaped after Python's {@code ast} module.
 */
public sealed interface PyExpr {

    enum ConstKind { INT, FLOAT, COMPLEX, STR, BYTES, BOOL, NONE, ELLIPSIS }

    record Name(String id) implements PyExpr {}

    /**
     * Literal constant. Values: INT {@link BigInteger}, FLOAT {@link Double},
     * COMPLEX {@link Double} (imaginary part), STR and BYTES {@link String}
     * (bytes as latin-1 chars), BOOL {@link Boolean}, NONE and ELLIPSIS null.
     */
    record Constant(Object value, ConstKind kind) implements PyExpr {

        public static final Constant NONE = new Constant(null, ConstKind.NONE);
        public static final Constant TRUE = new Constant(Boolean.TRUE, ConstKind.BOOL);
        public static final Constant FALSE = new Constant(Boolean.FALSE, ConstKind.BOOL);
        public static final Constant ELLIPSIS = new Constant(null, ConstKind.ELLIPSIS);
    }

    /** An f-string: literal {@link Constant} pieces and {@link FormattedValue} replacement fields. */
    record JoinedStr(List<PyExpr> values) implements PyExpr {
        public JoinedStr {
            values = List.copyOf(values);
        }
    }

    /**
     * One {@code {value!c:spec}} field. {@code conversion} is the conversion
     * character ({@code 's'}, {@code 'r'}, {@code 'a'}) or -1; {@code formatSpec} may be null.
     */
    record FormattedValue(PyExpr value, int conversion, JoinedStr formatSpec) implements PyExpr {}

    record Attribute(PyExpr value, String attr) implements PyExpr {}

    record Subscript(PyExpr value, PyExpr slice) implements PyExpr {}

    record Slice(PyExpr lower, PyExpr upper, PyExpr step) implements PyExpr {}

    record Call(PyExpr func, List<PyExpr> args, List<Keyword> keywords) implements PyExpr {
        public Call {
            args = List.copyOf(args);
            keywords = List.copyOf(keywords);
        }
    }

    /** {@code arg=value}, or {@code **value} when {@code arg} is null. */
    record Keyword(String arg, PyExpr value) {}

    record BinOp(PyExpr left, String op, PyExpr right) implements PyExpr {}

    record UnaryOp(String op, PyExpr operand) implements PyExpr {}

    record BoolOp(String op, List<PyExpr> values) implements PyExpr {
        public BoolOp {
            values = List.copyOf(values);
        }
    }

    record Compare(PyExpr left, List<String> ops, List<PyExpr> comparators) implements PyExpr {
        public Compare {
            ops = List.copyOf(ops);
            comparators = List.copyOf(comparators);
        }
    }

    record IfExp(PyExpr test, PyExpr body, PyExpr orelse) implements PyExpr {}

    record Lambda(Arguments args, PyExpr body) implements PyExpr {}

    record TupleExpr(List<PyExpr> elts) implements PyExpr {
        public TupleExpr {
            elts = List.copyOf(elts);
        }
    }

    record ListExpr(List<PyExpr> elts) implements PyExpr {
        public ListExpr {
            elts = List.copyOf(elts);
        }
    }

    record SetExpr(List<PyExpr> elts) implements PyExpr {
        public SetExpr {
            elts = List.copyOf(elts);
        }
    }

    /** A null key marks a {@code **mapping} entry. */
    record DictExpr(List<PyExpr> keys, List<PyExpr> values) implements PyExpr {
        public DictExpr {
            keys = Collections.unmodifiableList(new ArrayList<>(keys));
            values = List.copyOf(values);
        }
    }

    record Comprehension(PyExpr target, PyExpr iter, List<PyExpr> ifs, boolean async) {
        public Comprehension {
            ifs = List.copyOf(ifs);
        }
    }

    record ListComp(PyExpr elt, List<Comprehension> generators) implements PyExpr {}

    record SetComp(PyExpr elt, List<Comprehension> generators) implements PyExpr {}

    record GeneratorExp(PyExpr elt, List<Comprehension> generators) implements PyExpr {}

    record DictComp(PyExpr key, PyExpr value, List<Comprehension> generators) implements PyExpr {}

    record Starred(PyExpr value) implements PyExpr {}

    record NamedExpr(PyExpr target, PyExpr value) implements PyExpr {}

    record Await(PyExpr value) implements PyExpr {}

    /** {@code value} is null for a bare {@code yield}. */
    record Yield(PyExpr value) implements PyExpr {}

    record YieldFrom(PyExpr value) implements PyExpr {}
}
