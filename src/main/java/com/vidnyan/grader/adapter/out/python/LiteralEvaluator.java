package com.vidnyan.grader.adapter.out.python;

import com.vidnyan.grader.adapter.out.python.syntax.PyExpr;
import com.vidnyan.grader.adapter.out.python.syntax.PyExpr.*;
import com.vidnyan.grader.domain.variable.PyNone;
import com.vidnyan.grader.domain.variable.VariableTable;
import com.vidnyan.grader.domain.variable.VariableValue;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.vidnyan.grader.domain.variable.PythonValues.*;

/**
 * Allow-listed evaluator for assignment right-hand sides. Knows constants,
 * container displays, arithmetic, comparisons, boolean logic, conditional
 * expressions and subscripts; everything else, and any runtime error, yields
 * {@link VariableValue.Unresolvable}. Never throws and always terminates.
 * <p>
 * Value mapping: int {@link Long}, float {@link Double}, str {@link String},
 * bool {@link Boolean}, None {@link PyNone#NONE}, list {@link ArrayList},
 * tuple unmodifiable {@link List}, dict {@link LinkedHashMap}, set {@link LinkedHashSet}.
 */
final class LiteralEvaluator {

    static final int MAX_EXPONENT = 64;
    static final int MAX_SEQUENCE_LENGTH = 10_000;

    private final VariableTable environment;

    private LiteralEvaluator(VariableTable environment) {
        this.environment = environment;
    }

    /**
     * Literal-only evaluation: no names are visible.
     */
    static VariableValue literal(PyExpr expr) {
        return evaluate(expr, null);
    }

    /**
     * Evaluates with the bindings of {@code environment} as the only visible names.
     */
    static VariableValue evaluate(PyExpr expr, VariableTable environment) {
        try {
            return VariableValue.of(new LiteralEvaluator(environment).eval(expr));
        } catch (NotEvaluable | ArithmeticException e) {
            return VariableValue.unresolvable();
        }
    }

    /** Internal signal for a construct or operation outside the allow-list. */
    private static final class NotEvaluable extends RuntimeException {
        NotEvaluable() {
            super(null, null, false, false);
        }
    }

    private static NotEvaluable notEvaluable() {
        return new NotEvaluable();
    }

    private Object eval(PyExpr e) {
        if (e instanceof Constant c) {
            return constant(c);
        }
        if (e instanceof Name n) {
            if (environment == null) {
                throw notEvaluable();
            }
            return environment.get(n.id())
                    .flatMap(VariableValue::value)
                    .orElseThrow(LiteralEvaluator::notEvaluable);
        }
        if (e instanceof TupleExpr t) {
            return Collections.unmodifiableList(elements(t.elts()));
        }
        if (e instanceof ListExpr l) {
            return elements(l.elts());
        }
        if (e instanceof SetExpr s) {
            Set<Object> set = new LinkedHashSet<>();
            for (Object item : elements(s.elts())) {
                set.add(hashable(item));
            }
            return set;
        }
        if (e instanceof DictExpr d) {
            return dict(d);
        }
        if (e instanceof UnaryOp u) {
            return unary(u.op(), eval(u.operand()));
        }
        if (e instanceof BinOp b) {
            return binary(b.op(), eval(b.left()), eval(b.right()));
        }
        if (e instanceof BoolOp b) {
            Object result = null;
            for (PyExpr operand : b.values()) {
                result = eval(operand);
                boolean truth = truthy(result);
                if (b.op().equals("and") ? !truth : truth) {
                    return result;
                }
            }
            return result;
        }
        if (e instanceof Compare c) {
            Object left = eval(c.left());
            for (int i = 0; i < c.ops().size(); i++) {
                Object right = eval(c.comparators().get(i));
                if (!compare(c.ops().get(i), left, right)) {
                    return Boolean.FALSE;
                }
                left = right;
            }
            return Boolean.TRUE;
        }
        if (e instanceof IfExp i) {
            return truthy(eval(i.test())) ? eval(i.body()) : eval(i.orelse());
        }
        if (e instanceof Subscript s) {
            return subscript(eval(s.value()), s.slice());
        }
        throw notEvaluable();
    }

    private static Object constant(Constant c) {
        switch (c.kind()) {
            case INT:
                BigInteger value = (BigInteger) c.value();
                if (value.bitLength() >= 64) {
                    throw notEvaluable();
                }
                return value.longValue();
            case FLOAT:
            case STR:
            case BOOL:
                return c.value();
            case NONE:
                return PyNone.NONE;
            default:
                throw notEvaluable();
        }
    }

    private List<Object> elements(List<PyExpr> exprs) {
        List<Object> out = new ArrayList<>(exprs.size());
        for (PyExpr expr : exprs) {
            if (expr instanceof Starred starred) {
                out.addAll(iterate(eval(starred.value())));
            } else {
                out.add(eval(expr));
            }
            if (out.size() > MAX_SEQUENCE_LENGTH) {
                throw notEvaluable();
            }
        }
        return out;
    }

    private Map<Object, Object> dict(DictExpr d) {
        Map<Object, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < d.keys().size(); i++) {
            PyExpr key = d.keys().get(i);
            Object value = eval(d.values().get(i));
            if (key == null) {
                if (!(value instanceof Map<?, ?> unpacked)) {
                    throw notEvaluable();
                }
                unpacked.forEach((k, v) -> put(map, k, v));
            } else {
                put(map, hashable(eval(key)), value);
            }
        }
        return map;
    }

    /**
     * Dict insert where {@code 1}, {@code 1.0} and {@code True} are the same key.
     */
    private static void put(Map<Object, Object> map, Object key, Object value) {
        for (Map.Entry<Object, Object> entry : map.entrySet()) {
            if (pyEquals(entry.getKey(), key)) {
                entry.setValue(value);
                return;
            }
        }
        map.put(key, value);
    }

    private static Object hashable(Object value) {
        if (value instanceof ArrayList<?> || value instanceof Map<?, ?> || value instanceof Set<?>) {
            throw notEvaluable();
        }
        return value;
    }

    private static List<Object> iterate(Object value) {
        if (value instanceof String s) {
            List<Object> chars = new ArrayList<>();
            s.codePoints().forEach(cp -> chars.add(new String(Character.toChars(cp))));
            return chars;
        }
        if (value instanceof Collection<?> c) {
            return new ArrayList<>(c);
        }
        if (value instanceof Map<?, ?> m) {
            return new ArrayList<>(m.keySet());
        }
        throw notEvaluable();
    }

    // ---------------------------------------------------------------- operators

    private static Object unary(String op, Object operand) {
        switch (op) {
            case "not":
                return !truthy(operand);
            case "-":
                if (isIntegral(operand)) {
                    return Math.negateExact(toLong(operand));
                }
                return -toDouble(number(operand));
            case "+":
                return isIntegral(operand) ? (Object) toLong(operand) : (Object) toDouble(number(operand));
            case "~":
                return ~toLong(integral(operand));
            default:
                throw notEvaluable();
        }
    }

    private static Object binary(String op, Object left, Object right) {
        switch (op) {
            case "+":
                return add(left, right);
            case "*":
                return multiply(left, right);
            case "-":
                if (isIntegral(left) && isIntegral(right)) {
                    return Math.subtractExact(toLong(left), toLong(right));
                }
                return toDouble(number(left)) - toDouble(number(right));
            case "/": {
                double divisor = toDouble(number(right));
                if (divisor == 0.0) {
                    throw notEvaluable();
                }
                return toDouble(number(left)) / divisor;
            }
            case "//":
                if (isIntegral(left) && isIntegral(right)) {
                    if (toLong(right) == 0) {
                        throw notEvaluable();
                    }
                    if (toLong(left) == Long.MIN_VALUE && toLong(right) == -1) {
                        throw notEvaluable();
                    }
                    return Math.floorDiv(toLong(left), toLong(right));
                }
                return Math.floor(toDouble(number(left)) / nonZero(toDouble(number(right))));
            case "%":
                if (left instanceof String) {
                    throw notEvaluable();
                }
                if (isIntegral(left) && isIntegral(right)) {
                    if (toLong(right) == 0) {
                        throw notEvaluable();
                    }
                    return Math.floorMod(toLong(left), toLong(right));
                }
                return floatMod(toDouble(number(left)), nonZero(toDouble(number(right))));
            case "**":
                return power(number(left), number(right));
            case "<<":
            case ">>":
                return shift(op, toLong(integral(left)), toLong(integral(right)));
            case "&":
            case "|":
            case "^":
                return bitwise(op, integral(left), integral(right));
            default:
                throw notEvaluable();
        }
    }

    private static Object add(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Math.addExact(toLong(left), toLong(right));
        }
        if (isNumeric(left) && isNumeric(right)) {
            return toDouble(left) + toDouble(right);
        }
        if (left instanceof String a && right instanceof String b) {
            return bounded(a + b);
        }
        if (left instanceof List<?> a && right instanceof List<?> b && isTuple(a) == isTuple(b)) {
            List<Object> joined = new ArrayList<>(a);
            joined.addAll(b);
            bounded(joined);
            return isTuple(a) ? Collections.unmodifiableList(joined) : joined;
        }
        throw notEvaluable();
    }

    private static Object multiply(Object left, Object right) {
        if (isIntegral(left) && isIntegral(right)) {
            return Math.multiplyExact(toLong(left), toLong(right));
        }
        if (isNumeric(left) && isNumeric(right)) {
            return toDouble(left) * toDouble(right);
        }
        if (isIntegral(right) && (left instanceof String || left instanceof List<?>)) {
            return repeat(left, toLong(right));
        }
        if (isIntegral(left) && (right instanceof String || right instanceof List<?>)) {
            return repeat(right, toLong(left));
        }
        throw notEvaluable();
    }

    private static Object repeat(Object sequence, long times) {
        long count = Math.max(0, times);
        if (sequence instanceof String s) {
            if (s.length() * count > MAX_SEQUENCE_LENGTH) {
                throw notEvaluable();
            }
            return s.repeat((int) count);
        }
        List<?> list = (List<?>) sequence;
        if (list.size() * count > MAX_SEQUENCE_LENGTH) {
            throw notEvaluable();
        }
        List<Object> repeated = new ArrayList<>();
        for (long i = 0; i < count; i++) {
            repeated.addAll(list);
        }
        return isTuple(list) ? Collections.unmodifiableList(repeated) : repeated;
    }

    private static Object power(Object base, Object exponent) {
        if (isIntegral(base) && isIntegral(exponent)) {
            long b = toLong(base);
            long e = toLong(exponent);
            if (e < 0) {
                if (b == 0) {
                    throw notEvaluable();
                }
                return Math.pow(b, e);
            }
            if (e > MAX_EXPONENT) {
                throw notEvaluable();
            }
            long result = 1;
            for (long i = 0; i < e; i++) {
                result = Math.multiplyExact(result, b);
            }
            return result;
        }
        double b = toDouble(base);
        double e = toDouble(exponent);
        if (Math.abs(e) > MAX_EXPONENT || b == 0.0 && e < 0 || b < 0 && e != Math.rint(e)) {
            throw notEvaluable();
        }
        double result = Math.pow(b, e);
        if (Double.isInfinite(result)) {
            throw notEvaluable();
        }
        return result;
    }

    private static Object shift(String op, long value, long amount) {
        if (amount < 0) {
            throw notEvaluable();
        }
        if (op.equals(">>")) {
            return amount >= 64 ? (value < 0 ? -1L : 0L) : value >> amount;
        }
        if (amount > MAX_EXPONENT) {
            throw notEvaluable();
        }
        BigInteger shifted = BigInteger.valueOf(value).shiftLeft((int) amount);
        if (shifted.bitLength() >= 64) {
            throw notEvaluable();
        }
        return shifted.longValue();
    }

    private static Object bitwise(String op, Object left, Object right) {
        if (left instanceof Boolean a && right instanceof Boolean b) {
            switch (op) {
                case "&":
                    return a & b;
                case "|":
                    return a | b;
                default:
                    return a ^ b;
            }
        }
        long a = toLong(left);
        long b = toLong(right);
        switch (op) {
            case "&":
                return a & b;
            case "|":
                return a | b;
            default:
                return a ^ b;
        }
    }

    private static double floatMod(double a, double b) {
        double r = a % b;
        if (r != 0 && (r < 0) != (b < 0)) {
            r += b;
        }
        return r;
    }

    private static double nonZero(double divisor) {
        if (divisor == 0.0) {
            throw notEvaluable();
        }
        return divisor;
    }

    // ---------------------------------------------------------------- comparisons

    private static boolean compare(String op, Object left, Object right) {
        switch (op) {
            case "==":
                return pyEquals(left, right);
            case "!=":
                return !pyEquals(left, right);
            case "<":
                return order(left, right) < 0;
            case "<=":
                return order(left, right) <= 0;
            case ">":
                return order(left, right) > 0;
            case ">=":
                return order(left, right) >= 0;
            case "in":
                return contains(right, left);
            case "not in":
                return !contains(right, left);
            case "is":
                return identical(left, right);
            case "is not":
                return !identical(left, right);
            default:
                throw notEvaluable();
        }
    }

    private static int order(Object left, Object right) {
        if (isNumeric(left) && isNumeric(right)) {
            if (isIntegral(left) && isIntegral(right)) {
                return Long.compare(toLong(left), toLong(right));
            }
            return Double.compare(toDouble(left), toDouble(right));
        }
        if (left instanceof String a && right instanceof String b) {
            return Integer.signum(a.compareTo(b));
        }
        if (left instanceof List<?> a && right instanceof List<?> b && isTuple(a) == isTuple(b)) {
            for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
                if (!pyEquals(a.get(i), b.get(i))) {
                    return order(a.get(i), b.get(i));
                }
            }
            return Integer.compare(a.size(), b.size());
        }
        throw notEvaluable();
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof String s) {
            if (!(item instanceof String needle)) {
                throw notEvaluable();
            }
            return s.contains(needle);
        }
        if (container instanceof Collection<?> c) {
            return c.stream().anyMatch(x -> pyEquals(x, item));
        }
        if (container instanceof Map<?, ?> m) {
            return m.keySet().stream().anyMatch(x -> pyEquals(x, item));
        }
        throw notEvaluable();
    }

    private static boolean identical(Object left, Object right) {
        if (isNone(left) || isNone(right)) {
            return isNone(left) && isNone(right);
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return left.equals(right);
        }
        return left == right;
    }

    // ---------------------------------------------------------------- subscripts

    private Object subscript(Object container, PyExpr slice) {
        if (slice instanceof Slice s) {
            return sliceOf(container, s);
        }
        Object index = eval(slice);
        if (container instanceof Map<?, ?> m) {
            for (Map.Entry<?, ?> entry : m.entrySet()) {
                if (pyEquals(entry.getKey(), index)) {
                    return entry.getValue();
                }
            }
            throw notEvaluable();
        }
        if (!isIntegral(index)) {
            throw notEvaluable();
        }
        long i = toLong(index);
        if (container instanceof String s) {
            int length = s.length();
            int at = (int) normalizeIndex(i, length);
            return String.valueOf(s.charAt(at));
        }
        if (container instanceof List<?> list) {
            return list.get((int) normalizeIndex(i, list.size()));
        }
        throw notEvaluable();
    }

    private static long normalizeIndex(long index, int length) {
        long at = index < 0 ? index + length : index;
        if (at < 0 || at >= length) {
            throw notEvaluable();
        }
        return at;
    }

    private Object sliceOf(Object container, Slice s) {
        int length;
        if (container instanceof String str) {
            length = str.length();
        } else if (container instanceof List<?> list) {
            length = list.size();
        } else {
            throw notEvaluable();
        }
        long step = bound(s.step(), 1);
        if (step == 0) {
            throw notEvaluable();
        }
        long start = step > 0 ? clampBound(s.lower(), 0, length, false) : clampBound(s.lower(), length - 1, length, true);
        long stop = step > 0 ? clampBound(s.upper(), length, length, false) : clampBound(s.upper(), -1, length, true);

        List<Integer> indexes = new ArrayList<>();
        for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
            indexes.add((int) i);
        }
        if (container instanceof String str) {
            StringBuilder sb = new StringBuilder();
            indexes.forEach(i -> sb.append(str.charAt(i)));
            return sb.toString();
        }
        List<?> list = (List<?>) container;
        List<Object> out = new ArrayList<>();
        indexes.forEach(i -> out.add(list.get(i)));
        return isTuple(list) ? Collections.unmodifiableList(out) : out;
    }

    private long bound(PyExpr expr, long fallback) {
        if (expr == null) {
            return fallback;
        }
        Object value = eval(expr);
        if (isNone(value)) {
            return fallback;
        }
        if (!isIntegral(value)) {
            throw notEvaluable();
        }
        return toLong(value);
    }

    /**
     * Slice bound adjustment as in {@code PySlice_AdjustIndices}.
     */
    private long clampBound(PyExpr expr, long fallback, int length, boolean negativeStep) {
        if (expr == null) {
            return fallback;
        }
        Object value = eval(expr);
        if (isNone(value)) {
            return fallback;
        }
        if (!isIntegral(value)) {
            throw notEvaluable();
        }
        long at = toLong(value);
        if (at < 0) {
            at += length;
            if (at < 0) {
                at = negativeStep ? -1 : 0;
            }
        } else if (at >= length) {
            at = negativeStep ? length - 1 : length;
        }
        return at;
    }

    // ---------------------------------------------------------------- helpers

    private static boolean isTuple(List<?> list) {
        return !(list instanceof ArrayList<?>);
    }

    private static Object number(Object value) {
        if (!isNumeric(value)) {
            throw notEvaluable();
        }
        return value;
    }

    private static Object integral(Object value) {
        if (!isIntegral(value)) {
            throw notEvaluable();
        }
        return value;
    }

    private static String bounded(String value) {
        if (value.length() > MAX_SEQUENCE_LENGTH) {
            throw notEvaluable();
        }
        return value;
    }

    private static void bounded(List<?> value) {
        if (value.size() > MAX_SEQUENCE_LENGTH) {
            throw notEvaluable();
        }
    }
}
