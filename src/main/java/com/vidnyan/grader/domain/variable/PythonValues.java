package com.vidnyan.grader.domain.variable;

import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Value comparison with Python semantics for the Java representations the
 * resolver produces: {@code 1 == 1.0 == True}, lists compare element-wise.
 */
public final class PythonValues {

    private PythonValues() {
    }

    public static boolean pyEquals(Object a, Object b) {
        if (a == b) {
            return true;
        }
        if (a == null || b == null) {
            return isNone(a) && isNone(b);
        }
        if (isNumeric(a) && isNumeric(b)) {
            if (isIntegral(a) && isIntegral(b)) {
                return toLong(a) == toLong(b);
            }
            return toDouble(a) == toDouble(b);
        }
        if (a instanceof List<?> la && b instanceof List<?> lb) {
            if (la.size() != lb.size()) {
                return false;
            }
            Iterator<?> ia = la.iterator();
            Iterator<?> ib = lb.iterator();
            while (ia.hasNext()) {
                if (!pyEquals(ia.next(), ib.next())) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Map<?, ?> ma && b instanceof Map<?, ?> mb) {
            if (ma.size() != mb.size()) {
                return false;
            }
            for (Map.Entry<?, ?> e : ma.entrySet()) {
                Object key = findKey(mb.keySet(), e.getKey());
                if (key == null || !pyEquals(e.getValue(), mb.get(key))) {
                    return false;
                }
            }
            return true;
        }
        if (a instanceof Set<?> sa && b instanceof Set<?> sb) {
            return sa.size() == sb.size() && sa.stream().allMatch(x -> findKey(sb, x) != null);
        }
        return a.equals(b);
    }

    public static boolean isNumeric(Object o) {
        return o instanceof Number || o instanceof Boolean;
    }

    public static boolean isIntegral(Object o) {
        return o instanceof Long || o instanceof Integer || o instanceof Short
                || o instanceof Byte || o instanceof Boolean;
    }

    public static long toLong(Object o) {
        if (o instanceof Boolean b) {
            return b ? 1L : 0L;
        }
        return ((Number) o).longValue();
    }

    public static double toDouble(Object o) {
        if (o instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return ((Number) o).doubleValue();
    }

    public static boolean isNone(Object o) {
        return o == null || o == PyNone.NONE;
    }

    /**
     * Python truthiness.
     */
    public static boolean truthy(Object o) {
        if (isNone(o)) {
            return false;
        }
        if (o instanceof Boolean b) {
            return b;
        }
        if (isIntegral(o)) {
            return toLong(o) != 0;
        }
        if (o instanceof Number n) {
            return n.doubleValue() != 0.0;
        }
        if (o instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (o instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (o instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }

    private static Object findKey(Collection<?> keys, Object wanted) {
        for (Object key : keys) {
            if (pyEquals(key, wanted)) {
                return key;
            }
        }
        return null;
    }
}
