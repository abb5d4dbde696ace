package com.reasoning.kgml.util;

import com.reasoning.kgml.error.SemanticException;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Helpers for the closed value set carried by node metadata and KGML
 * properties: {@link String}, {@link Number}, {@link Boolean} and {@code null}.
 */
public final class Values {
    private Values() {
        // Utility class
    }

    /** True if {@code value} belongs to the closed scalar value set. */
    public static boolean isScalar(Object value) {
        return value == null || value instanceof String || value instanceof Number || value instanceof Boolean;
    }

    /**
     * Returns {@code value} if it is a scalar.
     *
     * @throws SemanticException otherwise
     */
    public static Object requireScalar(String key, Object value) {
        if (!isScalar(value))
            throw new SemanticException("Property '" + key + "' must be a string, number, boolean or null, got "
                    + value.getClass().getSimpleName());
        return value;
    }

    /**
     * Value equality used when scoring outcomes. Numbers compare by numeric
     * value regardless of their boxed type, everything else with
     * {@link Objects#equals(Object, Object)}.
     */
    public static boolean matches(Object a, Object b) {
        if (a instanceof Number na && b instanceof Number nb) {
            BigDecimal da = toDecimal(na), db = toDecimal(nb);
            if (da == null || db == null)
                return na.doubleValue() == nb.doubleValue();
            return da.compareTo(db) == 0;
        }
        return Objects.equals(a, b);
    }

    /**
     * Truth value of an evaluation result as seen by {@code IF►} and
     * {@code LOOP►}. False for {@code null}, {@code false}, numeric zero or NaN,
     * an empty string, and an empty collection or map; true otherwise.
     */
    public static boolean isTruthy(Object value) {
        if (value == null)
            return false;
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof CharSequence cs)
            return cs.length() > 0;
        if (value instanceof Collection<?> c)
            return !c.isEmpty();
        if (value instanceof Map<?, ?> m)
            return !m.isEmpty();
        return true;
    }

    /** Numeric coercion for properties that arrive either as numbers or strings. */
    public static double toDouble(String key, Object value) {
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.strip());
            } catch (NumberFormatException e) {
                throw new SemanticException("Property '" + key + "' is not numeric: " + s, e);
            }
        }
        throw new SemanticException("Property '" + key + "' is not numeric: " + value);
    }

    private static BigDecimal toDecimal(Number n) {
        if (n instanceof BigDecimal bd)
            return bd;
        if (n instanceof Double || n instanceof Float) {
            double d = n.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d))
                return null;
            return BigDecimal.valueOf(d);
        }
        try {
            return new BigDecimal(n.toString());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
