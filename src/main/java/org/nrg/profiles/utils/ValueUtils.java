package org.nrg.profiles.utils;

import org.apache.commons.lang3.math.NumberUtils;

import javax.annotation.Nullable;
import java.math.BigDecimal;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;

/**
 * Comparison helpers for metadata attribute and parameter values.
 * Values are scalars: strings, numbers and booleans. Only {@link #contains(Object, Object)} takes a collection.
 */
public class ValueUtils {
    private ValueUtils() {}

    public static boolean isScalar(@Nullable final Object value) {
        return value == null ||
                !(value instanceof Collection || value instanceof Map || value.getClass().isArray());
    }

    /**
     * @throws IllegalArgumentException if the value is a collection, map or array
     */
    public static Object checkScalar(final String key, @Nullable final Object value) {
        if (!isScalar(value)) {
            throw new IllegalArgumentException("Value for \"" + key + "\" must be a single value, not " +
                    value.getClass().getSimpleName());
        }
        return value;
    }

    /**
     * Two values are the same if they are equal, or if both are numbers (or numeric strings) and
     * numerically equal. This agrees with {@link #compare(Object, Object)}.
     */
    public static boolean sameValue(@Nullable final Object left, @Nullable final Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (Objects.equals(left, right)) {
            return true;
        }
        final BigDecimal leftNumber = asNumber(left);
        final BigDecimal rightNumber = asNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber) == 0;
        }
        if (left instanceof Boolean || right instanceof Boolean) {
            return String.valueOf(left).equalsIgnoreCase(String.valueOf(right));
        }
        return false;
    }

    /**
     * Orders two values, numerically when both sides are numbers (or numeric strings), otherwise
     * lexicographically when both are strings.
     *
     * @return the comparison, or null when the values can't be ordered
     */
    @Nullable
    public static Integer compare(@Nullable final Object left, @Nullable final Object right) {
        if (left == null || right == null) {
            return null;
        }
        final BigDecimal leftNumber = asNumber(left);
        final BigDecimal rightNumber = asNumber(right);
        if (leftNumber != null && rightNumber != null) {
            return leftNumber.compareTo(rightNumber);
        }
        if (left instanceof String && right instanceof String) {
            return ((String) left).compareTo((String) right);
        }
        return null;
    }

    /**
     * @param container A collection of options, or a string
     * @param element The value looked for; a substring when the container is a string
     */
    public static boolean contains(@Nullable final Object container, @Nullable final Object element) {
        if (container == null || element == null) {
            return false;
        }
        if (container instanceof Collection) {
            return ((Collection<?>) container).stream().anyMatch(item -> sameValue(item, element));
        }
        return String.valueOf(container).contains(String.valueOf(element));
    }

    @Nullable
    private static BigDecimal asNumber(final Object value) {
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        final String text;
        if (value instanceof Number) {
            text = value.toString();
        } else if (value instanceof String && NumberUtils.isCreatable(((String) value).trim())) {
            text = ((String) value).trim();
        } else {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            // NaN, infinities, and hex or octal literals have no decimal form
            return null;
        }
    }
}
