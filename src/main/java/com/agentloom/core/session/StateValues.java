package com.agentloom.core.session;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates state values: only strings, numbers, booleans and homogeneous
 * lists or sets of those are accepted.
 */
public final class StateValues {

    private static final List<Class<?>> NUMBER_TYPES = List.of(
            Integer.class, Long.class, Short.class, Byte.class,
            Double.class, Float.class, BigInteger.class, BigDecimal.class);

    private StateValues() {}

    /**
     * Validates a single delta entry; the tombstone is accepted for any valid key.
     *
     * @throws SessionValidationException if the key or the value is not acceptable
     */
    public static void validate(String key, Object value) {
        StateScope.of(key);
        if (value == State.REMOVED) {
            return;
        }
        if (value == null) {
            throw new SessionValidationException("State value for '" + key
                    + "' is null; use State.REMOVED to delete a key");
        }
        if (value instanceof List<?> || value instanceof Set<?>) {
            validateCollection(key, (Collection<?>) value);
            return;
        }
        if (kindOf(value) == null) {
            throw new SessionValidationException("State value for '" + key + "' has unsupported type "
                    + value.getClass().getName());
        }
    }

    public static void validateAll(Map<String, Object> delta) {
        delta.forEach(StateValues::validate);
    }

    /**
     * Returns an unmodifiable copy of a list or set value, anything else unchanged.
     * Committed state and committed events never share a collection with the caller.
     */
    public static Object freeze(Object value) {
        if (value instanceof List<?> list) {
            return Collections.unmodifiableList(new ArrayList<>(list));
        }
        if (value instanceof Set<?> set) {
            return Collections.unmodifiableSet(new LinkedHashSet<>(set));
        }
        return value;
    }

    private static void validateCollection(String key, Collection<?> values) {
        String firstKind = null;
        for (Object element : values) {
            String kind = element == null ? null : kindOf(element);
            if (kind == null) {
                throw new SessionValidationException("State collection for '" + key
                        + "' contains an unsupported element: " + element);
            }
            if (firstKind == null) {
                firstKind = kind;
            } else if (!firstKind.equals(kind)) {
                throw new SessionValidationException("State collection for '" + key
                        + "' mixes " + firstKind + " and " + kind + " elements");
            }
        }
    }

    private static String kindOf(Object value) {
        if (value instanceof String) return "string";
        if (value instanceof Boolean) return "boolean";
        for (Class<?> type : NUMBER_TYPES) {
            if (type.isInstance(value)) return "number";
        }
        return null;
    }
}
