package com.sds.phucth.assistantrelay.utils;

import java.util.Collection;
import java.util.Map;

/**
 * Loose truth test for values coming out of assistant JSON: false, zero, empty and null are
 * false, everything else is true.
 */
public final class Truthiness {
    private Truthiness() {
    }

    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0d;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        return true;
    }
}
