package com.eidos.core.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for the {@code Map<String, Object>} form used by {@code toMap}/{@code fromMap}.
 * Missing or mistyped values resolve to the supplied default.
 */
final class MapValues {

    private MapValues() {}

    static String string(Map<String, ?> data, String key, String fallback) {
        Object v = data.get(key);
        return v == null ? fallback : String.valueOf(v);
    }

    static double number(Map<String, ?> data, String key, double fallback) {
        Object v = data.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static Double nullableNumber(Map<String, ?> data, String key) {
        Object v = data.get(key);
        if (v instanceof Number n) return n.doubleValue();
        return null;
    }

    static int integer(Map<String, ?> data, String key, int fallback) {
        Object v = data.get(key);
        if (v instanceof Number n) return n.intValue();
        if (v instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    static boolean bool(Map<String, ?> data, String key, boolean fallback) {
        Object v = data.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        return fallback;
    }

    static Boolean nullableBool(Map<String, ?> data, String key) {
        Object v = data.get(key);
        if (v instanceof Boolean b) return b;
        if (v instanceof Number n) return n.intValue() != 0;
        return null;
    }

    static List<String> strings(Map<String, ?> data, String key) {
        Object v = data.get(key);
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) out.add(String.valueOf(item));
            }
        }
        return out;
    }

    static Map<String, Object> map(Map<String, ?> data, String key) {
        Object v = data.get(key);
        Map<String, Object> out = new LinkedHashMap<>();
        if (v instanceof Map<?, ?> m) {
            m.forEach((k, val) -> out.put(String.valueOf(k), val));
        }
        return out;
    }

    static Map<String, Integer> counts(Map<String, ?> data, String key) {
        Map<String, Integer> out = new LinkedHashMap<>();
        map(data, key).forEach((k, v) -> {
            if (v instanceof Number n) out.put(k, n.intValue());
        });
        return out;
    }
}
