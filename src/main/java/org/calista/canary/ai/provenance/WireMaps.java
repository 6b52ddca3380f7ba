package org.calista.canary.ai.provenance;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient readers for the map form of ledger entries (toMap/fromMap).
 * Missing or mistyped values fall back to the supplied default.
 */
final class WireMaps {

    private WireMaps() {}

    static String str(Map<String, ?> m, String key, String def) {
        Object v = m == null ? null : m.get(key);
        return v == null ? def : String.valueOf(v);
    }

    static Double dbl(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (v instanceof Number n) return n.doubleValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    static Long lng(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (v instanceof Number n) return n.longValue();
        if (v instanceof String s && !s.isBlank()) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    static List<String> strings(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (!(v instanceof Collection<?> c)) return List.of();
        ArrayList<String> out = new ArrayList<>(c.size());
        for (Object o : c) {
            if (o != null) out.add(String.valueOf(o));
        }
        return out;
    }

    static Map<String, Object> map(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (!(v instanceof Map<?, ?> raw)) return new LinkedHashMap<>();
        LinkedHashMap<String, Object> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : raw.entrySet()) {
            if (e.getKey() != null) out.put(String.valueOf(e.getKey()), e.getValue());
        }
        return out;
    }

    @SuppressWarnings("unchecked")
    static List<Map<String, Object>> maps(Map<String, ?> m, String key) {
        Object v = m == null ? null : m.get(key);
        if (!(v instanceof Collection<?> c)) return List.of();
        ArrayList<Map<String, Object>> out = new ArrayList<>(c.size());
        for (Object o : c) {
            if (o instanceof Map<?, ?>) out.add((Map<String, Object>) o);
        }
        return out;
    }

    /** Accepts ISO instants ("...Z") and zone-less local date-times. */
    static Instant instant(Map<String, ?> m, String key, Instant def) {
        String s = str(m, key, null);
        if (s == null || s.isBlank()) return def;
        try {
            return Instant.parse(s.trim());
        } catch (DateTimeParseException e) {
            try {
                return LocalDateTime.parse(s.trim()).atZone(ZoneId.systemDefault()).toInstant();
            } catch (DateTimeParseException e2) {
                return def;
            }
        }
    }
}
