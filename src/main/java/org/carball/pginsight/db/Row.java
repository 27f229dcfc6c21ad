package org.carball.pginsight.db;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One result row keyed by lower-cased column label, in select-list order.
 */
public final class Row {

    private final Map<String, Object> values;

    public Row(Map<String, Object> values) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        values.forEach((k, v) -> normalized.put(k.toLowerCase(), v));
        this.values = Collections.unmodifiableMap(normalized);
    }

    public static Row of(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Row.of expects key/value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return new Row(map);
    }

    public boolean has(String column) {
        return values.containsKey(column.toLowerCase());
    }

    public Object get(String column) {
        return values.get(column.toLowerCase());
    }

    /**
     * Value of the first column, for single-column results such as EXPLAIN output.
     */
    public Object first() {
        return values.isEmpty() ? null : values.values().iterator().next();
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : value.toString();
    }

    public double getDouble(String column) {
        Object value = get(column);
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s) {
            return Double.parseDouble(s);
        }
        return 0.0;
    }

    public long getLong(String column) {
        Object value = get(column);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s) {
            return Long.parseLong(s);
        }
        return 0L;
    }

    public boolean getBoolean(String column) {
        Object value = get(column);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            String trimmed = s.trim();
            return "t".equalsIgnoreCase(trimmed) || "true".equalsIgnoreCase(trimmed);
        }
        return false;
    }

    public Instant getInstant(String column) {
        Object value = get(column);
        if (value instanceof Timestamp timestamp) {
            return timestamp.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        return null;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
