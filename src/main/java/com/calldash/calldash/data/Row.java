package com.calldash.calldash.data;

import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * One call record keyed by exactly the column set of the dataset that owns it.
 * Numeric readings of every value are computed once at construction.
 */
public final class Row {

    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private final Map<String, Object> values;
    private final Map<String, Double> numbers;
    private final Map<String, Optional<LocalDate>> dates = new ConcurrentHashMap<>();

    private Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(values);
        Map<String, Double> parsed = new HashMap<>();
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            Double number = toNumber(entry.getValue());
            if (number != null) {
                parsed.put(entry.getKey(), number);
            }
        }
        this.numbers = parsed;
    }

    /**
     * Builds a row carrying every column in {@code columns}; absent source keys become null
     * and keys outside the column set are dropped.
     */
    public static Row of(List<String> columns, Map<String, ?> source) {
        Map<String, Object> values = new LinkedHashMap<>(columns.size() * 2);
        for (String column : columns) {
            values.put(column, source == null ? null : source.get(column));
        }
        return new Row(values);
    }

    public Object get(String column) {
        return values.get(column);
    }

    /**
     * Returns the value as text, or an empty string for null.
     */
    public String text(String column) {
        Object value = values.get(column);
        return value == null ? "" : value.toString();
    }

    /**
     * Returns the numeric reading of the value, or null when it is not a number.
     */
    public Double number(String column) {
        return numbers.get(column);
    }

    /**
     * Returns the call date held in {@code column}, parsed on first access.
     */
    public LocalDate date(String column) {
        return dates.computeIfAbsent(column, key -> Optional.ofNullable(CallDates.parse(text(key)))).orElse(null);
    }

    public Set<String> columns() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    /**
     * Returns a detached, mutable copy of the values for transformation passes.
     */
    public Map<String, Object> toMutableMap() {
        return new LinkedHashMap<>(values);
    }

    static Double toNumber(Object value) {
        if (value instanceof Number number) {
            double d = number.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (value instanceof String text) {
            String trimmed = text.trim();
            if (!trimmed.isEmpty() && NUMBER.matcher(trimmed).matches()) {
                return Double.parseDouble(trimmed);
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Row row)) {
            return false;
        }
        return values.equals(row.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
