package com.openforge.streamfold.message;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One value inside {@link Message#additionalFields()}.
 *
 * A tagged variant tree with exactly three shapes:
 *   Text    — string leaf; concatenated when two chunks meet
 *   Scalar  — number / boolean / null leaf; never concatenated
 *   Fields  — ordered nested mapping; merged key by key
 *
 * Example (an OpenAI-style function call):
 * <pre>
 *   Fields{ "function_call" → Fields{ "name" → Text("move_file"),
 *                                    "arguments" → Text("{...}") } }
 * </pre>
 */
public sealed interface FieldValue permits FieldValue.Text, FieldValue.Scalar, FieldValue.Fields {

    /** Plain Java view: String, Number, Boolean, null or an ordered Map. */
    @JsonValue
    Object toPlain();

    // ── Variants ─────────────────────────────────────────────────────────────

    record Text(String value) implements FieldValue {
        public Text {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Scalar(Object value) implements FieldValue {
        public Scalar {
            if (value != null && !(value instanceof Number) && !(value instanceof Boolean)) {
                throw new IllegalArgumentException(
                        "Scalar must be a number, boolean or null, got " + value.getClass().getName());
            }
        }

        public boolean isNull() {
            return value == null;
        }

        @Override
        public Object toPlain() {
            return value;
        }
    }

    record Fields(Map<String, FieldValue> entries) implements FieldValue {
        public Fields {
            entries = orderedCopy(entries);
        }

        public static Fields empty() {
            return new Fields(Map.of());
        }

        @Override
        public Object toPlain() {
            Map<String, Object> plain = new LinkedHashMap<>();
            entries.forEach((k, v) -> plain.put(k, v.toPlain()));
            return plain;
        }
    }

    // ── Factories ────────────────────────────────────────────────────────────

    static Text text(String value) {
        return new Text(value);
    }

    static Scalar scalar(Object value) {
        return new Scalar(value);
    }

    static Fields fields(Map<String, FieldValue> entries) {
        return new Fields(entries);
    }

    /**
     * Converts a plain Java value into the variant tree.
     * Maps must have String keys; lists are not representable.
     */
    static FieldValue of(Object raw) {
        if (raw instanceof FieldValue fv) return fv;
        if (raw == null || raw instanceof Number || raw instanceof Boolean) return new Scalar(raw);
        if (raw instanceof CharSequence cs) return new Text(cs.toString());
        if (raw instanceof Map<?, ?> map) {
            Map<String, FieldValue> converted = new LinkedHashMap<>();
            map.forEach((k, v) -> {
                if (!(k instanceof String key)) {
                    throw new IllegalArgumentException("Field keys must be strings, got " + k);
                }
                converted.put(key, of(v));
            });
            return new Fields(converted);
        }
        throw new IllegalArgumentException(
                "Unsupported field value type: " + raw.getClass().getName());
    }

    /**
     * Immutable insertion-ordered copy of a field map.  A null value is stored
     * as a null {@link Scalar}; null keys are rejected.
     */
    static Map<String, FieldValue> orderedCopy(Map<String, FieldValue> entries) {
        if (entries == null || entries.isEmpty()) return Map.of();
        Map<String, FieldValue> copy = new LinkedHashMap<>();
        entries.forEach((k, v) -> copy.put(
                Objects.requireNonNull(k, "field key"),
                v == null ? new Scalar(null) : v));
        return Collections.unmodifiableMap(copy);
    }

    /** Converts a plain map into an ordered field map. */
    static Map<String, FieldValue> mapOf(Map<String, ?> raw) {
        Map<String, FieldValue> converted = new LinkedHashMap<>();
        if (raw != null) raw.forEach((k, v) -> converted.put(k, of(v)));
        return converted;
    }
}
