package com.openforge.streamfold.document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads dot-delimited paths such as {@code author.address.city} out of
 * nested record maps.
 */
public final class FieldPaths {

    private FieldPaths() {}

    /**
     * Extracts each path into an ordered map keyed by the path itself.
     * A missing segment, or a segment that is not a map, yields {@code defaultValue}.
     */
    public static Map<String, Object> extract(Map<String, Object> record,
                                              List<String> paths,
                                              Object defaultValue) {
        Map<String, Object> extracted = new LinkedHashMap<>();
        if (paths == null) return extracted;
        for (String path : paths) {
            extracted.put(path, resolve(record, path, defaultValue));
        }
        return extracted;
    }

    public static Object resolve(Map<String, Object> record, String path, Object defaultValue) {
        Object value = record;
        for (String key : path.split("\\.")) {
            if (!(value instanceof Map<?, ?> map) || !map.containsKey(key)) {
                return defaultValue;
            }
            value = map.get(key);
        }
        return value == null ? defaultValue : value;
    }

    public static String topLevel(String path) {
        int dot = path.indexOf('.');
        return dot < 0 ? path : path.substring(0, dot);
    }
}
