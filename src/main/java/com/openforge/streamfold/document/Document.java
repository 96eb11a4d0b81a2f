package com.openforge.streamfold.document;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A loaded unit of text plus the metadata it was found with.
 */
public record Document(
        String pageContent,
        Map<String, Object> metadata
) {

    public Document {
        pageContent = pageContent == null ? "" : pageContent;
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }
}
