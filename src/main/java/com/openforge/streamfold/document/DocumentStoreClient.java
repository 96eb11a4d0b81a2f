package com.openforge.streamfold.document;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Narrow read-only view of a document store.
 *
 * Records are nested key/value maps.  Filters use the store's own expression
 * syntax; a null or blank filter matches everything.
 */
public interface DocumentStoreClient {

    long count(String filter);

    /**
     * Lazily iterates matching records.  The stream is single-use and should
     * be closed by the caller.
     *
     * @param projection dot-delimited field paths to fetch; null fetches every field
     */
    Stream<Map<String, Object>> find(String filter, List<String> projection);
}
