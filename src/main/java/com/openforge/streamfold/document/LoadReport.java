package com.openforge.streamfold.document;

import java.util.List;

/**
 * Outcome of a full load.
 *
 * expectedCount is taken before iteration starts; concurrent writes to the
 * store can make it differ from what iteration returns.
 */
public record LoadReport(
        List<Document> documents,
        long expectedCount
) {

    public LoadReport {
        documents = List.copyOf(documents);
    }

    /** True when iteration returned fewer records than the count. */
    public boolean partial() {
        return documents.size() < expectedCount;
    }

    /** True when records were added while iterating, so more came back than counted. */
    public boolean exceededCount() {
        return documents.size() > expectedCount;
    }
}
