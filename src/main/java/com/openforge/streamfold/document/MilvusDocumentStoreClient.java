package com.openforge.streamfold.document;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import io.milvus.orm.iterator.QueryIterator;
import io.milvus.response.QueryResultsWrapper;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.QueryIteratorReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.response.QueryResp;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * {@link DocumentStoreClient} over one Milvus collection.
 *
 *   count() — a single "count(*)" query, no row transfer
 *   find()  — a query iterator returning {@code pageSize} rows per batch,
 *             opened and advanced only as the stream is consumed
 *
 * Milvus projects top-level fields only, so dotted paths are reduced to their
 * first segment; JSON fields come back as Gson trees and are converted to
 * plain maps so that nested paths can be resolved by {@link FieldPaths}.
 */
@Slf4j
public class MilvusDocumentStoreClient implements DocumentStoreClient {

    private static final String COUNT_FIELD = "count(*)";
    private static final String ALL_FIELDS  = "*";
    /** Milvus rejects batches above its query result window (quotaAndLimits.maxQueryResultWindow). */
    static final int            MAX_BATCH   = 16_384;
    private static final Gson   GSON        = new Gson();

    private final MilvusClientV2 milvusClient;
    private final String         collectionName;
    private final int            pageSize;

    public MilvusDocumentStoreClient(MilvusClientV2 milvusClient, String collectionName, int pageSize) {
        this.milvusClient   = milvusClient;
        this.collectionName = collectionName;
        this.pageSize       = Math.min(Math.max(pageSize, 1), MAX_BATCH);
    }

    @Override
    public long count(String filter) {
        var builder = QueryReq.builder()
                .collectionName(collectionName)
                .outputFields(List.of(COUNT_FIELD));
        if (filter != null && !filter.isBlank()) builder.filter(filter);

        QueryResp resp = milvusClient.query(builder.build());
        if (resp == null || resp.getQueryResults() == null || resp.getQueryResults().isEmpty()) return 0L;

        Object count = resp.getQueryResults().get(0).getEntity().get(COUNT_FIELD);
        return count instanceof Number n ? n.longValue() : 0L;
    }

    @Override
    public Stream<Map<String, Object>> find(String filter, List<String> projection) {
        var builder = QueryIteratorReq.builder()
                .collectionName(collectionName)
                .outputFields(outputFields(projection))
                .batchSize(pageSize);
        if (filter != null && !filter.isBlank()) builder.expr(filter);

        RowBatches batches = new RowBatches(builder.build());
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(batches, Spliterator.ORDERED), false)
                .onClose(batches::close)
                .flatMap(List::stream);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    /**
     * Pulls one batch per step from a server-side query iterator.  The
     * iterator resumes from the last primary key it returned, so no request
     * carries an offset and the scan is not bounded by the query result window.
     * Opened on first pull, closed once a batch comes back empty or the
     * stream is closed.
     */
    private final class RowBatches implements Iterator<List<Map<String, Object>>> {

        private final QueryIteratorReq         request;
        private QueryIterator                  cursor;
        private List<Map<String, Object>>      buffered;
        private boolean                        exhausted;
        private long                           fetched;

        RowBatches(QueryIteratorReq request) {
            this.request = request;
        }

        @Override
        public boolean hasNext() {
            if (buffered == null && !exhausted) fetch();
            return buffered != null;
        }

        @Override
        public List<Map<String, Object>> next() {
            if (!hasNext()) throw new NoSuchElementException();
            List<Map<String, Object>> batch = buffered;
            buffered = null;
            return batch;
        }

        private void fetch() {
            if (cursor == null) cursor = milvusClient.queryIterator(request);
            List<QueryResultsWrapper.RowRecord> records = cursor.next();
            if (records == null || records.isEmpty()) {
                log.debug("[Milvus] Scan of '{}' finished after {} rows", collectionName, fetched);
                close();
                return;
            }
            List<Map<String, Object>> rows = new ArrayList<>(records.size());
            for (QueryResultsWrapper.RowRecord record : records) {
                rows.add(toPlainRecord(record.getFieldValues()));
            }
            fetched += rows.size();
            buffered = rows;
        }

        void close() {
            exhausted = true;
            if (cursor != null) {
                cursor.close();
                cursor = null;
            }
        }
    }

    static List<String> outputFields(List<String> projection) {
        if (projection == null || projection.isEmpty()) return List.of(ALL_FIELDS);
        LinkedHashSet<String> topLevel = new LinkedHashSet<>();
        for (String path : projection) {
            topLevel.add(FieldPaths.topLevel(path));
        }
        return List.copyOf(topLevel);
    }

    static Map<String, Object> toPlainRecord(Map<String, Object> entity) {
        Map<String, Object> record = new LinkedHashMap<>();
        if (entity == null) return record;
        entity.forEach((key, value) -> record.put(key,
                value instanceof JsonElement json ? GSON.fromJson(json, Object.class) : value));
        return record;
    }
}
