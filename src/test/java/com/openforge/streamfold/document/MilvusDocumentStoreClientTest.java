package com.openforge.streamfold.document;

import com.google.gson.JsonObject;
import io.milvus.orm.iterator.QueryIterator;
import io.milvus.response.QueryResultsWrapper;
import io.milvus.v2.client.MilvusClientV2;
import io.milvus.v2.service.vector.request.QueryIteratorReq;
import io.milvus.v2.service.vector.request.QueryReq;
import io.milvus.v2.service.vector.response.QueryResp;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MilvusDocumentStoreClientTest {

    @Mock
    private MilvusClientV2 milvusClient;

    private static QueryResp respOf(List<Map<String, Object>> rows) {
        List<QueryResp.QueryResult> results = rows.stream().map(row -> {
            QueryResp.QueryResult result = mock(QueryResp.QueryResult.class);
            when(result.getEntity()).thenReturn(row);
            return result;
        }).toList();
        QueryResp resp = mock(QueryResp.class);
        when(resp.getQueryResults()).thenReturn(results);
        return resp;
    }

    /** A cursor that hands out {@code batches} in order, then empty batches. */
    private static QueryIterator cursorOver(List<List<QueryResultsWrapper.RowRecord>> batches) {
        Iterator<List<QueryResultsWrapper.RowRecord>> remaining = batches.iterator();
        QueryIterator cursor = mock(QueryIterator.class);
        when(cursor.next()).thenAnswer(inv -> remaining.hasNext() ? remaining.next() : List.of());
        return cursor;
    }

    private static QueryResultsWrapper.RowRecord row() {
        QueryResultsWrapper.RowRecord row = mock(QueryResultsWrapper.RowRecord.class);
        when(row.getFieldValues()).thenReturn(Map.of("title", "t"));
        return row;
    }

    private static long asLong(Object value) {
        return ((Number) value).longValue();
    }

    @Test
    void shouldCountWithSingleAggregateQuery() {
        QueryResp resp = respOf(List.of(Map.of("count(*)", 42L)));
        when(milvusClient.query(any(QueryReq.class))).thenReturn(resp);
        MilvusDocumentStoreClient store = new MilvusDocumentStoreClient(milvusClient, "docs", 100);

        long count = store.count("lang == \"en\"");

        assertThat(count).isEqualTo(42L);
        ArgumentCaptor<QueryReq> request = ArgumentCaptor.forClass(QueryReq.class);
        verify(milvusClient).query(request.capture());
        assertThat(request.getValue().getOutputFields()).containsExactly("count(*)");
        assertThat(request.getValue().getFilter()).isEqualTo("lang == \"en\"");
        assertThat(request.getValue().getCollectionName()).isEqualTo("docs");
    }

    @Test
    void shouldScanWithQueryIteratorInsteadOfOffsets() {
        // GIVEN: 40 000 rows, far beyond the 16 384-row query result window
        List<QueryResultsWrapper.RowRecord> batch = Collections.nCopies(1000, row());
        List<List<QueryResultsWrapper.RowRecord>> batches = new ArrayList<>(Collections.nCopies(40, batch));
        QueryIterator cursor = cursorOver(batches);
        when(milvusClient.queryIterator(any(QueryIteratorReq.class))).thenReturn(cursor);
        MilvusDocumentStoreClient store = new MilvusDocumentStoreClient(milvusClient, "docs", 1000);

        // WHEN
        long count;
        try (Stream<Map<String, Object>> rows = store.find("lang == \"en\"", List.of("title", "author.name"))) {
            count = rows.count();
        }

        // THEN
        assertThat(count).isEqualTo(40_000L);
        verify(milvusClient, never()).query(any(QueryReq.class));
        ArgumentCaptor<QueryIteratorReq> request = ArgumentCaptor.forClass(QueryIteratorReq.class);
        verify(milvusClient, times(1)).queryIterator(request.capture());
        assertThat(asLong(request.getValue().getBatchSize())).isEqualTo(1000L);
        assertThat(request.getValue().getExpr()).isEqualTo("lang == \"en\"");
        assertThat(request.getValue().getOutputFields()).containsExactly("title", "author");
        verify(cursor).close();
    }

    @Test
    void shouldCapBatchSizeAtResultWindow() {
        QueryIterator cursor = cursorOver(List.of());
        when(milvusClient.queryIterator(any(QueryIteratorReq.class))).thenReturn(cursor);
        MilvusDocumentStoreClient store = new MilvusDocumentStoreClient(milvusClient, "docs", 50_000);

        assertThat(store.find("", null).toList()).isEmpty();

        ArgumentCaptor<QueryIteratorReq> request = ArgumentCaptor.forClass(QueryIteratorReq.class);
        verify(milvusClient).queryIterator(request.capture());
        assertThat(asLong(request.getValue().getBatchSize()))
                .isLessThanOrEqualTo(MilvusDocumentStoreClient.MAX_BATCH);
    }

    @Test
    void shouldCloseCursorWhenStreamClosedEarly() {
        QueryIterator cursor = cursorOver(List.of(List.of(row(), row())));
        when(milvusClient.queryIterator(any(QueryIteratorReq.class))).thenReturn(cursor);
        MilvusDocumentStoreClient store = new MilvusDocumentStoreClient(milvusClient, "docs", 2);

        try (Stream<Map<String, Object>> rows = store.find("", null)) {
            assertThat(rows.findFirst()).isPresent();
        }

        verify(cursor).close();
    }

    @Test
    void shouldNotQueryBeforeConsumption() {
        MilvusDocumentStoreClient store = new MilvusDocumentStoreClient(milvusClient, "docs", 2);

        store.find("", null);

        verify(milvusClient, never()).queryIterator(any(QueryIteratorReq.class));
    }

    @Test
    void shouldFetchEveryFieldWithoutProjection() {
        assertThat(MilvusDocumentStoreClient.outputFields(null)).containsExactly("*");
        assertThat(MilvusDocumentStoreClient.outputFields(List.of("a.b", "a.c", "d"))).containsExactly("a", "d");
    }

    @Test
    void shouldConvertJsonFieldsToPlainMaps() {
        JsonObject author = new JsonObject();
        author.addProperty("name", "Ada");

        Map<String, Object> record = MilvusDocumentStoreClient.toPlainRecord(Map.of("author", author, "id", 1L));

        assertThat(FieldPaths.resolve(record, "author.name", "")).isEqualTo("Ada");
        assertThat(record.get("id")).isEqualTo(1L);
    }
}
