package com.openforge.streamfold.document;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Loads records from a document store as {@link Document}s.
 *
 * Per record:
 *   pageContent ← values of fieldNames, stringified and joined with " "
 *   metadata    ← values of metadataNames, plus "database" / "collection"
 *                 when includeDbCollectionInMetadata is set
 * Missing paths resolve to "".
 *
 * A full load counts first and iterates second.  When the two disagree
 * (concurrent writes, eventual consistency) a warning is logged and what
 * was retrieved is returned; only a shortfall makes the report partial.
 */
@Slf4j
public class DocumentStoreLoader {

    static final String MISSING = "";

    private final DocumentStoreClient client;
    private final LoaderProperties    properties;

    public DocumentStoreLoader(DocumentStoreClient client, LoaderProperties properties) {
        requireSettings(properties);
        this.client     = Objects.requireNonNull(client, "client");
        this.properties = properties;
    }

    /** Fails fast on missing connection identifiers. */
    public static void requireSettings(LoaderProperties properties) {
        if (properties == null) {
            throw new ConfigurationException("Loader properties must be provided.");
        }
        if (isBlank(properties.connectionString())) {
            throw new ConfigurationException("connection-string must be provided.");
        }
        if (isBlank(properties.databaseName())) {
            throw new ConfigurationException("database-name must be provided.");
        }
        if (isBlank(properties.collectionName())) {
            throw new ConfigurationException("collection-name must be provided.");
        }
    }

    // ── Loading ──────────────────────────────────────────────────────────────

    /** Lazily maps records to documents; close the stream when done. */
    public Stream<Document> lazyLoad() {
        return client.find(properties.filter(), projection()).map(this::toDocument);
    }

    public LoadReport loadReport() {
        long expected = client.count(properties.filter());

        List<Document> documents;
        try (Stream<Document> stream = lazyLoad()) {
            documents = stream.collect(Collectors.toCollection(ArrayList::new));
        }

        LoadReport report = new LoadReport(documents, expected);
        if (report.partial()) {
            log.warn("[Loader] Only partial collection of documents returned from {}.{}. Loaded {} docs, expected {}.",
                    properties.databaseName(), properties.collectionName(), documents.size(), expected);
        } else if (report.exceededCount()) {
            log.warn("[Loader] Collection {}.{} grew during the load. Loaded {} docs, counted {} beforehand.",
                    properties.databaseName(), properties.collectionName(), documents.size(), expected);
        } else {
            log.debug("[Loader] Loaded {} docs from {}.{}",
                    documents.size(), properties.databaseName(), properties.collectionName());
        }
        return report;
    }

    public List<Document> load() {
        return loadReport().documents();
    }

    // ── Mapping ──────────────────────────────────────────────────────────────

    /** Every configured path, or null (all fields) when no field names are set. */
    List<String> projection() {
        if (properties.fieldNames().isEmpty()) return null;
        Set<String> paths = new LinkedHashSet<>(properties.fieldNames());
        paths.addAll(properties.metadataNames());
        return List.copyOf(paths);
    }

    Document toDocument(Map<String, Object> record) {
        Map<String, Object> metadata = new LinkedHashMap<>(
                FieldPaths.extract(record, properties.metadataNames(), MISSING));
        if (properties.includeDbCollectionInMetadata()) {
            metadata.put("database", properties.databaseName());
            metadata.put("collection", properties.collectionName());
        }

        String text = FieldPaths.extract(record, properties.fieldNames(), MISSING).values().stream()
                .map(String::valueOf)
                .collect(Collectors.joining(" "));
        return new Document(text, metadata);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
