package com.openforge.streamfold.document;

import lombok.Builder;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Document loader settings.
 *
 * application.yml:
 *
 * streamfold:
 *   loader:
 *     enabled: true
 *     connection-string: http://localhost:19530
 *     database-name: default
 *     collection-name: articles
 *     filter: 'lang == "en"'
 *     field-names: [title, body.text]
 *     metadata-names: [author.name, published]
 *     include-db-collection-in-metadata: true
 *     page-size: 1000
 */
@Builder
@ConfigurationProperties(prefix = "streamfold.loader")
public record LoaderProperties(
        boolean enabled,
        String connectionString,
        String databaseName,
        String collectionName,

        /** Store-native filter expression; blank matches every record. */
        String filter,

        /** Paths joined (space-separated) into the page content. */
        List<String> fieldNames,

        /** Paths copied into document metadata. */
        List<String> metadataNames,

        @DefaultValue("true") Boolean includeDbCollectionInMetadata,
        @DefaultValue("1000") int pageSize
) {

    public LoaderProperties {
        filter = filter == null ? "" : filter;
        fieldNames = fieldNames == null ? List.of() : List.copyOf(fieldNames);
        metadataNames = metadataNames == null ? List.of() : List.copyOf(metadataNames);
        includeDbCollectionInMetadata = includeDbCollectionInMetadata == null || includeDbCollectionInMetadata;
        pageSize = pageSize > 0 ? pageSize : 1000;
    }
}
