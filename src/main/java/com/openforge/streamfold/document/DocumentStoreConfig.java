package com.openforge.streamfold.document;

import io.milvus.v2.client.ConnectConfig;
import io.milvus.v2.client.MilvusClientV2;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Document loader bean configuration.
 *
 * On startup (only when streamfold.loader.enabled=true):
 *   1. Validates connection-string / database-name / collection-name
 *   2. Creates a MilvusClientV2 for that database
 *   3. Exposes the client as a DocumentStoreClient and a ready DocumentStoreLoader
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(LoaderProperties.class)
@ConditionalOnProperty(name = "streamfold.loader.enabled", havingValue = "true")
public class DocumentStoreConfig {

    @Bean(destroyMethod = "close")
    public MilvusClientV2 documentStoreMilvusClient(LoaderProperties props) {
        DocumentStoreLoader.requireSettings(props);
        log.info("[Milvus] Connecting to {} (database '{}')...", props.connectionString(), props.databaseName());
        MilvusClientV2 client = new MilvusClientV2(
                ConnectConfig.builder()
                        .uri(props.connectionString())
                        .dbName(props.databaseName())
                        .connectTimeoutMs(15_000)
                        .build()
        );
        log.info("[Milvus] Connected successfully.");
        return client;
    }

    @Bean
    public DocumentStoreClient documentStoreClient(MilvusClientV2 documentStoreMilvusClient,
                                                   LoaderProperties props) {
        return new MilvusDocumentStoreClient(documentStoreMilvusClient, props.collectionName(), props.pageSize());
    }

    @Bean
    public DocumentStoreLoader documentStoreLoader(DocumentStoreClient documentStoreClient,
                                                   LoaderProperties props) {
        return new DocumentStoreLoader(documentStoreClient, props);
    }
}
