package com.example.catalog.config;

import com.example.catalog.CatalogConfigurationException;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StoreUrisTest {

    @Test
    void extractsDatabaseName() {
        assertThat(StoreUris.databaseName("mongodb://localhost:27017/metadatastore")).isEqualTo("metadatastore");
        assertThat(StoreUris.databaseName("mongodb://user:pw@db1,db2/catalog?replicaSet=rs0")).isEqualTo("catalog");
    }

    @Test
    void uriWithoutDatabaseIsRejected() {
        assertThatThrownBy(() -> StoreUris.databaseName("mongodb://localhost:27017"))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessage("Invalid URI: 'mongodb://localhost:27017' Did you forget to include a database?");
    }

    @Test
    void malformedOrMissingUriIsRejected() {
        assertThatThrownBy(() -> StoreUris.databaseName("http://localhost/db"))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasCauseInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StoreUris.databaseName(" "))
                .isInstanceOf(CatalogConfigurationException.class);
    }

    @Test
    void operationsTargetTheUriDatabase() {
        String uri = "mongodb://localhost:27017/metadatastore";
        try (MongoClient client = MongoClients.create(uri)) {
            ReactiveMongoTemplate template = StoreUris.operations(client, uri);

            assertThat(template.getMongoDatabase().block().getName()).isEqualTo("metadatastore");
        }
    }

    @Test
    void operationsRequireDatabase() {
        assertThatThrownBy(() -> StoreUris.operations("mongodb://localhost:27017"))
                .isInstanceOf(CatalogConfigurationException.class)
                .hasMessageContaining("Did you forget to include a database?");
    }
}
