package com.example.catalog.config;

import com.example.catalog.CatalogConfigurationException;
import com.mongodb.ConnectionString;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;

/**
 * MongoDB URI checks. A catalog URI must name its database: {@code mongodb://host/database}.
 */
public final class StoreUris {
    private StoreUris() {}

    public static String databaseName(String uri) {
        if (uri == null || uri.isBlank()) {
            throw new CatalogConfigurationException("No metadata store URI configured");
        }
        ConnectionString connectionString;
        try {
            connectionString = new ConnectionString(uri);
        } catch (IllegalArgumentException e) {
            throw new CatalogConfigurationException("Invalid URI: '" + uri + "'", e);
        }
        String database = connectionString.getDatabase();
        if (database == null || database.isBlank()) {
            throw new CatalogConfigurationException(
                    "Invalid URI: '" + uri + "' Did you forget to include a database?");
        }
        return database;
    }

    /**
     * Template on the database named by {@code uri}, over a new client that the caller owns.
     */
    public static ReactiveMongoTemplate operations(String uri) {
        String database = databaseName(uri);
        return new ReactiveMongoTemplate(MongoClients.create(uri), database);
    }

    /**
     * Template on the database named by {@code uri}, sharing {@code client}.
     */
    public static ReactiveMongoTemplate operations(MongoClient client, String uri) {
        return new ReactiveMongoTemplate(client, databaseName(uri));
    }
}
