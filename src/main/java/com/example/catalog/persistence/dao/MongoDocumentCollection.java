package com.example.catalog.persistence.dao;

import org.bson.Document;
import org.springframework.data.mongodb.core.ReactiveMongoOperations;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.query.BasicQuery;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

public class MongoDocumentCollection implements DocumentCollection {
    private final ReactiveMongoOperations mongo;
    private final String collectionName;

    public MongoDocumentCollection(ReactiveMongoOperations mongo, String collectionName) {
        this.mongo = mongo;
        this.collectionName = collectionName;
    }

    @Override
    public String name() {
        return collectionName;
    }

    @Override
    public Flux<Document> find(Document filter, Document sort, long skip, int limit) {
        BasicQuery query = new BasicQuery(filter);
        if (sort != null && !sort.isEmpty()) {
            query.setSortObject(sort);
        }
        query.skip(skip).limit(limit);
        return mongo.find(query, Document.class, collectionName);
    }

    @Override
    public Mono<Document> findOne(Document filter) {
        return mongo.findOne(new BasicQuery(filter), Document.class, collectionName)
                .doOnNext(doc -> doc.remove("_id"));
    }

    @Override
    public Mono<Long> countDocuments(Document filter) {
        return mongo.count(new BasicQuery(filter), collectionName);
    }

    @Override
    public Mono<Long> estimatedDocumentCount() {
        return mongo.estimatedCount(collectionName);
    }

    @Override
    public Flux<Document> aggregate(List<Document> pipeline) {
        // Stages are already store-native; hand them over without field mapping.
        List<AggregationOperation> stages = pipeline.stream()
                .<AggregationOperation>map(stage -> context -> stage)
                .toList();
        return mongo.aggregate(Aggregation.newAggregation(stages), collectionName, Document.class);
    }

    @Override
    public Flux<String> distinct(String field, Document filter) {
        return mongo.findDistinct(new BasicQuery(filter), field, collectionName, String.class);
    }
}
