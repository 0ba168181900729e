package com.example.catalog.config;

import com.example.catalog.access.AccessPolicy;
import com.example.catalog.access.AllowListAccessPolicy;
import com.example.catalog.access.UnrestrictedAccessPolicy;
import com.example.catalog.persistence.dao.CatalogCollections;
import com.example.catalog.query.QueryRegistry;
import com.example.catalog.remote.RemoteArrayClient;
import com.example.catalog.tree.MongoCatalog;
import com.mongodb.reactivestreams.client.MongoClient;
import com.mongodb.reactivestreams.client.MongoClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.web.reactive.function.client.WebClientAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.web.reactive.function.client.WebClient;

@AutoConfiguration(after = WebClientAutoConfiguration.class)
@EnableConfigurationProperties(CatalogProperties.class)
public class CatalogAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(CatalogAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public QueryRegistry catalogQueryRegistry() {
        return QueryRegistry.withDefaults();
    }

    @Bean
    @ConditionalOnMissingBean(AccessPolicy.class)
    @ConditionalOnProperty(prefix = "catalog.access", name = "policy", havingValue = "unrestricted")
    public AccessPolicy unrestrictedAccessPolicy() {
        return new UnrestrictedAccessPolicy();
    }

    @Bean
    @ConditionalOnMissingBean(AccessPolicy.class)
    @ConditionalOnProperty(prefix = "catalog.access", name = "policy", havingValue = "allow-list")
    public AccessPolicy allowListAccessPolicy(CatalogProperties props) {
        return new AllowListAccessPolicy(props.access().accessLists());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnProperty(prefix = "catalog", name = "metadatastore-uri")
    public MongoClient catalogMongoClient(CatalogProperties props) {
        StoreUris.databaseName(props.metadatastoreUri());
        return MongoClients.create(props.metadatastoreUri());
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "catalog", name = "metadatastore-uri")
    public MongoCatalog mongoCatalog(MongoClient catalogMongoClient,
                                     CatalogProperties props,
                                     QueryRegistry queryRegistry,
                                     ObjectProvider<AccessPolicy> accessPolicy) {
        ReactiveMongoTemplate template = StoreUris.operations(catalogMongoClient, props.metadatastoreUri());
        AccessPolicy policy = accessPolicy.getIfAvailable();
        log.info("catalog on database {} (policy={}, batchSize={})",
                StoreUris.databaseName(props.metadatastoreUri()), policy, props.cursor().batchSize());
        return MongoCatalog.builder(CatalogCollections.of(template))
                .queryRegistry(queryRegistry)
                .accessPolicy(policy)
                .settings(props.settings())
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "catalog.remote", name = "base-url")
    public RemoteArrayClient remoteArrayClient(ObjectProvider<WebClient.Builder> builder, CatalogProperties props) {
        WebClient webClient = builder.getIfAvailable(WebClient::builder)
                .baseUrl(props.remote().baseUrl())
                .build();
        log.info("remote arrays at {}", props.remote().baseUrl());
        return new RemoteArrayClient(webClient, props);
    }
}
