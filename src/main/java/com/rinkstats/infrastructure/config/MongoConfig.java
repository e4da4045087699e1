package com.rinkstats.infrastructure.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * MongoDB configuration for the durable play-by-play store. Only active with
 * {@code rinkstats.mongo.enabled=true}.
 */
@Configuration
@ConditionalOnProperty(name = "rinkstats.mongo.enabled", havingValue = "true")
public class MongoConfig {

    @Value("${rinkstats.mongo.uri:mongodb://localhost:27017/?connectTimeoutMS=5000&serverSelectionTimeoutMS=5000}")
    private String mongoUri;

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient() {
        ConnectionString connectionString = new ConnectionString(mongoUri);
        MongoClientSettings settings = MongoClientSettings.builder()
            .applyConnectionString(connectionString)
            .build();
        return MongoClients.create(settings);
    }

    @Bean
    public String mongoCollectionName(@Value("${rinkstats.mongo.collection:play_by_play}") String collection) {
        return collection;
    }
}
