package com.rinkstats;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.mongo.MongoDataAutoConfiguration;
import org.springframework.boot.autoconfigure.mongo.MongoAutoConfiguration;

/**
 * Main Spring Boot application for the play-by-play scraping service. MongoDB is wired by
 * {@code MongoConfig} only when enabled.
 */
@SpringBootApplication(exclude = {MongoAutoConfiguration.class, MongoDataAutoConfiguration.class})
public class RinkStatsApplication {

    public static void main(String[] args) {
        SpringApplication.run(RinkStatsApplication.class, args);
    }
}
