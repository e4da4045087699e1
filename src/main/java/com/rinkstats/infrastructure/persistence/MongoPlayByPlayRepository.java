package com.rinkstats.infrastructure.persistence;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.BulkWriteOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.InsertOneModel;
import com.mongodb.client.model.Sorts;
import com.mongodb.client.model.WriteModel;
import com.rinkstats.domain.model.EnrichedEvent;
import com.rinkstats.domain.model.GameId;
import com.rinkstats.domain.ports.PlayByPlayRepository;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * MongoDB implementation of PlayByPlayRepository. One document per enriched event, keyed by game
 * and event index; saving a game replaces all of its documents.
 */
@Repository
@ConditionalOnProperty(name = "rinkstats.mongo.enabled", havingValue = "true")
public class MongoPlayByPlayRepository implements PlayByPlayRepository {

    private static final Logger logger = LoggerFactory.getLogger(MongoPlayByPlayRepository.class);
    private static final ObjectMapper OBJECT_MAPPER;
    private static final int BATCH_SIZE = 500;

    static final String GAME_ID = "gameId";
    static final String EVENT_IDX = "eventIdx";

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoPlayByPlayRepository(
            MongoClient mongoClient,
            String mongoCollectionName,
            @Value("${rinkstats.mongo.database:rinkstats}") String databaseName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = mongoCollectionName;

        initializeIndexes();
    }

    private void initializeIndexes() {
        try {
            collection().createIndex(
                Indexes.compoundIndex(Indexes.ascending(GAME_ID), Indexes.ascending(EVENT_IDX)),
                new IndexOptions().unique(true).background(true)
            );
            logger.info("MongoDB indexes initialized for collection: {}", collectionName);
        } catch (Exception e) {
            logger.warn("Failed to create indexes (may already exist): {}", e.getMessage());
        }
    }

    @Override
    public int saveGame(GameId gameId, List<EnrichedEvent> events) {
        MongoCollection<Document> collection = collection();
        long deleted = collection.deleteMany(Filters.eq(GAME_ID, gameId.toString())).getDeletedCount();
        if (deleted > 0) {
            logger.debug("Removed {} stored events of {}", deleted, gameId);
        }
        if (events == null || events.isEmpty()) {
            return 0;
        }

        int written = 0;
        for (int i = 0; i < events.size(); i += BATCH_SIZE) {
            List<EnrichedEvent> batch = events.subList(i, Math.min(i + BATCH_SIZE, events.size()));
            List<WriteModel<Document>> writes = new ArrayList<>(batch.size());
            for (EnrichedEvent event : batch) {
                writes.add(new InsertOneModel<>(eventToDocument(event)));
            }
            written += collection.bulkWrite(writes, new BulkWriteOptions().ordered(true)).getInsertedCount();
        }
        logger.info("Stored {} events of {} in batches of {}", written, gameId, BATCH_SIZE);
        return written;
    }

    @Override
    public List<EnrichedEvent> findByGameId(GameId gameId) {
        List<EnrichedEvent> events = new ArrayList<>();
        for (Document document : collection().find(Filters.eq(GAME_ID, gameId.toString()))
                .sort(Sorts.ascending(EVENT_IDX))) {
            events.add(documentToEvent(document));
        }
        return events;
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    static Document eventToDocument(EnrichedEvent event) {
        @SuppressWarnings("unchecked")
        Map<String, Object> map = OBJECT_MAPPER.convertValue(event, Map.class);
        Document document = new Document(map);
        document.put(GAME_ID, event.getGameId().toString());
        document.put(EVENT_IDX, event.getEvent().getEventIdx());
        return document;
    }

    static EnrichedEvent documentToEvent(Document document) {
        Document copy = new Document(document);
        copy.remove("_id");
        return OBJECT_MAPPER.convertValue(copy, EnrichedEvent.class);
    }
}
