package com.scratchodds.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.ReplaceOptions;
import com.scratchodds.domain.model.CachedSnapshot;
import com.scratchodds.domain.model.GameRecord;
import com.scratchodds.domain.ports.SnapshotCache;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * MongoDB implementation of SnapshotCache. The snapshot lives in a single document under a
 * fixed key, so every save replaces the previous one.
 */
@Repository
public class MongoSnapshotCache implements SnapshotCache {

    private static final Logger logger = LoggerFactory.getLogger(MongoSnapshotCache.class);

    public static final String CACHE_KEY = "tx-lottery-games-cache";

    private static final ObjectMapper OBJECT_MAPPER;
    private static final TypeReference<List<GameRecord>> RECORD_LIST = new TypeReference<>() {};

    static {
        OBJECT_MAPPER = new ObjectMapper();
        OBJECT_MAPPER.registerModule(new JavaTimeModule());
    }

    private final MongoClient mongoClient;
    private final String databaseName;
    private final String collectionName;

    public MongoSnapshotCache(
            MongoClient mongoClient,
            @Value("${mongodb.database:scratchodds}") String databaseName,
            @Value("${mongodb.cache-collection:snapshotCache}") String collectionName) {
        this.mongoClient = mongoClient;
        this.databaseName = databaseName;
        this.collectionName = collectionName;
    }

    @Override
    public Optional<CachedSnapshot> load() {
        Document doc = collection().find(Filters.eq("_id", CACHE_KEY)).first();
        if (doc == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(documentToSnapshot(doc));
        } catch (RuntimeException e) {
            logger.error("Cached snapshot is unreadable, removing it", e);
            clear();
            return Optional.empty();
        }
    }

    @Override
    public void save(CachedSnapshot snapshot) {
        collection().replaceOne(
            Filters.eq("_id", CACHE_KEY),
            snapshotToDocument(snapshot),
            new ReplaceOptions().upsert(true)
        );
        logger.info("Cached snapshot with {} games", snapshot.games().size());
    }

    @Override
    public void clear() {
        collection().deleteOne(Filters.eq("_id", CACHE_KEY));
    }

    private MongoCollection<Document> collection() {
        return mongoClient.getDatabase(databaseName).getCollection(collectionName);
    }

    private Document snapshotToDocument(CachedSnapshot snapshot) {
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> games = OBJECT_MAPPER.convertValue(snapshot.games(), List.class);
        return new Document("_id", CACHE_KEY)
            .append("timestamp", Date.from(snapshot.timestamp()))
            .append("games", games);
    }

    private CachedSnapshot documentToSnapshot(Document doc) {
        Date timestamp = doc.getDate("timestamp");
        if (timestamp == null) {
            throw new IllegalStateException("Cached snapshot has no timestamp");
        }
        List<GameRecord> games = OBJECT_MAPPER.convertValue(doc.get("games"), RECORD_LIST);
        return new CachedSnapshot(games, timestamp.toInstant());
    }
}
