package io.livedoc.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.ConnectionString;
import com.mongodb.ErrorCategory;
import com.mongodb.MongoClientSettings;
import com.mongodb.MongoException;
import com.mongodb.MongoNodeIsRecoveringException;
import com.mongodb.MongoNotPrimaryException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.FindOneAndUpdateOptions;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.ReturnDocument;
import com.mongodb.client.model.Sorts;
import io.livedoc.config.LiveDocConfig;
import io.livedoc.domain.model.ChangeEvent;
import io.livedoc.domain.model.ChangeRecord;
import io.livedoc.domain.model.StoreDocument;
import org.bson.Document;
import org.bson.json.JsonMode;
import org.bson.json.JsonWriterSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import static com.mongodb.client.model.Filters.and;
import static com.mongodb.client.model.Filters.eq;
import static com.mongodb.client.model.Filters.gt;
import static com.mongodb.client.model.Updates.combine;
import static com.mongodb.client.model.Updates.inc;
import static com.mongodb.client.model.Updates.set;

/**
 * MongoDB-backed document store.
 *
 * Collections:
 * - documents: _id = resource id, revision, body, updatedAt
 * - changes:   _id = seq, resourceId, revision, payload, committedAt (TTL on committedAt)
 * - counters:  _id = "changes", seq
 *
 * Connection pooling is the driver's own pool, sized from STORE_POOL_SIZE.
 */
public final class MongoDocumentStore implements DocumentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoDocumentStore.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final JsonWriterSettings RELAXED = JsonWriterSettings.builder().outputMode(JsonMode.RELAXED).build();

    static final String DOCUMENTS = "documents";
    static final String CHANGES = "changes";
    static final String COUNTERS = "counters";
    private static final String CHANGE_COUNTER_ID = "changes";

    private final MongoClient client;
    private final MongoDatabase database;
    private final MongoCollection<Document> documents;
    private final MongoCollection<Document> changes;
    private final MongoCollection<Document> counters;

    public MongoDocumentStore(LiveDocConfig config) {
        this(MongoClients.create(settings(config)), config.dbName());
        ensureIndexes(config);
    }

    MongoDocumentStore(MongoClient client, String dbName) {
        this.client = client;
        this.database = client.getDatabase(dbName);
        this.documents = database.getCollection(DOCUMENTS);
        this.changes = database.getCollection(CHANGES);
        this.counters = database.getCollection(COUNTERS);
    }

    private static MongoClientSettings settings(LiveDocConfig config) {
        long timeoutMs = config.storeTimeout().toMillis();
        log.info("[MONGO] Client: uri={}, db={}, pool={}, timeout={}ms",
            config.dbUri(), config.dbName(), config.storePoolSize(), timeoutMs);
        return MongoClientSettings.builder()
            .applyConnectionString(new ConnectionString(config.dbUri()))
            .applyToConnectionPoolSettings(b -> b
                .maxSize(config.storePoolSize())
                .maxWaitTime(timeoutMs, TimeUnit.MILLISECONDS))
            .applyToClusterSettings(b -> b.serverSelectionTimeout(timeoutMs, TimeUnit.MILLISECONDS))
            .applyToSocketSettings(b -> b
                .connectTimeout((int) timeoutMs, TimeUnit.MILLISECONDS)
                .readTimeout((int) timeoutMs, TimeUnit.MILLISECONDS))
            .build();
    }

    private void ensureIndexes(LiveDocConfig config) {
        try {
            changes.createIndex(Indexes.ascending("committedAt"),
                new IndexOptions().name("changes_ttl").expireAfter(config.changeRetention().getSeconds(), TimeUnit.SECONDS));
            changes.createIndex(Indexes.ascending("resourceId", "revision"), new IndexOptions().name("changes_resource"));
        } catch (MongoException e) {
            // Store may not be up yet; indexes are created again on the next start
            log.warn("[MONGO] Could not ensure indexes: {}", e.getMessage());
        }
    }

    @Override
    public StoreDocument write(String resourceId, JsonNode body, Long expectedRevision) {
        return call("write", () -> {
            Object bsonBody = toBson(body);
            Date now = new Date();
            if (expectedRevision == null) {
                Document saved = documents.findOneAndUpdate(
                    eq("_id", resourceId),
                    combine(set("body", bsonBody), set("updatedAt", now), inc("revision", 1L)),
                    new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER));
                return toStoreDocument(saved);
            }
            if (expectedRevision == 0L) {
                Document doc = new Document("_id", resourceId)
                    .append("revision", 1L)
                    .append("body", bsonBody)
                    .append("updatedAt", now);
                try {
                    documents.insertOne(doc);
                } catch (MongoWriteException e) {
                    if (e.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                        throw new RevisionConflictException(resourceId, 0L, currentRevision(resourceId));
                    }
                    throw e;
                }
                return toStoreDocument(doc);
            }
            Document saved = documents.findOneAndUpdate(
                and(eq("_id", resourceId), eq("revision", expectedRevision)),
                combine(set("body", bsonBody), set("updatedAt", now), inc("revision", 1L)),
                new FindOneAndUpdateOptions().returnDocument(ReturnDocument.AFTER));
            if (saved == null) {
                throw new RevisionConflictException(resourceId, expectedRevision, currentRevision(resourceId));
            }
            return toStoreDocument(saved);
        });
    }

    @Override
    public Optional<StoreDocument> read(String resourceId) {
        return call("read", () -> Optional.ofNullable(documents.find(eq("_id", resourceId)).first())
            .map(MongoDocumentStore::toStoreDocument));
    }

    @Override
    public long appendChange(ChangeEvent event) {
        return call("appendChange", () -> {
            Document counter = counters.findOneAndUpdate(
                eq("_id", CHANGE_COUNTER_ID),
                inc("seq", 1L),
                new FindOneAndUpdateOptions().upsert(true).returnDocument(ReturnDocument.AFTER));
            long seq = counter.get("seq", Number.class).longValue();
            changes.insertOne(new Document("_id", seq)
                .append("resourceId", event.resourceId())
                .append("revision", event.revision())
                .append("payload", toBson(event.payload()))
                .append("committedAt", Date.from(event.committedAt())));
            return seq;
        });
    }

    @Override
    public List<ChangeRecord> changesAfter(long afterSeq, int limit) {
        return call("changesAfter", () -> {
            List<ChangeRecord> result = new ArrayList<>();
            for (Document d : changes.find(gt("_id", afterSeq)).sort(Sorts.ascending("_id")).limit(limit)) {
                ChangeEvent event = new ChangeEvent(
                    d.getString("resourceId"),
                    d.get("revision", Number.class).longValue(),
                    fromBson(d.get("payload")),
                    d.getDate("committedAt").toInstant());
                result.add(new ChangeRecord(d.get("_id", Number.class).longValue(), event));
            }
            return result;
        });
    }

    @Override
    public long latestChangeSeq() {
        return call("latestChangeSeq", () -> {
            Document counter = counters.find(eq("_id", CHANGE_COUNTER_ID)).first();
            return counter == null ? 0L : counter.get("seq", Number.class).longValue();
        });
    }

    @Override
    public boolean ping() {
        try {
            database.runCommand(new Document("ping", 1));
            return true;
        } catch (MongoException e) {
            log.debug("[MONGO] ping failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Documents collection, for native change stream tailing.
     */
    public MongoCollection<Document> documentsCollection() {
        return documents;
    }

    @Override
    public void close() {
        client.close();
    }

    private long currentRevision(String resourceId) {
        Document current = documents.find(eq("_id", resourceId)).first();
        return current == null ? 0L : current.get("revision", Number.class).longValue();
    }

    public static StoreDocument toStoreDocument(Document d) {
        Date updatedAt = d.getDate("updatedAt");
        return new StoreDocument(
            d.getString("_id"),
            d.get("revision", Number.class).longValue(),
            fromBson(d.get("body")),
            updatedAt == null ? Instant.now() : updatedAt.toInstant());
    }

    private static Object toBson(JsonNode node) {
        if (node == null) {
            return null;
        }
        // Wrap so that arrays and scalars parse as well as objects
        return Document.parse("{\"v\": " + node.toString() + "}").get("v");
    }

    private static JsonNode fromBson(Object value) {
        try {
            String json = new Document("v", value).toJson(RELAXED);
            return MAPPER.readTree(json).get("v");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored body is not valid JSON", e);
        }
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (MongoTimeoutException | MongoSocketException
                 | MongoNotPrimaryException | MongoNodeIsRecoveringException e) {
            throw new StoreUnavailableException(operation, e.getMessage(), e);
        }
    }
}
