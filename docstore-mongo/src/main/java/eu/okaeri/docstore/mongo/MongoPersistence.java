package eu.okaeri.docstore.mongo;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoBulkWriteException;
import com.mongodb.MongoCommandException;
import com.mongodb.MongoWriteException;
import com.mongodb.bulk.BulkWriteError;
import com.mongodb.client.FindIterable;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.MongoIterable;
import com.mongodb.client.model.Aggregates;
import com.mongodb.client.model.CountOptions;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.InsertManyOptions;
import com.mongodb.client.model.Projections;
import com.mongodb.client.model.ReplaceOptions;
import com.mongodb.client.result.UpdateResult;
import eu.okaeri.docstore.FilterablePersistence;
import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;
import eu.okaeri.docstore.filter.FindFilter;
import eu.okaeri.docstore.filter.OrderBy;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.mongo.filter.MongoFilterRenderer;
import eu.okaeri.docstore.util.ConnectionRetry;
import lombok.Getter;
import lombok.NonNull;
import org.bson.conversions.Bson;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * MongoDB persistence backend with native filtering, ordering and counting.
 * Document paths are stored as {@code _id}.
 */
public class MongoPersistence implements FilterablePersistence {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.docstore.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(MongoPersistence.class.getSimpleName());
    private static final ReplaceOptions UPSERT = new ReplaceOptions().upsert(true);
    private static final MongoFilterRenderer FILTER_RENDERER = new MongoFilterRenderer();
    private static final int NAMESPACE_NOT_FOUND = 26;

    private final @Getter PersistencePath basePath;
    private final @Getter DocumentSerializer serializer;
    private final boolean dropIndexes;
    private @Getter MongoClient client;
    private @Getter MongoDatabase database;

    private final Map<String, PersistenceCollection> knownCollections = new ConcurrentHashMap<>();

    public MongoPersistence(@NonNull PersistencePath basePath, @NonNull MongoClient client, @NonNull String databaseName,
                            @NonNull DocumentSerializer serializer, boolean dropIndexes) {
        this.basePath = basePath;
        this.serializer = serializer;
        this.dropIndexes = dropIndexes;
        this.connect(client, databaseName);
    }

    public MongoPersistence(@NonNull MongoClient client, @NonNull String databaseName) {
        this(PersistencePath.of(""), client, databaseName, new DocumentSerializer(), false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {

        private PersistencePath basePath = PersistencePath.of("");
        private DocumentSerializer serializer;
        private MongoClient client;
        private String databaseName;
        private MongoConnectionSettings settings;
        private boolean dropIndexes;

        public Builder basePath(@NonNull String basePath) {
            return this.basePath(PersistencePath.of(basePath));
        }

        public Builder basePath(@NonNull PersistencePath basePath) {
            this.basePath = basePath;
            return this;
        }

        public Builder serializer(@NonNull DocumentSerializer serializer) {
            this.serializer = serializer;
            return this;
        }

        public Builder client(@NonNull MongoClient client) {
            this.client = client;
            return this;
        }

        public Builder databaseName(@NonNull String databaseName) {
            this.databaseName = databaseName;
            return this;
        }

        /**
         * Creates the client from settings when no client was given.
         */
        public Builder settings(@NonNull MongoConnectionSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder dropIndexes(boolean dropIndexes) {
            this.dropIndexes = dropIndexes;
            return this;
        }

        public MongoPersistence build() {
            MongoClient client = this.client;
            String databaseName = this.databaseName;
            boolean dropIndexes = this.dropIndexes;

            if (this.settings != null) {
                if (databaseName == null) {
                    databaseName = this.settings.resolveDatabase();
                }
                if (client == null) {
                    client = MongoClients.create(this.settings.toClientSettings());
                }
                dropIndexes |= this.settings.isDropIndexes();
            }

            if (client == null) {
                throw new IllegalStateException("client is required");
            }
            if (databaseName == null) {
                throw new IllegalStateException("databaseName is required");
            }

            DocumentSerializer serializer = (this.serializer == null) ? new DocumentSerializer() : this.serializer;
            return new MongoPersistence(this.basePath, client, databaseName, serializer, dropIndexes);
        }
    }

    private void connect(@NonNull MongoClient client, @NonNull String databaseName) {
        this.client = client;
        this.database = ConnectionRetry.of("mongo:" + databaseName, () -> {
                MongoDatabase database = client.getDatabase(databaseName);
                database.runCommand(new org.bson.Document("ping", 1));
                return database;
            })
            .connect();
    }

    // ==================== COLLECTION MANAGEMENT ====================

    @Override
    public void registerCollection(@NonNull PersistenceCollection collection) {
        this.knownCollections.computeIfAbsent(collection.getValue(), key -> {
            if (this.dropIndexes || collection.isDropIndexes()) {
                LOGGER.info("Dropping indexes of " + this.identifier(collection));
                try {
                    this.mongo(collection).dropIndexes();
                } catch (MongoCommandException exception) {
                    if (exception.getErrorCode() != NAMESPACE_NOT_FOUND) {
                        throw exception;
                    }
                    LOGGER.fine("Collection " + this.identifier(collection) + " does not exist yet, no indexes to drop");
                }
            }
            return collection;
        });
    }

    private void checkCollectionRegistered(@NonNull PersistenceCollection collection) {
        if (!this.knownCollections.containsKey(collection.getValue())) {
            throw new IllegalArgumentException("Collection not registered: " + collection.getValue());
        }
    }

    private String identifier(@NonNull PersistenceCollection collection) {
        return this.basePath.sub(collection).toSqlIdentifier();
    }

    private MongoCollection<org.bson.Document> mongo(@NonNull PersistenceCollection collection) {
        return this.database.getCollection(this.identifier(collection));
    }

    private String debugQuery(@NonNull String query) {
        if (DEBUG) {
            LOGGER.info("[MongoDB] " + query);
        }
        return query;
    }

    private org.bson.Document renderWhere(@NonNull Condition where) {
        return org.bson.Document.parse(this.debugQuery(FILTER_RENDERER.renderCondition(where)));
    }

    private static Bson byPath(@NonNull PersistencePath path) {
        return Filters.eq(Document.ID_FIELD, path.getValue());
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public boolean exists(@NonNull PersistenceCollection collection, @NonNull PersistencePath path) {
        this.checkCollectionRegistered(collection);
        return this.mongo(collection).countDocuments(byPath(path), new CountOptions().limit(1)) > 0;
    }

    @Override
    public long count(@NonNull PersistenceCollection collection) {
        this.checkCollectionRegistered(collection);
        return this.mongo(collection).countDocuments();
    }

    @Override
    public long count(@NonNull PersistenceCollection collection, Condition where) {
        this.checkCollectionRegistered(collection);
        if (where == null) {
            return this.mongo(collection).countDocuments();
        }
        return this.mongo(collection).countDocuments(this.renderWhere(where));
    }

    @Override
    public Optional<Document> read(@NonNull PersistenceCollection collection, @NonNull PersistencePath path) {
        this.checkCollectionRegistered(collection);
        org.bson.Document result = this.mongo(collection).find(byPath(path)).first();
        if (result == null) {
            return Optional.empty();
        }
        return Optional.of(this.transformMongoObject(collection, path, result));
    }

    @Override
    public Map<PersistencePath, Document> readAll(@NonNull PersistenceCollection collection) {
        try (Stream<PersistenceEntity<Document>> stream = this.streamAll(collection)) {
            return stream.collect(Collectors.toMap(
                PersistenceEntity::getPath,
                PersistenceEntity::getValue,
                (left, right) -> right,
                LinkedHashMap::new
            ));
        }
    }

    @Override
    public Stream<PersistenceEntity<Document>> streamAll(@NonNull PersistenceCollection collection) {
        this.checkCollectionRegistered(collection);
        return this.toStream(collection, this.mongo(collection).find());
    }

    // ==================== FILTERING ====================

    @Override
    public Stream<PersistenceEntity<Document>> find(@NonNull PersistenceCollection collection, @NonNull FindFilter filter) {
        this.checkCollectionRegistered(collection);

        if (filter.hasOrderBy() && filter.getOrderBy().stream().anyMatch(OrderBy::isNullable)) {
            return this.toStream(collection, this.aggregate(collection, filter));
        }

        FindIterable<org.bson.Document> findIterable = this.mongo(collection).find();

        if (filter.getWhere() != null) {
            findIterable = findIterable.filter(this.renderWhere(filter.getWhere()));
        }

        if (filter.hasOrderBy()) {
            findIterable = findIterable.sort(org.bson.Document.parse(this.debugQuery(FILTER_RENDERER.renderOrderBy(filter.getOrderBy()))));
        }

        if (filter.hasLimit()) {
            findIterable = findIterable.limit(filter.getLimit());
        }

        if (filter.hasSkip()) {
            findIterable = findIterable.skip(filter.getSkip());
        }

        if (filter.hasProjection()) {
            findIterable = findIterable.projection(Projections.include(new ArrayList<>(filter.getProjection())));
        }

        return this.toStream(collection, findIterable);
    }

    // nulls are ranked explicitly, plain find would sort them first in ascending order
    private MongoIterable<org.bson.Document> aggregate(@NonNull PersistenceCollection collection, @NonNull FindFilter filter) {
        List<OrderBy> orderBy = filter.getOrderBy();
        List<Bson> pipeline = new ArrayList<>();

        if (filter.getWhere() != null) {
            pipeline.add(Aggregates.match(this.renderWhere(filter.getWhere())));
        }

        pipeline.add(new org.bson.Document("$addFields", org.bson.Document.parse(this.debugQuery(FILTER_RENDERER.renderNullRanks(orderBy)))));
        pipeline.add(Aggregates.sort(org.bson.Document.parse(this.debugQuery(FILTER_RENDERER.renderOrderBy(orderBy)))));

        if (filter.hasSkip()) {
            pipeline.add(Aggregates.skip(filter.getSkip()));
        }

        if (filter.hasLimit()) {
            pipeline.add(Aggregates.limit(filter.getLimit()));
        }

        pipeline.add(Aggregates.project(filter.hasProjection()
            ? Projections.include(new ArrayList<>(filter.getProjection()))
            : Projections.exclude(FILTER_RENDERER.renderNullRankFields(orderBy))));

        return this.mongo(collection).aggregate(pipeline);
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public boolean write(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        this.checkCollectionRegistered(collection);
        UpdateResult result = this.mongo(collection).replaceOne(byPath(path), this.toMongoObject(collection, path, document), UPSERT);
        return (result.getModifiedCount() > 0) || (result.getUpsertedId() != null);
    }

    @Override
    public boolean insert(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        this.checkCollectionRegistered(collection);
        try {
            this.mongo(collection).insertOne(this.toMongoObject(collection, path, document));
            return true;
        } catch (MongoWriteException exception) {
            if (exception.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                return false;
            }
            throw exception;
        }
    }

    @Override
    public Set<PersistencePath> insert(@NonNull PersistenceCollection collection, @NonNull Map<PersistencePath, Document> documents) {
        this.checkCollectionRegistered(collection);
        if (documents.isEmpty()) {
            return Collections.emptySet();
        }

        List<PersistencePath> paths = new ArrayList<>(documents.size());
        List<org.bson.Document> objects = new ArrayList<>(documents.size());
        for (Map.Entry<PersistencePath, Document> entry : documents.entrySet()) {
            paths.add(entry.getKey());
            objects.add(this.toMongoObject(collection, entry.getKey(), entry.getValue()));
        }

        try {
            this.mongo(collection).insertMany(objects, new InsertManyOptions().ordered(false));
            return Collections.emptySet();
        } catch (MongoBulkWriteException exception) {
            Set<PersistencePath> rejected = new LinkedHashSet<>();
            for (BulkWriteError error : exception.getWriteErrors()) {
                if (error.getCategory() != ErrorCategory.DUPLICATE_KEY) {
                    throw exception;
                }
                rejected.add(paths.get(error.getIndex()));
            }
            return rejected;
        }
    }

    @Override
    public boolean replace(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        this.checkCollectionRegistered(collection);
        return this.mongo(collection)
            .replaceOne(byPath(path), this.toMongoObject(collection, path, document))
            .getMatchedCount() > 0;
    }

    // ==================== DELETE OPERATIONS ====================

    @Override
    public boolean delete(@NonNull PersistenceCollection collection, @NonNull PersistencePath path) {
        this.checkCollectionRegistered(collection);
        return this.mongo(collection)
            .deleteOne(byPath(path))
            .getDeletedCount() > 0;
    }

    @Override
    public long delete(@NonNull PersistenceCollection collection, @NonNull Collection<PersistencePath> paths) {
        this.checkCollectionRegistered(collection);
        if (paths.isEmpty()) {
            return 0;
        }

        List<String> keys = paths.stream()
            .map(PersistencePath::getValue)
            .collect(Collectors.toList());

        return this.mongo(collection)
            .deleteMany(Filters.in(Document.ID_FIELD, keys))
            .getDeletedCount();
    }

    @Override
    public boolean deleteAll(@NonNull PersistenceCollection collection) {
        this.checkCollectionRegistered(collection);
        // deleteMany keeps the indexes, drop() would not
        return this.mongo(collection).deleteMany(new org.bson.Document()).wasAcknowledged();
    }

    @Override
    public long deleteAll() {
        return this.knownCollections.values().stream()
            .map(this::deleteAll)
            .filter(Predicate.isEqual(true))
            .count();
    }

    @Override
    public void close() throws IOException {
        this.client.close();
    }

    // ==================== HELPERS ====================

    private Stream<PersistenceEntity<Document>> toStream(@NonNull PersistenceCollection collection, @NonNull MongoIterable<org.bson.Document> iterable) {
        return StreamSupport.stream(iterable
            .map(object -> {
                PersistencePath path = PersistencePath.of(String.valueOf(object.get(Document.ID_FIELD)));
                return new PersistenceEntity<>(path, this.transformMongoObject(collection, path, object));
            })
            .spliterator(), false);
    }

    private org.bson.Document toMongoObject(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        this.serializer.setupDocument(document, collection, path);
        org.bson.Document object = new org.bson.Document(Document.ID_FIELD, path.getValue());
        this.serializer.toMap(document).forEach((key, value) -> {
            if (!Document.ID_FIELD.equals(key)) {
                object.put(key, value);
            }
        });
        return object;
    }

    private Document transformMongoObject(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull org.bson.Document object) {
        Map<String, Object> data = new LinkedHashMap<>(object);
        data.remove(Document.ID_FIELD);
        return this.serializer.fromMap(data, Document.class, collection, path);
    }
}
