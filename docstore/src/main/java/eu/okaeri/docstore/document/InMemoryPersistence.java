package eu.okaeri.docstore.document;

import eu.okaeri.docstore.FilterablePersistence;
import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.FindFilter;
import eu.okaeri.docstore.filter.InMemoryFilterEvaluator;
import eu.okaeri.docstore.filter.condition.Condition;
import lombok.Getter;
import lombok.NonNull;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * In-memory persistence backend with full filtering support.
 * Documents are stored as detached generic copies in ConcurrentHashMaps, so callers
 * mutating their entities never affect the stored state.
 */
public class InMemoryPersistence implements FilterablePersistence {

    private final @Getter DocumentSerializer serializer;
    private final InMemoryFilterEvaluator filterEvaluator;

    private final Map<String, PersistenceCollection> knownCollections = new ConcurrentHashMap<>();
    private final Map<String, Map<PersistencePath, Document>> documents = new ConcurrentHashMap<>();

    public InMemoryPersistence() {
        this(new DocumentSerializer());
    }

    public InMemoryPersistence(@NonNull DocumentSerializer serializer) {
        this.serializer = serializer;
        this.filterEvaluator = new InMemoryFilterEvaluator(serializer);
    }

    // ==================== COLLECTION MANAGEMENT ====================

    @Override
    public void registerCollection(@NonNull PersistenceCollection collection) {
        this.knownCollections.put(collection.getValue(), collection);
        this.documents.computeIfAbsent(collection.getValue(), key -> new ConcurrentHashMap<>());
    }

    private Map<PersistencePath, Document> documents(@NonNull PersistenceCollection collection) {
        Map<PersistencePath, Document> collectionDocs = this.documents.get(collection.getValue());
        if (collectionDocs == null) {
            throw new IllegalArgumentException("Collection not registered: " + collection.getValue());
        }
        return collectionDocs;
    }

    private Document detach(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        return this.serializer.fromMap(this.serializer.toMap(document), Document.class, collection, path);
    }

    // ==================== READ OPERATIONS ====================

    @Override
    public boolean exists(@NonNull PersistenceCollection collection, @NonNull PersistencePath path) {
        return this.documents(collection).containsKey(path);
    }

    @Override
    public long count(@NonNull PersistenceCollection collection) {
        return this.documents(collection).size();
    }

    @Override
    public Optional<Document> read(@NonNull PersistenceCollection collection, @NonNull PersistencePath path) {
        return Optional.ofNullable(this.documents(collection).get(path))
            .map(document -> this.detach(collection, path, document));
    }

    @Override
    public Map<PersistencePath, Document> readAll(@NonNull PersistenceCollection collection) {
        Map<PersistencePath, Document> result = new LinkedHashMap<>();
        this.documents(collection).forEach((path, document) -> result.put(path, this.detach(collection, path, document)));
        return result;
    }

    @Override
    public Stream<PersistenceEntity<Document>> streamAll(@NonNull PersistenceCollection collection) {
        return this.documents(collection).entrySet().stream()
            .map(entry -> new PersistenceEntity<>(entry.getKey(), this.detach(collection, entry.getKey(), entry.getValue())));
    }

    // ==================== FILTERING ====================

    @Override
    public Stream<PersistenceEntity<Document>> find(@NonNull PersistenceCollection collection, @NonNull FindFilter filter) {
        return this.filterEvaluator.applyFilter(this.streamAll(collection), filter);
    }

    @Override
    public long count(@NonNull PersistenceCollection collection, Condition where) {
        if (where == null) {
            return this.count(collection);
        }
        return this.documents(collection).values().stream()
            .filter(document -> this.filterEvaluator.evaluateCondition(where, document))
            .count();
    }

    // ==================== WRITE OPERATIONS ====================

    @Override
    public boolean write(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        this.serializer.setupDocument(document, collection, path);
        this.documents(collection).put(path, this.detach(collection, path, document));
        return true;
    }

    @Override
    public boolean insert(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        Document stored = this.detach(collection, path, document);
        if (this.documents(collection).putIfAbsent(path, stored) != null) {
            return false;
        }
        this.serializer.setupDocument(document, collection, path);
        return true;
    }

    @Override
    public Set<PersistencePath> insert(@NonNull PersistenceCollection collection, @NonNull Map<PersistencePath, Document> documents) {
        Set<PersistencePath> rejected = new LinkedHashSet<>();
        documents.forEach((path, document) -> {
            if (!this.insert(collection, path, document)) {
                rejected.add(path);
            }
        });
        return rejected;
    }

    @Override
    public boolean replace(@NonNull PersistenceCollection collection, @NonNull PersistencePath path, @NonNull Document document) {
        Document stored = this.detach(collection, path, document);
        if (this.documents(collection).replace(path, stored) == null) {
            return false;
        }
        this.serializer.setupDocument(document, collection, path);
        return true;
    }

    // ==================== DELETE OPERATIONS ====================

    @Override
    public boolean delete(@NonNull PersistenceCollection collection, @NonNull PersistencePath path) {
        return this.documents(collection).remove(path) != null;
    }

    @Override
    public long delete(@NonNull PersistenceCollection collection, @NonNull Collection<PersistencePath> paths) {
        return paths.stream()
            .map(path -> this.delete(collection, path))
            .filter(Predicate.isEqual(true))
            .count();
    }

    @Override
    public boolean deleteAll(@NonNull PersistenceCollection collection) {
        this.documents(collection).clear();
        return true;
    }

    @Override
    public long deleteAll() {
        return this.knownCollections.values().stream()
            .map(this::deleteAll)
            .filter(Predicate.isEqual(true))
            .count();
    }

    @Override
    public void close() {
    }
}
