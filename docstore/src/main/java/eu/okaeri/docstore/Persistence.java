package eu.okaeri.docstore;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;

import java.io.Closeable;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Core persistence interface for document storage.
 * <p>
 * Backends implement this interface directly. Backends able to evaluate
 * conditions, ordering and counting natively also implement {@link FilterablePersistence},
 * which is what the pagination engine and the repository layer require.
 */
public interface Persistence extends Closeable {

    // ==================== COLLECTION MANAGEMENT ====================

    /**
     * Register a collection to be tracked by persistence.
     * Backends may create tables, indexes, or other structures as needed.
     *
     * @param collection Collection to be registered
     */
    void registerCollection(PersistenceCollection collection);

    /**
     * Get the document serializer used by this backend.
     *
     * @return The document serializer
     */
    DocumentSerializer getSerializer();

    // ==================== READ OPERATIONS ====================

    /**
     * Check if an entity exists at the given path.
     *
     * @param collection Target collection
     * @param path       Entity path (key)
     * @return True if entity exists
     */
    boolean exists(PersistenceCollection collection, PersistencePath path);

    /**
     * Count all entities in a collection.
     *
     * @param collection Target collection
     * @return Number of entities
     */
    long count(PersistenceCollection collection);

    /**
     * Read a single entity by path.
     *
     * @param collection Target collection
     * @param path       Entity path (key)
     * @return Entity if found, empty otherwise
     */
    Optional<Document> read(PersistenceCollection collection, PersistencePath path);

    /**
     * Read all entities in a collection.
     *
     * @param collection Target collection
     * @return Map of all entities
     */
    Map<PersistencePath, Document> readAll(PersistenceCollection collection);

    /**
     * Stream all entities in a collection.
     *
     * @param collection Target collection
     * @return Stream of entities
     */
    Stream<PersistenceEntity<Document>> streamAll(PersistenceCollection collection);

    // ==================== WRITE OPERATIONS ====================

    /**
     * Write a single entity to the collection.
     * If the entity exists, it will be replaced.
     *
     * @param collection Target collection
     * @param path       Entity path (key)
     * @param document   Document to save
     * @return True if the write changed the store
     */
    boolean write(PersistenceCollection collection, PersistencePath path, Document document);

    /**
     * Insert a new entity. Existing entities are left untouched.
     *
     * @param collection Target collection
     * @param path       Entity path (key)
     * @param document   Document to insert
     * @return False if an entity already exists at the path
     */
    boolean insert(PersistenceCollection collection, PersistencePath path, Document document);

    /**
     * Insert multiple entities without stopping at the first failure.
     *
     * @param collection Target collection
     * @param documents  Map of path to document, iteration order is the insertion order
     * @return Paths that were rejected because an entity already existed
     */
    Set<PersistencePath> insert(PersistenceCollection collection, Map<PersistencePath, Document> documents);

    /**
     * Replace an existing entity. Nothing is written when the path is unknown.
     *
     * @param collection Target collection
     * @param path       Entity path (key)
     * @param document   New document state
     * @return True if an entity was matched
     */
    boolean replace(PersistenceCollection collection, PersistencePath path, Document document);

    // ==================== DELETE OPERATIONS ====================

    /**
     * Delete a single entity by path.
     *
     * @param collection Target collection
     * @param path       Entity path (key)
     * @return True if entity was deleted
     */
    boolean delete(PersistenceCollection collection, PersistencePath path);

    /**
     * Delete multiple entities by paths (batch operation).
     *
     * @param collection Target collection
     * @param paths      Entity paths (keys)
     * @return Number of entities deleted
     */
    long delete(PersistenceCollection collection, Collection<PersistencePath> paths);

    /**
     * Delete all entities in a collection (truncate).
     *
     * @param collection Target collection
     * @return True if collection was cleared
     */
    boolean deleteAll(PersistenceCollection collection);

    /**
     * Delete all entities in all registered collections.
     *
     * @return Number of collections cleared
     */
    long deleteAll();
}
