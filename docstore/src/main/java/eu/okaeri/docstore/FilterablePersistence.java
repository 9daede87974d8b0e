package eu.okaeri.docstore;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.FindFilter;
import eu.okaeri.docstore.filter.condition.Condition;

import java.util.stream.Stream;

/**
 * Capability interface for backends that support native filtering.
 * <p>
 * Provides WHERE, ORDER BY, LIMIT, SKIP, projection and counting operations
 * executed by the storage backend rather than in application memory.
 * The reserved field {@code _id} refers to the document path.
 */
public interface FilterablePersistence extends Persistence {

    /**
     * Find entities matching a filter.
     *
     * @param collection Target collection
     * @param filter     Find filter with conditions, ordering and projection
     * @return Stream of matching entities
     */
    Stream<PersistenceEntity<Document>> find(PersistenceCollection collection, FindFilter filter);

    /**
     * Count entities matching a condition.
     *
     * @param collection Target collection
     * @param where      Condition to match, null counts the whole collection
     * @return Number of matching entities
     */
    long count(PersistenceCollection collection, Condition where);
}
