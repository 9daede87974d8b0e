package eu.okaeri.docstore.repository;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.pagination.PaginatedResponse;
import eu.okaeri.docstore.pagination.PaginationParams;
import lombok.NonNull;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Generic data access for a single document collection.
 * Identifiers are document paths, any object is accepted and converted with {@code String.valueOf}.
 */
public interface DocumentRepository<T extends Document> {

    long count();

    boolean exists(@NonNull Object id);

    /**
     * @param shouldError throw instead of returning false
     * @throws EntityNotFoundException if the entity is missing and {@code shouldError} is set
     */
    boolean exists(@NonNull Object id, boolean shouldError);

    /**
     * @throws EntityNotFoundException if the entity is missing
     */
    T get(@NonNull Object id);

    /**
     * Reads the entity with only the given fields populated.
     *
     * @throws EntityNotFoundException if the entity is missing
     */
    T get(@NonNull Object id, Collection<String> fields);

    Optional<T> find(@NonNull Object id);

    Optional<T> findOne(@NonNull Condition condition);

    /**
     * Lists a page of entities.
     *
     * @param pagination strategy, limit and cursor
     * @param fields     projected fields, null for whole entities
     * @param sorting    sort expressions, e.g. {@code -createdAt}, defaults to {@code +id}
     * @param filtering  equality filter by field name, null or empty for none
     */
    PaginatedResponse<T> list(@NonNull PaginationParams pagination, Collection<String> fields, List<String> sorting, Map<String, ?> filtering);

    PaginatedResponse<T> list(@NonNull PaginationParams pagination, Collection<String> fields, List<String> sorting, Condition where);

    CompletableFuture<PaginatedResponse<T>> listAsync(@NonNull PaginationParams pagination, Collection<String> fields, List<String> sorting,
                                                      Condition where, @NonNull Executor executor);

    /**
     * Inserts a new entity, generating an object id when it has no path.
     *
     * @throws EntityAlreadyExistsException if an entity with the same id exists
     */
    T add(@NonNull T entity);

    boolean delete(@NonNull T entity);

    boolean deleteById(@NonNull Object id);

    /**
     * Replaces the stored state of an existing entity.
     *
     * @throws EntityNotFoundException if the entity does not exist
     */
    T update(@NonNull T entity);

    /**
     * Reads, modifies and replaces an entity.
     *
     * @throws EntityNotFoundException if the entity does not exist
     */
    T update(@NonNull Object id, @NonNull Consumer<T> changes);

    /**
     * Unordered insert: every item is attempted, failures are reported per item.
     */
    BulkResponse bulkCreate(@NonNull List<T> entities);

    /**
     * Replaces every entity, inserting missing ones only with {@code upsert}.
     */
    BulkResponse bulkUpdate(@NonNull List<T> entities, boolean upsert);

    long bulkDelete(@NonNull Collection<?> ids);

    /**
     * Replaces existing entities and inserts missing ones, passed through {@code onInsert} first.
     */
    BulkResponse bulkUpsert(@NonNull List<T> entities, UnaryOperator<T> onInsert);
}
