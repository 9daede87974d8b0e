package eu.okaeri.docstore.repository;

import eu.okaeri.docstore.FilterablePersistence;
import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;
import eu.okaeri.docstore.filter.FindFilter;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.predicate.SimplePredicate;
import eu.okaeri.docstore.pagination.PageQuery;
import eu.okaeri.docstore.pagination.PageRequest;
import eu.okaeri.docstore.pagination.PaginatedResponse;
import eu.okaeri.docstore.pagination.PaginationParams;
import eu.okaeri.docstore.pagination.PaginatorRegistry;
import eu.okaeri.docstore.pagination.SortSpecification;
import eu.okaeri.docstore.schema.DocumentSchema;
import eu.okaeri.docstore.schema.FilterModel;
import eu.okaeri.docstore.schema.SchemaField;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Getter
@RequiredArgsConstructor
public class DefaultDocumentRepository<T extends Document> implements DocumentRepository<T> {

    private static final Logger LOGGER = Logger.getLogger(DefaultDocumentRepository.class.getSimpleName());

    private final FilterablePersistence persistence;
    private final PersistenceCollection collection;
    private final Class<T> documentType;
    private final DocumentSchema schema;
    private final PaginatorRegistry paginators;

    public DefaultDocumentRepository(@NonNull FilterablePersistence persistence, @NonNull PersistenceCollection collection,
                                     @NonNull Class<T> documentType, @NonNull DocumentSchema schema) {
        this(persistence, collection, documentType, schema, PaginatorRegistry.defaults());
    }

    private static PersistencePath toPath(Object object) {
        if (object instanceof PersistencePath) {
            return (PersistencePath) object;
        }
        return PersistencePath.of(String.valueOf(object));
    }

    private static Condition byId(PersistencePath path) {
        return Condition.on(Document.ID_FIELD, SimplePredicate.eq(path.getValue()));
    }

    private DocumentSerializer serializer() {
        return this.persistence.getSerializer();
    }

    private T convert(PersistenceEntity<Document> entity) {
        Document document = entity.getValue();
        this.serializer().setupDocument(document, this.collection, entity.getPath());
        return this.serializer().into(document, this.documentType);
    }

    @Override
    public long count() {
        return this.persistence.count(this.collection);
    }

    @Override
    public boolean exists(@NonNull Object id) {
        return this.persistence.exists(this.collection, toPath(id));
    }

    @Override
    public boolean exists(@NonNull Object id, boolean shouldError) {
        boolean exists = this.exists(id);
        if (!exists && shouldError) {
            throw new EntityNotFoundException(this.collection, id);
        }
        return exists;
    }

    @Override
    public T get(@NonNull Object id) {
        return this.find(id).orElseThrow(() -> new EntityNotFoundException(this.collection, id));
    }

    @Override
    public T get(@NonNull Object id, Collection<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return this.get(id);
        }
        FindFilter filter = FindFilter.builder()
            .where(byId(toPath(id)))
            .limit(1)
            .projection(this.projection(fields, null))
            .build();
        try (Stream<PersistenceEntity<Document>> stream = this.persistence.find(this.collection, filter)) {
            return stream.findFirst()
                .map(this::convert)
                .orElseThrow(() -> new EntityNotFoundException(this.collection, id));
        }
    }

    @Override
    public Optional<T> find(@NonNull Object id) {
        PersistencePath path = toPath(id);
        return this.persistence.read(this.collection, path)
            .map(document -> this.convert(new PersistenceEntity<>(path, document)));
    }

    @Override
    public Optional<T> findOne(@NonNull Condition condition) {
        FindFilter filter = FindFilter.builder().where(condition).limit(1).build();
        try (Stream<PersistenceEntity<Document>> stream = this.persistence.find(this.collection, filter)) {
            return stream.findFirst().map(this::convert);
        }
    }

    @Override
    public PaginatedResponse<T> list(@NonNull PaginationParams pagination, Collection<String> fields, List<String> sorting, Map<String, ?> filtering) {
        Condition where = (filtering == null) ? null : FilterModel.of(this.schema).toCondition(filtering);
        return this.list(pagination, fields, sorting, where);
    }

    @Override
    public PaginatedResponse<T> list(@NonNull PaginationParams pagination, Collection<String> fields, List<String> sorting, Condition where) {
        SortSpecification sort = SortSpecification.parse(this.schema, sorting);

        PageQuery query = PageQuery.builder()
            .persistence(this.persistence)
            .collection(this.collection)
            .where(where)
            .projection(this.projection(fields, sort))
            .build();

        PageRequest request = PageRequest.builder()
            .sorting(sort)
            .limit(pagination.getLimit())
            .next(pagination.getNext())
            .reversed(pagination.isReversed())
            .build();

        return this.paginators.resolve(pagination.getStrategy())
            .getPage(query, request)
            .map(document -> this.serializer().into(document, this.documentType));
    }

    @Override
    public CompletableFuture<PaginatedResponse<T>> listAsync(@NonNull PaginationParams pagination, Collection<String> fields, List<String> sorting,
                                                             Condition where, @NonNull Executor executor) {
        return CompletableFuture.supplyAsync(() -> this.list(pagination, fields, sorting, where), executor);
    }

    // the identifier is always returned as the document path, sort fields are needed for cursors
    private Set<String> projection(Collection<String> fields, SortSpecification sort) {
        if (fields == null || fields.isEmpty()) {
            return null;
        }
        Set<String> names = new LinkedHashSet<>(fields);
        if (sort != null) {
            names.addAll(sort.getNames());
        }
        Set<String> paths = new LinkedHashSet<>();
        for (String name : names) {
            SchemaField field = this.schema.getField(name)
                .orElseThrow(() -> new IllegalArgumentException("unknown field: '" + name + "'"));
            if (!field.isIdentifier()) {
                paths.add(field.getPath().toMongoPath());
            }
        }
        return paths;
    }

    @Override
    public T add(@NonNull T entity) {
        if (entity.getPath() == null) {
            entity.setPath(PersistencePath.objectId());
        }
        entity.setCollection(this.collection);
        if (!this.persistence.insert(this.collection, entity.getPath(), entity)) {
            throw new EntityAlreadyExistsException(this.collection, entity.getId());
        }
        return entity;
    }

    @Override
    public boolean delete(@NonNull T entity) {
        if (entity.getPath() == null) {
            return false;
        }
        return this.persistence.delete(this.collection, entity.getPath());
    }

    @Override
    public boolean deleteById(@NonNull Object id) {
        return this.persistence.delete(this.collection, toPath(id));
    }

    @Override
    public T update(@NonNull T entity) {
        if (entity.getPath() == null || !this.persistence.replace(this.collection, entity.getPath(), entity)) {
            throw new EntityNotFoundException(this.collection, entity.getId());
        }
        return entity;
    }

    @Override
    public T update(@NonNull Object id, @NonNull Consumer<T> changes) {
        T entity = this.get(id);
        changes.accept(entity);
        return this.update(entity);
    }

    @Override
    public BulkResponse bulkCreate(@NonNull List<T> entities) {
        Map<PersistencePath, Document> documents = new LinkedHashMap<>();
        List<BulkItem> items = new ArrayList<>();
        for (T entity : entities) {
            if (entity.getPath() == null) {
                entity.setPath(PersistencePath.objectId());
            }
            entity.setCollection(this.collection);
            if (documents.putIfAbsent(entity.getPath(), entity) != null) {
                items.add(BulkItem.error(entity.getId(), "duplicate id in request"));
            } else {
                items.add(null);
            }
        }

        Set<PersistencePath> rejected = this.persistence.insert(this.collection, documents);
        for (int i = 0; i < entities.size(); i++) {
            if (items.get(i) != null) {
                continue;
            }
            T entity = entities.get(i);
            items.set(i, rejected.contains(entity.getPath())
                ? BulkItem.error(entity.getId(), "already exists")
                : BulkItem.success(entity.getId()));
        }

        BulkResponse response = BulkResponse.of(items);
        if (response.isHasErrors()) {
            this.logErrors("create", response);
        }
        return response;
    }

    @Override
    public BulkResponse bulkUpdate(@NonNull List<T> entities, boolean upsert) {
        List<BulkItem> items = new ArrayList<>();
        for (T entity : entities) {
            if (entity.getPath() == null) {
                items.add(BulkItem.error(null, "missing id"));
                continue;
            }
            entity.setCollection(this.collection);
            boolean written = true;
            if (upsert) {
                this.persistence.write(this.collection, entity.getPath(), entity);
            } else {
                written = this.persistence.replace(this.collection, entity.getPath(), entity);
            }
            items.add(written ? BulkItem.success(entity.getId()) : BulkItem.error(entity.getId(), "not found"));
        }
        BulkResponse response = BulkResponse.of(items);
        if (response.isHasErrors()) {
            this.logErrors("update", response);
        }
        return response;
    }

    @Override
    public long bulkDelete(@NonNull Collection<?> ids) {
        Set<PersistencePath> paths = ids.stream()
            .map(DefaultDocumentRepository::toPath)
            .collect(Collectors.toCollection(LinkedHashSet::new));
        return this.persistence.delete(this.collection, paths);
    }

    @Override
    public BulkResponse bulkUpsert(@NonNull List<T> entities, UnaryOperator<T> onInsert) {
        List<BulkItem> items = new ArrayList<>();
        for (T entity : entities) {
            if (entity.getPath() == null) {
                entity.setPath(PersistencePath.objectId());
            }
            entity.setCollection(this.collection);
            if (this.persistence.replace(this.collection, entity.getPath(), entity)) {
                items.add(BulkItem.success(entity.getId()));
                continue;
            }
            T inserted = (onInsert == null) ? entity : onInsert.apply(entity);
            inserted.setPath(entity.getPath());
            inserted.setCollection(this.collection);
            // lost a race against a concurrent insert, retry as a replace
            boolean written = this.persistence.insert(this.collection, inserted.getPath(), inserted)
                || this.persistence.replace(this.collection, entity.getPath(), entity);
            items.add(written ? BulkItem.success(entity.getId()) : BulkItem.error(entity.getId(), "concurrently deleted"));
        }
        BulkResponse response = BulkResponse.of(items);
        if (response.isHasErrors()) {
            this.logErrors("upsert", response);
        }
        return response;
    }

    private void logErrors(String operation, BulkResponse response) {
        if (!LOGGER.isLoggable(Level.WARNING)) {
            return;
        }
        List<String> failed = response.getItems().stream()
            .filter(BulkItem::isError)
            .map(item -> item.getId() + " (" + item.getDetail() + ")")
            .collect(Collectors.toList());
        LOGGER.warning("Bulk " + operation + " in " + this.collection.getValue() + " failed for " + failed.size() + " item(s): " + failed);
    }
}
