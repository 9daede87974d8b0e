package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.condition.LogicalOperator;
import eu.okaeri.docstore.filter.predicate.Predicate;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

import static eu.okaeri.docstore.document.DocumentValueUtils.compareForSort;
import static eu.okaeri.docstore.document.DocumentValueUtils.extractValue;

/**
 * Evaluates filters in-memory for backends that don't support native query translation.
 * The document path is visible to conditions and ordering as {@code _id}.
 */
@RequiredArgsConstructor
public class InMemoryFilterEvaluator {

    private final DocumentSerializer serializer;

    /**
     * Apply WHERE, ORDER BY, SKIP, LIMIT and projection to a stream of documents in memory.
     */
    public Stream<PersistenceEntity<Document>> applyFilter(@NonNull Stream<PersistenceEntity<Document>> stream, @NonNull FindFilter filter) {
        if (filter.getWhere() != null) {
            stream = stream.filter(entity -> this.evaluateCondition(filter.getWhere(), entity.getValue()));
        }

        if (filter.hasOrderBy()) {
            stream = stream.sorted(this.buildComparator(filter.getOrderBy()));
        }

        if (filter.hasSkip()) {
            stream = stream.skip(filter.getSkip());
        }

        if (filter.hasLimit()) {
            stream = stream.limit(filter.getLimit());
        }

        if (filter.hasProjection()) {
            stream = stream.map(entity -> this.project(entity, filter.getProjection()));
        }

        return stream;
    }

    public boolean evaluateCondition(@NonNull Condition condition, @NonNull Document document) {
        return this.evaluateCondition(condition, this.toMap(document));
    }

    /**
     * Evaluate a condition against a document map, descending into nested conditions.
     */
    public boolean evaluateCondition(@NonNull Condition condition, @NonNull Map<String, Object> document) {
        Stream<Predicate> predicates = Arrays.stream(condition.getPredicates());
        if (condition.getOperator() == LogicalOperator.AND) {
            return predicates.allMatch(predicate -> this.evaluatePredicate(condition.getPath(), predicate, document));
        }
        if (condition.getOperator() == LogicalOperator.OR) {
            return predicates.anyMatch(predicate -> this.evaluatePredicate(condition.getPath(), predicate, document));
        }
        throw new IllegalArgumentException("Unsupported operator: " + condition.getOperator());
    }

    private boolean evaluatePredicate(PersistencePath path, Predicate predicate, Map<String, Object> document) {
        if (predicate instanceof Condition) {
            return this.evaluateCondition((Condition) predicate, document);
        }
        if (path == null) {
            throw new IllegalArgumentException("cannot evaluate " + predicate + " without a path");
        }
        return predicate.check(extractValue(document, path.toParts()));
    }

    /**
     * Build a comparator for ORDER BY clauses. Nulls come last in both directions.
     */
    protected Comparator<PersistenceEntity<Document>> buildComparator(@NonNull List<OrderBy> orderBys) {

        Comparator<Map<String, Object>> comparator = null;
        for (OrderBy orderBy : orderBys) {
            List<String> parts = orderBy.getPath().toParts();
            Comparator<Map<String, Object>> fieldComparator = (map1, map2) -> {
                Object val1 = extractValue(map1, parts);
                Object val2 = extractValue(map2, parts);
                if ((val1 == null) || (val2 == null)) {
                    return compareForSort(val1, val2);
                }
                int cmp = compareForSort(val1, val2);
                return (orderBy.getDirection() == OrderDirection.DESC) ? -cmp : cmp;
            };
            comparator = (comparator == null) ? fieldComparator : comparator.thenComparing(fieldComparator);
        }

        Comparator<Map<String, Object>> mapComparator = comparator;
        return (e1, e2) -> mapComparator.compare(this.toMap(e1.getValue()), this.toMap(e2.getValue()));
    }

    protected PersistenceEntity<Document> project(@NonNull PersistenceEntity<Document> entity, @NonNull Set<String> projection) {
        Map<String, Object> source = this.serializer.toMap(entity.getValue());
        Map<String, Object> target = new LinkedHashMap<>();
        for (String field : projection) {
            List<String> parts = PersistencePath.parse(field, ".").toParts();
            if (Document.ID_FIELD.equals(parts.get(0))) {
                continue;
            }
            Object value = extractValue(source, parts);
            if (value != null) {
                putValue(target, parts, value);
            }
        }
        Document document = this.serializer.fromMap(target, Document.class, entity.getValue().getCollection(), entity.getPath());
        return new PersistenceEntity<>(entity.getPath(), document);
    }

    private Map<String, Object> toMap(Document document) {
        return this.serializer.toFieldMap(document);
    }

    @SuppressWarnings("unchecked")
    private static void putValue(Map<String, Object> target, List<String> parts, Object value) {
        Map<String, Object> current = target;
        for (int i = 0; i < (parts.size() - 1); i++) {
            current = (Map<String, Object>) current.computeIfAbsent(parts.get(i), key -> new LinkedHashMap<String, Object>());
        }
        current.put(parts.get(parts.size() - 1), value);
    }
}
