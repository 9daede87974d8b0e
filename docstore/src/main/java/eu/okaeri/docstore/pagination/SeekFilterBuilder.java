package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.filter.OrderDirection;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.predicate.Predicate;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

import static eu.okaeri.docstore.filter.predicate.SimplePredicate.eq;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.gt;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.isNull;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.lt;
import static eu.okaeri.docstore.filter.predicate.SimplePredicate.notNull;

/**
 * Builds the seek condition selecting documents strictly after a cursor.
 * <p>
 * For sort fields {@code f1..fn} the result is {@code c1 OR c2 OR ... OR cn} where clause
 * {@code ci} requires equality on {@code f1..f(i-1)} and an ordering comparison on
 * {@code fi}. Null values sort after every non-null value in both directions:
 * <ul>
 *   <li>non-null boundary: {@code fi > v} (ascending) or {@code fi < v} (descending),
 *   widened with {@code fi == null} when the field is nullable</li>
 *   <li>null boundary: nothing sorts after it, the clause is left out</li>
 * </ul>
 * In index query mode the fields are expected to be inverted and the condition selects
 * documents before the cursor in the original order, so nulls are never included by a
 * non-null boundary and a null boundary is preceded by every non-null value.
 */
public class SeekFilterBuilder {

    /**
     * @throws MalformedCursorException if the cursor does not match the fields
     */
    public Condition build(@NonNull List<SortField> fields, @NonNull Cursor cursor, boolean indexQuery) {

        if (cursor.size() != fields.size()) {
            throw new MalformedCursorException("cursor has " + cursor.size() + " field(s), sorting expects " + fields.size());
        }

        List<Predicate> clauses = new ArrayList<>();
        List<Predicate> prefix = new ArrayList<>();

        for (int i = 0; i < fields.size(); i++) {
            SortField field = fields.get(i);
            Object value = cursor.getValue(i);

            Condition comparison = this.comparison(field, value, indexQuery);
            if (comparison != null) {
                List<Predicate> clause = new ArrayList<>(prefix);
                clause.add(comparison);
                clauses.add((clause.size() == 1) ? comparison : Condition.and(clause));
            }

            if (field.isIdentifier()) {
                break;
            }
            prefix.add(Condition.on(field.getPath(), (value == null) ? isNull() : eq(value)));
        }

        if (clauses.isEmpty()) {
            throw new IllegalStateException("cursor " + cursor + " cannot be positioned, sort fields: " + fields);
        }

        return (clauses.size() == 1) ? (Condition) clauses.get(0) : Condition.or(clauses);
    }

    private Condition comparison(SortField field, Object value, boolean indexQuery) {

        if (value == null) {
            return indexQuery ? Condition.on(field.getPath(), notNull()) : null;
        }

        Predicate compare = (field.getDirection() == OrderDirection.ASC) ? gt(value) : lt(value);
        if (field.isNullable() && !indexQuery) {
            return Condition.or(field.getPath(), isNull(), compare);
        }
        return Condition.on(field.getPath(), compare);
    }
}
