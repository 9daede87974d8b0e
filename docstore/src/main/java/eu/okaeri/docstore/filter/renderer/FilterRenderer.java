package eu.okaeri.docstore.filter.renderer;

import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.FindFilter;
import eu.okaeri.docstore.filter.OrderBy;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.condition.LogicalOperator;
import eu.okaeri.docstore.filter.predicate.Predicate;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns filters into backend query text. Mongo renders JSON query documents, the default
 * renderer produces the readable form used in page fetch logging.
 */
public interface FilterRenderer {

    String renderOperator(@NonNull LogicalOperator operator);

    String renderOperator(@NonNull Predicate predicate);

    String renderCondition(@NonNull Condition condition);

    String renderPredicate(@NonNull PersistencePath path, @NonNull Predicate predicate);

    String renderOperand(@NonNull Object operand);

    String renderOrderBy(@NonNull List<OrderBy> orderBy);

    /**
     * Renders a whole page query: where, order, skip, limit and projection, skipping the parts
     * the filter does not set.
     */
    default String renderFilter(@NonNull FindFilter filter) {
        List<String> parts = new ArrayList<>();
        if (filter.getWhere() != null) {
            parts.add("where " + this.renderCondition(filter.getWhere()));
        }
        if (filter.hasOrderBy()) {
            parts.add("order by " + this.renderOrderBy(filter.getOrderBy()));
        }
        if (filter.hasSkip()) {
            parts.add("skip " + filter.getSkip());
        }
        if (filter.hasLimit()) {
            parts.add("limit " + filter.getLimit());
        }
        if (filter.hasProjection()) {
            parts.add("select " + String.join(", ", filter.getProjection()));
        }
        return String.join(" ", parts);
    }
}
