package eu.okaeri.docstore.mongo.filter;

import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.OrderBy;
import eu.okaeri.docstore.filter.OrderDirection;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.condition.LogicalOperator;
import eu.okaeri.docstore.filter.predicate.Predicate;
import eu.okaeri.docstore.filter.predicate.collection.InPredicate;
import eu.okaeri.docstore.filter.predicate.equality.EqPredicate;
import eu.okaeri.docstore.filter.predicate.equality.NePredicate;
import eu.okaeri.docstore.filter.predicate.nullity.IsNullPredicate;
import eu.okaeri.docstore.filter.predicate.nullity.NotNullPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.GtPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.GtePredicate;
import eu.okaeri.docstore.filter.predicate.numeric.LtPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.LtePredicate;
import eu.okaeri.docstore.filter.renderer.DefaultFilterRenderer;
import eu.okaeri.docstore.filter.renderer.JsonStringRenderer;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders conditions and orderings as MongoDB extended JSON, parsed with {@code Document.parse}.
 * <p>
 * MongoDB sorts missing and null values first in ascending order. Orderings on nullable
 * paths are therefore sorted by a computed rank field first, see {@link #renderNullRanks(List)}.
 */
public class MongoFilterRenderer extends DefaultFilterRenderer {

    public static final String NULL_RANK_PREFIX = "__nulls_";

    public MongoFilterRenderer() {
        super(new JsonStringRenderer());
    }

    @Override
    public String renderOperator(@NonNull LogicalOperator operator) {
        if (operator == LogicalOperator.AND) {
            return "$and";
        }
        if (operator == LogicalOperator.OR) {
            return "$or";
        }
        throw new IllegalArgumentException("Unsupported operator: " + operator);
    }

    @Override
    public String renderOperator(@NonNull Predicate predicate) {

        if (predicate instanceof EqPredicate) {
            return "$eq";
        } else if (predicate instanceof GtePredicate) {
            return "$gte";
        } else if (predicate instanceof GtPredicate) {
            return "$gt";
        } else if (predicate instanceof LtePredicate) {
            return "$lte";
        } else if (predicate instanceof LtPredicate) {
            return "$lt";
        } else if (predicate instanceof NePredicate) {
            return "$ne";
        } else if (predicate instanceof InPredicate) {
            return "$in";
        }

        throw new IllegalArgumentException("cannot render operator " + predicate + " [" + predicate.getClass() + "]");
    }

    @Override
    public String renderCondition(@NonNull Condition condition) {

        String operator = this.renderOperator(condition.getOperator());
        String conditions = Arrays.stream(condition.getPredicates())
            .map(predicate -> {
                if (predicate instanceof Condition) {
                    return this.renderCondition((Condition) predicate);
                } else {
                    return this.renderPredicate(condition.getPath(), predicate);
                }
            })
            .collect(Collectors.joining(", "));

        return (condition.getPredicates().length == 1)
            ? conditions
            : ("{\"" + operator + "\": [" + conditions + "]}");
    }

    @Override
    public String renderPredicate(@NonNull PersistencePath path, @NonNull Predicate predicate) {

        // matches both missing fields and explicit nulls
        if (predicate instanceof IsNullPredicate) {
            return "{ \"" + path.toMongoPath() + "\": null }";
        }
        if (predicate instanceof NotNullPredicate) {
            return "{ \"" + path.toMongoPath() + "\": { \"$ne\": null } }";
        }

        return "{ \"" + path.toMongoPath() + "\": { \"" + this.renderOperator(predicate) + "\": " + this.renderOperand(predicate) + " }}";
    }

    @Override
    public String renderOrderBy(@NonNull List<OrderBy> orderBy) {
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < orderBy.size(); i++) {
            OrderBy order = orderBy.get(i);
            if (order.isNullable()) {
                fields.add("\"" + NULL_RANK_PREFIX + i + "\": 1");
            }
            int direction = (order.getDirection() == OrderDirection.ASC) ? 1 : -1;
            fields.add("\"" + order.getPath().toMongoPath() + "\": " + direction);
        }
        return "{" + String.join(", ", fields) + "}";
    }

    /**
     * Renders the {@code $addFields} stage body ranking nulls after values: 0 for values, 1 for
     * missing or null. Only orderings marked nullable get a rank.
     */
    public String renderNullRanks(@NonNull List<OrderBy> orderBy) {
        List<String> ranks = new ArrayList<>();
        for (int i = 0; i < orderBy.size(); i++) {
            OrderBy order = orderBy.get(i);
            if (!order.isNullable()) {
                continue;
            }
            String field = "\"$" + order.getPath().toMongoPath() + "\"";
            ranks.add("\"" + NULL_RANK_PREFIX + i + "\": { \"$cond\": [{ \"$eq\": [{ \"$ifNull\": [" + field + ", null] }, null] }, 1, 0] }");
        }
        return "{" + String.join(", ", ranks) + "}";
    }

    public List<String> renderNullRankFields(@NonNull List<OrderBy> orderBy) {
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < orderBy.size(); i++) {
            if (orderBy.get(i).isNullable()) {
                fields.add(NULL_RANK_PREFIX + i);
            }
        }
        return fields;
    }
}
