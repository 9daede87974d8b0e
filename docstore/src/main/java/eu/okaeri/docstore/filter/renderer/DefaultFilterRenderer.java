package eu.okaeri.docstore.filter.renderer;

import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.OrderBy;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.condition.LogicalOperator;
import eu.okaeri.docstore.filter.predicate.Predicate;
import eu.okaeri.docstore.filter.predicate.SimplePredicate;
import eu.okaeri.docstore.filter.predicate.collection.InPredicate;
import eu.okaeri.docstore.filter.predicate.equality.EqPredicate;
import eu.okaeri.docstore.filter.predicate.equality.NePredicate;
import eu.okaeri.docstore.filter.predicate.nullity.IsNullPredicate;
import eu.okaeri.docstore.filter.predicate.nullity.NotNullPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.GtPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.GtePredicate;
import eu.okaeri.docstore.filter.predicate.numeric.LtPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.LtePredicate;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import static eu.okaeri.docstore.document.DocumentValueUtils.toStoredValue;

/**
 * Renders conditions into a readable expression, e.g. {@code ((age > 18) || (age == null))}.
 * Used for debug logging of queries and as a base for backend specific renderers.
 */
@RequiredArgsConstructor
public class DefaultFilterRenderer implements FilterRenderer {

    protected final @NonNull StringRenderer stringRenderer;

    public DefaultFilterRenderer() {
        this.stringRenderer = new JsonStringRenderer();
    }

    @Override
    public String renderOperator(@NonNull LogicalOperator operator) {
        if (operator == LogicalOperator.AND) {
            return " && ";
        }
        if (operator == LogicalOperator.OR) {
            return " || ";
        }
        throw new IllegalArgumentException("Unsupported operator: " + operator);
    }

    @Override
    public String renderOperator(@NonNull Predicate predicate) {

        if (predicate instanceof EqPredicate) {
            return "==";
        } else if (predicate instanceof GtePredicate) {
            return ">=";
        } else if (predicate instanceof GtPredicate) {
            return ">";
        } else if (predicate instanceof LtePredicate) {
            return "<=";
        } else if (predicate instanceof LtPredicate) {
            return "<";
        } else if (predicate instanceof NePredicate) {
            return "!=";
        } else if (predicate instanceof InPredicate) {
            return "in";
        }

        throw new IllegalArgumentException("cannot render operator " + predicate + " [" + predicate.getClass() + "]");
    }

    @Override
    public String renderCondition(@NonNull Condition condition) {

        String expression = Arrays.stream(condition.getPredicates())
            .map(predicate -> {
                if (predicate instanceof Condition) {
                    return this.renderCondition((Condition) predicate);
                } else {
                    return this.renderPredicate(condition.getPath(), predicate);
                }
            })
            .collect(Collectors.joining(this.renderOperator(condition.getOperator())));

        return (condition.getPredicates().length == 1)
            ? expression
            : ("(" + expression + ")");
    }

    @Override
    public String renderPredicate(@NonNull PersistencePath path, @NonNull Predicate predicate) {
        if (predicate instanceof IsNullPredicate) {
            return "(" + path.toSqlIdentifier() + " == null)";
        }
        if (predicate instanceof NotNullPredicate) {
            return "(" + path.toSqlIdentifier() + " != null)";
        }
        return "(" + path.toSqlIdentifier() + " " + this.renderOperator(predicate) + " " + this.renderOperand(predicate) + ")";
    }

    @Override
    public String renderOperand(@NonNull Object operand) {

        if (operand instanceof SimplePredicate) {
            operand = ((SimplePredicate) operand).getRightOperand();
        }

        operand = toStoredValue(operand);

        if ((operand instanceof Double) || (operand instanceof Float)) {
            double value = ((Number) operand).doubleValue();
            if ((value == Math.rint(value)) && (Math.abs(value) < Long.MAX_VALUE)) {
                return String.valueOf((long) value);
            }
            return new BigDecimal(String.valueOf(operand)).toPlainString();
        }

        if (operand instanceof BigDecimal) {
            return ((BigDecimal) operand).toPlainString();
        }

        if ((operand instanceof Number) || (operand instanceof Boolean)) {
            return String.valueOf(operand);
        }

        if (operand instanceof CharSequence) {
            return this.stringRenderer.render(String.valueOf(operand));
        }

        if (operand instanceof Collection) {
            return "[" + ((Collection<?>) operand).stream()
                .map(this::renderOperand)
                .collect(Collectors.joining(", ")) + "]";
        }

        throw new IllegalArgumentException("cannot render operand " + operand + " [" + operand.getClass() + "]");
    }

    @Override
    public String renderOrderBy(@NonNull List<OrderBy> orderBy) {
        return orderBy.stream()
            .map(order -> order.getPath().toSqlIdentifier() + " " + order.getDirection().name())
            .collect(Collectors.joining(", "));
    }
}
