package eu.okaeri.docstore.filter.predicate;

import eu.okaeri.docstore.filter.predicate.collection.InPredicate;
import eu.okaeri.docstore.filter.predicate.equality.EqPredicate;
import eu.okaeri.docstore.filter.predicate.equality.NePredicate;
import eu.okaeri.docstore.filter.predicate.nullity.IsNullPredicate;
import eu.okaeri.docstore.filter.predicate.nullity.NotNullPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.GtPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.GtePredicate;
import eu.okaeri.docstore.filter.predicate.numeric.LtPredicate;
import eu.okaeri.docstore.filter.predicate.numeric.LtePredicate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.Arrays;

@Data
@AllArgsConstructor(access = AccessLevel.PROTECTED)
public abstract class SimplePredicate implements Predicate {

    private final Object rightOperand;

    /**
     * Creates an equals predicate for numeric values.
     * {@code field == value}
     *
     * @param rightOperand the value to compare against
     * @return equals predicate
     */
    public static SimplePredicate eq(double rightOperand) {
        return new EqPredicate(rightOperand);
    }

    public static SimplePredicate eq(long rightOperand) {
        return new EqPredicate(rightOperand);
    }

    public static SimplePredicate eq(boolean rightOperand) {
        return new EqPredicate(rightOperand);
    }

    public static SimplePredicate eq(@NonNull CharSequence rightOperand) {
        return new EqPredicate(rightOperand);
    }

    /**
     * Creates an equals predicate for an already typed value (number, string, boolean, instant).
     * {@code field == value}
     *
     * @param rightOperand the value to compare against
     * @return equals predicate
     */
    public static SimplePredicate eq(@NonNull Object rightOperand) {
        return new EqPredicate(rightOperand);
    }

    public static SimplePredicate ne(double rightOperand) {
        return new NePredicate(rightOperand);
    }

    public static SimplePredicate ne(@NonNull Object rightOperand) {
        return new NePredicate(rightOperand);
    }

    public static SimplePredicate gt(double rightOperand) {
        return new GtPredicate(rightOperand);
    }

    /**
     * Creates a greater-than predicate.
     * {@code field > value}
     *
     * @param rightOperand the value to compare against
     * @return greater-than predicate
     */
    public static SimplePredicate gt(@NonNull Object rightOperand) {
        return new GtPredicate(rightOperand);
    }

    public static SimplePredicate gte(double rightOperand) {
        return new GtePredicate(rightOperand);
    }

    public static SimplePredicate gte(@NonNull Object rightOperand) {
        return new GtePredicate(rightOperand);
    }

    public static SimplePredicate lt(double rightOperand) {
        return new LtPredicate(rightOperand);
    }

    /**
     * Creates a less-than predicate.
     * {@code field < value}
     *
     * @param rightOperand the value to compare against
     * @return less-than predicate
     */
    public static SimplePredicate lt(@NonNull Object rightOperand) {
        return new LtPredicate(rightOperand);
    }

    public static SimplePredicate lte(double rightOperand) {
        return new LtePredicate(rightOperand);
    }

    public static SimplePredicate lte(@NonNull Object rightOperand) {
        return new LtePredicate(rightOperand);
    }

    /**
     * Creates a null-check predicate, matching missing fields too.
     * {@code field == null}
     *
     * @return is-null predicate
     */
    public static Predicate isNull() {
        return new IsNullPredicate();
    }

    /**
     * Creates a not-null-check predicate.
     * {@code field != null}
     *
     * @return not-null predicate
     */
    public static Predicate notNull() {
        return new NotNullPredicate();
    }

    /**
     * Creates an IN predicate for collection membership.
     * {@code field IN (value1, value2, ...)}
     *
     * @param values the values to check membership against
     * @return IN predicate
     */
    public static SimplePredicate in(@NonNull Object... values) {
        return new InPredicate(Arrays.asList(values));
    }
}
