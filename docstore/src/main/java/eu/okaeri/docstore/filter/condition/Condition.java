package eu.okaeri.docstore.filter.condition;

import eu.okaeri.docstore.PersistencePath;
import eu.okaeri.docstore.filter.predicate.Predicate;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.Arrays;
import java.util.Collection;

/**
 * Logical group of predicates. A condition with a path applies its simple predicates to the
 * value at that path, nested conditions are evaluated against the whole document.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Condition implements Predicate {

    private final LogicalOperator operator;
    private final PersistencePath path;
    private final Predicate[] predicates;

    public static Condition and(@NonNull Predicate... predicates) {
        if (predicates.length <= 0) throw new IllegalArgumentException("one or more predicate is required");
        return new Condition(LogicalOperator.AND, null, predicates);
    }

    public static Condition and(@NonNull Collection<? extends Predicate> predicates) {
        return and(predicates.toArray(new Predicate[0]));
    }

    public static Condition on(@NonNull String path, @NonNull Predicate... predicates) {
        return and(path, predicates);
    }

    public static Condition on(@NonNull PersistencePath path, @NonNull Predicate... predicates) {
        return and(path, predicates);
    }

    public static Condition and(@NonNull String path, @NonNull Predicate... predicates) {
        return and(PersistencePath.parse(path, "."), predicates);
    }

    public static Condition and(@NonNull PersistencePath path, @NonNull Predicate... predicates) {
        if (predicates.length <= 0) throw new IllegalArgumentException("one or more predicate is required");
        return new Condition(LogicalOperator.AND, path, predicates);
    }

    public static Condition or(@NonNull Predicate... predicates) {
        if (predicates.length <= 0) throw new IllegalArgumentException("one or more predicate is required");
        return new Condition(LogicalOperator.OR, null, predicates);
    }

    public static Condition or(@NonNull Collection<? extends Predicate> predicates) {
        return or(predicates.toArray(new Predicate[0]));
    }

    public static Condition or(@NonNull String path, @NonNull Predicate... predicates) {
        return or(PersistencePath.parse(path, "."), predicates);
    }

    public static Condition or(@NonNull PersistencePath path, @NonNull Predicate... predicates) {
        if (predicates.length <= 0) throw new IllegalArgumentException("one or more predicate is required");
        return new Condition(LogicalOperator.OR, path, predicates);
    }

    /**
     * Combines an optional base condition with another one.
     *
     * @return {@code other} alone when {@code base} is null
     */
    public static Condition both(Condition base, @NonNull Condition other) {
        return (base == null) ? other : and(base, other);
    }

    @Override
    public boolean check(Object leftOperand) {
        if (this.operator == LogicalOperator.AND) {
            return Arrays.stream(this.predicates).allMatch(p -> p.check(leftOperand));
        }
        if (this.operator == LogicalOperator.OR) {
            return Arrays.stream(this.predicates).anyMatch(p -> p.check(leftOperand));
        }
        throw new IllegalArgumentException("Unsupported operator: " + this.operator);
    }
}
