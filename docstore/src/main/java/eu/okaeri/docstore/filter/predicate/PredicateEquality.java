package eu.okaeri.docstore.filter.predicate;

import lombok.NonNull;

import static eu.okaeri.docstore.document.DocumentValueUtils.compareEquals;
import static eu.okaeri.docstore.filter.predicate.PredicateOperands.stored;

/**
 * Equality against a stored form operand. Numbers of different types are equal by value,
 * a null or missing left operand never equals.
 */
public abstract class PredicateEquality extends SimplePredicate {

    protected PredicateEquality(@NonNull Object rightOperand) {
        super(stored(rightOperand));
    }

    protected boolean matches(Object leftOperand) {
        return compareEquals(leftOperand, this.getRightOperand());
    }
}
