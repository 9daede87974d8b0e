package eu.okaeri.docstore.filter.predicate;

import lombok.NonNull;

import static eu.okaeri.docstore.document.DocumentValueUtils.compareForSort;
import static eu.okaeri.docstore.filter.predicate.PredicateOperands.stored;

/**
 * Ordering comparison against a non-null operand. A null or missing left operand never
 * matches, the same way document stores treat range operators.
 */
public abstract class PredicateComparison extends SimplePredicate {

    protected PredicateComparison(@NonNull Object rightOperand) {
        super(stored(rightOperand));
    }

    @Override
    public boolean check(Object leftOperand) {
        if (leftOperand == null) {
            return false;
        }
        return this.results(compareForSort(leftOperand, this.getRightOperand()));
    }

    public abstract boolean results(int compareResult);
}
