package eu.okaeri.docstore.filter.predicate.numeric;

import eu.okaeri.docstore.filter.predicate.PredicateComparison;
import lombok.NonNull;

/**
 * VALUE greater than X
 * {@code val > x}
 */
public class GtPredicate extends PredicateComparison {

    public GtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult > 0;
    }
}
