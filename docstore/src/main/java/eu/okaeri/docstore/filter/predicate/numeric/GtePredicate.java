package eu.okaeri.docstore.filter.predicate.numeric;

import eu.okaeri.docstore.filter.predicate.PredicateComparison;
import lombok.NonNull;

/**
 * VALUE greater than or equal to X
 * {@code val >= x}
 */
public class GtePredicate extends PredicateComparison {

    public GtePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult >= 0;
    }
}
