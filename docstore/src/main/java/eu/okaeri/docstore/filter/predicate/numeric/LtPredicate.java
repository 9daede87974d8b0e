package eu.okaeri.docstore.filter.predicate.numeric;

import eu.okaeri.docstore.filter.predicate.PredicateComparison;
import lombok.NonNull;

/**
 * VALUE lower than X
 * {@code val < x}
 */
public class LtPredicate extends PredicateComparison {

    public LtPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean results(int compareResult) {
        return compareResult < 0;
    }
}
