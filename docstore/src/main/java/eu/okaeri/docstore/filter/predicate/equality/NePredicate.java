package eu.okaeri.docstore.filter.predicate.equality;

import eu.okaeri.docstore.filter.predicate.PredicateEquality;
import lombok.NonNull;

/**
 * {@code val != x}, matching null and missing values too.
 */
public class NePredicate extends PredicateEquality {

    public NePredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean check(Object leftOperand) {
        return !this.matches(leftOperand);
    }
}
