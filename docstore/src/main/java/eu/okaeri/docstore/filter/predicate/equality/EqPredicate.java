package eu.okaeri.docstore.filter.predicate.equality;

import eu.okaeri.docstore.filter.predicate.PredicateEquality;
import lombok.NonNull;

/**
 * {@code val == x}, used for filter model bindings and seek prefixes.
 */
public class EqPredicate extends PredicateEquality {

    public EqPredicate(@NonNull Object rightOperand) {
        super(rightOperand);
    }

    @Override
    public boolean check(Object leftOperand) {
        return this.matches(leftOperand);
    }
}
