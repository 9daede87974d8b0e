package eu.okaeri.docstore.filter.predicate.nullity;

import eu.okaeri.docstore.filter.predicate.Predicate;
import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * VALUE is null
 * {@code val == null}
 */
@ToString
@EqualsAndHashCode
public class IsNullPredicate implements Predicate {

    @Override
    public boolean check(Object leftOperand) {
        return leftOperand == null;
    }
}
