package eu.okaeri.docstore.filter.predicate.collection;

import eu.okaeri.docstore.filter.predicate.SimplePredicate;
import lombok.NonNull;

import java.util.Collection;
import java.util.List;

import static eu.okaeri.docstore.document.DocumentValueUtils.compareEquals;
import static eu.okaeri.docstore.filter.predicate.PredicateOperands.storedAll;

/**
 * {@code val in [x, y, z]}. Operands are kept as an immutable list in stored form, an empty
 * list is rejected. Null or missing values never match.
 */
public class InPredicate extends SimplePredicate {

    public InPredicate(@NonNull Collection<?> values) {
        super(storedAll(values));
    }

    @SuppressWarnings("unchecked")
    public List<Object> getValues() {
        return (List<Object>) this.getRightOperand();
    }

    @Override
    public boolean check(Object leftOperand) {
        if (leftOperand == null) {
            return false;
        }
        return this.getValues().stream().anyMatch(value -> compareEquals(leftOperand, value));
    }
}
