package eu.okaeri.docstore.filter.predicate;

import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static eu.okaeri.docstore.document.DocumentValueUtils.toStoredValue;

/**
 * Converts predicate operands to the form documents are stored in (instants as fixed width
 * strings, uuids and enums as strings), so rendered queries and in-memory evaluation see
 * the same values.
 */
public final class PredicateOperands {

    private PredicateOperands() {
    }

    /**
     * @throws IllegalArgumentException if a string operand contains a null byte
     */
    public static Object stored(@NonNull Object operand) {
        Object value = toStoredValue(operand);
        if ((value instanceof CharSequence) && (value.toString().indexOf('\0') >= 0)) {
            throw new IllegalArgumentException("null bytes are not supported in string operands");
        }
        return value;
    }

    /**
     * @throws IllegalArgumentException if there are no operands or one of them is null
     */
    public static List<Object> storedAll(@NonNull Collection<?> operands) {
        if (operands.isEmpty()) {
            throw new IllegalArgumentException("one or more operand is required");
        }
        List<Object> values = new ArrayList<>(operands.size());
        for (Object operand : operands) {
            if (operand == null) {
                throw new IllegalArgumentException("null operand, use isNull() instead");
            }
            values.add(stored(operand));
        }
        return Collections.unmodifiableList(values);
    }
}
