package eu.okaeri.docstore.document;

import lombok.NonNull;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Utility methods for extracting and comparing values from document maps.
 */
public final class DocumentValueUtils {

    private DocumentValueUtils() {
    }

    /**
     * Extract a value from a nested map using a path.
     *
     * @param map   the map to extract from
     * @param parts the path parts (e.g., ["user", "profile", "name"])
     * @return the value at the path, or null if not found
     */
    public static Object extractValue(Map<?, ?> map, @NonNull List<String> parts) {
        Object current = map;

        for (String part : parts) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<?, ?>) current).get(part);
            if (current == null) {
                return null;
            }
        }

        return current;
    }

    /**
     * Converts query values to their stored form. Instants are stored as fixed width strings,
     * UUIDs and enums by their string form.
     */
    public static Object toStoredValue(Object value) {
        if (value instanceof Instant) {
            return DocumentSerializer.formatInstant((Instant) value);
        }
        if (value instanceof UUID) {
            return String.valueOf(value);
        }
        if (value instanceof Enum) {
            return ((Enum<?>) value).name();
        }
        return value;
    }

    /**
     * Compare two values for equality with type coercion.
     *
     * @param value1 first value
     * @param value2 second value
     * @return true if values are equal
     * @throws IllegalArgumentException if values cannot be compared
     */
    public static boolean compareEquals(Object value1, Object value2) {
        value1 = toStoredValue(value1);
        value2 = toStoredValue(value2);

        if ((value1 == null) && (value2 == null)) {
            return true;
        }
        if ((value1 == null) || (value2 == null)) {
            return false;
        }

        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return new BigDecimal(String.valueOf(value1)).compareTo(new BigDecimal(String.valueOf(value2))) == 0;
        }

        if (value1.getClass() == value2.getClass()) {
            return value1.equals(value2);
        }

        // String and number - compare numerically
        if (((value1 instanceof String) || (value1 instanceof Number)) && ((value2 instanceof String) || (value2 instanceof Number))) {
            try {
                return new BigDecimal(String.valueOf(value1)).compareTo(new BigDecimal(String.valueOf(value2))) == 0;
            } catch (NumberFormatException ignored) {
                return false;
            }
        }

        if ((value1 instanceof Boolean) || (value2 instanceof Boolean)) {
            return Objects.equals(String.valueOf(value1), String.valueOf(value2));
        }

        throw new IllegalArgumentException("cannot compare " + value1 + " [" + value1.getClass() + "] to " + value2 + " [" + value2.getClass() + "]");
    }

    /**
     * Compare two values for sorting with type coercion.
     * Nulls are greater than any value, so they sort last in ascending order.
     *
     * @param value1 first value
     * @param value2 second value
     * @return negative if value1 &lt; value2, 0 if equal, positive if value1 &gt; value2
     */
    @SuppressWarnings({"unchecked", "rawtypes"})
    public static int compareForSort(Object value1, Object value2) {
        value1 = toStoredValue(value1);
        value2 = toStoredValue(value2);

        if ((value1 == null) && (value2 == null)) return 0;
        if (value1 == null) return 1;
        if (value2 == null) return -1;

        if ((value1 instanceof Number) && (value2 instanceof Number)) {
            return new BigDecimal(String.valueOf(value1)).compareTo(new BigDecimal(String.valueOf(value2)));
        }

        // Same comparable type - use natural ordering
        if ((value1 instanceof Comparable) && (value1.getClass() == value2.getClass())) {
            return ((Comparable) value1).compareTo(value2);
        }

        // String and number mixed - try numeric comparison
        if (((value1 instanceof String) || (value1 instanceof Number)) && ((value2 instanceof String) || (value2 instanceof Number))) {
            try {
                return new BigDecimal(String.valueOf(value1)).compareTo(new BigDecimal(String.valueOf(value2)));
            } catch (NumberFormatException ignored) {
                // Fall through to string comparison
            }
        }

        return String.valueOf(value1).compareTo(String.valueOf(value2));
    }
}
