package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.PersistencePath;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

/**
 * Ordering on a single path. Null values always come after non-null values, whatever the
 * direction. {@code nullable} tells backends that nulls may occur, so that those without
 * that ordering natively can rank them explicitly.
 */
@Data
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class OrderBy {

    private final PersistencePath path;
    private final OrderDirection direction;
    private final boolean nullable;

    public static OrderBy asc(@NonNull String path) {
        return new OrderBy(PersistencePath.parse(path, "."), OrderDirection.ASC, false);
    }

    public static OrderBy asc(@NonNull PersistencePath path) {
        return new OrderBy(path, OrderDirection.ASC, false);
    }

    public static OrderBy desc(@NonNull String path) {
        return new OrderBy(PersistencePath.parse(path, "."), OrderDirection.DESC, false);
    }

    public static OrderBy desc(@NonNull PersistencePath path) {
        return new OrderBy(path, OrderDirection.DESC, false);
    }

    public static OrderBy of(@NonNull PersistencePath path, @NonNull OrderDirection direction, boolean nullable) {
        return new OrderBy(path, direction, nullable);
    }

    public OrderBy nullable() {
        return new OrderBy(this.path, this.direction, true);
    }
}
