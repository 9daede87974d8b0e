package eu.okaeri.docstore.pagination;

import lombok.AccessLevel;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup of paginators by strategy, created once and passed to repositories.
 */
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class PaginatorRegistry {

    private final Map<PaginationStrategy, Paginator> paginators;

    public static PaginatorRegistry of(@NonNull Map<PaginationStrategy, ? extends Paginator> paginators) {
        Map<PaginationStrategy, Paginator> copy = new EnumMap<>(PaginationStrategy.class);
        copy.putAll(paginators);
        return new PaginatorRegistry(Collections.unmodifiableMap(copy));
    }

    /**
     * Registry with {@link CursorPaginator} for CURSOR and {@link RelayCursorPaginator} for RELAY.
     */
    public static PaginatorRegistry defaults() {
        Map<PaginationStrategy, Paginator> paginators = new EnumMap<>(PaginationStrategy.class);
        paginators.put(PaginationStrategy.CURSOR, new CursorPaginator());
        paginators.put(PaginationStrategy.RELAY, new RelayCursorPaginator());
        return of(paginators);
    }

    public Set<PaginationStrategy> getStrategies() {
        return this.paginators.keySet();
    }

    /**
     * @throws InvalidPaginationStrategyException if no paginator is registered
     */
    public Paginator resolve(@NonNull PaginationStrategy strategy) {
        Paginator paginator = this.paginators.get(strategy);
        if (paginator == null) {
            throw new InvalidPaginationStrategyException("pagination strategy " + strategy + " not found");
        }
        return paginator;
    }

    /**
     * Case-insensitive lookup by strategy name.
     *
     * @throws InvalidPaginationStrategyException if the name is unknown or not registered
     */
    public Paginator resolve(@NonNull String strategy) {
        PaginationStrategy parsed;
        try {
            parsed = PaginationStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException exception) {
            throw new InvalidPaginationStrategyException("pagination strategy " + strategy + " not found");
        }
        return this.resolve(parsed);
    }
}
