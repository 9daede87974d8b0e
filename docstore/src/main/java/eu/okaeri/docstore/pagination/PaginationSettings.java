package eu.okaeri.docstore.pagination;

/**
 * Pagination defaults, overridable with system properties:
 * <ul>
 *   <li>{@code okaeri.docstore.pagination.defaultLimit} - page size when none is given (default: 100)</li>
 * </ul>
 */
public final class PaginationSettings {

    public static final String DEFAULT_LIMIT_PROPERTY = "okaeri.docstore.pagination.defaultLimit";

    private PaginationSettings() {
    }

    public static int defaultLimit() {
        int limit = Integer.getInteger(DEFAULT_LIMIT_PROPERTY, 100);
        if (limit <= 0) {
            throw new IllegalStateException(DEFAULT_LIMIT_PROPERTY + " must be positive, got " + limit);
        }
        return limit;
    }
}
