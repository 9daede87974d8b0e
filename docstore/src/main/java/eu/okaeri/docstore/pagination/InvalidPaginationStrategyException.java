package eu.okaeri.docstore.pagination;

/**
 * No paginator is registered for the requested strategy.
 */
public class InvalidPaginationStrategyException extends PaginationException {

    public InvalidPaginationStrategyException(String message) {
        super(message);
    }
}
