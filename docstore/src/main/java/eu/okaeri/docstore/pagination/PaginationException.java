package eu.okaeri.docstore.pagination;

/**
 * Invalid pagination input supplied by the caller. Not retryable.
 */
public class PaginationException extends RuntimeException {

    public PaginationException(String message) {
        super(message);
    }

    public PaginationException(String message, Throwable cause) {
        super(message, cause);
    }
}
