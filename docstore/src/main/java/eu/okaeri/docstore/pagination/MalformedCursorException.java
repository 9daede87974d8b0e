package eu.okaeri.docstore.pagination;

/**
 * Cursor token cannot be decoded against the active sort specification.
 */
public class MalformedCursorException extends PaginationException {

    public MalformedCursorException(String message) {
        super(message);
    }

    public MalformedCursorException(String message, Throwable cause) {
        super(message, cause);
    }
}
