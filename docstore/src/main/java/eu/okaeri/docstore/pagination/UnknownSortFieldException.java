package eu.okaeri.docstore.pagination;

/**
 * Requested sort field is not declared on the document.
 */
public class UnknownSortFieldException extends PaginationException {

    public UnknownSortFieldException(String message) {
        super(message);
    }
}
