package eu.okaeri.docstore.pagination;

public class InvalidLimitException extends PaginationException {

    public InvalidLimitException(String message) {
        super(message);
    }
}
