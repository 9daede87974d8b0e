package eu.okaeri.docstore.pagination;

public enum PaginationStrategy {
    CURSOR,
    RELAY
}
