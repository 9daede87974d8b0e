package eu.okaeri.docstore.repository;

public enum BulkItemStatus {
    OK,
    ERROR
}
