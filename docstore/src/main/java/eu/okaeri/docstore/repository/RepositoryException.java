package eu.okaeri.docstore.repository;

import eu.okaeri.docstore.PersistenceCollection;
import lombok.Getter;

@Getter
public class RepositoryException extends RuntimeException {

    private final PersistenceCollection collection;
    private final Object id;

    public RepositoryException(String message, PersistenceCollection collection, Object id) {
        super(message);
        this.collection = collection;
        this.id = id;
    }
}
