package eu.okaeri.docstore.repository;

import eu.okaeri.docstore.PersistenceCollection;

public class EntityAlreadyExistsException extends RepositoryException {

    public EntityAlreadyExistsException(PersistenceCollection collection, Object id) {
        super(collection.getValue() + " " + id + " already exists", collection, id);
    }
}
