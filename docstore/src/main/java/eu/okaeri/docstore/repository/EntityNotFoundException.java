package eu.okaeri.docstore.repository;

import eu.okaeri.docstore.PersistenceCollection;

public class EntityNotFoundException extends RepositoryException {

    public EntityNotFoundException(PersistenceCollection collection, Object id) {
        super(collection.getValue() + " " + id + " not found", collection, id);
    }
}
