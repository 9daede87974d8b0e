package eu.okaeri.docstore;

import lombok.Getter;
import lombok.NonNull;
import lombok.ToString;

@Getter
@ToString(callSuper = true)
public class PersistenceCollection extends PersistencePath {

    private boolean dropIndexes;

    private PersistenceCollection(@NonNull String value) {
        super(value);
    }

    public static PersistenceCollection of(@NonNull String path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("collection name cannot be empty");
        }
        return new PersistenceCollection(path);
    }

    /**
     * Backends supporting native indexes drop them on registration when enabled.
     */
    public PersistenceCollection dropIndexes(boolean dropIndexes) {
        this.dropIndexes = dropIndexes;
        return this;
    }
}
