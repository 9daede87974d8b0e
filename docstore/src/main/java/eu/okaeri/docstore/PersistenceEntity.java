package eu.okaeri.docstore;

import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

@Data
@AllArgsConstructor
public class PersistenceEntity<V> {

    private PersistencePath path;
    private V value;

    // limit new allocations when shuffling types
    @SuppressWarnings("unchecked")
    public <T> PersistenceEntity<T> into(@NonNull T value) {
        this.value = (V) value;
        return (PersistenceEntity<T>) this;
    }

    public <T extends Document> PersistenceEntity<T> into(@NonNull DocumentSerializer serializer, @NonNull Class<T> type) {
        return this.into(serializer.into((Document) this.value, type));
    }
}
