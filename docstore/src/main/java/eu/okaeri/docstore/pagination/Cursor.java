package eu.okaeri.docstore.pagination;

import lombok.Data;
import lombok.NonNull;

import java.util.List;

/**
 * Decoded position in an ordered result set: the boundary document's value of every sort
 * field, in sort order. Values are typed, null when the document had none.
 */
@Data
public class Cursor {

    private final List<Entry> entries;

    public int size() {
        return this.entries.size();
    }

    public Object getValue(int index) {
        return this.entries.get(index).getValue();
    }

    @Data
    public static class Entry {
        private final @NonNull String name;
        private final Object value;
    }
}
