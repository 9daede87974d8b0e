package eu.okaeri.docstore.repository;

import lombok.Data;
import lombok.NonNull;

/**
 * Outcome of a single bulk operation item.
 */
@Data
public class BulkItem {

    private final BulkItemStatus status;
    private final String id;
    private final String detail;

    public static BulkItem success(@NonNull String id) {
        return new BulkItem(BulkItemStatus.OK, id, null);
    }

    public static BulkItem error(String id, @NonNull String detail) {
        return new BulkItem(BulkItemStatus.ERROR, id, detail);
    }

    public boolean isError() {
        return this.status == BulkItemStatus.ERROR;
    }
}
