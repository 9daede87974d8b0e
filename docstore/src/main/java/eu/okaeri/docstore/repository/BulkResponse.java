package eu.okaeri.docstore.repository;

import lombok.Data;
import lombok.NonNull;

import java.util.Collections;
import java.util.List;

/**
 * Per item results of a bulk operation, in request order.
 */
@Data
public class BulkResponse {

    private final List<BulkItem> items;
    private final boolean hasErrors;

    public static BulkResponse of(@NonNull List<BulkItem> items) {
        boolean hasErrors = items.stream().anyMatch(BulkItem::isError);
        return new BulkResponse(Collections.unmodifiableList(items), hasErrors);
    }
}
