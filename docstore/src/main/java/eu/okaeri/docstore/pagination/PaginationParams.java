package eu.okaeri.docstore.pagination;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
public class PaginationParams {

    @NonNull
    @Builder.Default
    private final PaginationStrategy strategy = PaginationStrategy.CURSOR;
    @Builder.Default
    private final int limit = PaginationSettings.defaultLimit();
    private final String next;
    private final boolean reversed;

    public static PaginationParams first(int limit) {
        return builder().limit(limit).build();
    }
}
