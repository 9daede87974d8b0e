package eu.okaeri.docstore.pagination;

import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

@Data
@Builder
public class PageRequest {

    private final @NonNull SortSpecification sorting;
    private final int limit;
    private final String next;
    private final boolean reversed;
}
