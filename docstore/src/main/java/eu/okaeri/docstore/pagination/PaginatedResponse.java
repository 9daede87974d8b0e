package eu.okaeri.docstore.pagination;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NonNull;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;

@Data
@AllArgsConstructor
public class PaginatedResponse<T> {

    private final List<T> items;
    /**
     * Cursor of the following page, null on the last page.
     */
    private final String next;
    private final Long index;
    private final long total;
    /**
     * Cursor of every item, in item order. Only filled by relay style pagination.
     */
    private final List<String> cursors;

    public boolean hasNext() {
        return this.next != null;
    }

    public <R> PaginatedResponse<R> map(@NonNull Function<? super T, ? extends R> mapper) {
        List<R> mapped = this.items.stream().map(mapper).collect(Collectors.toList());
        return new PaginatedResponse<>(mapped, this.next, this.index, this.total, this.cursors);
    }
}
