package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.filter.condition.Condition;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Computes the absolute position of a page and the total count of the base query.
 * <p>
 * The position is reconstructed by counting the documents preceding the cursor, using the
 * seek condition of the inverted ordering. Count and page queries do not share a snapshot.
 */
@RequiredArgsConstructor
public class PageInfoResolver {

    private final @NonNull SeekFilterBuilder seekFilterBuilder;

    /**
     * @param fields    sort fields in traversal order
     * @param cursor    incoming cursor, null for the first page
     * @param itemCount number of items on the page
     * @param reversed  whether the page was taken in reverse traversal
     */
    public PageInfo resolve(@NonNull PageQuery query, @NonNull List<SortField> fields, Cursor cursor, int itemCount, boolean reversed) {

        long total = query.getPersistence().count(query.getCollection(), query.getWhere());
        if (itemCount == 0) {
            return new PageInfo(null, total);
        }
        if (cursor == null) {
            return new PageInfo(0L, total);
        }

        List<SortField> inverted = fields.stream()
            .map(SortField::inverted)
            .collect(Collectors.toList());
        Condition preceding = this.seekFilterBuilder.build(inverted, cursor, true);

        // the cursor document is the last one preceding the page
        long index = query.getPersistence().count(query.getCollection(), Condition.both(query.getWhere(), preceding)) + 1;
        if (reversed) {
            index = Math.max(total - index - itemCount, 0);
        }

        return new PageInfo(index, total);
    }
}
