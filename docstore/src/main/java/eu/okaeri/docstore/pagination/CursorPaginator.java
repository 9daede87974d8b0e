package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.document.DocumentSerializer;
import eu.okaeri.docstore.filter.condition.Condition;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Keyset pagination with a single cursor per page.
 * <p>
 * Reverse traversal walks the inverted ordering starting at the cursor and returns the
 * items in natural order. The outgoing cursor always points at the last item in traversal
 * order, which is the first returned item of a reversed page.
 */
public class CursorPaginator implements Paginator {

    protected final CursorCodec codec;
    protected final SeekFilterBuilder seekFilterBuilder;
    protected final PageFetcher pageFetcher;
    protected final PageInfoResolver pageInfoResolver;

    public CursorPaginator() {
        this(new CursorCodec(), new SeekFilterBuilder(), new PageFetcher());
    }

    public CursorPaginator(@NonNull CursorCodec codec, @NonNull SeekFilterBuilder seekFilterBuilder, @NonNull PageFetcher pageFetcher) {
        this.codec = codec;
        this.seekFilterBuilder = seekFilterBuilder;
        this.pageFetcher = pageFetcher;
        this.pageInfoResolver = new PageInfoResolver(seekFilterBuilder);
    }

    @Override
    public PaginatedResponse<Document> getPage(@NonNull PageQuery query, @NonNull PageRequest request) {

        if (request.getLimit() <= 0) {
            throw new InvalidLimitException("limit must be a positive integer, got " + request.getLimit());
        }

        SortSpecification sorting = request.isReversed() ? request.getSorting().inverted() : request.getSorting();
        List<SortField> fields = sorting.getFields();

        Cursor cursor = this.codec.decode(request.getNext(), fields);
        Condition seek = (cursor == null) ? null : this.seekFilterBuilder.build(fields, cursor, false);

        PageFetcher.Result result = this.pageFetcher.fetch(query, seek, fields, request.getLimit());
        List<PersistenceEntity<Document>> traversed = result.getItems();

        String next = null;
        if (result.isHasNext() && !traversed.isEmpty()) {
            Document boundary = traversed.get(traversed.size() - 1).getValue();
            next = this.codec.encode(this.fieldMap(query, boundary), fields);
        }

        List<PersistenceEntity<Document>> ordered = new ArrayList<>(traversed);
        if (request.isReversed()) {
            Collections.reverse(ordered);
        }

        PageInfo info = this.pageInfoResolver.resolve(query, fields, cursor, ordered.size(), request.isReversed());
        List<Document> items = ordered.stream()
            .map(PersistenceEntity::getValue)
            .collect(Collectors.toList());

        return new PaginatedResponse<>(items, next, info.getIndex(), info.getTotal(), this.itemCursors(query, ordered, fields));
    }

    /**
     * Per item cursors, none for plain cursor pagination.
     */
    protected List<String> itemCursors(PageQuery query, List<PersistenceEntity<Document>> items, List<SortField> fields) {
        return null;
    }

    protected Map<String, Object> fieldMap(PageQuery query, Document document) {
        DocumentSerializer serializer = query.getPersistence().getSerializer();
        return serializer.toFieldMap(document);
    }
}
