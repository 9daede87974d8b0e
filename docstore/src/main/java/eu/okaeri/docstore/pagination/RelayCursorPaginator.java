package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.document.Document;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cursor pagination attaching a cursor to every item, following the Relay connection
 * convention. Any item cursor can be passed as {@code next} to continue after that item.
 */
public class RelayCursorPaginator extends CursorPaginator {

    @Override
    protected List<String> itemCursors(PageQuery query, List<PersistenceEntity<Document>> items, List<SortField> fields) {
        return Collections.unmodifiableList(items.stream()
            .map(item -> this.codec.encode(this.fieldMap(query, item.getValue()), fields))
            .collect(Collectors.toList()));
    }
}
