package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.FilterablePersistence;
import eu.okaeri.docstore.PersistenceCollection;
import eu.okaeri.docstore.filter.condition.Condition;
import lombok.Builder;
import lombok.Data;
import lombok.NonNull;

import java.util.Set;

/**
 * Base query a page is taken from. The seek condition of a cursor is ANDed with
 * {@code where}, never replacing it.
 */
@Data
@Builder
public class PageQuery {

    private final @NonNull FilterablePersistence persistence;
    private final @NonNull PersistenceCollection collection;
    private final Condition where;
    private final Set<String> projection;
}
