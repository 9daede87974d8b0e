package eu.okaeri.docstore.pagination;

import eu.okaeri.docstore.PersistenceEntity;
import eu.okaeri.docstore.document.Document;
import eu.okaeri.docstore.filter.FindFilter;
import eu.okaeri.docstore.filter.condition.Condition;
import eu.okaeri.docstore.filter.renderer.DefaultFilterRenderer;
import eu.okaeri.docstore.filter.renderer.FilterRenderer;
import lombok.Data;
import lombok.NonNull;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the bounded page query, fetching one item past the limit to detect a following page.
 */
public class PageFetcher {

    private static final boolean DEBUG = Boolean.parseBoolean(System.getProperty("okaeri.docstore.debug", "false"));
    private static final Logger LOGGER = Logger.getLogger(PageFetcher.class.getSimpleName());
    private static final FilterRenderer DEBUG_RENDERER = new DefaultFilterRenderer();

    public Result fetch(@NonNull PageQuery query, Condition seek, @NonNull List<SortField> fields, int limit) {

        if (limit <= 0) {
            throw new InvalidLimitException("limit must be a positive integer, got " + limit);
        }

        Condition where = (seek == null) ? query.getWhere() : Condition.both(query.getWhere(), seek);
        FindFilter filter = FindFilter.builder()
            .where(where)
            .orderBy(fields.stream().map(SortField::toOrderBy).collect(Collectors.toList()))
            .limit(limit + 1)
            .projection(projection(query.getProjection(), fields))
            .build();

        if (DEBUG) {
            LOGGER.info("[" + query.getCollection().getValue() + "] " + DEBUG_RENDERER.renderFilter(filter));
        }

        List<PersistenceEntity<Document>> items;
        try (Stream<PersistenceEntity<Document>> stream = query.getPersistence().find(query.getCollection(), filter)) {
            items = stream.collect(Collectors.toList());
        }

        if (items.size() > limit) {
            return new Result(items.subList(0, limit), true);
        }
        return new Result(items, false);
    }

    // cursors are encoded from the fetched documents, so every sort field has to be read
    private static Set<String> projection(Set<String> requested, List<SortField> fields) {
        if ((requested == null) || requested.isEmpty()) {
            return requested;
        }
        Set<String> projection = new LinkedHashSet<>(requested);
        for (SortField field : fields) {
            if (!field.isIdentifier()) {
                projection.add(field.getPath().toMongoPath());
            }
        }
        return projection;
    }

    @Data
    public static class Result {
        private final List<PersistenceEntity<Document>> items;
        private final boolean hasNext;
    }
}
