package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.filter.condition.Condition;
import lombok.Data;

import java.util.List;
import java.util.Set;

@Data
public class FindFilter {

    private final Condition where;
    private final int limit;
    private final int skip;
    private final List<OrderBy> orderBy;
    private final Set<String> projection;

    public static FindFilterBuilder builder() {
        return new FindFilterBuilder();
    }

    public boolean hasSkip() {
        return this.skip > 0;
    }

    public boolean hasLimit() {
        return this.limit > 0;
    }

    public boolean hasOrderBy() {
        return (this.orderBy != null) && !this.orderBy.isEmpty();
    }

    public boolean hasProjection() {
        return (this.projection != null) && !this.projection.isEmpty();
    }
}
