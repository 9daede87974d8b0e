package eu.okaeri.docstore.filter;

import eu.okaeri.docstore.filter.condition.Condition;
import lombok.NoArgsConstructor;
import lombok.NonNull;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@NoArgsConstructor
public class FindFilterBuilder {

    private Condition where;
    private int limit;
    private int skip;
    private List<OrderBy> orderBy;
    private Set<String> projection;

    public FindFilterBuilder where(Condition where) {
        this.where = where;
        return this;
    }

    public FindFilterBuilder limit(int limit) {
        this.limit = limit;
        return this;
    }

    public FindFilterBuilder skip(int skip) {
        this.skip = skip;
        return this;
    }

    public FindFilterBuilder orderBy(@NonNull OrderBy... order) {
        return this.orderBy(Arrays.asList(order));
    }

    public FindFilterBuilder orderBy(@NonNull Collection<OrderBy> order) {
        if (this.orderBy == null) {
            this.orderBy = new ArrayList<>();
        }
        this.orderBy.addAll(order);
        return this;
    }

    /**
     * Restricts returned documents to the given dotted field paths.
     * A null or empty collection returns whole documents.
     */
    public FindFilterBuilder projection(Collection<String> fields) {
        this.projection = (fields == null) ? null : new LinkedHashSet<>(fields);
        return this;
    }

    public FindFilter build() {
        return new FindFilter(this.where, this.limit, this.skip, this.orderBy, this.projection);
    }
}
