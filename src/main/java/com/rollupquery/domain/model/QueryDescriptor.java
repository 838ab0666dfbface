package com.rollupquery.domain.model;

import com.rollupquery.domain.parse.MalformedDescriptorException;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative aggregate query: select list, filters, grouping and ordering.
 *
 * Instances are immutable. The group-by list keeps its order because it
 * drives output column order; routing only looks at its set view.
 */
@Value
public class QueryDescriptor {

    List<SelectItem> select;
    List<String> groupBy;
    List<Predicate> where;
    List<OrderByItem> orderBy;

    /**
     * Explicit physical table or view, null when the router should choose.
     */
    String source;

    @Builder(toBuilder = true)
    public QueryDescriptor(@Singular("selectItem") List<SelectItem> select,
                           @Singular("groupByColumn") List<String> groupBy,
                           @Singular("predicate") List<Predicate> where,
                           @Singular("orderByItem") List<OrderByItem> orderBy,
                           String source) {
        if (select == null || select.isEmpty()) {
            throw new MalformedDescriptorException("Query descriptor needs a non-empty select list");
        }
        this.select = List.copyOf(select);
        this.groupBy = groupBy == null ? List.of() : List.copyOf(groupBy);
        this.where = where == null ? List.of() : List.copyOf(where);
        this.orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
        this.source = source == null || source.isBlank() ? null : source;
    }

    public Set<String> groupByColumns() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(groupBy));
    }

    public Set<String> whereColumns() {
        Set<String> columns = new LinkedHashSet<>();
        for (Predicate predicate : where) {
            columns.add(predicate.getColumn());
        }
        return Collections.unmodifiableSet(columns);
    }

    public List<SelectItem> aggregates() {
        return select.stream().filter(SelectItem::isAggregate).toList();
    }

    public boolean hasSourceOverride() {
        return source != null;
    }

    public QueryDescriptor withSource(String newSource) {
        return toBuilder().source(newSource).build();
    }
}
