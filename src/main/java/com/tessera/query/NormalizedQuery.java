package com.tessera.query;

import com.tessera.schema.Dimension;
import com.tessera.schema.Measure;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Canonical form of a {@link Query}: every member is resolved against the
 * registry, duplicates are rejected and every date range is absolute.
 * This is the only query shape the planner accepts.
 */
public final class NormalizedQuery {
    private final List<Measure> measures;
    private final List<Dimension> dimensions;
    private final List<ResolvedTimeDimension> timeDimensions;
    private final List<Filter> filters;
    private final Map<String, SortDirection> order;
    private final Integer limit;
    private final Integer offset;
    private final Instant resolvedAt;

    NormalizedQuery(List<Measure> measures, List<Dimension> dimensions,
                    List<ResolvedTimeDimension> timeDimensions, List<Filter> filters,
                    Map<String, SortDirection> order, Integer limit, Integer offset, Instant resolvedAt) {
        this.measures = Collections.unmodifiableList(new ArrayList<>(measures));
        this.dimensions = Collections.unmodifiableList(new ArrayList<>(dimensions));
        this.timeDimensions = Collections.unmodifiableList(new ArrayList<>(timeDimensions));
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
        this.order = Collections.unmodifiableMap(new LinkedHashMap<>(order));
        this.limit = limit;
        this.offset = offset;
        this.resolvedAt = resolvedAt;
    }

    public List<Measure> getMeasures() {
        return measures;
    }

    public List<Dimension> getDimensions() {
        return dimensions;
    }

    public List<ResolvedTimeDimension> getTimeDimensions() {
        return timeDimensions;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    public Map<String, SortDirection> getOrder() {
        return order;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    /**
     * The reference instant relative date ranges were resolved against.
     */
    public Instant getResolvedAt() {
        return resolvedAt;
    }

    /**
     * The cube owning the first measure, or the first dimension when the
     * query has no measures.
     */
    public String getPrimaryCube() {
        if (!measures.isEmpty()) {
            return measures.get(0).getCubeName();
        }
        return dimensions.get(0).getCubeName();
    }

    /**
     * Cubes owning any selected member, primary cube first. Filter and order
     * members are included by the planner, which resolves them.
     */
    public Set<String> getSelectedCubes() {
        Set<String> cubes = new LinkedHashSet<>();
        cubes.add(getPrimaryCube());
        measures.forEach(m -> cubes.add(m.getCubeName()));
        dimensions.forEach(d -> cubes.add(d.getCubeName()));
        timeDimensions.forEach(t -> cubes.add(t.getDimension().getCubeName()));
        return cubes;
    }
}
