package com.tessera.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A declarative analytics query as received from the caller.
 *
 * Instances are immutable; normalization produces a separate
 * {@link NormalizedQuery} rather than changing this one.
 */
public final class Query {
    private final List<String> measures;
    private final List<String> dimensions;
    private final List<TimeDimension> timeDimensions;
    private final List<Filter> filters;
    private final Map<String, SortDirection> order;
    private final Integer limit;
    private final Integer offset;

    private Query(Builder builder) {
        this.measures = Collections.unmodifiableList(new ArrayList<>(builder.measures));
        this.dimensions = Collections.unmodifiableList(new ArrayList<>(builder.dimensions));
        this.timeDimensions = Collections.unmodifiableList(new ArrayList<>(builder.timeDimensions));
        this.filters = Collections.unmodifiableList(new ArrayList<>(builder.filters));
        this.order = Collections.unmodifiableMap(new LinkedHashMap<>(builder.order));
        this.limit = builder.limit;
        this.offset = builder.offset;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getMeasures() {
        return measures;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public List<TimeDimension> getTimeDimensions() {
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

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Query)) return false;
        Query query = (Query) o;
        return measures.equals(query.measures)
            && dimensions.equals(query.dimensions)
            && timeDimensions.equals(query.timeDimensions)
            && filters.equals(query.filters)
            && order.equals(query.order)
            && Objects.equals(limit, query.limit)
            && Objects.equals(offset, query.offset);
    }

    @Override
    public int hashCode() {
        return Objects.hash(measures, dimensions, timeDimensions, filters, order, limit, offset);
    }

    @Override
    public String toString() {
        return "Query{measures=" + measures + ", dimensions=" + dimensions
            + ", timeDimensions=" + timeDimensions + ", filters=" + filters
            + ", order=" + order + ", limit=" + limit + ", offset=" + offset + "}";
    }

    public static final class Builder {
        private final List<String> measures = new ArrayList<>();
        private final List<String> dimensions = new ArrayList<>();
        private final List<TimeDimension> timeDimensions = new ArrayList<>();
        private final List<Filter> filters = new ArrayList<>();
        private final Map<String, SortDirection> order = new LinkedHashMap<>();
        private Integer limit;
        private Integer offset;

        private Builder() {
        }

        public Builder measures(String... members) {
            Collections.addAll(measures, members);
            return this;
        }

        public Builder measures(List<String> members) {
            measures.addAll(members);
            return this;
        }

        public Builder dimensions(String... members) {
            Collections.addAll(dimensions, members);
            return this;
        }

        public Builder dimensions(List<String> members) {
            dimensions.addAll(members);
            return this;
        }

        public Builder timeDimension(TimeDimension timeDimension) {
            timeDimensions.add(timeDimension);
            return this;
        }

        public Builder timeDimension(String dimension, TimeGranularity granularity, DateRangeExpression dateRange) {
            return timeDimension(new TimeDimension(dimension, granularity, dateRange));
        }

        public Builder filter(Filter filter) {
            filters.add(Objects.requireNonNull(filter, "filter"));
            return this;
        }

        public Builder order(String member, SortDirection direction) {
            order.put(member, direction);
            return this;
        }

        public Builder limit(Integer limit) {
            if (limit != null && limit < 0) {
                throw new IllegalArgumentException("Limit must not be negative");
            }
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            if (offset != null && offset < 0) {
                throw new IllegalArgumentException("Offset must not be negative");
            }
            this.offset = offset;
            return this;
        }

        public Query build() {
            return new Query(this);
        }
    }
}
