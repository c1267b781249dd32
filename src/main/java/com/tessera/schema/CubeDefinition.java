package com.tessera.schema;

import com.tessera.error.SchemaDefinitionException;
import com.tessera.query.predicate.Predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable definition of a cube: its measures, dimensions, joins, tenant
 * filter and optional event-stream metadata.
 *
 * Cubes are assembled with {@link #builder(String)} and registered once in a
 * {@link SchemaRegistry}. Member order follows declaration order.
 *
 * Example:
 * <pre>
 * CubeDefinition orders = CubeDefinition.builder("Orders")
 *     .sqlTable("orders")
 *     .dimension("status", MemberType.STRING, "status")
 *     .timeDimension("createdAt", "created_at")
 *     .measure("count", MeasureType.COUNT, null)
 *     .measure("revenue", MeasureType.SUM, "amount")
 *     .join("Customers", JoinRelationship.BELONGS_TO, "customer_id", "id")
 *     .tenantFilter(ctx -&gt; Predicates.equalTo(ColumnRef.of("Orders", "organisation_id"),
 *         ctx.require("organisationId")))
 *     .build();
 * </pre>
 */
public final class CubeDefinition {
    private final String name;
    private final String title;
    private final String sqlTable;
    private final Map<String, Measure> measures;
    private final Map<String, Dimension> dimensions;
    private final Map<String, CubeJoin> joins;
    private final TenantFilter tenantFilter;
    private final EventStreamMetadata eventStream;

    private CubeDefinition(Builder builder) {
        this.name = builder.name;
        this.title = builder.title != null ? builder.title : builder.name;
        this.sqlTable = builder.sqlTable;
        this.measures = Collections.unmodifiableMap(new LinkedHashMap<>(builder.measures));
        this.dimensions = Collections.unmodifiableMap(new LinkedHashMap<>(builder.dimensions));
        this.joins = Collections.unmodifiableMap(new LinkedHashMap<>(builder.joins));
        this.tenantFilter = builder.tenantFilter;
        this.eventStream = builder.eventStream;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public String getName() {
        return name;
    }

    public String getTitle() {
        return title;
    }

    public String getSqlTable() {
        return sqlTable;
    }

    public Map<String, Measure> getMeasures() {
        return measures;
    }

    public Map<String, Dimension> getDimensions() {
        return dimensions;
    }

    public Optional<Measure> findMeasure(String memberName) {
        return Optional.ofNullable(measures.get(memberName));
    }

    public Optional<Dimension> findDimension(String memberName) {
        return Optional.ofNullable(dimensions.get(memberName));
    }

    /**
     * Joins declared by this cube, keyed by target cube name.
     */
    public Map<String, CubeJoin> getJoins() {
        return joins;
    }

    /**
     * The tenant filter, or null if the cube declares none. A cube without a
     * tenant filter can be registered but never appears in a compiled plan.
     */
    public TenantFilter getTenantFilter() {
        return tenantFilter;
    }

    public Optional<EventStreamMetadata> getEventStream() {
        return Optional.ofNullable(eventStream);
    }

    public boolean isEventStream() {
        return eventStream != null;
    }

    @Override
    public String toString() {
        return "Cube[" + name + "]";
    }

    public static final class Builder {
        private final String name;
        private String title;
        private String sqlTable;
        private final Map<String, Measure> measures = new LinkedHashMap<>();
        private final Map<String, Dimension> dimensions = new LinkedHashMap<>();
        private final Map<String, CubeJoin> joins = new LinkedHashMap<>();
        private final List<String> memberNames = new ArrayList<>();
        private TenantFilter tenantFilter;
        private EventStreamMetadata eventStream;

        private Builder(String name) {
            if (name == null || name.trim().isEmpty() || name.contains(".")) {
                throw new SchemaDefinitionException("Invalid cube name: '" + name + "'");
            }
            this.name = name;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder sqlTable(String sqlTable) {
            this.sqlTable = sqlTable;
            return this;
        }

        public Builder measure(String memberName, MeasureType type, String sql) {
            return measure(memberName, null, type, sql, null);
        }

        public Builder measure(String memberName, String memberTitle, MeasureType type, String sql, Predicate filter) {
            claim(memberName);
            measures.put(memberName, new Measure(name, memberName, memberTitle, type, sql, filter));
            return this;
        }

        public Builder dimension(String memberName, MemberType type, String sql) {
            return dimension(memberName, null, type, sql, false);
        }

        public Builder dimension(String memberName, String memberTitle, MemberType type, String sql,
                                 boolean primaryKey) {
            claim(memberName);
            dimensions.put(memberName, new Dimension(name, memberName, memberTitle, type, sql, primaryKey));
            return this;
        }

        public Builder timeDimension(String memberName, String sql) {
            return dimension(memberName, MemberType.TIME, sql);
        }

        public Builder join(String targetCube, JoinRelationship relationship, String sourceColumn,
                            String targetColumn) {
            if (joins.containsKey(targetCube)) {
                throw new SchemaDefinitionException("Cube '" + name + "' declares two joins to '" + targetCube + "'");
            }
            joins.put(targetCube, new CubeJoin(targetCube, relationship, sourceColumn, targetColumn));
            return this;
        }

        public Builder tenantFilter(TenantFilter tenantFilter) {
            this.tenantFilter = tenantFilter;
            return this;
        }

        public Builder eventStream(String bindingKey, String timeDimension) {
            this.eventStream = new EventStreamMetadata(bindingKey, timeDimension);
            return this;
        }

        public CubeDefinition build() {
            if (eventStream != null) {
                Dimension key = dimensions.get(eventStream.getBindingKey());
                Dimension time = dimensions.get(eventStream.getTimeDimension());
                if (key == null) {
                    throw new SchemaDefinitionException(
                        "Event stream binding key '" + eventStream.getBindingKey() + "' is not a dimension of '" + name + "'");
                }
                if (time == null || !time.isTime()) {
                    throw new SchemaDefinitionException(
                        "Event stream time dimension '" + eventStream.getTimeDimension() + "' is not a time dimension of '" + name + "'");
                }
            }
            return new CubeDefinition(this);
        }

        private void claim(String memberName) {
            if (memberNames.contains(memberName)) {
                throw new SchemaDefinitionException("Cube '" + name + "' declares member '" + memberName + "' twice");
            }
            memberNames.add(memberName);
        }
    }
}
