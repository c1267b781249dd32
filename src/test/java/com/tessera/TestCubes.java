package com.tessera;

import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.Predicates;
import com.tessera.schema.CubeDefinition;
import com.tessera.schema.JoinRelationship;
import com.tessera.schema.MeasureType;
import com.tessera.schema.MemberType;
import com.tessera.schema.SchemaRegistry;
import com.tessera.schema.TenantFilter;
import com.tessera.security.SecurityContext;

import java.time.Instant;

/**
 * Shared schema for tests.
 *
 * <pre>
 * Orders --belongsTo--> Customers &lt;--belongsTo-- Events (event stream)
 * Products (no joins)
 * Audit    (no joins, no tenant filter)
 * </pre>
 */
public final class TestCubes {

    /** A Monday. */
    public static final Instant NOW = Instant.parse("2025-11-17T10:30:00Z");

    private TestCubes() {
    }

    public static SecurityContext tenant(Object organisationId) {
        return SecurityContext.of("organisationId", organisationId);
    }

    public static TenantFilter organisationFilter(String cube) {
        return context -> Predicates.equalTo(ColumnRef.of(cube, "organisation_id"), context.require("organisationId"));
    }

    public static CubeDefinition orders() {
        return CubeDefinition.builder("Orders")
            .sqlTable("orders")
            .measure("count", MeasureType.COUNT, null)
            .measure("revenue", MeasureType.SUM, "amount")
            .measure("averageAmount", MeasureType.AVG, "amount")
            .measure("uniqueCustomers", MeasureType.COUNT_DISTINCT, "customer_id")
            .measure("completedCount", "Completed orders", MeasureType.COUNT, null,
                Predicates.equalTo(ColumnRef.of("Orders", "status"), "completed"))
            .dimension("id", "Order id", MemberType.NUMBER, "id", true)
            .dimension("status", MemberType.STRING, "status")
            .dimension("amount", MemberType.NUMBER, "amount")
            .dimension("paid", MemberType.BOOLEAN, "is_paid")
            .timeDimension("createdAt", "created_at")
            .join("Customers", JoinRelationship.BELONGS_TO, "customer_id", "id")
            .tenantFilter(organisationFilter("Orders"))
            .build();
    }

    public static CubeDefinition customers() {
        return CubeDefinition.builder("Customers")
            .sqlTable("customers")
            .measure("count", MeasureType.COUNT, null)
            .dimension("id", "Customer id", MemberType.NUMBER, "id", true)
            .dimension("name", MemberType.STRING, "name")
            .dimension("country", MemberType.STRING, "country")
            .timeDimension("createdAt", "created_at")
            .tenantFilter(organisationFilter("Customers"))
            .build();
    }

    public static CubeDefinition events() {
        return CubeDefinition.builder("Events")
            .sqlTable("events")
            .measure("count", MeasureType.COUNT, null)
            .dimension("userId", MemberType.STRING, "user_id")
            .dimension("eventType", MemberType.STRING, "event_type")
            .timeDimension("timestamp", "occurred_at")
            .join("Customers", JoinRelationship.BELONGS_TO, "user_id", "id")
            .eventStream("userId", "timestamp")
            .tenantFilter(organisationFilter("Events"))
            .build();
    }

    public static CubeDefinition products() {
        return CubeDefinition.builder("Products")
            .measure("count", MeasureType.COUNT, null)
            .dimension("sku", MemberType.STRING, "sku")
            .tenantFilter(organisationFilter("Products"))
            .build();
    }

    public static CubeDefinition audit() {
        return CubeDefinition.builder("Audit")
            .measure("count", MeasureType.COUNT, null)
            .dimension("action", MemberType.STRING, "action")
            .build();
    }

    public static SchemaRegistry registry() {
        return SchemaRegistry.builder()
            .register(orders())
            .register(customers())
            .register(events())
            .register(products())
            .register(audit())
            .build();
    }
}
