package com.tessera.error;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Stable identifiers for every request-scoped compilation failure.
 * Callers can switch on these instead of exception types when the failure
 * crosses a serialization boundary.
 */
public enum ErrorCode {

    UNKNOWN_MEMBER("unknown_member"),
    DUPLICATE_MEMBER("duplicate_member"),
    INVALID_MEMBER_USAGE("invalid_member_usage"),
    EMPTY_QUERY("empty_query"),
    INVALID_FILTER("invalid_filter"),
    INVALID_DATE_RANGE("invalid_date_range"),
    UNREACHABLE_CUBE("unreachable_cube"),
    MISSING_SECURITY_CONTEXT("missing_security_context"),
    TENANT_FILTER("tenant_filter"),
    FUNNEL_NOT_SUPPORTED("funnel_not_supported"),
    FUNNEL_STEP_ORDER("funnel_step_order"),
    INVALID_FUNNEL("invalid_funnel"),
    INVALID_DESCRIPTOR("invalid_descriptor"),
    SCHEMA_DEFINITION("schema_definition");

    private final String value;

    ErrorCode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
