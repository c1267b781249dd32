package com.tessera.descriptor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON shape of a filter: either a member condition
 * ({@code member}, {@code operator}, {@code values}) or a logical group
 * ({@code and} / {@code or}) of nested filters. An {@code inDateRange}
 * condition may give a {@code dateRange} (string or two-element array)
 * instead of values.
 */
public class FilterDescriptor {

    @JsonProperty("member")
    private String member;

    @JsonProperty("operator")
    private String operator;

    @JsonProperty("values")
    private List<Object> values;

    @JsonProperty("dateRange")
    private JsonNode dateRange;

    @JsonProperty("and")
    private List<FilterDescriptor> and;

    @JsonProperty("or")
    private List<FilterDescriptor> or;

    public FilterDescriptor() {
    }

    public FilterDescriptor(String member, String operator, List<Object> values) {
        this.member = member;
        this.operator = operator;
        this.values = values;
    }

    public String getMember() {
        return member;
    }

    public void setMember(String member) {
        this.member = member;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public List<Object> getValues() {
        return values;
    }

    public void setValues(List<Object> values) {
        this.values = values;
    }

    public JsonNode getDateRange() {
        return dateRange;
    }

    public void setDateRange(JsonNode dateRange) {
        this.dateRange = dateRange;
    }

    public List<FilterDescriptor> getAnd() {
        return and;
    }

    public void setAnd(List<FilterDescriptor> and) {
        this.and = and;
    }

    public List<FilterDescriptor> getOr() {
        return or;
    }

    public void setOr(List<FilterDescriptor> or) {
        this.or = or;
    }
}
