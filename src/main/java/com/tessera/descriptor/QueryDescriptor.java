package com.tessera.descriptor;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declarative query request as received over the wire
 */
public class QueryDescriptor {

    @JsonProperty("measures")
    private List<String> measures = new ArrayList<>();

    @JsonProperty("dimensions")
    private List<String> dimensions = new ArrayList<>();

    @JsonProperty("timeDimensions")
    private List<TimeDimensionDescriptor> timeDimensions = new ArrayList<>();

    @JsonProperty("filters")
    private List<FilterDescriptor> filters = new ArrayList<>();

    @JsonProperty("order")
    private Map<String, String> order = new LinkedHashMap<>();

    @JsonProperty("limit")
    private Integer limit;

    @JsonProperty("offset")
    private Integer offset;

    public List<String> getMeasures() {
        return measures;
    }

    public void setMeasures(List<String> measures) {
        this.measures = measures;
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    public void setDimensions(List<String> dimensions) {
        this.dimensions = dimensions;
    }

    public List<TimeDimensionDescriptor> getTimeDimensions() {
        return timeDimensions;
    }

    public void setTimeDimensions(List<TimeDimensionDescriptor> timeDimensions) {
        this.timeDimensions = timeDimensions;
    }

    public List<FilterDescriptor> getFilters() {
        return filters;
    }

    public void setFilters(List<FilterDescriptor> filters) {
        this.filters = filters;
    }

    public Map<String, String> getOrder() {
        return order;
    }

    public void setOrder(Map<String, String> order) {
        this.order = order;
    }

    public Integer getLimit() {
        return limit;
    }

    public void setLimit(Integer limit) {
        this.limit = limit;
    }

    public Integer getOffset() {
        return offset;
    }

    public void setOffset(Integer offset) {
        this.offset = offset;
    }
}
