package com.tessera.descriptor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * JSON shape of a time dimension. {@code dateRange} is kept as a tree node
 * because it may be a string or a two-element array.
 */
public class TimeDimensionDescriptor {

    @JsonProperty("dimension")
    private String dimension;

    @JsonProperty("granularity")
    private String granularity;

    @JsonProperty("dateRange")
    private JsonNode dateRange;

    public String getDimension() {
        return dimension;
    }

    public void setDimension(String dimension) {
        this.dimension = dimension;
    }

    public String getGranularity() {
        return granularity;
    }

    public void setGranularity(String granularity) {
        this.granularity = granularity;
    }

    public JsonNode getDateRange() {
        return dateRange;
    }

    public void setDateRange(JsonNode dateRange) {
        this.dateRange = dateRange;
    }
}
