package com.tessera.descriptor;

import com.fasterxml.jackson.annotation.JsonProperty;

public class FunnelStepDescriptor {

    @JsonProperty("name")
    private String name;

    @JsonProperty("filter")
    private FilterDescriptor filter;

    // ISO-8601 duration, e.g. "P7D"
    @JsonProperty("timeToConvert")
    private String timeToConvert;

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public FilterDescriptor getFilter() {
        return filter;
    }

    public void setFilter(FilterDescriptor filter) {
        this.filter = filter;
    }

    public String getTimeToConvert() {
        return timeToConvert;
    }

    public void setTimeToConvert(String timeToConvert) {
        this.timeToConvert = timeToConvert;
    }
}
