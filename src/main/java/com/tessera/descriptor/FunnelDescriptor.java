package com.tessera.descriptor;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of a funnel request, the object under the top-level {@code funnel} key.
 */
public class FunnelDescriptor {

    @JsonProperty("bindingKey")
    private String bindingKey;

    @JsonProperty("timeDimension")
    private String timeDimension;

    @JsonProperty("steps")
    private List<FunnelStepDescriptor> steps = new ArrayList<>();

    @JsonProperty("includeTimeMetrics")
    private boolean includeTimeMetrics;

    @JsonProperty("globalTimeWindow")
    private String globalTimeWindow;

    @JsonProperty("dateRange")
    private JsonNode dateRange;

    public String getBindingKey() {
        return bindingKey;
    }

    public void setBindingKey(String bindingKey) {
        this.bindingKey = bindingKey;
    }

    public String getTimeDimension() {
        return timeDimension;
    }

    public void setTimeDimension(String timeDimension) {
        this.timeDimension = timeDimension;
    }

    public List<FunnelStepDescriptor> getSteps() {
        return steps;
    }

    public void setSteps(List<FunnelStepDescriptor> steps) {
        this.steps = steps;
    }

    public boolean isIncludeTimeMetrics() {
        return includeTimeMetrics;
    }

    public void setIncludeTimeMetrics(boolean includeTimeMetrics) {
        this.includeTimeMetrics = includeTimeMetrics;
    }

    public String getGlobalTimeWindow() {
        return globalTimeWindow;
    }

    public void setGlobalTimeWindow(String globalTimeWindow) {
        this.globalTimeWindow = globalTimeWindow;
    }

    public JsonNode getDateRange() {
        return dateRange;
    }

    public void setDateRange(JsonNode dateRange) {
        this.dateRange = dateRange;
    }
}
