package com.tessera.funnel;

import com.tessera.query.Filter;

/**
 * One step of a funnel: the events matching {@code filter}, optionally
 * required to follow the previous step within {@code timeToConvert}.
 */
public final class FunnelStep {
    private final String name;
    private final Filter filter;
    private final ConversionWindow timeToConvert;

    public FunnelStep(String name, Filter filter, ConversionWindow timeToConvert) {
        this.name = name;
        this.filter = filter;
        this.timeToConvert = timeToConvert;
    }

    public FunnelStep(String name, Filter filter) {
        this(name, filter, null);
    }

    public String getName() {
        return name;
    }

    public Filter getFilter() {
        return filter;
    }

    public ConversionWindow getTimeToConvert() {
        return timeToConvert;
    }

    @Override
    public String toString() {
        return name + (timeToConvert != null ? " within " + timeToConvert : "");
    }
}
