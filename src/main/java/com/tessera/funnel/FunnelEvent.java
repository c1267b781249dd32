package com.tessera.funnel;

import java.time.Instant;
import java.util.Objects;

/**
 * A candidate event row handed back by the execution collaborator: the
 * entity it belongs to, when it happened and which step it matched. A row
 * matching several steps appears once per step.
 */
public final class FunnelEvent {
    private final Object bindingKeyValue;
    private final Instant eventTime;
    private final int matchedStepIndex;

    public FunnelEvent(Object bindingKeyValue, Instant eventTime, int matchedStepIndex) {
        this.bindingKeyValue = Objects.requireNonNull(bindingKeyValue, "bindingKeyValue");
        this.eventTime = Objects.requireNonNull(eventTime, "eventTime");
        this.matchedStepIndex = matchedStepIndex;
    }

    public static FunnelEvent of(Object bindingKeyValue, Instant eventTime, int matchedStepIndex) {
        return new FunnelEvent(bindingKeyValue, eventTime, matchedStepIndex);
    }

    public Object getBindingKeyValue() {
        return bindingKeyValue;
    }

    public Instant getEventTime() {
        return eventTime;
    }

    public int getMatchedStepIndex() {
        return matchedStepIndex;
    }

    @Override
    public String toString() {
        return bindingKeyValue + "@" + eventTime + "#" + matchedStepIndex;
    }
}
