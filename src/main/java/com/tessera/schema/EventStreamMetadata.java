package com.tessera.schema;

/**
 * Marks a cube as an event stream usable as a funnel's primary cube.
 * Both members are unqualified dimension names of the declaring cube.
 */
public final class EventStreamMetadata {
    private final String bindingKey;
    private final String timeDimension;

    public EventStreamMetadata(String bindingKey, String timeDimension) {
        this.bindingKey = bindingKey;
        this.timeDimension = timeDimension;
    }

    public String getBindingKey() {
        return bindingKey;
    }

    public String getTimeDimension() {
        return timeDimension;
    }
}
