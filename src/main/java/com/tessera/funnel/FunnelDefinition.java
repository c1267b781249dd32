package com.tessera.funnel;

import com.tessera.query.DateRangeExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A declared funnel over an event-stream cube.
 *
 * {@code bindingKey} and {@code timeDimension} are fully qualified members
 * ({@code Events.userId}); the binding key's cube is the funnel's primary
 * cube. Structural validation happens when the funnel is planned.
 */
public final class FunnelDefinition {
    private final String bindingKey;
    private final String timeDimension;
    private final List<FunnelStep> steps;
    private final boolean includeTimeMetrics;
    private final ConversionWindow globalTimeWindow;
    private final DateRangeExpression dateRange;

    private FunnelDefinition(Builder builder) {
        this.bindingKey = builder.bindingKey;
        this.timeDimension = builder.timeDimension;
        this.steps = Collections.unmodifiableList(new ArrayList<>(builder.steps));
        this.includeTimeMetrics = builder.includeTimeMetrics;
        this.globalTimeWindow = builder.globalTimeWindow;
        this.dateRange = builder.dateRange;
    }

    public static Builder builder(String bindingKey, String timeDimension) {
        return new Builder(bindingKey, timeDimension);
    }

    public String getBindingKey() {
        return bindingKey;
    }

    public String getTimeDimension() {
        return timeDimension;
    }

    public List<FunnelStep> getSteps() {
        return steps;
    }

    public boolean isIncludeTimeMetrics() {
        return includeTimeMetrics;
    }

    public ConversionWindow getGlobalTimeWindow() {
        return globalTimeWindow;
    }

    public DateRangeExpression getDateRange() {
        return dateRange;
    }

    @Override
    public String toString() {
        return "FunnelDefinition{" +
            "bindingKey='" + bindingKey + '\'' +
            ", timeDimension='" + timeDimension + '\'' +
            ", steps=" + steps +
            ", globalTimeWindow=" + globalTimeWindow +
            '}';
    }

    public static final class Builder {
        private final String bindingKey;
        private final String timeDimension;
        private final List<FunnelStep> steps = new ArrayList<>();
        private boolean includeTimeMetrics;
        private ConversionWindow globalTimeWindow;
        private DateRangeExpression dateRange;

        private Builder(String bindingKey, String timeDimension) {
            this.bindingKey = bindingKey;
            this.timeDimension = timeDimension;
        }

        public Builder step(FunnelStep step) {
            steps.add(step);
            return this;
        }

        public Builder steps(List<FunnelStep> steps) {
            this.steps.addAll(steps);
            return this;
        }

        public Builder includeTimeMetrics(boolean includeTimeMetrics) {
            this.includeTimeMetrics = includeTimeMetrics;
            return this;
        }

        public Builder globalTimeWindow(ConversionWindow globalTimeWindow) {
            this.globalTimeWindow = globalTimeWindow;
            return this;
        }

        public Builder dateRange(DateRangeExpression dateRange) {
            this.dateRange = dateRange;
            return this;
        }

        public FunnelDefinition build() {
            return new FunnelDefinition(this);
        }
    }
}
