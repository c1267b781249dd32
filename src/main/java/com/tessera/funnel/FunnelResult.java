package com.tessera.funnel;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public final class FunnelResult {
    private final List<FunnelStepResult> steps;
    private final long completedCount;

    public FunnelResult(List<FunnelStepResult> steps, long completedCount) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.completedCount = completedCount;
    }

    public List<FunnelStepResult> getSteps() {
        return steps;
    }

    public FunnelStepResult getStep(String name) {
        return steps.stream()
            .filter(s -> s.getName().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No funnel step named '" + name + "'"));
    }

    /**
     * Entities that completed every step.
     */
    public long getCompletedCount() {
        return completedCount;
    }

    /**
     * Completed entities over entities that entered step 0.
     */
    public double getOverallConversionRate() {
        long entered = steps.isEmpty() ? 0 : steps.get(0).getEnteredCount();
        return entered == 0 ? 0.0 : (double) completedCount / entered;
    }

    @Override
    public String toString() {
        return "FunnelResult{steps=" + steps + ", completed=" + completedCount + '}';
    }
}
