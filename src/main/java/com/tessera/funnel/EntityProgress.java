package com.tessera.funnel;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Immutable progress of one binding-key value. {@code stepTimes[i]} is the
 * time step i was matched; its size is the number of steps entered.
 */
public final class EntityProgress {
    private final Object bindingKeyValue;
    private final FunnelState state;
    private final List<Instant> stepTimes;

    EntityProgress(Object bindingKeyValue, FunnelState state, List<Instant> stepTimes) {
        this.bindingKeyValue = bindingKeyValue;
        this.state = state;
        this.stepTimes = Collections.unmodifiableList(new ArrayList<>(stepTimes));
    }

    public static EntityProgress start(Object bindingKeyValue) {
        return new EntityProgress(bindingKeyValue, FunnelState.AWAITING_STEP, List.of());
    }

    public Object getBindingKeyValue() {
        return bindingKeyValue;
    }

    public FunnelState getState() {
        return state;
    }

    public List<Instant> getStepTimes() {
        return stepTimes;
    }

    /**
     * Index of the step this entity waits for; equals the number of matched steps.
     */
    public int getNextStep() {
        return stepTimes.size();
    }

    public boolean hasEntered(int stepIndex) {
        return stepTimes.size() > stepIndex;
    }

    /**
     * Gap between matching {@code stepIndex - 1} and {@code stepIndex}.
     */
    public Duration timeToStep(int stepIndex) {
        if (stepIndex < 1 || !hasEntered(stepIndex)) {
            throw new IllegalArgumentException("Step " + stepIndex + " has no measured conversion time");
        }
        return Duration.between(stepTimes.get(stepIndex - 1), stepTimes.get(stepIndex));
    }

    EntityProgress advance(Instant eventTime, int totalSteps) {
        List<Instant> times = new ArrayList<>(stepTimes);
        times.add(eventTime);
        FunnelState next = times.size() == totalSteps ? FunnelState.COMPLETED : FunnelState.AWAITING_STEP;
        return new EntityProgress(bindingKeyValue, next, times);
    }

    EntityProgress expire() {
        return new EntityProgress(bindingKeyValue, FunnelState.EXPIRED, stepTimes);
    }

    @Override
    public String toString() {
        return bindingKeyValue + ":" + state + (state == FunnelState.AWAITING_STEP ? "(" + getNextStep() + ")" : "");
    }
}
