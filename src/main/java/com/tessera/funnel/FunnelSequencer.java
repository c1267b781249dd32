package com.tessera.funnel;

import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-entity funnel state machine.
 *
 * <p>{@link #transition(EntityProgress, FunnelEvent)} is a pure function of
 * the current progress and one row. An entity waiting for step i advances on
 * the next row matching step i that is strictly later than step i-1, unless
 * that row arrives later than the step's conversion window allows. Rows for
 * other steps are ignored, so one row matching several steps advances at most
 * one of them. Once step 0 is matched every row is also checked against the
 * global window. A gap exactly equal to a window is still inside it.
 *
 * <p>Entities are independent of each other; only each entity's own rows
 * must be supplied in time order.
 */
public class FunnelSequencer {

    private final List<FunnelStep> steps;
    private final ConversionWindow globalTimeWindow;
    private final ZoneId zone;

    public FunnelSequencer(List<FunnelStep> steps, ConversionWindow globalTimeWindow, ZoneId zone) {
        if (steps.isEmpty()) {
            throw new IllegalArgumentException("A funnel needs at least one step");
        }
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
        this.globalTimeWindow = globalTimeWindow;
        this.zone = zone;
    }

    public int getStepCount() {
        return steps.size();
    }

    public EntityProgress transition(EntityProgress progress, FunnelEvent event) {
        if (progress.getState().isTerminal()) {
            return progress;
        }
        int awaiting = progress.getNextStep();
        List<Instant> times = progress.getStepTimes();

        if (awaiting > 0 && globalTimeWindow != null
                && globalTimeWindow.isExceeded(times.get(0), event.getEventTime(), zone)) {
            return progress.expire();
        }

        if (event.getMatchedStepIndex() != awaiting) {
            return progress;
        }
        if (awaiting > 0 && !event.getEventTime().isAfter(times.get(awaiting - 1))) {
            return progress;
        }

        ConversionWindow window = steps.get(awaiting).getTimeToConvert();
        if (awaiting > 0 && window != null
                && window.isExceeded(times.get(awaiting - 1), event.getEventTime(), zone)) {
            return progress.expire();
        }

        return progress.advance(event.getEventTime(), steps.size());
    }

    /**
     * Runs every entity's rows through the state machine.
     *
     * @return final progress per entity, in order of first appearance
     * @throws IllegalArgumentException if a row names an unknown step or an
     *         entity's rows go back in time
     */
    public List<EntityProgress> sequence(List<FunnelEvent> events) {
        Map<Object, EntityProgress> progressByEntity = new LinkedHashMap<>();
        Map<Object, Instant> lastSeen = new LinkedHashMap<>();

        for (FunnelEvent event : events) {
            if (event.getMatchedStepIndex() < 0 || event.getMatchedStepIndex() >= steps.size()) {
                throw new IllegalArgumentException("Row matches unknown step " + event.getMatchedStepIndex()
                    + " of a " + steps.size() + "-step funnel");
            }
            Object key = event.getBindingKeyValue();
            Instant previous = lastSeen.put(key, event.getEventTime());
            if (previous != null && event.getEventTime().isBefore(previous)) {
                throw new IllegalArgumentException("Rows for '" + key + "' are not ordered by time: "
                    + event.getEventTime() + " after " + previous);
            }
            EntityProgress current = progressByEntity.computeIfAbsent(key, EntityProgress::start);
            progressByEntity.put(key, transition(current, event));
        }
        return new ArrayList<>(progressByEntity.values());
    }
}
