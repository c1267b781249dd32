package com.tessera.funnel;

/**
 * Counts for one funnel step. {@code timeToConvert} describes the time taken
 * to reach this step from the previous one and is null for step 0 or when
 * time metrics were not requested.
 */
public final class FunnelStepResult {
    private final String name;
    private final int index;
    private final long enteredCount;
    private final long convertedCount;
    private final TimeToConvertStats timeToConvert;

    public FunnelStepResult(String name, int index, long enteredCount, long convertedCount,
                            TimeToConvertStats timeToConvert) {
        this.name = name;
        this.index = index;
        this.enteredCount = enteredCount;
        this.convertedCount = convertedCount;
        this.timeToConvert = timeToConvert;
    }

    public String getName() {
        return name;
    }

    public int getIndex() {
        return index;
    }

    public long getEnteredCount() {
        return enteredCount;
    }

    public long getConvertedCount() {
        return convertedCount;
    }

    /**
     * converted / entered, or 0 when nobody entered the step.
     */
    public double getConversionRate() {
        return enteredCount == 0 ? 0.0 : (double) convertedCount / enteredCount;
    }

    public TimeToConvertStats getTimeToConvert() {
        return timeToConvert;
    }

    @Override
    public String toString() {
        return name + "{entered=" + enteredCount + ", converted=" + convertedCount + '}';
    }
}
