package com.tessera.funnel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversion time statistics for one step: average, median and 90th
 * percentile (nearest rank) of the per-entity gaps.
 */
public final class TimeToConvertStats {
    private final int sampleSize;
    private final Duration average;
    private final Duration median;
    private final Duration p90;

    private TimeToConvertStats(int sampleSize, Duration average, Duration median, Duration p90) {
        this.sampleSize = sampleSize;
        this.average = average;
        this.median = median;
        this.p90 = p90;
    }

    /**
     * @return the statistics, or null when there are no samples
     */
    public static TimeToConvertStats of(List<Duration> samples) {
        if (samples.isEmpty()) {
            return null;
        }
        List<Duration> sorted = new ArrayList<>(samples);
        Collections.sort(sorted);
        int n = sorted.size();

        Duration total = Duration.ZERO;
        for (Duration sample : sorted) {
            total = total.plus(sample);
        }
        Duration average = total.dividedBy(n);

        Duration median = n % 2 == 1
            ? sorted.get(n / 2)
            : sorted.get(n / 2 - 1).plus(sorted.get(n / 2)).dividedBy(2);

        int rank = (int) Math.ceil(0.9 * n);
        Duration p90 = sorted.get(rank - 1);

        return new TimeToConvertStats(n, average, median, p90);
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public Duration getAverage() {
        return average;
    }

    public Duration getMedian() {
        return median;
    }

    public Duration getP90() {
        return p90;
    }

    @Override
    public String toString() {
        return "TimeToConvertStats{n=" + sampleSize + ", avg=" + average + ", median=" + median + ", p90=" + p90 + '}';
    }
}
