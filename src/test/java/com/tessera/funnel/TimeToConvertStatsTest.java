package com.tessera.funnel;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimeToConvertStats Tests")
class TimeToConvertStatsTest {

    @Test
    @DisplayName("Should return null without samples")
    void shouldReturnNullWithoutSamples() {
        assertThat(TimeToConvertStats.of(List.of())).isNull();
    }

    @Test
    @DisplayName("Should compute average, median and p90 for an odd sample")
    void shouldComputeOddSample() {
        TimeToConvertStats stats = TimeToConvertStats.of(List.of(
            Duration.ofHours(3), Duration.ofHours(1), Duration.ofHours(2)));

        assertThat(stats.getSampleSize()).isEqualTo(3);
        assertThat(stats.getAverage()).isEqualTo(Duration.ofHours(2));
        assertThat(stats.getMedian()).isEqualTo(Duration.ofHours(2));
        assertThat(stats.getP90()).isEqualTo(Duration.ofHours(3));
    }

    @Test
    @DisplayName("Should average the middle pair for an even sample")
    void shouldComputeEvenMedian() {
        TimeToConvertStats stats = TimeToConvertStats.of(List.of(
            Duration.ofMinutes(10), Duration.ofMinutes(20), Duration.ofMinutes(40), Duration.ofMinutes(90)));

        assertThat(stats.getMedian()).isEqualTo(Duration.ofMinutes(30));
        assertThat(stats.getAverage()).isEqualTo(Duration.ofMinutes(40));
    }

    @Test
    @DisplayName("Should use the nearest rank for p90")
    void shouldUseNearestRankForP90() {
        List<Duration> samples = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            samples.add(Duration.ofDays(i));
        }

        TimeToConvertStats stats = TimeToConvertStats.of(samples);

        assertThat(stats.getP90()).isEqualTo(Duration.ofDays(9));
        assertThat(TimeToConvertStats.of(List.of(Duration.ofSeconds(5))).getP90()).isEqualTo(Duration.ofSeconds(5));
    }
}
