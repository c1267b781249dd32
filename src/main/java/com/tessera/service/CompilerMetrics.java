package com.tessera.service;

import com.tessera.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for query and funnel compilation
 * Tracks successes, failures by error code, latency and plan width
 */
@Component
public class CompilerMetrics {

    static final String COMPILE_FAILED = "tessera.compile.failed";

    @Autowired
    MeterRegistry meterRegistry;

    private Counter compilationsSucceeded;
    private Counter funnelsPlanned;
    private Counter funnelsEvaluated;
    private Timer compileLatency;
    private Timer funnelLatency;
    private DistributionSummary planCubes;

    @PostConstruct
    public void init() {
        compilationsSucceeded = Counter.builder("tessera.compile.succeeded")
            .description("Total number of queries compiled into secured plans")
            .register(meterRegistry);

        funnelsPlanned = Counter.builder("tessera.funnel.planned")
            .description("Total number of funnels planned")
            .register(meterRegistry);

        funnelsEvaluated = Counter.builder("tessera.funnel.evaluated")
            .description("Total number of funnels evaluated")
            .register(meterRegistry);

        // Timers with histogram support for percentile calculation
        compileLatency = Timer.builder("tessera.compile.latency")
            .description("Latency of query compilation")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofNanos(10_000))
            .maximumExpectedValue(Duration.ofSeconds(1))
            .register(meterRegistry);

        funnelLatency = Timer.builder("tessera.funnel.latency")
            .description("Latency of funnel sequencing")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        planCubes = DistributionSummary.builder("tessera.plan.cubes")
            .description("Number of cubes referenced by a compiled plan")
            .baseUnit("cubes")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordCompilationSucceeded(int referencedCubes) {
        compilationsSucceeded.increment();
        planCubes.record(referencedCubes);
    }

    /**
     * Failures are counted per error code; the counter is registered on first use.
     */
    public void recordCompilationFailed(ErrorCode errorCode) {
        Counter.builder(COMPILE_FAILED)
            .description("Total number of rejected compilations")
            .tag("code", errorCode.name())
            .register(meterRegistry)
            .increment();
    }

    public void recordFunnelPlanned() {
        funnelsPlanned.increment();
    }

    public void recordFunnelEvaluated() {
        funnelsEvaluated.increment();
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordCompileLatency(Timer.Sample sample) {
        sample.stop(compileLatency);
    }

    public void recordFunnelLatency(Timer.Sample sample) {
        sample.stop(funnelLatency);
    }

    public double getFailedCount(ErrorCode errorCode) {
        Counter counter = meterRegistry.find(COMPILE_FAILED).tag("code", errorCode.name()).counter();
        return counter == null ? 0.0 : counter.count();
    }

    // Getter methods for testing
    public Counter getCompilationsSucceeded() {
        return compilationsSucceeded;
    }

    public Counter getFunnelsPlanned() {
        return funnelsPlanned;
    }

    public Counter getFunnelsEvaluated() {
        return funnelsEvaluated;
    }

    public Timer getCompileLatency() {
        return compileLatency;
    }

    public Timer getFunnelLatency() {
        return funnelLatency;
    }

    public DistributionSummary getPlanCubes() {
        return planCubes;
    }
}
