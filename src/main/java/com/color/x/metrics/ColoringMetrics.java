package com.color.x.metrics;

import com.color.x.dto.enums.ColoringAlgorithm;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class ColoringMetrics {
    private final MeterRegistry meterRegistry;
    private final DistributionSummary colorCountSummary;

    public ColoringMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.colorCountSummary = DistributionSummary.builder("coloring_color_count")
                .description("Number of colors in solved colorings")
                .register(meterRegistry);
    }

    public void recordSolve(ColoringAlgorithm algorithm, boolean solved, Duration duration) {
        meterRegistry.timer("coloring_solve_duration", "algorithm", algorithm.name(), "solved", String.valueOf(solved))
                .record(duration);
    }

    public void recordColorCount(int colorCount) {
        colorCountSummary.record(colorCount);
    }

    public void incrementTimeouts(ColoringAlgorithm algorithm) {
        meterRegistry.counter("coloring_timeouts", "algorithm", algorithm.name()).increment();
    }

    public void incrementErrors(ColoringAlgorithm algorithm) {
        meterRegistry.counter("coloring_errors", "algorithm", algorithm.name()).increment();
    }

    public void incrementRejections() {
        meterRegistry.counter("coloring_executor_rejections").increment();
    }
}
