package com.color.x.dto;

import com.color.x.dto.enums.ColoringAlgorithm;
import com.color.x.dto.enums.SolutionStatus;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class BatchSummaryTest {

    @Test
    void aggregatesSolvedTimedOutAndAverageDuration() {
        BatchSummary batch = BatchSummary.of(ColoringAlgorithm.DSATUR, List.of(
                summary("a", SolutionStatus.FEASIBLE, true, Duration.ofSeconds(1)),
                summary("b", SolutionStatus.TIMEOUT, false, Duration.ofSeconds(5)),
                summary("c", SolutionStatus.FEASIBLE, true, Duration.ofSeconds(3))));

        assertThat(batch.getTotalGraphs()).isEqualTo(3);
        assertThat(batch.getSolvedGraphs()).isEqualTo(2);
        assertThat(batch.getTimedOutGraphs()).isEqualTo(1);
        assertThat(batch.getAverageDuration()).isEqualTo(Duration.ofSeconds(3));
    }

    @Test
    void emptyBatchHasZeroAverage() {
        BatchSummary batch = BatchSummary.of(ColoringAlgorithm.PROBABILISTIC, List.of());

        assertThat(batch.getTotalGraphs()).isZero();
        assertThat(batch.getAverageDuration()).isEqualTo(Duration.ZERO);
    }

    private static SolutionSummary summary(String name, SolutionStatus status, boolean solved, Duration duration) {
        return SolutionSummary.builder()
                .graphName(name)
                .algorithm(ColoringAlgorithm.DSATUR)
                .status(status)
                .duration(duration)
                .solved(solved)
                .build();
    }
}
