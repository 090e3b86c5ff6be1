package com.color.x.dto;

import com.color.x.dto.enums.ColoringAlgorithm;
import com.color.x.dto.enums.SolutionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

@Value
@Builder
public class BatchSummary {
    ColoringAlgorithm algorithm;
    int totalGraphs;
    int solvedGraphs;
    int timedOutGraphs;
    Duration averageDuration;
    List<SolutionSummary> results;

    public static BatchSummary of(ColoringAlgorithm algorithm, List<SolutionSummary> results) {
        long totalNanos = 0;
        int solved = 0;
        int timedOut = 0;
        for (SolutionSummary summary : results) {
            totalNanos += summary.getDuration().toNanos();
            if (summary.isSolved()) {
                solved++;
            }
            if (summary.getStatus() == SolutionStatus.TIMEOUT) {
                timedOut++;
            }
        }
        Duration average = results.isEmpty() ? Duration.ZERO : Duration.ofNanos(totalNanos / results.size());
        return BatchSummary.builder()
                .algorithm(algorithm)
                .totalGraphs(results.size())
                .solvedGraphs(solved)
                .timedOutGraphs(timedOut)
                .averageDuration(average)
                .results(List.copyOf(results))
                .build();
    }
}
