package com.color.x.dto;

import com.color.x.dto.enums.ColoringAlgorithm;
import com.color.x.dto.enums.SolutionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Map;

/**
 * Immutable outcome of one solve, produced the same way for every algorithm.
 * {@code coloring} and {@code numColors} are null unless {@code solved}.
 */
@Value
@Builder
public class SolutionSummary {
    String graphName;
    ColoringAlgorithm algorithm;
    SolutionStatus status;
    Map<Integer, Integer> coloring;
    Integer numColors;
    Duration duration;
    int numNodes;
    int numEdges;
    double edgeDensity;
    boolean solved;
}
