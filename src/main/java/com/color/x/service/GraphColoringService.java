package com.color.x.service;

import com.color.x.dto.BatchSummary;
import com.color.x.dto.SolutionSummary;
import com.color.x.dto.enums.ColoringAlgorithm;
import com.color.x.models.ColorGraph;

import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.CompletableFuture;

public interface GraphColoringService {
    SolutionSummary solve(String graphName, ColorGraph graph, ColoringAlgorithm algorithm);
    SolutionSummary solve(String graphName, ColorGraph graph, ColoringAlgorithm algorithm, Duration budget);
    CompletableFuture<SolutionSummary> solveAsync(String graphName, ColorGraph graph, ColoringAlgorithm algorithm);
    CompletableFuture<SolutionSummary> solveAsync(String graphName, ColorGraph graph, ColoringAlgorithm algorithm, Duration budget);
    BatchSummary solveAll(Collection<String> graphNames, ColoringAlgorithm algorithm);
    BatchSummary solveAll(ColoringAlgorithm algorithm);
}
