package com.color.x.service;

import com.color.x.coloring.strategies.ColoringStrategy;
import com.color.x.coloring.strategies.ColoringStrategyContext;
import com.color.x.dto.BatchSummary;
import com.color.x.dto.SolutionSummary;
import com.color.x.dto.enums.ColoringAlgorithm;
import com.color.x.dto.enums.SolutionStatus;
import com.color.x.exceptions.ColoringExecutionException;
import com.color.x.metrics.ColoringMetrics;
import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.utils.SolveDeadline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Slf4j
@Service
public class GraphColoringServiceImpl implements GraphColoringService {
    private final ColoringStrategyContext strategyContext;
    private final GraphProvider graphProvider;
    private final List<SolutionConsumer> consumers;
    private final ColoringMetrics metrics;
    private final ExecutorService coloringExecutor;
    private final Duration defaultBudget;
    private final long graceMillis;

    public GraphColoringServiceImpl(
            ColoringStrategyContext strategyContext,
            GraphProvider graphProvider,
            List<SolutionConsumer> consumers,
            ColoringMetrics metrics,
            @Qualifier("coloringExecutor") ExecutorService coloringExecutor,
            @Value("${coloring.timeout-seconds:600}") long timeoutSeconds,
            @Value("${coloring.timeout-grace-millis:2000}") long graceMillis) {
        this.strategyContext = strategyContext;
        this.graphProvider = graphProvider;
        this.consumers = List.copyOf(consumers);
        this.metrics = metrics;
        this.coloringExecutor = coloringExecutor;
        this.defaultBudget = Duration.ofSeconds(timeoutSeconds);
        this.graceMillis = graceMillis;
    }

    @Override
    public SolutionSummary solve(String graphName, ColorGraph graph, ColoringAlgorithm algorithm) {
        return solve(graphName, graph, algorithm, defaultBudget);
    }

    @Override
    public SolutionSummary solve(String graphName, ColorGraph graph, ColoringAlgorithm algorithm, Duration budget) {
        Objects.requireNonNull(graph, "ColorGraph cannot be null.");
        Objects.requireNonNull(algorithm, "ColoringAlgorithm cannot be null.");
        Objects.requireNonNull(budget, "Budget cannot be null.");

        ColoringStrategy strategy = strategyContext.resolve(algorithm);
        log.info("Solving graph={} algorithm={} vertices={} edges={} budget={}",
                graphName, algorithm, graph.vertexCount(), graph.edgeCount(), budget);

        long start = System.nanoTime();
        ColoringRecords.ColoringResult result;
        try {
            result = strategy.color(graph, SolveDeadline.after(budget));
        } catch (RuntimeException e) {
            throw new ColoringExecutionException("Coloring of graph " + graphName + " with " + algorithm + " failed", e);
        }
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);

        return summarize(graphName, graph, algorithm, result, elapsed, budget);
    }

    @Override
    public CompletableFuture<SolutionSummary> solveAsync(String graphName, ColorGraph graph, ColoringAlgorithm algorithm) {
        return solveAsync(graphName, graph, algorithm, defaultBudget);
    }

    @Override
    public CompletableFuture<SolutionSummary> solveAsync(String graphName, ColorGraph graph,
                                                         ColoringAlgorithm algorithm, Duration budget) {
        long hardLimitMillis = budget.toMillis() + graceMillis;
        return CompletableFuture.supplyAsync(() -> solve(graphName, graph, algorithm, budget), coloringExecutor)
                .orTimeout(hardLimitMillis, TimeUnit.MILLISECONDS)
                .exceptionally(throwable -> failureSummary(graphName, graph, algorithm, throwable,
                        Duration.ofMillis(hardLimitMillis)));
    }

    @Override
    public BatchSummary solveAll(ColoringAlgorithm algorithm) {
        return solveAll(graphProvider.listNames(), algorithm);
    }

    @Override
    public BatchSummary solveAll(Collection<String> graphNames, ColoringAlgorithm algorithm) {
        List<Map.Entry<String, ColorGraph>> graphs = graphNames.stream()
                .map(name -> Map.entry(name, graphProvider.load(name)))
                .sorted(Comparator.comparingInt(entry -> entry.getValue().vertexCount()))
                .toList();
        log.info("Starting batch of {} graphs with algorithm={}", graphs.size(), algorithm);

        List<CompletableFuture<SolutionSummary>> futures = new ArrayList<>();
        for (Map.Entry<String, ColorGraph> entry : graphs) {
            futures.add(solveAsync(entry.getKey(), entry.getValue(), algorithm)
                    .thenApply(this::publish));
        }

        List<SolutionSummary> results = new ArrayList<>();
        for (CompletableFuture<SolutionSummary> future : futures) {
            results.add(future.join());
        }

        BatchSummary batch = BatchSummary.of(algorithm, results);
        log.info("Batch finished: total={} solved={} timedOut={} averageDuration={}",
                batch.getTotalGraphs(), batch.getSolvedGraphs(), batch.getTimedOutGraphs(), batch.getAverageDuration());
        return batch;
    }

    private SolutionSummary publish(SolutionSummary summary) {
        for (SolutionConsumer consumer : consumers) {
            try {
                consumer.accept(summary);
            } catch (RuntimeException e) {
                log.error("Result consumer {} failed for graph={}: {}",
                        consumer.getClass().getSimpleName(), summary.getGraphName(), e.getMessage(), e);
            }
        }
        return summary;
    }

    private SolutionSummary summarize(String graphName, ColorGraph graph, ColoringAlgorithm algorithm,
                                      ColoringRecords.ColoringResult result, Duration elapsed, Duration budget) {
        if (result.isTimedOut() || !result.hasColoring() || elapsed.compareTo(budget) > 0) {
            log.warn("Solve of graph={} algorithm={} exceeded budget={} after {} (best effort: {} colors)",
                    graphName, algorithm, budget, elapsed, result.hasColoring() ? result.getColorCount() : "none");
            metrics.incrementTimeouts(algorithm);
            metrics.recordSolve(algorithm, false, elapsed);
            return unsolved(graphName, graph, algorithm, SolutionStatus.TIMEOUT, elapsed);
        }

        Coloring coloring = result.getColoring().copy();
        coloring.compact();
        if (!coloring.isValidFor(graph)) {
            log.error("Algorithm={} produced an invalid coloring for graph={}", algorithm, graphName);
            metrics.incrementErrors(algorithm);
            metrics.recordSolve(algorithm, false, elapsed);
            return unsolved(graphName, graph, algorithm, SolutionStatus.ERROR, elapsed);
        }

        int colors = coloring.colorCount();
        metrics.recordSolve(algorithm, true, elapsed);
        metrics.recordColorCount(colors);
        log.info("Solved graph={} algorithm={} colors={} in {}", graphName, algorithm, colors, elapsed);

        return SolutionSummary.builder()
                .graphName(graphName)
                .algorithm(algorithm)
                .status(SolutionStatus.FEASIBLE)
                .coloring(coloring.asMap())
                .numColors(colors)
                .duration(elapsed)
                .numNodes(graph.vertexCount())
                .numEdges(graph.edgeCount())
                .edgeDensity(graph.edgeDensity())
                .solved(true)
                .build();
    }

    private SolutionSummary failureSummary(String graphName, ColorGraph graph, ColoringAlgorithm algorithm,
                                           Throwable throwable, Duration hardLimit) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause() : throwable;
        if (cause instanceof TimeoutException) {
            log.warn("Solve of graph={} algorithm={} did not return within {}", graphName, algorithm, hardLimit);
            metrics.incrementTimeouts(algorithm);
            return unsolved(graphName, graph, algorithm, SolutionStatus.TIMEOUT, hardLimit);
        }
        log.error("Solve of graph={} algorithm={} failed: {}", graphName, algorithm, cause.getMessage(), cause);
        metrics.incrementErrors(algorithm);
        return unsolved(graphName, graph, algorithm, SolutionStatus.ERROR, Duration.ZERO);
    }

    private SolutionSummary unsolved(String graphName, ColorGraph graph, ColoringAlgorithm algorithm,
                                     SolutionStatus status, Duration elapsed) {
        return SolutionSummary.builder()
                .graphName(graphName)
                .algorithm(algorithm)
                .status(status)
                .coloring(null)
                .numColors(null)
                .duration(elapsed)
                .numNodes(graph.vertexCount())
                .numEdges(graph.edgeCount())
                .edgeDensity(graph.edgeDensity())
                .solved(false)
                .build();
    }
}
