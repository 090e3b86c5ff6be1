package com.color.x.processors.coloring;

import com.color.x.config.ProbabilisticSearchConfig;
import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.random.RandomGenerator;

/**
 * Repeated independent-set construction with adaptive seed weights, followed by local search on the best trial.
 * <p>
 * Weights start uniform. After each trial the vertices involved in conflicts of that trial's coloring gain
 * {@code reweightIncrement} and the vector is renormalized, making them likelier seeds in later trials.
 * </p>
 */
@Slf4j
public class AdaptiveTrialSearch {
    private final ColorGraph graph;
    private final ProbabilisticSearchConfig config;
    private final IndependentSetConstructor constructor;
    private final LocalSearchRefiner refiner;

    public AdaptiveTrialSearch(ColorGraph graph, ProbabilisticSearchConfig config, RandomGenerator random) {
        this.graph = Objects.requireNonNull(graph, "ColorGraph cannot be null.");
        this.config = Objects.requireNonNull(config, "ProbabilisticSearchConfig cannot be null.");
        this.constructor = new IndependentSetConstructor(graph, random);
        this.refiner = new LocalSearchRefiner(graph, random, config.getPerturbationFraction());
    }

    /**
     * Best trial coloring by color count, before refinement. Null only if the deadline expired before the
     * first trial completed.
     */
    public ColoringRecords.TrialResult search(SolveDeadline deadline) {
        ProbabilityWeights weights = ProbabilityWeights.uniform(graph.vertexCount());
        ColoringRecords.TrialResult best = null;

        for (int trial = 1; trial <= config.getTrials(); trial++) {
            if (deadline.isExpired()) {
                log.warn("Trial loop stopped by deadline after {} of {} trials", trial - 1, config.getTrials());
                break;
            }
            ColoringRecords.TrialResult result = constructor.constructOnce(weights, deadline);
            if (result == null) {
                break;
            }
            if (best == null || result.getColorCount() < best.getColorCount()) {
                best = result;
                log.debug("Trial {} improved best to {} colors", trial, best.getColorCount());
            }

            ColoringRecords.ConflictReport conflicts = ConflictAnalyzer.analyze(graph, result.getColoring());
            weights = weights.reweight(conflicts.getConflictVertices(), config.getReweightIncrement()).normalize();
        }
        return best;
    }

    /**
     * Trial search followed by local search on the best trial, both bounded by {@code deadline}.
     */
    public ColoringRecords.ColoringResult run(SolveDeadline deadline) {
        if (graph.isEmpty()) {
            return ColoringRecords.ColoringResult.complete(Coloring.uncolored(0));
        }

        ColoringRecords.TrialResult best = search(deadline);
        if (best == null) {
            return ColoringRecords.ColoringResult.expired(null);
        }
        if (deadline.isExpired()) {
            return ColoringRecords.ColoringResult.expired(best.getColoring());
        }

        ColoringRecords.RefinementResult refined =
                refiner.refine(best.getColoring(), config.getLocalSearchIterations(), deadline);
        log.debug("Local search ran {} rounds ({} improving, {} perturbations): {} -> {} colors",
                refined.getRoundsRun(), refined.getImprovingRounds(), refined.getPerturbations(),
                best.getColorCount(), refined.getColorCount());

        if (refined.getRoundsRun() < config.getLocalSearchIterations()) {
            return ColoringRecords.ColoringResult.expired(refined.getColoring());
        }
        return ColoringRecords.ColoringResult.complete(refined.getColoring());
    }
}
