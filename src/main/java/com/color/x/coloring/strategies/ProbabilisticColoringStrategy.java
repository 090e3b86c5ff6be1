package com.color.x.coloring.strategies;

import com.color.x.config.ProbabilisticSearchConfig;
import com.color.x.models.ColorGraph;
import com.color.x.processors.coloring.AdaptiveTrialSearch;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.SplittableRandom;

@Component("probabilisticColoringStrategy")
@Slf4j
public class ProbabilisticColoringStrategy implements ColoringStrategy {
    private final ProbabilisticSearchConfig config;

    public ProbabilisticColoringStrategy(ProbabilisticSearchConfig config) {
        this.config = config;
    }

    @Override
    public ColoringRecords.ColoringResult color(ColorGraph graph, SolveDeadline deadline) {
        // fresh random source per solve
        SplittableRandom random = config.seedValue().isPresent()
                ? new SplittableRandom(config.seedValue().getAsLong())
                : new SplittableRandom();
        log.debug("Running probabilistic search on {} with {} trials", graph, config.getTrials());
        return new AdaptiveTrialSearch(graph, config, random).run(deadline);
    }

    @Override
    public boolean supports(String mode) {
        return "ProbabilisticColoringStrategy".equalsIgnoreCase(mode);
    }
}
