package com.color.x.coloring.strategies;

import com.color.x.models.ColorGraph;
import com.color.x.processors.coloring.DSaturAlgorithm;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Component("dsaturColoringStrategy")
@Slf4j
public class DSaturColoringStrategy implements ColoringStrategy {

    @Override
    public ColoringRecords.ColoringResult color(ColorGraph graph, SolveDeadline deadline) {
        log.debug("Running DSATUR on {}", graph);
        return new DSaturAlgorithm(graph).colorGraph(deadline);
    }

    @Override
    public boolean supports(String mode) {
        return "DSaturColoringStrategy".equalsIgnoreCase(mode);
    }
}
