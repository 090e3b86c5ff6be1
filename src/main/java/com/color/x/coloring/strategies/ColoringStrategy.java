package com.color.x.coloring.strategies;

import com.color.x.models.ColorGraph;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;

public interface ColoringStrategy {
    ColoringRecords.ColoringResult color(ColorGraph graph, SolveDeadline deadline);
    boolean supports(String mode);
}
