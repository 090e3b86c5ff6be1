package com.color.x.service;

import com.color.x.dto.SolutionSummary;

/**
 * Receives every summary produced by a batch solve, keyed by {@link SolutionSummary#getGraphName()}.
 */
public interface SolutionConsumer {
    void accept(SolutionSummary summary);
}
