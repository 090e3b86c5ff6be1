package com.color.x.service;

import com.color.x.models.Coloring;
import it.unimi.dsi.fastutil.ints.IntSet;
import lombok.AllArgsConstructor;
import lombok.Data;

public interface ColoringRecords {

    /**
     * Outcome of one engine run. {@code coloring} is null when the deadline expired before any complete
     * coloring existed.
     */
    @AllArgsConstructor
    @Data
    class ColoringResult {
        private final Coloring coloring;
        private final int colorCount;
        private final boolean timedOut;

        public static ColoringResult complete(Coloring coloring) {
            return new ColoringResult(coloring, coloring.colorCount(), false);
        }

        public static ColoringResult expired(Coloring bestSoFar) {
            return new ColoringResult(bestSoFar, bestSoFar == null ? 0 : bestSoFar.colorCount(), true);
        }

        public boolean hasColoring() {
            return coloring != null;
        }
    }

    @AllArgsConstructor
    @Data
    class TrialResult {
        private final Coloring coloring;
        private final int colorCount;
    }

    @AllArgsConstructor
    @Data
    class ConflictReport {
        private final int conflictCount;
        private final IntSet conflictVertices;

        public boolean isConflictFree() {
            return conflictCount == 0;
        }
    }

    @AllArgsConstructor
    @Data
    class RefinementResult {
        private final Coloring coloring;
        private final int colorCount;
        private final int roundsRun;
        private final int improvingRounds;
        private final int perturbations;
    }
}
