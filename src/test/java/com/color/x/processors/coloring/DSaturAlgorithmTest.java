package com.color.x.processors.coloring;

import com.color.x.models.ColorGraph;
import com.color.x.models.Coloring;
import com.color.x.models.GraphFixtures;
import com.color.x.service.ColoringRecords;
import com.color.x.utils.SolveDeadline;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DSaturAlgorithmTest {

    @Test
    void emptyGraphNeedsNoColors() {
        ColoringRecords.ColoringResult result = new DSaturAlgorithm(ColorGraph.empty()).colorGraph();

        assertThat(result.isTimedOut()).isFalse();
        assertThat(result.getColorCount()).isZero();
        assertThat(result.getColoring().vertexCount()).isZero();
    }

    @Test
    void edgelessGraphUsesOneColor() {
        ColoringRecords.ColoringResult result = new DSaturAlgorithm(GraphFixtures.edgeless(6)).colorGraph();

        assertThat(result.getColorCount()).isEqualTo(1);
        assertThat(result.getColoring().isComplete()).isTrue();
    }

    @Test
    void evenCycleIsTwoColored() {
        ColorGraph c4 = GraphFixtures.cycle(4);

        ColoringRecords.ColoringResult result = new DSaturAlgorithm(c4).colorGraph();

        assertThat(result.getColorCount()).isEqualTo(2);
        assertThat(result.getColoring().isValidFor(c4)).isTrue();
    }

    @Test
    void oddCycleNeedsThreeColors() {
        ColorGraph c5 = GraphFixtures.cycle(5);

        ColoringRecords.ColoringResult result = new DSaturAlgorithm(c5).colorGraph();

        assertThat(result.getColorCount()).isEqualTo(3);
        assertThat(result.getColoring().isValidFor(c5)).isTrue();
    }

    @Test
    void completeGraphUsesOneColorPerVertex() {
        ColorGraph k5 = GraphFixtures.complete(5);

        ColoringRecords.ColoringResult result = new DSaturAlgorithm(k5).colorGraph();

        assertThat(result.getColorCount()).isEqualTo(5);
        assertThat(result.getColoring().isValidFor(k5)).isTrue();
    }

    @Test
    void starCenterAndLeavesSplitIntoTwoColors() {
        ColorGraph star = GraphFixtures.star(5);

        ColoringRecords.ColoringResult result = new DSaturAlgorithm(star).colorGraph();

        assertThat(result.getColorCount()).isEqualTo(2);
        assertThat(result.getColoring().get(1)).isZero();
        for (int leaf = 2; leaf <= 6; leaf++) {
            assertThat(result.getColoring().get(leaf)).isEqualTo(1);
        }
    }

    @Test
    void vertexOneIsColoredFirstWithColorZero() {
        ColorGraph graph = ColorGraph.builder(3).addEdge(2, 3).build();

        Coloring coloring = new DSaturAlgorithm(graph).colorGraph().getColoring();

        assertThat(coloring.get(1)).isZero();
        assertThat(coloring.get(2)).isZero();
        assertThat(coloring.get(3)).isEqualTo(1);
    }

    @Test
    void repeatedRunsProduceIdenticalColorings() {
        ColorGraph graph = GraphFixtures.random(120, 0.1, 7L);

        Coloring first = new DSaturAlgorithm(graph).colorGraph().getColoring();
        Coloring second = new DSaturAlgorithm(graph).colorGraph().getColoring();

        assertThat(first).isEqualTo(second);
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 2L, 3L, 4L})
    void randomGraphsGetValidGapFreeColorings(long seed) {
        ColorGraph graph = GraphFixtures.random(200, 0.05, seed);

        ColoringRecords.ColoringResult result = new DSaturAlgorithm(graph).colorGraph();
        Coloring coloring = result.getColoring();

        assertThat(coloring.isValidFor(graph)).isTrue();
        assertThat(coloring.maxColor()).isEqualTo(result.getColorCount() - 1);
        assertThat(result.getColorCount()).isLessThanOrEqualTo(maxDegree(graph) + 1);
    }

    @Test
    void expiredDeadlineYieldsTimedOutResultWithoutColoring() {
        ColorGraph graph = GraphFixtures.random(300, 0.05, 11L);

        ColoringRecords.ColoringResult result =
                new DSaturAlgorithm(graph).colorGraph(SolveDeadline.after(Duration.ZERO));

        assertThat(result.isTimedOut()).isTrue();
        assertThat(result.hasColoring()).isFalse();
    }

    @Test
    void instanceCannotBeReused() {
        DSaturAlgorithm algorithm = new DSaturAlgorithm(GraphFixtures.cycle(4));
        algorithm.colorGraph();

        assertThatThrownBy(algorithm::colorGraph).isInstanceOf(IllegalStateException.class);
    }

    private static int maxDegree(ColorGraph graph) {
        int max = 0;
        for (int v = 1; v <= graph.vertexCount(); v++) {
            max = Math.max(max, graph.degree(v));
        }
        return max;
    }
}
