package com.color.x.models;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class ColorGraphTest {

    @Test
    void adjacencyIsSymmetricAndSorted() {
        ColorGraph graph = ColorGraph.builder(4)
                .addEdge(3, 1)
                .addEdge(1, 2)
                .addEdge(4, 1)
                .build();

        assertThat(graph.neighbors(1)).containsExactly(2, 3, 4);
        assertThat(graph.neighbors(3)).containsExactly(1);
        assertThat(graph.areAdjacent(1, 4)).isTrue();
        assertThat(graph.areAdjacent(4, 1)).isTrue();
        assertThat(graph.areAdjacent(2, 3)).isFalse();
        assertThat(graph.degree(1)).isEqualTo(3);
    }

    @Test
    void duplicateEdgesCollapse() {
        ColorGraph graph = ColorGraph.builder(2)
                .addEdge(1, 2)
                .addEdge(2, 1)
                .addEdge(1, 2)
                .build();

        assertThat(graph.edgeCount()).isEqualTo(1);
        assertThat(graph.degree(2)).isEqualTo(1);
    }

    @Test
    void rejectsSelfLoopsAndUnknownVertices() {
        ColorGraph.Builder builder = ColorGraph.builder(3);

        assertThatThrownBy(() -> builder.addEdge(2, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addEdge(0, 1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.addEdge(1, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ColorGraph.builder(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> GraphFixtures.cycle(3).neighbors(4)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void edgeDensityMatchesCompleteGraphRatio() {
        assertThat(GraphFixtures.complete(5).edgeDensity()).isEqualTo(1.0);
        assertThat(GraphFixtures.cycle(4).edgeDensity()).isCloseTo(4.0 / 6.0, offset(1e-12));
        assertThat(GraphFixtures.edgeless(1).edgeDensity()).isZero();
        assertThat(ColorGraph.empty().edgeDensity()).isZero();
    }

    @Test
    void emptyGraphHasNoVerticesOrEdges() {
        ColorGraph graph = ColorGraph.builder(0).build();

        assertThat(graph.isEmpty()).isTrue();
        assertThat(graph.vertexCount()).isZero();
        assertThat(graph.edgeCount()).isZero();
    }
}
