package com.color.x.processors.coloring;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.data.Offset.offset;

class ProbabilityWeightsTest {

    @Test
    void uniformWeightsSumToOne() {
        ProbabilityWeights weights = ProbabilityWeights.uniform(4);

        assertThat(weights.get(1)).isEqualTo(0.25);
        assertThat(weights.total()).isCloseTo(1.0, offset(1e-12));
    }

    @Test
    void reweightRaisesOnlySelectedVerticesAndLeavesOriginalUntouched() {
        ProbabilityWeights uniform = ProbabilityWeights.uniform(4);

        ProbabilityWeights raised = uniform.reweight(new IntOpenHashSet(new int[]{2, 3}), 0.1).normalize();

        assertThat(uniform.get(2)).isEqualTo(0.25);
        assertThat(raised.total()).isCloseTo(1.0, offset(1e-12));
        assertThat(raised.get(2)).isGreaterThan(raised.get(1));
        assertThat(raised.get(2)).isCloseTo(0.35 / 1.2, offset(1e-12));
        assertThat(raised.get(1)).isCloseTo(0.25 / 1.2, offset(1e-12));
    }

    @Test
    void normalizingZeroVectorKeepsItUnchanged() {
        ProbabilityWeights zero = ProbabilityWeights.of(0.0, 0.0);

        assertThat(zero.normalize().total()).isZero();
    }

    @Test
    void rejectsInvalidValues() {
        assertThatThrownBy(() -> ProbabilityWeights.of(0.5, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProbabilityWeights.of(Double.NaN)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProbabilityWeights.uniform(2).reweight(new IntOpenHashSet(new int[]{3}), 0.1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProbabilityWeights.uniform(2).reweight(new IntOpenHashSet(), -1.0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
