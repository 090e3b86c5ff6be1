package com.color.x.service;

import com.color.x.exceptions.GraphNotFoundException;
import com.color.x.models.ColorGraph;
import com.color.x.models.GraphFixtures;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryGraphProviderTest {
    private final InMemoryGraphProvider provider = new InMemoryGraphProvider();

    @Test
    void listsRegisteredNamesInOrder() {
        provider.register("queen5_5", GraphFixtures.complete(3));
        provider.register("myciel3", GraphFixtures.cycle(5));

        assertThat(provider.listNames()).containsExactly("myciel3", "queen5_5");
    }

    @Test
    void registeringSameNameReplacesGraph() {
        ColorGraph replacement = GraphFixtures.cycle(6);
        provider.register("g", GraphFixtures.cycle(4));
        provider.register("g", replacement);

        assertThat(provider.load("g")).isSameAs(replacement);
    }

    @Test
    void unknownNameThrows() {
        assertThatThrownBy(() -> provider.load("nope"))
                .isInstanceOf(GraphNotFoundException.class)
                .hasMessage("Graph instance not found: nope");
    }
}
