package com.color.x.service;

import com.color.x.exceptions.GraphNotFoundException;
import com.color.x.models.ColorGraph;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class InMemoryGraphProvider implements GraphProvider {
    private final Map<String, ColorGraph> graphs = new ConcurrentHashMap<>();

    public void register(String name, ColorGraph graph) {
        Objects.requireNonNull(name, "Graph name cannot be null.");
        Objects.requireNonNull(graph, "ColorGraph cannot be null.");
        if (graphs.put(name, graph) != null) {
            log.info("Replaced graph instance name={}", name);
        }
    }

    @Override
    public ColorGraph load(String name) {
        ColorGraph graph = graphs.get(name);
        if (graph == null) {
            throw new GraphNotFoundException(name);
        }
        return graph;
    }

    @Override
    public List<String> listNames() {
        return graphs.keySet().stream().sorted().toList();
    }
}
