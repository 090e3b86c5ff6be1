package com.color.x.service;

import com.color.x.exceptions.GraphNotFoundException;
import com.color.x.models.ColorGraph;

import java.util.List;

/**
 * Source of named graph instances.
 */
public interface GraphProvider {

    /**
     * @throws GraphNotFoundException if no instance is known under {@code name}
     */
    ColorGraph load(String name);

    List<String> listNames();
}
