package com.color.x.exceptions;

/**
 * Thrown when a graph provider has no instance registered under the requested name.
 */
public class GraphNotFoundException extends RuntimeException {

    /**
     * Constructs a new GraphNotFoundException for the given instance name.
     *
     * @param graphName the name that could not be resolved.
     */
    public GraphNotFoundException(String graphName) {
        super("Graph instance not found: " + graphName);
    }
}
