package com.notegraph.core.service.analysis;

/**
 * Thrown when the topology of an analyzer is requested before it was built.
 */
public class GraphNotBuiltException extends IllegalStateException {

    public GraphNotBuiltException() {
        super("Graph has not been built. Call buildGraph() first.");
    }
}
