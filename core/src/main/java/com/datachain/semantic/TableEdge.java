package com.datachain.semantic;

/**
 * A directed edge of the relationship graph, used as a join step.
 */
public record TableEdge(String incoming, String outgoing) {

    @Override
    public String toString() {
        return incoming + " -> " + outgoing;
    }
}
