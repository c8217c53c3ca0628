package com.fdsl.flow.graph;

/** A node of the dependency graph: an entity or a source. */
public interface GraphNode {
    String name();
}
