package com.fdsl.flow.graph;

public record Edge(String from, String to, EdgeKind kind) {

    @Override
    public String toString() {
        return from + " -[" + kind + "]-> " + to;
    }
}
