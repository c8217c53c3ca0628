package com.fdsl.flow.chain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered path of entities for one direction of a duplex channel.
 *
 * @param channelEntity the client-facing entity the chain was resolved from
 * @param entities      every entity on a path from a root to the terminal, in
 *                      topological order, both ends included
 * @param roots         where data enters: the client entity (inbound) or the
 *                      subscribe-bound entities (outbound)
 * @param terminal      where data leaves: the publish-bound entity (inbound)
 *                      or the client entity (outbound)
 * @param sources       the publish sinks of the terminal (inbound) or the
 *                      subscribe sources feeding the roots (outbound)
 * @param wrappers      wrapper entities on the chain
 */
public record Chain(String channelEntity, ChainDirection direction, List<String> entities, List<String> roots,
        String terminal, List<String> sources, Set<String> wrappers) {

    public Chain {
        entities = List.copyOf(entities);
        roots = List.copyOf(roots);
        sources = List.copyOf(sources);
        wrappers = Collections.unmodifiableSet(new LinkedHashSet<>(wrappers));
    }

    /**
     * Subscribe sources that must all have delivered before the outbound chain
     * can run; empty when a single source feeds the chain.
     */
    public List<String> syncSources() {
        return direction == ChainDirection.OUTBOUND && sources.size() > 1 ? sources : List.of();
    }

    public boolean isWrapper(String entity) {
        return wrappers.contains(entity);
    }

    @Override
    public String toString() {
        return direction + entities.toString() + " -> " + terminal;
    }
}
