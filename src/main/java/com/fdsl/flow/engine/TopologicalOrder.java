package com.fdsl.flow.engine;

import com.fdsl.flow.graph.ModelBuildException;

import java.util.*;

import lombok.extern.log4j.Log4j2;

/**
 * Topology -- CSR-encoded static DAG over named nodes.
 *
 * Used both for the whole dependency graph (cycle detection at model build)
 * and for the dependency closure of a single plan target.
 *
 * Data layout:
 * - topoOrder: node names sorted topologically. Iterating 0..N visits
 * dependencies before dependents.
 * - childrenList: a single flattened int array with the topological indices of
 * all children of all nodes.
 * - childrenOffset: childrenOffset[i] is the start of node i's children in
 * childrenList; childrenOffset[i+1] is the end.
 *
 * Ordering is deterministic: among nodes whose dependencies are all satisfied,
 * the one added to the builder first is emitted first. Callers add nodes in
 * metamodel declaration order, so independent parents keep declaration order.
 */
@Log4j2
public final class TopologicalOrder {
    // The node names in topological execution order.
    private final String[] topoOrder;

    // CSR Index: childrenOffset[i] points to the start of node i's children in
    // childrenList.
    private final int[] childrenOffset;

    // CSR Data: Flattened list of child indices.
    private final int[] childrenList;

    // Number of parents for each node
    private final int[] parentCount;

    private final Map<String, Integer> nameToIndex;

    private TopologicalOrder(String[] topoOrder, int[] childrenOffset, int[] childrenList,
            int[] parentCount, Map<String, Integer> nameToIndex) {
        this.topoOrder = topoOrder;
        this.childrenOffset = childrenOffset;
        this.childrenList = childrenList;
        this.parentCount = parentCount;
        this.nameToIndex = nameToIndex;
    }

    public int nodeCount() {
        return topoOrder.length;
    }

    /** Returns the node name at the given topological index. */
    public String node(int ti) {
        return topoOrder[ti];
    }

    /** Resolves a node name to its topological index. O(1) hash lookup. */
    public int topoIndex(String name) {
        Integer idx = nameToIndex.get(name);
        if (idx == null)
            throw new IllegalArgumentException("Unknown node: " + name);
        return idx;
    }

    public boolean contains(String name) {
        return nameToIndex.containsKey(name);
    }

    public int childCount(int ti) {
        return childrenOffset[ti + 1] - childrenOffset[ti];
    }

    public int child(int ti, int i) {
        return childrenList[childrenOffset[ti] + i];
    }

    public int parentCount(int ti) {
        return parentCount[ti];
    }

    /** Node names in topological order. */
    public List<String> order() {
        return List.of(topoOrder);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for constructing the TopologicalOrder.
     * Handles cycle detection and topological sorting.
     */
    public static final class Builder {
        private final List<String> nodes = new ArrayList<>();
        private final Map<String, Integer> nameToIdx = new HashMap<>();
        private final Map<Integer, Set<Integer>> forwardEdges = new HashMap<>();

        public Builder addNode(String name) {
            if (nameToIdx.containsKey(name))
                throw new IllegalArgumentException("Duplicate node name: " + name);
            int idx = nodes.size();
            nodes.add(name);
            nameToIdx.put(name, idx);
            forwardEdges.put(idx, new LinkedHashSet<>());
            return this;
        }

        public boolean hasNode(String name) {
            return nameToIdx.containsKey(name);
        }

        /** Adds a dependency edge; {@code to} is ordered after {@code from}. Duplicates are ignored. */
        public Builder addEdge(String from, String to) {
            if (from.equals(to))
                throw new ModelBuildException(ModelBuildException.Reason.CYCLE_DETECTED, from,
                        "self-dependency on " + from);
            forwardEdges.get(requireIndex(from)).add(requireIndex(to));
            return this;
        }

        private int requireIndex(String name) {
            Integer idx = nameToIdx.get(name);
            if (idx == null)
                throw new IllegalArgumentException("Unknown node: " + name);
            return idx;
        }

        /**
         * Compiles the graph.
         * <p>
         * Performs Kahn's algorithm with a min-heap on insertion order, so ties
         * resolve to the earliest-added node.
         *
         * @throws ModelBuildException CYCLE_DETECTED naming the nodes left unsorted
         */
        public TopologicalOrder build() {
            int n = nodes.size();
            int[] inDegree = new int[n];

            // 1. Calculate in-degrees
            for (var entry : forwardEdges.entrySet())
                for (int child : entry.getValue())
                    inDegree[child]++;

            // 2. Seed the ready set with nodes having in-degree 0
            PriorityQueue<Integer> ready = new PriorityQueue<>();
            for (int i = 0; i < n; i++)
                if (inDegree[i] == 0)
                    ready.add(i);

            // 3. Kahn's algorithm
            int[] topoMap = new int[n], reverseMap = new int[n];
            int topoIdx = 0;
            while (!ready.isEmpty()) {
                int curr = ready.poll();
                topoMap[curr] = topoIdx;
                reverseMap[topoIdx] = curr;
                topoIdx++;
                for (int child : forwardEdges.get(curr))
                    if (--inDegree[child] == 0)
                        ready.add(child);
            }
            if (topoIdx != n) {
                List<String> stuck = new ArrayList<>();
                for (int i = 0; i < n; i++)
                    if (inDegree[i] > 0)
                        stuck.add(nodes.get(i));
                log.debug("Cycle detected! Processed {} of {}, unresolved {}", topoIdx, n, stuck);
                throw new ModelBuildException(ModelBuildException.Reason.CYCLE_DETECTED, stuck,
                        "Cycle detected! Processed " + topoIdx + " of " + n);
            }

            // 4. Construct compact arrays
            String[] ordered = new String[n];
            int[] parentCounts = new int[n];
            Map<String, Integer> newNameToIndex = new HashMap<>(n * 2);
            for (int ti = 0; ti < n; ti++) {
                ordered[ti] = nodes.get(reverseMap[ti]);
                newNameToIndex.put(ordered[ti], ti);
            }

            // 5. Build CSR structure
            int[] offsets = new int[n + 1];
            for (int ti = 0; ti < n; ti++)
                offsets[ti + 1] = offsets[ti] + forwardEdges.get(reverseMap[ti]).size();

            int[] flatChildren = new int[offsets[n]];
            for (int ti = 0; ti < n; ti++) {
                int j = offsets[ti];
                for (int child : forwardEdges.get(reverseMap[ti])) {
                    int childTi = topoMap[child];
                    flatChildren[j++] = childTi;
                    parentCounts[childTi]++;
                }
            }
            return new TopologicalOrder(ordered, offsets, flatChildren, parentCounts, newNameToIndex);
        }
    }
}
