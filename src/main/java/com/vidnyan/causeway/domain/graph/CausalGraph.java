package com.vidnyan.causeway.domain.graph;

import com.vidnyan.causeway.domain.error.CyclicGraphException;

import java.util.*;

/**
 * Directed graph of program entities and their influence edges.
 * Immutable once built; pruning produces a new instance through {@link #toBuilder()}.
 * Node and edge iteration follow insertion order, so every traversal is deterministic.
 */
public final class CausalGraph {

    private final Map<String, GraphNode> nodes;
    private final Set<CausalEdge> edges;
    private final Map<String, Set<String>> successors;
    private final Map<String, Set<String>> predecessors;

    private CausalGraph(
            Map<String, GraphNode> nodes,
            Set<CausalEdge> edges,
            Map<String, Set<String>> successors,
            Map<String, Set<String>> predecessors
    ) {
        this.nodes = Collections.unmodifiableMap(nodes);
        this.edges = Collections.unmodifiableSet(edges);
        this.successors = Collections.unmodifiableMap(successors);
        this.predecessors = Collections.unmodifiableMap(predecessors);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Graph of plain variable nodes from {@code source, target} pairs.
     */
    public static CausalGraph ofEdges(String[]... pairs) {
        Builder builder = builder();
        for (String[] pair : pairs) {
            builder.addEdge(pair[0], pair[1], EdgeKind.DATA_FLOW);
        }
        return builder.build();
    }

    public Builder toBuilder() {
        Builder builder = builder();
        nodes.values().forEach(builder::addNode);
        edges.forEach(builder::addEdge);
        return builder;
    }

    public Collection<GraphNode> nodes() {
        return nodes.values();
    }

    public Set<String> nodeIds() {
        return nodes.keySet();
    }

    public Optional<GraphNode> node(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    public boolean containsNode(String id) {
        return nodes.containsKey(id);
    }

    public Set<CausalEdge> edges() {
        return edges;
    }

    public boolean hasEdge(String source, String target) {
        return successors(source).contains(target);
    }

    public Set<String> successors(String id) {
        return successors.getOrDefault(id, Set.of());
    }

    public Set<String> predecessors(String id) {
        return predecessors.getOrDefault(id, Set.of());
    }

    public int nodeCount() {
        return nodes.size();
    }

    public int edgeCount() {
        return edges.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    /**
     * Nodes with no incoming edges.
     */
    public List<String> roots() {
        return nodes.keySet().stream().filter(id -> predecessors(id).isEmpty()).toList();
    }

    /**
     * Nodes with no outgoing edges.
     */
    public List<String> leaves() {
        return nodes.keySet().stream().filter(id -> successors(id).isEmpty()).toList();
    }

    public boolean isAcyclic() {
        return findCycle().isEmpty();
    }

    /**
     * Kahn ordering. Ties are broken by insertion order.
     *
     * @throws CyclicGraphException if the graph has a cycle
     */
    public List<String> topologicalOrder() {
        Map<String, Integer> inDegree = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            inDegree.put(id, predecessors(id).size());
        }

        Deque<String> ready = new ArrayDeque<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            for (String next : successors(id)) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() != nodes.size()) {
            throw new CyclicGraphException(findCycle().orElse(List.of()));
        }
        return order;
    }

    /**
     * Find one cycle, returned as a closed path ({@code a, b, a}).
     */
    public Optional<List<String>> findCycle() {
        Set<String> visited = new HashSet<>();
        Set<String> inStack = new HashSet<>();

        for (String id : nodes.keySet()) {
            if (!visited.contains(id)) {
                List<String> cycle = findCycleFrom(id, visited, inStack);
                if (cycle != null) {
                    return Optional.of(cycle);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Depth-first search with an explicit stack, so long chains cannot overflow the call stack.
     */
    private List<String> findCycleFrom(String start, Set<String> visited, Set<String> inStack) {
        List<String> path = new ArrayList<>();
        Deque<Iterator<String>> pending = new ArrayDeque<>();

        visited.add(start);
        inStack.add(start);
        path.add(start);
        pending.push(successors(start).iterator());

        while (!pending.isEmpty()) {
            Iterator<String> next = pending.peek();
            if (!next.hasNext()) {
                pending.pop();
                inStack.remove(path.remove(path.size() - 1));
                continue;
            }
            String successor = next.next();
            if (inStack.contains(successor)) {
                List<String> cycle = new ArrayList<>(path.subList(path.indexOf(successor), path.size()));
                cycle.add(successor);
                return cycle;
            }
            if (visited.add(successor)) {
                inStack.add(successor);
                path.add(successor);
                pending.push(successors(successor).iterator());
            }
        }
        return null;
    }

    public Stats stats() {
        return new Stats(
                nodes.size(),
                edges.size(),
                (int) edges.stream().filter(e -> e.kind() == EdgeKind.DATA_FLOW).count(),
                (int) edges.stream().filter(e -> e.kind() == EdgeKind.CONTROL_FLOW).count(),
                roots().size(),
                leaves().size()
        );
    }

    public record Stats(int nodeCount, int edgeCount, int dataFlowEdges, int controlFlowEdges,
                        int rootCount, int leafCount) {}

    @Override
    public String toString() {
        return "CausalGraph[" + nodes.size() + " nodes, " + edges.size() + " edges]";
    }

    /**
     * Mutable accumulator. Duplicate nodes and edges are ignored, as are self-loops.
     * An edge naming an unknown node adds a plain variable node for it.
     */
    public static final class Builder {
        private final Map<String, GraphNode> nodes = new LinkedHashMap<>();
        private final Set<CausalEdge> edges = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder addNode(GraphNode node) {
            nodes.putIfAbsent(node.id(), node);
            return this;
        }

        public Builder addNodes(Collection<GraphNode> toAdd) {
            toAdd.forEach(this::addNode);
            return this;
        }

        public Builder addEdge(String source, String target, EdgeKind kind) {
            return addEdge(new CausalEdge(source, target, kind));
        }

        public Builder addEdge(CausalEdge edge) {
            if (edge.isSelfLoop()) {
                return this;
            }
            nodes.computeIfAbsent(edge.source(), GraphNode::variable);
            nodes.computeIfAbsent(edge.target(), GraphNode::variable);
            edges.add(edge);
            return this;
        }

        public Builder addEdges(Collection<CausalEdge> toAdd) {
            toAdd.forEach(this::addEdge);
            return this;
        }

        public Builder removeEdgesTouching(Set<String> nodeIds) {
            edges.removeIf(e -> nodeIds.contains(e.source()) || nodeIds.contains(e.target()));
            return this;
        }

        /**
         * Remove the given nodes if no edge touches them any more.
         */
        public Builder removeIsolated(Set<String> nodeIds) {
            Set<String> touched = new HashSet<>();
            for (CausalEdge edge : edges) {
                touched.add(edge.source());
                touched.add(edge.target());
            }
            nodeIds.stream().filter(id -> !touched.contains(id)).forEach(nodes::remove);
            return this;
        }

        public boolean containsNode(String id) {
            return nodes.containsKey(id);
        }

        public CausalGraph build() {
            Map<String, Set<String>> out = new LinkedHashMap<>();
            Map<String, Set<String>> in = new LinkedHashMap<>();
            for (CausalEdge edge : edges) {
                out.computeIfAbsent(edge.source(), k -> new LinkedHashSet<>()).add(edge.target());
                in.computeIfAbsent(edge.target(), k -> new LinkedHashSet<>()).add(edge.source());
            }
            out.replaceAll((k, v) -> Collections.unmodifiableSet(v));
            in.replaceAll((k, v) -> Collections.unmodifiableSet(v));
            return new CausalGraph(new LinkedHashMap<>(nodes), new LinkedHashSet<>(edges), out, in);
        }
    }
}
