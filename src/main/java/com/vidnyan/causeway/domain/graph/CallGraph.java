package com.vidnyan.causeway.domain.graph;

import java.util.*;

/**
 * Call relation between function nodes.
 * Bidirectional index: caller → callees, callee → callers. Immutable.
 */
public final class CallGraph {

    private static final CallGraph EMPTY = new CallGraph(Map.of(), Map.of(), List.of());

    private final Map<String, List<CallEdge>> outgoing;
    private final Map<String, List<CallEdge>> incoming;
    private final List<CallEdge> edges;

    private CallGraph(
            Map<String, List<CallEdge>> outgoing,
            Map<String, List<CallEdge>> incoming,
            List<CallEdge> edges
    ) {
        this.outgoing = Collections.unmodifiableMap(outgoing);
        this.incoming = Collections.unmodifiableMap(incoming);
        this.edges = List.copyOf(edges);
    }

    public static CallGraph empty() {
        return EMPTY;
    }

    public static CallGraph build(List<CallEdge> edges) {
        Map<String, List<CallEdge>> outgoing = new LinkedHashMap<>();
        Map<String, List<CallEdge>> incoming = new LinkedHashMap<>();

        for (CallEdge edge : edges) {
            outgoing.computeIfAbsent(edge.callerId(), k -> new ArrayList<>()).add(edge);
            incoming.computeIfAbsent(edge.calleeId(), k -> new ArrayList<>()).add(edge);
        }

        return new CallGraph(outgoing, incoming, edges);
    }

    public List<CallEdge> edges() {
        return edges;
    }

    public List<CallEdge> getOutgoingCalls(String functionId) {
        return outgoing.getOrDefault(functionId, List.of());
    }

    public List<CallEdge> getIncomingCalls(String functionId) {
        return incoming.getOrDefault(functionId, List.of());
    }

    public List<String> getCallees(String functionId) {
        return getOutgoingCalls(functionId).stream()
                .map(CallEdge::calleeId)
                .distinct()
                .toList();
    }

    public List<String> getCallers(String functionId) {
        return getIncomingCalls(functionId).stream()
                .map(CallEdge::callerId)
                .distinct()
                .toList();
    }

    public boolean isEmpty() {
        return edges.isEmpty();
    }

    public Stats stats() {
        return new Stats(
                outgoing.size(),
                edges.size()
        );
    }

    public record Stats(int callerCount, int edgeCount) {}
}
