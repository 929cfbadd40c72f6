package com.vidnyan.causeway.domain.graph;

import com.vidnyan.causeway.domain.syntax.ScopeContext;

import java.util.Map;

/**
 * Program entity in a causal graph.
 * The id is derived from scope, name and, for reassignable kinds, the source line,
 * so extracting the same source twice yields the same ids.
 */
public record GraphNode(
    String id,
    String name,
    NodeKind kind,
    int sourceLine,
    String scope,
    Map<String, Object> metadata
) {

    public static final String OPERATION = "function";

    public GraphNode {
        metadata = Map.copyOf(metadata);
    }

    public static String functionId(String scope, String name) {
        return ScopeContext.MODULE.equals(scope) ? "func:" + name : "func:" + scope + "." + name;
    }

    public static String variableId(String scope, String name, int line) {
        return "var:" + scope + "." + name + ":L" + line;
    }

    public static String returnId(String scope, int line) {
        return "return:" + scope + ":L" + line;
    }

    public static String effectId(String scope, String operation, int line) {
        return "effect:" + scope + "." + operation + ":L" + line;
    }

    /**
     * Plain variable node whose id is its name. Used for simulation graphs.
     */
    public static GraphNode variable(String name) {
        return new GraphNode(name, name, NodeKind.VARIABLE, 0, ScopeContext.MODULE, Map.of());
    }

    /**
     * Operation name recorded on effect nodes, or null.
     */
    public String operation() {
        Object op = metadata.get(OPERATION);
        return op != null ? op.toString() : null;
    }
}
