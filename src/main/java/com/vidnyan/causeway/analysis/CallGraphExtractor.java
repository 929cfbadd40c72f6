package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.CallEdge;
import com.vidnyan.causeway.domain.graph.CallGraph;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.syntax.*;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Derives a call graph from unqualified (or {@code this.}) calls whose name
 * matches a function declared in the same tree.
 * A function of the caller's own type wins over one declared elsewhere.
 */
@Component
public class CallGraphExtractor {

    public CallGraph extract(SourceTree tree) {
        Map<String, List<String>> functionsByName = new LinkedHashMap<>();
        collectFunctions(tree.roots(), ScopeContext.module(), functionsByName);

        List<CallEdge> edges = new ArrayList<>();
        collectCalls(tree.roots(), ScopeContext.module(), null, null, functionsByName, edges);
        return CallGraph.build(edges);
    }

    private void collectFunctions(List<SyntaxNode> body, ScopeContext scope, Map<String, List<String>> out) {
        for (SyntaxNode node : body) {
            switch (node.kind()) {
                case TYPE -> {
                    TypeDef type = (TypeDef) node;
                    collectFunctions(type.body(), scope.enter(type.name()), out);
                }
                case FUNCTION -> {
                    FunctionDef function = (FunctionDef) node;
                    out.computeIfAbsent(function.name(), k -> new ArrayList<>())
                            .add(GraphNode.functionId(scope.qualifiedName(), function.name()));
                }
                default -> {
                }
            }
        }
    }

    private void collectCalls(List<SyntaxNode> body, ScopeContext scope, String callerId, String ownerScope,
                              Map<String, List<String>> functions, List<CallEdge> edges) {
        for (SyntaxNode node : body) {
            switch (node.kind()) {
                case TYPE -> {
                    TypeDef type = (TypeDef) node;
                    collectCalls(type.body(), scope.enter(type.name()), callerId, ownerScope, functions, edges);
                }
                case FUNCTION -> {
                    FunctionDef function = (FunctionDef) node;
                    String id = GraphNode.functionId(scope.qualifiedName(), function.name());
                    collectCalls(function.body(), scope.enter(function.name()), id, scope.qualifiedName(),
                            functions, edges);
                }
                case CONDITIONAL -> {
                    Conditional c = (Conditional) node;
                    collectCalls(c.body(), scope, callerId, ownerScope, functions, edges);
                    collectCalls(c.orElse(), scope, callerId, ownerScope, functions, edges);
                }
                case LOOP -> {
                    Loop l = (Loop) node;
                    collectCalls(l.body(), scope, callerId, ownerScope, functions, edges);
                    collectCalls(l.orElse(), scope, callerId, ownerScope, functions, edges);
                }
                case EXCEPTION_BLOCK -> {
                    ExceptionBlock b = (ExceptionBlock) node;
                    collectCalls(b.body(), scope, callerId, ownerScope, functions, edges);
                    b.handlers().forEach(h -> collectCalls(h.body(), scope, callerId, ownerScope, functions, edges));
                    collectCalls(b.orElse(), scope, callerId, ownerScope, functions, edges);
                    collectCalls(b.finallyBody(), scope, callerId, ownerScope, functions, edges);
                }
                case CALL -> {
                    Call call = (Call) node;
                    if (callerId == null || !(call.receiver() == null || "this".equals(call.receiver()))) {
                        continue;
                    }
                    resolveCallee(call.name(), ownerScope, functions).ifPresent(callee ->
                            edges.add(CallEdge.builder()
                                    .caller(callerId)
                                    .callee(callee)
                                    .line(call.line())
                                    .build()));
                }
                case ASSIGNMENT, RETURN -> {
                }
            }
        }
    }

    private Optional<String> resolveCallee(String name, String ownerScope, Map<String, List<String>> functions) {
        List<String> candidates = functions.getOrDefault(name, List.of());
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        String local = GraphNode.functionId(ownerScope, name);
        if (candidates.contains(local)) {
            return Optional.of(local);
        }
        return candidates.size() == 1 ? Optional.of(candidates.get(0)) : Optional.empty();
    }
}
