package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.graph.NodeKind;
import com.vidnyan.causeway.domain.syntax.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Turns a lowered source tree into scope-qualified graph nodes.
 * Functions, assignments (one node per line), returns inside functions and
 * calls to side-effecting operations each produce a node.
 */
@Slf4j
@Component
public class NodeExtractor {

    /**
     * Call names treated as side effects.
     */
    public static final Set<String> EFFECT_OPERATIONS = Set.of(
            "print", "println", "printf", "write", "append", "extend", "add", "addAll",
            "put", "putAll", "remove", "pop", "push", "offer", "poll", "clear", "update",
            "set", "open", "close", "flush",
            "log", "trace", "debug", "info", "warn", "error"
    );

    public List<GraphNode> extract(SourceTree tree) {
        Map<String, GraphNode> nodes = new LinkedHashMap<>();
        walk(tree.roots(), ScopeContext.module(), nodes);
        log.debug("Extracted {} nodes from {}", nodes.size(), tree.origin());
        return List.copyOf(nodes.values());
    }

    private void walk(List<SyntaxNode> body, ScopeContext scope, Map<String, GraphNode> nodes) {
        for (SyntaxNode node : body) {
            walk(node, scope, nodes);
        }
    }

    private void walk(SyntaxNode node, ScopeContext scope, Map<String, GraphNode> nodes) {
        String scopeName = scope.qualifiedName();
        switch (node.kind()) {
            case TYPE -> {
                TypeDef type = (TypeDef) node;
                walk(type.body(), scope.enter(type.name()), nodes);
            }
            case FUNCTION -> {
                FunctionDef function = (FunctionDef) node;
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("syntax", "FunctionDef");
                metadata.put("parameters", function.parameters());
                metadata.put("decorators", function.decorators());
                metadata.put("async", function.async());
                if (function.source() != null) {
                    metadata.put("source", function.source());
                }
                add(nodes, new GraphNode(
                        GraphNode.functionId(scopeName, function.name()),
                        function.name(),
                        NodeKind.FUNCTION,
                        function.line(),
                        scopeName,
                        metadata));
                walk(function.body(), scope.enter(function.name()), nodes);
            }
            case ASSIGNMENT -> {
                Assignment assignment = (Assignment) node;
                Map<String, Object> metadata = new LinkedHashMap<>();
                metadata.put("syntax", assignment.augmented() ? "AugmentedAssignment" : "Assignment");
                metadata.put("operator", assignment.operator());
                if (assignment.valueType() != null) {
                    metadata.put("value_type", assignment.valueType());
                }
                add(nodes, new GraphNode(
                        GraphNode.variableId(scopeName, assignment.target(), assignment.line()),
                        assignment.target(),
                        NodeKind.VARIABLE,
                        assignment.line(),
                        scopeName,
                        metadata));
            }
            case CONDITIONAL -> {
                Conditional conditional = (Conditional) node;
                walk(conditional.body(), scope, nodes);
                walk(conditional.orElse(), scope, nodes);
            }
            case LOOP -> {
                Loop loop = (Loop) node;
                walk(loop.body(), scope, nodes);
                walk(loop.orElse(), scope, nodes);
            }
            case EXCEPTION_BLOCK -> {
                ExceptionBlock block = (ExceptionBlock) node;
                walk(block.body(), scope, nodes);
                block.handlers().forEach(h -> walk(h.body(), scope, nodes));
                walk(block.orElse(), scope, nodes);
                walk(block.finallyBody(), scope, nodes);
            }
            case CALL -> {
                Call call = (Call) node;
                if (EFFECT_OPERATIONS.contains(call.name())) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put(GraphNode.OPERATION, call.name());
                    if (call.receiver() != null) {
                        metadata.put("receiver", call.receiver());
                    }
                    add(nodes, new GraphNode(
                            GraphNode.effectId(scopeName, call.name(), call.line()),
                            call.name() + "()",
                            NodeKind.EFFECT,
                            call.line(),
                            scopeName,
                            metadata));
                }
            }
            case RETURN -> {
                Return ret = (Return) node;
                if (!scope.isModule()) {
                    add(nodes, new GraphNode(
                            GraphNode.returnId(scopeName, ret.line()),
                            "return@" + scopeName,
                            NodeKind.RETURN,
                            ret.line(),
                            scopeName,
                            Map.of("has_value", ret.hasValue())));
                }
            }
        }
    }

    private void add(Map<String, GraphNode> nodes, GraphNode node) {
        nodes.putIfAbsent(node.id(), node);
    }
}
