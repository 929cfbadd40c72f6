package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.syntax.*;

import java.util.*;

/**
 * Per scope and variable name, the lines at which the variable is defined.
 * Answers "most recent definition before this line", walking outward through
 * enclosing scopes to the module scope.
 */
final class DefinitionIndex {

    private final Map<String, Map<String, NavigableMap<Integer, String>>> definitions = new HashMap<>();

    private DefinitionIndex() {
    }

    static DefinitionIndex of(SourceTree tree) {
        DefinitionIndex index = new DefinitionIndex();
        index.walk(tree.roots(), ScopeContext.module());
        return index;
    }

    /**
     * Definition strictly before {@code line}.
     */
    Optional<String> resolveBefore(String scope, String name, int line) {
        return resolve(scope, name, line, false);
    }

    /**
     * Definition at or before {@code line}.
     */
    Optional<String> resolveAtOrBefore(String scope, String name, int line) {
        return resolve(scope, name, line, true);
    }

    private Optional<String> resolve(String scope, String name, int line, boolean inclusive) {
        for (String candidate : ScopeContext.lookupChain(scope)) {
            NavigableMap<Integer, String> lines = definitions
                    .getOrDefault(candidate, Map.of())
                    .get(name);
            if (lines == null) {
                continue;
            }
            Map.Entry<Integer, String> entry = inclusive ? lines.floorEntry(line) : lines.lowerEntry(line);
            if (entry != null) {
                return Optional.of(entry.getValue());
            }
        }
        return Optional.empty();
    }

    private void walk(List<SyntaxNode> body, ScopeContext scope) {
        for (SyntaxNode node : body) {
            walk(node, scope);
        }
    }

    private void walk(SyntaxNode node, ScopeContext scope) {
        switch (node.kind()) {
            case TYPE -> {
                TypeDef type = (TypeDef) node;
                walk(type.body(), scope.enter(type.name()));
            }
            case FUNCTION -> {
                FunctionDef function = (FunctionDef) node;
                walk(function.body(), scope.enter(function.name()));
            }
            case ASSIGNMENT -> {
                Assignment assignment = (Assignment) node;
                String scopeName = scope.qualifiedName();
                definitions
                        .computeIfAbsent(scopeName, k -> new HashMap<>())
                        .computeIfAbsent(assignment.target(), k -> new TreeMap<>())
                        .putIfAbsent(assignment.line(),
                                GraphNode.variableId(scopeName, assignment.target(), assignment.line()));
            }
            case CONDITIONAL -> {
                Conditional conditional = (Conditional) node;
                walk(conditional.body(), scope);
                walk(conditional.orElse(), scope);
            }
            case LOOP -> {
                Loop loop = (Loop) node;
                walk(loop.body(), scope);
                walk(loop.orElse(), scope);
            }
            case EXCEPTION_BLOCK -> {
                ExceptionBlock block = (ExceptionBlock) node;
                walk(block.body(), scope);
                block.handlers().forEach(h -> walk(h.body(), scope));
                walk(block.orElse(), scope);
                walk(block.finallyBody(), scope);
            }
            case CALL, RETURN -> {
                // no definitions
            }
        }
    }
}
