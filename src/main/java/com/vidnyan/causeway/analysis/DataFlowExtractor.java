package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.CausalEdge;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.syntax.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Data-flow edges from definition/use chains.
 * <p>
 * A use is linked to the single most recent definition before its line. There is
 * no merging across branches: after an if/else, a later use only sees whichever
 * definition sits on the latest line.
 */
@Slf4j
@Component
public class DataFlowExtractor {

    public List<CausalEdge> extract(SourceTree tree, Collection<GraphNode> nodes) {
        Set<String> known = nodes.stream().map(GraphNode::id).collect(Collectors.toSet());
        Walk walk = new Walk(DefinitionIndex.of(tree), known);
        walk.visit(tree.roots(), ScopeContext.module());
        log.debug("Extracted {} data-flow edges", walk.edges.size());
        return List.copyOf(walk.edges);
    }

    private static final class Walk {
        private final DefinitionIndex definitions;
        private final Set<String> known;
        private final Set<CausalEdge> edges = new LinkedHashSet<>();

        Walk(DefinitionIndex definitions, Set<String> known) {
            this.definitions = definitions;
            this.known = known;
        }

        void visit(List<SyntaxNode> body, ScopeContext scope) {
            for (SyntaxNode node : body) {
                visit(node, scope);
            }
        }

        void visit(SyntaxNode node, ScopeContext scope) {
            String scopeName = scope.qualifiedName();
            switch (node.kind()) {
                case TYPE -> {
                    TypeDef type = (TypeDef) node;
                    visit(type.body(), scope.enter(type.name()));
                }
                case FUNCTION -> {
                    FunctionDef function = (FunctionDef) node;
                    visit(function.body(), scope.enter(function.name()));
                }
                case ASSIGNMENT -> {
                    Assignment assignment = (Assignment) node;
                    String target = GraphNode.variableId(scopeName, assignment.target(), assignment.line());
                    linkReads(assignment.reads(), scopeName, assignment.line(), target);
                    if (assignment.augmented()) {
                        definitions.resolveBefore(scopeName, assignment.target(), assignment.line())
                                .ifPresent(previous -> link(previous, target));
                    }
                }
                case RETURN -> {
                    Return ret = (Return) node;
                    if (!scope.isModule()) {
                        linkReads(ret.reads(), scopeName, ret.line(), GraphNode.returnId(scopeName, ret.line()));
                    }
                }
                case CONDITIONAL -> {
                    Conditional conditional = (Conditional) node;
                    visit(conditional.body(), scope);
                    visit(conditional.orElse(), scope);
                }
                case LOOP -> {
                    Loop loop = (Loop) node;
                    visit(loop.body(), scope);
                    visit(loop.orElse(), scope);
                }
                case EXCEPTION_BLOCK -> {
                    ExceptionBlock block = (ExceptionBlock) node;
                    visit(block.body(), scope);
                    block.handlers().forEach(h -> visit(h.body(), scope));
                    visit(block.orElse(), scope);
                    visit(block.finallyBody(), scope);
                }
                case CALL -> {
                    // calls carry no definitions or uses of their own
                }
            }
        }

        private void linkReads(List<String> reads, String scope, int line, String target) {
            for (String name : new LinkedHashSet<>(reads)) {
                definitions.resolveBefore(scope, name, line).ifPresent(source -> link(source, target));
            }
        }

        private void link(String source, String target) {
            if (known.contains(source) && known.contains(target) && !source.equals(target)) {
                edges.add(CausalEdge.dataFlow(source, target));
            }
        }
    }
}
