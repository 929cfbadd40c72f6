package com.vidnyan.causeway.analysis;

import com.vidnyan.causeway.domain.graph.CausalEdge;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.syntax.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Control-flow edges from branching, looping and exception structure.
 * Nodes are matched to blocks by source line range within the block's own scope,
 * since merged trees from several files share line numbers.
 */
@Slf4j
@Component
public class ControlFlowExtractor {

    public List<CausalEdge> extract(SourceTree tree, Collection<GraphNode> nodes) {
        Walk walk = new Walk(DefinitionIndex.of(tree), nodes);
        walk.visit(tree.roots(), ScopeContext.module());
        log.debug("Extracted {} control-flow edges", walk.edges.size());
        return List.copyOf(walk.edges);
    }

    private static final class Walk {
        private final DefinitionIndex definitions;
        private final Set<String> known = new HashSet<>();
        private final NavigableMap<Integer, List<GraphNode>> nodesByLine = new TreeMap<>();
        private final Set<CausalEdge> edges = new LinkedHashSet<>();

        Walk(DefinitionIndex definitions, Collection<GraphNode> nodes) {
            this.definitions = definitions;
            for (GraphNode node : nodes) {
                known.add(node.id());
                nodesByLine.computeIfAbsent(node.sourceLine(), k -> new ArrayList<>()).add(node);
            }
        }

        void visit(List<SyntaxNode> body, ScopeContext scope) {
            for (SyntaxNode node : body) {
                visit(node, scope);
            }
        }

        void visit(SyntaxNode node, ScopeContext scope) {
            switch (node.kind()) {
                case TYPE -> {
                    TypeDef type = (TypeDef) node;
                    visit(type.body(), scope.enter(type.name()));
                }
                case FUNCTION -> {
                    FunctionDef function = (FunctionDef) node;
                    visit(function.body(), scope.enter(function.name()));
                }
                case CONDITIONAL -> {
                    Conditional conditional = (Conditional) node;
                    conditional(conditional, scope.qualifiedName());
                    visit(conditional.body(), scope);
                    visit(conditional.orElse(), scope);
                }
                case LOOP -> {
                    Loop loop = (Loop) node;
                    loop(loop, scope.qualifiedName());
                    visit(loop.body(), scope);
                    visit(loop.orElse(), scope);
                }
                case EXCEPTION_BLOCK -> {
                    ExceptionBlock block = (ExceptionBlock) node;
                    exceptionBlock(block, scope.qualifiedName());
                    visit(block.body(), scope);
                    block.handlers().forEach(h -> visit(h.body(), scope));
                    visit(block.orElse(), scope);
                    visit(block.finallyBody(), scope);
                }
                case ASSIGNMENT, CALL, RETURN -> {
                    // leaves
                }
            }
        }

        private void conditional(Conditional conditional, String scope) {
            List<String> conditionNodes = resolveAll(scope, conditional.conditionReads(), conditional.line());
            List<String> bodyNodes = nodesIn(conditional.bodyRange(), scope);
            linkControlled(conditionNodes, bodyNodes, scope, conditional.line());

            if (!conditional.hasElse()) {
                return;
            }
            Conditional elseIf = conditional.elseIfConditional();
            if (elseIf != null) {
                // first node of the taken branch excludes the alternative's test
                List<String> elseIfConditions = resolveAll(scope, elseIf.conditionReads(), elseIf.line());
                if (!bodyNodes.isEmpty() && !elseIfConditions.isEmpty()) {
                    link(bodyNodes.get(0), elseIfConditions.get(0));
                }
                return;
            }
            List<String> elseNodes = nodesIn(conditional.elseRange(), scope);
            if (!conditionNodes.isEmpty()) {
                linkAll(conditionNodes, elseNodes);
            } else if (!bodyNodes.isEmpty() && !elseNodes.isEmpty()) {
                link(bodyNodes.get(0), elseNodes.get(0));
            }
        }

        private void loop(Loop loop, String scope) {
            Set<String> controlNodes = new LinkedHashSet<>(resolveAll(scope, loop.controlReads(), loop.line()));
            if (loop.iterates()) {
                for (GraphNode header : nodesByLine.getOrDefault(loop.line(), List.of())) {
                    if (header.scope().equals(scope)) {
                        controlNodes.add(header.id());
                    }
                }
            }
            List<String> conditionNodes = List.copyOf(controlNodes);
            List<String> bodyNodes = nodesIn(loop.bodyRange(), scope);
            linkControlled(conditionNodes, bodyNodes, scope, loop.line());

            if (loop.hasElse()) {
                List<String> elseNodes = nodesIn(loop.elseRange(), scope);
                if (!conditionNodes.isEmpty()) {
                    linkAll(conditionNodes, elseNodes);
                } else if (!bodyNodes.isEmpty() && !elseNodes.isEmpty()) {
                    link(bodyNodes.get(bodyNodes.size() - 1), elseNodes.get(0));
                }
            }
        }

        private void exceptionBlock(ExceptionBlock block, String scope) {
            List<String> tryNodes = nodesIn(block.bodyRange(), scope);
            List<String> handlerNodes = new ArrayList<>();
            for (ExceptionBlock.Handler handler : block.handlers()) {
                List<String> nodes = nodesIn(handler.range(), scope);
                linkAll(tryNodes, nodes);
                handlerNodes.addAll(nodes);
            }
            if (block.elseRange() != null) {
                linkAll(tryNodes, nodesIn(block.elseRange(), scope));
            }
            if (block.finallyRange() != null) {
                List<String> finallyNodes = nodesIn(block.finallyRange(), scope);
                linkAll(tryNodes, finallyNodes);
                linkAll(handlerNodes, finallyNodes);
            }
        }

        /**
         * Condition to every body node; otherwise the nearest earlier node of the
         * same scope to the first body node; otherwise a sequential chain.
         */
        private void linkControlled(List<String> conditionNodes, List<String> bodyNodes, String scope, int line) {
            if (bodyNodes.isEmpty()) {
                return;
            }
            if (!conditionNodes.isEmpty()) {
                linkAll(conditionNodes, bodyNodes);
                return;
            }
            Optional<String> preceding = nearestPreceding(scope, line);
            if (preceding.isPresent()) {
                link(preceding.get(), bodyNodes.get(0));
                return;
            }
            for (int i = 1; i < bodyNodes.size(); i++) {
                link(bodyNodes.get(i - 1), bodyNodes.get(i));
            }
        }

        private List<String> resolveAll(String scope, List<String> names, int line) {
            Set<String> resolved = new LinkedHashSet<>();
            for (String name : names) {
                definitions.resolveAtOrBefore(scope, name, line)
                        .filter(known::contains)
                        .ifPresent(resolved::add);
            }
            return List.copyOf(resolved);
        }

        private Optional<String> nearestPreceding(String scope, int line) {
            for (List<GraphNode> atLine : nodesByLine.headMap(line, false).descendingMap().values()) {
                for (GraphNode node : atLine) {
                    if (node.scope().equals(scope)) {
                        return Optional.of(node.id());
                    }
                }
            }
            return Optional.empty();
        }

        private List<String> nodesIn(LineRange range, String scope) {
            List<String> ids = new ArrayList<>();
            if (range.start() > range.end()) {
                return ids;
            }
            String nested = scope + ".";
            for (List<GraphNode> atLine : nodesByLine.subMap(range.start(), true, range.end(), true).values()) {
                for (GraphNode node : atLine) {
                    if (node.scope().equals(scope) || node.scope().startsWith(nested)) {
                        ids.add(node.id());
                    }
                }
            }
            return ids;
        }

        private void linkAll(Collection<String> sources, Collection<String> targets) {
            for (String source : sources) {
                for (String target : targets) {
                    link(source, target);
                }
            }
        }

        private void link(String source, String target) {
            if (!source.equals(target)) {
                edges.add(CausalEdge.controlFlow(source, target));
            }
        }
    }
}
