package com.vidnyan.causeway.application.port.in;

import com.vidnyan.causeway.domain.graph.CallGraph;
import com.vidnyan.causeway.domain.model.CausalBundle;
import com.vidnyan.causeway.domain.model.EnhancementMode;
import com.vidnyan.causeway.domain.syntax.SourceTree;
import com.vidnyan.causeway.domain.trace.Trace;

import java.util.Map;
import java.util.Objects;

/**
 * Primary use case: add causal structure and mechanisms to parsed source.
 * Never throws for analysis failures; they come back as warnings on the bundle.
 */
public interface EnhanceCodeUseCase {

    CausalBundle enhance(EnhanceRequest request);

    /**
     * @param callGraph    optional; derived from the tree when null
     * @param traces       optional execution traces, one column per graph node
     * @param sourceByNode optional method source per node id, for static inference
     */
    record EnhanceRequest(
        SourceTree sourceTree,
        CallGraph callGraph,
        Trace traces,
        EnhancementMode mode,
        Map<String, String> sourceByNode
    ) {
        public EnhanceRequest {
            Objects.requireNonNull(sourceTree, "sourceTree");
            mode = mode == null ? EnhancementMode.AUTO : mode;
            sourceByNode = sourceByNode == null ? Map.of() : Map.copyOf(sourceByNode);
        }

        public static EnhanceRequest forTree(SourceTree tree) {
            return new EnhanceRequest(tree, null, null, EnhancementMode.AUTO, Map.of());
        }

        public EnhanceRequest withTraces(Trace traces) {
            return new EnhanceRequest(sourceTree, callGraph, traces, mode, sourceByNode);
        }

        public EnhanceRequest withMode(EnhancementMode mode) {
            return new EnhanceRequest(sourceTree, callGraph, traces, mode, sourceByNode);
        }
    }
}
