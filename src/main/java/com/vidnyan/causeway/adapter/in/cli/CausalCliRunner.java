package com.vidnyan.causeway.adapter.in.cli;

import com.vidnyan.causeway.application.port.in.EnhanceCodeUseCase;
import com.vidnyan.causeway.application.port.in.EnhanceCodeUseCase.EnhanceRequest;
import com.vidnyan.causeway.application.port.out.SourceTreeParser;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.CausalException;
import com.vidnyan.causeway.domain.graph.CausalEdge;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.graph.GraphNode;
import com.vidnyan.causeway.domain.mechanism.Mechanism;
import com.vidnyan.causeway.domain.model.CausalBundle;
import com.vidnyan.causeway.domain.model.EnhancementMode;
import com.vidnyan.causeway.domain.syntax.SourceTree;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Map;

/**
 * CLI runner for standalone causal analysis.
 * Runs when causeway.analyze.path is set, then shuts the application down.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CausalCliRunner implements CommandLineRunner {

    private static final int MAX_LISTED = 50;

    private final SourceTreeParser parser;
    private final EnhanceCodeUseCase enhanceCodeUseCase;
    private final CausalProperties properties;
    private final ConfigurableApplicationContext context;

    @Override
    public void run(String... args) {
        String sourcePath = properties.getAnalyze().getPath();
        if (sourcePath == null || sourcePath.isBlank()) {
            log.info("No source path specified. Set causeway.analyze.path property.");
            return;
        }

        try {
            log.info("╔══════════════════════════════════════════════════════════════╗");
            log.info("║              CAUSEWAY - Causal Code Analysis                  ║");
            log.info("╠══════════════════════════════════════════════════════════════╣");
            log.info("║ Analyzing: {}", truncatePath(sourcePath, 50));
            log.info("║ Mode:      {}", properties.getAnalyze().getMode());
            log.info("╚══════════════════════════════════════════════════════════════╝");

            SourceTree tree = parser.parse(Path.of(sourcePath));
            EnhanceRequest request = EnhanceRequest.forTree(tree)
                    .withMode(EnhancementMode.fromLabel(properties.getAnalyze().getMode()));
            CausalBundle bundle = enhanceCodeUseCase.enhance(request);

            printResults(bundle);

            log.info("");
            log.info("Analysis complete!");
        } catch (CausalException | IllegalArgumentException e) {
            log.error("Analysis failed: {}", e.getMessage());
        } finally {
            SpringApplication.exit(context, () -> 0);
        }
    }

    private void printResults(CausalBundle bundle) {
        log.info("");
        log.info("═══════════════════════════════════════════════════════════════");
        log.info(" CAUSAL GRAPH");
        log.info("═══════════════════════════════════════════════════════════════");

        if (!bundle.hasGraph()) {
            log.info(" No causal graph available.");
            printWarnings(bundle);
            return;
        }

        CausalGraph graph = bundle.causalGraph();
        CausalGraph.Stats stats = graph.stats();
        log.info(" Nodes:              {}", stats.nodeCount());
        log.info(" Edges:              {}", stats.edgeCount());
        log.info("   Data flow:        {}", stats.dataFlowEdges());
        log.info("   Control flow:     {}", stats.controlFlowEdges());
        log.info(" Roots / leaves:     {} / {}", stats.rootCount(), stats.leafCount());
        log.info(" Mode:               {}", bundle.mode() == null ? "none" : bundle.mode().label());
        log.info(" Duration:           {}ms", bundle.metadata().getOrDefault("duration_ms", "-"));
        log.info("───────────────────────────────────────────────────────────────");

        log.info(" NODES:");
        int count = 0;
        for (GraphNode node : graph.nodes()) {
            if (++count > MAX_LISTED) {
                log.info("   ... and {} more nodes", graph.nodeCount() - MAX_LISTED);
                break;
            }
            log.info("   {} [{}] line {}", node.id(), node.kind(), node.sourceLine());
        }

        log.info("");
        log.info(" EDGES:");
        count = 0;
        for (CausalEdge edge : graph.edges()) {
            if (++count > MAX_LISTED) {
                log.info("   ... and {} more edges", graph.edgeCount() - MAX_LISTED);
                break;
            }
            log.info("   {} → {} ({})", edge.source(), edge.target(), edge.kind());
        }

        if (bundle.scm() != null && !bundle.scm().mechanisms().isEmpty()) {
            log.info("");
            log.info(" MECHANISMS:");
            for (Map.Entry<String, Mechanism> entry : bundle.scm().mechanisms().entrySet()) {
                Mechanism mechanism = entry.getValue();
                log.info("   {}: {} (confidence {}) {}", entry.getKey(), mechanism.kind(),
                        mechanism.confidence(), mechanism.expression());
            }
        }
        printWarnings(bundle);
    }

    private void printWarnings(CausalBundle bundle) {
        if (bundle.warnings().isEmpty()) {
            return;
        }
        log.info("");
        log.info(" ⚠️  WARNINGS: {}", bundle.warnings());
        Object error = bundle.metadata().get("error");
        if (error != null) {
            log.info("    {}", error);
        }
    }

    private String truncatePath(String path, int maxLen) {
        if (path.length() <= maxLen)
            return path;
        return "..." + path.substring(path.length() - maxLen + 3);
    }
}
