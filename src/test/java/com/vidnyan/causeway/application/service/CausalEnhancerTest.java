package com.vidnyan.causeway.application.service;

import com.vidnyan.causeway.analysis.CausalGraphBuilder;
import com.vidnyan.causeway.application.port.in.EnhanceCodeUseCase.EnhanceRequest;
import com.vidnyan.causeway.application.port.out.ScmService;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.InterventionException;
import com.vidnyan.causeway.domain.intervention.InterventionResult;
import com.vidnyan.causeway.domain.mechanism.MechanismKind;
import com.vidnyan.causeway.domain.model.CausalBundle;
import com.vidnyan.causeway.domain.model.EnhancementMode;
import com.vidnyan.causeway.domain.model.ScmMode;
import com.vidnyan.causeway.domain.syntax.*;
import com.vidnyan.causeway.domain.trace.Trace;
import com.vidnyan.causeway.intervention.InterventionEngine;
import com.vidnyan.causeway.intervention.InterventionParser;
import com.vidnyan.causeway.mechanism.ScmFitter;
import com.vidnyan.causeway.mechanism.StaticMechanismInferrer;
import com.vidnyan.causeway.support.StubScmService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CausalEnhancerTest {

    private static final String X = "var:__module__.x:L1";
    private static final String Y = "var:__module__.y:L2";

    private StubScmService scmService;
    private CausalEnhancer enhancer;

    @BeforeEach
    void setUp() {
        scmService = new StubScmService();
        CausalProperties properties = new CausalProperties();
        enhancer = new CausalEnhancer(
                CausalGraphBuilder.withDefaults(),
                new ScmFitter(new StaticMechanismInferrer(), scmService, properties),
                new InterventionEngine(new InterventionParser(), scmService, properties),
                properties);
    }

    private static SourceTree functionTree() {
        FunctionDef function = new FunctionDef("double_it", 1, 4, List.of("a"), List.of(), false,
                "double double_it(double a) { return a * 2; }",
                List.of(new Assignment("b", 2, List.of("a"), false, "=", null),
                        new Return(3, List.of("b"), true)));
        return SourceTree.of(function);
    }

    private static SourceTree assignmentTree() {
        return SourceTree.of(
                new Assignment("x", 1, List.of(), false, "=", null),
                new Assignment("y", 2, List.of("x"), false, "=", null));
    }

    private static Trace traces() {
        return Trace.fromLists(Map.of(
                X, List.of(1.0, 2.0, 3.0, 4.0),
                Y, List.of(2.0, 4.0, 6.0, 8.0)));
    }

    private CausalBundle enhanceDynamic() {
        return enhancer.enhance(EnhanceRequest.forTree(assignmentTree()).withTraces(traces()));
    }

    @Test
    void enhance_StaticModeInfersMechanismsFromFunctionSource() {
        // Act
        CausalBundle bundle = enhancer.enhance(EnhanceRequest.forTree(functionTree()));

        // Assert
        assertTrue(bundle.hasCausalCapability());
        assertTrue(bundle.warnings().isEmpty());
        assertEquals(ScmMode.STATIC, bundle.mode());
        assertEquals(MechanismKind.LINEAR, bundle.scm().mechanisms().get("func:double_it").kind());
        assertEquals("static", bundle.metadata().get("mode"));
        assertEquals("auto", bundle.metadata().get("requested_mode"));
        assertEquals(bundle.causalGraph().nodeCount(), bundle.metadata().get("node_count"));
        assertTrue(bundle.metadata().containsKey("duration_ms"));
    }

    @Test
    void enhance_GraphFailureDegrades() {
        CausalBundle bundle = enhancer.enhance(EnhanceRequest.forTree(new SourceTree("empty", List.of())));

        assertNull(bundle.causalGraph());
        assertNull(bundle.scm());
        assertEquals(List.of(CausalEnhancer.WARNING_GRAPH_FAILED), bundle.warnings());
        assertEquals(0, enhancer.consecutiveFailures());
    }

    @Test
    void enhance_DynamicModeWithTraces() {
        CausalBundle bundle = enhanceDynamic();

        assertEquals(ScmMode.DYNAMIC, bundle.mode());
        assertTrue(bundle.scm().hasTraces());
        assertEquals(List.of(X, Y), scmService.fitRequests.get(0).graph().nodes());
    }

    @Test
    void enhance_DynamicWithoutTracesKeepsGraph() {
        CausalBundle bundle = enhancer.enhance(EnhanceRequest.forTree(assignmentTree())
                .withMode(EnhancementMode.DYNAMIC));

        assertTrue(bundle.hasGraph());
        assertNull(bundle.scm());
        assertEquals(List.of(CausalEnhancer.WARNING_FITTING_FAILED), bundle.warnings());
        assertEquals("FITTING", bundle.metadata().get("error_family"));
    }

    @Test
    void enhance_ValidationFailureDoesNotCountTowardBreaker() {
        scmService.onFit(request -> new ScmService.FitResponse(ScmService.STATUS_VALIDATION_FAILED, Map.of(),
                Map.of("mean_r2", 0.2, "failed_nodes", List.of(Y)), Map.of(), null, null));

        for (int i = 0; i < 5; i++) {
            assertEquals(List.of(CausalEnhancer.WARNING_FITTING_FAILED), enhanceDynamic().warnings());
        }

        assertEquals(0, enhancer.consecutiveFailures());
        assertFalse(enhancer.isCircuitOpen());
    }

    @Test
    void enhance_ServiceFailuresOpenCircuitBreaker() {
        // Arrange
        scmService.failing("connection refused");

        // Act
        for (int i = 0; i < 3; i++) {
            CausalBundle bundle = enhanceDynamic();
            assertEquals(List.of(CausalEnhancer.WARNING_SERVICE_FAILED), bundle.warnings());
            assertTrue(bundle.hasGraph());
        }
        CausalBundle shortCircuited = enhanceDynamic();

        // Assert
        assertTrue(enhancer.isCircuitOpen());
        assertEquals(List.of(CausalEnhancer.WARNING_CIRCUIT_BREAKER), shortCircuited.warnings());
        assertNull(shortCircuited.causalGraph());
        assertEquals(3, scmService.fitRequests.size(), "no call once the breaker is open");

        enhancer.resetCircuitBreaker();
        assertFalse(enhancer.isCircuitOpen());
        assertEquals(0, enhancer.consecutiveFailures());
    }

    @Test
    void enhance_SuccessClearsFailureCount() {
        scmService.failing("flaky");
        enhanceDynamic();
        enhanceDynamic();
        assertEquals(2, enhancer.consecutiveFailures());

        scmService = scmService.onFit(request -> new ScmService.FitResponse(ScmService.STATUS_SUCCESS,
                Map.of(), Map.of(), Map.of(), null, null));
        CausalBundle bundle = enhanceDynamic();

        assertTrue(bundle.hasCausalCapability());
        assertEquals(0, enhancer.consecutiveFailures());
    }

    @Test
    void query_UsesFittedBundle() {
        scmService.onQuery(request -> new ScmService.QueryResponse(ScmService.STATUS_SUCCESS,
                Map.of(Y, List.of(2.0, 2.0)), null, Map.of(), null, null));
        CausalBundle bundle = enhanceDynamic();

        InterventionResult result = enhancer.query(bundle, Map.of("type", "hard", "node", X, "value", 1));

        assertEquals(2.0, result.statistics().get(Y).mean());
    }

    @Test
    void query_WithoutFittedModelFails() {
        CausalBundle degraded = enhancer.enhance(EnhanceRequest.forTree(new SourceTree("empty", List.of())));

        assertThrows(InterventionException.class, () -> enhancer.query(degraded, "do(x=1)"));
        assertThrows(InterventionException.class, () -> enhancer.query(null, "do(x=1)"));
    }
}
