package com.vidnyan.causeway.adapter.out.scm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.causeway.application.port.out.ScmService;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.ExternalServiceException;
import com.vidnyan.causeway.domain.graph.CausalGraph;
import com.vidnyan.causeway.domain.intervention.HardIntervention;
import com.vidnyan.causeway.domain.trace.Trace;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class SubprocessScmClientTest {

    private static final CausalGraph GRAPH = CausalGraph.ofEdges(new String[] {"x", "y"});
    private static final Trace TRACES = Trace.fromLists(Map.of(
            "x", List.of(1.0, 2.0),
            "y", List.of(2.0, 4.0)));

    private static ScmService.FitRequest fitRequest() {
        return ScmService.FitRequest.of(GRAPH, TRACES, new ScmService.FitConfig("GOOD", true, 0.7, 0.2));
    }

    private static SubprocessScmClient client(String script) {
        CausalProperties properties = new CausalProperties();
        properties.getService().setFitCommand(List.of("sh", "-c", script));
        properties.getService().setQueryCommand(List.of("sh", "-c", script));
        properties.getService().setAvailabilityCommand(List.of("sh", "-c", script));
        properties.getService().setTimeout(Duration.ofSeconds(10));
        properties.getService().setAvailabilityTimeout(Duration.ofSeconds(5));
        return new SubprocessScmClient(new ObjectMapper(), properties);
    }

    @Test
    void fit_ParsesSuccessResponse() {
        SubprocessScmClient client = client("cat > /dev/null; "
                + "echo '{\"status\":\"success\",\"scm\":{\"nodes\":[\"x\",\"y\"]},"
                + "\"validation\":{\"mean_r2\":0.91},\"metadata\":{},\"unexpected\":true}'");

        ScmService.FitResponse response = client.fit(fitRequest());

        assertEquals(ScmService.STATUS_SUCCESS, response.status());
        assertEquals(0.91, response.validation().get("mean_r2"));
        assertEquals(List.of("x", "y"), response.scm().get("nodes"));
    }

    @Test
    void fit_WritesRequestToStdin() {
        SubprocessScmClient client = client("input=$(cat); case \"$input\" in "
                + "*'\"r2_threshold\":0.7'*) echo '{\"status\":\"success\"}' ;; "
                + "*) echo '{\"status\":\"warning\"}' ;; esac");

        assertEquals(ScmService.STATUS_SUCCESS, client.fit(fitRequest()).status());
    }

    @Test
    void query_ParsesSamples() {
        SubprocessScmClient client = client("cat > /dev/null; "
                + "echo '{\"status\":\"success\",\"samples\":{\"y\":[1.0,2.0]},\"statistics\":{}}'");
        ScmService.QueryRequest request = new ScmService.QueryRequest(
                ScmService.GraphPayload.of(GRAPH),
                TRACES.toLists(),
                ScmService.QuerySpec.interventional(List.of(new HardIntervention("x", 1.0)), null, 2),
                Map.of("quality", "GOOD"));

        ScmService.QueryResponse response = client.query(request);

        assertEquals(List.of(1.0, 2.0), response.samples().get("y"));
    }

    @Test
    void fit_ErrorStatusCarriesTraceback() {
        SubprocessScmClient client = client("cat > /dev/null; "
                + "echo '{\"status\":\"error\",\"error\":\"boom\",\"traceback\":\"line 1\"}'");

        ExternalServiceException error = assertThrows(ExternalServiceException.class, () -> client.fit(fitRequest()));

        assertTrue(error.getMessage().contains("boom"));
        assertEquals("line 1", error.traceback());
    }

    @Test
    void fit_NonJsonOutputFails() {
        SubprocessScmClient client = client("cat > /dev/null; echo 'Traceback: ImportError'; exit 1");

        ExternalServiceException error = assertThrows(ExternalServiceException.class, () -> client.fit(fitRequest()));

        assertTrue(error.rawOutput().contains("ImportError"));
    }

    @Test
    void fit_EmptyOutputFails() {
        SubprocessScmClient client = client("cat > /dev/null");

        assertThrows(ExternalServiceException.class, () -> client.fit(fitRequest()));
    }

    @Test
    void fit_TimesOut() {
        CausalProperties properties = new CausalProperties();
        properties.getService().setFitCommand(List.of("sh", "-c", "sleep 5"));
        properties.getService().setTimeout(Duration.ofMillis(300));
        SubprocessScmClient impatient = new SubprocessScmClient(new ObjectMapper(), properties);

        ExternalServiceException error = assertThrows(ExternalServiceException.class,
                () -> impatient.fit(fitRequest()));

        assertTrue(error.getMessage().contains("timed out"));
    }

    @Test
    void fit_MissingExecutableFails() {
        CausalProperties properties = new CausalProperties();
        properties.getService().setFitCommand(List.of("/nonexistent/causeway-scm"));
        SubprocessScmClient client = new SubprocessScmClient(new ObjectMapper(), properties);

        assertThrows(ExternalServiceException.class, () -> client.fit(fitRequest()));
    }

    @Test
    void isAvailable_FollowsExitCode() {
        assertTrue(client("echo 0.11").isAvailable());
        assertFalse(client("echo missing >&2; exit 1").isAvailable());
    }
}
