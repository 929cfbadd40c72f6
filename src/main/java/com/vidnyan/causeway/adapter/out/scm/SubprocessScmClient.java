package com.vidnyan.causeway.adapter.out.scm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vidnyan.causeway.application.port.out.ScmService;
import com.vidnyan.causeway.config.CausalProperties;
import com.vidnyan.causeway.domain.error.ExternalServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the SCM service as a child process: request JSON on stdin, response JSON on stdout.
 */
@Slf4j
@Component
public class SubprocessScmClient implements ScmService {

    private static final int EXCERPT_LENGTH = 500;

    private final ObjectMapper objectMapper;
    private final CausalProperties.Service settings;

    public SubprocessScmClient(ObjectMapper objectMapper, CausalProperties properties) {
        this.objectMapper = objectMapper;
        this.settings = properties.getService();
    }

    @Override
    public FitResponse fit(FitRequest request) {
        log.info("Fitting SCM via subprocess: {} nodes, {} edges",
                request.graph().nodes().size(), request.graph().edges().size());
        return call("fit", settings.getFitCommand(), request, FitResponse.class);
    }

    @Override
    public QueryResponse query(QueryRequest request) {
        log.info("Querying SCM via subprocess: {} interventions",
                request.intervention().interventions().size());
        return call("query", settings.getQueryCommand(), request, QueryResponse.class);
    }

    @Override
    public boolean isAvailable() {
        try {
            ProcessResult result = run(settings.getAvailabilityCommand(), "", settings.getAvailabilityTimeout());
            if (result.exitCode() == 0) {
                log.info("SCM service available: {}", result.stdout().trim());
                return true;
            }
            log.warn("SCM service check failed: {}", excerpt(result.stderr()));
            return false;
        } catch (ExternalServiceException e) {
            log.warn("SCM service check failed: {}", e.getMessage());
            return false;
        }
    }

    private <T> T call(String operation, List<String> command, Object request, Class<T> responseType) {
        String input;
        try {
            input = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Failed to encode " + operation + " request", e);
        }

        ProcessResult result = run(command, input, settings.getTimeout());

        JsonNode output;
        try {
            output = objectMapper.readTree(result.stdout());
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException(String.format(
                    "Failed to parse SCM %s output as JSON (exit %d).%nstdout: %s%nstderr: %s",
                    operation, result.exitCode(), excerpt(result.stdout()), excerpt(result.stderr())),
                    result.stdout(), null, e);
        }
        if (output == null || !output.isObject()) {
            throw new ExternalServiceException(String.format(
                    "SCM %s produced no JSON object (exit %d).%nstdout: %s%nstderr: %s",
                    operation, result.exitCode(), excerpt(result.stdout()), excerpt(result.stderr())),
                    result.stdout(), null, null);
        }

        if (STATUS_ERROR.equals(output.path("status").asText())) {
            String error = output.path("error").asText("Unknown error");
            String traceback = output.path("traceback").asText("");
            throw new ExternalServiceException("SCM " + operation + " failed: " + error
                    + (traceback.isEmpty() ? "" : "\nTraceback:\n" + traceback),
                    result.stdout(), traceback, null);
        }

        try {
            return objectMapper.treeToValue(output, responseType);
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Malformed SCM " + operation + " response: " + e.getOriginalMessage(),
                    result.stdout(), null, e);
        }
    }

    private ProcessResult run(List<String> command, String input, Duration timeout) {
        Process process;
        try {
            process = new ProcessBuilder(command).start();
        } catch (IOException e) {
            throw new ExternalServiceException("Failed to start SCM process " + command + ": " + e.getMessage(), e);
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> readAll(process.getInputStream()));
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        CompletableFuture<Void> stdin = CompletableFuture.runAsync(() -> writeAll(process.getOutputStream(), input));

        try {
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw new ExternalServiceException("SCM process timed out after " + timeout.toSeconds() + "s");
            }
            stdin.exceptionally(e -> null).join();
            return new ProcessResult(process.exitValue(),
                    stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS),
                    stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted while waiting for SCM process", e);
        } catch (ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            throw new ExternalServiceException("Failed to read SCM process output: " + e.getMessage(), e);
        }
    }

    private static String readAll(InputStream stream) {
        try (stream) {
            return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void writeAll(OutputStream stream, String input) {
        try (stream) {
            stream.write(input.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            // child exited without reading stdin; its output decides the outcome
            log.debug("SCM process closed stdin early: {}", e.getMessage());
        }
    }

    private static String excerpt(String text) {
        return text.length() <= EXCERPT_LENGTH ? text : text.substring(0, EXCERPT_LENGTH);
    }

    private record ProcessResult(int exitCode, String stdout, String stderr) {}
}
