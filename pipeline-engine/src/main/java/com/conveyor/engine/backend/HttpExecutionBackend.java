package com.conveyor.engine.backend;

import com.conveyor.engine.backend.dto.RunStepRequest;
import com.conveyor.engine.backend.dto.RunStepResponse;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * HTTP client for the step runner service.
 *
 * The runner pulls the image, runs the commands in a container and answers
 * with the exit code once the container stops, so each call blocks for the
 * whole step. That is fine: calls come from the scheduler's worker pools.
 */
@Component
public class HttpExecutionBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(HttpExecutionBackend.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final int          stepTimeoutSec;

    public HttpExecutionBackend(
            @Value("${conveyor.runner.base-url}") String baseUrl,
            @Value("${conveyor.runner.step-timeout-sec:3600}") int stepTimeoutSec,
            ObjectMapper objectMapper) {
        this.baseUrl        = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.stepTimeoutSec = stepTimeoutSec;
        this.json           = objectMapper;
        this.http           = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public ExitStatus runStep(StepInvocation invocation) {
        log.info("Running step '{}' of pipeline '{}' in {} on {}",
                invocation.step(), invocation.pipeline(), invocation.image(), invocation.platform());

        RunStepRequest request = new RunStepRequest(
                invocation.runId() == null ? null : invocation.runId().toString(),
                invocation.pipeline(),
                invocation.step(),
                invocation.platform().toString(),
                invocation.image(),
                invocation.commands(),
                invocation.environment(),
                stepTimeoutSec);

        // The runner enforces timeout_sec itself; leave it room to answer.
        String body = post("/steps/run", toJson(request),
                "runStep " + invocation.pipeline() + "/" + invocation.step(),
                Duration.ofSeconds(stepTimeoutSec + 30L));
        try {
            RunStepResponse response = json.readValue(body, RunStepResponse.class);
            if (response.error_type() != null) {
                log.warn("Step '{}' of pipeline '{}' ended with runner error {} (exit {})",
                        invocation.step(), invocation.pipeline(), response.error_type(), response.exit_code());
            }
            return new ExitStatus(response.exit_code(), response.output());
        } catch (JsonProcessingException e) {
            throw new ExecutionBackendException("Failed to parse runStep response", e);
        }
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String post(String path, String jsonBody, String opName, Duration timeout) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new ExecutionBackendException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (ExecutionBackendException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionBackendException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new ExecutionBackendException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new ExecutionBackendException("JSON serialization failed", e);
        }
    }
}
