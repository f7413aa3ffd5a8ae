package com.conveyor.engine.api;

import com.conveyor.engine.api.dto.EvaluateResponse;
import com.conveyor.engine.api.dto.RunResponse;
import com.conveyor.engine.api.dto.SubmitRunRequest;
import com.conveyor.engine.compile.PipelineConfigException;
import com.conveyor.engine.model.Pipeline;
import com.conveyor.engine.service.RunService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.UUID;

/**
 * REST API for runs.
 *
 * POST /runs           : compile templates and start a run for an event
 * POST /runs/evaluate  : list the pipelines an event would run, run nothing
 * GET  /runs/{id}      : current state of a run and its pipelines
 */
@RestController
@RequestMapping("/runs")
public class RunController {

    private final RunService runService;

    public RunController(RunService runService) {
        this.runService = runService;
    }

    /**
     * Start a run.
     *
     * HTTP 201: compiled and scheduled
     * HTTP 400: missing event or templates that do not compile
     */
    @PostMapping
    public ResponseEntity<RunResponse> submit(@RequestBody SubmitRunRequest req) {
        requireEvent(req);
        try {
            RunResponse run = RunResponse.from(runService.submit(req.templates(), req.variables(), req.event()));
            return ResponseEntity.status(HttpStatus.CREATED).body(run);
        } catch (PipelineConfigException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    @PostMapping("/evaluate")
    public EvaluateResponse evaluate(@RequestBody SubmitRunRequest req) {
        requireEvent(req);
        try {
            return new EvaluateResponse(runService.evaluate(req.templates(), req.variables(), req.event())
                    .stream()
                    .map(Pipeline::name)
                    .toList());
        } catch (PipelineConfigException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Poll a run. Returns 404 if the id is neither running nor in history.
     */
    @GetMapping("/{id}")
    public RunResponse getRun(@PathVariable UUID id) {
        return runService.find(id)
                .map(RunResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Run not found: " + id));
    }

    private static void requireEvent(SubmitRunRequest req) {
        if (req.event() == null || req.event().type() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Request must carry an event with a type");
        }
    }
}
