package com.mar.simulator.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import jakarta.annotation.PreDestroy;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import com.fasterxml.jackson.databind.JsonNode;
import com.mar.simulator.config.AppProperties;
import com.mar.simulator.domain.model.JobResponse;
import com.mar.simulator.engine.Portfolio;
import com.mar.simulator.engine.SimulationException;
import com.mar.simulator.infrastructure.messaging.SseHub;
import com.mar.simulator.service.SimulationService;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
@Slf4j
public class SimulationController {

    private final AppProperties props;
    private final SimulationService simulationService;
    private final SseHub hub;

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @GetMapping("/config")
    public AppProperties getConfig() {
        return props;
    }

    /**
     * Starts a simulation with the defaults, optionally overridden by the request body, and returns its job id.
     * Configuration problems are rejected here, before the job is queued.
     */
    @PostMapping("/simulate")
    public JobResponse simulate(@RequestBody(required = false) JsonNode body) {
        AppProperties cfg = simulationService.resolveConfig(body);
        Portfolio.validate(cfg);

        String jobId = "sim-" + UUID.randomUUID();
        log.info("Queued simulation {} | files={}", jobId, cfg.getData().getFiles());
        pool.submit(() -> simulationService.runForUI(cfg, jobId));
        return new JobResponse(jobId);
    }

    @GetMapping(path = "/stream/{jobId}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String jobId) {
        return hub.connect(jobId);
    }

    @GetMapping(value = "/result/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public String getResult(@PathVariable String jobId) {
        return hub.getLast(jobId);
    }

    @ExceptionHandler(SimulationException.class)
    public ResponseEntity<Map<String, String>> onSimulationError(SimulationException e) {
        HttpStatus status = e.getErrorCode() == SimulationException.ErrorCode.INVALID_CONFIGURATION
            ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
        log.warn("Request rejected [{}]: {}", e.getErrorCode(), e.getMessage());
        return ResponseEntity.status(status).body(Map.of("code", e.getErrorCode().name(), "message", e.getMessage()));
    }

    @PreDestroy
    void shutdown() {
        pool.shutdownNow();
    }
}
