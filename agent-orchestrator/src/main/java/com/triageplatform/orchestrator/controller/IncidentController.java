package com.triageplatform.orchestrator.controller;

import com.triageplatform.common.event.BufferingWorkerEventSink;
import com.triageplatform.common.model.ExecutionResult;
import com.triageplatform.common.model.IncidentInput;
import com.triageplatform.orchestrator.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/incidents")
public class IncidentController {

    private static final Logger log = LoggerFactory.getLogger(IncidentController.class);

    private final PipelineOrchestrator orchestrator;

    public IncidentController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping
    public Mono<ResponseEntity<ExecutionResult>> triage(@RequestBody IncidentInput incident) {
        return orchestrator.execute(incident).map(ResponseEntity::ok);
    }

    /**
     * Streams every worker lifecycle event as it happens, then the final result, one JSON object
     * per line.
     *
     * <p>The pipeline starts as soon as the client subscribes to the event stream; the event
     * stream completes when the pipeline terminates, after which the cached result is emitted.
     * The pipeline runs to completion even if the client disconnects early.
     */
    @PostMapping(value = "/stream", produces = MediaType.APPLICATION_NDJSON_VALUE)
    public Flux<IncidentStreamFrame> triageStream(@RequestBody IncidentInput incident) {
        BufferingWorkerEventSink sink = new BufferingWorkerEventSink();
        Mono<ExecutionResult> result = orchestrator.execute(incident, sink)
            .doFinally(signal -> sink.complete())
            .cache();

        Flux<IncidentStreamFrame> events = sink.events()
            .map(IncidentStreamFrame::of)
            .doOnSubscribe(subscription -> result.subscribe(
                r -> log.debug("Streamed triage finished. executionId={}", r.executionId()),
                e -> log.error("Streamed triage failed. deploymentId={}", incident.deploymentId(), e)));

        return Flux.concat(events, result.map(IncidentStreamFrame::of));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
