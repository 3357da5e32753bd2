package com.patentflow.orchestrator.api;

import com.patentflow.orchestrator.api.dto.AdmissionResponse;
import com.patentflow.orchestrator.api.dto.ArtifactResponse;
import com.patentflow.orchestrator.api.dto.ControlResponse;
import com.patentflow.orchestrator.api.dto.TaskStateResponse;
import com.patentflow.orchestrator.model.Artifact;
import com.patentflow.orchestrator.model.TaskState;
import com.patentflow.orchestrator.service.AdmissionResult;
import com.patentflow.orchestrator.service.ControlResult;
import com.patentflow.orchestrator.service.TaskAdmissionService;
import com.patentflow.orchestrator.service.TaskControlService;
import com.patentflow.orchestrator.stage.StageDefinition;
import com.patentflow.orchestrator.stage.StageRegistry;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * REST API for stage runs on a workflow record.
 *
 * POST /records/{id}/stages/{stage}/start?force=   admit a run (202)
 * POST /records/{id}/stages/{stage}/cancel         cancel a running task
 * POST /records/{id}/stages/{stage}/reset          force the stage to FAILED
 * POST /records/{id}/stages/{stage}/heartbeat      manual liveness ping
 * GET  /records/{id}/stages/{stage}                status of one stage
 * GET  /records/{id}/stages                        status of every stage
 * GET  /records/{id}/stages/{stage}/artifacts      files produced by the stage
 * GET  /records/{id}/artifacts/{artifactId}        download one file
 */
@RestController
@RequestMapping("/records/{recordId}")
public class TaskController {

    private final TaskAdmissionService admission;
    private final TaskControlService   control;
    private final StageRegistry        stages;

    public TaskController(TaskAdmissionService admission,
                          TaskControlService control,
                          StageRegistry stages) {
        this.admission = admission;
        this.control   = control;
        this.stages    = stages;
    }

    /**
     * Admit a stage run.
     *
     * Example:
     *   curl -X POST "http://localhost:8080/records/{id}/stages/scene2tech/start?force=true"
     *
     * HTTP 202 accepted · 400 missing inputs · 404 unknown record/stage
     * 409 already running / already done · 503 job queue refused the run
     */
    @PostMapping("/stages/{stageKey}/start")
    public ResponseEntity<AdmissionResponse> start(@PathVariable UUID recordId,
                                                   @PathVariable String stageKey,
                                                   @RequestParam(defaultValue = "false") boolean force) {
        AdmissionResult result = admission.start(recordId, stageKey, force);
        HttpStatus status = switch (result.kind()) {
            case ACCEPTED   -> HttpStatus.ACCEPTED;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case NOT_FOUND  -> HttpStatus.NOT_FOUND;
            case CONFLICT   -> HttpStatus.CONFLICT;
            case SUBMISSION -> HttpStatus.SERVICE_UNAVAILABLE;
        };
        return ResponseEntity.status(status).body(AdmissionResponse.from(result));
    }

    /** HTTP 200 if a running task was cancelled, 409 if nothing was running. */
    @PostMapping("/stages/{stageKey}/cancel")
    public ResponseEntity<ControlResponse> cancel(@PathVariable UUID recordId, @PathVariable String stageKey) {
        requireKnown(recordId, stageKey);
        return respond(control.cancel(recordId, stageKey));
    }

    @PostMapping("/stages/{stageKey}/reset")
    public ResponseEntity<ControlResponse> reset(@PathVariable UUID recordId, @PathVariable String stageKey) {
        requireKnown(recordId, stageKey);
        return respond(control.reset(recordId, stageKey));
    }

    @PostMapping("/stages/{stageKey}/heartbeat")
    public ResponseEntity<ControlResponse> heartbeat(@PathVariable UUID recordId, @PathVariable String stageKey) {
        requireKnown(recordId, stageKey);
        return respond(control.heartbeat(recordId, stageKey));
    }

    @GetMapping("/stages/{stageKey}")
    public TaskStateResponse status(@PathVariable UUID recordId, @PathVariable String stageKey) {
        requireKnown(recordId, stageKey);
        return control.status(recordId, stageKey)
                .map(TaskStateResponse::from)
                .orElseGet(() -> TaskStateResponse.idle(recordId, stageKey));
    }

    /** One entry per configured stage, in pipeline order; never-started stages read as IDLE. */
    @GetMapping("/stages")
    public List<TaskStateResponse> statuses(@PathVariable UUID recordId) {
        requireRecord(recordId);
        Map<String, TaskState> byStage = control.statuses(recordId).stream()
                .collect(Collectors.toMap(TaskState::getStageKey, Function.identity()));
        return stages.all().stream()
                .map(StageDefinition::key)
                .map(key -> byStage.containsKey(key)
                        ? TaskStateResponse.from(byStage.get(key))
                        : TaskStateResponse.idle(recordId, key))
                .toList();
    }

    @GetMapping("/stages/{stageKey}/artifacts")
    public List<ArtifactResponse> artifacts(@PathVariable UUID recordId, @PathVariable String stageKey) {
        requireKnown(recordId, stageKey);
        return control.artifacts(recordId, stageKey).stream()
                .map(ArtifactResponse::from)
                .toList();
    }

    @GetMapping("/artifacts/{artifactId}")
    public ResponseEntity<byte[]> download(@PathVariable UUID recordId, @PathVariable UUID artifactId) {
        Artifact artifact = control.artifact(recordId, artifactId).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Artifact not found: " + artifactId));
        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(artifact.getContentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        ContentDisposition.attachment().filename(artifact.getFileName()).build().toString())
                .body(artifact.getContent());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void requireKnown(UUID recordId, String stageKey) {
        if (stages.find(stageKey).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Unknown stage: " + stageKey);
        }
        requireRecord(recordId);
    }

    private void requireRecord(UUID recordId) {
        if (!control.recordExists(recordId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Record not found: " + recordId);
        }
    }

    private static ResponseEntity<ControlResponse> respond(ControlResult result) {
        return ResponseEntity.status(result.ok() ? HttpStatus.OK : HttpStatus.CONFLICT)
                .body(ControlResponse.from(result));
    }
}
