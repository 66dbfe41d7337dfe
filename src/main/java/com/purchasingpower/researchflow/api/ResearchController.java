package com.purchasingpower.researchflow.api;

import com.purchasingpower.researchflow.exception.ErrorType;
import com.purchasingpower.researchflow.exception.ResumeMismatchException;
import com.purchasingpower.researchflow.exception.RunConflictException;
import com.purchasingpower.researchflow.exception.StoreUnavailableException;
import com.purchasingpower.researchflow.graph.engine.RunResult;
import com.purchasingpower.researchflow.model.RunStatus;
import com.purchasingpower.researchflow.service.ResearchSessionService;
import com.purchasingpower.researchflow.service.RunStreamService;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * REST controller for research threads.
 *
 * Flow:
 * 1. POST /{threadId}/run with a query; the response is COMPLETED, SUSPENDED or FAILED
 * 2. If SUSPENDED, inspect the interrupt and POST /{threadId}/resume with a decision
 * 3. Optionally follow progress through GET /{threadId}/stream
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
public class ResearchController {

    private static final String ASYNC_MESSAGE = "Processing... Connect to SSE stream for updates.";

    private final ResearchSessionService researchService;
    private final RunStreamService runStreamService;

    /**
     * POST /api/v1/research/{threadId}/run
     */
    @PostMapping("/{threadId}/run")
    public ResponseEntity<RunResponse> run(@PathVariable String threadId,
                                           @RequestBody RunRequest request,
                                           @RequestParam(defaultValue = "false") boolean async) {
        try {
            Map<String, Object> fields;
            if (request.getFields() != null && !request.getFields().isEmpty()) {
                fields = request.getFields();
            } else if (request.getQuery() != null && !request.getQuery().isBlank()) {
                fields = ResearchState.initialInput(request.getQuery());
            } else {
                return ResponseEntity.badRequest()
                        .body(RunResponse.error(threadId, null, "Either query or fields is required"));
            }

            if (async) {
                researchService.runAsync(threadId, fields);
                return ResponseEntity.ok(RunResponse.accepted(threadId, ASYNC_MESSAGE));
            }
            return toResponse(researchService.run(threadId, fields));

        } catch (RunConflictException e) {
            return conflict(threadId, e.getErrorType(), e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected run input for thread {}: {}", threadId, e.getMessage());
            return ResponseEntity.badRequest().body(RunResponse.error(threadId, null, e.getMessage()));
        } catch (StoreUnavailableException e) {
            return unavailable(threadId, e);
        } catch (Exception e) {
            log.error("Run failed: thread={}", threadId, e);
            return ResponseEntity.internalServerError()
                    .body(RunResponse.error(threadId, null, "Internal error: " + e.getMessage()));
        }
    }

    /**
     * POST /api/v1/research/{threadId}/resume
     */
    @PostMapping("/{threadId}/resume")
    public ResponseEntity<RunResponse> resume(@PathVariable String threadId,
                                              @RequestBody ResumeRequest request,
                                              @RequestParam(defaultValue = "false") boolean async) {
        try {
            Map<String, Object> decision = request.toDecision();
            if (async) {
                researchService.resumeAsync(threadId, decision);
                return ResponseEntity.ok(RunResponse.accepted(threadId, ASYNC_MESSAGE));
            }
            return toResponse(researchService.resume(threadId, decision));

        } catch (ResumeMismatchException e) {
            return conflict(threadId, e.getErrorType(), e.getMessage());
        } catch (StoreUnavailableException e) {
            return unavailable(threadId, e);
        } catch (Exception e) {
            log.error("Resume failed: thread={}", threadId, e);
            return ResponseEntity.internalServerError()
                    .body(RunResponse.error(threadId, null, "Internal error: " + e.getMessage()));
        }
    }

    /**
     * POST /api/v1/research/{threadId}/cancel
     */
    @PostMapping("/{threadId}/cancel")
    public ResponseEntity<RunResponse> cancel(@PathVariable String threadId) {
        if (!researchService.cancel(threadId)) {
            return conflict(threadId, ErrorType.RUN_CONFLICT, "No active run for thread " + threadId);
        }
        return ResponseEntity.ok(RunResponse.accepted(threadId, "Cancellation requested"));
    }

    /**
     * GET /api/v1/research/{threadId}
     */
    @GetMapping("/{threadId}")
    public ResponseEntity<RunResponse> getThread(@PathVariable String threadId) {
        try {
            return researchService.getCheckpoint(threadId)
                    .map(checkpoint -> ResponseEntity.ok(RunResponse.from(checkpoint)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(RunResponse.error(threadId, null, "Thread not found: " + threadId)));
        } catch (StoreUnavailableException e) {
            return unavailable(threadId, e);
        }
    }

    /**
     * GET /api/v1/research/threads?status=SUSPENDED
     */
    @GetMapping("/threads")
    public ResponseEntity<List<RunResponse>> listThreads(@RequestParam(defaultValue = "SUSPENDED") String status) {
        RunStatus runStatus;
        try {
            runStatus = RunStatus.valueOf(status.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            log.warn("Invalid status filter '{}'", status);
            return ResponseEntity.badRequest().build();
        }

        try {
            List<RunResponse> threads = researchService.findThreads(runStatus).stream()
                    .map(RunResponse::from)
                    .collect(Collectors.toList());
            return ResponseEntity.ok(threads);
        } catch (StoreUnavailableException e) {
            log.error("Listing threads failed", e);
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
        }
    }

    /**
     * GET /api/v1/research/{threadId}/stream
     */
    @GetMapping(value = "/{threadId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter stream(@PathVariable String threadId) {
        return runStreamService.createStream(threadId);
    }

    private ResponseEntity<RunResponse> toResponse(RunResult result) {
        RunResponse body = RunResponse.from(result);
        if (result instanceof RunResult.Failed failed) {
            if (failed.errorType() == ErrorType.STORE_UNAVAILABLE) {
                return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
            }
            if (failed.errorType() == ErrorType.UNKNOWN_FIELD) {
                return ResponseEntity.badRequest().body(body);
            }
        }
        return ResponseEntity.ok(body);
    }

    private ResponseEntity<RunResponse> conflict(String threadId, ErrorType errorType, String message) {
        log.warn("⚠️ Conflict on thread {}: {}", threadId, message);
        return ResponseEntity.status(HttpStatus.CONFLICT).body(RunResponse.error(threadId, errorType, message));
    }

    private ResponseEntity<RunResponse> unavailable(String threadId, StoreUnavailableException e) {
        log.error("❌ Checkpoint store unavailable: thread={}", threadId, e);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(RunResponse.error(threadId, e.getErrorType(), e.getMessage()));
    }
}
