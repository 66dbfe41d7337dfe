package com.purchasingpower.researchflow.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.researchflow.graph.engine.StepEvent;
import com.purchasingpower.researchflow.graph.engine.StepListener;
import com.purchasingpower.researchflow.model.RunStatus;
import com.purchasingpower.researchflow.model.dto.RunEvent;
import com.purchasingpower.researchflow.workflow.state.ResearchState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes step events of research runs to Server-Sent Event streams.
 *
 * Usage:
 * 1. Client calls GET /api/v1/research/{threadId}/stream
 * 2. RunStreamService creates an SseEmitter
 * 3. The graph engine calls onStep() after every checkpoint
 * 4. Client receives updates via EventSource
 *
 * Events published before the client connects are buffered and replayed on connect.
 * The buffer of a thread lives for one invocation: it is dropped when the run
 * completes or fails with no client connected, and when a new run or resume starts.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RunStreamService implements StepListener {

    static final String EVENT_NAME = "run-update";

    private static final long SSE_TIMEOUT_MS = 5 * 60 * 1000;

    /**
     * Max buffered events per thread.
     */
    static final int MAX_BUFFERED_EVENTS = 100;

    private final ObjectMapper objectMapper;

    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();
    private final Map<String, List<RunEvent>> eventBuffer = new ConcurrentHashMap<>();

    public SseEmitter createStream(String threadId) {
        log.info("📡 Creating SSE stream for thread: {}", threadId);

        SseEmitter emitter = new SseEmitter(SSE_TIMEOUT_MS);

        emitter.onCompletion(() -> {
            log.info("✅ SSE stream completed for thread: {}", threadId);
            removeEmitter(threadId);
        });
        emitter.onTimeout(() -> {
            log.warn("⏱️ SSE stream timed out for thread: {}", threadId);
            removeEmitter(threadId);
        });
        emitter.onError(error -> {
            log.error("❌ SSE stream error for thread: {}", threadId, error);
            removeEmitter(threadId);
        });

        emitters.put(threadId, emitter);

        try {
            send(emitter, RunEvent.connected(threadId));

            List<RunEvent> buffered = eventBuffer.remove(threadId);
            if (buffered != null && !buffered.isEmpty()) {
                log.info("🔄 Replaying {} buffered events for thread: {}", buffered.size(), threadId);
                synchronized (buffered) {
                    for (RunEvent event : buffered) {
                        send(emitter, event);
                    }
                }
            }
        } catch (IOException e) {
            log.error("Failed to send SSE events during stream creation", e);
            removeEmitter(threadId);
        }

        return emitter;
    }

    @Override
    public void onStep(StepEvent step) {
        RunEvent event = toRunEvent(step);
        sendUpdate(step.getThreadId(), event);

        if (step.getStatus() == RunStatus.COMPLETED) {
            complete(step.getThreadId());
        } else if (step.getStatus() == RunStatus.FAILED) {
            fail(step.getThreadId(), event.getError());
        }
    }

    /**
     * Sends to the connected client, or buffers the event if none is connected yet.
     */
    public void sendUpdate(String threadId, RunEvent event) {
        SseEmitter emitter = emitters.get(threadId);

        if (emitter == null) {
            List<RunEvent> buffer = eventBuffer.computeIfAbsent(threadId,
                    k -> Collections.synchronizedList(new ArrayList<>()));
            if (buffer.size() < MAX_BUFFERED_EVENTS) {
                buffer.add(event);
                log.debug("📦 Buffered SSE event (total: {}): thread={}, node={}", buffer.size(), threadId, event.getNode());
            } else {
                log.warn("⚠️ Event buffer full for thread: {} (dropping event)", threadId);
            }
            return;
        }

        try {
            send(emitter, event);
            log.debug("📤 Sent SSE update: thread={}, status={}, node={}", threadId, event.getStatus(), event.getNode());
        } catch (IOException e) {
            log.error("Failed to send SSE update for thread: {}", threadId, e);
            removeEmitter(threadId);
        }
    }

    public boolean hasActiveStream(String threadId) {
        return emitters.containsKey(threadId);
    }

    /**
     * Drops events left over from an earlier invocation of the thread.
     */
    public void clearBuffer(String threadId) {
        List<RunEvent> stale = eventBuffer.remove(threadId);
        if (stale != null) {
            log.debug("🗑️ Dropped {} stale SSE events for thread: {}", stale.size(), threadId);
        }
    }

    List<RunEvent> getBufferedEvents(String threadId) {
        List<RunEvent> buffer = eventBuffer.get(threadId);
        return buffer == null ? List.of() : List.copyOf(buffer);
    }

    private void complete(String threadId) {
        SseEmitter emitter = emitters.remove(threadId);
        if (emitter != null) {
            emitter.complete();
        } else {
            clearBuffer(threadId);
        }
    }

    private void fail(String threadId, String error) {
        SseEmitter emitter = emitters.remove(threadId);
        if (emitter != null) {
            emitter.completeWithError(new IllegalStateException(error));
        } else {
            clearBuffer(threadId);
        }
    }

    RunEvent toRunEvent(StepEvent step) {
        RunEvent.RunEventBuilder event = RunEvent.builder()
                .threadId(step.getThreadId())
                .status(step.getStatus())
                .stepSequence(step.getStepSequence())
                .node(step.getNode())
                .nextNode(step.getNextNode())
                .interrupt(step.getInterrupt());

        if (step.getState() != null) {
            event.progress(new ResearchState(step.getState()).getResearchProgress());
        }

        switch (step.getStatus()) {
            case COMPLETED:
                event.message("✅ Run completed after " + step.getNode());
                break;
            case SUSPENDED:
                event.message("⏸️ Waiting before " + step.getNextNode() + ": "
                        + (step.getInterrupt() != null ? step.getInterrupt().getReason() : "suspended"));
                break;
            case FAILED:
                String error = step.getError() != null ? step.getError().getMessage() : "unknown error";
                event.error(error).message("❌ Run failed: " + error);
                break;
            default:
                event.message("⚙️ " + step.getNode() + " finished, next: " + step.getNextNode());
        }
        return event.build();
    }

    private void send(SseEmitter emitter, RunEvent event) throws IOException {
        emitter.send(SseEmitter.event()
                .name(EVENT_NAME)
                .data(objectMapper.writeValueAsString(event)));
    }

    private void removeEmitter(String threadId) {
        emitters.remove(threadId);
        eventBuffer.remove(threadId);
        log.debug("🗑️ Removed SSE emitter for thread: {}", threadId);
    }
}
