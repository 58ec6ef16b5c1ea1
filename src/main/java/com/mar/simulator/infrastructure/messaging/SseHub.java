package com.mar.simulator.infrastructure.messaging;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Server-sent events per simulation job.
 *
 * One emitter per job id, a bounded replay buffer so a client that subscribes after the job started still
 * sees its history, heartbeats so idle connections survive proxies, and a delayed close so the final
 * event flushes. A job's replay buffer is dropped once {@code done} is sent; its last payload stays available
 * to {@link #getLast(String)} until {@value #RESULT_LIMIT} newer jobs have pushed it out.
 */
@Slf4j
@Component
public class SseHub {

    public static final String PROGRESS = "progress";
    public static final String RESULT = "result";
    public static final String ERROR = "error";
    public static final String DONE = "done";

    private static final int REPLAY_LIMIT = 32;
    static final int RESULT_LIMIT = 256;
    private static final long HEARTBEAT_SECS = 10;
    private static final long EMITTER_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final ObjectMapper objectMapper;
    private final Map<String, SseEmitter> emitters = new ConcurrentHashMap<>();
    private final Map<String, Deque<Event>> buffers = new ConcurrentHashMap<>();
    private final Map<String, String> lastPayloads = Collections.synchronizedMap(new LinkedHashMap<String, String>() {
        @Override
        protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
            return size() > RESULT_LIMIT;
        }
    });
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();

    public SseHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        scheduler.scheduleAtFixedRate(this::heartbeatAll, HEARTBEAT_SECS, HEARTBEAT_SECS, TimeUnit.SECONDS);
    }

    public SseEmitter connect(String jobId) {
        var emitter = new SseEmitter(EMITTER_TIMEOUT_MS);
        emitter.onTimeout(() -> emitters.remove(jobId, emitter));
        emitter.onCompletion(() -> emitters.remove(jobId, emitter));
        emitters.put(jobId, emitter);

        var buf = buffers.get(jobId);
        if (buf != null) {
            synchronized (buf) {
                for (var ev : buf) {
                    if (!send(jobId, emitter, ev)) break;
                }
            }
        }
        return emitter;
    }

    /** Last payload sent for the job, or an empty JSON object. */
    public String getLast(String jobId) {
        return lastPayloads.getOrDefault(jobId, "{}");
    }

    public void emit(String jobId, String eventType, Object payload) {
        String data;
        try {
            data = payload instanceof String s ? s : objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("SSE payload for {} not serializable: {}", jobId, e.getMessage());
            return;
        }
        var ev = new Event(eventType, data);
        var buf = buffers.computeIfAbsent(jobId, k -> new ArrayDeque<>(REPLAY_LIMIT));
        synchronized (buf) {
            if (buf.size() == REPLAY_LIMIT) buf.removeFirst();
            buf.addLast(ev);
        }
        lastPayloads.put(jobId, data);

        var em = emitters.get(jobId);
        if (em != null) send(jobId, em, ev);
    }

    /** Sends {@code done} and closes the stream after a short delay. */
    public void complete(String jobId) {
        scheduler.schedule(() -> finish(jobId), 500, TimeUnit.MILLISECONDS);
    }

    void finish(String jobId) {
        var em = emitters.remove(jobId);
        if (em != null) {
            send(jobId, em, new Event(DONE, "{}"));
            em.complete();
        }
        buffers.remove(jobId);
    }

    int bufferedJobs() {
        return buffers.size();
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }

    private boolean send(String jobId, SseEmitter em, Event ev) {
        try {
            em.send(SseEmitter.event().name(ev.name()).data(ev.data(), MediaType.APPLICATION_JSON));
            return true;
        } catch (IOException | IllegalStateException e) {
            log.debug("SSE send of {} failed for {}: {}", ev.name(), jobId, e.getMessage());
            emitters.remove(jobId, em);
            return false;
        }
    }

    private void heartbeatAll() {
        emitters.forEach((jobId, em) -> send(jobId, em, new Event("heartbeat", "{}")));
    }

    private record Event(String name, String data) {}
}
