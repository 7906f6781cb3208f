package com.routemind.dispatch.api;

import com.routemind.core.events.EventBus;
import com.routemind.core.events.RoutemindEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Streams the {@link EventBus} events of one workflow to an HTTP client as server-sent events.
 * <p>
 * Each stream ends after the {@code workflow.finished} event. Open streams receive a comment
 * frame every 30 seconds so proxies keep them open.
 */
@Service
public class WorkflowEventStreamService {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEventStreamService.class);

    static final String FINISHED_EVENT = "workflow.finished";

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final CopyOnWriteArrayList<Stream> streams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public WorkflowEventStreamService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    WorkflowEventStreamService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void shutdown() {
        heartbeat.shutdownNow();
        for (Stream stream : streams) {
            close(stream);
        }
    }

    /**
     * Opens a stream for the given workflow. Events published before this call are not replayed.
     */
    public SseEmitter open(String workflowId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        Stream stream = new Stream(workflowId, emitter);
        streams.add(stream);
        stream.subscription = eventBus.subscribe(workflowId, event -> forward(stream, event));
        if (stream.released.get()) {
            // finished before the handle was stored
            stream.subscription.unsubscribe();
            return emitter;
        }

        emitter.onCompletion(() -> release(stream));
        emitter.onTimeout(() -> {
            log.debug("Event stream for workflow {} timed out", workflowId);
            release(stream);
        });
        emitter.onError(e -> {
            log.debug("Event stream for workflow {} failed: {}", workflowId, e.getMessage());
            release(stream);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Could not open event stream for workflow {}: {}", workflowId, e.getMessage());
            release(stream);
        }
        log.info("Event stream opened for workflow {}", workflowId);
        return emitter;
    }

    public int openStreamCount() {
        return streams.size();
    }

    private void forward(Stream stream, RoutemindEvent event) {
        var data = new LinkedHashMap<String, Object>();
        data.put("workflowId", event.workflowId());
        if (event.taskId() != null) {
            data.put("taskId", event.taskId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        try {
            stream.emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Dropping {} for workflow {}: {}", event.eventType(), stream.workflowId, e.getMessage());
            release(stream);
            return;
        }
        if (FINISHED_EVENT.equals(event.eventType())) {
            close(stream);
        }
    }

    private void sendHeartbeats() {
        for (Stream stream : streams) {
            try {
                stream.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat failed for workflow {}: {}", stream.workflowId, e.getMessage());
                release(stream);
            }
        }
    }

    private void close(Stream stream) {
        release(stream);
        stream.emitter.complete();
    }

    private void release(Stream stream) {
        if (stream.released.compareAndSet(false, true)) {
            EventBus.Subscription subscription = stream.subscription;
            if (subscription != null) {
                subscription.unsubscribe();
            }
            streams.remove(stream);
            log.debug("Event stream released for workflow {}", stream.workflowId);
        }
    }

    private static final class Stream {
        final String workflowId;
        final SseEmitter emitter;
        final AtomicBoolean released = new AtomicBoolean();
        volatile EventBus.Subscription subscription;

        Stream(String workflowId, SseEmitter emitter) {
            this.workflowId = workflowId;
            this.emitter = emitter;
        }
    }
}
