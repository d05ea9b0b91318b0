package com.github.mirrorfetch.service;

import com.github.mirrorfetch.model.ProgressUpdate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

@Slf4j
@Service
public class ProgressBroadcastService {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    // In-process observers (tests, embedding callers)
    private final CopyOnWriteArrayList<Consumer<ProgressUpdate>> listeners = new CopyOnWriteArrayList<>();

    /**
     * Register a new SSE emitter
     */
    public SseEmitter createEmitter() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> removeEmitter(emitter));
        emitter.onTimeout(() -> removeEmitter(emitter));
        emitter.onError(e -> removeEmitter(emitter));

        log.info("New SSE emitter registered. Total: {}", emitters.size());

        return emitter;
    }

    public void registerListener(Consumer<ProgressUpdate> listener) {
        listeners.add(listener);
        log.debug("Progress listener registered. Total: {}", listeners.size());
    }

    public void unregisterListener(Consumer<ProgressUpdate> listener) {
        listeners.remove(listener);
        log.debug("Progress listener unregistered. Remaining: {}", listeners.size());
    }

    /**
     * Broadcast progress update to all connected clients
     */
    public void broadcastProgress(ProgressUpdate update) {
        log.trace("Broadcasting progress for task {}: {}", update.getTaskId(), update.getBytesTransferred());

        broadcastToSSE(update);
        broadcastToListeners(update);
    }

    private void broadcastToSSE(ProgressUpdate update) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event()
                        .name("progress")
                        .data(update));

            } catch (IOException e) {
                log.warn("Failed to send SSE event: {}", e.getMessage());
                removeEmitter(emitter);
            }
        }
    }

    private void broadcastToListeners(ProgressUpdate update) {
        for (Consumer<ProgressUpdate> listener : listeners) {
            try {
                listener.accept(update);
            } catch (Exception e) {
                log.error("Error in progress listener: {}", e.getMessage(), e);
            }
        }
    }

    private void removeEmitter(SseEmitter emitter) {
        if (emitters.remove(emitter)) {
            log.info("SSE emitter removed. Remaining: {}", emitters.size());
        }
    }

    public int getActiveConnections() {
        return emitters.size();
    }
}
