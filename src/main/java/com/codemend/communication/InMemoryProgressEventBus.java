package com.codemend.communication;

import com.codemend.core.event.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryProgressEventBus implements ProgressEventBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryProgressEventBus.class);

    private final List<ProgressListener> listeners =
            new CopyOnWriteArrayList<>();

    /**
     * Delivers synchronously. A failing listener is logged and skipped so
     * that progress reporting never affects the correction loop.
     */
    @Override
    public void publish(ProgressEvent event) {
        for (ProgressListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("[ProgressBus] Listener {} failed on {}: {}",
                        listener.getClass().getSimpleName(), event.getStage(), e.getMessage());
            }
        }
    }

    @Override
    public void subscribe(ProgressListener listener) {
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(ProgressListener listener) {
        listeners.remove(listener);
    }
}
