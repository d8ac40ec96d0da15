package com.codemend.communication;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Subscribes every {@link ProgressListener} bean to the progress bus once the
 * application is ready. Listeners that are not beans subscribe themselves.
 */
@Component
public class EventListenerRegistrar {

    private static final Logger log = LoggerFactory.getLogger(EventListenerRegistrar.class);

    private final ProgressEventBus       progressBus;
    private final List<ProgressListener> beanListeners;

    private boolean registered;

    public EventListenerRegistrar(ProgressEventBus progressBus, List<ProgressListener> beanListeners) {
        this.progressBus   = progressBus;
        this.beanListeners = List.copyOf(beanListeners);
    }

    /** Idempotent: a second ready event does not subscribe the beans twice. */
    @EventListener(ApplicationReadyEvent.class)
    public synchronized void subscribeListenerBeans() {
        if (registered) {
            return;
        }
        beanListeners.forEach(progressBus::subscribe);
        registered = true;
        log.info("[ProgressBus] {} progress listener bean(s) subscribed", beanListeners.size());
    }
}
