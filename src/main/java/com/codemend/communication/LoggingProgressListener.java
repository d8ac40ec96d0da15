package com.codemend.communication;

import com.codemend.core.event.ProgressEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    @Override
    public void onEvent(ProgressEvent event) {
        if (event.getProgressPercent() >= 0) {
            log.info("[Progress] {} {} {}% {}", event.getRequestId(), event.getStage(),
                    event.getProgressPercent(), event.getMessage());
        } else {
            log.info("[Progress] {} {} {}", event.getRequestId(), event.getStage(), event.getMessage());
        }
        if (!event.getIssues().isEmpty()) {
            log.debug("[Progress] {} issues: {}", event.getRequestId(), event.getIssues());
        }
    }
}
