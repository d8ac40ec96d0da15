package com.codemend.communication;

import com.codemend.core.event.ProgressEvent;

public interface ProgressEventBus {

    void publish(ProgressEvent event);

    void subscribe(ProgressListener listener);

    void unsubscribe(ProgressListener listener);
}
