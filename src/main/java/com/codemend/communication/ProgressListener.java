package com.codemend.communication;

import com.codemend.core.event.ProgressEvent;

@FunctionalInterface
public interface ProgressListener {

    void onEvent(ProgressEvent event);
}
