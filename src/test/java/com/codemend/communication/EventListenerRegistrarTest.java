package com.codemend.communication;

import com.codemend.core.event.ProgressEvent;
import com.codemend.core.event.ProgressStage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EventListenerRegistrarTest {

    @Test
    void testListenerBeansAreSubscribedOnce() {
        InMemoryProgressEventBus bus = new InMemoryProgressEventBus();
        List<ProgressEvent> received = new ArrayList<>();
        EventListenerRegistrar registrar = new EventListenerRegistrar(bus, List.of(received::add));

        bus.publish(ProgressEvent.of("r1", ProgressStage.GENERATING, "before ready"));
        registrar.subscribeListenerBeans();
        registrar.subscribeListenerBeans();
        bus.publish(ProgressEvent.of("r1", ProgressStage.VALIDATING, "after ready"));

        assertEquals(1, received.size());
        assertEquals(ProgressStage.VALIDATING, received.get(0).getStage());
    }
}
