package com.codemend.communication;

import com.codemend.core.event.ProgressEvent;
import com.codemend.core.event.ProgressStage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryProgressEventBusTest {

    @Test
    void testDeliversToSubscribersInOrder() {
        InMemoryProgressEventBus bus = new InMemoryProgressEventBus();
        List<String> received = new ArrayList<>();
        bus.subscribe(e -> received.add("first:" + e.getStage()));
        bus.subscribe(e -> received.add("second:" + e.getStage()));

        bus.publish(ProgressEvent.of("r1", ProgressStage.VALIDATING, "Validating"));

        assertEquals(List.of("first:VALIDATING", "second:VALIDATING"), received);
    }

    @Test
    void testFailingListenerDoesNotStopDelivery() {
        InMemoryProgressEventBus bus = new InMemoryProgressEventBus();
        List<ProgressEvent> received = new ArrayList<>();
        bus.subscribe(e -> { throw new IllegalStateException("listener broke"); });
        bus.subscribe(received::add);

        bus.publish(ProgressEvent.of("r1", ProgressStage.PLANNING, "Planning"));

        assertEquals(1, received.size());
    }

    @Test
    void testUnsubscribe() {
        InMemoryProgressEventBus bus = new InMemoryProgressEventBus();
        List<ProgressEvent> received = new ArrayList<>();
        ProgressListener listener = received::add;
        bus.subscribe(listener);
        bus.unsubscribe(listener);

        bus.publish(ProgressEvent.of("r1", ProgressStage.COMPLETED, "Done"));

        assertTrue(received.isEmpty());
    }
}
