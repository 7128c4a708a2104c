package com.govsignal.core.bus;

import com.govsignal.core.events.DigestComposed;
import com.govsignal.core.events.Event;
import com.govsignal.core.events.SignalSkipped;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

class EventBusTest {
    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void publishNotifiesMultipleSubscribersForSameType() {
        EventBus bus = new EventBus();
        AtomicInteger hitsA = new AtomicInteger();
        AtomicInteger hitsB = new AtomicInteger();

        bus.subscribe(SignalSkipped.class, event -> hitsA.incrementAndGet());
        bus.subscribe(SignalSkipped.class, event -> hitsB.incrementAndGet());

        bus.publish(new SignalSkipped(NOW, "congress:hr1", "rules", "bad metric"));

        assertEquals(1, hitsA.get());
        assertEquals(1, hitsB.get());
    }

    @Test
    void publishRoutesToCorrectEventTypeAndCatchAllSeesEverything() {
        EventBus bus = new EventBus();
        AtomicInteger skippedHits = new AtomicInteger();
        AtomicInteger composedHits = new AtomicInteger();
        List<String> seen = new ArrayList<>();

        bus.subscribe(SignalSkipped.class, event -> skippedHits.incrementAndGet());
        bus.subscribe(DigestComposed.class, event -> composedHits.incrementAndGet());
        bus.subscribeAll(event -> seen.add(event.type()));

        bus.publish(new SignalSkipped(NOW, "congress:hr1", "rules", "bad metric"));
        bus.publish(new DigestComposed(NOW, 4, 3, 2, 1));

        assertEquals(1, skippedHits.get());
        assertEquals(1, composedHits.get());
        assertEquals(List.of("SignalSkipped", "DigestComposed"), seen);
    }

    @Test
    void publishContinuesWhenHandlerThrows() {
        AtomicReference<Exception> capturedError = new AtomicReference<>();
        AtomicReference<Event> failedEvent = new AtomicReference<>();
        EventBus bus = new EventBus((event, error) -> {
            failedEvent.set(event);
            capturedError.set(error);
        });
        AtomicInteger safeHits = new AtomicInteger();

        bus.subscribe(DigestComposed.class, event -> {
            throw new RuntimeException("boom");
        });
        bus.subscribe(DigestComposed.class, event -> safeHits.incrementAndGet());

        bus.publish(new DigestComposed(NOW, 0, 0, 0, 0));

        assertEquals(1, safeHits.get());
        assertNotNull(capturedError.get());
        assertEquals("boom", capturedError.get().getMessage());
        assertEquals("DigestComposed", failedEvent.get().type());
    }
}
