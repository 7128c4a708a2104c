package com.govsignal.core.events;

import java.time.Instant;

public record SignalSkipped(
        Instant timestamp,
        String stableId,
        String stage,
        String reason
) implements Event {
    @Override
    public String type() {
        return "SignalSkipped";
    }
}
