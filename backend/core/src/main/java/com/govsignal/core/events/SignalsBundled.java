package com.govsignal.core.events;

import java.time.Instant;

public record SignalsBundled(
        Instant timestamp,
        String rule,
        int count
) implements Event {
    @Override
    public String type() {
        return "SignalsBundled";
    }
}
