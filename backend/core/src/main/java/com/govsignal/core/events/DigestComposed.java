package com.govsignal.core.events;

import java.time.Instant;

public record DigestComposed(
        Instant timestamp,
        int inputCount,
        int eligibleCount,
        int emittedCount,
        int overflowCount
) implements Event {
    @Override
    public String type() {
        return "DigestComposed";
    }
}
