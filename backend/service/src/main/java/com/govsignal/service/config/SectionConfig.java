package com.govsignal.service.config;

import com.govsignal.service.digest.SectionKind;

import java.util.Objects;

public record SectionConfig(
        SectionKind section,
        int cap,
        boolean countsOverflow
) {
    public SectionConfig {
        Objects.requireNonNull(section, "section is required");
        if (cap < 0) {
            throw new IllegalArgumentException("cap must not be negative for section " + section.wireName());
        }
    }
}
