package com.govsignal.rules.bundle;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.govsignal.core.model.Signal;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

public record BundleRule(
        String name,
        String label,
        String agencyKeyword,
        String titlePattern,
        String landingUrl
) {
    public BundleRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(titlePattern, "titlePattern is required");
        label = label == null || label.isBlank() ? name : label;
        agencyKeyword = agencyKeyword == null ? "" : agencyKeyword.toLowerCase(Locale.ROOT);
        landingUrl = landingUrl == null ? "" : landingUrl;
        Pattern.compile(titlePattern);
    }

    @JsonIgnore
    public Pattern compiledTitlePattern() {
        return Pattern.compile(titlePattern, Pattern.CASE_INSENSITIVE);
    }

    public boolean matches(Signal signal, Pattern compiled) {
        String agency = signal.agency() == null ? "" : signal.agency().toLowerCase(Locale.ROOT);
        return agency.contains(agencyKeyword) && compiled.matcher(signal.title()).find();
    }
}
