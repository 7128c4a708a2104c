package com.govsignal.rules.industry;

import com.govsignal.core.model.Signal;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

public class IndustryTagger {
    public static final String DEFAULT_INDUSTRY = "Government";

    private final Map<String, String> issueCodes;
    private final Map<Pattern, String> agencyPatterns;
    private final Map<Pattern, String> topicPatterns;

    public IndustryTagger(IndustryTables tables) {
        this.issueCodes = tables.issueCodes();
        this.agencyPatterns = compile(tables.agencyKeywords());
        this.topicPatterns = compile(tables.topicKeywords());
    }

    public String tag(Signal signal) {
        for (String code : signal.issueCodes()) {
            String industry = issueCodes.get(code.toUpperCase(Locale.ROOT));
            if (industry != null) {
                return industry;
            }
        }
        if (signal.agency() != null) {
            String agency = signal.agency().toLowerCase(Locale.ROOT);
            String industry = firstMatch(agencyPatterns, agency);
            if (industry != null) {
                return industry;
            }
        }
        String industry = firstMatch(topicPatterns, signal.contentText());
        return industry == null ? DEFAULT_INDUSTRY : industry;
    }

    private static String firstMatch(Map<Pattern, String> patterns, String text) {
        for (Map.Entry<Pattern, String> entry : patterns.entrySet()) {
            if (entry.getKey().matcher(text).find()) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static Map<Pattern, String> compile(Map<String, String> keywords) {
        Map<Pattern, String> compiled = new LinkedHashMap<>();
        keywords.forEach((keyword, industry) -> compiled.put(
                Pattern.compile("\\b" + Pattern.quote(keyword.toLowerCase(Locale.ROOT)) + "\\b"),
                industry
        ));
        return compiled;
    }
}
