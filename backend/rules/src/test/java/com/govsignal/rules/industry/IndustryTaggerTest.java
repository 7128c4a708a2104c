package com.govsignal.rules.industry;

import com.govsignal.core.model.Source;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.govsignal.rules.support.TestSignals.signal;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IndustryTaggerTest {
    private final IndustryTagger tagger = new IndustryTagger(IndustryTables.defaults());

    @Test
    void issueCodesWinInListedOrder() {
        assertEquals("Health", tagger.tag(signal(Source.CONGRESS, "a")
                .issueCodes(List.of("XYZ", "HCR", "TEC"))
                .agency("Environmental Protection Agency")
                .build()));
        assertEquals("Cyber/Intel", tagger.tag(signal(Source.CONGRESS, "b").issueCodes(List.of("int")).build()));
    }

    @Test
    void agencyKeywordsApplyBeforeTopicKeywords() {
        assertEquals("Environment", tagger.tag(signal(Source.FEDERAL_REGISTER, "c")
                .agency("Environmental Protection Agency")
                .title("Banking privacy disclosures")
                .build()));
        assertEquals("Finance", tagger.tag(signal(Source.FEDERAL_REGISTER, "d").agency("SEC").build()));
    }

    @Test
    void keywordsMatchWholeWordsOnly() {
        assertEquals("Defense", tagger.tag(signal(Source.FEDERAL_REGISTER, "e")
                .agency("Department of Homeland Security")
                .build()));
        assertEquals("Government", tagger.tag(signal(Source.OTHER, "f")
                .title("Maintenance schedule for the main building")
                .build()));
    }

    @Test
    void topicKeywordsScanTitleSummaryAndAgency() {
        assertEquals("Environment", tagger.tag(signal(Source.CONGRESS, "g")
                .title("Hearing")
                .summary("Regional climate resilience funding")
                .build()));
        assertEquals("Tech", tagger.tag(signal(Source.CONGRESS, "h").title("AI accountability act").build()));
    }

    @Test
    void defaultsToGovernment() {
        assertEquals(IndustryTagger.DEFAULT_INDUSTRY, tagger.tag(signal(Source.OTHER, "i").title("Sunshine Act Meeting").build()));
    }

    @Test
    void defaultTablesAreLoadedOnceAndImmutable() {
        IndustryTables tables = IndustryTables.defaults();

        assertSame(tables, IndustryTables.defaults());
        assertEquals("Health", tables.issueCodes().get("HCR"));
        assertTrue(tables.agencyKeywords().containsKey("epa"));
        assertThrows(UnsupportedOperationException.class, () -> tables.topicKeywords().put("x", "y"));
    }

    @Test
    void customTablesKeepInsertionPriority() {
        IndustryTables tables = new IndustryTables(Map.of(), Map.of(), new LinkedHashMap<>(Map.of("rail", "Transportation")));

        assertEquals("Transportation", new IndustryTagger(tables).tag(signal(Source.OTHER, "j").title("Rail safety").build()));
        assertThrows(IllegalStateException.class, () -> IndustryTables.load("/missing-tables.json"));
    }
}
