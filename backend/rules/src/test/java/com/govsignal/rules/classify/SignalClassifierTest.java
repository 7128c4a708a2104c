package com.govsignal.rules.classify;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Source;
import org.junit.jupiter.api.Test;

import static com.govsignal.rules.support.TestSignals.federalRegister;
import static com.govsignal.rules.support.TestSignals.signal;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SignalClassifierTest {
    private final SignalClassifier classifier = new SignalClassifier();

    @Test
    void interimFinalRuleWinsOverFinalRule() {
        assertEquals(SignalType.INTERIM_FINAL_RULE,
                classifier.classify(federalRegister("fr1", "Interim Final Rule on Medicare payments").build()));
        assertEquals(SignalType.FINAL_RULE,
                classifier.classify(federalRegister("fr2", "Emission Standards; Final Rule").build()));
    }

    @Test
    void proposedRuleMatchesPhraseOrNprmInSummary() {
        assertEquals(SignalType.PROPOSED_RULE,
                classifier.classify(federalRegister("fr3", "Privacy Standards").summary("Proposed rule; request for comment").build()));
        assertEquals(SignalType.PROPOSED_RULE,
                classifier.classify(federalRegister("fr4", "Broadband Labels NPRM").build()));
    }

    @Test
    void federalRegisterFallsBackToDocumentTypeThenNotice() {
        assertEquals(SignalType.FINAL_RULE, classifier.classify(
                federalRegister("fr5", "Airworthiness Directives; Boeing").metric(MetricKeys.DOCUMENT_TYPE, "Rule").build()));
        assertEquals(SignalType.PROPOSED_RULE, classifier.classify(
                federalRegister("fr6", "Safety Zone; Lake Michigan").metric(MetricKeys.DOCUMENT_TYPE, "Proposed Rule").build()));
        assertEquals(SignalType.NOTICE, classifier.classify(
                federalRegister("fr7", "Sunshine Act Meeting").metric(MetricKeys.DOCUMENT_TYPE, "Notice").build()));
    }

    @Test
    void congressRecognizesMarkupBeforeHearing() {
        assertEquals(SignalType.MARKUP, classifier.classify(
                signal(Source.CONGRESS, "c1").title("Full committee markup following hearing").build()));
        assertEquals(SignalType.HEARING, classifier.classify(
                signal(Source.CONGRESS, "c2").title("Oversight Hearing on AI Safety").build()));
        assertEquals(SignalType.HEARING, classifier.classify(
                signal(Source.CONGRESS, "c3").title("S. 99").metric(MetricKeys.ACTION_TYPE, "hearing_scheduled").build()));
        assertEquals(SignalType.MARKUP, classifier.classify(
                signal(Source.CONGRESS, "c4").title("H.R. 7").metric(MetricKeys.ACTION_TYPE, "markup_scheduled").build()));
        assertEquals(SignalType.BILL, classifier.classify(
                signal(Source.CONGRESS, "c5").title("H.R. 8 introduced").build()));
    }

    @Test
    void docketAndOtherSourcesHaveFixedTypes() {
        assertEquals(SignalType.DOCKET, classifier.classify(
                signal(Source.REGULATIONS_GOV, "EPA-1-0001").title("Final rule comments").build()));
        assertEquals(SignalType.NOTICE, classifier.classify(
                signal(Source.OTHER, "o1").title("Final rule hearing").build()));
    }
}
