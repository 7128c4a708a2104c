package com.govsignal.rules.classify;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.util.MetricValues;

import java.util.Locale;

public class SignalClassifier {
    public SignalType classify(Signal signal) {
        String text = (signal.title() + " " + signal.summary()).toLowerCase(Locale.ROOT);
        return switch (signal.source()) {
            case FEDERAL_REGISTER -> classifyFederalRegister(signal, text);
            case CONGRESS -> classifyCongress(signal, text);
            case REGULATIONS_GOV -> SignalType.DOCKET;
            case OTHER -> SignalType.NOTICE;
        };
    }

    private static SignalType classifyFederalRegister(Signal signal, String text) {
        if (text.contains("interim final rule")) {
            return SignalType.INTERIM_FINAL_RULE;
        }
        if (text.contains("final rule")) {
            return SignalType.FINAL_RULE;
        }
        if (text.contains("proposed rule") || text.contains("nprm")) {
            return SignalType.PROPOSED_RULE;
        }
        String documentType = MetricValues.text(signal.metrics(), MetricKeys.DOCUMENT_TYPE)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .orElse("");
        if ("rule".equals(documentType)) {
            return SignalType.FINAL_RULE;
        }
        if ("proposed rule".equals(documentType)) {
            return SignalType.PROPOSED_RULE;
        }
        return SignalType.NOTICE;
    }

    private static SignalType classifyCongress(Signal signal, String text) {
        String actionType = actionType(signal);
        if (text.contains("markup") || "markup_scheduled".equals(actionType)) {
            return SignalType.MARKUP;
        }
        if (text.contains("hearing") || "hearing_scheduled".equals(actionType)) {
            return SignalType.HEARING;
        }
        return SignalType.BILL;
    }

    public static String actionType(Signal signal) {
        return MetricValues.text(signal.metrics(), MetricKeys.ACTION_TYPE)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .orElse("");
    }
}
