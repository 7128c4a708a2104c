package com.govsignal.rules.bundle;

import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Urgency;
import com.govsignal.rules.score.PriorityScorer;

import java.time.Instant;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

public class SignalBundler {
    private static final Logger LOGGER = Logger.getLogger(SignalBundler.class.getName());

    private final BundlerConfig config;
    private final Map<BundleRule, Pattern> patterns = new LinkedHashMap<>();

    public SignalBundler(BundlerConfig config) {
        this.config = config;
        for (BundleRule rule : config.rules()) {
            patterns.put(rule, rule.compiledTitlePattern());
        }
    }

    public List<ScoredSignal> bundle(List<ScoredSignal> signals) {
        Map<BundleRule, List<ScoredSignal>> clusters = new LinkedHashMap<>();
        for (BundleRule rule : patterns.keySet()) {
            clusters.put(rule, new ArrayList<>());
        }
        Map<ScoredSignal, BundleRule> assigned = new IdentityHashMap<>();
        for (ScoredSignal signal : signals) {
            if (!isBundleable(signal)) {
                continue;
            }
            for (Map.Entry<BundleRule, Pattern> entry : patterns.entrySet()) {
                if (entry.getKey().matches(signal.signal(), entry.getValue())) {
                    clusters.get(entry.getKey()).add(signal);
                    assigned.put(signal, entry.getKey());
                    break;
                }
            }
        }

        List<ScoredSignal> passthrough = new ArrayList<>();
        List<ScoredSignal> bundles = new ArrayList<>();
        for (ScoredSignal signal : signals) {
            BundleRule rule = assigned.get(signal);
            if (rule == null || clusters.get(rule).size() < config.minClusterSize()) {
                passthrough.add(signal);
            }
        }
        for (Map.Entry<BundleRule, List<ScoredSignal>> cluster : clusters.entrySet()) {
            if (cluster.getValue().size() >= config.minClusterSize()) {
                bundles.add(toBundle(cluster.getKey(), cluster.getValue()));
                LOGGER.fine(() -> "Bundled " + cluster.getValue().size() + " signals under " + cluster.getKey().name());
            }
        }
        passthrough.addAll(bundles);
        return passthrough;
    }

    public boolean isEscalated(Signal signal) {
        String title = signal.title().toLowerCase(Locale.ROOT);
        for (String keyword : config.escalationKeywords()) {
            if (title.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private boolean isBundleable(ScoredSignal signal) {
        return !signal.isBundle() && !signal.watchlistHit() && !isEscalated(signal.signal());
    }

    private static ScoredSignal toBundle(BundleRule rule, List<ScoredSignal> members) {
        ScoredSignal first = members.get(0);
        Instant latest = first.signal().timestamp();
        for (ScoredSignal member : members) {
            if (member.signal().timestamp().isAfter(latest)) {
                latest = member.signal().timestamp();
            }
        }
        int count = members.size();
        String link = rule.landingUrl().isEmpty() ? first.signal().link() : rule.landingUrl();
        Signal bundle = Signal.builder(first.signal().source(), "bundle-" + rule.name() + "-" + count, latest)
                .title(rule.label() + " — " + count + " notices")
                .link(link)
                .agency(first.signal().agency())
                .metric(MetricKeys.BUNDLED_COUNT, count)
                .metric(MetricKeys.BUNDLE_RULE, rule.name())
                .build();
        return new ScoredSignal(bundle, SignalType.NOTICE, Urgency.LOW, PriorityScorer.BUNDLE_SCORE,
                first.industryTag(), List.of());
    }
}
