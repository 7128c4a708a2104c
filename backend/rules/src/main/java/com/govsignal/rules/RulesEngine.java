package com.govsignal.rules;

import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.core.model.SignalType;
import com.govsignal.core.model.Urgency;
import com.govsignal.rules.classify.SignalClassifier;
import com.govsignal.rules.industry.IndustryTables;
import com.govsignal.rules.industry.IndustryTagger;
import com.govsignal.rules.score.PriorityScorer;
import com.govsignal.rules.urgency.UrgencyResolver;
import com.govsignal.rules.watchlist.WatchlistMatcher;

import java.time.Clock;
import java.util.List;

public class RulesEngine {
    private final SignalClassifier classifier;
    private final UrgencyResolver urgencyResolver;
    private final WatchlistMatcher watchlistMatcher;
    private final PriorityScorer scorer;
    private final IndustryTagger industryTagger;

    public RulesEngine(IndustryTables tables, List<String> watchlist, Clock clock) {
        this.classifier = new SignalClassifier();
        this.urgencyResolver = new UrgencyResolver(clock);
        this.watchlistMatcher = new WatchlistMatcher(watchlist);
        this.scorer = new PriorityScorer(clock);
        this.industryTagger = new IndustryTagger(tables);
    }

    public ScoredSignal process(Signal signal) {
        SignalType type = classifier.classify(signal);
        Urgency urgency = urgencyResolver.resolve(signal, type);
        List<String> matches = watchlistMatcher.match(signal);
        double score = scorer.score(signal, type, urgency, !matches.isEmpty());
        String industry = industryTagger.tag(signal);
        return new ScoredSignal(signal, type, urgency, score, industry, matches);
    }
}
