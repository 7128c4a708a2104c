package com.govsignal.service.runtime;

import com.govsignal.core.bus.EventBus;
import com.govsignal.core.events.DigestComposed;
import com.govsignal.core.events.SignalSkipped;
import com.govsignal.core.events.SignalsBundled;
import com.govsignal.core.model.MetricKeys;
import com.govsignal.core.model.ScoredSignal;
import com.govsignal.core.model.Signal;
import com.govsignal.rules.RulesEngine;
import com.govsignal.rules.bundle.BundlerConfig;
import com.govsignal.rules.bundle.SignalBundler;
import com.govsignal.rules.group.SignalDeduplicator;
import com.govsignal.rules.industry.IndustryTables;
import com.govsignal.service.config.DigestConfig;
import com.govsignal.service.digest.DigestComposer;
import com.govsignal.service.digest.DigestResult;
import com.govsignal.service.digest.MiniDigestComposer;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

public class DigestPipeline {
    private static final Logger LOGGER = Logger.getLogger(DigestPipeline.class.getName());

    private final IndustryTables industryTables;
    private final SignalBundler bundler;
    private final DigestComposer composer;
    private final MiniDigestComposer miniComposer;
    private final Clock clock;
    private final EventBus eventBus;

    public DigestPipeline(
            IndustryTables industryTables,
            BundlerConfig bundlerConfig,
            DigestConfig digestConfig,
            Clock clock,
            EventBus eventBus
    ) {
        this.industryTables = industryTables;
        this.bundler = new SignalBundler(bundlerConfig);
        this.composer = new DigestComposer(digestConfig, clock);
        this.miniComposer = new MiniDigestComposer(digestConfig, clock);
        this.clock = clock;
        this.eventBus = eventBus;
    }

    public PipelineOutcome run(List<Signal> signals, List<String> watchlist) {
        List<ScoredSignal> scored = score(signals, watchlist);
        int skipped = signals.size() - scored.size();

        List<ScoredSignal> unique = SignalDeduplicator.deduplicate(scored);
        List<ScoredSignal> bundled = bundler.bundle(unique);
        for (ScoredSignal signal : bundled) {
            if (signal.isBundle()) {
                eventBus.publish(new SignalsBundled(
                        clock.instant(),
                        String.valueOf(signal.signal().metrics().get(MetricKeys.BUNDLE_RULE)),
                        signal.bundledCount()
                ));
            }
        }

        DigestResult digest = composer.composeResult(bundled);
        eventBus.publish(new DigestComposed(
                clock.instant(),
                signals.size(),
                digest.eligibleCount(),
                digest.emittedCount(),
                digest.overflowCount()
        ));
        LOGGER.info(() -> "Digest run complete: input=" + signals.size() + " skipped=" + skipped
                + " emitted=" + digest.emittedCount() + " overflow=" + digest.overflowCount());
        return new PipelineOutcome(digest, bundled, scored.size(), skipped);
    }

    public Optional<String> runMini(List<Signal> signals, List<String> watchlist) {
        return miniComposer.compose(SignalDeduplicator.deduplicate(score(signals, watchlist)));
    }

    private List<ScoredSignal> score(List<Signal> signals, List<String> watchlist) {
        RulesEngine engine = new RulesEngine(industryTables, watchlist, clock);
        List<ScoredSignal> scored = new ArrayList<>();
        for (Signal signal : signals) {
            try {
                scored.add(engine.process(signal));
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "Skipping signal " + signal.stableId() + ": " + ex.getMessage(), ex);
                eventBus.publish(new SignalSkipped(clock.instant(), signal.stableId(), "rules", ex.getMessage()));
            }
        }
        return scored;
    }

    public record PipelineOutcome(
            DigestResult digest,
            List<ScoredSignal> signals,
            int processed,
            int skipped
    ) {
        public PipelineOutcome {
            Objects.requireNonNull(digest, "digest is required");
            signals = List.copyOf(signals);
        }

        public String text() {
            return digest.text();
        }
    }
}
