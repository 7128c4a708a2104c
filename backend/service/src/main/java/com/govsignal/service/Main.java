package com.govsignal.service;

import com.govsignal.core.bus.EventBus;
import com.govsignal.core.model.Signal;
import com.govsignal.rules.bundle.BundlerConfig;
import com.govsignal.rules.industry.IndustryTables;
import com.govsignal.service.config.ConfigLoader;
import com.govsignal.service.config.DigestConfig;
import com.govsignal.service.runtime.DigestPipeline;
import com.govsignal.service.store.SignalCodec;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    private Main() {
    }

    public static void main(String[] args) {
        Path configDir = Path.of("config");
        Path signalsFile = Path.of("data/signals.json");
        Path exportFile = Path.of("state/scored-signals.json");
        Clock clock = Clock.systemUTC();

        DigestConfig digestConfig = ConfigLoader.loadDigest(configDir);
        List<String> watchlist = ConfigLoader.loadWatchlist(configDir);
        List<Signal> signals = new SignalCodec(clock).readAll(signalsFile);
        LOGGER.info(() -> "Loaded " + signals.size() + " signals and " + watchlist.size() + " watchlist terms");

        EventBus eventBus = new EventBus();
        eventBus.subscribeAll(event -> LOGGER.fine(() -> event.type() + " at " + event.timestamp()));

        DigestPipeline pipeline = new DigestPipeline(
                IndustryTables.defaults(),
                BundlerConfig.defaults(),
                digestConfig,
                clock,
                eventBus
        );
        DigestPipeline.PipelineOutcome outcome = pipeline.run(signals, watchlist);
        writeExport(exportFile, SignalCodec.toJson(outcome.signals()));

        System.out.println(outcome.text());
        pipeline.runMini(signals, watchlist).ifPresent(mini -> {
            System.out.println();
            System.out.println(mini);
        });
    }

    static void writeExport(Path file, String json) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, json);
        } catch (IOException e) {
            throw new IllegalStateException("Failed writing scored signals to " + file, e);
        }
    }
}
