package com.govsignal.service.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.govsignal.core.util.JsonUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

public final class ConfigLoader {
    private ConfigLoader() {
    }

    public static DigestConfig loadDigest(Path configDir) {
        DigestConfig config = read(configDir.resolve("digest.json"), new TypeReference<>() {
        });
        if (config == null) {
            throw new IllegalStateException("Empty config in " + configDir.resolve("digest.json"));
        }
        return config;
    }

    public static List<String> loadWatchlist(Path configDir) {
        List<String> terms = read(configDir.resolve("watchlist.json"), new TypeReference<>() {
        });
        return terms == null ? List.of() : terms.stream().filter(Objects::nonNull).toList();
    }

    private static <T> T read(Path path, TypeReference<T> ref) {
        try (InputStream in = Files.newInputStream(path)) {
            return JsonUtils.objectMapper().readValue(in, ref);
        } catch (IOException | IllegalArgumentException e) {
            throw new IllegalStateException("Failed loading config from " + path, e);
        }
    }
}
