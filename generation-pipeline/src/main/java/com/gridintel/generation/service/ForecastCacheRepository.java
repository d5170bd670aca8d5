package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.ForecastDocument;
import com.gridintel.generation.output.CsvFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Local cache of per-county forecasts: {cacheDir}/{county}_forecast.json.
 *
 * Written by the forecast refresher on its own (slower) cycle and read by the
 * enrichment step on every pipeline run, so reads must tolerate stale, missing
 * or reshaped files.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ForecastCacheRepository {

    private static final String SUFFIX = "_forecast.json";

    private final ObjectMapper objectMapper;
    private final ForecastDocumentParser parser;
    private final GenerationPipelineProperties properties;

    /**
     * Empty when the county has never been cached. A file that exists but cannot
     * be read yields an empty document, so its lookups come back missing.
     */
    public Optional<ForecastDocument> load(String county) {
        Path path = pathFor(county);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            JsonNode root = objectMapper.readTree(path.toFile());
            return Optional.of(parser.parse(root, properties.getFeed().zoneId()));
        } catch (IOException e) {
            log.warn("Cached forecast {} is unreadable: {}", path, e.getMessage());
            return Optional.of(ForecastDocument.EMPTY);
        }
    }

    /** Replace the cached raw document for a county. */
    public Path saveRaw(String county, JsonNode document) {
        Path dir = cacheDir();
        CsvFiles.ensureDirectory(dir);
        Path target = pathFor(county);
        Path tmp = dir.resolve(target.getFileName() + ".tmp");
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write forecast cache " + target, e);
        }
        CsvFiles.replace(tmp, target);
        return target;
    }

    Path pathFor(String county) {
        return cacheDir().resolve(county + SUFFIX);
    }

    private Path cacheDir() {
        return properties.getStorage().resolve(properties.getStorage().getForecastCacheDir());
    }
}
