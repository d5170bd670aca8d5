package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.output.CsvFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Pulls township forecasts for every configured county from the CWA open-data
 * API into the local forecast cache.
 *
 * Runs on its own, slower schedule (default every 6 hours). After each refresh
 * the combined document shape is fingerprinted and compared with the previous
 * refresh, so an upstream schema change shows up in the structure log before
 * it quietly turns every weather feature into a missing value.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ForecastCacheRefresher {

    public record RefreshResult(int fetched, int failed, boolean structureChanged) {
    }

    private final ForecastCacheRepository forecastCache;
    private final ObjectMapper objectMapper;
    private final GenerationPipelineProperties properties;
    private final Clock clock;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();

    public RefreshResult refreshAll() {
        GenerationPipelineProperties.Forecast config = properties.getForecast();
        if (config.getApiKey() == null || config.getApiKey().isBlank()) {
            log.warn("No CWA API key configured (CWA_API_KEY), skipping forecast refresh");
            return new RefreshResult(0, 0, false);
        }

        log.info("Starting forecast refresh for {} counties", config.getCounties().size());
        ArrayNode fetchedDocs = objectMapper.createArrayNode();
        int failed = 0;

        for (Map.Entry<String, String> county : config.getCounties().entrySet()) {
            Optional<JsonNode> doc = fetchCounty(county.getKey(), county.getValue());
            if (doc.isPresent()) {
                forecastCache.saveRaw(county.getKey(), doc.get());
                fetchedDocs.add(doc.get());
            } else {
                failed++;
            }
        }

        boolean changed = checkStructure(fetchedDocs);
        log.info("Forecast refresh complete: {} fetched, {} failed", fetchedDocs.size(), failed);
        return new RefreshResult(fetchedDocs.size(), failed, changed);
    }

    Optional<JsonNode> fetchCounty(String county, String locationId) {
        GenerationPipelineProperties.Forecast config = properties.getForecast();
        URI uri = UriComponentsBuilder.fromHttpUrl(config.getBaseUrl())
                .queryParam("Authorization", config.getApiKey())
                .queryParam("locationId", locationId)
                .build()
                .toUri();

        log.debug("Fetching forecast for {} ({})", county, locationId);
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(uri)
                    .timeout(config.getTimeout())
                    .GET()
                    .build();

            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));

            if (response.statusCode() != 200) {
                log.error("Forecast fetch for {} returned HTTP {}", county, response.statusCode());
                return Optional.empty();
            }
            return Optional.of(objectMapper.readTree(response.body()));

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Forecast fetch for {} interrupted", county);
        } catch (IOException e) {
            log.error("Forecast fetch for {} failed: {}", county, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * @return true when the shape differs from the last recorded fingerprint
     */
    boolean checkStructure(ArrayNode fetchedDocs) {
        String now = EffectiveTimestamps.format(EffectiveTimestamps.localNow(clock, properties.getFeed().zoneId()));
        Path logFile = properties.getStorage().resolve(properties.getForecast().getStructureLog());

        if (fetchedDocs.isEmpty()) {
            appendStructureLog(logFile, "[" + now + "] ⚠️ No weather data fetched successfully to generate a structure fingerprint.\n");
            return false;
        }

        String fingerprint = StructureFingerprint.of(fetchedDocs, objectMapper);
        Path fingerprintFile = properties.getStorage().resolve(properties.getForecast().getFingerprintFile());
        String previous = readFingerprint(fingerprintFile);

        if (fingerprint.equals(previous)) {
            appendStructureLog(logFile, "[" + now + "] ✅ Weather data structure remains consistent.\n");
            return false;
        }

        log.warn("Forecast structure changed: {} -> {}", previous, fingerprint);
        appendStructureLog(logFile, "[" + now + "] ❌ WEATHER DATA STRUCTURE CHANGE DETECTED!\n"
                + "  Old Fingerprint: " + previous + "\n"
                + "  New Fingerprint: " + fingerprint + "\n"
                + "  Please review the CWA API documentation or fetched JSON files for changes.\n");
        writeFingerprint(fingerprintFile, fingerprint, now);
        return true;
    }

    private String readFingerprint(Path file) {
        if (!Files.exists(file)) return null;
        try {
            JsonNode node = objectMapper.readTree(file.toFile());
            return node.hasNonNull("fingerprint") ? node.get("fingerprint").asText() : null;
        } catch (IOException e) {
            log.warn("Could not read previous fingerprint {}, treating as new structure: {}", file, e.getMessage());
            return null;
        }
    }

    private void writeFingerprint(Path file, String fingerprint, String timestamp) {
        if (file.getParent() != null) CsvFiles.ensureDirectory(file.getParent());
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(),
                    Map.of("fingerprint", fingerprint, "timestamp", timestamp));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write fingerprint " + file, e);
        }
    }

    private void appendStructureLog(Path file, String entry) {
        if (file.getParent() != null) CsvFiles.ensureDirectory(file.getParent());
        try {
            Files.writeString(file, entry, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append structure log " + file, e);
        }
    }
}
