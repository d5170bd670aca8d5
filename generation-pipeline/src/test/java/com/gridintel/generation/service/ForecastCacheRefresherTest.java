package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.gridintel.generation.config.GenerationPipelineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ForecastCacheRefresherTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private GenerationPipelineProperties properties;
    private ForecastCacheRefresher refresher;

    @BeforeEach
    void setUp() {
        properties = new GenerationPipelineProperties();
        properties.getStorage().setBaseDir(tempDir.toString());
        ForecastCacheRepository cache =
                new ForecastCacheRepository(objectMapper, new ForecastDocumentParser(), properties);
        refresher = new ForecastCacheRefresher(cache, objectMapper, properties,
                Clock.fixed(Instant.parse("2025-01-01T00:05:00Z"), ZoneOffset.UTC));
    }

    @Test
    @DisplayName("refreshAll - without an API key nothing is fetched or written")
    void refreshAll_NoApiKey() {
        ForecastCacheRefresher.RefreshResult result = refresher.refreshAll();

        assertThat(result).isEqualTo(new ForecastCacheRefresher.RefreshResult(0, 0, false));
        assertThat(tempDir.resolve("forecast_cache")).doesNotExist();
    }

    @Test
    @DisplayName("checkStructure - first fingerprint is a change, repeat is consistent, new shape is a change")
    void checkStructure_TracksFingerprint() throws Exception {
        ArrayNode v1 = docs("{\"records\":{\"locations\":[{\"location\":[]}]}}");
        ArrayNode v1Again = docs("{\"records\":{\"locations\":[{\"location\":[]}]}}");
        ArrayNode v2 = docs("{\"Records\":{\"Locations\":[{\"Location\":[]}]}}");

        assertThat(refresher.checkStructure(v1)).isTrue();
        assertThat(refresher.checkStructure(v1Again)).isFalse();
        assertThat(refresher.checkStructure(v2)).isTrue();

        String log = Files.readString(tempDir.resolve("weather_structure_log.txt"), StandardCharsets.UTF_8);
        assertThat(log).contains("remains consistent").contains("STRUCTURE CHANGE DETECTED");
        assertThat(objectMapper.readTree(tempDir.resolve("weather_structure_fingerprint.json").toFile())
                .get("fingerprint").asText())
                .isEqualTo(StructureFingerprint.of(v2, objectMapper));
    }

    @Test
    @DisplayName("checkStructure - no documents logs a warning and keeps the stored fingerprint")
    void checkStructure_NothingFetched() throws Exception {
        assertThat(refresher.checkStructure(objectMapper.createArrayNode())).isFalse();

        assertThat(Files.readString(tempDir.resolve("weather_structure_log.txt"), StandardCharsets.UTF_8))
                .contains("No weather data fetched");
        assertThat(tempDir.resolve("weather_structure_fingerprint.json")).doesNotExist();
    }

    private ArrayNode docs(String json) throws Exception {
        ArrayNode docs = objectMapper.createArrayNode();
        docs.add(objectMapper.readTree(json));
        return docs;
    }
}
