package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.config.WeatherProfiles;
import com.gridintel.generation.model.ForecastTown;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.RegionWeatherProfile;
import com.gridintel.generation.model.WeatherFeatureSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WeatherEnricherTest {

    private static final ZonedDateTime EFFECTIVE =
            ZonedDateTime.of(2025, 1, 1, 9, 30, 0, 0, ZoneId.of("Asia/Taipei"));

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ForecastCacheRepository cache;
    private WeatherEnricher enricher;

    @BeforeEach
    void setUp() {
        GenerationPipelineProperties properties = new GenerationPipelineProperties();
        properties.getStorage().setBaseDir(tempDir.toString());
        cache = new ForecastCacheRepository(objectMapper, new ForecastDocumentParser(), properties);

        WeatherProfiles profiles = new WeatherProfiles(Map.of(Region.NORTH, new RegionWeatherProfile(
                List.of(new ForecastTown("甲市", "一區"), new ForecastTown("甲市", "二區"), new ForecastTown("乙縣", "三鄉")),
                new ForecastTown("甲市", "一區"))));
        enricher = new WeatherEnricher(profiles, cache, new ForecastIndex());
    }

    @Test
    @DisplayName("enrich - averages present values per horizon and takes the code town's weather code")
    void enrich_AveragesPresentValues() {
        Map<String, String[]> countyA = new LinkedHashMap<>();
        //                  tempNow, tempFut, windNow, windFut, codeNow, codeFut
        countyA.put("一區", new String[]{"20", "15", "2", "4", "01", "08"});
        countyA.put("二區", new String[]{"21", "16", "-", "5", "02", "09"});
        writeCounty("甲市", countyA);
        writeCounty("乙縣", Map.of("三鄉", new String[]{"21", "-", "3", "6", "03", "10"}));

        WeatherFeatureSet w = enricher.enrich(Region.NORTH, EFFECTIVE);

        assertThat(w.getTempNow()).isEqualTo(20.67);
        assertThat(w.getWindNow()).isEqualTo(2.5);
        assertThat(w.getWeatherCodeNow()).isEqualTo(1);
        assertThat(w.getTempFuture12h()).isEqualTo(15.5);
        assertThat(w.getWindFuture12h()).isEqualTo(5.0);
        assertThat(w.getWeatherCodeFuture12h()).isEqualTo(8);
    }

    @Test
    @DisplayName("enrich - any required county missing from the cache yields empty features")
    void enrich_MissingCountyIsEmpty() {
        writeCounty("甲市", Map.of(
                "一區", new String[]{"20", "15", "2", "4", "01", "08"},
                "二區", new String[]{"21", "16", "3", "5", "02", "09"}));

        assertThat(enricher.enrich(Region.NORTH, EFFECTIVE)).isEqualTo(WeatherFeatureSet.EMPTY);
    }

    @Test
    @DisplayName("enrich - all values missing leaves every feature null rather than zero")
    void enrich_AllMissingIsNull() {
        String[] dashes = {"-", "-", "-", "-", "-", "-"};
        writeCounty("甲市", Map.of("一區", dashes, "二區", dashes));
        writeCounty("乙縣", Map.of("三鄉", dashes));

        WeatherFeatureSet w = enricher.enrich(Region.NORTH, EFFECTIVE);

        assertThat(w.isEmpty()).isTrue();
        assertThat(w.getTempNow()).isNull();
        assertThat(w.getWeatherCodeFuture12h()).isNull();
    }

    @Test
    @DisplayName("enrich - regions without a profile get empty features")
    void enrich_NoProfileIsEmpty() {
        assertThat(enricher.enrich(Region.OTHER, EFFECTIVE)).isEqualTo(WeatherFeatureSet.EMPTY);
        assertThat(enricher.enrich(Region.UNKNOWN, EFFECTIVE)).isEqualTo(WeatherFeatureSet.EMPTY);
    }

    // ── Fixtures ─────────────────────────────────────────────────────────────

    /**
     * Two windows per element: [06:00, 18:00) carries the "now" value and
     * [18:00, 06:00+1d) the "+12h" value (09:30 + 12h = 21:30).
     */
    private void writeCounty(String county, Map<String, String[]> towns) {
        ObjectNode root = objectMapper.createObjectNode();
        ArrayNode locations = root.putObject("records").putArray("locations").addObject().putArray("location");
        towns.forEach((town, v) -> {
            ObjectNode loc = locations.addObject();
            loc.put("locationName", town);
            ArrayNode elements = loc.putArray("weatherElement");
            element(elements, ForecastIndex.TEMPERATURE, "Temperature", v[0], v[1]);
            element(elements, ForecastIndex.WIND_SPEED, "WindSpeed", v[2], v[3]);
            element(elements, ForecastIndex.WEATHER_PHENOMENON, "WeatherCode", v[4], v[5]);
        });
        cache.saveRaw(county, root);
    }

    private void element(ArrayNode elements, String name, String field, String now, String future) {
        ObjectNode el = elements.addObject();
        el.put("elementName", name);
        ArrayNode time = el.putArray("time");
        window(time, "2025-01-01T06:00:00+08:00", "2025-01-01T18:00:00+08:00", field, now);
        window(time, "2025-01-01T18:00:00+08:00", "2025-01-02T06:00:00+08:00", field, future);
    }

    private void window(ArrayNode time, String start, String end, String field, String value) {
        ObjectNode w = time.addObject();
        w.put("startTime", start);
        w.put("endTime", end);
        w.putArray("elementValue").addObject().put(field, value);
    }
}
