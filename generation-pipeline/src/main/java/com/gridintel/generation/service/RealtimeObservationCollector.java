package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.output.CsvFiles;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Collects the ten-minute station observations from CWA (O-A0003-001).
 *
 * Every matched station is appended to the observation log with a flag for
 * missing readings, then each region gets one averaged row per observation time
 * in {@code weather_data/<Region>.csv}. A region whose last row already carries
 * the current observation time is left alone.
 *
 * Failures are logged and skipped; the next tick tries again.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RealtimeObservationCollector {

    static final String[] LOG_HEADERS = {
            "Timestamp", "StationName", "AirTemperature", "WindSpeed", "SunshineDuration", "HasNullValue"
    };
    static final String[] REGION_HEADERS = {"ObsTime", "SunshineDuration", "AirTemperature", "WindSpeed"};

    // CWA reports missing readings as large negative sentinels (-99, -999)
    private static final double MISSING_THRESHOLD = -90;

    private final RestTemplate restTemplate;
    private final GenerationPipelineProperties properties;

    public record CollectionResult(String obsTime, int stationsLogged, int regionsAppended) {
        static final CollectionResult NONE = new CollectionResult(null, 0, 0);
    }

    private record Reading(String station, String obsTime, Double airTemperature, Double windSpeed,
                           Double sunshineDuration) {
        boolean hasNull() {
            return airTemperature == null || windSpeed == null || sunshineDuration == null;
        }
    }

    public CollectionResult collect() {
        String apiKey = properties.getForecast().getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No CWA API key configured (CWA_API_KEY), skipping observation collection");
            return CollectionResult.NONE;
        }

        URI uri = UriComponentsBuilder.fromHttpUrl(properties.getObservation().getUrl())
                .queryParam("Authorization", apiKey)
                .build()
                .toUri();
        log.info("Fetching realtime observations from {}", properties.getObservation().getUrl());
        try {
            JsonNode root = restTemplate.getForObject(uri, JsonNode.class);
            if (root == null) {
                log.warn("Observation feed returned an empty body");
                return CollectionResult.NONE;
            }
            return process(root);
        } catch (RestClientException e) {
            log.error("Observation fetch failed: {}", e.getMessage());
            return CollectionResult.NONE;
        }
    }

    CollectionResult process(JsonNode root) {
        JsonNode stations = root.path("records").path("Station");
        if (!stations.isArray()) {
            log.error("Observation payload has no records.Station array, aborting");
            return CollectionResult.NONE;
        }
        if (stations.isEmpty()) {
            log.warn("Observation payload contains no stations");
            return CollectionResult.NONE;
        }

        Map<Region, List<String>> byRegion = properties.getObservation().getStations();
        Set<String> wanted = byRegion.values().stream()
                .flatMap(List::stream)
                .collect(Collectors.toSet());

        Map<String, Reading> readings = new LinkedHashMap<>();
        String obsTime = null;
        for (JsonNode station : stations) {
            String name = station.path("StationName").asText(null);
            if (name == null || !wanted.contains(name)) continue;

            String time = station.path("ObsTime").path("DateTime").asText(null);
            if (obsTime == null) obsTime = time;

            JsonNode elements = station.path("WeatherElement");
            readings.put(name, new Reading(name, time,
                    reading(elements.get("AirTemperature")),
                    reading(elements.get("WindSpeed")),
                    reading(elements.get("SunshineDuration"))));
        }

        if (readings.isEmpty()) {
            log.warn("No configured stations in the observation payload, nothing written");
            return CollectionResult.NONE;
        }
        if (obsTime == null || obsTime.isBlank()) {
            log.warn("Observation payload has no ObsTime for the matched stations, nothing written");
            return CollectionResult.NONE;
        }

        appendStationLog(readings.values());
        log.info("{} station records for {} appended to observation log", readings.size(), obsTime);

        int appended = 0;
        for (Map.Entry<Region, List<String>> e : byRegion.entrySet()) {
            if (appendRegion(e.getKey(), e.getValue(), readings, obsTime)) appended++;
        }
        return new CollectionResult(obsTime, readings.size(), appended);
    }

    static Double reading(JsonNode node) {
        if (node == null || node.isNull()) return null;
        try {
            double value = Double.parseDouble(node.asText().trim());
            return value < MISSING_THRESHOLD ? null : value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Mean of the present values rounded to two places, or null when none are present. */
    static Double average(List<Double> values) {
        List<Double> present = values.stream().filter(Objects::nonNull).toList();
        if (present.isEmpty()) return null;
        double mean = present.stream().mapToDouble(Double::doubleValue).average().orElseThrow();
        return BigDecimal.valueOf(mean).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
    }

    private void appendStationLog(Iterable<Reading> readings) {
        Path logFile = properties.getStorage().resolve(properties.getStorage().getObservationLog());
        CsvFiles.ensureDirectory(logFile.toAbsolutePath().getParent());
        try {
            boolean fresh = CsvFiles.isNewOrEmpty(logFile);
            try (CSVWriter writer = CsvFiles.appendingWriter(logFile)) {
                if (fresh) writer.writeNext(LOG_HEADERS);
                for (Reading r : readings) {
                    writer.writeNext(new String[]{
                            r.obsTime() == null ? "" : r.obsTime(),
                            r.station(),
                            orNull(r.airTemperature()),
                            orNull(r.windSpeed()),
                            orNull(r.sunshineDuration()),
                            r.hasNull() ? "True" : "False"
                    });
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append observation log " + logFile, e);
        }
    }

    private boolean appendRegion(Region region, List<String> stationNames, Map<String, Reading> readings,
                                 String obsTime) {
        Path dir = properties.getStorage().resolve(properties.getStorage().getObservationDir());
        Path table = dir.resolve(region.label() + ".csv");

        if (obsTime.equals(lastObsTime(table))) {
            log.info("Observations for {} already hold {}, skipping", region, obsTime);
            return false;
        }

        List<Reading> members = new ArrayList<>();
        for (String name : stationNames) {
            Reading r = readings.get(name);
            if (r != null) members.add(r);
        }

        CsvFiles.ensureDirectory(dir);
        try {
            boolean fresh = CsvFiles.isNewOrEmpty(table);
            try (CSVWriter writer = CsvFiles.appendingWriter(table)) {
                if (fresh) writer.writeNext(REGION_HEADERS);
                writer.writeNext(new String[]{
                        obsTime,
                        orEmpty(average(members.stream().map(Reading::sunshineDuration).toList())),
                        orEmpty(average(members.stream().map(Reading::airTemperature).toList())),
                        orEmpty(average(members.stream().map(Reading::windSpeed).toList()))
                });
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot append observation table " + table, e);
        }
        log.debug("Appended {} observation average for {}", region, obsTime);
        return true;
    }

    private String lastObsTime(Path table) {
        if (!Files.exists(table)) return null;
        try {
            List<Map<String, String>> records = CsvFiles.readRecords(table);
            return records.isEmpty() ? null : records.get(records.size() - 1).get("ObsTime");
        } catch (UncheckedIOException | IllegalStateException e) {
            log.warn("Cannot read last ObsTime from {}, appending anyway: {}", table, e.getMessage());
            return null;
        }
    }

    private static String orNull(Double value) {
        return value == null ? "NULL" : value.toString();
    }

    private static String orEmpty(Double value) {
        return value == null ? "" : value.toString();
    }
}
