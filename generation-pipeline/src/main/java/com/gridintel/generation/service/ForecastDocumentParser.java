package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridintel.generation.model.ForecastDocument;
import com.gridintel.generation.model.ForecastElement;
import com.gridintel.generation.model.ForecastLocation;
import com.gridintel.generation.model.ForecastWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Normalises a raw CWA township forecast into {@link ForecastDocument}.
 *
 * The upstream schema has shipped with both camelCase ("records", "locationName",
 * "startTime") and PascalCase ("Records", "LocationName", "StartTime") keys.
 * Both are accepted here so nothing downstream has to care. Structural gaps
 * produce empty lists rather than exceptions.
 */
@Component
@Slf4j
public class ForecastDocumentParser {

    public ForecastDocument parse(JsonNode root, ZoneId zone) {
        if (root == null) return ForecastDocument.EMPTY;
        try {
            JsonNode records = field(root, "records", "Records");
            JsonNode groups = field(records, "locations", "Locations");
            if (groups == null || !groups.isArray() || groups.isEmpty()) {
                return ForecastDocument.EMPTY;
            }

            JsonNode group = groups.get(0);
            List<ForecastLocation> locations = new ArrayList<>();
            for (JsonNode loc : iterable(field(group, "location", "Location"))) {
                String name = text(field(loc, "locationName", "LocationName"));
                if (name == null) continue;
                locations.add(new ForecastLocation(name,
                        parseElements(field(loc, "weatherElement", "WeatherElement"), zone)));
            }

            List<ForecastElement> shared = parseElements(field(group, "weatherElement", "WeatherElement"), zone);
            return new ForecastDocument(locations, shared);

        } catch (RuntimeException e) {
            log.warn("Unreadable forecast document, treating as empty: {}", e.getMessage());
            return ForecastDocument.EMPTY;
        }
    }

    private List<ForecastElement> parseElements(JsonNode elements, ZoneId zone) {
        List<ForecastElement> result = new ArrayList<>();
        for (JsonNode el : iterable(elements)) {
            String name = text(field(el, "elementName", "ElementName"));
            if (name == null) continue;

            List<ForecastWindow> windows = new ArrayList<>();
            for (JsonNode block : iterable(field(el, "time", "Time"))) {
                windows.add(new ForecastWindow(
                        parseInstant(text(field(block, "startTime", "StartTime")), zone),
                        parseInstant(text(field(block, "endTime", "EndTime")), zone),
                        firstValueEntry(field(block, "elementValue", "ElementValue"))));
            }
            result.add(new ForecastElement(name, windows));
        }
        return result;
    }

    private Map<String, String> firstValueEntry(JsonNode values) {
        Map<String, String> entry = new LinkedHashMap<>();
        if (values == null || !values.isArray() || values.isEmpty()) return entry;

        JsonNode first = values.get(0);
        if (first == null || !first.isObject()) return entry;

        Iterator<Map.Entry<String, JsonNode>> fields = first.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> f = fields.next();
            entry.put(f.getKey(), text(f.getValue()));
        }
        return entry;
    }

    /**
     * ISO offset date-time ("2025-01-01T06:00:00+08:00"), or a local
     * "yyyy-MM-dd HH:mm:ss" interpreted in the forecast's zone.
     */
    Instant parseInstant(String value, ZoneId zone) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            return EffectiveTimestamps.parse(value)
                    .map(local -> local.atZone(zone).toInstant())
                    .orElse(null);
        }
    }

    private static JsonNode field(JsonNode node, String... names) {
        if (node == null || !node.isObject()) return null;
        for (String name : names) {
            JsonNode value = node.get(name);
            if (value != null && !value.isNull()) return value;
        }
        return null;
    }

    private static Iterable<JsonNode> iterable(JsonNode node) {
        if (node == null || !node.isArray()) return List.of();
        return node;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull()) return null;
        return node.isValueNode() ? node.asText() : node.toString();
    }
}
