package com.gridintel.generation.service;

import com.gridintel.generation.model.ForecastDocument;
import com.gridintel.generation.model.ForecastElement;
import com.gridintel.generation.model.ForecastWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Point lookups into a normalised forecast document.
 *
 * <p>The window containing the target instant ({@code start <= t < end}) is used;
 * when none does, the first published window is used instead. That includes
 * targets earlier than every window. The lookup is total: every structural gap
 * or unparseable value comes back as an empty {@link OptionalDouble}.
 */
@Component
@Slf4j
public class ForecastIndex {

    public static final String TEMPERATURE = "平均溫度";
    public static final String WIND_SPEED = "風速";
    public static final String WEATHER_PHENOMENON = "天氣現象";

    private static final String WEATHER_CODE_FIELD = "WeatherCode";
    private static final Pattern EMBEDDED_NUMBER = Pattern.compile("-?\\d+(\\.\\d+)?");

    public OptionalDouble lookup(ForecastDocument document, String locationName, String elementName, Instant target) {
        if (document == null || elementName == null) return OptionalDouble.empty();

        ForecastElement element = findElement(document.elementsFor(locationName), elementName);
        if (element == null || element.windows().isEmpty()) {
            log.debug("No {} windows for {}", elementName, locationName);
            return OptionalDouble.empty();
        }

        ForecastWindow window = selectWindow(element.windows(), target);
        String raw = WEATHER_PHENOMENON.equals(elementName)
                ? weatherCode(window.values())
                : firstValue(window.values());
        return parseValue(raw);
    }

    ForecastWindow selectWindow(List<ForecastWindow> windows, Instant target) {
        for (ForecastWindow w : windows) {
            if (w.contains(target)) return w;
        }
        return windows.get(0);
    }

    static OptionalDouble parseValue(String raw) {
        if (raw == null) return OptionalDouble.empty();
        String value = raw.trim();
        if (value.isEmpty() || "-".equals(value)) return OptionalDouble.empty();

        OptionalDouble direct = parseFinite(value);
        if (direct.isPresent()) return direct;

        Matcher m = EMBEDDED_NUMBER.matcher(value);
        if (m.find()) return parseFinite(m.group());
        return OptionalDouble.empty();
    }

    private static OptionalDouble parseFinite(String value) {
        try {
            double parsed = Double.parseDouble(value);
            return Double.isFinite(parsed) ? OptionalDouble.of(parsed) : OptionalDouble.empty();
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private ForecastElement findElement(List<ForecastElement> elements, String name) {
        for (ForecastElement el : elements) {
            if (name.equals(el.name())) return el;
        }
        return null;
    }

    private String weatherCode(Map<String, String> values) {
        for (Map.Entry<String, String> e : values.entrySet()) {
            if (WEATHER_CODE_FIELD.equalsIgnoreCase(e.getKey())) return e.getValue();
        }
        return null;
    }

    private String firstValue(Map<String, String> values) {
        return values.isEmpty() ? null : values.values().iterator().next();
    }
}
