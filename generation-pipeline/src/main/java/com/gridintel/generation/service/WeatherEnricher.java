package com.gridintel.generation.service;

import com.gridintel.generation.config.WeatherProfiles;
import com.gridintel.generation.model.ForecastDocument;
import com.gridintel.generation.model.ForecastTown;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.RegionWeatherProfile;
import com.gridintel.generation.model.WeatherFeatureSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Builds a region's "now" and "+12h" weather features from the cached county
 * forecasts.
 *
 * Fail-soft throughout: a region without a profile, or with any required county
 * missing from the cache, gets {@link WeatherFeatureSet#EMPTY} and still flows
 * through aggregation.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WeatherEnricher {

    static final int FUTURE_HORIZON_HOURS = 12;

    private final WeatherProfiles weatherProfiles;
    private final ForecastCacheRepository forecastCache;
    private final ForecastIndex forecastIndex;

    public WeatherFeatureSet enrich(Region region, ZonedDateTime effectiveTime) {
        Optional<RegionWeatherProfile> maybeProfile = weatherProfiles.profileFor(region);
        if (maybeProfile.isEmpty()) {
            log.debug("No weather profile for region {}, leaving features empty", region);
            return WeatherFeatureSet.EMPTY;
        }
        RegionWeatherProfile profile = maybeProfile.get();

        Map<String, ForecastDocument> forecasts = new HashMap<>();
        for (String county : profile.requiredCounties()) {
            Optional<ForecastDocument> doc = forecastCache.load(county);
            if (doc.isEmpty()) {
                log.warn("Forecast for {} not found in cache, skipping weather for {}", county, region);
                return WeatherFeatureSet.EMPTY;
            }
            forecasts.put(county, doc.get());
        }

        Horizon now = horizon(profile, forecasts, effectiveTime.toInstant());
        Horizon future = horizon(profile, forecasts, effectiveTime.plusHours(FUTURE_HORIZON_HOURS).toInstant());

        return WeatherFeatureSet.builder()
                .tempNow(now.temp())
                .windNow(now.wind())
                .weatherCodeNow(now.weatherCode())
                .tempFuture12h(future.temp())
                .windFuture12h(future.wind())
                .weatherCodeFuture12h(future.weatherCode())
                .build();
    }

    private Horizon horizon(RegionWeatherProfile profile, Map<String, ForecastDocument> forecasts, Instant target) {
        Mean temps = new Mean();
        Mean winds = new Mean();
        for (ForecastTown town : profile.averagingTowns()) {
            ForecastDocument doc = forecasts.get(town.county());
            forecastIndex.lookup(doc, town.town(), ForecastIndex.TEMPERATURE, target).ifPresent(temps::add);
            forecastIndex.lookup(doc, town.town(), ForecastIndex.WIND_SPEED, target).ifPresent(winds::add);
        }

        ForecastTown codeTown = profile.codeTown();
        OptionalDouble code = forecastIndex.lookup(
                forecasts.get(codeTown.county()), codeTown.town(), ForecastIndex.WEATHER_PHENOMENON, target);

        return new Horizon(
                temps.rounded(),
                winds.rounded(),
                code.isPresent() ? (int) code.getAsDouble() : null);
    }

    private record Horizon(Double temp, Double wind, Integer weatherCode) {
    }

    /** Mean over present values only; no values means missing, never zero. */
    private static final class Mean {
        private double sum;
        private int count;

        void add(double value) {
            sum += value;
            count++;
        }

        Double rounded() {
            if (count == 0) return null;
            return BigDecimal.valueOf(sum / count).setScale(2, RoundingMode.HALF_EVEN).doubleValue();
        }
    }
}
