package com.gridintel.generation.config;

import com.gridintel.generation.model.ForecastTown;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.RegionWeatherProfile;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Townships chosen for proximity to each region's major generation sites.
 * Catch-all regions (Other, Unknown) have no profile.
 */
@Component
public class WeatherProfiles {

    private final Map<Region, RegionWeatherProfile> profiles;

    public WeatherProfiles() {
        this(defaults());
    }

    public WeatherProfiles(Map<Region, RegionWeatherProfile> profiles) {
        this.profiles = Collections.unmodifiableMap(new EnumMap<>(profiles));
    }

    public Optional<RegionWeatherProfile> profileFor(Region region) {
        return Optional.ofNullable(profiles.get(region));
    }

    private static Map<Region, RegionWeatherProfile> defaults() {
        Map<Region, RegionWeatherProfile> m = new EnumMap<>(Region.class);
        m.put(Region.NORTH, new RegionWeatherProfile(
                List.of(town("新北市", "林口區"), town("桃園市", "觀音區"), town("苗栗縣", "通霄鎮"), town("臺北市", "中正區")),
                town("臺北市", "中正區")));
        m.put(Region.CENTRAL, new RegionWeatherProfile(
                List.of(town("臺中市", "龍井區"), town("臺中市", "西屯區"), town("彰化縣", "彰化市")),
                town("臺中市", "西屯區")));
        m.put(Region.SOUTH, new RegionWeatherProfile(
                List.of(town("高雄市", "永安區"), town("高雄市", "小港區"), town("臺南市", "安南區"), town("屏東縣", "恆春鎮")),
                town("高雄市", "苓雅區")));
        m.put(Region.EAST, new RegionWeatherProfile(
                List.of(town("花蓮縣", "花蓮市")),
                town("花蓮縣", "花蓮市")));
        m.put(Region.ISLANDS, new RegionWeatherProfile(
                List.of(town("澎湖縣", "湖西鄉")),
                town("澎湖縣", "湖西鄉")));
        return m;
    }

    private static ForecastTown town(String county, String town) {
        return new ForecastTown(county, town);
    }
}
