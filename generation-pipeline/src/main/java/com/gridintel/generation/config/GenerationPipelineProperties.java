package com.gridintel.generation.config;

import com.gridintel.generation.model.Region;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "generation-pipeline")
@Data
public class GenerationPipelineProperties {

    private Feed feed = new Feed();
    private Storage storage = new Storage();
    private Output output = new Output();
    private Forecast forecast = new Forecast();
    private Observation observation = new Observation();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Feed {
        private String generationUrl = "https://www.taipower.com.tw/d006/loadGraph/loadGraph/data/genary.json";
        private String demandUrl = "https://www.taipower.com.tw/d006/loadGraph/loadGraph/data/loadpara.json";
        private Duration timeout = Duration.ofSeconds(20);
        private String zone = "Asia/Taipei";

        public ZoneId zoneId() {
            return ZoneId.of(zone);
        }
    }

    /**
     * Every file the pipeline reads or writes lives under {@code baseDir}.
     */
    @Data
    public static class Storage {
        private String baseDir = "/data/grid";
        private String finalDataDir = "final_data";
        private String forecastCacheDir = "forecast_cache";
        private String reportsDir = "reports";
        private String regionMapFile = "plant_to_region_map.csv";
        private String stateFile = "last_run_units.json";
        private String fluctuationLog = "fluctuation_log.txt";
        private String unknownPlantsLog = "unknown_plants_log.txt";
        private String unitDetailsLog = "unit_details_log.csv";
        private String demandFile = "electricity_demand.csv";
        private String observationLog = "10min_weather_log.csv";
        private String observationDir = "weather_data";

        public Path resolve(String name) {
            return Paths.get(baseDir).resolve(name);
        }
    }

    /**
     * Segment CSV tables are always written. ClickHouse only mirrors them.
     */
    @Data
    public static class Output {
        private boolean clickhouseMirror = false;
    }

    @Data
    public static class Forecast {
        private String baseUrl = "https://opendata.cwa.gov.tw/api/v1/rest/datastore/F-D0047-093";
        private String apiKey;
        private Duration timeout = Duration.ofSeconds(30);
        private String fingerprintFile = "weather_structure_fingerprint.json";
        private String structureLog = "weather_structure_log.txt";

        /** County name → CWA township forecast dataset id. */
        private Map<String, String> counties = defaultCounties();

        private static Map<String, String> defaultCounties() {
            Map<String, String> m = new LinkedHashMap<>();
            m.put("臺北市", "F-D0047-063");
            m.put("新北市", "F-D0047-071");
            m.put("基隆市", "F-D0047-051");
            m.put("桃園市", "F-D0047-007");
            m.put("苗栗縣", "F-D0047-015");
            m.put("臺中市", "F-D0047-075");
            m.put("彰化縣", "F-D0047-019");
            m.put("高雄市", "F-D0047-067");
            m.put("臺南市", "F-D0047-079");
            m.put("屏東縣", "F-D0047-035");
            m.put("花蓮縣", "F-D0047-043");
            m.put("澎湖縣", "F-D0047-047");
            return m;
        }
    }

    /**
     * Realtime station observations. Reuses the forecast API key.
     */
    @Data
    public static class Observation {
        private String url = "https://opendata.cwa.gov.tw/api/v1/rest/datastore/O-A0003-001";

        /** Stations averaged into each region's observation table. */
        private Map<Region, List<String>> stations = defaultStations();

        private static Map<Region, List<String>> defaultStations() {
            Map<Region, List<String>> m = new EnumMap<>(Region.class);
            m.put(Region.NORTH, List.of("臺北", "新北", "基隆", "新竹", "新屋", "鞍部"));
            m.put(Region.CENTRAL, List.of("臺中", "後龍", "古坑", "田中", "日月潭", "阿里山", "玉山"));
            m.put(Region.SOUTH, List.of("嘉義", "臺南", "永康", "高雄", "恆春"));
            m.put(Region.EAST, List.of("宜蘭", "花蓮", "成功", "臺東", "大武"));
            m.put(Region.ISLANDS, List.of("澎湖", "金門", "馬祖", "蘭嶼", "東吉島"));
            return m;
        }
    }

    @Data
    public static class Scheduling {
        private String pipelineCron = "0 */10 * * * *";
        private String forecastCron = "0 5 0/6 * * *";
        private String observationCron = "0 3/10 * * * *";
        private boolean runOnStartup = false;
    }
}
