package com.gridintel.generation.output;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.SegmentKey;
import com.gridintel.generation.model.WeatherFeatureSet;
import com.gridintel.generation.service.EffectiveTimestamps;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Segmented time-series tables, one CSV per (region, fuel type).
 *
 * Output path pattern: {finalDataDir}/{Region}/{Region}_{fuel}.csv
 * e.g. /data/grid/final_data/North/North_燃煤.csv
 *
 * The timestamp is the primary key within a table. An upsert drops any stored
 * row for an incoming timestamp, appends the new row and rewrites the whole
 * table, so re-running a timestamp replaces rather than duplicates it.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SegmentCsvStore {

    public static final String COL_DATETIME = "DATETIME";
    public static final String COL_REGION = "REGION";
    public static final String COL_FUEL_TYPE = "FUEL_TYPE";
    public static final String COL_NET_P = "NET_P";

    static final String[] HEADERS = {
            COL_DATETIME, COL_REGION, COL_FUEL_TYPE, COL_NET_P,
            "TEMP_now", "WIND_now", "W_CODE_now",
            "TEMP_future_12h", "WIND_future_12h", "W_CODE_future_12h"
    };

    private final GenerationPipelineProperties properties;

    /**
     * @return number of rows written across all touched tables
     */
    public int upsert(List<AggregatedRow> rows) {
        if (rows.isEmpty()) return 0;

        Map<Path, List<AggregatedRow>> byTable = rows.stream()
                .collect(Collectors.groupingBy(r -> tablePath(r.segmentKey()), LinkedHashMap::new, Collectors.toList()));
        byTable.forEach(SegmentCsvStore::checkNoTimestampCollision);

        int written = 0;
        for (Map.Entry<Path, List<AggregatedRow>> e : byTable.entrySet()) {
            upsertSegment(e.getKey(), e.getValue());
            written += e.getValue().size();
        }
        log.info("Upserted {} rows into {} segment tables", written, byTable.size());
        return written;
    }

    public Path tablePath(SegmentKey key) {
        String region = sanitize(key.region().label());
        String fuel = sanitize(key.fuelType());
        return finalDataDir().resolve(region).resolve(region + "_" + fuel + ".csv");
    }

    /** Every segment table currently on disk. */
    public List<Path> listTables() {
        Path root = finalDataDir();
        if (!Files.isDirectory(root)) return List.of();
        try (Stream<Path> files = Files.walk(root)) {
            return files.filter(p -> p.getFileName().toString().endsWith(".csv")).sorted().toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list segment tables under " + root, e);
        }
    }

    /** Rows of a table keyed by header name, BOM tolerated. */
    public List<Map<String, String>> readTable(Path path) {
        return CsvFiles.readRecords(path);
    }

    /**
     * Drop parenthesised suffixes, then replace characters that are unsafe in
     * file names: "燃煤(Coal)" becomes "燃煤".
     */
    static String sanitize(String name) {
        if (name == null) return "";
        return name.replaceAll("\\(.*\\)", "")
                .replaceAll("[\\\\/*?:\"<>|]", "_")
                .trim();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Distinct fuel labels can sanitise to the same file name. Two of them at one
     * timestamp would make the second row replace the first, so the whole batch
     * is rejected before anything is written.
     */
    private static void checkNoTimestampCollision(Path table, List<AggregatedRow> rows) {
        Map<LocalDateTime, String> seen = new HashMap<>();
        for (AggregatedRow row : rows) {
            String previous = seen.putIfAbsent(row.getTimestamp(), row.getFuelType());
            if (previous != null) {
                throw new IllegalStateException(String.format(
                        "Fuel types '%s' and '%s' both map to segment table %s at %s",
                        previous, row.getFuelType(), table.getFileName(),
                        EffectiveTimestamps.format(row.getTimestamp())));
            }
        }
    }

    private void upsertSegment(Path path, List<AggregatedRow> incoming) {
        CsvFiles.ensureDirectory(path.getParent());

        Set<LocalDateTime> replaced = incoming.stream()
                .map(AggregatedRow::getTimestamp)
                .collect(Collectors.toSet());

        List<String[]> kept = new ArrayList<>();
        int dropped = 0;
        if (Files.exists(path)) {
            Table existing = read(path);
            int tsIdx = Math.max(0, existing.indexOf(COL_DATETIME));
            for (String[] row : existing.rows()) {
                Optional<LocalDateTime> ts = tsIdx < row.length
                        ? EffectiveTimestamps.parse(row[tsIdx])
                        : Optional.empty();
                if (ts.isPresent() && replaced.contains(ts.get())) {
                    dropped++;
                } else {
                    kept.add(row);
                }
            }
        }

        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try (CSVWriter writer = CsvFiles.newWriter(tmp)) {
            writer.writeNext(HEADERS);
            for (String[] row : kept) {
                writer.writeNext(row);
            }
            for (AggregatedRow row : incoming) {
                writer.writeNext(toRow(row));
            }
        } catch (IOException e) {
            log.error("Failed to write segment table {}: {}", path, e.getMessage(), e);
            throw new UncheckedIOException("Segment write failed: " + path, e);
        }
        CsvFiles.replace(tmp, path);

        log.debug("Segment {}: kept {} rows, replaced {}, appended {}", path.getFileName(), kept.size(), dropped, incoming.size());
    }

    private Table read(Path path) {
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {
            String[] header = reader.readNext();
            if (header == null) return new Table(new String[0], List.of());
            if (header.length > 0) header[0] = CsvFiles.stripBom(header[0]);

            List<String[]> rows = new ArrayList<>();
            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                rows.add(row);
            }
            return new Table(header, rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read segment table " + path, e);
        } catch (CsvValidationException e) {
            throw new IllegalStateException("Corrupt segment table " + path + ": " + e.getMessage(), e);
        }
    }

    private String[] toRow(AggregatedRow r) {
        WeatherFeatureSet w = r.getWeather() == null ? WeatherFeatureSet.EMPTY : r.getWeather();
        return new String[]{
                EffectiveTimestamps.format(r.getTimestamp()),
                r.getRegion().label(),
                str(r.getFuelType()),
                num(r.getNetPowerSum()),
                num(w.getTempNow()),
                num(w.getWindNow()),
                str(w.getWeatherCodeNow()),
                num(w.getTempFuture12h()),
                num(w.getWindFuture12h()),
                str(w.getWeatherCodeFuture12h())
        };
    }

    private String num(Double val) {
        return val == null ? "" : BigDecimal.valueOf(val).toPlainString();
    }

    private String str(Object val) {
        return val == null ? "" : val.toString();
    }

    private Path finalDataDir() {
        return properties.getStorage().resolve(properties.getStorage().getFinalDataDir());
    }

    private record Table(String[] header, List<String[]> rows) {
        int indexOf(String column) {
            for (int i = 0; i < header.length; i++) {
                if (column.equalsIgnoreCase(header[i].trim())) return i;
            }
            return -1;
        }
    }
}
