package com.gridintel.generation.service;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.FuelTypes;
import com.gridintel.generation.output.CsvFiles;
import com.gridintel.generation.output.SegmentCsvStore;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Read-only reporting over what the pipeline has persisted: the latest
 * generation mix, per-region unit lists and the most recent fluctuation block.
 * Never writes to the pipeline's own tables or logs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineReportService {

    private static final String FLUCTUATION_HEADER = "--- Fluctuation Report @";

    private final SegmentCsvStore segmentCsvStore;
    private final GenerationPipelineProperties properties;

    public record FuelShare(String fuelType, double mw, double percent) {
    }

    public record GenerationMix(LocalDateTime timestamp, double totalMw, List<FuelShare> fuels) {
    }

    /**
     * Per-fuel totals across every segment table at the latest persisted timestamp.
     *
     * @throws IllegalStateException when nothing has been persisted yet
     */
    public GenerationMix latestGenerationMix() {
        List<Map<String, String>> all = new ArrayList<>();
        for (Path table : segmentCsvStore.listTables()) {
            all.addAll(segmentCsvStore.readTable(table));
        }

        Optional<LocalDateTime> latest = all.stream()
                .map(r -> EffectiveTimestamps.parse(r.get(SegmentCsvStore.COL_DATETIME)))
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());
        if (latest.isEmpty()) {
            throw new IllegalStateException("No persisted generation data found");
        }

        Map<String, Double> byFuel = new LinkedHashMap<>();
        for (Map<String, String> row : all) {
            Optional<LocalDateTime> ts = EffectiveTimestamps.parse(row.get(SegmentCsvStore.COL_DATETIME));
            if (ts.isEmpty() || !ts.get().equals(latest.get())) continue;
            double mw = parseDouble(row.get(SegmentCsvStore.COL_NET_P));
            byFuel.merge(row.getOrDefault(SegmentCsvStore.COL_FUEL_TYPE, ""), mw, Double::sum);
        }

        double total = byFuel.values().stream().mapToDouble(Double::doubleValue).sum();
        List<FuelShare> shares = new ArrayList<>();
        byFuel.entrySet().stream()
                .sorted(Comparator.comparingInt((Map.Entry<String, Double> e) -> reportRank(e.getKey()))
                        .thenComparing(Map.Entry::getKey))
                .forEach(e -> shares.add(new FuelShare(e.getKey(), e.getValue(),
                        total > 0 ? e.getValue() / total * 100 : 0)));

        return new GenerationMix(latest.get(), total, shares);
    }

    /**
     * Writes latest_vs_all_units.csv and one {Region}_units.csv per region of the
     * latest run into the reports directory.
     *
     * @return the files written
     * @throws IllegalStateException when the unit-details log is missing or empty
     */
    public List<Path> writeUnitReports() {
        Path detailsLog = properties.getStorage().resolve(properties.getStorage().getUnitDetailsLog());
        if (!Files.exists(detailsLog)) {
            throw new IllegalStateException("Unit details log not found: " + detailsLog);
        }

        List<Map<String, String>> details = CsvFiles.readRecords(detailsLog);
        Optional<LocalDateTime> latest = details.stream()
                .map(r -> EffectiveTimestamps.parse(r.get("DATETIME")))
                .flatMap(Optional::stream)
                .max(Comparator.naturalOrder());
        if (latest.isEmpty()) {
            throw new IllegalStateException("Unit details log is empty: " + detailsLog);
        }

        Set<String> allUnits = new TreeSet<>();
        Set<String> latestUnits = new TreeSet<>();
        Map<String, Set<String>> latestByRegion = new TreeMap<>();
        for (Map<String, String> row : details) {
            String unit = row.get("UNIT_NAME");
            if (unit == null || unit.isBlank()) continue;
            allUnits.add(unit);
            if (EffectiveTimestamps.parse(row.get("DATETIME")).filter(latest.get()::equals).isPresent()) {
                latestUnits.add(unit);
                latestByRegion.computeIfAbsent(row.getOrDefault("REGION", ""), k -> new TreeSet<>()).add(unit);
            }
        }

        Path reportsDir = properties.getStorage().resolve(properties.getStorage().getReportsDir());
        CsvFiles.ensureDirectory(reportsDir);
        List<Path> written = new ArrayList<>();

        List<String[]> coverage = new ArrayList<>();
        for (String unit : allUnits) {
            coverage.add(new String[]{unit, latestUnits.contains(unit) ? "True" : "False"});
        }
        written.add(writeReport(reportsDir.resolve("latest_vs_all_units.csv"),
                new String[]{"UNIT_NAME", "InLatestEntry"}, coverage));

        for (Map.Entry<String, Set<String>> region : latestByRegion.entrySet()) {
            String safe = region.getKey().replace('(', '_').replace(")", "").replace(' ', '_');
            List<String[]> units = region.getValue().stream().map(u -> new String[]{u}).toList();
            written.add(writeReport(reportsDir.resolve(safe + "_units.csv"), new String[]{"UNIT_NAME"}, units));
        }

        log.info("Wrote {} unit reports to {}", written.size(), reportsDir);
        return written;
    }

    /** The most recent block of the fluctuation log, or empty if there is none. */
    public Optional<String> latestFluctuationReport() {
        Path logFile = properties.getStorage().resolve(properties.getStorage().getFluctuationLog());
        if (!Files.exists(logFile)) return Optional.empty();

        List<String> lines;
        try {
            lines = Files.readAllLines(logFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read fluctuation log " + logFile, e);
        }

        for (int i = lines.size() - 1; i >= 0; i--) {
            if (lines.get(i).contains(FLUCTUATION_HEADER)) {
                return Optional.of(String.join("\n", lines.subList(i, lines.size())).strip());
            }
        }
        return Optional.empty();
    }

    private Path writeReport(Path path, String[] header, List<String[]> rows) {
        try (CSVWriter writer = CsvFiles.newWriter(path)) {
            writer.writeNext(header);
            rows.forEach(writer::writeNext);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write report " + path, e);
        }
        return path;
    }

    private static int reportRank(String fuelType) {
        int idx = FuelTypes.REPORT_ORDER.indexOf(fuelType);
        return idx < 0 ? FuelTypes.REPORT_ORDER.size() : idx;
    }

    private static double parseDouble(String value) {
        if (value == null || value.isBlank()) return 0.0;
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric NET_P value '{}'", value);
            return 0.0;
        }
    }
}
