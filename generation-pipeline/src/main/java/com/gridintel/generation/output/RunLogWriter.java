package com.gridintel.generation.output;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.EnrichedRecord;
import com.gridintel.generation.service.EffectiveTimestamps;
import com.opencsv.CSVWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Append-only run logs consumed by the reporting side:
 * <ul>
 *   <li>fluctuation_log.txt: one block per run with added/missing units</li>
 *   <li>unknown_plants_log.txt: one line per run listing units with no region</li>
 *   <li>unit_details_log.csv: DATETIME, UNIT_NAME, REGION, FUEL_TYPE per unit per run</li>
 *   <li>electricity_demand.csv: DATETIME, DEMAND_MW per run</li>
 * </ul>
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunLogWriter {

    static final String[] UNIT_DETAIL_HEADERS = {"DATETIME", "UNIT_NAME", "REGION", "FUEL_TYPE"};
    static final String[] DEMAND_HEADERS = {"DATETIME", "DEMAND_MW"};

    private final GenerationPipelineProperties properties;

    public void appendFluctuation(String block) {
        appendText(path(properties.getStorage().getFluctuationLog()), block);
    }

    public void appendUnknownPlants(LocalDateTime timestamp, List<String> unknownUnits) {
        String stamp = "[" + EffectiveTimestamps.format(timestamp) + "] ";
        String entry = unknownUnits.isEmpty()
                ? stamp + "✅ No Unknown Plants Detected.\n"
                : stamp + "❌ Unknown Plants Detected:\n  " + String.join(", ", unknownUnits) + "\n";
        appendText(path(properties.getStorage().getUnknownPlantsLog()), entry);
    }

    public void appendUnitDetails(List<EnrichedRecord> records) {
        if (records.isEmpty()) return;
        Path target = path(properties.getStorage().getUnitDetailsLog());
        appendCsv(target, UNIT_DETAIL_HEADERS, writer -> {
            for (EnrichedRecord r : records) {
                writer.writeNext(new String[]{
                        EffectiveTimestamps.format(r.getTimestamp()),
                        r.getUnitName(),
                        r.getRegion().label(),
                        r.getFuelType()
                });
            }
        });
        log.info("Appended {} unit details to {}", records.size(), target.getFileName());
    }

    public void appendDemand(LocalDateTime timestamp, double demandMw) {
        appendCsv(path(properties.getStorage().getDemandFile()), DEMAND_HEADERS, writer ->
                writer.writeNext(new String[]{
                        EffectiveTimestamps.format(timestamp),
                        BigDecimal.valueOf(demandMw).toPlainString()
                }));
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private interface RowSink {
        void write(CSVWriter writer);
    }

    private void appendCsv(Path target, String[] headers, RowSink rows) {
        ensureParent(target);
        try {
            boolean fresh = CsvFiles.isNewOrEmpty(target);
            try (CSVWriter writer = CsvFiles.appendingWriter(target)) {
                if (fresh) writer.writeNext(headers);
                rows.write(writer);
            }
        } catch (IOException e) {
            log.error("Failed to append to {}: {}", target, e.getMessage(), e);
            throw new UncheckedIOException("Log append failed: " + target, e);
        }
    }

    private void appendText(Path target, String text) {
        ensureParent(target);
        try {
            Files.writeString(target, text, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            log.error("Failed to append to {}: {}", target, e.getMessage(), e);
            throw new UncheckedIOException("Log append failed: " + target, e);
        }
    }

    private void ensureParent(Path target) {
        if (target.getParent() != null) CsvFiles.ensureDirectory(target.getParent());
    }

    private Path path(String name) {
        return properties.getStorage().resolve(name);
    }
}
