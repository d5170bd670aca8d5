package com.gridintel.generation.service;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.output.CsvFiles;
import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Loads the hand-maintained unit → region table (UNIT_NAME, REGION columns).
 *
 * The file is optional. Rows with an unrecognised region label are ignored so
 * those units fall through to keyword inference. The first row for a unit wins.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StaticRegionMapLoader {

    private static final String COL_UNIT = "UNIT_NAME";
    private static final String COL_REGION = "REGION";

    private final GenerationPipelineProperties properties;

    public Map<String, Region> load() {
        return load(properties.getStorage().resolve(properties.getStorage().getRegionMapFile()));
    }

    Map<String, Region> load(Path path) {
        if (!Files.exists(path)) {
            log.info("Region map {} not found, using keyword inference only", path);
            return Collections.emptyMap();
        }

        Map<String, Region> map = new LinkedHashMap<>();
        int ignored = 0;

        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVReader reader = new CSVReader(in)) {

            String[] header = reader.readNext();
            if (header == null) return Collections.emptyMap();

            int unitIdx = indexOf(header, COL_UNIT);
            int regionIdx = indexOf(header, COL_REGION);
            if (unitIdx < 0 || regionIdx < 0) {
                log.warn("Region map {} lacks {} / {} columns, ignoring it", path, COL_UNIT, COL_REGION);
                return Collections.emptyMap();
            }

            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length <= Math.max(unitIdx, regionIdx)) continue;
                String unit = row[unitIdx];
                Region region = Region.fromLabel(row[regionIdx]).orElse(null);
                if (unit == null || unit.isBlank() || region == null) {
                    ignored++;
                    continue;
                }
                map.putIfAbsent(unit, region);
            }
        } catch (IOException | CsvValidationException e) {
            log.warn("Could not read region map {}: {}", path, e.getMessage());
            return Collections.emptyMap();
        }

        log.debug("Loaded {} static region assignments ({} rows ignored)", map.size(), ignored);
        return map;
    }

    private int indexOf(String[] header, String column) {
        for (int i = 0; i < header.length; i++) {
            if (column.equalsIgnoreCase(CsvFiles.stripBom(header[i]).trim())) return i;
        }
        return -1;
    }
}
