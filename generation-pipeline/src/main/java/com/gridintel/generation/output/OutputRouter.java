package com.gridintel.generation.output;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.PipelineRun;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Persists aggregated rows. The segment CSV tables are the system of record
 * and are written on every run; ClickHouse, when enabled, receives a copy.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OutputRouter {

    private final SegmentCsvStore segmentCsvStore;
    private final ClickHouseWriter clickHouseWriter;
    private final GenerationPipelineProperties properties;

    /**
     * @return number of rows persisted
     */
    public int write(List<AggregatedRow> rows) {
        segmentCsvStore.upsert(rows);
        if (clickHouseEnabled()) {
            clickHouseWriter.write(rows);
        }
        return rows.size();
    }

    public void writePipelineRun(PipelineRun run) {
        if (!clickHouseEnabled()) return;
        try {
            clickHouseWriter.writePipelineRun(run);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run metadata: {}", e.getMessage());
        }
    }

    public boolean clickHouseEnabled() {
        return properties.getOutput().isClickhouseMirror();
    }
}
