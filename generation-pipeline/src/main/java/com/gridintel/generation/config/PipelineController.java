package com.gridintel.generation.config;

import com.gridintel.generation.model.PipelineRun;
import com.gridintel.generation.service.EffectiveTimestamps;
import com.gridintel.generation.service.ForecastCacheRefresher;
import com.gridintel.generation.service.PipelineReportService;
import com.gridintel.generation.service.PipelineService;
import com.gridintel.generation.service.RealtimeObservationCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PipelineController {

    private final PipelineService pipelineService;
    private final ForecastCacheRefresher forecastCacheRefresher;
    private final RealtimeObservationCollector observationCollector;
    private final PipelineReportService reportService;
    private final GenerationPipelineProperties properties;

    // ── Triggers ──────────────────────────────────────────────────────────────

    @PostMapping("/pipeline/trigger")
    public ResponseEntity<Map<String, String>> triggerRun() {
        new Thread(pipelineService::runOnce, "manual-pipeline-run").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "pipeline"));
    }

    @PostMapping("/forecasts/refresh")
    public ResponseEntity<Map<String, String>> refreshForecasts() {
        new Thread(forecastCacheRefresher::refreshAll, "manual-forecast-refresh").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "forecasts"));
    }

    @PostMapping("/observations/collect")
    public ResponseEntity<Map<String, String>> collectObservations() {
        new Thread(observationCollector::collect, "manual-observation-collect").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "target", "observations"));
    }

    @GetMapping("/pipeline/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "grid-intel-generation-pipeline");
        body.put("version", "1.0.0");
        body.put("clickhouseMirror", properties.getOutput().isClickhouseMirror());
        body.put("dataDir", properties.getStorage().getBaseDir());

        PipelineRun last = pipelineService.lastRun();
        if (last != null) {
            Map<String, Object> run = new LinkedHashMap<>();
            run.put("runId", last.getRunId());
            run.put("effectiveTimestamp", EffectiveTimestamps.format(last.getEffectiveTimestamp()));
            run.put("status", last.getStatus());
            run.put("unitsFetched", last.getUnitsFetched());
            run.put("rowsWritten", last.getRowsWritten());
            run.put("addedUnits", last.getAddedUnits());
            run.put("missingUnits", last.getMissingUnits());
            if (last.getErrorMessage() != null) run.put("error", last.getErrorMessage());
            body.put("lastRun", run);
        }
        return ResponseEntity.ok(body);
    }

    // ── Reports ───────────────────────────────────────────────────────────────

    /**
     * Generation mix at the latest persisted timestamp.
     *
     * GET /reports/generation-mix
     */
    @GetMapping("/reports/generation-mix")
    public ResponseEntity<?> generationMix() {
        try {
            return ResponseEntity.ok(reportService.latestGenerationMix());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Generation mix report failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @PostMapping("/reports/units")
    public ResponseEntity<?> unitReports() {
        try {
            List<String> files = reportService.writeUnitReports().stream()
                    .map(Path::toString)
                    .toList();
            return ResponseEntity.ok(Map.of("files", files));
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Unit report generation failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }

    @GetMapping("/reports/fluctuation/latest")
    public ResponseEntity<?> latestFluctuation() {
        try {
            return reportService.latestFluctuationReport()
                    .<ResponseEntity<?>>map(block -> ResponseEntity.ok(Map.of("report", block)))
                    .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                            .body(Map.of("error", "No fluctuation report recorded yet")));
        } catch (Exception e) {
            log.error("Fluctuation report lookup failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", e.getMessage()));
        }
    }
}
