package com.gridintel.generation.scheduler;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.output.ClickHouseWriter;
import com.gridintel.generation.output.OutputRouter;
import com.gridintel.generation.service.ForecastCacheRefresher;
import com.gridintel.generation.service.PipelineService;
import com.gridintel.generation.service.RealtimeObservationCollector;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Manages scheduled and on-startup pipeline runs.
 *
 * The live feed refreshes every 10 minutes, so the pipeline runs on the same
 * cadence (Asia/Taipei). Station observations are collected a few minutes
 * after each ten-minute mark. Forecast caches are refreshed every 6 hours.
 *
 * Override with PIPELINE_CRON / OBSERVATION_CRON / FORECAST_CRON or the generation-pipeline.scheduling.* properties.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class PipelineScheduler {

    private final PipelineService pipelineService;
    private final ForecastCacheRefresher forecastCacheRefresher;
    private final RealtimeObservationCollector observationCollector;
    private final OutputRouter outputRouter;
    private final ClickHouseWriter clickHouseWriter;
    private final GenerationPipelineProperties properties;

    /**
     * On application startup:
     *  1. Ensure the ClickHouse schema exists when the mirror sink is enabled
     *  2. Optionally run the pipeline once if RUN_ON_STARTUP=true
     */
    @PostConstruct
    public void onStartup() {
        if (outputRouter.clickHouseEnabled()) {
            try {
                clickHouseWriter.ensureSchema();
            } catch (Exception e) {
                log.warn("Could not initialise ClickHouse schema: {}", e.getMessage());
            }
        }

        if (properties.getScheduling().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, running pipeline once");
            try {
                pipelineService.runOnce();
            } catch (Exception e) {
                log.error("Startup pipeline run failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Pipeline ready. Schedule: {}", properties.getScheduling().getPipelineCron());
        }
    }

    @Scheduled(cron = "${generation-pipeline.scheduling.pipeline-cron:0 */10 * * * *}", zone = "Asia/Taipei")
    public void scheduledRun() {
        log.info("Scheduled pipeline run triggered");
        try {
            pipelineService.runOnce();
        } catch (Exception e) {
            log.error("Scheduled pipeline run failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${generation-pipeline.scheduling.observation-cron:0 3/10 * * * *}", zone = "Asia/Taipei")
    public void scheduledObservationCollect() {
        try {
            observationCollector.collect();
        } catch (Exception e) {
            log.error("Observation collection failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${generation-pipeline.scheduling.forecast-cron:0 5 0/6 * * *}", zone = "Asia/Taipei")
    public void scheduledForecastRefresh() {
        log.info("Scheduled forecast refresh triggered");
        try {
            forecastCacheRefresher.refreshAll();
        } catch (Exception e) {
            log.error("Forecast refresh failed: {}", e.getMessage(), e);
        }
    }
}
