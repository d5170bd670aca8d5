package com.gridintel.generation.service;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.exception.FeedFetchException;
import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.EnrichedRecord;
import com.gridintel.generation.model.GenerationFeedResponse;
import com.gridintel.generation.model.GenerationRecord;
import com.gridintel.generation.model.PipelineOutcome;
import com.gridintel.generation.model.PipelineRun;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.RunState;
import com.gridintel.generation.model.WeatherFeatureSet;
import com.gridintel.generation.output.OutputRouter;
import com.gridintel.generation.output.RunLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Orchestrates one pipeline run:
 * fetch → resolve regions → diff units → enrich → aggregate → persist → log.
 *
 * Runs are synchronous. {@link #runOnce()} is serialised on this instance so a
 * manual trigger cannot overlap a scheduled run; nothing locks the files across
 * processes. A fetch failure aborts the
 * run before anything is written, leaving tables, logs and state as they were.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PipelineService {

    private final LiveFeedClient feedClient;
    private final GenerationFeedParser feedParser;
    private final StaticRegionMapLoader regionMapLoader;
    private final RegionResolver regionResolver;
    private final FluctuationTracker fluctuationTracker;
    private final WeatherEnricher weatherEnricher;
    private final GenerationAggregator aggregator;
    private final OutputRouter outputRouter;
    private final RunLogWriter runLogWriter;
    private final RunStateStore runStateStore;
    private final GenerationPipelineProperties properties;
    private final Clock clock;

    private final AtomicReference<PipelineRun> lastRun = new AtomicReference<>();

    /**
     * Load the previous state, run, and persist the next state if the run succeeded.
     */
    public synchronized PipelineOutcome runOnce() {
        RunState previous = runStateStore.load();
        PipelineOutcome outcome = run(previous);
        if (outcome.succeeded()) {
            runStateStore.save(outcome.nextState());
        }
        return outcome;
    }

    public PipelineOutcome run(RunState previous) {
        ZonedDateTime effective = EffectiveTimestamps.floorToTenMinutes(
                ZonedDateTime.now(clock.withZone(properties.getFeed().zoneId())));
        LocalDateTime timestamp = effective.toLocalDateTime();

        PipelineRun run = PipelineRun.builder()
                .runId(UUID.randomUUID().toString())
                .effectiveTimestamp(timestamp)
                .startedAt(EffectiveTimestamps.localNow(clock, properties.getFeed().zoneId()))
                .status(PipelineRun.RUNNING)
                .build();
        RunState next = previous;

        log.info("Running pipeline for {}", EffectiveTimestamps.format(timestamp));
        try {
            GenerationFeedResponse feed = feedClient.fetchGeneration();
            List<GenerationRecord> records = feedParser.parse(feed, timestamp);
            run.setUnitsFetched(records.size());

            if (records.isEmpty()) {
                log.warn("No valid generator records in feed, nothing to persist");
                run.setStatus(PipelineRun.SKIPPED);
                return new PipelineOutcome(run, previous);
            }
            log.info("Fetched data for {} active units", records.size());

            captureDemand(timestamp);

            Map<String, Region> staticMap = regionMapLoader.load();
            Set<String> currentUnits = new LinkedHashSet<>();
            List<String> unknownUnits = new ArrayList<>();
            Map<Region, WeatherFeatureSet> weatherByRegion = new EnumMap<>(Region.class);
            List<EnrichedRecord> enriched = new ArrayList<>(records.size());

            for (GenerationRecord r : records) {
                Region region = regionResolver.resolve(r.getUnitName(), staticMap);
                currentUnits.add(r.getUnitName());
                if (region == Region.UNKNOWN) unknownUnits.add(r.getUnitName());
                WeatherFeatureSet weather = weatherByRegion.computeIfAbsent(region,
                        reg -> weatherEnricher.enrich(reg, effective));
                enriched.add(EnrichedRecord.of(r, region, weather));
            }
            unknownUnits.sort(null);
            log.info("Resolved {} regions, {} unknown units, enriched {} regions with weather",
                    weatherByRegion.size(), unknownUnits.size(),
                    weatherByRegion.values().stream().filter(w -> !w.isEmpty()).count());

            FluctuationTracker.UnitDiff diff = fluctuationTracker.diff(currentUnits, previous.unitNames());
            run.setAddedUnits(diff.added().size());
            run.setMissingUnits(diff.missing().size());

            List<AggregatedRow> rows = aggregator.aggregate(enriched);
            run.setRowsWritten(outputRouter.write(rows));

            runLogWriter.appendFluctuation(fluctuationTracker.describe(timestamp, currentUnits.size(), diff));
            runLogWriter.appendUnknownPlants(timestamp, unknownUnits);
            runLogWriter.appendUnitDetails(enriched);
            log.info("Fluctuation: added {}, missing {}", diff.added().size(), diff.missing().size());

            next = RunState.of(currentUnits);
            run.setStatus(PipelineRun.SUCCESS);

        } catch (FeedFetchException e) {
            log.error("Failed to fetch generation feed: {}", e.getMessage(), e);
            run.setStatus(PipelineRun.FAILED);
            run.setErrorMessage(e.getMessage());
        } catch (RuntimeException e) {
            log.error("Pipeline run for {} failed: {}", EffectiveTimestamps.format(timestamp), e.getMessage(), e);
            run.setStatus(PipelineRun.FAILED);
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(EffectiveTimestamps.localNow(clock, properties.getFeed().zoneId()));
            outputRouter.writePipelineRun(run);
            lastRun.set(run);
            log.info("Pipeline run {} for {} ({} units, {} rows)", run.getStatus(),
                    EffectiveTimestamps.format(timestamp), run.getUnitsFetched(), run.getRowsWritten());
        }

        return new PipelineOutcome(run, next);
    }

    public PipelineRun lastRun() {
        return lastRun.get();
    }

    private void captureDemand(LocalDateTime timestamp) {
        try {
            feedClient.fetchDemandMw().ifPresent(mw -> {
                runLogWriter.appendDemand(timestamp, mw);
                log.info("Saved current demand ({} MW)", mw);
            });
        } catch (RuntimeException e) {
            log.warn("Demand capture failed: {}", e.getMessage());
        }
    }
}
