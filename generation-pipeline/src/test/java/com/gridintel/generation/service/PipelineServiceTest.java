package com.gridintel.generation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.config.WeatherProfiles;
import com.gridintel.generation.exception.FeedFetchException;
import com.gridintel.generation.model.GenerationFeedResponse;
import com.gridintel.generation.model.PipelineOutcome;
import com.gridintel.generation.model.PipelineRun;
import com.gridintel.generation.model.RunState;
import com.gridintel.generation.output.ClickHouseWriter;
import com.gridintel.generation.output.OutputRouter;
import com.gridintel.generation.output.RunLogWriter;
import com.gridintel.generation.output.SegmentCsvStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PipelineServiceTest {

    // 09:37 in Asia/Taipei, floors to 09:30
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T01:37:12Z"), ZoneOffset.UTC);
    private static final LocalDateTime EFFECTIVE = LocalDateTime.of(2025, 1, 1, 9, 30);

    @Mock
    private LiveFeedClient mockFeedClient;
    @Mock
    private ClickHouseWriter mockClickHouseWriter;

    @TempDir
    Path tempDir;

    private GenerationPipelineProperties properties;
    private RunStateStore runStateStore;
    private SegmentCsvStore segmentCsvStore;
    private PipelineService pipelineService;

    @BeforeEach
    void setUp() {
        properties = new GenerationPipelineProperties();
        properties.getStorage().setBaseDir(tempDir.toString());
        ObjectMapper objectMapper = new ObjectMapper();

        runStateStore = new RunStateStore(objectMapper, properties);
        segmentCsvStore = new SegmentCsvStore(properties);
        ForecastCacheRepository forecastCache =
                new ForecastCacheRepository(objectMapper, new ForecastDocumentParser(), properties);

        pipelineService = new PipelineService(
                mockFeedClient,
                new GenerationFeedParser(),
                new StaticRegionMapLoader(properties),
                new RegionResolver(),
                new FluctuationTracker(),
                new WeatherEnricher(new WeatherProfiles(), forecastCache, new ForecastIndex()),
                new GenerationAggregator(),
                new OutputRouter(segmentCsvStore, mockClickHouseWriter, properties),
                new RunLogWriter(properties),
                runStateStore,
                properties,
                CLOCK);
    }

    @Test
    @DisplayName("runOnce - success persists segments, logs and the next state")
    void runOnce_Success() throws Exception {
        // Arrange
        when(mockFeedClient.fetchGeneration()).thenReturn(feed());
        when(mockFeedClient.fetchDemandMw()).thenReturn(OptionalDouble.of(31250.0));
        runStateStore.save(RunState.of(List.of("林口#1", "大潭#7")));

        // Act
        PipelineOutcome outcome = pipelineService.runOnce();

        // Assert
        PipelineRun run = outcome.run();
        assertThat(run.getStatus()).isEqualTo(PipelineRun.SUCCESS);
        assertThat(run.getEffectiveTimestamp()).isEqualTo(EFFECTIVE);
        assertThat(run.getStartedAt()).isEqualTo(LocalDateTime.of(2025, 1, 1, 9, 37, 12));
        assertThat(run.getCompletedAt()).isEqualTo(LocalDateTime.of(2025, 1, 1, 9, 37, 12));
        assertThat(run.getUnitsFetched()).isEqualTo(4);
        assertThat(run.getRowsWritten()).isEqualTo(3);
        assertThat(run.getAddedUnits()).isEqualTo(3);
        assertThat(run.getMissingUnits()).isEqualTo(1);
        assertThat(pipelineService.lastRun()).isSameAs(run);

        assertThat(runStateStore.load().unitNames())
                .containsExactlyInAnyOrder("林口#1", "林口#2", "彰工風力", "XYZ-9");

        assertThat(segmentCsvStore.listTables()).extracting(p -> p.getFileName().toString())
                .containsExactlyInAnyOrder("North_燃煤.csv", "Central_風力.csv", "Unknown_燃氣.csv");
        List<Map<String, String>> coal = segmentCsvStore.readTable(
                tempDir.resolve("final_data/North/North_燃煤.csv"));
        assertThat(coal).singleElement().satisfies(r -> {
            assertThat(r.get("DATETIME")).isEqualTo("2025-01-01 09:30:00");
            assertThat(r.get("NET_P")).isEqualTo("980.5");
            assertThat(r.get("TEMP_now")).isEmpty();
        });

        String fluctuation = read("fluctuation_log.txt");
        assertThat(fluctuation).startsWith("--- Fluctuation Report @ 2025-01-01 09:30:00 (4 plants) ❌ ---")
                .contains("[ADDED] XYZ-9, 彰工風力, 林口#2")
                .contains("[MISSING] 大潭#7");
        assertThat(read("unknown_plants_log.txt")).contains("Unknown Plants Detected").contains("XYZ-9");
        assertThat(read("unit_details_log.csv")).contains("DATETIME,UNIT_NAME,REGION,FUEL_TYPE".replace(",", "\",\""));
        assertThat(read("electricity_demand.csv")).contains("31250.0");
        verifyNoInteractions(mockClickHouseWriter);
    }

    @Test
    @DisplayName("runOnce - fetch failure leaves tables, logs and state untouched")
    void runOnce_FetchFailure() throws Exception {
        // Arrange
        when(mockFeedClient.fetchGeneration()).thenThrow(new FeedFetchException("connect timed out"));
        runStateStore.save(RunState.of(List.of("林口#1")));
        String stateBefore = read("last_run_units.json");

        // Act
        PipelineOutcome outcome = pipelineService.runOnce();

        // Assert
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.run().getStatus()).isEqualTo(PipelineRun.FAILED);
        assertThat(outcome.run().getErrorMessage()).contains("connect timed out");
        assertThat(outcome.nextState().unitNames()).containsExactly("林口#1");
        assertThat(read("last_run_units.json")).isEqualTo(stateBefore);
        assertThat(tempDir.resolve("final_data")).doesNotExist();
        assertThat(tempDir.resolve("fluctuation_log.txt")).doesNotExist();
        verify(mockFeedClient, never()).fetchDemandMw();
    }

    @Test
    @DisplayName("runOnce - state file with a null unit counts every unit as added")
    void runOnce_NullEntryInStateFile() throws Exception {
        when(mockFeedClient.fetchGeneration()).thenReturn(feed());
        when(mockFeedClient.fetchDemandMw()).thenReturn(OptionalDouble.empty());
        Files.writeString(properties.getStorage().resolve(properties.getStorage().getStateFile()),
                "[\"林口#1\", null]", StandardCharsets.UTF_8);

        PipelineOutcome outcome = pipelineService.runOnce();

        assertThat(outcome.run().getStatus()).isEqualTo(PipelineRun.SUCCESS);
        assertThat(outcome.run().getAddedUnits()).isEqualTo(4);
        assertThat(runStateStore.load().unitNames()).hasSize(4);
    }

    @Test
    @DisplayName("runOnce - two runs in the same slot keep one row per timestamp")
    void runOnce_SameTimestampTwice() throws Exception {
        when(mockFeedClient.fetchGeneration()).thenReturn(feed());
        when(mockFeedClient.fetchDemandMw()).thenReturn(OptionalDouble.empty());

        pipelineService.runOnce();
        PipelineOutcome second = pipelineService.runOnce();

        assertThat(second.run().getAddedUnits()).isZero();
        assertThat(second.run().getMissingUnits()).isZero();
        assertThat(segmentCsvStore.readTable(tempDir.resolve("final_data/North/North_燃煤.csv"))).hasSize(1);
        assertThat(read("fluctuation_log.txt")).contains("(4 plants) ✅");
        assertThat(tempDir.resolve("electricity_demand.csv")).doesNotExist();
    }

    @Test
    @DisplayName("runOnce - feed without generator rows is skipped and writes nothing")
    void runOnce_EmptyFeedSkipped() {
        GenerationFeedResponse feed = new GenerationFeedResponse();
        feed.setRows(List.of(List.of("<b>燃煤</b>", "", "小計", "", "980.5")));
        when(mockFeedClient.fetchGeneration()).thenReturn(feed);

        PipelineOutcome outcome = pipelineService.runOnce();

        assertThat(outcome.run().getStatus()).isEqualTo(PipelineRun.SKIPPED);
        assertThat(outcome.succeeded()).isFalse();
        assertThat(tempDir.resolve("last_run_units.json")).doesNotExist();
        assertThat(tempDir.resolve("final_data")).doesNotExist();
    }

    @Test
    @DisplayName("run - does not touch the state store itself")
    void run_ReturnsNextStateWithoutSaving() {
        when(mockFeedClient.fetchGeneration()).thenReturn(feed());
        when(mockFeedClient.fetchDemandMw()).thenReturn(OptionalDouble.empty());

        PipelineOutcome outcome = pipelineService.run(RunState.empty());

        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.nextState().unitNames()).hasSize(4);
        assertThat(tempDir.resolve("last_run_units.json")).doesNotExist();
    }

    private String read(String name) throws Exception {
        return Files.readString(tempDir.resolve(name), StandardCharsets.UTF_8);
    }

    private static GenerationFeedResponse feed() {
        GenerationFeedResponse feed = new GenerationFeedResponse();
        feed.setRows(List.of(
                List.of("<b>燃煤</b>", "", "林口#1", "", "500"),
                List.of("<b>燃煤</b>", "", "林口#2", "", "480.5"),
                List.of("<b>燃煤</b>", "", "小計", "", "980.5"),
                List.of("<b>風力</b>", "", "彰工風力", "", "12"),
                List.of("<b>燃氣</b>", "", "XYZ-9", "", "1,000")));
        return feed;
    }
}
