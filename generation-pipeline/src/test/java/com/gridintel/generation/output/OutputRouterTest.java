package com.gridintel.generation.output;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.PipelineRun;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.WeatherFeatureSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class OutputRouterTest {

    @Mock
    private SegmentCsvStore mockSegmentCsvStore;
    @Mock
    private ClickHouseWriter mockClickHouseWriter;

    private final List<AggregatedRow> rows = List.of(AggregatedRow.builder()
            .timestamp(LocalDateTime.of(2025, 1, 1, 9, 30))
            .region(Region.NORTH)
            .fuelType("燃煤(Coal)")
            .netPowerSum(980.5)
            .weather(WeatherFeatureSet.EMPTY)
            .build());

    @Test
    @DisplayName("write - without the mirror only the segment tables are written")
    void write_SegmentTablesOnly() {
        OutputRouter router = router(false);

        assertThat(router.write(rows)).isEqualTo(1);

        verify(mockSegmentCsvStore).upsert(rows);
        verifyNoInteractions(mockClickHouseWriter);
        assertThat(router.clickHouseEnabled()).isFalse();
    }

    @Test
    @DisplayName("write - with the mirror enabled the segment tables are still written")
    void write_MirrorStillWritesSegmentTables() {
        OutputRouter router = router(true);

        router.write(rows);

        verify(mockSegmentCsvStore).upsert(rows);
        verify(mockClickHouseWriter).write(rows);
        assertThat(router.clickHouseEnabled()).isTrue();
    }

    @Test
    @DisplayName("writePipelineRun - skipped without the mirror")
    void writePipelineRun_NoMirror() {
        router(false).writePipelineRun(PipelineRun.builder().runId("r1").status(PipelineRun.SUCCESS).build());

        verifyNoInteractions(mockClickHouseWriter);
    }

    @Test
    @DisplayName("writePipelineRun - metadata failures never propagate")
    void writePipelineRun_SwallowsSinkFailure() {
        OutputRouter router = router(true);
        doThrow(new IllegalStateException("ClickHouse down")).when(mockClickHouseWriter).writePipelineRun(any());

        router.writePipelineRun(PipelineRun.builder().runId("r1").status(PipelineRun.FAILED).build());

        verify(mockClickHouseWriter).writePipelineRun(any());
        verifyNoInteractions(mockSegmentCsvStore);
    }

    private OutputRouter router(boolean clickhouseMirror) {
        GenerationPipelineProperties properties = new GenerationPipelineProperties();
        properties.getOutput().setClickhouseMirror(clickhouseMirror);
        return new OutputRouter(mockSegmentCsvStore, mockClickHouseWriter, properties);
    }
}
