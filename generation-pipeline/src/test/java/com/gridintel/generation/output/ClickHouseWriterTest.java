package com.gridintel.generation.output;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.Region;
import com.gridintel.generation.model.WeatherFeatureSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ClickHouseWriterTest {

    // 09:31 in Asia/Taipei
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-01-01T01:31:00Z"), ZoneOffset.UTC);

    @Mock
    private JdbcTemplate mockJdbcTemplate;

    private static final AggregatedRow ROW = AggregatedRow.builder()
            .timestamp(LocalDateTime.of(2025, 1, 1, 9, 30))
            .region(Region.NORTH)
            .fuelType("燃煤(Coal)")
            .netPowerSum(980.5)
            .weather(WeatherFeatureSet.builder().tempNow(18.25).weatherCodeNow(4).build())
            .build();

    @Test
    @DisplayName("toValueRow - quotes strings and writes NULL for missing features")
    void toValueRow_Format() {
        ClickHouseWriter writer = writer();

        String values = writer.toValueRow(ROW, "'2025-01-01 09:31:00'");

        assertThat(values).isEqualTo("('2025-01-01 09:30:00','North','燃煤(Coal)',980.5,18.25,NULL,4,NULL,NULL,NULL,'2025-01-01 09:31:00')");
    }

    @Test
    @DisplayName("write - one INSERT per batch into generation_segments")
    void write_InsertsBatch() {
        ClickHouseWriter writer = writer();
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

        writer.write(List.of(ROW));

        verify(mockJdbcTemplate).execute(sql.capture());
        assertThat(sql.getValue()).contains("INSERT INTO grid_intel.generation_segments").contains("'North'");
    }

    @Test
    @DisplayName("write - nothing to write issues no SQL")
    void write_Empty() {
        writer().write(List.of());

        verifyNoInteractions(mockJdbcTemplate);
    }

    @Test
    @DisplayName("write - ingested_at is feed-zone wall time, not the clock's UTC")
    void write_IngestedAtInFeedZone() {
        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);

        writer().write(List.of(ROW));

        verify(mockJdbcTemplate).execute(sql.capture());
        assertThat(sql.getValue()).contains(",'2025-01-01 09:31:00')")
                .doesNotContain("'2025-01-01 01:31:00'");
    }

    private ClickHouseWriter writer() {
        return new ClickHouseWriter(mockJdbcTemplate, new GenerationPipelineProperties(), CLOCK);
    }
}
