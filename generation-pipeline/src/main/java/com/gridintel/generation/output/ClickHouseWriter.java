package com.gridintel.generation.output;

import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.AggregatedRow;
import com.gridintel.generation.model.PipelineRun;
import com.gridintel.generation.model.WeatherFeatureSet;
import com.gridintel.generation.service.EffectiveTimestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Optional mirror of the segment tables in ClickHouse.
 *
 * generation_segments is a ReplacingMergeTree keyed on (region, fuel_type, ts),
 * so re-running a timestamp collapses to the latest ingested row on merge and
 * queries with FINAL see one row per key.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ClickHouseWriter {

    private static final int BATCH_SIZE = 1000;
    private final JdbcTemplate jdbcTemplate;
    private final GenerationPipelineProperties properties;
    private final Clock clock;

    public void ensureSchema() {
        log.info("Ensuring ClickHouse schema exists...");

        jdbcTemplate.execute("CREATE DATABASE IF NOT EXISTS grid_intel");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS grid_intel.generation_segments
            (
                ts                  DateTime,
                region              LowCardinality(String),
                fuel_type           LowCardinality(String),
                net_p               Float64,
                temp_now            Nullable(Float64),
                wind_now            Nullable(Float64),
                w_code_now          Nullable(Int32),
                temp_future_12h     Nullable(Float64),
                wind_future_12h     Nullable(Float64),
                w_code_future_12h   Nullable(Int32),
                ingested_at         DateTime
            )
            ENGINE = ReplacingMergeTree(ingested_at)
            PARTITION BY toYYYYMM(ts)
            ORDER BY (region, fuel_type, ts)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS grid_intel.pipeline_runs
            (
                run_id              String,
                effective_ts        Nullable(DateTime),
                started_at          DateTime,
                completed_at        Nullable(DateTime),
                status              LowCardinality(String),
                units_fetched       Int32,
                rows_written        Int32,
                added_units         Int32,
                missing_units       Int32,
                error_message       Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, run_id)
        """);

        log.info("ClickHouse schema ready.");
    }

    public void write(List<AggregatedRow> rows) {
        if (rows.isEmpty()) return;

        int total = rows.size();
        String ingestedAt = sqlStr(EffectiveTimestamps.format(
                EffectiveTimestamps.localNow(clock, properties.getFeed().zoneId())));
        log.info("Writing {} segment rows to ClickHouse in batches of {}", total, BATCH_SIZE);

        for (int i = 0; i < total; i += BATCH_SIZE) {
            List<AggregatedRow> batch = rows.subList(i, Math.min(i + BATCH_SIZE, total));
            try {
                writeBatchAsValues(batch, ingestedAt);
                log.debug("Wrote batch {}/{}", Math.min(i + BATCH_SIZE, total), total);
            } catch (Exception e) {
                log.error("Batch write failed at offset {}: {}", i, e.getMessage(), e);
                throw e;
            }
        }

        log.info("Successfully wrote {} segment rows", total);
    }

    private void writeBatchAsValues(List<AggregatedRow> batch, String ingestedAt) {
        StringBuilder sql = new StringBuilder("""
            INSERT INTO grid_intel.generation_segments
            (ts, region, fuel_type, net_p, temp_now, wind_now, w_code_now,
             temp_future_12h, wind_future_12h, w_code_future_12h, ingested_at)
            VALUES
            """);

        sql.append(batch.stream()
                .map(r -> toValueRow(r, ingestedAt))
                .collect(Collectors.joining(",\n")));

        jdbcTemplate.execute(sql.toString());
    }

    String toValueRow(AggregatedRow r, String ingestedAt) {
        WeatherFeatureSet w = r.getWeather() == null ? WeatherFeatureSet.EMPTY : r.getWeather();
        return String.format("(%s,%s,%s,%s,%s,%s,%s,%s,%s,%s,%s)",
                sqlStr(EffectiveTimestamps.format(r.getTimestamp())),
                sqlStr(r.getRegion().label()),
                sqlStr(r.getFuelType()),
                r.getNetPowerSum(),
                sqlNum(w.getTempNow()),
                sqlNum(w.getWindNow()),
                sqlNum(w.getWeatherCodeNow()),
                sqlNum(w.getTempFuture12h()),
                sqlNum(w.getWindFuture12h()),
                sqlNum(w.getWeatherCodeFuture12h()),
                ingestedAt
        );
    }

    private String sqlStr(Object val) {
        if (val == null) return "NULL";
        return "'" + val.toString().replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private String sqlNum(Number val) {
        return val == null ? "NULL" : val.toString();
    }

    public void writePipelineRun(PipelineRun run) {
        try {
            String sql = String.format("""
                INSERT INTO grid_intel.pipeline_runs
                (run_id, effective_ts, started_at, completed_at, status,
                 units_fetched, rows_written, added_units, missing_units, error_message)
                VALUES (%s,%s,%s,%s,%s,%d,%d,%d,%d,%s)
                """,
                    sqlStr(run.getRunId()),
                    sqlStr(run.getEffectiveTimestamp() == null ? null : EffectiveTimestamps.format(run.getEffectiveTimestamp())),
                    sqlStr(EffectiveTimestamps.format(run.getStartedAt())),
                    sqlStr(run.getCompletedAt() == null ? null : EffectiveTimestamps.format(run.getCompletedAt())),
                    sqlStr(run.getStatus()),
                    run.getUnitsFetched(),
                    run.getRowsWritten(),
                    run.getAddedUnits(),
                    run.getMissingUnits(),
                    sqlStr(run.getErrorMessage())
            );
            jdbcTemplate.execute(sql);
        } catch (Exception e) {
            log.warn("Failed to write pipeline run: {}", e.getMessage());
        }
    }
}
