package com.gridintel.generation.service;

import com.gridintel.generation.exception.FeedFetchException;
import com.gridintel.generation.model.FuelTypes;
import com.gridintel.generation.model.GenerationFeedResponse;
import com.gridintel.generation.model.GenerationRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses raw feed rows into GenerationRecord domain objects.
 *
 * Feed row columns (positional, all strings):
 *   [0] fuel group label wrapped in &lt;b&gt;..&lt;/b&gt; plus HTML noise,
 *   [1] capacity, [2] unit name, [3] installed, [4] net power (MW, comma thousands)
 *
 * Subtotal rows, load rows and rows whose power is not a plain number are dropped.
 */
@Component
@Slf4j
public class GenerationFeedParser {

    private static final int COL_LABEL     = 0;
    private static final int COL_UNIT_NAME = 2;
    private static final int COL_NET_POWER = 4;

    private static final String SUBTOTAL_MARKER = "小計";
    private static final String LOAD_MARKER = "Load";

    private static final Pattern BOLD_LABEL = Pattern.compile("<b>(.*?)</b>");
    private static final Pattern PLAIN_NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    /**
     * @throws FeedFetchException when the feed carries no row array at all
     */
    public List<GenerationRecord> parse(GenerationFeedResponse feed, LocalDateTime timestamp) {
        if (feed == null || feed.getRows() == null) {
            throw new FeedFetchException("Generation feed has no 'aaData' row array");
        }

        List<GenerationRecord> records = new ArrayList<>();
        int skipped = 0;

        for (List<String> row : feed.getRows()) {
            GenerationRecord record = parseRow(row, timestamp);
            if (record == null) {
                skipped++;
            } else {
                records.add(record);
            }
        }

        log.info("Parsed generation feed: {} unit records, {} rows skipped", records.size(), skipped);
        return records;
    }

    private GenerationRecord parseRow(List<String> row, LocalDateTime timestamp) {
        if (row == null || row.size() <= COL_NET_POWER) return null;

        String rawUnit = safeGet(row, COL_UNIT_NAME);
        if (rawUnit.contains(SUBTOTAL_MARKER)) return null;

        String unitName = rawUnit.trim();
        Matcher label = BOLD_LABEL.matcher(safeGet(row, COL_LABEL));
        if (!label.find() || unitName.isEmpty() || label.group(1).contains(LOAD_MARKER)) return null;

        String power = safeGet(row, COL_NET_POWER).replace(",", "").trim();
        if (!PLAIN_NUMBER.matcher(power).matches()) return null;

        return GenerationRecord.builder()
                .timestamp(timestamp)
                .unitName(unitName)
                .fuelType(FuelTypes.toBilingual(label.group(1)))
                .netPower(Double.parseDouble(power))
                .build();
    }

    private String safeGet(List<String> row, int idx) {
        if (idx >= row.size()) return "";
        String val = row.get(idx);
        return val == null ? "" : val;
    }
}
