package com.gridintel.generation.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridintel.generation.config.GenerationPipelineProperties;
import com.gridintel.generation.model.RunState;
import com.gridintel.generation.output.CsvFiles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Persists {@link RunState} as a JSON array of unit names.
 *
 * Saves go to a sibling temp file that is then moved over the real one, so an
 * interrupted write never leaves a truncated state file behind.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RunStateStore {

    private static final TypeReference<List<String>> UNIT_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;
    private final GenerationPipelineProperties properties;

    /** Absent or corrupt state reads as empty: every current unit then counts as added. */
    public RunState load() {
        Path path = statePath();
        if (!Files.exists(path)) {
            log.info("No previous run state at {}, starting fresh", path);
            return RunState.empty();
        }
        try {
            List<String> units = objectMapper.readValue(path.toFile(), UNIT_LIST);
            if (units == null || units.stream().anyMatch(u -> u == null || u.isBlank())) {
                log.warn("Run state {} holds null or blank unit names, treating previous units as empty", path);
                return RunState.empty();
            }
            return RunState.of(units);
        } catch (IOException | RuntimeException e) {
            log.warn("Run state {} is unreadable, treating previous units as empty: {}", path, e.getMessage());
            return RunState.empty();
        }
    }

    public void save(RunState state) {
        Path path = statePath();
        if (path.getParent() != null) CsvFiles.ensureDirectory(path.getParent());
        Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
        try {
            objectMapper.writeValue(tmp.toFile(), List.copyOf(state.unitNames()));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write run state " + path, e);
        }
        CsvFiles.replace(tmp, path);
        log.debug("Saved run state with {} units", state.unitNames().size());
    }

    private Path statePath() {
        return properties.getStorage().resolve(properties.getStorage().getStateFile());
    }
}
