package org.carball.materializer.state;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.materializer.model.backfill.BackfillJob;
import org.carball.materializer.model.candidate.MaterializationCandidate;
import org.carball.materializer.model.query.PropertyKey;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Keeps the whole state in memory and rewrites a JSON file on every change.
 * Each write goes to a temporary file that is then moved over the old one.
 */
@Slf4j
public class JsonFileStateStore implements StateStore {

    static final String FILE_NAME = "state.json";

    private final Path file;
    private final ObjectMapper objectMapper;
    private final StateData data;

    public JsonFileStateStore(Path stateDirectory) throws IOException {
        Files.createDirectories(stateDirectory);
        this.file = stateDirectory.resolve(FILE_NAME);

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        if (Files.exists(file)) {
            this.data = objectMapper.readValue(file.toFile(), StateData.class);
            log.info("Loaded state from {}: {} candidates, {} backfill jobs",
                    file, data.getCandidates().size(), data.getJobs().size());
        } else {
            this.data = new StateData();
            log.info("No state at {}, starting empty", file);
        }
    }

    @Override
    public synchronized Optional<MaterializationCandidate> findCandidate(PropertyKey key) {
        return Optional.ofNullable(data.getCandidates().get(key.asStateKey())).map(JsonFileStateStore::copy);
    }

    @Override
    public synchronized List<MaterializationCandidate> candidates() {
        return data.getCandidates().values().stream()
                .map(JsonFileStateStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void saveCandidate(MaterializationCandidate candidate) {
        data.getCandidates().put(candidate.getKey().asStateKey(), copy(candidate));
        flush();
    }

    @Override
    public synchronized Optional<BackfillJob> findJob(PropertyKey key) {
        return Optional.ofNullable(data.getJobs().get(key.asStateKey())).map(JsonFileStateStore::copy);
    }

    @Override
    public synchronized List<BackfillJob> jobs() {
        return data.getJobs().values().stream()
                .map(JsonFileStateStore::copy)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void saveJob(BackfillJob job) {
        data.getJobs().put(job.getKey().asStateKey(), copy(job));
        flush();
    }

    @Override
    public synchronized Set<PropertyKey> blockedKeys() {
        return data.getCandidates().values().stream()
                .filter(candidate -> candidate.getState().blocksReselection())
                .map(MaterializationCandidate::getKey)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    private void flush() {
        Path temp = file.resolveSibling(FILE_NAME + ".tmp");
        try {
            objectMapper.writeValue(temp.toFile(), data);
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.error("Failed to persist state to {}", file, e);
            throw new UncheckedIOException("Failed to persist state to " + file, e);
        }
    }

    private static MaterializationCandidate copy(MaterializationCandidate candidate) {
        return candidate.toBuilder().build();
    }

    private static BackfillJob copy(BackfillJob job) {
        return job.toBuilder().partitions(new ArrayList<>(job.getPartitions())).build();
    }

    @Data
    static class StateData {
        private Map<String, MaterializationCandidate> candidates = new TreeMap<>();
        private Map<String, BackfillJob> jobs = new TreeMap<>();
    }
}
