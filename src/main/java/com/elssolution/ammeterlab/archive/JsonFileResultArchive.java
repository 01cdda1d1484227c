package com.elssolution.ammeterlab.archive;

import com.elssolution.ammeterlab.domain.DeviceKind;
import com.elssolution.ammeterlab.domain.RunStatus;
import com.elssolution.ammeterlab.domain.TestRun;
import com.elssolution.ammeterlab.exception.ArchiveException;
import com.elssolution.ammeterlab.exception.RunNotFoundException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One pretty-printed JSON file per run ({@code yyyyMMdd_<runId>.json}, date of {@code createdAt}
 * in UTC) plus {@code results_index.json} mapping run id to file name and the fields needed to
 * filter and summarize without opening run files.
 *
 * <p>Writes go to a temp file first and are moved into place. The index is rewritten after every
 * store and delete. Mutations are serialized on this instance; reads of run files are not.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "lab.archive.type", havingValue = "file", matchIfMissing = true)
public class JsonFileResultArchive implements ResultArchive {

    static final String INDEX_FILENAME = "results_index.json";
    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd").withZone(ZoneOffset.UTC);

    /** Index row. */
    public record IndexEntry(String filename, Instant createdAt, DeviceKind deviceKind, RunStatus status,
                      int validSamples, int totalSamples) {
    }

    private final Path dir;
    private final ObjectMapper mapper = newMapper();
    private final Map<String, IndexEntry> index = new LinkedHashMap<>();

    public JsonFileResultArchive(@Value("${lab.archive.path:./results}") String path) {
        this.dir = Paths.get(path).toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.dir);
        } catch (IOException e) {
            throw new ArchiveException("cannot create archive directory " + this.dir + ": " + e.getMessage(), e);
        }
        loadIndex();
        log.info("Result archive at {} ({} runs indexed)", this.dir, index.size());
    }

    public Path getDirectory() {
        return dir;
    }

    @Override
    public synchronized void store(TestRun run) {
        if (run == null) throw new ArchiveException("run is required");
        if (!run.status().isTerminal()) {
            throw new ArchiveException("run " + run.runId() + " is still " + run.status());
        }
        if (index.containsKey(run.runId())) {
            throw new ArchiveException("run id already archived: " + run.runId());
        }
        String filename = FILE_DATE.format(run.createdAt()) + "_" + run.runId() + ".json";
        writeAtomically(dir.resolve(filename), run);

        index.put(run.runId(), new IndexEntry(filename, run.createdAt(), run.deviceKind(), run.status(),
                run.validSampleCount(), run.samples().size()));
        try {
            saveIndex();
        } catch (ArchiveException e) {
            index.remove(run.runId());
            deleteQuietly(dir.resolve(filename));
            throw e;
        }
        log.info("run_archived runId={} file={}", run.runId(), filename);
    }

    @Override
    public TestRun get(String runId) {
        IndexEntry entry = entry(runId).orElseThrow(() -> new RunNotFoundException(runId));
        Path file = dir.resolve(entry.filename());
        if (!Files.exists(file)) {
            log.warn("archive_file_missing runId={} file={}", runId, file);
            throw new RunNotFoundException(runId);
        }
        try {
            return mapper.readValue(file.toFile(), TestRun.class);
        } catch (IOException e) {
            throw new ArchiveException("cannot read run " + runId + " from " + file + ": " + e.getMessage(), e);
        }
    }

    /** Index entries are filtered eagerly, run files are read as the stream is consumed. Unreadable files are skipped. */
    @Override
    public Stream<TestRun> query(DeviceKind kind, Instant from, Instant to) {
        List<String> ids;
        synchronized (this) {
            ids = index.entrySet().stream()
                    .filter(e -> kind == null || e.getValue().deviceKind() == kind)
                    .filter(e -> from == null || !e.getValue().createdAt().isBefore(from))
                    .filter(e -> to == null || e.getValue().createdAt().isBefore(to))
                    .sorted(Comparator.comparing((Map.Entry<String, IndexEntry> e) -> e.getValue().createdAt())
                            .reversed()
                            .thenComparing(Map.Entry::getKey))
                    .map(Map.Entry::getKey)
                    .toList();
        }
        return ids.stream()
                .map(this::readForQuery)
                .filter(Objects::nonNull);
    }

    @Override
    public synchronized boolean delete(String runId) {
        IndexEntry removed = index.remove(runId);
        if (removed == null) return false;
        saveIndex();
        deleteQuietly(dir.resolve(removed.filename()));
        log.info("run_deleted runId={}", runId);
        return true;
    }

    @Override
    public synchronized ArchiveSummary summary() {
        return ArchiveSummary.of(index.values().stream()
                .map(e -> new ArchiveSummary.Entry(e.deviceKind(), e.status()))
                .toList());
    }

    // ---------------------- index ----------------------

    private synchronized Optional<IndexEntry> entry(String runId) {
        return Optional.ofNullable(runId == null ? null : index.get(runId));
    }

    private void loadIndex() {
        Path file = dir.resolve(INDEX_FILENAME);
        if (!Files.exists(file)) return;
        try {
            Map<String, IndexEntry> loaded = mapper.readValue(file.toFile(), new TypeReference<LinkedHashMap<String, IndexEntry>>() {});
            index.putAll(loaded);
        } catch (IOException e) {
            throw new ArchiveException("corrupt archive index " + file + ": " + e.getMessage(), e);
        }
    }

    private void saveIndex() {
        writeAtomically(dir.resolve(INDEX_FILENAME), index);
    }

    // ---------------------- file helpers ----------------------

    private TestRun readForQuery(String runId) {
        try {
            return get(runId);
        } catch (RunNotFoundException | ArchiveException e) {
            log.warn("archive_query_skip runId={}: {}", runId, e.getMessage());
            return null;
        }
    }

    private void writeAtomically(Path target, Object value) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), value);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new ArchiveException("cannot write " + target + ": " + e.getMessage(), e);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            log.warn("archive_delete_failed file={}: {}", p, e.toString());
        }
    }

    static ObjectMapper newMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
