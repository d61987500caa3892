package io.csvchange.backup;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.csvchange.json.Json;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Persistent list of {@link BackupRecord}s plus the per-path version high-water marks.
 * <p>
 * Every mutation persists before it becomes visible; if writing fails the in-memory state is left as it was.
 * Both files are replaced atomically (temp file, then rename).
 */
public class BackupIndex {
    private static final TypeReference<List<BackupRecord>> RECORDS = new TypeReference<>() {};
    private static final TypeReference<Map<String, Integer>> VERSIONS = new TypeReference<>() {};

    private final Path indexFile;
    private final Path versionsFile;
    private final ObjectMapper mapper = Json.prettyMapper();

    private List<BackupRecord> records = List.of();
    private Map<String, Integer> highWater = new TreeMap<>();

    public BackupIndex(Path indexFile, Path versionsFile) {
        this.indexFile = indexFile;
        this.versionsFile = versionsFile;
    }

    public synchronized void load() throws IOException {
        records = Files.exists(indexFile)
                ? List.copyOf(mapper.readValue(indexFile.toFile(), RECORDS))
                : List.of();
        highWater = Files.exists(versionsFile)
                ? new TreeMap<>(mapper.readValue(versionsFile.toFile(), VERSIONS))
                : new TreeMap<>();
        for (BackupRecord r : records) highWater.merge(r.originalPath(), r.version(), Math::max);
    }

    public synchronized List<BackupRecord> records() { return records; }

    public synchronized Optional<BackupRecord> find(String id) {
        return records.stream().filter(r -> r.id().equals(id)).findFirst();
    }

    /** Next unused version for {@code originalPath}; versions are never handed out twice, even after deletion. */
    public synchronized int nextVersion(String originalPath) {
        int max = highWater.getOrDefault(originalPath, 0);
        for (BackupRecord r : records) {
            if (r.originalPath().equals(originalPath)) max = Math.max(max, r.version());
        }
        return max + 1;
    }

    public synchronized void add(BackupRecord record) throws IOException {
        List<BackupRecord> next = new ArrayList<>(records);
        next.add(record);
        Map<String, Integer> nextHigh = new TreeMap<>(highWater);
        nextHigh.merge(record.originalPath(), record.version(), Math::max);
        persist(next, nextHigh);
        records = List.copyOf(next);
        highWater = nextHigh;
    }

    public synchronized void removeAll(Collection<String> ids) throws IOException {
        List<BackupRecord> next = new ArrayList<>(records);
        if (!next.removeIf(r -> ids.contains(r.id()))) return;
        persist(next, highWater);
        records = List.copyOf(next);
    }

    // Index first; load() re-derives high-water marks from the records.
    private void persist(List<BackupRecord> nextRecords, Map<String, Integer> nextHigh) throws IOException {
        writeAtomically(indexFile, mapper.writeValueAsString(nextRecords));
        try {
            writeAtomically(versionsFile, mapper.writeValueAsString(nextHigh));
        } catch (IOException e) {
            try {
                writeAtomically(indexFile, mapper.writeValueAsString(records));
            } catch (IOException rollback) {
                e.addSuppressed(rollback);
            }
            throw e;
        }
    }

    static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        moveReplacing(tmp, target);
    }

    static void moveReplacing(Path from, Path to) throws IOException {
        try {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
