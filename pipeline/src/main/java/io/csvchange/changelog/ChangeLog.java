package io.csvchange.changelog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.csvchange.csv.CsvFormat;
import io.csvchange.csv.CsvParser;
import io.csvchange.json.Json;
import io.csvchange.monitor.ChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Append-only journal of processed changes, one JSON object per line in {@code csv-changes.jsonl}.
 * <p>
 * Sequence numbers increase by one per entry and survive restarts. A torn last line (crash mid-append) is skipped
 * on load with a warning.
 */
public class ChangeLog {
    private static final Logger log = LoggerFactory.getLogger(ChangeLog.class);
    public static final String LOG_FILE = "csv-changes.jsonl";
    static final List<String> CSV_HEADER = List.of("ID", "Timestamp", "Filename", "Change Type", "File Size",
            "Previous Hash", "Current Hash", "Description");

    private final Path file;
    private final Clock clock;
    private final ObjectMapper mapper = Json.compactMapper();

    private final List<ChangeLogEntry> entries = new ArrayList<>();
    private long lastSequence;
    private boolean loaded;

    public ChangeLog(Path logDir, Clock clock) {
        this.file = logDir.resolve(LOG_FILE);
        this.clock = clock;
    }

    public Path file() { return file; }

    public synchronized void initialize() throws IOException {
        if (loaded) return;
        Files.createDirectories(file.getParent());
        entries.clear();
        lastSequence = 0;
        if (Files.exists(file)) {
            int lineNo = 0;
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                lineNo++;
                if (line.isBlank()) continue;
                try {
                    ChangeLogEntry e = mapper.readValue(line, ChangeLogEntry.class);
                    entries.add(e);
                    lastSequence = Math.max(lastSequence, e.sequence());
                } catch (JsonProcessingException e) {
                    log.warn("Skipping unreadable change log line {} in {}: {}", lineNo, file, e.getOriginalMessage());
                }
            }
            terminateTornLine();
        }
        loaded = true;
        log.debug("Change log {} loaded with {} entries", file, entries.size());
    }

    // A crash mid-append can leave the last line without its newline.
    private void terminateTornLine() throws IOException {
        try (SeekableByteChannel ch = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = ch.size();
            if (size == 0) return;
            ByteBuffer last = ByteBuffer.allocate(1);
            ch.position(size - 1);
            ch.read(last);
            if (last.get(0) == '\n') return;
        }
        log.warn("Change log {} ends without a newline, terminating the torn line", file);
        Files.writeString(file, "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
    }

    /**
     * Appends one entry for {@code event}. The line is written before the entry becomes visible to queries.
     */
    public synchronized ChangeLogEntry log(ChangeEvent event, ChangeLogMetadata metadata) throws IOException {
        initialize();
        long seq = lastSequence + 1;
        Instant now = clock.instant();
        ChangeLogEntry entry = new ChangeLogEntry(
                String.format(Locale.ROOT, "%d-%06d", now.toEpochMilli(), seq),
                seq,
                event.timestamp() != null ? event.timestamp() : now,
                event.path().toAbsolutePath().toString(),
                event.kind(),
                event.previousDigest(),
                event.currentDigest(),
                event.kind().carriesContent() ? event.size() : null,
                metadata == null ? ChangeLogMetadata.empty() : metadata,
                describe(event));
        String line = mapper.writeValueAsString(entry) + "\n";
        Files.writeString(file, line, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        entries.add(entry);
        lastSequence = seq;
        return entry;
    }

    public synchronized List<ChangeLogEntry> query(ChangeLogQuery q) throws IOException {
        initialize();
        List<ChangeLogEntry> matched = entries.stream()
                .filter(q::matches)
                .sorted(Comparator.comparing(ChangeLogEntry::timestamp)
                        .thenComparingLong(ChangeLogEntry::sequence).reversed())
                .collect(Collectors.toList());
        int from = Math.min(Math.max(0, q.offset()), matched.size());
        int to = q.limit() > 0 ? Math.min(matched.size(), from + q.limit()) : matched.size();
        return List.copyOf(matched.subList(from, to));
    }

    public List<ChangeLogEntry> recent(int limit) throws IOException {
        return query(ChangeLogQuery.all().page(limit, 0));
    }

    public List<ChangeLogEntry> fileChanges(Path path, int limit) throws IOException {
        return query(ChangeLogQuery.all().forFile(path.toAbsolutePath().toString()).page(limit, 0));
    }

    public synchronized ChangeLogSummary summary() throws IOException {
        initialize();
        Map<String, Integer> byType = new TreeMap<>();
        Map<String, Integer> byFile = new TreeMap<>();
        Instant first = null;
        Instant last = null;
        for (ChangeLogEntry e : entries) {
            byType.merge(e.changeType().name().toLowerCase(Locale.ROOT), 1, Integer::sum);
            byFile.merge(Path.of(e.filename()).getFileName().toString(), 1, Integer::sum);
            if (first == null || e.timestamp().isBefore(first)) first = e.timestamp();
            if (last == null || e.timestamp().isAfter(last)) last = e.timestamp();
        }
        return new ChangeLogSummary(entries.size(), byType, byFile, first, last);
    }

    /** Exports every entry, newest first. */
    public String export(ExportFormat format) throws IOException {
        List<ChangeLogEntry> all = query(ChangeLogQuery.all());
        if (format == ExportFormat.JSON) {
            return Json.prettyMapper().writeValueAsString(all);
        }
        CsvParser csv = new CsvParser(CsvFormat.DEFAULT);
        StringBuilder sb = new StringBuilder(csv.formatRecord(CSV_HEADER)).append('\n');
        for (ChangeLogEntry e : all) {
            sb.append(csv.formatRecord(List.of(
                    e.id(),
                    e.timestamp().toString(),
                    e.filename(),
                    e.changeType().name().toLowerCase(Locale.ROOT),
                    e.fileSize() == null ? "" : String.valueOf(e.fileSize()),
                    nullToEmpty(e.previousHash()),
                    nullToEmpty(e.currentHash()),
                    nullToEmpty(e.description())))).append('\n');
        }
        return sb.toString();
    }

    /** One display line: {@code [timestamp] TYPE: name (x.xKB) [n rows]}. */
    public static String format(ChangeLogEntry e) {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(e.timestamp()).append("] ")
                .append(e.changeType().name()).append(": ")
                .append(Path.of(e.filename()).getFileName());
        if (e.fileSize() != null) {
            sb.append(String.format(Locale.ROOT, " (%.1fKB)", e.fileSize() / 1024.0));
        }
        if (e.metadata() != null && e.metadata().rowCount() != null) {
            sb.append(" [").append(e.metadata().rowCount()).append(" rows]");
        }
        return sb.toString();
    }

    private static String describe(ChangeEvent event) {
        String name = event.path().getFileName().toString();
        return switch (event.kind()) {
            case ADDED -> "File " + name + " was created";
            case DELETED -> "File " + name + " was deleted";
            case RENAMED -> "File " + name + " was renamed";
            case CHANGED -> "File " + name + " was modified (" + event.size() + " bytes)";
        };
    }

    private static String nullToEmpty(String s) { return s == null ? "" : s; }
}
