package io.csvchange.diff;

import com.codahale.metrics.Timer;
import io.csvchange.csv.CsvParseException;
import io.csvchange.csv.CsvParser;
import io.csvchange.csv.CsvTable;
import io.csvchange.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Compares two versions of a delimited file. See {@link RowMatcher} for how rows are paired.
 */
public class CsvDiffEngine {
    private static final Logger log = LoggerFactory.getLogger(CsvDiffEngine.class);

    private final DiffOptions options;
    private final Clock clock;
    private final Timer timer;

    public CsvDiffEngine(DiffOptions options, Clock clock, Metrics metrics) {
        this.options = Objects.requireNonNull(options);
        this.clock = Objects.requireNonNull(clock);
        this.timer = metrics.timer("diff.time");
    }

    public DiffOptions options() { return options; }

    /** Compares with the configured options; the configured filter, if any, is applied as a final pass. */
    public DiffResult compareFiles(Path oldFile, Path newFile) throws DiffException {
        return compareFiles(oldFile, newFile, options);
    }

    public DiffResult compareFiles(Path oldFile, Path newFile, DiffOptions opts) throws DiffException {
        String oldText = read(oldFile);
        String newText = read(newFile);
        return compareText(oldText, newText, oldFile.toString(), newFile.toString(), opts);
    }

    public DiffResult compareText(String oldText, String newText, String oldLabel, String newLabel, DiffOptions opts)
            throws DiffException {
        long t0 = System.nanoTime();
        try (Timer.Context ignored = timer.time()) {
            DiffResult raw = switch (opts.mode()) {
                case TEXT -> textDiff(oldText, newText, oldLabel, newLabel, opts, t0);
                case SCHEMA -> schemaDiff(parse(oldText, oldLabel, opts), parse(newText, newLabel, opts), oldLabel, newLabel, opts, t0);
                case STRUCTURED -> structured(oldText, newText, oldLabel, newLabel, opts, false, t0);
                case HYBRID -> structured(oldText, newText, oldLabel, newLabel, opts, true, t0);
            };
            log.debug("Compared {} with {} ({}): {} changes", oldLabel, newLabel, opts.mode(), raw.statistics().changes().total());
            return opts.filter().isEmpty() ? raw : applyFilters(raw, opts.filter(), opts.topColumns());
        }
    }

    private DiffResult textDiff(String oldText, String newText, String oldLabel, String newLabel, DiffOptions opts, long t0) {
        List<String> a = TextDiff.lines(oldText);
        List<String> b = TextDiff.lines(newText);
        List<TextDiff.Edit> edits = TextDiff.diff(a, b);
        int added = TextDiff.count(edits, TextDiff.Op.INSERT);
        int removed = TextDiff.count(edits, TextDiff.Op.DELETE);
        int modified = Math.min(added, removed);
        added -= modified;
        removed -= modified;
        int maxLines = Math.max(a.size(), b.size());
        DiffStatistics.Changes changes = new DiffStatistics.Changes(added, removed, modified, 0,
                Math.max(0, Math.min(a.size(), b.size()) - modified));
        DiffStatistics stats = new DiffStatistics(new DiffStatistics.Counts(a.size(), b.size()), new DiffStatistics.Counts(0, 0),
                changes, List.of(), percent(changes.total(), maxLines), List.of());
        String patch = TextDiff.unified(fileName(oldLabel), fileName(newLabel), edits, TextDiff.DEFAULT_CONTEXT);
        return new DiffResult(DiffMode.TEXT, clock.instant(), new DiffResult.SourceFiles(oldLabel, newLabel), stats,
                List.of(), List.of(), patch, null, metadata(opts, t0, false, false));
    }

    private DiffResult schemaDiff(CsvTable oldT, CsvTable newT, String oldLabel, String newLabel, DiffOptions opts, long t0) {
        List<SchemaChange> schema = schemaChanges(oldT.headers(), newT.headers());
        int maxCols = Math.max(oldT.columnCount(), newT.columnCount());
        List<String> affected = new ArrayList<>(new LinkedHashSet<>(schema.stream().map(SchemaChange::columnName).toList()));
        DiffStatistics stats = new DiffStatistics(
                new DiffStatistics.Counts(oldT.rowCount(), newT.rowCount()),
                new DiffStatistics.Counts(oldT.columnCount(), newT.columnCount()),
                new DiffStatistics.Changes(0, 0, 0, 0, Math.min(oldT.rowCount(), newT.rowCount())),
                affected, percent(schema.size(), maxCols), List.of());
        return new DiffResult(DiffMode.SCHEMA, clock.instant(), new DiffResult.SourceFiles(oldLabel, newLabel), stats,
                schema, List.of(), null, null, metadata(opts, t0, false, false));
    }

    private DiffResult structured(String oldText, String newText, String oldLabel, String newLabel, DiffOptions opts,
                                  boolean withText, long t0) throws DiffException {
        CsvTable oldFull = parse(oldText, oldLabel, opts);
        CsvTable newFull = parse(newText, newLabel, opts);
        int max = Math.max(1, opts.maxRowsToProcess());
        boolean truncated = oldFull.rowCount() > max || newFull.rowCount() > max;
        if (truncated) log.warn("Diff of {} and {} truncated to {} rows", oldLabel, newLabel, max);
        CsvTable oldT = oldFull.limit(max);
        CsvTable newT = newFull.limit(max);

        for (String k : opts.keyColumns()) {
            if (!oldT.headers().contains(k) || !newT.headers().contains(k)) {
                throw new DiffException("Key column '" + k + "' is not present in both files");
            }
        }
        Set<String> oldHeaders = new HashSet<>(oldT.headers());
        List<String> common = newT.headers().stream().filter(oldHeaders::contains).distinct().toList();

        List<Map<String, String>> oldRows = rows(oldT);
        List<Map<String, String>> newRows = rows(newT);
        RowMatcher matcher = new RowMatcher(opts.keyColumns(), common, opts);
        RowMatcher.Outcome outcome = matcher.match(oldRows, newRows);
        boolean[] ordered = RowMatcher.inOrder(outcome.pairs());

        List<RowChange> changes = new ArrayList<>();
        int unchanged = 0;
        for (int p = 0; p < outcome.pairs().size(); p++) {
            RowMatcher.Pair pair = outcome.pairs().get(p);
            Map<String, String> o = oldRows.get(pair.oldIndex());
            Map<String, String> n = newRows.get(pair.newIndex());
            String id = matcher.keyOf(n);
            if (matcher.sameContent(o, n)) {
                if (opts.moveDetection() && !ordered[p] && pair.oldIndex() != pair.newIndex()) {
                    changes.add(new RowChange(pair.newIndex(), id, ChangeType.MOVED, List.of(), o, n, 1.0,
                            pair.oldIndex(), pair.newIndex()));
                } else {
                    unchanged++;
                }
                continue;
            }
            List<CellChange> cells = new ArrayList<>();
            for (String c : common) {
                if (!Objects.equals(o.get(c), n.get(c))) cells.add(new CellChange(c, o.get(c), n.get(c), ChangeType.MODIFIED));
            }
            changes.add(new RowChange(pair.newIndex(), id, ChangeType.MODIFIED, cells, o, n,
                    pair.bySimilarity() ? pair.similarity() : matcher.similarity(o, n), pair.oldIndex(), pair.newIndex()));
        }
        for (int i : outcome.unmatchedOld()) {
            changes.add(new RowChange(i, matcher.keyOf(oldRows.get(i)), ChangeType.REMOVED, List.of(), oldRows.get(i), null,
                    null, i, null));
        }
        for (int j : outcome.unmatchedNew()) {
            changes.add(new RowChange(j, matcher.keyOf(newRows.get(j)), ChangeType.ADDED, List.of(), null, newRows.get(j),
                    null, null, j));
        }
        changes.sort(ROW_ORDER);

        List<SchemaChange> schema = schemaChanges(oldT.headers(), newT.headers());
        DiffStatistics stats = statistics(oldT.rowCount(), newT.rowCount(), oldT.columnCount(), newT.columnCount(),
                changes, schema, unchanged, opts.topColumns());
        String patch = null;
        if (withText) {
            List<TextDiff.Edit> edits = TextDiff.diff(TextDiff.lines(oldText), TextDiff.lines(newText));
            patch = TextDiff.unified(fileName(oldLabel), fileName(newLabel), edits, TextDiff.DEFAULT_CONTEXT);
        }
        return new DiffResult(withText ? DiffMode.HYBRID : DiffMode.STRUCTURED, clock.instant(),
                new DiffResult.SourceFiles(oldLabel, newLabel), stats, schema, changes, patch, structuredDelta(changes),
                metadata(opts, t0, truncated, false));
    }

    /** Removals first, then by position: old index for removals, new index otherwise. */
    private static final Comparator<RowChange> ROW_ORDER = Comparator
            .comparingInt((RowChange r) -> r.changeType() == ChangeType.REMOVED ? 0 : 1)
            .thenComparingInt(RowChange::rowIndex);

    static List<SchemaChange> schemaChanges(List<String> oldHeaders, List<String> newHeaders) {
        List<SchemaChange> out = new ArrayList<>();
        for (int i = 0; i < oldHeaders.size(); i++) {
            if (!newHeaders.contains(oldHeaders.get(i))) out.add(new SchemaChange(ChangeType.REMOVED, oldHeaders.get(i), i, null));
        }
        for (int j = 0; j < newHeaders.size(); j++) {
            if (!oldHeaders.contains(newHeaders.get(j))) out.add(new SchemaChange(ChangeType.ADDED, newHeaders.get(j), null, j));
        }
        for (int i = 0; i < oldHeaders.size(); i++) {
            int j = newHeaders.indexOf(oldHeaders.get(i));
            if (j >= 0 && j != i) out.add(new SchemaChange(ChangeType.MOVED, oldHeaders.get(i), i, j));
        }
        return out;
    }

    static DiffStatistics statistics(int oldRows, int newRows, int oldCols, int newCols, List<RowChange> changes,
                                     List<SchemaChange> schema, int unchanged, int topN) {
        int added = 0, removed = 0, modified = 0, moved = 0;
        Map<String, Integer> perColumn = new LinkedHashMap<>();
        for (RowChange r : changes) {
            switch (r.changeType()) {
                case ADDED -> added++;
                case REMOVED -> removed++;
                case MODIFIED -> modified++;
                case MOVED -> moved++;
                case UNCHANGED -> unchanged++;
            }
            for (CellChange c : r.cellChanges()) perColumn.merge(c.column(), 1, Integer::sum);
        }
        int maxRows = Math.max(oldRows, newRows);
        List<ColumnChangeCount> top = perColumn.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed().thenComparing(Map.Entry.<String, Integer>comparingByKey()))
                .limit(Math.max(0, topN))
                .map(e -> new ColumnChangeCount(e.getKey(), e.getValue(), percent(e.getValue(), maxRows)))
                .toList();
        Set<String> affected = new LinkedHashSet<>(perColumn.keySet());
        schema.forEach(s -> affected.add(s.columnName()));
        DiffStatistics.Changes counts = new DiffStatistics.Changes(added, removed, modified, moved, unchanged);
        return new DiffStatistics(new DiffStatistics.Counts(oldRows, newRows), new DiffStatistics.Counts(oldCols, newCols),
                counts, new ArrayList<>(affected), percent(counts.total(), maxRows), top);
    }

    /**
     * Filtered copy of {@code result}. Cell changes equal under the filter's normalisation or outside its column
     * selection are dropped, and a modified row left without cell changes counts as unchanged.
     */
    public DiffResult applyFilters(DiffResult result, DiffFilter filter) {
        return applyFilters(result, filter, options.topColumns());
    }

    DiffResult applyFilters(DiffResult result, DiffFilter filter, int topN) {
        int unchanged = result.statistics().changes().unchanged();
        List<RowChange> kept = new ArrayList<>();
        for (RowChange r : result.rowChanges()) {
            RowChange row = r;
            if (r.changeType() == ChangeType.MODIFIED) {
                List<CellChange> cells = r.cellChanges().stream()
                        .filter(c -> filter.columnVisible(c.column()))
                        .filter(c -> !filter.normalize(c.oldValue()).equals(filter.normalize(c.newValue())))
                        .toList();
                if (cells.isEmpty()) {
                    unchanged++;
                    continue;
                }
                row = r.withCellChanges(cells);
            }
            if (filter.typeVisible(row.changeType())) kept.add(row);
        }
        List<SchemaChange> schema = result.schemaChanges().stream()
                .filter(s -> filter.columnVisible(s.columnName()))
                .filter(s -> filter.typeVisible(s.changeType()))
                .toList();
        DiffStatistics s = result.statistics();
        DiffStatistics stats = result.mode() == DiffMode.TEXT ? s
                : statistics(s.totalRows().old(), s.totalRows().current(), s.totalColumns().old(), s.totalColumns().current(),
                kept, schema, unchanged, topN);
        DiffMetadata m = result.metadata();
        return new DiffResult(result.mode(), result.timestamp(), result.sourceFiles(), stats, schema, kept,
                result.textDiff(), result.structuredDiff() == null ? null : structuredDelta(kept),
                new DiffMetadata(m.processingMillis(), m.truncated(), m.maxRowsToProcess(), m.keyColumns(), true));
    }

    /**
     * Array delta in the jsondiffpatch layout: {@code "n": [row]} added at n, {@code "_o": [row, 0, 0]} removed
     * from o, {@code "n": {col: [old, new]}} modified, {@code "_o": ["", n, 3]} moved.
     */
    static Map<String, Object> structuredDelta(List<RowChange> changes) {
        Map<String, Object> delta = new TreeMap<>();
        if (changes.isEmpty()) return delta;
        delta.put("_t", "a");
        for (RowChange r : changes) {
            switch (r.changeType()) {
                case ADDED -> delta.put(String.valueOf(r.newIndex()), List.of(r.newRow()));
                case REMOVED -> delta.put("_" + r.oldIndex(), List.of(r.oldRow(), 0, 0));
                case MOVED -> delta.put("_" + r.oldIndex(), List.of("", r.newIndex(), 3));
                case MODIFIED -> {
                    Map<String, Object> cells = new TreeMap<>();
                    for (CellChange c : r.cellChanges()) cells.put(c.column(), List.of(nz(c.oldValue()), nz(c.newValue())));
                    delta.put(String.valueOf(r.newIndex()), cells);
                }
                default -> { }
            }
        }
        return delta;
    }

    private static String nz(String v) { return v == null ? "" : v; }

    private CsvTable parse(String text, String label, DiffOptions opts) throws DiffException {
        try {
            return new CsvParser(opts.format()).parse(text);
        } catch (CsvParseException e) {
            throw new DiffException("Cannot parse " + label + ": " + e.getMessage(), e);
        }
    }

    private static List<Map<String, String>> rows(CsvTable t) {
        List<Map<String, String>> out = new ArrayList<>(t.rowCount());
        for (int i = 0; i < t.rowCount(); i++) out.add(t.rowAsMap(i));
        return out;
    }

    private static String read(Path p) throws DiffException {
        try {
            return Files.readString(p, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new DiffException("Cannot read " + p + ": " + e.getMessage(), e);
        }
    }

    private DiffMetadata metadata(DiffOptions opts, long t0, boolean truncated, boolean filtered) {
        return new DiffMetadata((System.nanoTime() - t0) / 1e6, truncated, opts.maxRowsToProcess(), opts.keyColumns(), filtered);
    }

    private static double percent(int part, int whole) {
        return whole <= 0 ? 0.0 : (part * 100.0) / whole;
    }

    private static String fileName(String label) {
        int slash = Math.max(label.lastIndexOf('/'), label.lastIndexOf('\\'));
        return slash >= 0 ? label.substring(slash + 1) : label;
    }
}
