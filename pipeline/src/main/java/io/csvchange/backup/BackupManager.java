package io.csvchange.backup;

import com.codahale.metrics.Timer;
import io.csvchange.event.Notifier;
import io.csvchange.hash.ChecksumAlgorithm;
import io.csvchange.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Versioned, checksummed copies of watched files.
 * <p>
 * All index mutations (create, delete, retention) run under one lock so the payload directory and
 * {@code backup-metadata.json} move in lock-step.
 */
public class BackupManager {
    private static final Logger log = LoggerFactory.getLogger(BackupManager.class);
    private static final byte[] GZIP_MAGIC = {0x1f, (byte) 0x8b};
    static final String PRE_RESTORE_TAG = "pre-restore";

    private final BackupOptions options;
    private final Clock clock;
    private final BackupIndex index;
    private final ReentrantLock lock = new ReentrantLock();
    private final Notifier<BackupRecord> created = new Notifier<>("backup.created");
    private final Notifier<BackupRecord> deleted = new Notifier<>("backup.deleted");
    private final Notifier<RetentionFailure> retentionFailures = new Notifier<>("backup.retention.failed");

    private final Timer createTimer;
    private final Timer restoreTimer;
    private final Metrics metrics;

    private volatile boolean initialized;

    public BackupManager(BackupOptions options, Clock clock, Metrics metrics) {
        this.options = Objects.requireNonNull(options);
        this.clock = Objects.requireNonNull(clock);
        this.metrics = Objects.requireNonNull(metrics);
        this.index = new BackupIndex(options.backupDir().resolve(BackupOptions.INDEX_FILE),
                options.backupDir().resolve(BackupOptions.VERSIONS_FILE));
        this.createTimer = metrics.timer("backup.create.time");
        this.restoreTimer = metrics.timer("backup.restore.time");
    }

    public BackupOptions options() { return options; }
    public Notifier<BackupRecord> created() { return created; }
    public Notifier<BackupRecord> deleted() { return deleted; }
    public Notifier<RetentionFailure> retentionFailures() { return retentionFailures; }

    /**
     * Creates the backup directory and loads the index.
     *
     * @throws BackupException if the directory cannot be created or the index is unreadable
     */
    public void initialize() {
        lock.lock();
        try {
            Files.createDirectories(options.backupDir());
            index.load();
            initialized = true;
            log.info("Backup store at {} holds {} backups", options.backupDir(), index.records().size());
        } catch (IOException e) {
            throw new BackupException("Cannot initialize backup directory " + options.backupDir(), e);
        } finally {
            lock.unlock();
        }
    }

    /** Never throws; failures come back in the result. */
    public BackupResult createBackup(Path file, String context, List<String> tags) {
        return createBackup(file, context, tags, Set.of());
    }

    private BackupResult createBackup(Path file, String context, List<String> tags, Set<String> protectedIds) {
        long t0 = System.nanoTime();
        Path source = file.toAbsolutePath().normalize();
        try (Timer.Context ignored = createTimer.time()) {
            ensureInitialized();
            byte[] bytes = Files.readAllBytes(source);
            ChecksumAlgorithm alg = options.checksumAlgorithm();
            String checksum = alg.hex(bytes);
            BackupRecord record;
            lock.lock();
            try {
                String original = source.toString();
                int version = index.nextVersion(original);
                Instant now = clock.instant();
                String id = newId(source, now, version);
                Path payload = options.backupDir().resolve(id + "_v" + version + extension(source) + (options.compression() ? ".gz" : ""));
                writePayload(payload, bytes);
                record = new BackupRecord(id, original, payload.toString(), now, bytes.length, checksum, alg,
                        options.compression(), version, context, tags);
                try {
                    index.add(record);
                } catch (IOException e) {
                    Files.deleteIfExists(payload);
                    throw e;
                }
                try {
                    applyRetentionLocked(original, protectedIds);
                } catch (IOException e) {
                    // the new backup is already indexed and stays
                    metrics.counter("backup.retention.failed").inc();
                    log.warn("Retention for {} failed after backing up {}: {}", source, record.id(), e.toString());
                    retentionFailures.publish(new RetentionFailure(source, e));
                }
            } finally {
                lock.unlock();
            }
            metrics.counter("backup.created").inc();
            log.info("Backed up {} as {} (v{}, {} bytes)", source, record.id(), record.version(), record.fileSize());
            created.publish(record);
            return BackupResult.ok(record, Duration.ofNanos(System.nanoTime() - t0));
        } catch (IOException | RuntimeException e) {
            metrics.counter("backup.failed").inc();
            log.warn("Backup of {} failed: {}", source, e.toString());
            return BackupResult.failed(describe(e), Duration.ofNanos(System.nanoTime() - t0));
        }
    }

    /**
     * Restores backup {@code id} onto {@code target}, or onto its original path when {@code target} is null.
     * An existing target is first saved as a {@code pre-restore} backup and put back if the restore fails.
     */
    public RestoreResult restoreFromBackup(String id, Path target) {
        try (Timer.Context ignored = restoreTimer.time()) {
            ensureInitialized();
            Optional<BackupRecord> found = index.find(id);
            if (found.isEmpty()) return RestoreResult.failed(id, target, null, "Backup not found: " + id, null);
            BackupRecord record = found.get();
            Path dest = (target == null ? record.original() : target).toAbsolutePath().normalize();

            String safetyId = null;
            if (Files.exists(dest)) {
                BackupResult safety = createBackup(dest, "Pre-restore backup before restoring " + id,
                        List.of(PRE_RESTORE_TAG), Set.of(id));
                if (!safety.success()) {
                    return RestoreResult.failed(id, dest, null, "Safety backup failed: " + safety.error(), null);
                }
                safetyId = safety.record().id();
            }

            try {
                byte[] bytes = readPayload(record);
                if (!record.checksumAlgorithm().hex(bytes).equals(record.checksum())) {
                    throw new IOException("Backup payload checksum mismatch for " + id);
                }
                writeTarget(dest, bytes);
                if (!record.checksumAlgorithm().hex(dest).equals(record.checksum())) {
                    throw new IOException("Restored file checksum mismatch for " + dest);
                }
                log.info("Restored {} (v{}) to {}", id, record.version(), dest);
                return RestoreResult.ok(id, dest, safetyId);
            } catch (IOException | RuntimeException e) {
                log.warn("Restore of {} to {} failed: {}", id, dest, e.toString());
                String rollbackError = safetyId == null ? null : rollback(safetyId, dest);
                return RestoreResult.failed(id, dest, safetyId, describe(e), rollbackError);
            }
        } catch (RuntimeException e) {
            return RestoreResult.failed(id, target, null, describe(e), null);
        }
    }

    private String rollback(String safetyId, Path dest) {
        try {
            BackupRecord safety = index.find(safetyId).orElseThrow(() -> new IOException("Safety backup vanished: " + safetyId));
            writeTarget(dest, readPayload(safety));
            log.info("Rolled {} back to safety backup {}", dest, safetyId);
            return null;
        } catch (IOException | RuntimeException e) {
            log.error("Rollback of {} from {} failed: {}", dest, safetyId, e.toString());
            return describe(e);
        }
    }

    /** Decompressed payload of a backup. */
    public byte[] readPayload(BackupRecord record) throws IOException {
        byte[] raw = Files.readAllBytes(record.payload());
        if (!record.compressed()) return raw;
        if (raw.length < 2 || raw[0] != GZIP_MAGIC[0] || raw[1] != GZIP_MAGIC[1]) {
            throw new IOException("Payload is not gzip data: " + record.payload());
        }
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
            return in.readAllBytes();
        }
    }

    public Optional<BackupRecord> getBackup(String id) {
        ensureInitialized();
        return index.find(id);
    }

    public List<BackupRecord> listBackups(BackupQuery query) {
        ensureInitialized();
        String original = query.originalPath() == null ? null : query.originalPath().toAbsolutePath().normalize().toString();
        Comparator<BackupRecord> order = switch (query.sortBy()) {
            case SIZE -> Comparator.comparingLong(BackupRecord::fileSize);
            case VERSION -> Comparator.comparingInt(BackupRecord::version);
            case TIMESTAMP -> Comparator.comparing(BackupRecord::timestamp).thenComparingInt(BackupRecord::version);
        };
        if (query.descending()) order = order.reversed();
        var stream = index.records().stream()
                .filter(r -> original == null || r.originalPath().equals(original))
                .filter(r -> query.from() == null || !r.timestamp().isBefore(query.from()))
                .filter(r -> query.to() == null || !r.timestamp().isAfter(query.to()))
                .filter(r -> query.tags().isEmpty() || r.hasAnyTag(query.tags()))
                .sorted(order);
        if (query.limit() > 0) stream = stream.limit(query.limit());
        return stream.toList();
    }

    /** True iff the payload exists and its recomputed checksum matches. Never throws. */
    public boolean verifyBackup(String id) {
        try {
            ensureInitialized();
            Optional<BackupRecord> r = index.find(id);
            if (r.isEmpty()) return false;
            byte[] bytes = readPayload(r.get());
            return r.get().checksumAlgorithm().hex(bytes).equals(r.get().checksum());
        } catch (IOException | RuntimeException e) {
            log.debug("Verification of {} failed: {}", id, e.toString());
            return false;
        }
    }

    /**
     * Removes a backup's index entry and payload.
     *
     * @return false if no backup has that id
     * @throws BackupException if the index or payload cannot be updated; the store is left consistent
     */
    public boolean deleteBackup(String id) {
        ensureInitialized();
        lock.lock();
        try {
            Optional<BackupRecord> r = index.find(id);
            if (r.isEmpty()) return false;
            delete(r.get());
            return true;
        } catch (IOException e) {
            throw new BackupException("Cannot delete backup " + id, e);
        } finally {
            lock.unlock();
        }
    }

    /** Applies retention to one original path. Returns the number of backups removed. */
    public int applyRetentionPolicy(Path original) {
        ensureInitialized();
        lock.lock();
        try {
            return applyRetentionLocked(original.toAbsolutePath().normalize().toString(), Set.of());
        } catch (IOException e) {
            throw new BackupException("Retention failed for " + original, e);
        } finally {
            lock.unlock();
        }
    }

    /** Manual retention sweep over every original path in the index. */
    public int cleanupOldBackups() {
        ensureInitialized();
        lock.lock();
        try {
            int removed = 0;
            for (String original : new TreeMap<>(countsByPath()).keySet()) {
                removed += applyRetentionLocked(original, Set.of());
            }
            if (removed > 0) log.info("Retention sweep removed {} backups", removed);
            return removed;
        } catch (IOException e) {
            throw new BackupException("Retention sweep failed", e);
        } finally {
            lock.unlock();
        }
    }

    private int applyRetentionLocked(String original, Set<String> protectedIds) throws IOException {
        RetentionPolicy policy = options.retention();
        List<BackupRecord> oldestFirst = new ArrayList<>(index.records().stream()
                .filter(r -> r.originalPath().equals(original))
                .sorted(Comparator.comparing(BackupRecord::timestamp).thenComparingInt(BackupRecord::version))
                .toList());
        int remaining = oldestFirst.size();
        List<BackupRecord> victims = new ArrayList<>();
        for (BackupRecord r : oldestFirst) {
            if (remaining <= policy.maxBackups() || remaining <= policy.minBackups()) break;
            if (protectedIds.contains(r.id())) continue;
            victims.add(r);
            remaining--;
        }
        if (policy.maxAge() != null) {
            Instant cutoff = clock.instant().minus(policy.maxAge());
            for (BackupRecord r : oldestFirst) {
                if (remaining <= policy.minBackups()) break;
                if (victims.contains(r) || protectedIds.contains(r.id())) continue;
                if (!r.timestamp().isBefore(cutoff)) break;
                victims.add(r);
                remaining--;
            }
        }
        for (BackupRecord r : victims) delete(r);
        if (!victims.isEmpty()) log.debug("Retention removed {} backups of {}", victims.size(), original);
        return victims.size();
    }

    private void delete(BackupRecord r) throws IOException {
        index.removeAll(Set.of(r.id()));
        try {
            Files.deleteIfExists(r.payload());
        } catch (IOException e) {
            index.add(r);
            throw e;
        }
        metrics.counter("backup.deleted").inc();
        deleted.publish(r);
    }

    public BackupStats getBackupStats() {
        ensureInitialized();
        List<BackupRecord> all = index.records();
        long total = 0;
        Instant oldest = null;
        Instant newest = null;
        for (BackupRecord r : all) {
            total += r.fileSize();
            if (oldest == null || r.timestamp().isBefore(oldest)) oldest = r.timestamp();
            if (newest == null || r.timestamp().isAfter(newest)) newest = r.timestamp();
        }
        return new BackupStats(all.size(), total, oldest, newest, countsByPath());
    }

    private Map<String, Integer> countsByPath() {
        Map<String, Integer> counts = new TreeMap<>();
        for (BackupRecord r : index.records()) counts.merge(r.originalPath(), 1, Integer::sum);
        return counts;
    }

    private void writePayload(Path payload, byte[] bytes) throws IOException {
        if (!options.compression()) {
            Files.write(payload, bytes);
            return;
        }
        ByteArrayOutputStream buf = new ByteArrayOutputStream(Math.max(512, bytes.length / 3));
        try (OutputStream gz = new LeveledGzip(buf, options.compressionLevel())) {
            gz.write(bytes);
        }
        Files.write(payload, buf.toByteArray());
    }

    private static void writeTarget(Path dest, byte[] bytes) throws IOException {
        Path parent = dest.getParent();
        if (parent != null) Files.createDirectories(parent);
        Path tmp = dest.resolveSibling("." + dest.getFileName() + ".restore.tmp");
        try {
            Files.write(tmp, bytes);
            BackupIndex.moveReplacing(tmp, dest);
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    private void ensureInitialized() {
        if (!initialized) initialize();
    }

    private static String newId(Path source, Instant now, int version) {
        String base = baseName(source);
        String salt = source + ":" + now.toEpochMilli() + ":" + version;
        String hash = ChecksumAlgorithm.MD5.hex(salt.getBytes(StandardCharsets.UTF_8)).substring(0, 8);
        return base + "_" + now.toEpochMilli() + "_" + hash;
    }

    private static String baseName(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(Path p) {
        String name = p.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(dot) : "";
    }

    private static String describe(Exception e) {
        if (e instanceof java.nio.file.NoSuchFileException) return "File not found: " + e.getMessage();
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }

    private static final class LeveledGzip extends GZIPOutputStream {
        LeveledGzip(OutputStream out, int level) throws IOException {
            super(out);
            def.setLevel(level);
        }
    }
}
