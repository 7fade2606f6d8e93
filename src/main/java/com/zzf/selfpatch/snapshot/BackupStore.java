package com.zzf.selfpatch.snapshot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.index.SourceFileStore;
import com.zzf.selfpatch.core.util.AtomicFiles;
import com.zzf.selfpatch.project.ProjectContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Point-in-time copies of every indexed file.
 * <p>
 * Each snapshot lives in memory under {@code path_timestamp} keys and, when persistence is on,
 * as a directory {@code <backup-dir>/<timestamp>/} with a {@code backup-info.json} manifest.
 * Restoring only overwrites files that have an entry; files created afterwards stay.
 * Snapshots are never evicted automatically, see {@link #prune(int)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BackupStore {
    static final String METADATA_FILE = "backup-info.json";

    private final ProjectContext projectContext;
    private final SourceFileStore store;
    private final SelfPatchProperties properties;
    private final ObjectMapper objectMapper;
    private final OperationLog operationLog;

    private final Map<String, String> backups = new HashMap<>();
    private final NavigableSet<Long> timestamps = new TreeSet<>();
    private long lastTimestamp;

    public synchronized long snapshot() {
        long timestamp = Math.max(System.currentTimeMillis(), lastTimestamp + 1);
        lastTimestamp = timestamp;

        Map<String, String> contents = store.contents();
        for (Map.Entry<String, String> e : contents.entrySet()) {
            backups.put(key(e.getKey(), timestamp), e.getValue());
        }
        timestamps.add(timestamp);

        String status = "success";
        String error = null;
        if (properties.getBackup().isPersist()) {
            try {
                persist(timestamp, contents);
            } catch (IOException e) {
                status = "partial";
                error = e.getMessage();
                log.warn("backup.persist.fail ts={} err={}", timestamp, e.toString());
            }
        }
        operationLog.append(OperationLog.Entry.builder()
                .timestamp(timestamp)
                .type("backup")
                .status(status)
                .filesCount(contents.size())
                .error(error)
                .build());
        log.info("backup.snapshot ts={} files={}", timestamp, contents.size());
        return timestamp;
    }

    /**
     * Writes the snapshot content back for every currently indexed path that has an entry.
     * An unknown timestamp restores nothing.
     */
    public synchronized RestoreResult restore(long timestamp) {
        Map<String, String> source = entriesFor(timestamp);
        int restored = 0;
        int failed = 0;
        for (String path : store.paths()) {
            String content = source.get(path);
            if (content == null) {
                continue;
            }
            try {
                AtomicFiles.writeString(projectContext.resolve(path), content);
                store.put(path, content);
                restored++;
            } catch (IOException | IllegalArgumentException e) {
                failed++;
                log.warn("backup.restore.file.fail ts={} path={} err={}", timestamp, path, e.toString());
            }
        }
        boolean found = !source.isEmpty();
        operationLog.append(OperationLog.Entry.builder()
                .timestamp(System.currentTimeMillis())
                .type("restore")
                .status(!found ? "failed" : (failed == 0 ? "success" : "partial"))
                .filesCount(restored)
                .snapshot(timestamp)
                .build());
        log.info("backup.restore ts={} found={} restored={} failed={}", timestamp, found, restored, failed);
        return RestoreResult.builder()
                .timestamp(timestamp)
                .found(found)
                .restoredFiles(restored)
                .failedFiles(failed)
                .message(found
                        ? "Restored " + restored + " files from backup " + Instant.ofEpochMilli(timestamp)
                        : "No backup found for " + timestamp)
                .build();
    }

    /**
     * Restores the {@code index}-th newest snapshot (0 = most recent).
     */
    public synchronized RestoreResult rollback(int index) {
        List<SnapshotInfo> all = listSnapshots();
        if (index < 0 || index >= all.size()) {
            return RestoreResult.builder()
                    .timestamp(-1)
                    .found(false)
                    .message(all.isEmpty() ? "No backups available for rollback" : "Backup " + index + " not found")
                    .build();
        }
        return restore(all.get(index).getTimestamp());
    }

    public synchronized List<SnapshotInfo> listSnapshots() {
        Map<Long, SnapshotInfo> byTimestamp = new TreeMap<>(Comparator.reverseOrder());
        for (Long ts : timestamps) {
            byTimestamp.put(ts, SnapshotInfo.builder()
                    .timestamp(ts)
                    .date(Instant.ofEpochMilli(ts).toString())
                    .fileCount(countEntries(ts))
                    .inMemory(true)
                    .build());
        }
        for (Long ts : persistedTimestamps()) {
            SnapshotInfo info = byTimestamp.get(ts);
            if (info != null) {
                info.setPersisted(true);
                continue;
            }
            BackupInfo manifest = readManifest(ts);
            byTimestamp.put(ts, SnapshotInfo.builder()
                    .timestamp(ts)
                    .date(Instant.ofEpochMilli(ts).toString())
                    .fileCount(manifest == null ? 0 : manifest.getFiles().size())
                    .persisted(true)
                    .build());
        }
        return new ArrayList<>(byTimestamp.values());
    }

    /**
     * Deletes all but the {@code maxKeep} newest snapshots, in memory and on disk.
     *
     * @return number of snapshots removed
     */
    public synchronized int prune(int maxKeep) {
        List<SnapshotInfo> all = listSnapshots();
        int removed = 0;
        for (int i = Math.max(0, maxKeep); i < all.size(); i++) {
            long ts = all.get(i).getTimestamp();
            timestamps.remove(ts);
            backups.keySet().removeIf(k -> k.endsWith("_" + ts));
            try {
                deleteRecursively(snapshotDir(ts));
            } catch (IOException e) {
                log.warn("backup.prune.fail ts={} err={}", ts, e.toString());
            }
            removed++;
        }
        if (removed > 0) {
            log.info("backup.prune removed={} kept={}", removed, all.size() - removed);
        }
        return removed;
    }

    private Map<String, String> entriesFor(long timestamp) {
        Map<String, String> result = new HashMap<>();
        if (timestamps.contains(timestamp)) {
            String suffix = "_" + timestamp;
            for (Map.Entry<String, String> e : backups.entrySet()) {
                if (e.getKey().endsWith(suffix)) {
                    result.put(e.getKey().substring(0, e.getKey().length() - suffix.length()), e.getValue());
                }
            }
            return result;
        }
        return loadPersisted(timestamp);
    }

    private int countEntries(long timestamp) {
        String suffix = "_" + timestamp;
        int count = 0;
        for (String k : backups.keySet()) {
            if (k.endsWith(suffix)) {
                count++;
            }
        }
        return count;
    }

    private void persist(long timestamp, Map<String, String> contents) throws IOException {
        Path dir = snapshotDir(timestamp);
        Files.createDirectories(dir);
        BackupInfo info = new BackupInfo();
        info.setTimestamp(timestamp);
        info.setDate(Instant.ofEpochMilli(timestamp).toString());
        info.setOperation("pre-modification-backup");
        int n = 0;
        for (Map.Entry<String, String> e : contents.entrySet()) {
            String backupFile = (n++) + "_" + e.getKey().replaceAll("[/\\\\]", "_");
            try {
                Files.writeString(dir.resolve(backupFile), e.getValue(), StandardCharsets.UTF_8);
                info.getFiles().put(e.getKey(), new BackupInfo.FileEntry(
                        e.getKey(), backupFile, e.getValue().length(), checksum(e.getValue())));
            } catch (IOException ex) {
                log.warn("backup.persist.file.fail path={} err={}", e.getKey(), ex.toString());
            }
        }
        objectMapper.writerWithDefaultPrettyPrinter().writeValue(dir.resolve(METADATA_FILE).toFile(), info);
    }

    private Map<String, String> loadPersisted(long timestamp) {
        Map<String, String> result = new LinkedHashMap<>();
        BackupInfo info = readManifest(timestamp);
        if (info == null) {
            return result;
        }
        Path dir = snapshotDir(timestamp);
        for (BackupInfo.FileEntry entry : info.getFiles().values()) {
            try {
                String content = Files.readString(dir.resolve(entry.getBackupFile()), StandardCharsets.UTF_8);
                if (entry.getChecksum() != null && !entry.getChecksum().equals(checksum(content))) {
                    log.warn("backup.checksum.mismatch ts={} path={}", timestamp, entry.getOriginalPath());
                    continue;
                }
                result.put(entry.getOriginalPath(), content);
            } catch (IOException e) {
                log.warn("backup.load.file.fail ts={} path={} err={}", timestamp, entry.getOriginalPath(), e.toString());
            }
        }
        return result;
    }

    private BackupInfo readManifest(long timestamp) {
        Path manifest = snapshotDir(timestamp).resolve(METADATA_FILE);
        if (!Files.isRegularFile(manifest)) {
            return null;
        }
        try {
            return objectMapper.readValue(manifest.toFile(), BackupInfo.class);
        } catch (IOException e) {
            log.warn("backup.manifest.read.fail ts={} err={}", timestamp, e.toString());
            return null;
        }
    }

    private List<Long> persistedTimestamps() {
        List<Long> result = new ArrayList<>();
        Path dir = backupDir();
        if (!Files.isDirectory(dir)) {
            return result;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String name = entry.getFileName().toString();
                if (Files.isDirectory(entry) && name.matches("\\d+")) {
                    result.add(Long.parseLong(name));
                }
            }
        } catch (IOException e) {
            log.warn("backup.list.fail dir={} err={}", dir, e.toString());
        }
        return result;
    }

    private Path backupDir() {
        return projectContext.getRoot().resolve(properties.getBackup().getDirectory());
    }

    private Path snapshotDir(long timestamp) {
        return backupDir().resolve(Long.toString(timestamp));
    }

    private static String key(String path, long timestamp) {
        return path + "_" + timestamp;
    }

    static String checksum(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (byte b : hash) {
                sb.append(String.format("%02x", b));
            }
            return sb.toString();
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }

    private static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = new ArrayList<>();
            walk.forEach(paths::add);
            paths.sort(Comparator.reverseOrder());
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }
}
