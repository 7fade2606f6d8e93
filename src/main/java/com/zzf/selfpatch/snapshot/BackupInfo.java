package com.zzf.selfpatch.snapshot;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Metadata written as {@code backup-info.json} inside a persisted snapshot directory.
 */
@Data
@NoArgsConstructor
public class BackupInfo {
    private long timestamp;
    private String date;
    private String operation;
    private Map<String, FileEntry> files = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FileEntry {
        private String originalPath;
        private String backupFile;
        private int size;
        private String checksum;
    }
}
