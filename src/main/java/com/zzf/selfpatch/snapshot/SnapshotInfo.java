package com.zzf.selfpatch.snapshot;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SnapshotInfo {
    private long timestamp;
    private String date;
    private int fileCount;
    private boolean inMemory;
    private boolean persisted;
}
