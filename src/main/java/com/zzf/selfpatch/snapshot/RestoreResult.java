package com.zzf.selfpatch.snapshot;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class RestoreResult {
    private long timestamp;
    private boolean found;
    private int restoredFiles;
    private int failedFiles;
    private String message;
}
