package com.zzf.selfpatch.core.feature;

import com.zzf.selfpatch.core.patch.PatchOutcome;
import com.zzf.selfpatch.core.patch.PatchResult;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
public class ApplicationResult {
    private int successCount;
    private int failureCount;
    private int totalChanges;
    @Builder.Default
    private List<PatchOutcome> outcomes = new ArrayList<>();
    private String description;
    private boolean needsRestart;
    private boolean fallback;
    /** Snapshot taken before applying, null when none was taken. */
    private Long backupTimestamp;

    public boolean isSuccess() {
        return successCount > 0;
    }

    static ApplicationResult of(ChangeSet changeSet, PatchResult patch, Long backupTimestamp) {
        return ApplicationResult.builder()
                .successCount(patch.getSuccessCount())
                .failureCount(patch.getFailureCount())
                .totalChanges(patch.getTotalChanges())
                .outcomes(patch.getOutcomes() == null ? new ArrayList<>() : patch.getOutcomes())
                .description(changeSet.getDescription())
                .needsRestart(changeSet.isNeedsRestart())
                .fallback(changeSet.isFallback())
                .backupTimestamp(backupTimestamp)
                .build();
    }
}
