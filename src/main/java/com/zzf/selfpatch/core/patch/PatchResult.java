package com.zzf.selfpatch.core.patch;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one {@link PatchEngine#apply(List)} batch.
 */
@Data
@Builder
public class PatchResult {
    private int successCount;
    private int failureCount;
    private int totalChanges;
    private List<PatchOutcome> outcomes;

    public static PatchResult empty() {
        return PatchResult.builder().outcomes(List.of()).build();
    }
}
