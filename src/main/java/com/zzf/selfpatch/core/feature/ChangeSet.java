package com.zzf.selfpatch.core.feature;

import com.zzf.selfpatch.core.patch.PatchOperation;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Operations proposed for one feature request.
 */
@Data
@Builder
public class ChangeSet {
    @Builder.Default
    private List<PatchOperation> operations = new ArrayList<>();
    private String description;
    private boolean needsRestart;
    /** True when the operations come from a built-in template instead of the oracle. */
    private boolean fallback;

    public static ChangeSet empty(String description) {
        return ChangeSet.builder().description(description).build();
    }

    public boolean isEmpty() {
        return operations == null || operations.isEmpty();
    }
}
