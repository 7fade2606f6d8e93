package com.zzf.selfpatch.core.patch;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class PatchOutcome {
    private String filePath;
    private PatchOperation.Kind kind;
    private boolean success;
    private String reason;

    static PatchOutcome applied(PatchOperation op) {
        return new PatchOutcome(op.getFilePath(), op.getKind(), true, null);
    }

    static PatchOutcome failed(PatchOperation op, String reason) {
        return new PatchOutcome(op.getFilePath(), op.getKind(), false, reason);
    }
}
