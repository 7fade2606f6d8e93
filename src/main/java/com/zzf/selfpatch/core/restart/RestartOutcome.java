package com.zzf.selfpatch.core.restart;

import lombok.AllArgsConstructor;
import lombok.Data;

@Data
@AllArgsConstructor
public class RestartOutcome {
    private RestartStatus status;
    private String message;

    public boolean isLaunched() {
        return status == RestartStatus.LAUNCHED;
    }
}
