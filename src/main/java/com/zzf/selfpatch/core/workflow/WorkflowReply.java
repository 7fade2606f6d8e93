package com.zzf.selfpatch.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zzf.selfpatch.core.feature.ApplicationResult;
import com.zzf.selfpatch.core.restart.RestartOutcome;
import lombok.Builder;
import lombok.Data;

/**
 * Answer to one utterance. {@code handled=false} means the workflow did not take the
 * utterance and the caller should treat it as ordinary chat.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WorkflowReply {
    private boolean handled;
    private String message;
    private WorkflowStage stage;
    private boolean cancelled;
    private boolean executed;
    private ApplicationResult result;
    private RestartOutcome restart;

    static WorkflowReply notHandled() {
        return WorkflowReply.builder().handled(false).stage(WorkflowStage.IDLE).build();
    }
}
