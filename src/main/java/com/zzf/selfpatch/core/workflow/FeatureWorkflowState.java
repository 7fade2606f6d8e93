package com.zzf.selfpatch.core.workflow;

import com.zzf.selfpatch.core.feature.ConversationTurn;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * The one in-flight feature conversation.
 */
@Data
@NoArgsConstructor
public class FeatureWorkflowState {
    private String originalRequest;
    private FeatureDetection detection;
    private WorkflowStage stage = WorkflowStage.IDLE;
    private String clarification;
    private List<ConversationTurn> turns = new ArrayList<>();

    FeatureWorkflowState(String originalRequest, FeatureDetection detection) {
        this.originalRequest = originalRequest;
        this.detection = detection;
        this.stage = WorkflowStage.CLARIFICATION;
        this.turns.add(ConversationTurn.user(originalRequest));
    }

    FeatureWorkflowState copy() {
        FeatureWorkflowState c = new FeatureWorkflowState();
        c.originalRequest = originalRequest;
        c.detection = detection;
        c.stage = stage;
        c.clarification = clarification;
        c.turns = new ArrayList<>(turns);
        return c;
    }
}
