package com.zzf.selfpatch.core.workflow;

public enum WorkflowStage {
    IDLE,
    /** Waiting for the user to describe the feature in more detail. */
    CLARIFICATION,
    /** Waiting for a yes or no before any file is touched. */
    CONFIRMATION,
    /** Generating and applying the confirmed change-set; only reported by {@link FeatureRequestWorkflow#stage()}. */
    EXECUTING
}
