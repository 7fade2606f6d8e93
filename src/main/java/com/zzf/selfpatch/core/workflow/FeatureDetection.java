package com.zzf.selfpatch.core.workflow;

import lombok.Builder;
import lombok.Data;

/**
 * Classification of one utterance.
 */
@Data
@Builder
public class FeatureDetection {
    private boolean featureRequest;
    private double confidence;
    private String target;
    private String type;
    private String priority;
    private String description;
    /** Which classification produced this result: primary, coarse, internal or none. */
    private String source;

    public static FeatureDetection none(String source) {
        return FeatureDetection.builder().featureRequest(false).confidence(0.0).source(source).build();
    }
}
