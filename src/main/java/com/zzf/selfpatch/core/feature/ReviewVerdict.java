package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of the peer review of a generated change-set. When approved, {@code reviewed} holds
 * the change-set JSON to apply in place of the generated one.
 */
@Getter
@ToString(exclude = "reviewed")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ReviewVerdict {
    private final boolean approved;
    private final Integer safetyScore;
    private final String assessment;
    private final String reason;
    private final JsonNode reviewed;

    static ReviewVerdict approved(JsonNode reviewed, int safetyScore, String assessment) {
        return new ReviewVerdict(true, safetyScore, assessment, null, reviewed);
    }

    static ReviewVerdict rejected(String reason, Integer safetyScore, String assessment) {
        return new ReviewVerdict(false, safetyScore, assessment, reason, null);
    }
}
