package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.index.SourceFileStore;
import com.zzf.selfpatch.core.util.JsonUtils;
import com.zzf.selfpatch.core.util.StringUtils;
import com.zzf.selfpatch.llm.LanguageModelOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Second oracle pass over a generated change-set. The reviewer may rewrite contents, but the
 * anchors of each change are carried over from the generated one when the review drops them.
 * A missing or non-numeric safety score, a score below the configured minimum, or a
 * {@code rejected} status rejects the whole change-set.
 * <p>
 * {@link com.zzf.selfpatch.llm.OracleException} is not caught here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChangeSetReviewer {
    private static final List<String> PRESERVED_FIELDS = List.of(
            "filePath", "file", "operation", "method", "methodName", "insertAfter", "search", "targetLocation");

    private final LanguageModelOracle oracle;
    private final SourceFileStore store;
    private final SelfPatchProperties properties;
    private final ObjectMapper objectMapper;

    public ReviewVerdict review(JsonNode generated) {
        SelfPatchProperties.Review cfg = properties.getReview();
        JsonNode changes = generated.path("changes");
        String raw = oracle.complete(prompt(changes, cfg.getMaxListedFiles()), cfg.getTemperature(), cfg.getMaxTokens());

        Optional<JsonNode> parsed = JsonUtils.parseFirstObject(objectMapper, raw);
        if (parsed.isEmpty() || !parsed.get().path("changes").isArray()) {
            log.warn("review.unparseable chars={}", raw == null ? 0 : raw.length());
            return ReviewVerdict.rejected("no valid review in reply", null, "");
        }
        JsonNode reply = parsed.get();
        String assessment = JsonUtils.textOrFallback(reply, "overallAssessment");
        String status = JsonUtils.textOrFallback(reply, "validationStatus");
        JsonNode scoreNode = reply.get("safetyScore");
        if (scoreNode == null || !scoreNode.isNumber()) {
            log.warn("review.noScore status={}", status);
            return ReviewVerdict.rejected("review gave no safety score", null, assessment);
        }
        int score = scoreNode.asInt();
        log.info("review.done status={} score={} changes={}", status, score, reply.path("changes").size());

        if (score < cfg.getMinSafetyScore()) {
            return ReviewVerdict.rejected("safety score " + score + " below " + cfg.getMinSafetyScore()
                    + (StringUtils.isBlank(assessment) ? "" : " (" + assessment + ")"), score, assessment);
        }
        if ("rejected".equalsIgnoreCase(status.trim())) {
            return ReviewVerdict.rejected("reviewer rejected the changes"
                    + (StringUtils.isBlank(assessment) ? "" : " (" + assessment + ")"), score, assessment);
        }
        return ReviewVerdict.approved(merge(generated, (ArrayNode) reply.get("changes")), score, assessment);
    }

    private JsonNode merge(JsonNode generated, ArrayNode reviewedChanges) {
        JsonNode originals = generated.path("changes");
        ArrayNode merged = objectMapper.createArrayNode();
        for (int i = 0; i < reviewedChanges.size(); i++) {
            JsonNode reviewed = reviewedChanges.get(i);
            if (!reviewed.isObject()) {
                continue;
            }
            ObjectNode change = ((ObjectNode) reviewed).deepCopy();
            JsonNode original = originals.path(i);
            for (String field : PRESERVED_FIELDS) {
                if (!change.hasNonNull(field) && original.hasNonNull(field)) {
                    change.set(field, original.get(field));
                }
            }
            if (!change.hasNonNull("content") && original.hasNonNull("content")) {
                change.set("content", original.get("content"));
            }
            merged.add(change);
        }
        ObjectNode root = generated.isObject() ? ((ObjectNode) generated).deepCopy() : objectMapper.createObjectNode();
        root.set("changes", merged);
        return root;
    }

    private String prompt(JsonNode changes, int maxListedFiles) {
        StringBuilder sb = new StringBuilder();
        sb.append("SYSTEM: You are a senior code reviewer. Review these generated code changes for quality, safety and integration.\n\n");
        sb.append("GENERATED CHANGES:\n");
        sb.append(changes.toPrettyString());
        sb.append("\n\nPROJECT FILES:\n");
        List<String> paths = store.paths();
        for (String path : paths.subList(0, Math.min(Math.max(0, maxListedFiles), paths.size()))) {
            sb.append("- ").append(path).append('\n');
        }
        sb.append("\nCRITERIA: code quality, integration with the existing code, security, performance, error handling.\n");
        sb.append("Keep filePath, operation and every anchor (method, search, insertAfter) exactly as given.\n\n");
        sb.append("RESPONSE FORMAT (JSON only):\n");
        sb.append("{\n");
        sb.append("  \"validationStatus\": \"approved|rejected|needs_modification\",\n");
        sb.append("  \"changes\": [{\"filePath\": \"same as input\", \"operation\": \"same as input\", \"content\": \"validated content\",");
        sb.append(" \"warnings\": [\"...\"]}],\n");
        sb.append("  \"overallAssessment\": \"...\",\n");
        sb.append("  \"safetyScore\": 0\n");
        sb.append("}\n");
        sb.append("Compute safetyScore (0-100) from the risks you actually found. Respond with the JSON only:");
        return sb.toString();
    }
}
