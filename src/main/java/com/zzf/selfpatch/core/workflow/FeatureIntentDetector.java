package com.zzf.selfpatch.core.workflow;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.util.JsonUtils;
import com.zzf.selfpatch.core.util.StringUtils;
import com.zzf.selfpatch.llm.LanguageModelOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether an utterance asks for a new application feature.
 * <p>
 * Level 1 rejects internal system text without calling the oracle. Level 2 asks for a JSON
 * classification and only accepts it above the confidence threshold. Level 3 is a one-word
 * FEATURE_REQUEST / NORMAL_CHAT prompt used when level 2 fails. Any further failure means
 * "not a feature request".
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FeatureIntentDetector {

    private static final Pattern INTERNAL_PREFIX = Pattern.compile(
            "(?is)^\\s*(SYSTEM:|CONTEXT:|ANALYSIS TASK|USER INPUT:|CONVERSATION HISTORY:|RESPONSE FORMAT|TASK:|You are (an?|the) ).*");
    private static final Pattern JSON_BLOB = Pattern.compile("(?s)^\\s*[\\[{].*[\\]}]\\s*$");
    private static final Pattern FENCED_BLOCK = Pattern.compile("(?s)^\\s*```.*");

    private static final String PRIMARY_PROMPT = "You decide whether a user utterance asks to ADD or CHANGE functionality of the running application.\n" +
            "Feature requests: new functionality, new UI components, making elements interactive, integrations, enhancing existing features.\n" +
            "Not feature requests: questions, using existing functionality, asking for information, small talk, device commands.\n" +
            "\n" +
            "Output strictly in JSON format:\n" +
            "{\"isFeatureRequest\": true|false, \"confidence\": 0.0-1.0, \"target\": \"ui|backend|data|integration|other\", " +
            "\"type\": \"new_feature|enhancement|ui_change\", \"priority\": \"low|medium|high\", \"description\": \"one sentence\"}\n" +
            "User utterance: ";

    private static final String COARSE_PROMPT = "Answer with exactly one word, FEATURE_REQUEST or NORMAL_CHAT.\n" +
            "FEATURE_REQUEST means the user asks to build or change functionality of the application.\n" +
            "User utterance: ";

    private final LanguageModelOracle oracle;
    private final SelfPatchProperties properties;
    private final ObjectMapper objectMapper;

    public FeatureDetection detect(String utterance) {
        if (isInternalText(utterance)) {
            log.debug("intent.skip reason=internal");
            return FeatureDetection.none("internal");
        }
        String q = StringUtils.truncate(utterance.trim(), 1000);
        SelfPatchProperties.Oracle cfg = properties.getOracle();

        Optional<FeatureDetection> primary = primary(q, cfg);
        if (primary.isPresent()) {
            return primary.get();
        }
        return coarse(q, cfg);
    }

    boolean isInternalText(String text) {
        if (StringUtils.isBlank(text)) {
            return true;
        }
        return INTERNAL_PREFIX.matcher(text).matches()
                || JSON_BLOB.matcher(text).matches()
                || FENCED_BLOCK.matcher(text).matches();
    }

    private Optional<FeatureDetection> primary(String q, SelfPatchProperties.Oracle cfg) {
        try {
            long t0 = System.nanoTime();
            String raw = oracle.complete(PRIMARY_PROMPT + q, cfg.getClassificationTemperature(), cfg.getClassificationMaxTokens());
            Optional<JsonNode> node = JsonUtils.parseFirstObject(objectMapper, raw);
            if (node.isEmpty()) {
                log.warn("intent.primary.unparseable q={}", StringUtils.truncate(q, 50));
                return Optional.empty();
            }
            JsonNode n = node.get();
            double confidence = JsonUtils.doubleOrDefault(n, "confidence", 0.0);
            boolean claimed = JsonUtils.booleanOrDefault(n, "isFeatureRequest", false);
            double threshold = properties.getWorkflow().getConfidenceThreshold();
            boolean accepted = claimed && confidence >= threshold;
            long tookMs = (System.nanoTime() - t0) / 1_000_000L;
            log.info("intent.primary feature={} confidence={} accepted={} tookMs={} q={}",
                    claimed, confidence, accepted, tookMs, StringUtils.truncate(q, 50));
            return Optional.of(FeatureDetection.builder()
                    .featureRequest(accepted)
                    .confidence(confidence)
                    .target(JsonUtils.textOrFallback(n, "target"))
                    .type(JsonUtils.textOrFallback(n, "type"))
                    .priority(JsonUtils.textOrFallback(n, "priority"))
                    .description(JsonUtils.textOrFallback(n, "description"))
                    .source("primary")
                    .build());
        } catch (Exception e) {
            log.warn("intent.primary.fail err={}", e.toString());
            return Optional.empty();
        }
    }

    private FeatureDetection coarse(String q, SelfPatchProperties.Oracle cfg) {
        try {
            String raw = oracle.complete(COARSE_PROMPT + q, cfg.getClassificationTemperature(), 10);
            String answer = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
            boolean feature = answer.contains("FEATURE_REQUEST");
            log.info("intent.coarse feature={} q={}", feature, StringUtils.truncate(q, 50));
            if (!feature) {
                return FeatureDetection.none("coarse");
            }
            return FeatureDetection.builder()
                    .featureRequest(true)
                    .confidence(properties.getWorkflow().getConfidenceThreshold())
                    .description(q)
                    .source("coarse")
                    .build();
        } catch (Exception e) {
            log.warn("intent.coarse.fail err={}", e.toString());
            return FeatureDetection.none("none");
        }
    }
}
