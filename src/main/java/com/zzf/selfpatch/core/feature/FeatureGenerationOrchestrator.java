package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.index.FileAnalysis;
import com.zzf.selfpatch.core.index.SourceAnalyzer;
import com.zzf.selfpatch.core.index.SourceSummarizer;
import com.zzf.selfpatch.core.patch.PatchEngine;
import com.zzf.selfpatch.core.patch.PatchResult;
import com.zzf.selfpatch.core.util.JsonUtils;
import com.zzf.selfpatch.llm.LanguageModelOracle;
import com.zzf.selfpatch.llm.OracleException;
import com.zzf.selfpatch.snapshot.BackupStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Turns a feature conversation into a {@link ChangeSet} and applies it behind a snapshot.
 * <p>
 * Generation runs in three stages: content analysis of the target files, the generation call,
 * and a peer review of the generated changes. Any stage failing sends the request to the
 * fallback templates, or to an empty change-set when none matches.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureGenerationOrchestrator {

    private final LanguageModelOracle oracle;
    private final FeaturePromptBuilder promptBuilder;
    private final ChangeSetParser parser;
    private final ChangeSetReviewer reviewer;
    private final SourceAnalyzer analyzer;
    private final FallbackChangeSets fallbacks;
    private final SourceSummarizer summarizer;
    private final PatchEngine patchEngine;
    private final BackupStore backupStore;
    private final SelfPatchProperties properties;
    private final ObjectMapper objectMapper;

    public ChangeSet generate(List<ConversationTurn> conversation, String projectSummary) {
        List<FileAnalysis> analyses = analyzer.analyze(conversationText(conversation, false));
        String prompt = promptBuilder.build(conversation, projectSummary, analyses);
        SelfPatchProperties.Oracle cfg = properties.getOracle();
        String reason;
        try {
            String raw = oracle.complete(prompt, cfg.getGenerationTemperature(), cfg.getGenerationMaxTokens());
            Optional<JsonNode> root = JsonUtils.parseFirstObject(objectMapper, raw);
            if (root.isPresent()) {
                ChangeSet changeSet = parser.parse(root.get(), false);
                if (changeSet.isEmpty()) {
                    reason = "no usable changes";
                } else if (!properties.getReview().isEnabled()) {
                    log.info("feature.generate ops={} needsRestart={} reviewed=false",
                            changeSet.getOperations().size(), changeSet.isNeedsRestart());
                    return changeSet;
                } else {
                    ReviewVerdict verdict = reviewer.review(root.get());
                    if (verdict.isApproved()) {
                        ChangeSet reviewed = parser.parse(verdict.getReviewed(), false);
                        if (!reviewed.isEmpty()) {
                            log.info("feature.generate ops={} needsRestart={} reviewed=true score={}",
                                    reviewed.getOperations().size(), reviewed.isNeedsRestart(), verdict.getSafetyScore());
                            return reviewed;
                        }
                        reason = "review left no usable changes";
                    } else {
                        reason = "review rejected the changes: " + verdict.getReason();
                    }
                }
            } else {
                reason = "no JSON object in reply";
            }
        } catch (OracleException e) {
            reason = e.getMessage();
        }
        log.warn("feature.generate.fail reason={}", reason);

        Optional<ChangeSet> fallback = fallbacks.forConversation(conversation);
        if (fallback.isPresent()) {
            log.info("feature.generate.fallback ops={}", fallback.get().getOperations().size());
            return fallback.get();
        }
        return ChangeSet.empty("Code generation failed: " + reason);
    }

    public ApplicationResult apply(ChangeSet changeSet) {
        PatchResult result = patchEngine.apply(changeSet.getOperations());
        return ApplicationResult.of(changeSet, result, null);
    }

    public ApplicationResult applyWithBackup(ChangeSet changeSet) {
        if (changeSet.isEmpty()) {
            return ApplicationResult.of(changeSet, PatchResult.empty(), null);
        }
        long backup = backupStore.snapshot();
        PatchResult result = patchEngine.apply(changeSet.getOperations());
        return ApplicationResult.of(changeSet, result, backup);
    }

    public ApplicationResult generateAndApply(List<ConversationTurn> conversation) {
        String summary = summarizer.summarize(conversationText(conversation, true)).render();
        ChangeSet changeSet = generate(conversation, summary);
        ApplicationResult result = applyWithBackup(changeSet);
        log.info("feature.apply success={} failure={} total={} backup={} fallback={}",
                result.getSuccessCount(), result.getFailureCount(), result.getTotalChanges(),
                result.getBackupTimestamp(), result.isFallback());
        return result;
    }

    private static String conversationText(List<ConversationTurn> conversation, boolean userOnly) {
        StringBuilder sb = new StringBuilder();
        if (conversation != null) {
            for (ConversationTurn turn : conversation) {
                if (turn.getContent() == null || (userOnly && turn.getRole() != ConversationTurn.Role.USER)) {
                    continue;
                }
                sb.append(turn.getContent()).append(' ');
            }
        }
        return sb.toString().trim();
    }
}
