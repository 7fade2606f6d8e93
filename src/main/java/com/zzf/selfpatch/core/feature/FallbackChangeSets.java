package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.util.StringUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Optional;

/**
 * Built-in change-sets used when the oracle reply is unusable and the conversation asks for a
 * known feature.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FallbackChangeSets {

    private final SelfPatchProperties properties;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final ChangeSetParser parser;

    public Optional<ChangeSet> forConversation(List<ConversationTurn> conversation) {
        SelfPatchProperties.Workflow cfg = properties.getWorkflow();
        StringBuilder text = new StringBuilder();
        if (conversation != null) {
            for (ConversationTurn turn : conversation) {
                if (turn.getContent() != null) {
                    text.append(turn.getContent()).append('\n');
                }
            }
        }
        if (!StringUtils.containsAnyIgnoreCase(text.toString(), cfg.getFallbackKeywords())) {
            return Optional.empty();
        }
        return load(cfg.getNoteFallbackResource());
    }

    Optional<ChangeSet> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("fallback.missing location={}", location);
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(in);
            ChangeSet changeSet = parser.parse(root, true);
            log.info("fallback.loaded location={} ops={}", location, changeSet.getOperations().size());
            return Optional.of(changeSet);
        } catch (IOException e) {
            log.warn("fallback.load.fail location={} err={}", location, e.toString());
            return Optional.empty();
        }
    }
}
