package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.databind.JsonNode;
import com.zzf.selfpatch.core.patch.PatchOperation;
import com.zzf.selfpatch.core.util.JsonUtils;
import com.zzf.selfpatch.core.util.StringUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps the change-set JSON returned by the oracle (or stored as a template) onto
 * {@link PatchOperation}s. Entries with an unknown operation or missing fields are dropped.
 */
@Slf4j
@Component
public class ChangeSetParser {

    public ChangeSet parse(JsonNode root, boolean fallback) {
        List<PatchOperation> operations = new ArrayList<>();
        JsonNode changes = root == null ? null : root.get("changes");
        int dropped = 0;
        if (changes != null && changes.isArray()) {
            for (JsonNode change : changes) {
                Optional<PatchOperation> op = toOperation(change);
                if (op.isPresent()) {
                    operations.add(op.get());
                } else {
                    dropped++;
                }
            }
        }
        if (dropped > 0) {
            log.warn("changeset.dropped count={} kept={}", dropped, operations.size());
        }
        return ChangeSet.builder()
                .operations(operations)
                .description(root == null ? "" : JsonUtils.textOrFallback(root, "description"))
                .needsRestart(root != null && JsonUtils.booleanOrDefault(root, "needsRestart", false))
                .fallback(fallback)
                .build();
    }

    Optional<PatchOperation> toOperation(JsonNode change) {
        if (change == null || !change.isObject()) {
            return Optional.empty();
        }
        String filePath = JsonUtils.textOrFallback(change, "filePath", "file");
        String operation = JsonUtils.textOrFallback(change, "operation");
        Optional<PatchOperation.Kind> kind = PatchOperation.Kind.fromWireName(operation);
        if (StringUtils.isBlank(filePath) || kind.isEmpty()) {
            log.warn("changeset.entry.invalid op={} file={}", operation, filePath);
            return Optional.empty();
        }
        String content = change.hasNonNull("content") ? change.get("content").asText() : null;
        switch (kind.get()) {
            case ADD_METHOD:
                return content == null ? missing(change, "content") : Optional.of(PatchOperation.addMethod(filePath, content));
            case UPDATE_METHOD: {
                String method = JsonUtils.textOrFallback(change, "method", "methodName");
                if (StringUtils.isBlank(method)) {
                    return missing(change, "method");
                }
                return content == null ? missing(change, "content") : Optional.of(PatchOperation.updateMethod(filePath, method, content));
            }
            case INSERT_AFTER: {
                String anchor = JsonUtils.textOrFallback(change, "insertAfter", "targetLocation");
                if (StringUtils.isBlank(anchor)) {
                    return missing(change, "insertAfter");
                }
                return content == null ? missing(change, "content") : Optional.of(PatchOperation.insertAfter(filePath, anchor, content));
            }
            case REPLACE_SECTION: {
                String search = JsonUtils.textOrFallback(change, "search", "targetLocation");
                if (StringUtils.isBlank(search)) {
                    return missing(change, "search");
                }
                return content == null ? missing(change, "content") : Optional.of(PatchOperation.replaceSection(filePath, search, content));
            }
            case CREATE_FILE:
                return content == null ? missing(change, "content") : Optional.of(PatchOperation.createFile(filePath, content));
            default:
                return Optional.empty();
        }
    }

    private static Optional<PatchOperation> missing(JsonNode change, String field) {
        log.warn("changeset.entry.missing field={} op={}", field, JsonUtils.textOrFallback(change, "operation"));
        return Optional.empty();
    }
}
