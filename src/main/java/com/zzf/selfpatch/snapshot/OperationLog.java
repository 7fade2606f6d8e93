package com.zzf.selfpatch.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.util.AtomicFiles;
import com.zzf.selfpatch.project.ProjectContext;
import jakarta.annotation.PostConstruct;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only record of backups, restores and patch batches, kept next to the persisted
 * snapshots as a JSON array.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperationLog {
    static final String FILE_NAME = "operations.log";

    private final ProjectContext projectContext;
    private final SelfPatchProperties properties;
    private final ObjectMapper objectMapper;
    private final List<Entry> entries = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Entry {
        private long timestamp;
        private String type;
        private String status;
        private Integer filesCount;
        private Integer changesApplied;
        private Integer changesFailed;
        private Long snapshot;
        private String error;
    }

    @PostConstruct
    public synchronized void load() {
        Path file = logFile();
        if (!Files.exists(file)) {
            return;
        }
        try {
            List<Entry> loaded = objectMapper.readValue(file.toFile(), new TypeReference<List<Entry>>() {});
            entries.clear();
            entries.addAll(loaded);
        } catch (Exception e) {
            log.warn("oplog.load.fail path={} err={}", file, e.toString());
        }
    }

    public synchronized void append(Entry entry) {
        entries.add(entry);
        if (!properties.getBackup().isPersist()) {
            return;
        }
        try {
            AtomicFiles.writeString(logFile(), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entries));
        } catch (Exception e) {
            log.warn("oplog.save.fail err={}", e.toString());
        }
    }

    public synchronized List<Entry> entries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    private Path logFile() {
        return projectContext.getRoot().resolve(properties.getBackup().getDirectory()).resolve(FILE_NAME);
    }
}
