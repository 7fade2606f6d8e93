package com.zzf.selfpatch.core.patch;

import com.zzf.selfpatch.core.index.SourceFile;
import com.zzf.selfpatch.core.index.SourceFileStore;
import com.zzf.selfpatch.core.index.SourceTreeIndexer;
import com.zzf.selfpatch.core.util.AtomicFiles;
import com.zzf.selfpatch.project.ProjectContext;
import com.zzf.selfpatch.snapshot.OperationLog;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies {@link PatchOperation}s to the project tree in submission order. Every write is
 * atomic per operation and immediately reflected in the {@link SourceFileStore}, so later
 * operations of the same batch see earlier ones.
 */
@Slf4j
@Service
public class PatchEngine {

    private final ProjectContext projectContext;
    private final SourceFileStore store;
    private final SourceTreeIndexer indexer;
    private final OperationLog operationLog;
    private final Counter appliedCounter;
    private final Counter failedCounter;

    public PatchEngine(ProjectContext projectContext,
                       SourceFileStore store,
                       SourceTreeIndexer indexer,
                       OperationLog operationLog,
                       MeterRegistry meterRegistry) {
        this.projectContext = projectContext;
        this.store = store;
        this.indexer = indexer;
        this.operationLog = operationLog;
        this.appliedCounter = Counter.builder("selfpatch.patch.applied")
                .description("Patch operations written to disk")
                .register(meterRegistry);
        this.failedCounter = Counter.builder("selfpatch.patch.failed")
                .description("Patch operations that missed their anchor or failed to write")
                .register(meterRegistry);
    }

    public synchronized PatchResult apply(List<PatchOperation> operations) {
        if (operations == null || operations.isEmpty()) {
            return PatchResult.empty();
        }
        long t0 = System.nanoTime();
        List<PatchOutcome> outcomes = new ArrayList<>();
        int success = 0;
        int failure = 0;
        for (PatchOperation op : operations) {
            PatchOutcome outcome = applyOne(op);
            outcomes.add(outcome);
            if (outcome.isSuccess()) {
                success++;
                log.info("patch.applied op={} file={}", op.getKind().wireName(), op.getFilePath());
            } else {
                failure++;
                log.warn("patch.failed op={} file={} reason={}", op.getKind().wireName(), op.getFilePath(), outcome.getReason());
            }
        }
        appliedCounter.increment(success);
        failedCounter.increment(failure);

        indexer.refresh();
        operationLog.append(OperationLog.Entry.builder()
                .timestamp(System.currentTimeMillis())
                .type("code-modification")
                .status(failure == 0 ? "success" : (success == 0 ? "failed" : "partial"))
                .changesApplied(success)
                .changesFailed(failure)
                .build());

        long tookMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("patch.batch total={} success={} failure={} tookMs={}", operations.size(), success, failure, tookMs);
        return PatchResult.builder()
                .successCount(success)
                .failureCount(failure)
                .totalChanges(operations.size())
                .outcomes(outcomes)
                .build();
    }

    private PatchOutcome applyOne(PatchOperation op) {
        if (op == null) {
            return new PatchOutcome(null, null, false, "null operation");
        }
        Path target;
        String key;
        try {
            target = projectContext.resolve(op.getFilePath());
            key = projectContext.relativize(target);
        } catch (IllegalArgumentException e) {
            return PatchOutcome.failed(op, e.getMessage());
        }

        String current = "";
        if (op.requiresExistingFile()) {
            Optional<String> loaded = currentContent(key, target);
            if (loaded.isEmpty()) {
                return PatchOutcome.failed(op, "file not found");
            }
            current = loaded.get();
        }

        Optional<String> updated = op.applyTo(current);
        if (updated.isEmpty()) {
            return PatchOutcome.failed(op, "anchor not found");
        }
        try {
            AtomicFiles.writeString(target, updated.get());
        } catch (IOException e) {
            return PatchOutcome.failed(op, "write failed: " + e.getMessage());
        }
        store.put(key, updated.get());
        return PatchOutcome.applied(op);
    }

    private Optional<String> currentContent(String key, Path target) {
        Optional<SourceFile> cached = store.get(key);
        if (cached.isPresent()) {
            return Optional.of(cached.get().getContent());
        }
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(target, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("patch.read.fail path={} err={}", key, e.toString());
            return Optional.empty();
        }
    }
}
