package com.zzf.selfpatch.core.patch;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.index.SourceFileStore;
import com.zzf.selfpatch.core.index.SourceTreeIndexer;
import com.zzf.selfpatch.project.ProjectContext;
import com.zzf.selfpatch.snapshot.OperationLog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatchEngineTest {

    private static final String APP = String.join("\n",
            "class App {",
            "    constructor() {",
            "        this.projects = [];",
            "    }",
            "",
            "    loadProjects() {",
            "        return this.projects;",
            "    }",
            "}",
            "");

    @TempDir
    Path root;

    private SourceFileStore store;
    private OperationLog operationLog;
    private SimpleMeterRegistry meterRegistry;
    private PatchEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        Path app = root.resolve("src/ui/app.js");
        Files.createDirectories(app.getParent());
        Files.writeString(app, APP, StandardCharsets.UTF_8);

        SelfPatchProperties properties = new SelfPatchProperties();
        properties.setProjectRoot(root.toString());
        ProjectContext context = new ProjectContext(root);
        store = new SourceFileStore();
        SourceTreeIndexer indexer = new SourceTreeIndexer(context, store, properties);
        indexer.refresh();
        operationLog = new OperationLog(context, properties, new ObjectMapper());
        meterRegistry = new SimpleMeterRegistry();
        engine = new PatchEngine(context, store, indexer, operationLog, meterRegistry);
    }

    @Test
    void missingMethodIsCountedAsFailureAndLeavesFileUntouched() throws Exception {
        PatchResult result = engine.apply(List.of(
                PatchOperation.updateMethod("src/ui/app.js", "loadNotes", "\n        return [];")));

        assertEquals(0, result.getSuccessCount());
        assertEquals(1, result.getFailureCount());
        assertEquals(1, result.getTotalChanges());
        assertEquals("anchor not found", result.getOutcomes().get(0).getReason());
        assertEquals(APP, Files.readString(root.resolve("src/ui/app.js"), StandardCharsets.UTF_8));
        assertEquals(1.0, meterRegistry.counter("selfpatch.patch.failed").count(), 1e-9);
    }

    @Test
    void everyAnchorMissIsANoOp() throws Exception {
        PatchResult result = engine.apply(List.of(
                PatchOperation.insertAfter("src/ui/app.js", "this.inventory = [];", "x"),
                PatchOperation.replaceSection("src/ui/app.js", "loadInventory()", "y"),
                PatchOperation.addMethod("src/ui/missing.js", "z() {}")));

        assertEquals(0, result.getSuccessCount());
        assertEquals(3, result.getFailureCount());
        assertEquals("file not found", result.getOutcomes().get(2).getReason());
        assertEquals(APP, Files.readString(root.resolve("src/ui/app.js"), StandardCharsets.UTF_8));
        assertFalse(Files.exists(root.resolve("src/ui/missing.js")));
    }

    @Test
    void laterOperationsSeeEarlierWritesOfTheSameBatch() throws Exception {
        PatchResult result = engine.apply(List.of(
                PatchOperation.addMethod("src/ui/app.js", "\n    loadNotes() {\n        return [];\n    }"),
                PatchOperation.updateMethod("src/ui/app.js", "loadNotes", "\n        return this.notes;"),
                PatchOperation.insertAfter("src/ui/app.js", "this.projects = [];", "        this.notes = [];")));

        assertEquals(3, result.getSuccessCount());
        assertEquals(0, result.getFailureCount());
        String onDisk = Files.readString(root.resolve("src/ui/app.js"), StandardCharsets.UTF_8);
        assertTrue(onDisk.contains("    loadNotes() {\n        return this.notes;\n    }"));
        assertTrue(onDisk.contains("this.projects = [];\n        this.notes = [];"));
        assertEquals(onDisk, store.get("src/ui/app.js").orElseThrow().getContent());
        assertTrue(store.get("src/ui/app.js").orElseThrow().getFunctions().contains("loadNotes"));
    }

    @Test
    void createFileAddsParentsAndIndexesTheFile() throws Exception {
        PatchResult result = engine.apply(List.of(
                PatchOperation.createFile("src/features/notes.js", "export function listNotes() {\n    return [];\n}\n")));

        assertEquals(1, result.getSuccessCount());
        assertTrue(Files.exists(root.resolve("src/features/notes.js")));
        assertTrue(store.contains("src/features/notes.js"));
    }

    @Test
    void pathsOutsideTheProjectAreRejected() {
        PatchResult result = engine.apply(List.of(PatchOperation.createFile("../escape.js", "x")));

        assertEquals(1, result.getFailureCount());
        assertFalse(Files.exists(root.getParent().resolve("escape.js")));
    }

    @Test
    void batchIsRecordedInOperationLog() {
        engine.apply(List.of(
                PatchOperation.insertAfter("src/ui/app.js", "this.projects = [];", "        this.notes = [];"),
                PatchOperation.replaceSection("src/ui/app.js", "not there", "x")));

        List<OperationLog.Entry> entries = operationLog.entries();
        assertEquals(1, entries.size());
        assertEquals("code-modification", entries.get(0).getType());
        assertEquals("partial", entries.get(0).getStatus());
        assertEquals(1, entries.get(0).getChangesApplied());
        assertEquals(1, entries.get(0).getChangesFailed());
        assertTrue(Files.exists(root.resolve(".selfpatch-backups").resolve("operations.log")));
    }
}
