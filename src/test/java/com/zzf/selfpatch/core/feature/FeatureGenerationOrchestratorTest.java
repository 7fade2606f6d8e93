package com.zzf.selfpatch.core.feature;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.index.SourceAnalyzer;
import com.zzf.selfpatch.core.index.SourceFileStore;
import com.zzf.selfpatch.core.index.SourceSummarizer;
import com.zzf.selfpatch.core.index.SourceTreeIndexer;
import com.zzf.selfpatch.core.patch.PatchEngine;
import com.zzf.selfpatch.llm.LanguageModelOracle;
import com.zzf.selfpatch.llm.OracleException;
import com.zzf.selfpatch.project.ProjectContext;
import com.zzf.selfpatch.snapshot.BackupStore;
import com.zzf.selfpatch.snapshot.OperationLog;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeatureGenerationOrchestratorTest {

    static final String APP = String.join("\n",
            "class App {",
            "    constructor() {",
            "        this.currentPage = 'dashboard';",
            "        this.projects = [];",
            "    }",
            "",
            "    showSuccess(message) {",
            "        console.log(message);",
            "    }",
            "",
            "    loadNotes() {",
            "        const notesList = document.getElementById('notesList');",
            "    }",
            "}",
            "");

    static final String INDEX = String.join("\n",
            "<html><head><style>",
            "#notesPage { display: none; }",
            ".note-card:hover { color: #fff; }",
            "</style></head>",
            "<body><div id=\"notesPage\" class=\"page hidden\">",
            "<button id=\"addNoteBtn\" class=\"btn primary\">Add</button></div></body></html>",
            "");

    static final String ADD_LOG_CLICK = "{\"changes\":[{\"filePath\":\"src/ui/app.js\",\"operation\":\"addMethod\","
            + "\"content\":\"\\n    logClick() {\\n        console.log('clicked');\\n    }\"}],"
            + "\"description\":\"Log button clicks\",\"needsRestart\":false}";

    @TempDir
    Path root;

    private LanguageModelOracle oracle;
    private BackupStore backups;
    private SelfPatchProperties properties;
    private FeatureGenerationOrchestrator orchestrator;

    @BeforeEach
    void setUp() throws Exception {
        Path app = root.resolve("src/ui/app.js");
        Files.createDirectories(app.getParent());
        Files.writeString(app, APP, StandardCharsets.UTF_8);
        Files.writeString(root.resolve("src/ui/index.html"), INDEX, StandardCharsets.UTF_8);

        properties = new SelfPatchProperties();
        properties.setProjectRoot(root.toString());
        ProjectContext context = new ProjectContext(root);
        ObjectMapper mapper = new ObjectMapper();
        SourceFileStore store = new SourceFileStore();
        SourceTreeIndexer indexer = new SourceTreeIndexer(context, store, properties);
        indexer.refresh();
        OperationLog operationLog = new OperationLog(context, properties, mapper);
        PatchEngine engine = new PatchEngine(context, store, indexer, operationLog, new SimpleMeterRegistry());
        backups = new BackupStore(context, store, properties, mapper, operationLog);
        ChangeSetParser parser = new ChangeSetParser();
        FallbackChangeSets fallbacks = new FallbackChangeSets(properties, new DefaultResourceLoader(), mapper, parser);
        oracle = Mockito.mock(LanguageModelOracle.class);
        ChangeSetReviewer reviewer = new ChangeSetReviewer(oracle, store, properties, mapper);
        orchestrator = new FeatureGenerationOrchestrator(oracle, new FeaturePromptBuilder(), parser, reviewer,
                new SourceAnalyzer(store, properties), fallbacks, new SourceSummarizer(store, properties),
                engine, backups, properties, mapper);
    }

    @Test
    void appliesReviewedChangeSetBehindASnapshot() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn(
                "Sure, here it is:\n```json\n" + ADD_LOG_CLICK + "\n```",
                review("approved", 92, "{\"filePath\":\"src/ui/app.js\",\"operation\":\"addMethod\","
                        + "\"content\":\"\\n    logClick() {\\n        console.log('clicked');\\n    }\"}"));

        ApplicationResult result = orchestrator.generateAndApply(List.of(
                ConversationTurn.user("add a button that logs clicks"),
                ConversationTurn.assistant("Which page?"),
                ConversationTurn.user("the dashboard")));

        assertEquals(1, result.getSuccessCount());
        assertEquals(0, result.getFailureCount());
        assertFalse(result.isNeedsRestart());
        assertFalse(result.isFallback());
        assertEquals("Log button clicks", result.getDescription());
        assertNotNull(result.getBackupTimestamp());
        assertEquals(1, backups.listSnapshots().size());
        assertTrue(read().contains("logClick() {"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(oracle).complete(prompt.capture(), eq(0.2), eq(4000));
        assertTrue(prompt.getValue().contains("USER: add a button that logs clicks"));
        assertTrue(prompt.getValue().contains("=== src/ui/app.js ==="));
        assertTrue(prompt.getValue().contains("File: src/ui/index.html"));
        assertTrue(prompt.getValue().contains("- IDs found: notesPage, addNoteBtn"));
        verify(oracle).complete(contains("senior code reviewer"), eq(0.1), eq(4000));
    }

    @Test
    void lowSafetyScoreRejectsTheChangeSet() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn(
                ADD_LOG_CLICK,
                review("approved", 40, "{\"filePath\":\"src/ui/app.js\",\"operation\":\"addMethod\",\"content\":\"x() {}\"}"));

        ApplicationResult result = orchestrator.generateAndApply(List.of(ConversationTurn.user("make the sidebar draggable")));

        assertEquals(0, result.getTotalChanges());
        assertTrue(result.getDescription().startsWith("Code generation failed: review rejected the changes"));
        assertTrue(result.getDescription().contains("safety score 40 below 70"));
        assertNull(result.getBackupTimestamp());
        assertEquals(APP, read());
    }

    @Test
    void rejectedNoteRequestStillGetsTheTemplate() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn(
                ADD_LOG_CLICK,
                review("rejected", 85, "{\"filePath\":\"src/ui/app.js\",\"operation\":\"addMethod\",\"content\":\"x() {}\"}"));

        ChangeSet changeSet = orchestrator.generate(List.of(ConversationTurn.user("I want to keep notes")), "");

        assertTrue(changeSet.isFallback());
        assertEquals(4, changeSet.getOperations().size());
    }

    @Test
    void unparseableReviewFallsThroughToFailure() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn(ADD_LOG_CLICK, "Looks good to me!");

        ApplicationResult result = orchestrator.generateAndApply(List.of(ConversationTurn.user("add a clock widget")));

        assertEquals(0, result.getTotalChanges());
        assertEquals("Code generation failed: review rejected the changes: no valid review in reply", result.getDescription());
        assertEquals(APP, read());
    }

    @Test
    void reviewKeepsAnchorsOfTheGeneratedChanges() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn(
                "{\"changes\":[{\"filePath\":\"src/ui/app.js\",\"operation\":\"replaceSection\","
                        + "\"search\":\"console.log(message);\",\"content\":\"console.info(message);\"}],"
                        + "\"description\":\"Quieter success messages\"}",
                review("approved", 88, "{\"filePath\":\"src/ui/app.js\",\"operation\":\"replaceSection\","
                        + "\"content\":\"console.warn(message);\"}"));

        ApplicationResult result = orchestrator.generateAndApply(List.of(ConversationTurn.user("log success as a warning")));

        assertEquals(1, result.getSuccessCount());
        assertEquals("Quieter success messages", result.getDescription());
        String updated = read();
        assertTrue(updated.contains("console.warn(message);"));
        assertFalse(updated.contains("console.log(message);"));
    }

    @Test
    void reviewCanBeSwitchedOff() throws Exception {
        properties.getReview().setEnabled(false);
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn(ADD_LOG_CLICK);

        ApplicationResult result = orchestrator.generateAndApply(List.of(ConversationTurn.user("add a click logger")));

        assertEquals(1, result.getSuccessCount());
        verify(oracle, times(1)).complete(anyString(), anyDouble(), anyInt());
    }

    @Test
    void proseReplyForNoteRequestFallsBackToTemplate() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt()))
                .thenReturn("I'd love to help you add notes! First, let's think about the design...");

        ApplicationResult result = orchestrator.generateAndApply(List.of(
                ConversationTurn.user("I want to take notes in the app"),
                ConversationTurn.user("yes")));

        assertTrue(result.isFallback());
        assertTrue(result.isNeedsRestart());
        assertEquals(4, result.getTotalChanges());
        assertEquals(4, result.getSuccessCount());
        String updated = read();
        assertTrue(updated.contains("async addNote(noteData) {"));
        assertTrue(updated.contains("loadNotesFromStorage() {"));
        assertTrue(updated.contains("this.loadNotesFromStorage();"));
        assertTrue(updated.contains("No notes yet."));
    }

    @Test
    void oracleFailureWithoutKnownFeatureGivesEmptyResult() throws Exception {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenThrow(new OracleException("timeout"));

        ApplicationResult result = orchestrator.generateAndApply(List.of(ConversationTurn.user("make the sidebar draggable")));

        assertEquals(0, result.getSuccessCount());
        assertEquals(0, result.getTotalChanges());
        assertTrue(result.getDescription().startsWith("Code generation failed"));
        assertNull(result.getBackupTimestamp());
        assertEquals(APP, read());
    }

    @Test
    void emptyChangesListIsTreatedAsFailure() {
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn("{\"changes\":[],\"description\":\"nothing\"}");

        ChangeSet changeSet = orchestrator.generate(List.of(ConversationTurn.user("add a clock widget")), "");

        assertTrue(changeSet.isEmpty());
        assertFalse(changeSet.isFallback());
        assertEquals("Code generation failed: no usable changes", changeSet.getDescription());
    }

    private static String review(String status, int score, String change) {
        return "{\"validationStatus\":\"" + status + "\",\"changes\":[" + change + "],"
                + "\"overallAssessment\":\"checked\",\"safetyScore\":" + score + "}";
    }

    private String read() throws Exception {
        return Files.readString(root.resolve("src/ui/app.js"), StandardCharsets.UTF_8);
    }
}
