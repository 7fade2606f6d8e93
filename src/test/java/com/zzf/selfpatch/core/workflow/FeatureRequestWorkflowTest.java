package com.zzf.selfpatch.core.workflow;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.feature.ApplicationResult;
import com.zzf.selfpatch.core.feature.ConversationTurn;
import com.zzf.selfpatch.core.feature.FeatureGenerationOrchestrator;
import com.zzf.selfpatch.core.restart.RestartOutcome;
import com.zzf.selfpatch.core.restart.RestartStatus;
import com.zzf.selfpatch.core.restart.RestartTrigger;
import com.zzf.selfpatch.llm.LanguageModelOracle;
import com.zzf.selfpatch.llm.OracleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeatureRequestWorkflowTest {

    private FeatureIntentDetector detector;
    private FeatureGenerationOrchestrator orchestrator;
    private RestartTrigger restartTrigger;
    private LanguageModelOracle oracle;
    private FeatureRequestWorkflow workflow;

    @BeforeEach
    void setUp() {
        detector = Mockito.mock(FeatureIntentDetector.class);
        orchestrator = Mockito.mock(FeatureGenerationOrchestrator.class);
        restartTrigger = Mockito.mock(RestartTrigger.class);
        oracle = Mockito.mock(LanguageModelOracle.class);
        workflow = new FeatureRequestWorkflow(detector, orchestrator, restartTrigger, oracle, new SelfPatchProperties());

        when(detector.detect(anyString())).thenReturn(FeatureDetection.none("primary"));
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenReturn("Sounds good. Where should it go?");
    }

    @Test
    void ordinaryChatIsNotHandled() {
        WorkflowReply reply = workflow.handle("what time is it?");

        assertFalse(reply.isHandled());
        assertEquals(WorkflowStage.IDLE, reply.getStage());
        assertFalse(workflow.isActive());
    }

    @Test
    void buttonFeatureWithoutRestart() {
        featureDetected("add a button that logs when clicked");
        when(orchestrator.generateAndApply(anyList())).thenReturn(ApplicationResult.builder()
                .successCount(1).failureCount(0).totalChanges(1)
                .description("Added a logging button").needsRestart(false).build());

        WorkflowReply first = workflow.handle("add a button that logs when clicked");
        assertTrue(first.isHandled());
        assertEquals(WorkflowStage.CLARIFICATION, first.getStage());

        WorkflowReply second = workflow.handle("on the dashboard, log to the console");
        assertEquals(WorkflowStage.CONFIRMATION, second.getStage());
        assertEquals("on the dashboard, log to the console", workflow.currentState().orElseThrow().getClarification());

        WorkflowReply done = workflow.handle("yes");

        assertTrue(done.isExecuted());
        assertEquals(WorkflowStage.IDLE, done.getStage());
        assertEquals(1, done.getResult().getSuccessCount());
        assertTrue(done.getMessage().contains("Added a logging button"));
        assertFalse(workflow.isActive());
        verify(restartTrigger, never()).requestRestart();

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ConversationTurn>> turns = ArgumentCaptor.forClass(List.class);
        verify(orchestrator).generateAndApply(turns.capture());
        assertEquals("add a button that logs when clicked", turns.getValue().get(0).getContent());
        assertEquals("yes", turns.getValue().get(turns.getValue().size() - 1).getContent());
    }

    @Test
    void noteFallbackTriggersRestartOnce() {
        featureDetected("I want to take notes");
        when(orchestrator.generateAndApply(anyList())).thenReturn(ApplicationResult.builder()
                .successCount(4).failureCount(0).totalChanges(4).fallback(true)
                .description("Note-taking feature with add, edit, delete functionality").needsRestart(true).build());
        when(restartTrigger.requestRestart()).thenReturn(CompletableFuture.completedFuture(
                new RestartOutcome(RestartStatus.LAUNCHED, "Restart launched: npm run fresh")));

        workflow.handle("I want to take notes");
        workflow.handle("a simple list on the notes page");
        WorkflowReply done = workflow.handle("go ahead");

        assertTrue(done.isExecuted());
        assertEquals(RestartStatus.LAUNCHED, done.getRestart().getStatus());
        assertTrue(done.getMessage().contains("Restarting"));
        verify(restartTrigger, times(1)).requestRestart();
    }

    @Test
    void restartFailureIsReported() {
        featureDetected("add notes");
        when(orchestrator.generateAndApply(anyList())).thenReturn(ApplicationResult.builder()
                .successCount(1).totalChanges(1).needsRestart(true).description("notes").build());
        when(restartTrigger.requestRestart()).thenReturn(CompletableFuture.completedFuture(
                new RestartOutcome(RestartStatus.FAILED, "Restart failed: npm: not found")));

        workflow.handle("add notes");
        workflow.handle("anything");
        WorkflowReply done = workflow.handle("sure");

        assertTrue(done.getMessage().contains("npm: not found"));
        assertTrue(done.getMessage().contains("restart it manually"));
    }

    @Test
    void noRestartWhenNothingWasApplied() {
        featureDetected("add notes");
        when(orchestrator.generateAndApply(anyList())).thenReturn(ApplicationResult.builder()
                .successCount(0).failureCount(1).totalChanges(1).needsRestart(true).description("notes").build());

        workflow.handle("add notes");
        workflow.handle("details");
        WorkflowReply done = workflow.handle("yes");

        assertTrue(done.getMessage().startsWith("I couldn't apply the feature"));
        verify(restartTrigger, never()).requestRestart();
    }

    @Test
    void quitDuringClarificationCancels() {
        featureDetected("add a chart");

        workflow.handle("add a chart");
        WorkflowReply reply = workflow.handle("never mind");

        assertTrue(reply.isCancelled());
        assertFalse(workflow.isActive());
        verify(orchestrator, never()).generateAndApply(anyList());
    }

    @Test
    void quitOrDenialDuringConfirmationCancels() {
        featureDetected("add a chart");

        workflow.handle("add a chart");
        workflow.handle("a bar chart of inventory");
        assertTrue(workflow.handle("nope").isCancelled());

        workflow.handle("add a chart");
        workflow.handle("a bar chart of inventory");
        assertTrue(workflow.handle("stop").isCancelled());

        verify(orchestrator, never()).generateAndApply(anyList());
    }

    @Test
    void ambiguousConfirmationRepromptsAndStays() {
        featureDetected("add a chart");
        workflow.handle("add a chart");
        workflow.handle("bar chart");

        WorkflowReply reply = workflow.handle("hmm, maybe later tonight");

        assertEquals(WorkflowStage.CONFIRMATION, reply.getStage());
        assertTrue(reply.getMessage().contains("yes or no"));
        assertTrue(workflow.isActive());
    }

    @Test
    void hedgedOrNegatedYesRepromptsWithoutTouchingCode() {
        featureDetected("add a timer widget");
        workflow.handle("add a timer widget");
        workflow.handle("on the dashboard");

        WorkflowReply notSure = workflow.handle("I'm not sure");
        assertEquals(WorkflowStage.CONFIRMATION, notSure.getStage());
        assertFalse(notSure.isExecuted());
        assertTrue(notSure.getMessage().contains("yes or no"));

        WorkflowReply notOk = workflow.handle("not ok");
        assertEquals(WorkflowStage.CONFIRMATION, notOk.getStage());
        assertFalse(notOk.isExecuted());

        assertTrue(workflow.isActive());
        verify(orchestrator, never()).generateAndApply(anyList());
    }

    @Test
    void negationBeatsAffirmation() {
        featureDetected("add a timer widget");
        workflow.handle("add a timer widget");
        workflow.handle("on the dashboard");

        WorkflowReply reply = workflow.handle("yes, no wait");

        assertTrue(reply.isCancelled());
        assertFalse(workflow.isActive());
        verify(orchestrator, never()).generateAndApply(anyList());
    }

    @Test
    void clarificationMentioningStopIsNotAQuit() {
        featureDetected("add a timer widget");
        workflow.handle("add a timer widget");

        WorkflowReply reply = workflow.handle("it needs start and stop buttons");

        assertFalse(reply.isCancelled());
        assertEquals(WorkflowStage.CONFIRMATION, reply.getStage());
        assertEquals("it needs start and stop buttons", workflow.currentState().orElseThrow().getClarification());
    }

    @Test
    void leadingQuitCommandStillCancelsClarification() {
        featureDetected("add a timer widget");
        workflow.handle("add a timer widget");

        WorkflowReply reply = workflow.handle("Cancel that.");

        assertTrue(reply.isCancelled());
        assertFalse(workflow.isActive());
    }

    @Test
    void stageIsPublishedThroughExecution() {
        featureDetected("add a chart");
        List<WorkflowStage> duringExecution = new ArrayList<>();
        when(orchestrator.generateAndApply(anyList())).thenAnswer(invocation -> {
            duringExecution.add(workflow.stage());
            return ApplicationResult.builder().successCount(1).totalChanges(1).description("chart").build();
        });

        assertEquals(WorkflowStage.IDLE, workflow.stage());
        workflow.handle("add a chart");
        assertEquals(WorkflowStage.CLARIFICATION, workflow.stage());
        workflow.handle("a bar chart");
        assertEquals(WorkflowStage.CONFIRMATION, workflow.stage());
        workflow.handle("yes");

        assertEquals(List.of(WorkflowStage.EXECUTING), duringExecution);
        assertEquals(WorkflowStage.IDLE, workflow.stage());
    }

    @Test
    void activeWorkflowNeverReclassifies() {
        featureDetected("add a chart");
        workflow.handle("add a chart");
        workflow.handle("also add a calendar feature please");

        verify(detector, times(1)).detect(anyString());
        assertEquals(WorkflowStage.CONFIRMATION, workflow.currentState().orElseThrow().getStage());
    }

    @Test
    void cancelFromApi() {
        featureDetected("add a chart");
        workflow.handle("add a chart");

        assertTrue(workflow.cancel().isCancelled());
        assertFalse(workflow.isActive());
        assertFalse(workflow.cancel().isHandled());
    }

    @Test
    void oracleOutageStillProducesMessages() {
        featureDetected("add a chart");
        when(oracle.complete(anyString(), anyDouble(), anyInt())).thenThrow(new OracleException("offline"));

        WorkflowReply question = workflow.handle("add a chart");
        assertEquals(FeatureRequestWorkflow.CLARIFY_FALLBACK, question.getMessage());

        WorkflowReply confirm = workflow.handle("bar chart");
        assertTrue(confirm.getMessage().contains("add a chart"));
        assertTrue(confirm.getMessage().contains("bar chart"));
    }

    @Test
    void executionErrorStillAnswersAndResets() {
        featureDetected("add a chart");
        when(orchestrator.generateAndApply(any())).thenThrow(new IllegalStateException("disk full"));

        workflow.handle("add a chart");
        workflow.handle("bar chart");
        WorkflowReply done = workflow.handle("ok");

        assertTrue(done.getMessage().contains("disk full"));
        assertFalse(workflow.isActive());
    }

    private void featureDetected(String utterance) {
        when(detector.detect(utterance)).thenReturn(FeatureDetection.builder()
                .featureRequest(true).confidence(0.95).target("ui").source("primary").build());
    }
}
