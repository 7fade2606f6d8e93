package com.zzf.selfpatch.core.workflow;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.feature.ApplicationResult;
import com.zzf.selfpatch.core.feature.ConversationTurn;
import com.zzf.selfpatch.core.feature.FeatureGenerationOrchestrator;
import com.zzf.selfpatch.core.restart.RestartOutcome;
import com.zzf.selfpatch.core.restart.RestartStatus;
import com.zzf.selfpatch.core.restart.RestartTrigger;
import com.zzf.selfpatch.core.util.StringUtils;
import com.zzf.selfpatch.llm.LanguageModelOracle;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Conversation that guards every code change: detect, clarify, confirm, execute.
 * <p>
 * At most one workflow is active. While it is active, every utterance is a continuation and
 * never reaches intent classification; a quit phrase ends it from any stage.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FeatureRequestWorkflow {

    static final String CLARIFY_FALLBACK =
            "I can build that for you. Could you describe what it should do and where it should appear?";
    static final String CANCELLED_MESSAGE = "Okay, I've cancelled the feature request. Nothing was changed.";
    static final String YES_NO_PROMPT = "Should I go ahead and build it? Please answer yes or no.";

    private final FeatureIntentDetector detector;
    private final FeatureGenerationOrchestrator orchestrator;
    private final RestartTrigger restartTrigger;
    private final LanguageModelOracle oracle;
    private final SelfPatchProperties properties;

    private FeatureWorkflowState state;
    private volatile WorkflowStage published = WorkflowStage.IDLE;

    public synchronized WorkflowReply handle(String utterance) {
        try {
            if (state == null) {
                return start(utterance);
            }
            return switch (state.getStage()) {
                case CLARIFICATION -> onClarification(utterance);
                case CONFIRMATION -> onConfirmation(utterance);
                default -> {
                    state = null;
                    yield start(utterance);
                }
            };
        } finally {
            publish();
        }
    }

    public synchronized WorkflowReply cancel() {
        if (state == null) {
            return WorkflowReply.builder()
                    .handled(false)
                    .stage(WorkflowStage.IDLE)
                    .message("There is no feature request in progress.")
                    .build();
        }
        log.info("workflow.cancel stage={} via=api", state.getStage());
        state = null;
        publish();
        return cancelled();
    }

    public synchronized Optional<FeatureWorkflowState> currentState() {
        return state == null ? Optional.empty() : Optional.of(state.copy());
    }

    public synchronized boolean isActive() {
        return state != null;
    }

    /**
     * Current stage, readable without waiting for a running execution to finish.
     */
    public WorkflowStage stage() {
        return published;
    }

    private void publish() {
        published = state == null ? WorkflowStage.IDLE : state.getStage();
    }

    private WorkflowReply start(String utterance) {
        FeatureDetection detection = detector.detect(utterance);
        if (!detection.isFeatureRequest()) {
            return WorkflowReply.notHandled();
        }
        state = new FeatureWorkflowState(utterance.trim(), detection);
        String question = askOracle(clarifyPrompt(utterance.trim(), detection), CLARIFY_FALLBACK);
        state.getTurns().add(ConversationTurn.assistant(question));
        log.info("workflow.start confidence={} source={} target={}",
                detection.getConfidence(), detection.getSource(), detection.getTarget());
        return WorkflowReply.builder()
                .handled(true)
                .stage(WorkflowStage.CLARIFICATION)
                .message(question)
                .build();
    }

    private WorkflowReply onClarification(String utterance) {
        if (ReplyClassifier.isQuit(utterance)) {
            log.info("workflow.quit stage=CLARIFICATION");
            state = null;
            return cancelled();
        }
        String clarification = utterance == null ? "" : utterance.trim();
        state.setClarification(clarification);
        state.getTurns().add(ConversationTurn.user(clarification));
        state.setStage(WorkflowStage.CONFIRMATION);

        String fallback = "To confirm, you want: \"" + state.getOriginalRequest() + "\" with these details: \""
                + clarification + "\". " + YES_NO_PROMPT;
        String summary = askOracle(confirmPrompt(state.getOriginalRequest(), clarification), fallback);
        state.getTurns().add(ConversationTurn.assistant(summary));
        log.info("workflow.clarified chars={}", clarification.length());
        return WorkflowReply.builder()
                .handled(true)
                .stage(WorkflowStage.CONFIRMATION)
                .message(summary)
                .build();
    }

    private WorkflowReply onConfirmation(String utterance) {
        if (ReplyClassifier.isQuit(utterance) || ReplyClassifier.isNegation(utterance)) {
            log.info("workflow.denied stage=CONFIRMATION");
            state = null;
            return cancelled();
        }
        if (!ReplyClassifier.isAffirmation(utterance)) {
            log.info("workflow.confirm.unclear uncertain={}", ReplyClassifier.isUncertain(utterance));
            return WorkflowReply.builder()
                    .handled(true)
                    .stage(WorkflowStage.CONFIRMATION)
                    .message("I didn't catch that. " + YES_NO_PROMPT)
                    .build();
        }
        state.getTurns().add(ConversationTurn.user(utterance.trim()));
        FeatureWorkflowState executing = state;
        state = null;
        published = WorkflowStage.EXECUTING;
        return execute(executing);
    }

    private WorkflowReply execute(FeatureWorkflowState executing) {
        log.info("workflow.execute request={}", StringUtils.truncate(executing.getOriginalRequest(), 80));
        ApplicationResult result;
        try {
            result = orchestrator.generateAndApply(executing.getTurns());
        } catch (RuntimeException e) {
            log.error("workflow.execute.fail err={}", e.toString(), e);
            return WorkflowReply.builder()
                    .handled(true)
                    .stage(WorkflowStage.IDLE)
                    .executed(true)
                    .message("Something went wrong while building the feature: " + e.getMessage()
                            + ". Nothing else was changed.")
                    .build();
        }

        StringBuilder message = new StringBuilder(report(result));
        RestartOutcome restart = null;
        if (result.isNeedsRestart() && result.getSuccessCount() > 0) {
            restart = awaitRestart();
            message.append(' ').append(restartMessage(restart));
        }
        return WorkflowReply.builder()
                .handled(true)
                .stage(WorkflowStage.IDLE)
                .executed(true)
                .result(result)
                .restart(restart)
                .message(message.toString())
                .build();
    }

    private RestartOutcome awaitRestart() {
        int awaitSeconds = properties.getWorkflow().getRestartAwaitSeconds();
        try {
            return restartTrigger.requestRestart().get(awaitSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            log.warn("workflow.restart.await timeoutSec={}", awaitSeconds);
            return new RestartOutcome(RestartStatus.LAUNCHED, "Restart scheduled");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new RestartOutcome(RestartStatus.FAILED, "Interrupted while waiting for restart");
        } catch (ExecutionException e) {
            return new RestartOutcome(RestartStatus.FAILED, "Restart failed: " + e.getCause());
        }
    }

    private static String report(ApplicationResult result) {
        String description = StringUtils.isBlank(result.getDescription()) ? "the requested feature" : result.getDescription();
        if (result.isSuccess()) {
            StringBuilder sb = new StringBuilder("Done! Applied ")
                    .append(result.getSuccessCount()).append(" of ").append(result.getTotalChanges())
                    .append(" changes: ").append(description).append('.');
            if (result.getFailureCount() > 0) {
                sb.append(' ').append(result.getFailureCount()).append(" change(s) could not be applied.");
            }
            if (result.isFallback()) {
                sb.append(" I used a built-in template for this one.");
            }
            return sb.toString();
        }
        return "I couldn't apply the feature (" + result.getSuccessCount() + " of " + result.getTotalChanges()
                + " changes applied): " + description + ".";
    }

    private static String restartMessage(RestartOutcome restart) {
        if (restart.getStatus() == RestartStatus.FAILED) {
            return "The application needs a restart, but relaunching failed: " + restart.getMessage()
                    + ". Please restart it manually.";
        }
        if (restart.getStatus() == RestartStatus.ALREADY_PENDING) {
            return "A restart is already on its way.";
        }
        return "Restarting the application to load the new feature.";
    }

    private WorkflowReply cancelled() {
        return WorkflowReply.builder()
                .handled(true)
                .stage(WorkflowStage.IDLE)
                .cancelled(true)
                .message(CANCELLED_MESSAGE)
                .build();
    }

    private String askOracle(String prompt, String fallback) {
        SelfPatchProperties.Oracle cfg = properties.getOracle();
        try {
            String reply = oracle.complete(prompt, cfg.getChatTemperature(), cfg.getChatMaxTokens());
            return StringUtils.isBlank(reply) ? fallback : reply.trim();
        } catch (RuntimeException e) {
            log.warn("workflow.oracle.fail err={}", e.toString());
            return fallback;
        }
    }

    private static String clarifyPrompt(String request, FeatureDetection detection) {
        return "You are an assistant that can build new features into its own application.\n" +
                "The user asked: \"" + request + "\"\n" +
                (StringUtils.isBlank(detection.getDescription()) ? "" : "Understood as: " + detection.getDescription() + "\n") +
                "Reply with one short, friendly clarifying question about what exactly they want and where it should appear. " +
                "Do not write code.";
    }

    private static String confirmPrompt(String request, String clarification) {
        return "You are an assistant that can build new features into its own application.\n" +
                "Original request: \"" + request + "\"\n" +
                "Clarification: \"" + clarification + "\"\n" +
                "Restate in two or three sentences what you will build, then ask the user to confirm with yes or no. " +
                "Do not write code.";
    }
}
