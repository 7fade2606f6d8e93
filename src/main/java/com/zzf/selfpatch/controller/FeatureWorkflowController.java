package com.zzf.selfpatch.controller;

import com.zzf.selfpatch.api.ApiException;
import com.zzf.selfpatch.core.workflow.FeatureRequestWorkflow;
import com.zzf.selfpatch.core.workflow.FeatureWorkflowState;
import com.zzf.selfpatch.core.workflow.WorkflowReply;
import com.zzf.selfpatch.core.workflow.WorkflowStage;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@Slf4j
@RestController
@RequestMapping("/api/feature")
@RequiredArgsConstructor
public class FeatureWorkflowController {

    private final FeatureRequestWorkflow workflow;

    @Data
    public static class MessageRequest {
        private String text;
    }

    @PostMapping("/messages")
    public WorkflowReply message(@RequestBody MessageRequest request) {
        if (request == null || request.getText() == null) {
            throw new ApiException("EMPTY_MESSAGE", "text is required");
        }
        return workflow.handle(request.getText());
    }

    @GetMapping("/state")
    public Map<String, Object> state() {
        Map<String, Object> response = new LinkedHashMap<>();
        Optional<FeatureWorkflowState> state = workflow.currentState();
        response.put("active", state.isPresent());
        response.put("stage", state.map(FeatureWorkflowState::getStage).orElse(WorkflowStage.IDLE));
        state.ifPresent(s -> {
            response.put("originalRequest", s.getOriginalRequest());
            response.put("clarification", s.getClarification());
            response.put("detection", s.getDetection());
        });
        return response;
    }

    @PostMapping("/cancel")
    public WorkflowReply cancel() {
        return workflow.cancel();
    }
}
