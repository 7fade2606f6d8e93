package com.zzf.selfpatch.controller;

import com.zzf.selfpatch.core.restart.RestartOutcome;
import com.zzf.selfpatch.core.restart.RestartTrigger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/restart")
@RequiredArgsConstructor
public class RestartController {

    private final RestartTrigger restartTrigger;

    @PostMapping
    public Map<String, Object> restart() {
        CompletableFuture<RestartOutcome> future = restartTrigger.requestRestart();
        Map<String, Object> response = new LinkedHashMap<>();
        // The launch happens after the grace delay; an already completed future means it was refused.
        RestartOutcome outcome = future.getNow(null);
        response.put("status", outcome == null ? "SCHEDULED" : outcome.getStatus().name());
        if (outcome != null) {
            response.put("message", outcome.getMessage());
        }
        response.put("pending", restartTrigger.isPending());
        return response;
    }
}
