package com.zzf.selfpatch.infrastructure;

import com.zzf.selfpatch.core.workflow.FeatureRequestWorkflow;
import com.zzf.selfpatch.core.workflow.WorkflowStage;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request's log lines with a trace id and the feature workflow stage it arrived in.
 */
@Component
@RequiredArgsConstructor
public final class TraceIdFilter extends OncePerRequestFilter {
    static final String HEADER = "X-Trace-Id";
    static final String TRACE_KEY = "traceId";
    static final String STAGE_KEY = "workflowStage";

    private final FeatureRequestWorkflow workflow;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = request.getHeader(HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = "trace-" + UUID.randomUUID();
        }
        WorkflowStage stage = workflow.stage();
        MDC.put(TRACE_KEY, traceId);
        MDC.put(STAGE_KEY, stage == null ? WorkflowStage.IDLE.name() : stage.name());
        response.setHeader(HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_KEY);
            MDC.remove(STAGE_KEY);
        }
    }
}
