package com.zzf.selfpatch.core.restart;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.util.StringUtils;
import com.zzf.selfpatch.project.ProjectContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Relaunches the host application after a change-set that needs it. At most one restart is
 * in flight; the flag is only cleared again when the launch fails.
 */
@Slf4j
@Service
public class RestartTrigger {

    private final SelfPatchProperties properties;
    private final ProjectContext projectContext;
    private final ProcessLauncher launcher;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean pending = new AtomicBoolean(false);

    public RestartTrigger(SelfPatchProperties properties, ProjectContext projectContext, ProcessLauncher launcher) {
        this.properties = properties;
        this.projectContext = projectContext;
        this.launcher = launcher;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "selfpatch-restart");
            t.setDaemon(true);
            return t;
        });
    }

    public CompletableFuture<RestartOutcome> requestRestart() {
        if (!pending.compareAndSet(false, true)) {
            log.info("restart.skip reason=already_pending");
            return CompletableFuture.completedFuture(
                    new RestartOutcome(RestartStatus.ALREADY_PENDING, "Restart already pending"));
        }
        SelfPatchProperties.Restart cfg = properties.getRestart();
        List<String> command = new ArrayList<>(cfg.getCommand());
        Path workDir = workingDirectory(cfg);
        log.info("restart.scheduled graceMs={} cmd={}", cfg.getGraceDelayMillis(), String.join(" ", command));

        CompletableFuture<RestartOutcome> future = new CompletableFuture<>();
        scheduler.schedule(() -> {
            try {
                launcher.launch(command, workDir);
            } catch (Exception e) {
                pending.set(false);
                log.error("restart.launch.fail cmd={} err={}", String.join(" ", command), e.toString());
                future.complete(new RestartOutcome(RestartStatus.FAILED, "Restart failed: " + e.getMessage()));
                return;
            }
            scheduler.schedule(() -> launcher.exit(0), cfg.getExitDelayMillis(), TimeUnit.MILLISECONDS);
            future.complete(new RestartOutcome(RestartStatus.LAUNCHED, "Restart launched: " + String.join(" ", command)));
        }, cfg.getGraceDelayMillis(), TimeUnit.MILLISECONDS);
        return future;
    }

    public boolean isPending() {
        return pending.get();
    }

    private Path workingDirectory(SelfPatchProperties.Restart cfg) {
        if (StringUtils.isBlank(cfg.getWorkingDirectory())) {
            return projectContext.getRoot();
        }
        return Paths.get(cfg.getWorkingDirectory()).toAbsolutePath().normalize();
    }

    @PreDestroy
    void shutdown() {
        scheduler.shutdownNow();
    }
}
