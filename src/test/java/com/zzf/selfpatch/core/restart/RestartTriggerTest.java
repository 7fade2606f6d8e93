package com.zzf.selfpatch.core.restart;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.project.ProjectContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class RestartTriggerTest {

    @TempDir
    Path root;

    private ProcessLauncher launcher;
    private RestartTrigger trigger;

    @BeforeEach
    void setUp() {
        SelfPatchProperties properties = new SelfPatchProperties();
        properties.getRestart().setGraceDelayMillis(10);
        properties.getRestart().setExitDelayMillis(10);
        launcher = Mockito.mock(ProcessLauncher.class);
        trigger = new RestartTrigger(properties, new ProjectContext(root), launcher);
    }

    @AfterEach
    void tearDown() {
        trigger.shutdown();
    }

    @Test
    void launchesConfiguredCommandThenExits() throws Exception {
        RestartOutcome outcome = trigger.requestRestart().get(5, TimeUnit.SECONDS);

        assertEquals(RestartStatus.LAUNCHED, outcome.getStatus());
        assertTrue(trigger.isPending());
        verify(launcher).launch(eq(List.of("npm", "run", "fresh")), eq(root.toAbsolutePath().normalize()));
        verify(launcher, timeout(2000)).exit(0);
    }

    @Test
    void secondRequestWhilePendingIsIgnored() throws Exception {
        trigger.requestRestart();
        RestartOutcome second = trigger.requestRestart().get(1, TimeUnit.SECONDS);

        assertEquals(RestartStatus.ALREADY_PENDING, second.getStatus());
        verify(launcher, timeout(2000).times(1)).launch(anyList(), any(Path.class));
    }

    @Test
    void launchFailureClearsFlagAndDoesNotExit() throws Exception {
        doThrow(new IOException("npm: not found")).when(launcher).launch(anyList(), any(Path.class));

        RestartOutcome outcome = trigger.requestRestart().get(5, TimeUnit.SECONDS);

        assertEquals(RestartStatus.FAILED, outcome.getStatus());
        assertTrue(outcome.getMessage().contains("npm: not found"));
        assertFalse(trigger.isPending());
        Thread.sleep(100);
        verify(launcher, never()).exit(Mockito.anyInt());

        // a later request may try again
        doThrow(new IOException("still missing")).when(launcher).launch(anyList(), any(Path.class));
        assertEquals(RestartStatus.FAILED, trigger.requestRestart().get(5, TimeUnit.SECONDS).getStatus());
        verify(launcher, times(2)).launch(anyList(), any(Path.class));
    }
}
