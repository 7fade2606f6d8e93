package com.zzf.selfpatch.core.restart;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Starts the relaunch command detached from this process and terminates the JVM.
 */
@Slf4j
@Component
public class DefaultProcessLauncher implements ProcessLauncher {

    @Override
    public void launch(List<String> command, Path workingDirectory) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workingDirectory.toFile());
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        pb.redirectInput(ProcessBuilder.Redirect.PIPE);
        Process process = pb.start();
        process.getOutputStream().close();
        log.info("restart.launched pid={} cmd={} dir={}", process.pid(), String.join(" ", command), workingDirectory);
    }

    @Override
    public void exit(int status) {
        log.info("restart.exit status={}", status);
        System.exit(status);
    }
}
