package com.zzf.selfpatch.core.restart;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Seam between the restart trigger and the operating system.
 */
public interface ProcessLauncher {

    void launch(List<String> command, Path workingDirectory) throws IOException;

    void exit(int status);
}
