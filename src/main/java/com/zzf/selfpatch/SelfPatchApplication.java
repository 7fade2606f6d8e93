package com.zzf.selfpatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

@SpringBootApplication
public class SelfPatchApplication {
    private static final Logger logger = LoggerFactory.getLogger(SelfPatchApplication.class);

    public static void main(String[] args) {
        guardWorkingDirectory();
        SpringApplication.run(SelfPatchApplication.class, args);
    }

    private static void guardWorkingDirectory() {
        try {
            Path cwd = Paths.get(System.getProperty("user.dir")).toAbsolutePath().normalize();
            if (!Files.isWritable(cwd)) {
                logger.warn("runtime.workdir.readonly path={}", cwd);
            }
        } catch (Exception e) {
            logger.warn("runtime.workdir.check.failed err={}", e.toString());
        }
    }
}
