package com.zzf.selfpatch.project;

import com.zzf.selfpatch.config.SelfPatchProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Root of the source tree the assistant is allowed to patch.
 * Relative paths handed around the engine always use forward slashes and are resolved here.
 */
@Component
public class ProjectContext {

    private final Path root;

    @Autowired
    public ProjectContext(SelfPatchProperties properties) {
        this(resolveRoot(properties.getProjectRoot()));
    }

    public ProjectContext(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    private static Path resolveRoot(String configured) {
        if (configured == null || configured.isBlank()) {
            return Paths.get(System.getProperty("user.dir"));
        }
        return Paths.get(configured.trim());
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Resolves a project-relative path. Absolute paths and {@code ..} segments that leave the
     * root are rejected.
     */
    public Path resolve(String relativePath) {
        if (relativePath == null || relativePath.isBlank()) {
            throw new IllegalArgumentException("path is empty");
        }
        String normalized = relativePath.trim().replace('\\', '/');
        Path parsed = Paths.get(normalized);
        Path resolved = parsed.isAbsolute() ? parsed.normalize() : root.resolve(parsed).normalize();
        if (!resolved.startsWith(root)) {
            throw new IllegalArgumentException("path escapes project root: " + relativePath);
        }
        return resolved;
    }

    public String relativize(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        return toTransportPath(root.relativize(normalized).toString());
    }

    public static String toTransportPath(String path) {
        if (path == null) {
            return "";
        }
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) {
            p = p.substring(2);
        }
        return p;
    }
}
