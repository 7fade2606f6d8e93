package com.zzf.selfpatch.core.index;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.project.ProjectContext;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Loads the configured source roots into the {@link SourceFileStore}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceTreeIndexer {

    private final ProjectContext projectContext;
    private final SourceFileStore store;
    private final SelfPatchProperties properties;

    @PostConstruct
    public void init() {
        refresh();
    }

    /**
     * Rescans every root and replaces the store entries. Files that disappeared since the last
     * scan are dropped.
     *
     * @return number of indexed files
     */
    public synchronized int refresh() {
        long t0 = System.nanoTime();
        Set<String> seen = new LinkedHashSet<>();
        Path root = projectContext.getRoot();
        for (String dir : properties.getIndex().getSourceRoots()) {
            Path dirPath = root.resolve(dir).normalize();
            if (!dirPath.startsWith(root) || !Files.isDirectory(dirPath)) {
                log.debug("index.root.skip dir={}", dir);
                continue;
            }
            scanDirectory(dirPath, true, seen);
        }
        if (properties.getIndex().isScanRootFiles()) {
            scanDirectory(root, false, seen);
        }
        store.retainOnly(seen);
        long tookMs = (System.nanoTime() - t0) / 1_000_000L;
        log.info("index.refresh files={} tookMs={} root={}", seen.size(), tookMs, root);
        return seen.size();
    }

    private void scanDirectory(Path dir, boolean recursive, Set<String> seen) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
            for (Path entry : entries) {
                String relative = projectContext.relativize(entry);
                String name = entry.getFileName().toString();
                if (shouldExclude(relative, name)) {
                    continue;
                }
                if (Files.isDirectory(entry)) {
                    if (recursive) {
                        scanDirectory(entry, true, seen);
                    }
                } else if (Files.isRegularFile(entry) && shouldInclude(name)) {
                    loadFile(entry, relative, seen);
                }
            }
        } catch (IOException e) {
            log.warn("index.scan.fail dir={} err={}", dir, e.toString());
        }
    }

    private void loadFile(Path file, String relative, Set<String> seen) {
        if (seen.contains(relative)) {
            return;
        }
        try {
            String content = Files.readString(file, StandardCharsets.UTF_8);
            store.put(relative, content);
            seen.add(relative);
        } catch (IOException e) {
            log.warn("index.read.fail path={} err={}", relative, e.toString());
        }
    }

    boolean shouldExclude(String relativePath, String fileName) {
        if (fileName.startsWith(".")) {
            return true;
        }
        List<String> excludes = properties.getIndex().getExcludePatterns();
        for (String segment : relativePath.split("/")) {
            if (excludes.contains(segment)) {
                return true;
            }
        }
        return false;
    }

    boolean shouldInclude(String fileName) {
        for (String suffix : properties.getIndex().getFileSuffixes()) {
            if (fileName.endsWith(suffix)) {
                return true;
            }
        }
        return false;
    }
}
