package com.zzf.selfpatch.core.index;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Path-keyed in-memory view of the indexed tree. All access is serialized on the store monitor
 * so a write made by one patch is visible to the next one.
 */
@Component
public class SourceFileStore {

    private final Map<String, SourceFile> files = new TreeMap<>();

    public synchronized Optional<SourceFile> get(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public synchronized boolean contains(String path) {
        return files.containsKey(path);
    }

    public synchronized SourceFile put(String path, String content) {
        SourceFile file = SourceFile.of(path, content);
        files.put(path, file);
        return file;
    }

    public synchronized void remove(String path) {
        files.remove(path);
    }

    public synchronized void retainOnly(Collection<String> paths) {
        files.keySet().retainAll(Set.copyOf(paths));
    }

    public synchronized List<String> paths() {
        return new ArrayList<>(files.keySet());
    }

    public synchronized List<SourceFile> all() {
        return new ArrayList<>(files.values());
    }

    /**
     * Copy of path → content, taken under one lock acquisition.
     */
    public synchronized Map<String, String> contents() {
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, SourceFile> e : files.entrySet()) {
            copy.put(e.getKey(), e.getValue().getContent());
        }
        return copy;
    }

    public synchronized int size() {
        return files.size();
    }

    public synchronized void clear() {
        files.clear();
    }
}
