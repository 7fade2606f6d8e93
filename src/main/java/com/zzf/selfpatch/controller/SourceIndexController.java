package com.zzf.selfpatch.controller;

import com.zzf.selfpatch.core.index.SourceFile;
import com.zzf.selfpatch.core.index.SourceFileStore;
import com.zzf.selfpatch.core.index.SourceSummarizer;
import com.zzf.selfpatch.core.index.SourceSummary;
import com.zzf.selfpatch.core.index.SourceTreeIndexer;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/source")
@RequiredArgsConstructor
public class SourceIndexController {

    private final SourceTreeIndexer indexer;
    private final SourceFileStore store;
    private final SourceSummarizer summarizer;

    @GetMapping("/summary")
    public Map<String, Object> summary(@RequestParam(name = "q", required = false, defaultValue = "") String query) {
        SourceSummary summary = summarizer.summarize(query);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("summary", summary);
        response.put("text", summary.render());
        return response;
    }

    @PostMapping("/refresh")
    public Map<String, Object> refresh() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("files", indexer.refresh());
        return response;
    }

    @GetMapping("/files")
    public List<Map<String, Object>> files() {
        List<Map<String, Object>> files = new ArrayList<>();
        for (SourceFile f : store.all()) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("path", f.getPath());
            item.put("lines", f.getLines());
            item.put("functions", f.getFunctions());
            item.put("classes", f.getClasses());
            files.add(item);
        }
        return files;
    }
}
