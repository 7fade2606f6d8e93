package com.zzf.selfpatch.core.index;

import com.zzf.selfpatch.config.SelfPatchProperties;
import com.zzf.selfpatch.core.util.StringUtils;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Builds a {@link SourceSummary} for a request. Files are ranked by how many request keywords
 * they mention, with a small bonus for UI/app files and medium-sized files.
 */
@Component
@RequiredArgsConstructor
public class SourceSummarizer {
    private static final Pattern WORD = Pattern.compile("[^a-z0-9_]+");
    private static final Set<String> STOP_WORDS = Set.of(
            "the", "and", "for", "that", "this", "with", "add", "want", "would", "like", "please",
            "can", "you", "make", "just", "fine", "yes", "into", "from", "new", "feature");
    private static final int MAX_KEY_DIRECTORIES = 10;

    private final SourceFileStore store;
    private final SelfPatchProperties properties;

    public SourceSummary summarize(String requestText) {
        List<SourceFile> files = store.all();
        Map<String, Integer> byExtension = new TreeMap<>();
        Set<String> directories = new LinkedHashSet<>();
        for (SourceFile f : files) {
            byExtension.merge(extension(f.getPath()), 1, Integer::sum);
            directories.add(directory(f.getPath()));
        }

        List<String> keywords = keywords(requestText);
        SelfPatchProperties.Index cfg = properties.getIndex();
        List<SourceSummary.FileDigest> relevant = new ArrayList<>();
        files.stream()
                .sorted(Comparator.comparingInt((SourceFile f) -> score(f, keywords)).reversed()
                        .thenComparing(SourceFile::getPath))
                .limit(Math.max(0, cfg.getMaxSummaryFiles()))
                .forEach(f -> relevant.add(digest(f, cfg)));

        return SourceSummary.builder()
                .totalFiles(files.size())
                .filesByExtension(byExtension)
                .keyDirectories(new ArrayList<>(directories).subList(0, Math.min(MAX_KEY_DIRECTORIES, directories.size())))
                .relevantFiles(relevant)
                .build();
    }

    private SourceSummary.FileDigest digest(SourceFile f, SelfPatchProperties.Index cfg) {
        List<String> elements = new ArrayList<>(f.getClasses());
        elements.addAll(f.getFunctions());
        return SourceSummary.FileDigest.builder()
                .path(f.getPath())
                .type(describe(extension(f.getPath())))
                .lines(f.getLines())
                .keyElements(elements.subList(0, Math.min(cfg.getMaxKeyElements(), elements.size())))
                .excerpt(StringUtils.excerpt(f.getContent(), cfg.getMaxExcerptChars()))
                .build();
    }

    int score(SourceFile f, List<String> keywords) {
        int score = 0;
        String path = f.getPath().toLowerCase(Locale.ROOT);
        if (path.contains("ui") || path.contains("app")) {
            score += 20;
        }
        String content = f.getContent().toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (content.contains(keyword)) {
                score += 10;
            }
        }
        if (f.getLines() > 50 && f.getLines() < 500) {
            score += 5;
        }
        return score;
    }

    static List<String> keywords(String text) {
        List<String> result = new ArrayList<>();
        if (text == null) {
            return result;
        }
        for (String token : WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (token.length() > 2 && !STOP_WORDS.contains(token) && !result.contains(token)) {
                result.add(token);
            }
        }
        return result;
    }

    static String extension(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        return dot <= 0 ? "no-ext" : name.substring(dot);
    }

    static String directory(String path) {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? "." : path.substring(0, slash);
    }

    static String describe(String ext) {
        return switch (ext) {
            case ".js" -> "JavaScript Module";
            case ".ts" -> "TypeScript Module";
            case ".java" -> "Java Source";
            case ".css", ".scss" -> "Stylesheet";
            case ".html" -> "HTML Template";
            case ".json" -> "Configuration/Data";
            case ".md" -> "Documentation";
            default -> "Text File";
        };
    }
}
