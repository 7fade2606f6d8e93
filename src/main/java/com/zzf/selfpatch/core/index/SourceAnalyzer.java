package com.zzf.selfpatch.core.index;

import com.zzf.selfpatch.config.SelfPatchProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pre-generation analysis: picks the files a conversation is most likely about and lists the
 * ids, classes, element selectors and CSS variables they really contain.
 * <p>
 * Stylesheet selectors are read with declaration blocks removed, so colors like {@code #fff}
 * and numbers like {@code .5em} are not taken for ids or classes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SourceAnalyzer {
    private static final Set<String> STYLE_TYPES = Set.of(".css", ".scss");
    private static final Set<String> MARKUP_TYPES = Set.of(".html", ".htm", ".vue");
    private static final Set<String> SCRIPT_TYPES = Set.of(".js", ".ts", ".jsx", ".tsx");
    private static final Set<String> UI_WORDS = Set.of("button", "color", "colour", "style", "ui", "theme", "layout", "css");
    private static final Set<String> LOGIC_WORDS = Set.of("function", "method", "feature", "click", "handler", "logic");

    private static final Pattern WORD = Pattern.compile("[^a-z0-9]+");
    private static final Pattern STYLE_BLOCK = Pattern.compile("(?is)<style[^>]*>(.*?)</style>");
    private static final Pattern DECLARATIONS = Pattern.compile("\\{[^{}]*\\}");
    private static final Pattern SELECTOR_ID = Pattern.compile("#([A-Za-z_][\\w-]*)");
    private static final Pattern SELECTOR_CLASS = Pattern.compile("\\.([A-Za-z_-][\\w-]*)");
    private static final Pattern SELECTOR_ELEMENT = Pattern.compile("(?<![.#:\\w-])([a-z][a-z0-9]*)\\s*\\{");
    private static final Pattern ATTR_ID = Pattern.compile("\\bid=[\"']([^\"']+)[\"']");
    private static final Pattern ATTR_CLASS = Pattern.compile("\\b(?:class|className)=[\"']([^\"']+)[\"']");
    private static final Pattern CSS_VARIABLE = Pattern.compile("--[A-Za-z][\\w-]*");

    private final SourceFileStore store;
    private final SelfPatchProperties properties;

    public List<FileAnalysis> analyze(String conversationText) {
        List<FileAnalysis> result = new ArrayList<>();
        int limit = Math.max(0, properties.getIndex().getMaxAnalyzedFiles());
        for (String path : identifyTargetFiles(conversationText)) {
            if (result.size() >= limit) {
                break;
            }
            store.get(path).map(this::analyzeFile).ifPresent(result::add);
        }
        log.info("source.analyze analyzed={}", result.size());
        return result;
    }

    /**
     * Files named in the conversation first, then markup/style files for UI requests and script
     * files for behavior requests, in index order.
     */
    public List<String> identifyTargetFiles(String conversationText) {
        String text = conversationText == null ? "" : conversationText.toLowerCase(Locale.ROOT);
        Set<String> words = new HashSet<>(Arrays.asList(WORD.split(text)));
        boolean ui = containsAny(words, UI_WORDS);
        boolean logic = containsAny(words, LOGIC_WORDS);

        Set<String> named = new LinkedHashSet<>();
        Set<String> related = new LinkedHashSet<>();
        for (String path : store.paths()) {
            String base = baseName(path);
            String ext = extension(path);
            if (base.length() >= 3 && text.contains(base)) {
                named.add(path);
            } else if (ui && (STYLE_TYPES.contains(ext) || MARKUP_TYPES.contains(ext))) {
                related.add(path);
            } else if (logic && SCRIPT_TYPES.contains(ext)) {
                related.add(path);
            }
        }
        List<String> targets = new ArrayList<>(named);
        targets.addAll(related);
        return targets;
    }

    public FileAnalysis analyzeFile(SourceFile file) {
        String content = file.getContent();
        String ext = extension(file.getPath());
        int cap = Math.max(0, properties.getIndex().getMaxSelectorsPerKind());

        Set<String> ids = new LinkedHashSet<>();
        Set<String> classes = new LinkedHashSet<>();
        Set<String> elements = new LinkedHashSet<>();
        Set<String> variables = new LinkedHashSet<>();

        Optional<String> stylesheet = stylesheetText(content, ext);
        if (stylesheet.isPresent()) {
            String css = stylesheet.get();
            collect(withoutComments(css), SELECTOR_ELEMENT, 1, elements);
            String selectors = stripDeclarations(css);
            collect(selectors, SELECTOR_ID, 1, ids);
            collect(selectors, SELECTOR_CLASS, 1, classes);
            collect(css, CSS_VARIABLE, 0, variables);
        }
        if (MARKUP_TYPES.contains(ext) || SCRIPT_TYPES.contains(ext)) {
            collect(content, ATTR_ID, 1, ids);
            Matcher m = ATTR_CLASS.matcher(content);
            while (m.find()) {
                for (String name : m.group(1).trim().split("\\s+")) {
                    if (!name.isEmpty()) {
                        classes.add(name);
                    }
                }
            }
        }

        return FileAnalysis.builder()
                .path(file.getPath())
                .fileType(ext.isEmpty() ? "(none)" : ext)
                .ids(cap(ids, cap))
                .classes(cap(classes, cap))
                .elements(cap(elements, cap))
                .cssVariables(cap(variables, cap))
                .styleTag(content.contains("<style"))
                .scriptTag(content.contains("<script"))
                .lines(file.getLines())
                .build();
    }

    private static Optional<String> stylesheetText(String content, String ext) {
        if (STYLE_TYPES.contains(ext)) {
            return Optional.of(content);
        }
        if (MARKUP_TYPES.contains(ext)) {
            StringBuilder sb = new StringBuilder();
            Matcher m = STYLE_BLOCK.matcher(content);
            while (m.find()) {
                sb.append(m.group(1)).append('\n');
            }
            return sb.length() == 0 ? Optional.empty() : Optional.of(sb.toString());
        }
        return Optional.empty();
    }

    private static String withoutComments(String css) {
        return css.replaceAll("(?s)/\\*.*?\\*/", " ");
    }

    /**
     * Removes innermost blocks only, so selectors nested in {@code @media} rules survive.
     */
    static String stripDeclarations(String css) {
        return DECLARATIONS.matcher(withoutComments(css)).replaceAll(" ");
    }

    private static void collect(String text, Pattern pattern, int group, Collection<String> into) {
        Matcher m = pattern.matcher(text);
        while (m.find()) {
            into.add(m.group(group));
        }
    }

    private static List<String> cap(Set<String> values, int max) {
        List<String> list = new ArrayList<>(values);
        return list.size() <= max ? list : new ArrayList<>(list.subList(0, max));
    }

    private static boolean containsAny(Set<String> words, Set<String> candidates) {
        for (String candidate : candidates) {
            if (words.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static String baseName(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    private static String extension(String path) {
        String name = path.substring(path.lastIndexOf('/') + 1).toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 ? name.substring(dot) : "";
    }
}
