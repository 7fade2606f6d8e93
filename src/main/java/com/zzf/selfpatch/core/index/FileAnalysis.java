package com.zzf.selfpatch.core.index;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Identifiers that actually exist in a file, handed to the generation prompt so that it does
 * not invent selectors.
 */
@Data
@Builder
public class FileAnalysis {
    private String path;
    private String fileType;
    private List<String> ids;
    private List<String> classes;
    private List<String> elements;
    private List<String> cssVariables;
    private boolean styleTag;
    private boolean scriptTag;
    private int lines;

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("File: ").append(path).append(" (").append(fileType).append(", ").append(lines).append(" lines)\n");
        sb.append("- IDs found: ").append(joinOrNone(ids)).append('\n');
        sb.append("- Classes found: ").append(joinOrNone(classes)).append('\n');
        sb.append("- Element selectors: ").append(joinOrNone(elements)).append('\n');
        sb.append("- CSS variables: ").append(joinOrNone(cssVariables)).append('\n');
        sb.append("- Has <style> tag: ").append(styleTag).append('\n');
        sb.append("- Has <script> tag: ").append(scriptTag).append('\n');
        return sb.toString();
    }

    private static String joinOrNone(List<String> values) {
        return values == null || values.isEmpty() ? "none" : String.join(", ", values);
    }
}
