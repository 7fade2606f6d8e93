package com.zzf.selfpatch.core.index;

import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * Bounded description of the indexed tree handed to the oracle instead of full file bodies.
 */
@Data
@Builder
public class SourceSummary {
    private int totalFiles;
    private Map<String, Integer> filesByExtension;
    private List<String> keyDirectories;
    private List<FileDigest> relevantFiles;

    @Data
    @Builder
    public static class FileDigest {
        private String path;
        private String type;
        private int lines;
        private List<String> keyElements;
        private String excerpt;
    }

    public String render() {
        StringBuilder sb = new StringBuilder();
        sb.append("Total Files: ").append(totalFiles).append('\n');
        filesByExtension.forEach((ext, count) -> sb.append(ext).append(": ").append(count).append(" files\n"));
        sb.append("Key Directories: ").append(String.join(", ", keyDirectories)).append('\n');
        if (!relevantFiles.isEmpty()) {
            sb.append("\nMOST RELEVANT FILES:\n");
        }
        for (FileDigest f : relevantFiles) {
            sb.append("=== ").append(f.getPath()).append(" ===\n");
            sb.append("Type: ").append(f.getType()).append('\n');
            sb.append("Lines: ").append(f.getLines()).append('\n');
            sb.append("Key Elements: ").append(String.join(", ", f.getKeyElements())).append('\n');
            sb.append("Content Preview:\n").append(f.getExcerpt()).append("\n\n");
        }
        return sb.toString();
    }
}
