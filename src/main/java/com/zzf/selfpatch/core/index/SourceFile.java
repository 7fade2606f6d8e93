package com.zzf.selfpatch.core.index;

import com.zzf.selfpatch.core.util.StringUtils;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * An indexed file: its current text plus the symbol hints derived from it.
 */
@Getter
@Builder
@ToString(exclude = "content")
public class SourceFile {
    private final String path;
    private final String content;
    private final int lines;
    private final List<String> functions;
    private final List<String> classes;

    public static SourceFile of(String path, String content) {
        String text = content == null ? "" : content;
        return SourceFile.builder()
                .path(path)
                .content(text)
                .lines(StringUtils.countLines(text))
                .functions(List.copyOf(SymbolExtractor.functions(text)))
                .classes(List.copyOf(SymbolExtractor.classes(text)))
                .build();
    }
}
