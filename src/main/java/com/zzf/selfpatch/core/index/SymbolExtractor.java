package com.zzf.selfpatch.core.index;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based symbol hints for prompt building. Not a parser: control-flow keywords that look
 * like calls (if, for, while, ...) are filtered, everything else shaped like a name followed by
 * a parameter list and an opening brace counts as a function.
 */
public final class SymbolExtractor {
    private static final Pattern FUNCTION = Pattern.compile("(?:async\\s+)?(?:function\\s+)?(\\w+)\\s*\\([^)]*\\)\\s*\\{");
    private static final Pattern CLASS = Pattern.compile("class\\s+(\\w+)");
    private static final List<String> KEYWORDS = List.of("if", "for", "while", "switch", "catch", "function", "return");

    private SymbolExtractor() {}

    public static List<String> functions(String code) {
        List<String> result = new ArrayList<>();
        if (code == null) {
            return result;
        }
        Matcher m = FUNCTION.matcher(code);
        while (m.find()) {
            String name = m.group(1);
            if (!KEYWORDS.contains(name)) {
                result.add(name);
            }
        }
        return result;
    }

    public static List<String> classes(String code) {
        List<String> result = new ArrayList<>();
        if (code == null) {
            return result;
        }
        Matcher m = CLASS.matcher(code);
        while (m.find()) {
            result.add(m.group(1));
        }
        return result;
    }
}
