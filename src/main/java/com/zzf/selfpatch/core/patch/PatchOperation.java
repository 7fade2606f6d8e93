package com.zzf.selfpatch.core.patch;

import lombok.Getter;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One self-contained textual mutation of a single file. Operations never reference each other;
 * {@link #applyTo(String)} is pure and returns empty when the anchor cannot be located.
 */
@Getter
public abstract class PatchOperation {

    public enum Kind {
        ADD_METHOD("addMethod"),
        UPDATE_METHOD("updateMethod"),
        INSERT_AFTER("insertAfter"),
        REPLACE_SECTION("replaceSection"),
        CREATE_FILE("createFile");

        private final String wireName;

        Kind(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static Optional<Kind> fromWireName(String name) {
            if (name == null) {
                return Optional.empty();
            }
            String n = name.trim().toLowerCase(Locale.ROOT);
            for (Kind k : values()) {
                if (k.wireName.toLowerCase(Locale.ROOT).equals(n)) {
                    return Optional.of(k);
                }
            }
            return Optional.empty();
        }
    }

    private final String filePath;

    protected PatchOperation(String filePath) {
        this.filePath = filePath;
    }

    public abstract Kind getKind();

    /**
     * @return the new file text, or empty on anchor miss
     */
    public abstract Optional<String> applyTo(String content);

    public boolean requiresExistingFile() {
        return true;
    }

    @Override
    public String toString() {
        return getKind().wireName() + "{" + filePath + "}";
    }

    public static AddMethod addMethod(String file, String methodCode) {
        return new AddMethod(file, methodCode);
    }

    public static UpdateMethod updateMethod(String file, String methodName, String newBody) {
        return new UpdateMethod(file, methodName, newBody);
    }

    public static InsertAfter insertAfter(String file, String anchorText, String content) {
        return new InsertAfter(file, anchorText, content);
    }

    public static ReplaceSection replaceSection(String file, String searchText, String replacement) {
        return new ReplaceSection(file, searchText, replacement);
    }

    public static CreateFile createFile(String file, String content) {
        return new CreateFile(file, content);
    }

    /**
     * Inserts code right before the last closing brace of the file, which is taken to be the
     * closing brace of the enclosing type.
     */
    @Getter
    public static final class AddMethod extends PatchOperation {
        private final String methodCode;

        public AddMethod(String filePath, String methodCode) {
            super(filePath);
            this.methodCode = methodCode == null ? "" : methodCode;
        }

        @Override
        public Kind getKind() {
            return Kind.ADD_METHOD;
        }

        @Override
        public Optional<String> applyTo(String content) {
            int brace = content.lastIndexOf('}');
            if (brace < 0) {
                return Optional.empty();
            }
            return Optional.of(content.substring(0, brace) + methodCode + "\n" + content.substring(brace));
        }
    }

    /**
     * Replaces the body of a named method. The body runs from the signature's opening brace to
     * the first later line holding only a closing brace at the signature's indentation. This is
     * a textual boundary; braces inside the body are not counted.
     */
    @Getter
    public static final class UpdateMethod extends PatchOperation {
        private final String methodName;
        private final String newBody;

        public UpdateMethod(String filePath, String methodName, String newBody) {
            super(filePath);
            this.methodName = methodName == null ? "" : methodName.trim();
            this.newBody = newBody == null ? "" : newBody;
        }

        @Override
        public Kind getKind() {
            return Kind.UPDATE_METHOD;
        }

        @Override
        public Optional<String> applyTo(String content) {
            if (methodName.isEmpty()) {
                return Optional.empty();
            }
            Pattern signature = Pattern.compile(
                    "^([ \\t]*)[^\\n]*?(?<![\\w.])" + Pattern.quote(methodName) + "\\s*\\([^)]*\\)[^{;\\n]*\\{",
                    Pattern.MULTILINE);
            Matcher sig = signature.matcher(content);
            if (!sig.find()) {
                return Optional.empty();
            }
            int bodyStart = sig.end();
            Pattern closing = Pattern.compile("\\r?\\n" + Pattern.quote(sig.group(1)) + "\\}[ \\t]*(?=\\r?\\n|\\z)");
            Matcher close = closing.matcher(content);
            if (!close.find(bodyStart)) {
                return Optional.empty();
            }
            return Optional.of(content.substring(0, bodyStart) + newBody + content.substring(close.start()));
        }
    }

    @Getter
    public static final class InsertAfter extends PatchOperation {
        private final String anchorText;
        private final String content;

        public InsertAfter(String filePath, String anchorText, String content) {
            super(filePath);
            this.anchorText = anchorText == null ? "" : anchorText;
            this.content = content == null ? "" : content;
        }

        @Override
        public Kind getKind() {
            return Kind.INSERT_AFTER;
        }

        @Override
        public Optional<String> applyTo(String existing) {
            if (anchorText.isEmpty()) {
                return Optional.empty();
            }
            int idx = existing.indexOf(anchorText);
            if (idx < 0) {
                return Optional.empty();
            }
            int end = idx + anchorText.length();
            return Optional.of(existing.substring(0, end) + "\n" + content + existing.substring(end));
        }
    }

    @Getter
    public static final class ReplaceSection extends PatchOperation {
        private final String searchText;
        private final String replacement;

        public ReplaceSection(String filePath, String searchText, String replacement) {
            super(filePath);
            this.searchText = searchText == null ? "" : searchText;
            this.replacement = replacement == null ? "" : replacement;
        }

        @Override
        public Kind getKind() {
            return Kind.REPLACE_SECTION;
        }

        @Override
        public Optional<String> applyTo(String content) {
            if (searchText.isEmpty()) {
                return Optional.empty();
            }
            int idx = content.indexOf(searchText);
            if (idx < 0) {
                return Optional.empty();
            }
            return Optional.of(content.substring(0, idx) + replacement + content.substring(idx + searchText.length()));
        }
    }

    @Getter
    public static final class CreateFile extends PatchOperation {
        private final String content;

        public CreateFile(String filePath, String content) {
            super(filePath);
            this.content = content == null ? "" : content;
        }

        @Override
        public Kind getKind() {
            return Kind.CREATE_FILE;
        }

        @Override
        public Optional<String> applyTo(String ignored) {
            return Optional.of(content);
        }

        @Override
        public boolean requiresExistingFile() {
            return false;
        }
    }
}
