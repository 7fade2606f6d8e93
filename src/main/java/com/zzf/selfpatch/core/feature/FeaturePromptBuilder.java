package com.zzf.selfpatch.core.feature;

import com.zzf.selfpatch.core.index.FileAnalysis;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the code-generation prompt: conversation, project summary, the identifiers found in
 * the target files, and the change-set schema the reply must follow.
 */
@Component
public class FeaturePromptBuilder {

    public String build(List<ConversationTurn> conversation, String projectSummary, List<FileAnalysis> analyses) {
        StringBuilder sb = new StringBuilder();
        sb.append("SYSTEM: You are an expert full-stack engineer extending a running JavaScript/Electron application.\n");
        sb.append("Only reference files, methods and selectors that appear in the project overview below.\n\n");

        sb.append("CONVERSATION HISTORY:\n");
        if (conversation != null) {
            for (ConversationTurn turn : conversation) {
                String role = turn.getRole() == null ? "USER" : turn.getRole().name().toUpperCase(Locale.ROOT);
                sb.append(role).append(": ").append(turn.getContent() == null ? "" : turn.getContent()).append('\n');
            }
        }

        sb.append("\nPROJECT STRUCTURE OVERVIEW:\n");
        sb.append(projectSummary == null ? "" : projectSummary).append('\n');

        if (analyses != null && !analyses.isEmpty()) {
            sb.append("ACTUAL IDENTIFIERS IN TARGET FILES (use these, do not assume selectors that are not listed):\n");
            for (FileAnalysis analysis : analyses) {
                sb.append(analysis.render());
            }
            sb.append('\n');
        }

        sb.append("AVAILABLE OPERATIONS:\n");
        sb.append("1. addMethod - append a method to the class in filePath (content = full method code)\n");
        sb.append("2. updateMethod - replace the body of an existing method (method = name, content = new body)\n");
        sb.append("3. insertAfter - insert content after the exact text given in insertAfter\n");
        sb.append("4. replaceSection - replace the exact text given in search with content\n");
        sb.append("5. createFile - create or overwrite filePath with content\n\n");

        sb.append("RESPONSE FORMAT (JSON only, no prose):\n");
        sb.append("{\n");
        sb.append("  \"changes\": [\n");
        sb.append("    {\"filePath\": \"path/relative/to/project\", \"operation\": \"addMethod|updateMethod|insertAfter|replaceSection|createFile\",");
        sb.append(" \"method\": \"...\", \"search\": \"...\", \"insertAfter\": \"...\", \"content\": \"...\"}\n");
        sb.append("  ],\n");
        sb.append("  \"description\": \"what was implemented\",\n");
        sb.append("  \"needsRestart\": true\n");
        sb.append("}\n\n");

        sb.append("RULES:\n");
        sb.append("- Generate real, working code. No pseudocode or placeholders.\n");
        sb.append("- Anchors (method, search, insertAfter) must match the existing file text exactly.\n");
        sb.append("- Keep changes minimal and consistent with the existing code.\n");
        sb.append("- Set needsRestart to true when the running application must reload to pick up the change.\n\n");
        sb.append("Generate the JSON response now:");
        return sb.toString();
    }
}
