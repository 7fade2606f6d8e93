package com.zzf.selfpatch.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings for the patching engine and the feature workflow, bound from {@code selfpatch.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "selfpatch")
public class SelfPatchProperties {
    private String projectRoot = "";
    private Index index = new Index();
    private Backup backup = new Backup();
    private Oracle oracle = new Oracle();
    private Review review = new Review();
    private Workflow workflow = new Workflow();
    private Restart restart = new Restart();

    public String getProjectRoot() {
        return projectRoot;
    }

    public void setProjectRoot(String projectRoot) {
        this.projectRoot = projectRoot;
    }

    public Index getIndex() {
        return index;
    }

    public void setIndex(Index index) {
        this.index = index;
    }

    public Backup getBackup() {
        return backup;
    }

    public void setBackup(Backup backup) {
        this.backup = backup;
    }

    public Oracle getOracle() {
        return oracle;
    }

    public void setOracle(Oracle oracle) {
        this.oracle = oracle;
    }

    public Review getReview() {
        return review;
    }

    public void setReview(Review review) {
        this.review = review;
    }

    public Workflow getWorkflow() {
        return workflow;
    }

    public void setWorkflow(Workflow workflow) {
        this.workflow = workflow;
    }

    public Restart getRestart() {
        return restart;
    }

    public void setRestart(Restart restart) {
        this.restart = restart;
    }

    @Data
    public static class Index {
        private List<String> sourceRoots = new ArrayList<>(List.of(
                "src", "public", "assets", "config", "database", "scripts", "components",
                "pages", "styles", "utils", "lib", "api", "docs", "tests"));
        private List<String> fileSuffixes = new ArrayList<>(List.of(
                ".js", ".ts", ".json", ".html", ".css", ".scss", ".jsx", ".tsx", ".vue",
                ".md", ".txt", ".sql", ".java"));
        private List<String> excludePatterns = new ArrayList<>(List.of(
                "node_modules", ".git", ".vscode", "dist", "build", "target", ".next", ".nuxt",
                "coverage", ".nyc_output", ".selfpatch-backups", "logs"));
        private boolean scanRootFiles = true;
        private int maxSummaryFiles = 5;
        private int maxExcerptChars = 1500;
        private int maxKeyElements = 5;
        private int maxAnalyzedFiles = 5;
        private int maxSelectorsPerKind = 40;
    }

    @Data
    public static class Backup {
        private String directory = ".selfpatch-backups";
        private boolean persist = true;
    }

    @Data
    public static class Oracle {
        private String apiKey = "";
        private String baseUrl = "https://api.openai.com/v1";
        private String modelName = "gpt-4o";
        private int timeoutSeconds = 120;
        private double generationTemperature = 0.2;
        private int generationMaxTokens = 4000;
        private double chatTemperature = 0.7;
        private int chatMaxTokens = 600;
        private double classificationTemperature = 0.0;
        private int classificationMaxTokens = 300;
    }

    @Data
    public static class Review {
        private boolean enabled = true;
        private int minSafetyScore = 70;
        private double temperature = 0.1;
        private int maxTokens = 4000;
        private int maxListedFiles = 10;
    }

    @Data
    public static class Workflow {
        private double confidenceThreshold = 0.8;
        private List<String> fallbackKeywords = new ArrayList<>(List.of("note"));
        private String noteFallbackResource = "classpath:fallback/note-taking.json";
        private int restartAwaitSeconds = 10;
    }

    @Data
    public static class Restart {
        private List<String> command = new ArrayList<>(List.of("npm", "run", "fresh"));
        private String workingDirectory = "";
        private long graceDelayMillis = 2000;
        private long exitDelayMillis = 1000;
    }
}
