package com.eidos.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings bound from {@code eidos.*}.
 */
@Component
@ConfigurationProperties(prefix = "eidos")
public class EidosProperties {

    private String dbPath = Path.of(System.getProperty("user.home"), ".spark", "eidos.db").toString();
    private int busyTimeoutMs = 5000;
    private String reportsDir = Path.of(System.getProperty("user.home"), ".spark").toString();
    private Refiner refiner = new Refiner();
    private Llm llm = new Llm();

    public String getDbPath() {
        return dbPath;
    }

    public void setDbPath(String dbPath) {
        this.dbPath = dbPath;
    }

    public int getBusyTimeoutMs() {
        return busyTimeoutMs;
    }

    public void setBusyTimeoutMs(int busyTimeoutMs) {
        this.busyTimeoutMs = busyTimeoutMs;
    }

    public String getReportsDir() {
        return reportsDir;
    }

    public void setReportsDir(String reportsDir) {
        this.reportsDir = reportsDir;
    }

    public Refiner getRefiner() {
        return refiner;
    }

    public void setRefiner(Refiner refiner) {
        this.refiner = refiner;
    }

    public Llm getLlm() {
        return llm;
    }

    public void setLlm(Llm llm) {
        this.llm = llm;
    }

    public static class Refiner {

        private double minUnifiedScore = 0.60;
        private double llmMinUnifiedScore = 0.45;

        public double getMinUnifiedScore() {
            return minUnifiedScore;
        }

        public void setMinUnifiedScore(double minUnifiedScore) {
            this.minUnifiedScore = minUnifiedScore;
        }

        public double getLlmMinUnifiedScore() {
            return llmMinUnifiedScore;
        }

        public void setLlmMinUnifiedScore(double llmMinUnifiedScore) {
            this.llmMinUnifiedScore = llmMinUnifiedScore;
        }
    }

    /**
     * Per-area gates for the optional LLM rewrite capability, keyed by area id
     * ({@code runtime_refine}, {@code archive_rewrite}, ...). Areas without an entry are disabled.
     */
    public static class Llm {

        private Map<String, Area> areas = new LinkedHashMap<>();

        public Map<String, Area> getAreas() {
            return areas;
        }

        public void setAreas(Map<String, Area> areas) {
            this.areas = areas;
        }
    }

    public static class Area {

        private boolean enabled;
        private Double timeoutSeconds;
        private Integer maxChars;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        /** Null means "use the area default". */
        public Double getTimeoutSeconds() {
            return timeoutSeconds;
        }

        public void setTimeoutSeconds(Double timeoutSeconds) {
            this.timeoutSeconds = timeoutSeconds;
        }

        public Integer getMaxChars() {
            return maxChars;
        }

        public void setMaxChars(Integer maxChars) {
            this.maxChars = maxChars;
        }
    }
}
