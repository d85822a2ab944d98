package com.baleen.corpus.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@ConfigurationProperties(prefix = "baleen")
public class IngestProperties {
    private static final String DEFAULT_USER_AGENT = "baleen-corpus/0.1 (+https://github.com/baleen)";
    public static final List<String> DEFAULT_ALLOWED_TAGS = List.of(
        "p", "br",
        "h1", "h2", "h3", "h4", "h5", "h6",
        "ul", "ol", "li",
        "em", "strong", "i", "b",
        "a", "img",
        "blockquote",
        "code", "pre"
    );

    private String userAgent;
    private int workerPoolSize = 4;
    private int requestTimeoutMs = 20_000;
    private int perHostDelayMs = 250;
    private int perHostConcurrency = 2;
    private Retry retry = new Retry();
    private Scheduler scheduler = new Scheduler();
    private Extraction extraction = new Extraction();
    private Sanitizer sanitizer = new Sanitizer();
    private Data data = new Data();
    private Export export = new Export();

    public String getUserAgent() {
        return normalizeUserAgent(userAgent);
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = normalizeUserAgent(userAgent);
    }

    public int getWorkerPoolSize() {
        return Math.max(1, workerPoolSize);
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = Math.max(1, workerPoolSize);
    }

    public int getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public void setRequestTimeoutMs(int requestTimeoutMs) {
        this.requestTimeoutMs = requestTimeoutMs;
    }

    public int getPerHostDelayMs() {
        return Math.max(1, perHostDelayMs);
    }

    public void setPerHostDelayMs(int perHostDelayMs) {
        this.perHostDelayMs = Math.max(1, perHostDelayMs);
    }

    public int getPerHostConcurrency() {
        return Math.max(1, perHostConcurrency);
    }

    public void setPerHostConcurrency(int perHostConcurrency) {
        this.perHostConcurrency = Math.max(1, perHostConcurrency);
    }

    public Retry getRetry() {
        return retry;
    }

    public void setRetry(Retry retry) {
        this.retry = retry;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    public Extraction getExtraction() {
        return extraction;
    }

    public void setExtraction(Extraction extraction) {
        this.extraction = extraction;
    }

    public Sanitizer getSanitizer() {
        return sanitizer;
    }

    public void setSanitizer(Sanitizer sanitizer) {
        this.sanitizer = sanitizer;
    }

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    public Export getExport() {
        return export;
    }

    public void setExport(Export export) {
        this.export = export;
    }

    public static String normalizeUserAgent(String candidate) {
        if (candidate == null || candidate.isBlank()) {
            return DEFAULT_USER_AGENT;
        }
        return candidate.trim();
    }

    public static class Retry {
        private int maxAttempts = 3;
        private int baseDelayMs = 500;
        private int maxDelayMs = 8_000;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getBaseDelayMs() {
            return Math.max(0, baseDelayMs);
        }

        public void setBaseDelayMs(int baseDelayMs) {
            this.baseDelayMs = Math.max(0, baseDelayMs);
        }

        public int getMaxDelayMs() {
            return Math.max(0, maxDelayMs);
        }

        public void setMaxDelayMs(int maxDelayMs) {
            this.maxDelayMs = Math.max(0, maxDelayMs);
        }
    }

    public static class Scheduler {
        private boolean enabled = false;
        private long intervalSeconds = 3600;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getIntervalSeconds() {
            return intervalSeconds;
        }

        public void setIntervalSeconds(long intervalSeconds) {
            this.intervalSeconds = intervalSeconds;
        }
    }

    public static class Extraction {
        private boolean enabled = true;
        private int maxAttempts = 1;
        private int minTextLength = 200;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxAttempts() {
            return Math.max(1, maxAttempts);
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = Math.max(1, maxAttempts);
        }

        public int getMinTextLength() {
            return Math.max(0, minTextLength);
        }

        public void setMinTextLength(int minTextLength) {
            this.minTextLength = Math.max(0, minTextLength);
        }
    }

    public static class Sanitizer {
        private List<String> allowedTags = new ArrayList<>(DEFAULT_ALLOWED_TAGS);

        public List<String> getAllowedTags() {
            return allowedTags;
        }

        public void setAllowedTags(List<String> allowedTags) {
            List<String> normalized = new ArrayList<>();
            if (allowedTags != null) {
                for (String tag : allowedTags) {
                    if (tag != null && !tag.isBlank()) {
                        normalized.add(tag.trim().toLowerCase(Locale.ROOT));
                    }
                }
            }
            this.allowedTags = normalized;
        }
    }

    public static class Data {
        private String feedsCsv = "../data/feeds.csv";

        public String getFeedsCsv() {
            return feedsCsv;
        }

        public void setFeedsCsv(String feedsCsv) {
            this.feedsCsv = feedsCsv;
        }
    }

    public static class Export {
        private String root = "../corpus";

        public String getRoot() {
            return root;
        }

        public void setRoot(String root) {
            this.root = root;
        }
    }
}
