package com.example.reelroom.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All tunables of the recorder, bound from {@code reelroom.*}.
 */
@ConfigurationProperties(prefix = "reelroom")
public class ReelroomProperties {

    private final Capture capture = new Capture();
    private final Store store = new Store();
    private final Upload upload = new Upload();
    private final Download download = new Download();
    private final Export export = new Export();
    private final Recorder recorder = new Recorder();

    public Capture getCapture() { return capture; }
    public Store getStore() { return store; }
    public Upload getUpload() { return upload; }
    public Download getDownload() { return download; }
    public Export getExport() { return export; }
    public Recorder getRecorder() { return recorder; }

    public static class Capture {
        private int maxBodyChars = 200_000;
        // substring match against the full request url
        private List<String> ignoreUrlPatterns = new ArrayList<>();

        public int getMaxBodyChars() { return maxBodyChars; }
        public void setMaxBodyChars(int maxBodyChars) { this.maxBodyChars = maxBodyChars; }

        public List<String> getIgnoreUrlPatterns() { return ignoreUrlPatterns; }
        public void setIgnoreUrlPatterns(List<String> ignoreUrlPatterns) { this.ignoreUrlPatterns = ignoreUrlPatterns; }
    }

    public static class Store {
        private int maxEventsPerSession = 5000;
        private int recordIntervalDays = 2;
        private long sweepDelayMs = 1000;
        private long graceWindowMs = 10_000;

        public int getMaxEventsPerSession() { return maxEventsPerSession; }
        public void setMaxEventsPerSession(int maxEventsPerSession) { this.maxEventsPerSession = maxEventsPerSession; }

        public int getRecordIntervalDays() { return recordIntervalDays; }
        public void setRecordIntervalDays(int recordIntervalDays) { this.recordIntervalDays = recordIntervalDays; }

        public long getSweepDelayMs() { return sweepDelayMs; }
        public void setSweepDelayMs(long sweepDelayMs) { this.sweepDelayMs = sweepDelayMs; }

        public long getGraceWindowMs() { return graceWindowMs; }
        public void setGraceWindowMs(long graceWindowMs) { this.graceWindowMs = graceWindowMs; }
    }

    public static class Upload {
        private String endpoint = "";
        private long maxBytes = 20L * 1024 * 1024;
        private long timeoutMs = 5 * 60 * 1000L;
        private String platform = "";
        private String deviceId = "unknown_device";
        private String jiraId = "";
        private Map<String, String> headers = new LinkedHashMap<>();

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public long getMaxBytes() { return maxBytes; }
        public void setMaxBytes(long maxBytes) { this.maxBytes = maxBytes; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public String getPlatform() { return platform; }
        public void setPlatform(String platform) { this.platform = platform; }

        public String getDeviceId() { return deviceId; }
        public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

        public String getJiraId() { return jiraId; }
        public void setJiraId(String jiraId) { this.jiraId = jiraId; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }
    }

    public static class Download {
        private int chunkSize = 1024 * 1024;
        private int maxConcurrent = 6;
        private int maxRetries = 3;
        private long initialBackoffMs = 1000;
        private long chunkThreshold = 1024 * 1024;
        // whole-download deadline, across all ranges and retries
        private long timeoutMs = 10 * 60 * 1000L;

        public int getChunkSize() { return chunkSize; }
        public void setChunkSize(int chunkSize) { this.chunkSize = chunkSize; }

        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }

        public long getChunkThreshold() { return chunkThreshold; }
        public void setChunkThreshold(long chunkThreshold) { this.chunkThreshold = chunkThreshold; }

        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    public static class Export {
        private String directory = "./exports";

        public String getDirectory() { return directory; }
        public void setDirectory(String directory) { this.directory = directory; }
    }

    public static class Recorder {
        private boolean autoStart = true;

        public boolean isAutoStart() { return autoStart; }
        public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }
    }
}
