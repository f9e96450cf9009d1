package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reply of the remote session sink.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UploadResponse {

    private boolean success;
    private StoredSession session;
    private String error;

    public UploadResponse() {}

    public UploadResponse(boolean success, StoredSession session, String error) {
        this.success = success;
        this.session = session;
        this.error = error;
    }

    public boolean isSuccess() { return success; }
    public void setSuccess(boolean success) { this.success = success; }

    public StoredSession getSession() { return session; }
    public void setSession(StoredSession session) { this.session = session; }

    public String getError() { return error; }
    public void setError(String error) { this.error = error; }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class StoredSession {
        private String id;
        @JsonProperty("created_at")
        private String createdAt;
        @JsonProperty("jira_id")
        private String jiraId;
        private String platform;
        @JsonProperty("device_id")
        private String deviceId;
        @JsonProperty("file_size")
        private Long fileSize;

        public StoredSession() {}

        public String getId() { return id; }
        public void setId(String id) { this.id = id; }

        public String getCreatedAt() { return createdAt; }
        public void setCreatedAt(String createdAt) { this.createdAt = createdAt; }

        public String getJiraId() { return jiraId; }
        public void setJiraId(String jiraId) { this.jiraId = jiraId; }

        public String getPlatform() { return platform; }
        public void setPlatform(String platform) { this.platform = platform; }

        public String getDeviceId() { return deviceId; }
        public void setDeviceId(String deviceId) { this.deviceId = deviceId; }

        public Long getFileSize() { return fileSize; }
        public void setFileSize(Long fileSize) { this.fileSize = fileSize; }
    }
}
