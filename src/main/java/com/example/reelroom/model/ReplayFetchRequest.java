package com.example.reelroom.model;

public class ReplayFetchRequest {
    private String url;
    private Long fileSize; // optional, skips the HEAD probe

    public ReplayFetchRequest() {}

    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }

    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }
}
