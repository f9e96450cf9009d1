package com.example.reelroom.archive;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Written as {@code manifest.json} next to {@code data.json}. Its presence marks the keyed layout.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveManifest {

    public static final String FORMAT = "reelroom-archive";
    public static final int VERSION = 1;

    private String format = FORMAT;
    private int version = VERSION;
    private List<String> sessions = new ArrayList<>();

    public ArchiveManifest() {}

    public ArchiveManifest(List<String> sessions) {
        this.sessions = sessions;
    }

    public String getFormat() { return format; }
    public void setFormat(String format) { this.format = format; }

    public int getVersion() { return version; }
    public void setVersion(int version) { this.version = version; }

    public List<String> getSessions() { return sessions; }
    public void setSessions(List<String> sessions) { this.sessions = sessions; }
}
