package com.example.reelroom.transfer;

import com.example.reelroom.model.DownloadProgress;

@FunctionalInterface
public interface DownloadListener {

    DownloadListener NONE = p -> {};

    void onProgress(DownloadProgress progress);
}
