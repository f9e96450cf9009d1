package com.example.reelroom.model;

public enum ChunkStatus {
    PENDING,
    DOWNLOADING,
    COMPLETED,
    ERROR
}
