package com.work.anchor.core.model;

import java.time.Instant;

public class BlockInfo {

    private final String hash;
    private final long number;
    private final Instant timestamp;

    public BlockInfo(String hash, long number, Instant timestamp) {
        this.hash = hash;
        this.number = number;
        this.timestamp = timestamp;
    }

    public String getHash() {
        return hash;
    }

    public long getNumber() {
        return number;
    }

    public Instant getTimestamp() {
        return timestamp;
    }
}
