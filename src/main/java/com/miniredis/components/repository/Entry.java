package com.miniredis.components.repository;

import lombok.Getter;

@Getter
public class Entry {
    private final byte[] value;
    private Long expireAt;

    public Entry(byte[] value, Long expireAt) {
        this.value = value;
        this.expireAt = expireAt;
    }

    public boolean hasExpiry() {
        return expireAt != null;
    }

    // nanoTime values may overflow, so compare by difference
    public boolean isExpired(long now) {
        return expireAt != null && now - expireAt >= 0;
    }

    void expireAt(long when) {
        this.expireAt = when;
    }

    void persist() {
        this.expireAt = null;
    }
}
