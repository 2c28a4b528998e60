package com.miniredis.components.repository;

import java.util.List;
import java.util.Optional;

public interface KeyValueStore {

    Optional<byte[]> get(String key);

    boolean set(String key, byte[] value, SetOptions options);

    SetOutcome setWithOutcome(String key, byte[] value, SetOptions options);

    int del(List<String> keys);

    int exists(List<String> keys);

    boolean expireAt(String key, long when);

    // true only if a live key had its expiration removed
    boolean persist(String key);

    // empty if missing, -1 without expiration or once it has passed
    Optional<Long> ttlMs(String key);
}
