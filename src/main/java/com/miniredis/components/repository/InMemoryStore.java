package com.miniredis.components.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantReadWriteLock;

@Slf4j
@Component
public class InMemoryStore implements KeyValueStore {
    private final Map<String, Entry> map = new HashMap<>();
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final MonotonicClock clock;

    public InMemoryStore(MonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<byte[]> get(String key) {
        boolean expired = false;
        rwLock.readLock().lock();
        try {
            Entry entry = map.get(key);
            if (entry != null) {
                if (!entry.isExpired(clock.nanoTime())) {
                    return Optional.of(entry.getValue().clone());
                }
                expired = true;
            }
        } finally {
            rwLock.readLock().unlock();
        }

        if (expired) {
            removeIfExpired(key);
        }
        return Optional.empty();
    }

    @Override
    public boolean set(String key, byte[] value, SetOptions options) {
        return setWithOutcome(key, value, options).isApplied();
    }

    @Override
    public SetOutcome setWithOutcome(String key, byte[] value, SetOptions options) {
        rwLock.writeLock().lock();
        try {
            Entry previous = liveEntry(key, clock.nanoTime());

            switch (options.getMode()) {
                case ONLY_IF_ABSENT -> {
                    if (previous != null) {
                        return SetOutcome.REJECTED;
                    }
                }
                case ONLY_IF_PRESENT -> {
                    if (previous == null) {
                        return SetOutcome.REJECTED;
                    }
                }
                default -> {
                }
            }

            Long expireAt = options.getExpire().orElse(null);
            if (expireAt == null && options.isKeepTtl() && previous != null) {
                expireAt = previous.getExpireAt();
            }
            map.put(key, new Entry(value.clone(), expireAt));

            return previous == null ? SetOutcome.CREATED : SetOutcome.UPDATED;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public int del(List<String> keys) {
        rwLock.writeLock().lock();
        try {
            long now = clock.nanoTime();
            int removed = 0;
            for (String key : keys) {
                Entry entry = map.remove(key);
                if (entry != null && !entry.isExpired(now)) {
                    removed++;
                }
            }
            return removed;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public int exists(List<String> keys) {
        rwLock.readLock().lock();
        try {
            long now = clock.nanoTime();
            int count = 0;
            for (String key : keys) {
                Entry entry = map.get(key);
                if (entry != null && !entry.isExpired(now)) {
                    count++;
                }
            }
            return count;
        } finally {
            rwLock.readLock().unlock();
        }
    }

    @Override
    public boolean expireAt(String key, long when) {
        rwLock.writeLock().lock();
        try {
            Entry entry = liveEntry(key, clock.nanoTime());
            if (entry == null) {
                return false;
            }
            entry.expireAt(when);
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public boolean persist(String key) {
        rwLock.writeLock().lock();
        try {
            Entry entry = liveEntry(key, clock.nanoTime());
            if (entry == null || !entry.hasExpiry()) {
                return false;
            }
            entry.persist();
            return true;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Long> ttlMs(String key) {
        rwLock.readLock().lock();
        try {
            Entry entry = map.get(key);
            if (entry == null) {
                return Optional.empty();
            }
            if (!entry.hasExpiry()) {
                return Optional.of(-1L);
            }
            long remaining = entry.getExpireAt() - clock.nanoTime();
            if (remaining <= 0) {
                return Optional.of(-1L);
            }
            // round up so a live key never reports 0
            long millis = TimeUnit.NANOSECONDS.toMillis(remaining + TimeUnit.MILLISECONDS.toNanos(1) - 1);
            return Optional.of(millis);
        } finally {
            rwLock.readLock().unlock();
        }
    }

    public int purgeExpired() {
        rwLock.writeLock().lock();
        try {
            long now = clock.nanoTime();
            int purged = 0;
            Iterator<Entry> it = map.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired(now)) {
                    it.remove();
                    purged++;
                }
            }
            return purged;
        } finally {
            rwLock.writeLock().unlock();
        }
    }

    // includes expired entries not yet purged
    public int size() {
        rwLock.readLock().lock();
        try {
            return map.size();
        } finally {
            rwLock.readLock().unlock();
        }
    }

    // caller must hold the write lock
    private Entry liveEntry(String key, long now) {
        Entry entry = map.get(key);
        if (entry != null && entry.isExpired(now)) {
            map.remove(key);
            log.debug("Lazily expired key {}", key);
            return null;
        }
        return entry;
    }

    private void removeIfExpired(String key) {
        rwLock.writeLock().lock();
        try {
            liveEntry(key, clock.nanoTime());
        } finally {
            rwLock.writeLock().unlock();
        }
    }
}
