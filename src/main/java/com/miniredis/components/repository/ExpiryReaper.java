package com.miniredis.components.repository;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "miniredis", name = "reaper-enabled", havingValue = "true", matchIfMissing = true)
public class ExpiryReaper {
    private final InMemoryStore store;

    public ExpiryReaper(InMemoryStore store) {
        this.store = store;
    }

    @Scheduled(fixedDelayString = "${miniredis.reaper-interval-ms:1000}")
    public void reap() {
        int purged = store.purgeExpired();
        if (purged > 0) {
            log.debug("Purged {} expired keys, {} remaining", purged, store.size());
        }
    }
}
