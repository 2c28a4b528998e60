package com.miniredis.components.infra;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Semaphore;

@Slf4j
public class AdmissionController {
    private final Semaphore semaphore;
    private final int maxConns;

    public AdmissionController(int maxConns) {
        if (maxConns <= 0) {
            throw new IllegalArgumentException("maxConns must be positive: " + maxConns);
        }
        this.maxConns = maxConns;
        this.semaphore = new Semaphore(maxConns, true);
    }

    // blocks until a permit is free; interrupting the caller abandons the wait
    public Permit acquire() throws InterruptedException {
        if (semaphore.availablePermits() == 0) {
            log.info("All {} connection permits in use, waiting for one to be released", maxConns);
        }
        semaphore.acquire();
        return new Permit(semaphore);
    }

    public int available() {
        return semaphore.availablePermits();
    }

    public int getMaxConns() {
        return maxConns;
    }
}
