package com.miniredis.components.infra;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

public class Permit implements AutoCloseable {
    private final Semaphore semaphore;
    private final AtomicBoolean released = new AtomicBoolean(false);

    Permit(Semaphore semaphore) {
        this.semaphore = semaphore;
    }

    // only the first call returns the slot to the pool
    public void release() {
        if (released.compareAndSet(false, true)) {
            semaphore.release();
        }
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        release();
    }
}
