package com.miniredis.components.infra;

import java.util.concurrent.CountDownLatch;

public class ShutdownSignal {
    private final CountDownLatch latch = new CountDownLatch(1);

    public void trigger() {
        latch.countDown();
    }

    public boolean isTriggered() {
        return latch.getCount() == 0;
    }
}
