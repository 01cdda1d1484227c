package com.elssolution.ammeterlab.service;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/** Operator stop request shared between the HTTP/CLI side and a running campaign. */
public final class CancellationSignal {

    private final CountDownLatch latch = new CountDownLatch(1);
    private volatile String reason;

    public void cancel(String why) {
        if (latch.getCount() > 0) {
            reason = why;
            latch.countDown();
        }
    }

    public boolean isCancelled() {
        return latch.getCount() == 0;
    }

    public String getReason() {
        return reason;
    }

    /** Waits up to {@code nanos}; returns true as soon as the signal fires. */
    public boolean await(long nanos) throws InterruptedException {
        if (nanos <= 0) return isCancelled();
        return latch.await(nanos, TimeUnit.NANOSECONDS);
    }
}
