package com.ryuqq.monobuild.testkit.runner;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Tracks how many runners execute at the same time.
 *
 * @author Monobuild Team
 * @since 1.0.0
 */
public final class ConcurrencyProbe {

    private final AtomicInteger current = new AtomicInteger();
    private final AtomicInteger max = new AtomicInteger();

    public void enter() {
        int now = current.incrementAndGet();
        max.accumulateAndGet(now, Math::max);
    }

    public void exit() {
        current.decrementAndGet();
    }

    public int getCurrent() {
        return current.get();
    }

    /**
     * Highest number of simultaneous runners observed.
     *
     * @return peak concurrency
     */
    public int getMax() {
        return max.get();
    }
}
