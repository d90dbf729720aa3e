package com.subsort.core.util;

/** 전역 토큰 버킷. 모든 워커가 공유하며 fetch 시도 1회당 토큰 1개. */
public final class RateLimiter {
    private final long capacity;
    private final long refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(long capacity, long refillPerSecond) {
        if (capacity < 1 || refillPerSecond < 1) {
            throw new IllegalArgumentException("capacity and refillPerSecond must be >= 1");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.tokens = capacity;
        this.lastNs = System.nanoTime();
    }

    /** rps <= 0 이면 null(무제한) */
    public static RateLimiter perSecond(int rps) {
        return rps > 0 ? new RateLimiter(rps, rps) : null;
    }

    public synchronized void acquire() throws InterruptedException {
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
