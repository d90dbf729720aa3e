package com.subsort.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimiterTest {

    @Test
    void zero_rps_means_unlimited() {
        assertNull(RateLimiter.perSecond(0));
        assertNull(RateLimiter.perSecond(-3));
        assertNotNull(RateLimiter.perSecond(10));
    }

    @Test
    void rejects_non_positive_arguments() {
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(0, 5));
        assertThrows(IllegalArgumentException.class, () -> new RateLimiter(1, 0));
    }

    @Test
    void acquire_waits_for_refill() throws Exception {
        RateLimiter rl = new RateLimiter(1, 20); // 초당 20토큰
        long t0 = System.nanoTime();
        rl.acquire(); // 초기 토큰
        rl.acquire();
        rl.acquire();
        long ms = (System.nanoTime() - t0) / 1_000_000;
        // 이론상 ~100ms, 여유를 둔 하한
        assertTrue(ms >= 60, "3 acquires at 20 tps should take at least ~60ms, took " + ms);
    }
}
