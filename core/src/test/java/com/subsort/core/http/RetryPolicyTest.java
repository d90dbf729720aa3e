package com.subsort.core.http;

import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.ScanConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class RetryPolicyTest {

    @Test
    void retries_only_timeout_and_refused_up_to_max_attempts() {
        var p = new DefaultRetryPolicy(); // 첫 시도 + 재시도 3회

        assertEquals(4, p.maxAttempts(), "maxAttempts must be 4");

        for (ErrorKind k : new ErrorKind[]{ErrorKind.TIMEOUT, ErrorKind.CONNECTION_REFUSED}) {
            assertTrue(p.shouldRetry(k, 1), "should retry after first failure for " + k);
            assertTrue(p.shouldRetry(k, 3), "should retry after third failure for " + k);
            assertFalse(p.shouldRetry(k, 4), "must stop at attempt=4 for " + k);
        }
        for (ErrorKind k : new ErrorKind[]{ErrorKind.TLS_ERROR, ErrorKind.TOO_MANY_REDIRECTS, ErrorKind.OTHER}) {
            assertFalse(p.shouldRetry(k, 1), "must not retry " + k);
        }
        assertFalse(p.shouldRetry(null, 1));
    }

    @Test
    void backoff_is_exponential_with_jitter_plus_minus_10_percent() {
        var p = new DefaultRetryPolicy();

        // 1000 → 2000 → 4000 (ms), 각각 ±10%
        assertBetween(p.nextDelay(1).toMillis(), 900, 1100, "attempt=1 backoff");
        assertBetween(p.nextDelay(2).toMillis(), 1800, 2200, "attempt=2 backoff");
        assertBetween(p.nextDelay(3).toMillis(), 3600, 4400, "attempt=3 backoff");
    }

    @Test
    void delay_is_capped_by_max_delay() {
        var p = new DefaultRetryPolicy(10, 1000, 2.0, Duration.ofMillis(1500));

        assertEquals(1500, p.nextDelay(6).toMillis());
    }

    @Test
    void built_from_config() {
        ScanConfig cfg = ScanConfig.defaults().setMaxRetries(0).setRetryBaseMs(10);
        var p = DefaultRetryPolicy.from(cfg);

        assertEquals(1, p.maxAttempts());
        assertFalse(p.shouldRetry(ErrorKind.TIMEOUT, 1));
    }

    @Test
    void decide_returns_delay_only_when_retryable() {
        var p = new DefaultRetryPolicy(4, 100, 2.0, Duration.ofSeconds(1));

        Optional<Duration> d = p.decide(1, new TransportException(ErrorKind.TIMEOUT, "t"));
        assertTrue(d.isPresent());
        assertBetween(d.get().toMillis(), 90, 110, "decide delay");
        assertTrue(p.decide(1, new TransportException(ErrorKind.TLS_ERROR, "x")).isEmpty());
        assertTrue(p.decide(1, null).isEmpty());
    }

    @Test
    void counting_policy_tallies_granted_retries() {
        var p = new CountingRetryPolicy(new DefaultRetryPolicy(3, 0, 1.0, Duration.ZERO));

        p.shouldRetry(ErrorKind.TIMEOUT, 1);
        p.shouldRetry(ErrorKind.OTHER, 2);
        p.shouldRetry(ErrorKind.CONNECTION_REFUSED, 2);
        p.shouldRetry(ErrorKind.TIMEOUT, 3);

        assertEquals(2, p.getRetryCount());
        assertEquals(3, p.maxAttempts());
    }

    // ---- helpers ----
    private static void assertBetween(long actual, long min, long max, String label) {
        assertTrue(actual >= min && actual <= max,
                () -> label + " out of range: " + actual + "ms (expected " + min + "~" + max + "ms)");
    }
}
