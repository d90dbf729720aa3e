package com.subsort.core.http;

import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.ScanConfig;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/** TIMEOUT / CONNECTION_REFUSED에서만 재시도. base × mult^(n-1), ±10% Jitter, 상한 maxDelay */
public final class DefaultRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final double multiplier;
    private final long maxDelayMillis;

    public DefaultRetryPolicy() { this(4, 1000, 2.0, Duration.ofSeconds(30)); }

    public DefaultRetryPolicy(int maxAttempts, long baseMillis, double multiplier, Duration maxDelay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(0, baseMillis);
        this.multiplier = Math.max(1.0, multiplier);
        this.maxDelayMillis = (maxDelay == null ? Long.MAX_VALUE : Math.max(0, maxDelay.toMillis()));
    }

    public static DefaultRetryPolicy from(ScanConfig cfg) {
        return new DefaultRetryPolicy(cfg.getMaxRetries() + 1, cfg.getRetryBaseMs(),
                cfg.getRetryMultiplier(), cfg.getRetryMaxDelay());
    }

    @Override public boolean shouldRetry(ErrorKind kind, int attempt) {
        if (attempt >= maxAttempts) return false;
        return kind != null && kind.isRetryable();
    }

    @Override public Duration nextDelay(int attempt) {
        double raw = baseMillis * Math.pow(multiplier, Math.max(0, attempt - 1)); // 1000, 2000, 4000...
        double jitter = 0.9 + ThreadLocalRandom.current().nextDouble(0.2);        // ±10%
        long ms = (long) Math.min((double) maxDelayMillis, raw * jitter);
        return Duration.ofMillis(ms);
    }

    @Override public int maxAttempts() { return maxAttempts; }
}
