package com.subsort.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class ScanStats {
    private final AtomicLong requestsTotal = new AtomicLong(0);        // fetch 시도(재시도 포함) 총합
    private final AtomicLong retriesTotal  = new AtomicLong(0);        // 재시도 횟수 총합
    private final AtomicLong sumWallMsAcrossHosts = new AtomicLong(0); // 호스트별 파이프라인 벽시계 합
    private final AtomicLong hostsDone     = new AtomicLong(0);
    private final AtomicLong hostsFailed   = new AtomicLong(0);
    private final AtomicInteger maxObservedConcurrency = new AtomicInteger(0);

    /** attempts = (1 + retries) for a host */
    public void addAttempts(long attempts) {
        requestsTotal.addAndGet(attempts);
    }
    public void addRetries(long retries) {
        retriesTotal.addAndGet(retries);
    }
    public void addWallTimeMs(long wallMs) {
        sumWallMsAcrossHosts.addAndGet(wallMs);
    }
    public void hostFinished(boolean failed) {
        hostsDone.incrementAndGet();
        if (failed) hostsFailed.incrementAndGet();
    }
    /** 현재 동시 실행 수를 관측하여 최대값 갱신 */
    public void observeConcurrency(int current) {
        maxObservedConcurrency.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long req = requestsTotal.get();
        long attempts = Math.max(1, req);
        long avgLatencyMs = sumWallMsAcrossHosts.get() / attempts; // per-attempt 평균(대기 포함, 근사치)
        return new Snapshot(req, retriesTotal.get(), maxObservedConcurrency.get(), avgLatencyMs,
                hostsDone.get(), hostsFailed.get());
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long requestsTotal;
        public final long retriesTotal;
        public final int  maxObservedConcurrency;
        public final long avgLatencyMs;
        public final long hostsDone;
        public final long hostsFailed;
        public Snapshot(long r, long t, int c, long a, long done, long failed) {
            this.requestsTotal = r;
            this.retriesTotal = t;
            this.maxObservedConcurrency = c;
            this.avgLatencyMs = a;
            this.hostsDone = done;
            this.hostsFailed = failed;
        }
    }
}
