package com.subsort.core.scanner;

import com.subsort.core.api.IHttpTransport;
import com.subsort.core.http.FetchOptions;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.Host;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.util.RateLimiter;

import java.net.URI;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 모듈 1회 실행 컨텍스트. 모듈마다 새로 만들어 예산(deadline)을 따로 센다.
 * 추가 왕복은 fetch()로만 하며 요청 1건의 timeout = min(config.timeout, 남은 예산).
 */
public final class ModuleContext {

    private final Host host;
    private final ScanConfig config;
    private final IHttpTransport transport;
    private final RateLimiter rateLimiter; // null이면 무제한
    private final long deadlineNanos;
    private final AtomicBoolean cancel; // 스캔 전체 취소 플래그(null 가능)

    public ModuleContext(Host host, ScanConfig config, IHttpTransport transport,
                         RateLimiter rateLimiter, Duration budget, AtomicBoolean cancel) {
        this.host = Objects.requireNonNull(host, "host");
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.rateLimiter = rateLimiter;
        this.deadlineNanos = System.nanoTime() + Objects.requireNonNull(budget, "budget").toNanos();
        this.cancel = cancel;
    }

    public ModuleContext(Host host, ScanConfig config, IHttpTransport transport,
                         RateLimiter rateLimiter, Duration budget) {
        this(host, config, transport, rateLimiter, budget, null);
    }

    /** 기본 예산(config.moduleBudget), 속도 제한 없음 */
    public ModuleContext(Host host, ScanConfig config, IHttpTransport transport) {
        this(host, config, transport, null, config.getModuleBudget());
    }

    public Host host() { return host; }
    public ScanConfig config() { return config; }
    public IHttpTransport transport() { return transport; }

    public Duration remaining() {
        long left = deadlineNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    /** 예산 소진 또는 스캔 취소 */
    public boolean expired() { return cancelled() || remaining().isZero(); }

    public boolean cancelled() { return cancel != null && cancel.get(); }

    /** 호스트 origin 기준 경로 해석 ("/robots.txt" → https://host/robots.txt) */
    public URI resolve(String path) {
        return host.origin().resolve(path);
    }

    public HttpResponseData fetch(URI url) throws ModuleException, TransportException, InterruptedException {
        return fetch(url, FetchOptions.DEFAULT);
    }

    public HttpResponseData fetch(URI url, FetchOptions options)
            throws ModuleException, TransportException, InterruptedException {
        if (cancelled()) throw new ModuleException("scan cancelled before " + url);
        if (remaining().isZero()) {
            throw new ModuleException("module budget exhausted before " + url);
        }
        if (rateLimiter != null) rateLimiter.acquire();
        if (cancelled()) throw new ModuleException("scan cancelled before " + url);
        Duration left = remaining();
        if (left.isZero()) {
            throw new ModuleException("module budget exhausted before " + url);
        }
        Duration perCall = config.getTimeout().compareTo(left) < 0 ? config.getTimeout() : left;
        FetchOptions opts = (options == null ? FetchOptions.DEFAULT : options).toBuilder().timeout(perCall).build();
        return transport.fetch(url, opts);
    }
}
