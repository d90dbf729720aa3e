package com.subsort.core.model;

import com.subsort.core.config.ConfigException;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 스캔 설정 (CLI 옵션 / scan.yml 매핑 대상).
 * ScanService는 validate() 후 copy()로 얻은 사본만 읽는다. 스캔 도중 원본을 바꿔도 영향 없음.
 */
public final class ScanConfig {

    public static final int MAX_CONCURRENCY = 200;
    public static final List<Integer> DEFAULT_PORTS =
            List.of(21, 22, 25, 80, 443, 3306, 5432, 6379, 8080, 8443);

    // ---------- 기본 필드 ----------
    private int concurrency = 50;                       // 동시 파이프라인 상한
    private Duration timeout = Duration.ofSeconds(5);   // 요청 1회 벽시계 상한(connect + body)
    private int maxRetries = 3;                         // 첫 시도 제외 재시도 횟수
    private Duration delay = Duration.ZERO;             // 매 시도 전 대기
    private boolean ignoreSsl = false;
    private boolean followRedirects = true;
    private String userAgent;                           // null이면 로테이션
    private List<String> userAgents = List.of();        // 비어 있으면 내장 풀
    private Map<String, String> headers = new LinkedHashMap<>();
    private Set<String> modules = new LinkedHashSet<>(List.of("status"));

    // ---------- 확장 필드 ----------
    private int rps = 0;                                // 전역 요청 속도(0 = 무제한)
    private int maxBodyBytes = 1024 * 1024;
    private long retryBaseMs = 1000;
    private double retryMultiplier = 2.0;
    private Duration retryMaxDelay = Duration.ofSeconds(30);
    private String defaultScheme = "https";
    private boolean httpFallback = false;
    private int moduleTimeoutFactor = 2;
    private List<Integer> ports = DEFAULT_PORTS;

    // ---------- getters ----------
    public int getConcurrency() { return concurrency; }
    public Duration getTimeout() { return timeout; }
    public int getMaxRetries() { return maxRetries; }
    public Duration getDelay() { return delay; }
    public boolean isIgnoreSsl() { return ignoreSsl; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public List<String> getUserAgents() { return userAgents; }
    public Map<String, String> getHeaders() { return headers; }
    public Set<String> getModules() { return modules; }
    public int getRps() { return rps; }
    public int getMaxBodyBytes() { return maxBodyBytes; }
    public long getRetryBaseMs() { return retryBaseMs; }
    public double getRetryMultiplier() { return retryMultiplier; }
    public Duration getRetryMaxDelay() { return retryMaxDelay; }
    public String getDefaultScheme() { return defaultScheme; }
    public boolean isHttpFallback() { return httpFallback; }
    public int getModuleTimeoutFactor() { return moduleTimeoutFactor; }
    public List<Integer> getPorts() { return ports; }

    /** 모듈 1개의 추가 왕복 예산(timeout × factor) */
    public Duration getModuleBudget() { return timeout.multipliedBy(Math.max(1, moduleTimeoutFactor)); }

    public long getTimeoutMs() { return timeout.toMillis(); }

    // ---------- fluent setters ----------
    public void setRps(int rps) { this.rps = rps; }
    public ScanConfig setConcurrency(int concurrency) { this.concurrency = concurrency; return this; }
    public ScanConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public ScanConfig setTimeoutMs(long ms) { this.timeout = Duration.ofMillis(Math.max(1, ms)); return this; }
    public ScanConfig setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; return this; }
    public ScanConfig setDelay(Duration delay) { this.delay = (delay == null ? Duration.ZERO : delay); return this; }
    public ScanConfig setIgnoreSsl(boolean v) { this.ignoreSsl = v; return this; }
    public ScanConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScanConfig setUserAgent(String ua) { this.userAgent = (ua == null || ua.isBlank()) ? null : ua.trim(); return this; }
    public ScanConfig setMaxBodyBytes(int v) { this.maxBodyBytes = v; return this; }
    public ScanConfig setRetryBaseMs(long v) { this.retryBaseMs = v; return this; }
    public ScanConfig setRetryMultiplier(double v) { this.retryMultiplier = v; return this; }
    public ScanConfig setRetryMaxDelay(Duration v) { this.retryMaxDelay = v; return this; }
    public ScanConfig setHttpFallback(boolean v) { this.httpFallback = v; return this; }
    public ScanConfig setModuleTimeoutFactor(int v) { this.moduleTimeoutFactor = v; return this; }

    public ScanConfig setDefaultScheme(String scheme) {
        this.defaultScheme = (scheme == null ? null : scheme.trim().toLowerCase(Locale.ROOT));
        return this;
    }

    public ScanConfig setUserAgents(List<String> pool) {
        this.userAgents = (pool == null) ? List.of() : List.copyOf(pool);
        return this;
    }

    public ScanConfig setHeaders(Map<String, String> headers) {
        this.headers = (headers == null) ? new LinkedHashMap<>() : new LinkedHashMap<>(headers);
        return this;
    }

    public ScanConfig addHeader(String name, String value) {
        this.headers.put(name, value);
        return this;
    }

    /** 모듈 이름 집합 교체. 실행 순서는 ModuleRegistry가 정하므로 여기 순서는 의미 없음 */
    public ScanConfig setModules(Collection<String> names) {
        LinkedHashSet<String> s = new LinkedHashSet<>();
        if (names != null) {
            for (String n : names) {
                if (n != null && !n.isBlank()) s.add(n.trim().toLowerCase(Locale.ROOT));
            }
        }
        this.modules = s;
        return this;
    }

    public ScanConfig enableModule(String name) {
        if (name != null && !name.isBlank()) modules.add(name.trim().toLowerCase(Locale.ROOT));
        return this;
    }

    public ScanConfig setPorts(List<Integer> ports) {
        this.ports = (ports == null || ports.isEmpty()) ? DEFAULT_PORTS : List.copyOf(ports);
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (concurrency < 1 || concurrency > MAX_CONCURRENCY)
            throw new ConfigException("concurrency must be in [1, " + MAX_CONCURRENCY + "]: " + concurrency);
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new ConfigException("timeout must be > 0");
        if (maxRetries < 0) throw new ConfigException("maxRetries must be >= 0");
        if (delay == null || delay.isNegative()) throw new ConfigException("delay must be >= 0");
        if (rps < 0) throw new ConfigException("rps must be >= 0");
        if (maxBodyBytes < 1) throw new ConfigException("maxBodyBytes must be >= 1");
        if (retryBaseMs < 0) throw new ConfigException("retryBaseMs must be >= 0");
        if (retryMultiplier < 1.0) throw new ConfigException("retryMultiplier must be >= 1.0");
        if (retryMaxDelay == null || retryMaxDelay.isNegative())
            throw new ConfigException("retryMaxDelay must be >= 0");
        if (!"https".equals(defaultScheme) && !"http".equals(defaultScheme))
            throw new ConfigException("defaultScheme must be http or https: " + defaultScheme);
        if (moduleTimeoutFactor < 1) throw new ConfigException("moduleTimeoutFactor must be >= 1");
        if (modules == null || modules.isEmpty()) throw new ConfigException("at least one module must be enabled");
        for (Integer p : ports) {
            if (p == null || p < 1 || p > 65535) throw new ConfigException("invalid port: " + p);
        }
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    /** 스캔 시작 시 고정 사본. 컬렉션은 불변으로 복사한다. */
    public ScanConfig copy() {
        ScanConfig c = new ScanConfig();
        c.concurrency = concurrency;
        c.timeout = timeout;
        c.maxRetries = maxRetries;
        c.delay = delay;
        c.ignoreSsl = ignoreSsl;
        c.followRedirects = followRedirects;
        c.userAgent = userAgent;
        c.userAgents = List.copyOf(userAgents);
        c.headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        c.modules = Collections.unmodifiableSet(new LinkedHashSet<>(modules));
        c.rps = rps;
        c.maxBodyBytes = maxBodyBytes;
        c.retryBaseMs = retryBaseMs;
        c.retryMultiplier = retryMultiplier;
        c.retryMaxDelay = retryMaxDelay;
        c.defaultScheme = defaultScheme;
        c.httpFallback = httpFallback;
        c.moduleTimeoutFactor = moduleTimeoutFactor;
        c.ports = List.copyOf(ports);
        return c;
    }
}
