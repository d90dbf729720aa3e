package com.subsort.core.http;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** fetch 1회 옵션. null 필드는 ScanConfig 기본값을 따른다. */
public final class FetchOptions {

    public static final FetchOptions DEFAULT = builder().build();

    private final String method;
    private final Map<String, String> headers;
    private final Duration timeout;
    private final Boolean followRedirects;

    private FetchOptions(Builder b) {
        this.method = b.method;
        this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(b.headers));
        this.timeout = b.timeout;
        this.followRedirects = b.followRedirects;
    }

    public String getMethod() { return method; }
    public Map<String, String> getHeaders() { return headers; }
    public Duration getTimeout() { return timeout; }
    public Boolean getFollowRedirects() { return followRedirects; }

    public static Builder builder() { return new Builder(); }

    public Builder toBuilder() {
        Builder b = new Builder().method(method);
        headers.forEach(b::header);
        b.timeout = timeout;
        b.followRedirects = followRedirects;
        return b;
    }

    public static final class Builder {
        private String method = "GET";
        private final Map<String, String> headers = new LinkedHashMap<>();
        private Duration timeout;
        private Boolean followRedirects;

        public Builder method(String method) { this.method = method; return this; }
        public Builder header(String name, String value) { this.headers.put(name, value); return this; }
        public Builder timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Builder followRedirects(boolean v) { this.followRedirects = v; return this; }

        public FetchOptions build() { return new FetchOptions(this); }
    }
}
