package com.subsort.core.model;

import java.net.URI;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/** HTTP 응답 캡처(불변). 본문은 바이트로 보관하고 필요 시 Content-Type charset으로 디코딩. */
public final class HttpResponseData {
    private final URI requestedUrl;
    private final URI finalUrl;
    private final int statusCode;
    private final Map<String, List<String>> headers;   // 대소문자 무시
    private final byte[] body;
    private final boolean truncated;
    private final long elapsedMs;
    private final int redirectCount;
    private volatile String bodyText;                   // 지연 디코딩 캐시

    private HttpResponseData(Builder b) {
        this.requestedUrl = b.requestedUrl;
        this.finalUrl = (b.finalUrl == null ? b.requestedUrl : b.finalUrl);
        this.statusCode = b.statusCode;
        TreeMap<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) {
            b.headers.forEach((k, v) -> {
                if (k == null || v == null) return;
                h.computeIfAbsent(k, x -> new ArrayList<>()).addAll(v);
            });
        }
        h.replaceAll((k, v) -> List.copyOf(v));
        this.headers = Collections.unmodifiableMap(h);
        this.body = (b.body == null) ? new byte[0] : b.body;
        this.truncated = b.truncated;
        this.elapsedMs = b.elapsedMs;
        this.redirectCount = b.redirectCount;
    }

    public URI getRequestedUrl() { return requestedUrl; }
    public URI getFinalUrl() { return finalUrl; }
    public String getScheme() { return finalUrl.getScheme(); }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public boolean isTruncated() { return truncated; }
    public long getElapsedMs() { return elapsedMs; }
    public int getRedirectCount() { return redirectCount; }
    public int getBodySize() { return body.length; }

    /** 방어적 복사본 */
    public byte[] getBody() { return body.clone(); }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        List<String> vs = headers.get(name);
        return (vs == null || vs.isEmpty()) ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        List<String> vs = headers.get(name);
        return vs == null ? List.of() : vs;
    }

    public String getContentType() { return header("Content-Type"); }

    public boolean isHtml() {
        String ct = getContentType();
        return ct != null && ct.toLowerCase(Locale.ROOT).contains("html");
    }

    /** Content-Type charset → 실패 시 UTF-8 */
    public String bodyText() {
        String t = bodyText;
        if (t == null) {
            t = new String(body, charsetOf(getContentType()));
            bodyText = t;
        }
        return t;
    }

    static Charset charsetOf(String contentType) {
        if (contentType == null) return StandardCharsets.UTF_8;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String name = p.substring(8).trim().replace("\"", "");
                try {
                    return Charset.forName(name);
                } catch (RuntimeException e) {
                    return StandardCharsets.UTF_8;
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI requestedUrl;
        private URI finalUrl;
        private int statusCode;
        private Map<String, List<String>> headers;
        private byte[] body;
        private boolean truncated;
        private long elapsedMs;
        private int redirectCount;
        private boolean ownHeaders;

        public Builder url(URI url) { this.requestedUrl = url; return this; }
        public Builder finalUrl(URI url) { this.finalUrl = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; this.ownHeaders = false; return this; }
        public Builder header(String name, String value) {
            if (!ownHeaders) {
                TreeMap<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
                if (this.headers != null) this.headers.forEach((k, v) -> copy.put(k, new ArrayList<>(v)));
                this.headers = copy;
                ownHeaders = true;
            }
            this.headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
            return this;
        }
        public Builder body(byte[] body) { this.body = body; return this; }
        public Builder body(String body) { this.body = (body == null ? null : body.getBytes(StandardCharsets.UTF_8)); return this; }
        public Builder truncated(boolean truncated) { this.truncated = truncated; return this; }
        public Builder elapsedMs(long elapsedMs) { this.elapsedMs = elapsedMs; return this; }
        public Builder redirectCount(int redirectCount) { this.redirectCount = redirectCount; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(requestedUrl, "url");
            return new HttpResponseData(this);
        }
    }
}
