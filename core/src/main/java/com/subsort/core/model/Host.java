package com.subsort.core.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * 입력 호스트 1건. 원본 문자열(raw)이 식별자이며, 정규화 URL은 한 번만 계산한다.
 * - 앞뒤 공백/끝 점 제거, 호스트명 소문자화
 * - 스킴 없으면 defaultScheme 추론
 * - fragment 제거, 빈 path는 "/"
 */
public final class Host {

    private final String raw;
    private final URI url;
    private final boolean schemeExplicit;

    private Host(String raw, URI url, boolean schemeExplicit) {
        this.raw = raw;
        this.url = url;
        this.schemeExplicit = schemeExplicit;
    }

    /** @throws IllegalArgumentException URL로 만들 수 없는 입력 */
    public static Host of(String raw, String defaultScheme) {
        Objects.requireNonNull(raw, "raw");
        String s = raw.trim();
        if (s.isEmpty()) throw new IllegalArgumentException("empty host");
        if (s.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("whitespace in host: " + s);
        }
        boolean explicit = s.contains("://");
        String candidate = explicit ? s : defaultScheme + "://" + s;

        URI u;
        try {
            u = new URI(candidate);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("unparseable host: " + raw, e);
        }
        String scheme = (u.getScheme() == null ? "" : u.getScheme().toLowerCase(Locale.ROOT));
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("unsupported scheme: " + scheme);
        }
        String hostname = u.getHost();
        if (hostname == null && u.getRawAuthority() != null && u.getRawAuthority().indexOf('_') >= 0) {
            // java.net.http는 레지스트리 기반 authority(밑줄 포함)로 요청을 만들 수 없다
            throw new IllegalArgumentException("underscore in hostname is not addressable over HTTP: "
                    + u.getRawAuthority());
        }
        if (hostname == null) throw new IllegalArgumentException("no hostname in: " + raw);
        hostname = hostname.toLowerCase(Locale.ROOT);
        while (hostname.endsWith(".")) hostname = hostname.substring(0, hostname.length() - 1);
        if (hostname.isEmpty()) throw new IllegalArgumentException("no hostname in: " + raw);

        StringBuilder b = new StringBuilder(scheme).append("://").append(hostname);
        if (u.getPort() != -1) b.append(':').append(u.getPort());
        String path = u.getRawPath();
        b.append(path == null || path.isEmpty() ? "/" : path);
        if (u.getRawQuery() != null) b.append('?').append(u.getRawQuery());

        try {
            return new Host(raw, new URI(b.toString()), explicit);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("unparseable host: " + raw, e);
        }
    }

    /** 같은 raw를 유지한 채 스킴만 바꾼 사본(http 폴백용) */
    public Host withScheme(String scheme) {
        String s = url.toString().replaceFirst("^https?://", scheme + "://");
        return new Host(raw, URI.create(s), schemeExplicit);
    }

    public String getRaw() { return raw; }
    public URI getUrl() { return url; }
    public String getHostname() { return url.getHost(); }
    public boolean isSchemeExplicit() { return schemeExplicit; }

    /** scheme://host[:port] */
    public URI origin() {
        String s = url.getScheme() + "://" + url.getRawAuthority();
        return URI.create(s);
    }

    @Override public String toString() { return raw + " -> " + url; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Host h)) return false;
        return raw.equals(h.raw) && url.equals(h.url);
    }

    @Override public int hashCode() { return Objects.hash(raw, url); }
}
