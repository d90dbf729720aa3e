package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** 패시브: Server 배너 분류 + 보안 헤더 존재율 + CDN/WAF 마커 */
public final class ServerModule implements IAnalysisModule {

    public static final String NAME = "server";

    private static final List<String> FIELDS = List.of(
            "server", "server_type", "security_headers", "security_score", "cdn_waf");

    static final List<String> SECURITY_HEADERS = List.of(
            "Strict-Transport-Security",
            "Content-Security-Policy",
            "X-Frame-Options",
            "X-Content-Type-Options",
            "Referrer-Policy",
            "Permissions-Policy",
            "X-XSS-Protection");

    // 배너 부분 문자열 → 분류 (앞쪽 우선: openresty가 nginx보다 먼저)
    private static final String[][] SERVER_TYPES = {
            {"openresty", "openresty"},
            {"nginx", "nginx"},
            {"apache-coyote", "tomcat"},
            {"tomcat", "tomcat"},
            {"apache", "apache"},
            {"microsoft-iis", "iis"},
            {"iis", "iis"},
            {"cloudflare", "cloudflare"},
            {"litespeed", "litespeed"},
            {"gws", "gws"},
            {"envoy", "envoy"},
            {"caddy", "caddy"},
            {"jetty", "jetty"},
    };

    @Override public String name() { return NAME; }
    @Override public int priority() { return 10; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        String server = resp.header("Server");
        if (server != null && server.isBlank()) server = null;

        Map<String, String> present = new LinkedHashMap<>();
        for (String h : SECURITY_HEADERS) {
            String v = resp.header(h);
            if (v != null && !v.isBlank()) present.put(h, v.trim());
        }
        int score = (int) Math.round(present.size() * 100.0 / SECURITY_HEADERS.size());

        return PartialRecord.of(NAME)
                .put("server", server)
                .put("server_type", classify(server))
                .put("security_headers", present)
                .put("security_score", score)
                .put("cdn_waf", cdnWaf(resp));
    }

    static String classify(String server) {
        if (server == null) return "undisclosed";
        String s = server.toLowerCase(Locale.ROOT);
        for (String[] t : SERVER_TYPES) {
            if (s.contains(t[0])) return t[1];
        }
        return "unknown";
    }

    /** 헤더 마커로 CDN/WAF 추정. 없으면 null */
    static String cdnWaf(HttpResponseData resp) {
        String server = lower(resp.header("Server"));
        if (resp.header("CF-RAY") != null || server.contains("cloudflare")) return "Cloudflare";
        if (resp.header("X-Sucuri-ID") != null || server.contains("sucuri")) return "Sucuri";
        if (resp.header("X-Iinfo") != null || lower(resp.header("X-CDN")).contains("incapsula")) return "Incapsula";
        if (resp.header("X-Amz-Cf-Id") != null || lower(resp.header("Via")).contains("cloudfront")) return "CloudFront";
        if (resp.header("X-Azure-Ref") != null) return "Azure Front Door";
        if (resp.header("X-Fastly-Request-ID") != null || lower(resp.header("X-Served-By")).contains("cache-")) return "Fastly";
        if (server.contains("akamai") || resp.header("X-Akamai-Transformed") != null) return "Akamai";
        return null;
    }

    private static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
