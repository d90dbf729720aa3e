package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.http.FetchOptions;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 가상 호스트 탐지: 원래 호스트와 대체 Host 헤더 응답 비교(리다이렉트 미추적).
 * 상태 코드, 본문 길이(차이 100 초과), 제목 중 하나라도 다르면 대체 응답으로 기록.
 */
public final class VhostModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(VhostModule.class);

    public static final String NAME = "vhost";
    static final int LENGTH_THRESHOLD = 100;

    private static final List<String> FIELDS = List.of("is_vhost", "vhost_alternatives", "vhost_indicators");

    static final List<String> INDICATORS = List.of(
            "virtual host", "vhost", "shared hosting", "multiple domains", "domain parking");

    private static final Pattern DOMAIN = Pattern.compile(
            "\\b(?:[a-zA-Z0-9](?:[a-zA-Z0-9-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,}\\b");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws Exception {
        URI target = resp.getRequestedUrl();
        HttpResponseData baseline = ctx.fetch(target, FetchOptions.builder().followRedirects(false).build());

        List<Map<String, Object>> alternatives = new ArrayList<>();
        for (String alt : testHosts(ctx.host().getHostname())) {
            HttpResponseData r;
            try {
                r = ctx.fetch(target, FetchOptions.builder()
                        .followRedirects(false)
                        .header("Host", alt)
                        .build());
            } catch (TransportException e) {
                LOG.debug("vhost probe Host={} failed for {}: {}", alt, target, e.getMessage());
                continue;
            }
            if (differs(baseline, r)) {
                Map<String, Object> m = new LinkedHashMap<>();
                m.put("host", alt);
                m.put("status", r.getStatusCode());
                m.put("title", titleOf(r));
                m.put("content_length", r.getBodySize());
                alternatives.add(m);
            }
        }

        return PartialRecord.of(NAME)
                .put("is_vhost", !alternatives.isEmpty())
                .put("vhost_alternatives", alternatives)
                .put("vhost_indicators", indicators(resp.bodyText()));
    }

    static List<String> testHosts(String hostname) {
        return List.of("example.com", "test.local", "nonexistent.domain.com", hostname.replace('.', '-') + ".test");
    }

    static boolean differs(HttpResponseData base, HttpResponseData other) {
        return base.getStatusCode() != other.getStatusCode()
                || Math.abs(base.getBodySize() - other.getBodySize()) > LENGTH_THRESHOLD
                || !Objects.equals(titleOf(base), titleOf(other));
    }

    private static String titleOf(HttpResponseData r) {
        return r.isHtml() ? HtmlSupport.title(HtmlSupport.parse(r)) : null;
    }

    static List<String> indicators(String body) {
        List<String> out = new ArrayList<>();
        if (body == null || body.isEmpty()) return out;
        String lower = body.toLowerCase(Locale.ROOT);
        for (String p : INDICATORS) if (lower.contains(p)) out.add(p);

        Set<String> domains = new LinkedHashSet<>();
        Matcher m = DOMAIN.matcher(body);
        while (m.find()) domains.add(m.group().toLowerCase(Locale.ROOT));
        if (domains.size() > 3) out.add("multiple_domains_in_content");
        return out;
    }
}
