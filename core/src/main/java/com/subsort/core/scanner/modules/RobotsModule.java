package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.scanner.modules.robots.RobotsParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** /robots.txt 파싱 + 흔한 사이트맵 위치 탐침 */
public final class RobotsModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(RobotsModule.class);

    public static final String NAME = "robots";

    private static final List<String> FIELDS = List.of(
            "robots_accessible", "disallowed_paths", "allowed_paths", "crawl_delay",
            "sitemap_urls", "sitemaps_found", "interesting_paths", "robots_user_agents");

    static final List<String> INTERESTING = List.of(
            "admin", "login", "api", "private", "internal", "backup", "config", "test", "dev",
            "staging", "tmp", "temp", "secret", "hidden", "upload", "download", "logs",
            "phpmyadmin", "wp-admin", "wp-content", "database");

    static final List<String> SITEMAP_PATHS = List.of(
            "/sitemap.xml", "/sitemap_index.xml", "/sitemaps.xml", "/sitemap1.xml", "/sitemap.txt");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws Exception {
        PartialRecord pr = PartialRecord.of(NAME);

        String robots = null;
        try {
            HttpResponseData r = ctx.fetch(ctx.resolve("/robots.txt"));
            if (r.getStatusCode() == 200 && !r.bodyText().isBlank()) robots = r.bodyText();
        } catch (TransportException e) {
            LOG.debug("robots.txt fetch failed for {}: {}", ctx.host().getRaw(), e.getMessage());
        }

        if (robots != null) {
            RobotsParser.ParsedRobots parsed = RobotsParser.parse(robots);
            List<String> dis = parsed.allDisallowed();
            List<String> allow = parsed.allAllowed();
            pr.put("robots_accessible", true)
              .put("disallowed_paths", dis)
              .put("allowed_paths", allow)
              .put("crawl_delay", parsed.crawlDelay())
              .put("sitemap_urls", parsed.sitemaps())
              .put("interesting_paths", interesting(dis, allow))
              .put("robots_user_agents", parsed.userAgents());
        } else {
            pr.put("robots_accessible", false)
              .put("disallowed_paths", List.of())
              .put("allowed_paths", List.of())
              .put("crawl_delay", null)
              .put("sitemap_urls", List.of())
              .put("interesting_paths", List.of())
              .put("robots_user_agents", List.of());
        }

        return pr.put("sitemaps_found", probeSitemaps(ctx));
    }

    static List<String> interesting(List<String> disallowed, List<String> allowed) {
        Set<String> out = new LinkedHashSet<>();
        List<String> all = new ArrayList<>(disallowed);
        all.addAll(allowed);
        for (String p : all) {
            String lp = p.toLowerCase(Locale.ROOT);
            for (String k : INTERESTING) {
                if (lp.contains(k)) { out.add(p); break; }
            }
        }
        return List.copyOf(out);
    }

    private List<Map<String, Object>> probeSitemaps(ModuleContext ctx) throws Exception {
        List<Map<String, Object>> found = new ArrayList<>();
        for (String path : SITEMAP_PATHS) {
            URI u = ctx.resolve(path);
            HttpResponseData r;
            try {
                r = ctx.fetch(u);
            } catch (TransportException e) {
                LOG.debug("sitemap probe {} failed: {}", u, e.getMessage());
                continue;
            }
            Map<String, Object> info = describeSitemap(u, path, r);
            if (info != null) found.add(info);
        }
        return found;
    }

    /** 200 + 사이트맵다운 본문일 때만. xml은 urlset/sitemapindex 루트 필요 */
    static Map<String, Object> describeSitemap(URI url, String path, HttpResponseData r) {
        if (r.getStatusCode() != 200) return null;
        String body = r.bodyText();
        if (body.isBlank()) return null;
        boolean xml = path.endsWith(".xml");
        if (xml && !(body.contains("<urlset") || body.contains("<sitemapindex"))) return null;
        if (!xml && r.isHtml()) return null;

        Map<String, Object> info = new LinkedHashMap<>();
        info.put("url", url.toString());
        info.put("size", r.getBodySize());
        info.put("type", xml ? "xml" : "txt");
        if (xml) {
            info.put("url_count", count(body, "<url>"));
            info.put("sitemap_count", count(body, "<sitemap>"));
        }
        return info;
    }

    private static int count(String hay, String needle) {
        int n = 0;
        for (int i = hay.indexOf(needle); i >= 0; i = hay.indexOf(needle, i + needle.length())) n++;
        return n;
    }
}
