package com.subsort.core.scanner.modules;

import com.google.common.hash.Hashing;
import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 파비콘 지문. hash = Shodan 방식 murmur3-32(MIME base64, 76열 + 줄마다 개행).
 * 본문 <link rel=icon> 우선, 그다음 흔한 경로.
 */
public final class FaviconModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(FaviconModule.class);

    public static final String NAME = "favicon";

    private static final List<String> FIELDS = List.of(
            "favicon_url", "favicon_size", "favicon_hash", "favicon_md5", "favicon_match");

    static final List<String> COMMON_PATHS = List.of(
            "/favicon.ico", "/favicon.png", "/apple-touch-icon.png",
            "/android-chrome-192x192.png", "/mstile-150x150.png");

    static final Map<Integer, String> KNOWN_HASHES = Map.ofEntries(
            Map.entry(-1588080585, "Apache HTTP Server"),
            Map.entry(1404073852, "nginx"),
            Map.entry(708578229, "Microsoft IIS"),
            Map.entry(-235893395, "WordPress"),
            Map.entry(1942532096, "Django"),
            Map.entry(-343656283, "Flask"),
            Map.entry(81166609, "Amazon S3"),
            Map.entry(-1152842768, "Google Cloud"),
            Map.entry(1379923932, "Microsoft Azure"),
            Map.entry(-1194133913, "Cloudflare"),
            Map.entry(1011053026, "Drupal"),
            Map.entry(-1506969290, "Joomla"),
            Map.entry(1335392324, "Magento"),
            Map.entry(-1278104634, "Shopify"),
            Map.entry(566218143, "Splunk"),
            Map.entry(-1025300011, "Kibana"),
            Map.entry(394490493, "Grafana"),
            Map.entry(-1347968860, "pfSense"));

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws Exception {
        for (URI candidate : candidates(resp, ctx)) {
            HttpResponseData r;
            try {
                r = ctx.fetch(candidate);
            } catch (TransportException e) {
                LOG.debug("favicon probe {} failed: {}", candidate, e.getMessage());
                continue;
            }
            if (r.getStatusCode() != 200 || r.getBodySize() == 0 || r.isHtml()) continue;

            byte[] data = r.getBody();
            int hash = shodanHash(data);
            return PartialRecord.of(NAME)
                    .put("favicon_url", candidate.toString())
                    .put("favicon_size", data.length)
                    .put("favicon_hash", hash)
                    .put("favicon_md5", md5Hex(data))
                    .put("favicon_match", KNOWN_HASHES.get(hash));
        }
        return PartialRecord.of(NAME)
                .put("favicon_url", null)
                .put("favicon_size", null)
                .put("favicon_hash", null)
                .put("favicon_md5", null)
                .put("favicon_match", null);
    }

    static List<URI> candidates(HttpResponseData resp, ModuleContext ctx) {
        Set<URI> out = new LinkedHashSet<>();
        if (resp.isHtml()) {
            Document doc = HtmlSupport.parse(resp);
            for (Element link : doc.select("link[rel~=(?i)icon][href]")) {
                String abs = link.absUrl("href");
                if (abs.startsWith("http://") || abs.startsWith("https://")) {
                    try {
                        out.add(URI.create(abs));
                    } catch (IllegalArgumentException e) {
                        LOG.debug("bad icon href {}: {}", abs, e.getMessage());
                    }
                }
            }
        }
        for (String p : COMMON_PATHS) out.add(ctx.resolve(p));
        return new ArrayList<>(out);
    }

    /** mmh3(base64.encodebytes(data)) 과 동일: 76열 MIME 인코딩, 마지막 줄도 개행 */
    static int shodanHash(byte[] data) {
        String b64 = Base64.getMimeEncoder(76, new byte[]{'\n'}).encodeToString(data) + "\n";
        return Hashing.murmur3_32_fixed().hashBytes(b64.getBytes(StandardCharsets.US_ASCII)).asInt();
    }

    @SuppressWarnings("deprecation") // 식별용 지문(보안 용도 아님)
    static String md5Hex(byte[] data) {
        return Hashing.md5().hashBytes(data).toString();
    }
}
