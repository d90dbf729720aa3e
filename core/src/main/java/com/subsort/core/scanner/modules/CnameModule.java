package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.scanner.ModuleException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * CNAME 체인(최대 깊이 10) + 서브도메인 탈취 가능성.
 * 취약 서비스 대상이면 medium, 그 대상이 NXDOMAIN/해석 실패면 high.
 */
public final class CnameModule implements IAnalysisModule {

    public static final String NAME = "cname";
    static final int MAX_DEPTH = 10;

    private static final List<String> FIELDS = List.of(
            "cname_records", "cname_takeover_service", "cname_takeover_possible", "cname_risk_level");

    static final Map<String, String> VULNERABLE_SERVICES = new LinkedHashMap<>();
    static {
        VULNERABLE_SERVICES.put("amazonaws.com", "AWS S3/ELB");
        VULNERABLE_SERVICES.put("cloudfront.net", "AWS CloudFront");
        VULNERABLE_SERVICES.put("azurewebsites.net", "Azure Websites");
        VULNERABLE_SERVICES.put("herokuapp.com", "Heroku");
        VULNERABLE_SERVICES.put("github.io", "GitHub Pages");
        VULNERABLE_SERVICES.put("netlify.com", "Netlify");
        VULNERABLE_SERVICES.put("vercel.app", "Vercel");
        VULNERABLE_SERVICES.put("surge.sh", "Surge.sh");
        VULNERABLE_SERVICES.put("bitbucket.io", "Bitbucket");
        VULNERABLE_SERVICES.put("fastly.com", "Fastly CDN");
        VULNERABLE_SERVICES.put("cloudflare.net", "Cloudflare");
        VULNERABLE_SERVICES.put("unbounce.com", "Unbounce");
        VULNERABLE_SERVICES.put("helpjuice.com", "HelpJuice");
        VULNERABLE_SERVICES.put("desk.com", "Salesforce Desk");
        VULNERABLE_SERVICES.put("teamwork.com", "Teamwork");
        VULNERABLE_SERVICES.put("zendesk.com", "Zendesk");
    }

    private final CnameResolver resolver;

    public CnameModule() { this(new DnsjavaCnameResolver()); }

    CnameModule(CnameResolver resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
    }

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws ModuleException {
        List<Map<String, Object>> chain = resolveChain(ctx.host().getHostname(), ctx);
        Takeover t = assessTakeover(chain);
        return PartialRecord.of(NAME)
                .put("cname_records", chain)
                .put("cname_takeover_service", t.service())
                .put("cname_takeover_possible", t.possible())
                .put("cname_risk_level", t.risk());
    }

    List<Map<String, Object>> resolveChain(String hostname, ModuleContext ctx) throws ModuleException {
        List<Map<String, Object>> chain = new ArrayList<>();
        String current = hostname;
        for (int depth = 0; depth < MAX_DEPTH; depth++) {
            if (ctx.expired()) throw new ModuleException("module budget exhausted resolving " + current);
            Duration t = perQuery(ctx);
            CnameResolver.Answer a = resolver.cname(current, t);
            Map<String, Object> last = chain.isEmpty() ? null : chain.get(chain.size() - 1);
            switch (a.status()) {
                case CNAME -> {
                    Map<String, Object> rec = new LinkedHashMap<>();
                    rec.put("domain", current);
                    rec.put("cname", a.target().toLowerCase(Locale.ROOT));
                    rec.put("depth", depth);
                    chain.add(rec);
                    current = a.target();
                    continue;
                }
                case NXDOMAIN -> { if (last != null) last.put("nxdomain", true); }
                case NO_CNAME -> {
                    if (last != null) {
                        List<String> ips = resolver.addresses(current, t);
                        if (ips.isEmpty()) last.put("resolution_failed", true);
                        else last.put("resolved_ips", ips);
                    }
                }
                case ERROR -> { if (last != null) last.put("resolution_failed", true); }
            }
            break;
        }
        return chain;
    }

    private static Duration perQuery(ModuleContext ctx) {
        Duration timeout = ctx.config().getTimeout();
        Duration left = ctx.remaining();
        return timeout.compareTo(left) < 0 ? timeout : left;
    }

    record Takeover(String service, boolean possible, String risk) {}

    /** 체인에서 처음 걸리는 취약 서비스 기준으로 판정 */
    static Takeover assessTakeover(List<Map<String, Object>> chain) {
        for (Map<String, Object> rec : chain) {
            String target = String.valueOf(rec.get("cname")).toLowerCase(Locale.ROOT);
            for (Map.Entry<String, String> e : VULNERABLE_SERVICES.entrySet()) {
                if (target.equals(e.getKey()) || target.endsWith("." + e.getKey())) {
                    boolean dangling = Boolean.TRUE.equals(rec.get("nxdomain"))
                            || Boolean.TRUE.equals(rec.get("resolution_failed"));
                    return new Takeover(e.getValue(), dangling, dangling ? "high" : "medium");
                }
            }
        }
        return new Takeover(null, false, "low");
    }
}
