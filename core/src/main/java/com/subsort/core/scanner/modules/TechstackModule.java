package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 기술 스택 추정: "헤더 텍스트 + 본문"에 대한 대소문자 무시 정규식 시그니처.
 * 카테고리 단일값(web_server 등)은 탐지 순서상 첫 항목.
 */
public final class TechstackModule implements IAnalysisModule {

    public static final String NAME = "techstack";

    private static final List<String> FIELDS = List.of(
            "technologies", "web_server", "programming_language", "web_framework",
            "cms", "cdn", "security_products", "analytics", "frontend");

    private static final Map<String, List<Pattern>> SIGNATURES = new LinkedHashMap<>();

    private static void sig(String tech, String... regexes) {
        List<Pattern> ps = new ArrayList<>();
        for (String r : regexes) ps.add(Pattern.compile(r, Pattern.CASE_INSENSITIVE));
        SIGNATURES.put(tech, ps);
    }

    static {
        // web servers
        sig("apache", "apache(?!-coyote)");
        sig("nginx", "nginx");
        sig("iis", "microsoft-iis");
        sig("tomcat", "apache-coyote", "tomcat");
        sig("jetty", "jetty");
        sig("lighttpd", "lighttpd");
        // languages / frameworks
        sig("php", "x-powered-by:[^\\n]*php", "phpsessid");
        sig("nodejs", "x-powered-by:[^\\n]*express", "node\\.js");
        sig("aspnet", "x-aspnet-version", "x-powered-by:[^\\n]*asp\\.net", "__viewstate");
        sig("django", "django", "csrfmiddlewaretoken");
        sig("flask", "werkzeug", "flask");
        sig("rails", "x-powered-by:[^\\n]*rails", "phusion passenger", "\\brails\\b");
        sig("laravel", "laravel");
        sig("spring", "x-application-context", "whitelabel error page");
        // cms
        sig("wordpress", "wp-content", "wp-includes", "wordpress");
        sig("drupal", "drupal", "x-drupal");
        sig("joomla", "joomla", "/components/com_");
        sig("magento", "magento", "x-magento");
        sig("shopify", "shopify", "myshopify\\.com");
        // cdn / cloud
        sig("cloudflare", "cloudflare", "cf-ray");
        sig("aws", "amazons3", "x-amz-", "amazonaws\\.com");
        sig("azure", "x-azure", "windows\\.net");
        sig("googlecloud", "x-cloud-trace-context", "x-goog-", "googleusercontent\\.com");
        // security
        sig("modsecurity", "mod_security", "modsecurity");
        sig("sucuri", "x-sucuri-id", "sucuri");
        sig("incapsula", "x-iinfo", "incap_ses");
        // analytics
        sig("googleanalytics", "google-analytics", "gtag\\(", "\\bga\\(");
        sig("gtm", "googletagmanager", "GTM-[A-Z0-9]+");
        sig("hotjar", "hotjar\\.com", "hjid");
        // frontend
        sig("react", "react(-dom)?(\\.production)?(\\.min)?\\.js", "data-reactroot", "__REACT_DEVTOOLS");
        sig("angular", "angular(\\.min)?\\.js", "ng-version", "ng-app");
        sig("vue", "vue(\\.runtime)?(\\.min)?\\.js", "__VUE__", "data-v-");
        sig("jquery", "jquery");
        sig("bootstrap", "bootstrap");
    }

    static final List<String> WEB_SERVERS = List.of("apache", "nginx", "iis", "tomcat", "jetty", "lighttpd");
    static final List<String> LANGUAGES = List.of("php", "nodejs", "aspnet");
    static final List<String> FRAMEWORKS = List.of("django", "flask", "rails", "laravel", "spring");
    static final List<String> CMS = List.of("wordpress", "drupal", "joomla", "magento", "shopify");
    static final List<String> CDNS = List.of("cloudflare", "aws", "azure", "googlecloud");
    static final List<String> SECURITY = List.of("modsecurity", "sucuri", "incapsula", "cloudflare");
    static final List<String> ANALYTICS = List.of("googleanalytics", "gtm", "hotjar");
    static final List<String> FRONTEND = List.of("react", "angular", "vue", "jquery", "bootstrap");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        List<String> techs = detect(haystack(resp));
        return PartialRecord.of(NAME)
                .put("technologies", techs)
                .put("web_server", first(techs, WEB_SERVERS))
                .put("programming_language", first(techs, LANGUAGES))
                .put("web_framework", first(techs, FRAMEWORKS))
                .put("cms", first(techs, CMS))
                .put("cdn", first(techs, CDNS))
                .put("security_products", all(techs, SECURITY))
                .put("analytics", all(techs, ANALYTICS))
                .put("frontend", all(techs, FRONTEND));
    }

    static String haystack(HttpResponseData resp) {
        StringBuilder sb = new StringBuilder();
        resp.getHeaders().forEach((k, vs) -> vs.forEach(v -> sb.append(k).append(": ").append(v).append('\n')));
        sb.append('\n').append(resp.bodyText());
        return sb.toString();
    }

    static List<String> detect(String text) {
        List<String> out = new ArrayList<>();
        SIGNATURES.forEach((tech, patterns) -> {
            for (Pattern p : patterns) {
                if (p.matcher(text).find()) { out.add(tech); break; }
            }
        });
        return out;
    }

    private static String first(List<String> techs, List<String> category) {
        for (String t : techs) if (category.contains(t)) return t;
        return null;
    }

    private static List<String> all(List<String> techs, List<String> category) {
        return techs.stream().filter(category::contains).toList();
    }
}
