package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 알려진 취약 버전(major.minor 일치) 대조: jQuery ≤ 2.1, AngularJS 1.0~1.5, Bootstrap 2.0~3.2.
 * risk = min(취약점 수 × 10, 100)
 */
public final class JsVulnModule implements IAnalysisModule {

    public static final String NAME = "jsvuln";

    private static final List<String> FIELDS = List.of(
            "vulnerable_libraries", "js_vulnerability_count", "js_risk_score");

    private record Advisory(List<String> versions, List<String> vulnerabilities) {}

    private static final Map<String, Advisory> ADVISORIES = Map.of(
            "jquery", new Advisory(
                    List.of("1.0", "1.1", "1.2", "1.3", "1.4", "1.5", "1.6", "1.7", "1.8", "1.9", "2.0", "2.1"),
                    List.of("XSS", "DOM manipulation")),
            "angular", new Advisory(
                    List.of("1.0", "1.1", "1.2", "1.3", "1.4", "1.5"),
                    List.of("XSS", "Template injection")),
            "bootstrap", new Advisory(
                    List.of("2.0", "2.1", "2.2", "2.3", "3.0", "3.1", "3.2"),
                    List.of("XSS in tooltip/popover")));

    private static final Pattern INLINE_JQUERY = Pattern.compile("jQuery\\s*v?(\\d+\\.\\d+(?:\\.\\d+){0,4})");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        List<Map<String, Object>> found = new ArrayList<>();
        if (resp.isHtml()) {
            for (Element s : HtmlSupport.parse(resp).select("script")) {
                if (s.hasAttr("src") && !s.attr("src").isBlank()) {
                    String abs = s.absUrl("src");
                    JsLibraries.Lib lib = JsLibraries.identify(abs.isEmpty() ? s.attr("src") : abs);
                    if (lib != null) addIfVulnerable(found, lib.library(), lib.version(), lib.url());
                } else {
                    Matcher m = INLINE_JQUERY.matcher(s.data());
                    if (m.find()) addIfVulnerable(found, "jquery", m.group(1), "inline");
                }
            }
        }
        int count = 0;
        for (Map<String, Object> f : found) count += ((List<?>) f.get("vulnerabilities")).size();

        return PartialRecord.of(NAME)
                .put("vulnerable_libraries", found)
                .put("js_vulnerability_count", count)
                .put("js_risk_score", Math.min(count * 10, 100));
    }

    private static void addIfVulnerable(List<Map<String, Object>> out, String lib, String version, String url) {
        Advisory a = ADVISORIES.get(lib);
        if (a == null || !isVulnerable(a.versions(), version)) return;
        Map<String, Object> v = new LinkedHashMap<>();
        v.put("library", lib);
        v.put("version", version);
        v.put("url", url);
        v.put("vulnerabilities", a.vulnerabilities());
        v.put("severity", a.vulnerabilities().size() > 1 ? "high" : "medium");
        out.add(v);
    }

    /** "1.8.3" → "1.8" 로 잘라 목록과 정확히 비교("1.10"은 "1.1"이 아님) */
    static boolean isVulnerable(List<String> versions, String version) {
        if (version == null) return false;
        String[] parts = version.split("\\.");
        if (parts.length < 2) return false;
        return versions.contains(parts[0] + "." + parts[1]);
    }
}
