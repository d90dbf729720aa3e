package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;
import org.jsoup.nodes.Document;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** 제목/설명/콘텐츠 메타 + 프레임워크 시그니처(본문/헤더 마커) */
public final class TitleModule implements IAnalysisModule {

    public static final String NAME = "title";

    private static final List<String> FIELDS = List.of(
            "title", "has_title", "description", "content_type", "content_length", "framework_signatures");

    // 이름 → 본문/헤더(소문자)에서 찾을 마커
    private static final Map<String, List<String>> SIGNATURES = new LinkedHashMap<>();
    static {
        SIGNATURES.put("WordPress", List.of("wp-content/", "wp-includes/"));
        SIGNATURES.put("Drupal", List.of("drupal.settings", "x-drupal-cache", "/sites/default/files"));
        SIGNATURES.put("Joomla", List.of("/media/jui/", "joomla!"));
        SIGNATURES.put("Django", List.of("csrfmiddlewaretoken", "__admin_media_prefix__"));
        SIGNATURES.put("Laravel", List.of("laravel_session"));
        SIGNATURES.put("Ruby on Rails", List.of("csrf-param", "x-runtime"));
        SIGNATURES.put("ASP.NET", List.of("__viewstate", "x-aspnet-version", "asp.net"));
        SIGNATURES.put("Next.js", List.of("__next_data__", "/_next/"));
        SIGNATURES.put("Nuxt", List.of("__nuxt", "/_nuxt/"));
        SIGNATURES.put("Angular", List.of("ng-version"));
        SIGNATURES.put("React", List.of("data-reactroot", "react-dom"));
        SIGNATURES.put("Vue.js", List.of("data-v-", "vue.runtime"));
        SIGNATURES.put("Spring", List.of("jsessionid", "whitelabel error page"));
        SIGNATURES.put("Express", List.of("x-powered-by: express"));
        SIGNATURES.put("PHP", List.of("phpsessid", "x-powered-by: php"));
    }

    @Override public String name() { return NAME; }
    @Override public int priority() { return 20; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        PartialRecord pr = PartialRecord.of(NAME)
                .put("content_type", resp.getContentType())
                .put("content_length", resp.getBodySize())
                .put("framework_signatures", signatures(resp));
        if (!resp.isHtml()) {
            return pr.put("title", null).put("has_title", false).put("description", null);
        }
        Document doc = HtmlSupport.parse(resp);
        String title = HtmlSupport.title(doc);
        return pr.put("title", title)
                .put("has_title", title != null && !title.isEmpty())
                .put("description", HtmlSupport.description(doc));
    }

    static List<String> signatures(HttpResponseData resp) {
        StringBuilder hay = new StringBuilder();
        resp.getHeaders().forEach((k, vs) -> vs.forEach(v -> hay.append(k).append(": ").append(v).append('\n')));
        hay.append(resp.bodyText());
        String text = hay.toString().toLowerCase(Locale.ROOT);

        List<String> found = new ArrayList<>();
        SIGNATURES.forEach((name, markers) -> {
            for (String m : markers) {
                if (text.contains(m)) { found.add(name); break; }
            }
        });
        return found;
    }
}
