package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** <script> 목록: 외부 파일(절대 URL) / 인라인 개수 / 라이브러리 추정 */
public final class JsModule implements IAnalysisModule {

    public static final String NAME = "js";

    private static final List<String> FIELDS = List.of(
            "js_files", "inline_js_count", "external_js_count", "js_libraries");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        List<Map<String, Object>> files = new ArrayList<>();
        List<Map<String, Object>> libs = new ArrayList<>();
        int inline = 0;

        if (resp.isHtml()) {
            Document doc = HtmlSupport.parse(resp);
            for (Element s : doc.select("script")) {
                if (s.hasAttr("src") && !s.attr("src").isBlank()) {
                    String abs = s.absUrl("src");
                    String url = abs.isEmpty() ? s.attr("src").trim() : abs;
                    Map<String, Object> f = new LinkedHashMap<>();
                    f.put("url", url);
                    f.put("async", s.hasAttr("async"));
                    f.put("defer", s.hasAttr("defer"));
                    files.add(f);

                    JsLibraries.Lib lib = JsLibraries.identify(url);
                    if (lib != null) {
                        Map<String, Object> l = new LinkedHashMap<>();
                        l.put("library", lib.library());
                        l.put("version", lib.version());
                        l.put("url", lib.url());
                        libs.add(l);
                    }
                } else if (!s.data().isBlank()) {
                    inline++;
                }
            }
        }

        return PartialRecord.of(NAME)
                .put("js_files", files)
                .put("inline_js_count", inline)
                .put("external_js_count", files.size())
                .put("js_libraries", libs);
    }
}
