package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;

import java.util.List;

/** 상태 코드/분류/접근성. 순수 계산(추가 왕복 없음) */
public final class StatusModule implements IAnalysisModule {

    public static final String NAME = "status";

    private static final List<String> FIELDS = List.of(
            "status_code", "status_category", "accessible", "scheme",
            "ssl_enabled", "final_url", "response_size");

    @Override public String name() { return NAME; }
    @Override public int priority() { return 0; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        int sc = resp.getStatusCode();
        String scheme = resp.getScheme();
        return PartialRecord.of(NAME)
                .put("status_code", sc)
                .put("status_category", category(sc))
                .put("accessible", sc < 400)
                .put("scheme", scheme)
                .put("ssl_enabled", "https".equalsIgnoreCase(scheme))
                .put("final_url", resp.getFinalUrl().toString())
                .put("response_size", resp.getBodySize());
    }

    static String category(int sc) {
        if (sc >= 200 && sc < 300) return "success";
        if (sc >= 300 && sc < 400) return "redirect";
        if (sc >= 400 && sc < 500) return "client_error";
        if (sc >= 500 && sc < 600) return "server_error";
        return "unknown";
    }
}
