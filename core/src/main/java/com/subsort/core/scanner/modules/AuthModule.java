package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** 패시브: 인증 신호(401, 인증 헤더, 로그인 폼, OAuth/SSO 마커) */
public final class AuthModule implements IAnalysisModule {

    public static final String NAME = "auth";

    private static final List<String> FIELDS = List.of(
            "has_auth", "auth_types", "login_forms", "auth_headers", "requires_auth");

    static final Map<String, String> AUTH_HEADERS = new LinkedHashMap<>();
    static {
        AUTH_HEADERS.put("www-authenticate", "HTTP Basic/Digest");
        AUTH_HEADERS.put("authorization", "Bearer/API Key");
        AUTH_HEADERS.put("x-auth-token", "Token Authentication");
        AUTH_HEADERS.put("set-cookie", "Session Authentication");
    }

    private static final List<Pattern> SSO = List.of(
            Pattern.compile("\\boauth2?\\b"),
            Pattern.compile("\\bsaml\\b"),
            Pattern.compile("\\bsso\\b"),
            Pattern.compile("(sign|log) ?in with (google|facebook|microsoft)"),
            Pattern.compile("accounts\\.google\\.com/o/oauth2|login\\.microsoftonline\\.com"));

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        Set<String> types = new LinkedHashSet<>();
        List<String> headers = new ArrayList<>();
        boolean requiresAuth = resp.getStatusCode() == 401;

        AUTH_HEADERS.forEach((h, type) -> {
            if (resp.header(h) != null) {
                headers.add(h);
                types.add(type);
            }
        });

        int forms = 0;
        if (resp.isHtml()) {
            forms = HtmlSupport.countLoginForms(HtmlSupport.parse(resp));
            if (forms > 0) types.add("Form Authentication");
            String lower = resp.bodyText().toLowerCase(Locale.ROOT);
            if (SSO.stream().anyMatch(p -> p.matcher(lower).find())) types.add("OAuth/SSO");
        }

        return PartialRecord.of(NAME)
                .put("has_auth", requiresAuth || !types.isEmpty())
                .put("auth_types", List.copyOf(types))
                .put("login_forms", forms)
                .put("auth_headers", headers)
                .put("requires_auth", requiresAuth);
    }
}
