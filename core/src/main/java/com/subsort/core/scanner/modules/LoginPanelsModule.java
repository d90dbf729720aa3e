package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.HtmlSupport;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.scanner.ModuleException;
import org.jsoup.nodes.Document;
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

/**
 * 로그인/관리 패널 탐지: 메인 페이지 + 흔한 관리 경로 탐침.
 * 예산이 바닥나면 그때까지 찾은 것만 보고한다.
 */
public final class LoginPanelsModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(LoginPanelsModule.class);

    public static final String NAME = "loginpanels";

    private static final List<String> FIELDS = List.of("login_panels", "admin_paths_found", "panel_types");

    static final List<String> ADMIN_PATHS = List.of(
            "/admin", "/admin/", "/admin/login", "/admin/login.php", "/wp-admin", "/wp-login.php",
            "/administrator", "/login", "/login.php", "/signin", "/auth", "/panel", "/cpanel",
            "/control", "/dashboard");

    static final List<String> LOGIN_INDICATORS = List.of(
            "login", "signin", "sign in", "log in", "authentication", "admin panel",
            "administrator", "control panel", "dashboard", "password", "username", "email");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws InterruptedException {
        List<Map<String, Object>> panels = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();
        List<String> paths = new ArrayList<>();

        if (resp.getStatusCode() == 200) {
            Map<String, Object> main = panel(resp, "/");
            if (main != null && seenUrls.add(String.valueOf(main.get("url")))) panels.add(main);
        }

        for (String path : ADMIN_PATHS) {
            URI u = ctx.resolve(path);
            HttpResponseData r;
            try {
                r = ctx.fetch(u);
            } catch (TransportException e) {
                LOG.debug("admin probe {} failed: {}", u, e.getMessage());
                continue;
            } catch (ModuleException e) {
                LOG.debug("loginpanels budget exhausted at {} for {}", path, ctx.host().getRaw());
                break;
            }
            int sc = r.getStatusCode();
            if (sc != 200 && sc != 401 && sc != 403) continue;

            Map<String, Object> p = panel(r, path);
            if (p == null && sc == 401) p = basicAuthPanel(r, path);
            if (p != null && seenUrls.add(String.valueOf(p.get("url")))) {
                panels.add(p);
                paths.add(path);
            }
        }

        Set<String> types = new LinkedHashSet<>();
        for (Map<String, Object> p : panels) types.add(String.valueOf(p.get("type")));

        return PartialRecord.of(NAME)
                .put("login_panels", panels)
                .put("admin_paths_found", paths)
                .put("panel_types", List.copyOf(types));
    }

    /** 로그인 폼이 있거나 제목이 로그인류일 때만 패널로 본다 */
    static Map<String, Object> panel(HttpResponseData r, String path) {
        if (!r.isHtml()) return null;
        Document doc = HtmlSupport.parse(r);
        String title = HtmlSupport.title(doc);
        String titleLower = title == null ? "" : title.toLowerCase(Locale.ROOT);
        String text = doc.text().toLowerCase(Locale.ROOT);
        if (LOGIN_INDICATORS.stream().noneMatch(text::contains)) return null;

        int forms = HtmlSupport.countLoginForms(doc);
        boolean titleSaysLogin = LOGIN_INDICATORS.stream().anyMatch(titleLower::contains);
        if (forms == 0 && !titleSaysLogin) return null;

        String url = r.getFinalUrl().toString();
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("url", url);
        p.put("type", panelType(titleLower, text, url.toLowerCase(Locale.ROOT)));
        p.put("title", title);
        p.put("path", path);
        p.put("status_code", r.getStatusCode());
        p.put("form_count", forms);
        p.put("requires_auth", r.getStatusCode() == 401);
        return p;
    }

    private static Map<String, Object> basicAuthPanel(HttpResponseData r, String path) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("url", r.getFinalUrl().toString());
        p.put("type", "HTTP Basic Auth");
        p.put("title", "Authentication Required");
        p.put("path", path);
        p.put("status_code", 401);
        p.put("form_count", 0);
        p.put("requires_auth", true);
        return p;
    }

    static String panelType(String title, String text, String url) {
        if (containsAny(title, "wordpress", "wp-admin", "wp-login") || containsAny(url, "wp-admin", "wp-login")) {
            return "WordPress Admin";
        }
        if (containsAny(title, "admin panel", "administrator", "control panel")
                || containsAny(text, "admin panel", "administrator", "control panel")) {
            return "Admin Panel";
        }
        if (containsAny(title, "cpanel", "whm", "webhost") || containsAny(url, "cpanel", "whm")) {
            return "Hosting Panel";
        }
        if (containsAny(title, "phpmyadmin", "adminer", "database")) return "Database Admin";
        if (containsAny(title, "login", "sign in", "authentication")) return "Login Page";
        return "Unknown Panel";
    }

    private static boolean containsAny(String s, String... needles) {
        for (String n : needles) if (s.contains(n)) return true;
        return false;
    }
}
