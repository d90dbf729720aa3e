package com.subsort.core.scanner.modules;

import com.subsort.core.http.TransportException;
import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.Host;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.support.FakeTransport;
import com.subsort.core.support.Responses;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class LoginPanelsModuleTest {

    private static final URI URL = URI.create("https://app.example.com/");
    private static final Host HOST = Host.of("app.example.com", "https");

    private static final String ADMIN_LOGIN = "<html><head><title>Admin Login</title></head><body>"
            + "<p>Please log in with your username</p>"
            + "<form method=post><input type=text name=username><input type=password name=password></form>"
            + "</body></html>";

    @Test
    @SuppressWarnings("unchecked")
    void finds_form_panel_and_basic_auth_panel() throws Exception {
        FakeTransport t = new FakeTransport()
                .html("/admin", 200, ADMIN_LOGIN)
                .on("/dashboard", (u, o) -> HttpResponseData.builder()
                        .url(u).statusCode(401)
                        .header("Content-Type", "text/html")
                        .header("WWW-Authenticate", "Basic realm=\"x\"")
                        .body("<html><head><title>401</title></head><body>auth required</body></html>")
                        .build())
                .on("/login", (u, o) -> { throw new TransportException(ErrorKind.TIMEOUT, "slow"); });
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        PartialRecord pr = new LoginPanelsModule().analyze(Responses.html(URL, 200, "<p>Welcome</p>"), ctx);

        List<Map<String, Object>> panels = (List<Map<String, Object>>) pr.get("login_panels");
        assertThat(panels).hasSize(2);
        assertThat(panels.get(0))
                .containsEntry("url", "https://app.example.com/admin")
                .containsEntry("type", "Login Page")
                .containsEntry("form_count", 1)
                .containsEntry("requires_auth", false);
        assertThat(panels.get(1))
                .containsEntry("type", "HTTP Basic Auth")
                .containsEntry("requires_auth", true);
        assertThat((List<String>) pr.get("admin_paths_found")).containsExactly("/admin", "/dashboard");
        assertThat((List<String>) pr.get("panel_types")).containsExactly("Login Page", "HTTP Basic Auth");
        assertEquals(LoginPanelsModule.ADMIN_PATHS.size(), t.calls().size());
    }

    @Test
    @SuppressWarnings("unchecked")
    void main_page_login_is_reported_once() throws Exception {
        FakeTransport t = new FakeTransport();
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        PartialRecord pr = new LoginPanelsModule().analyze(Responses.html(URL, 200, ADMIN_LOGIN), ctx);

        List<Map<String, Object>> panels = (List<Map<String, Object>>) pr.get("login_panels");
        assertThat(panels).hasSize(1);
        assertThat(panels.get(0)).containsEntry("path", "/");
        assertThat((List<String>) pr.get("admin_paths_found")).isEmpty();
    }

    @Test
    @SuppressWarnings("unchecked")
    void exhausted_budget_stops_probing() throws Exception {
        FakeTransport t = new FakeTransport().html("/admin", 200, ADMIN_LOGIN);
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t, null, Duration.ZERO);

        PartialRecord pr = new LoginPanelsModule().analyze(Responses.html(URL, 200, "<p>Welcome</p>"), ctx);

        assertThat((List<Object>) pr.get("login_panels")).isEmpty();
        assertThat(t.calls()).isEmpty();
    }

    @Test
    void panel_type_classification() {
        assertEquals("WordPress Admin", LoginPanelsModule.panelType("log in", "", "https://a/wp-login.php"));
        assertEquals("Admin Panel", LoginPanelsModule.panelType("welcome", "administrator area", "https://a/x"));
        assertEquals("Database Admin", LoginPanelsModule.panelType("phpmyadmin", "", "https://a/pma"));
        assertEquals("Unknown Panel", LoginPanelsModule.panelType("portal", "", "https://a/p"));
    }
}
