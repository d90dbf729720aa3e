package com.subsort.core.scanner.modules;

import com.subsort.core.http.TransportException;
import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.Host;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.support.FakeTransport;
import com.subsort.core.support.Responses;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class VhostModuleTest {

    private static final URI URL = URI.create("https://app.example.com/");
    private static final Host HOST = Host.of("app.example.com", "https");
    private static final String MAIN = "<html><head><title>Main Site</title></head><body>hello</body></html>";

    @Test
    @SuppressWarnings("unchecked")
    void alternative_host_header_with_different_title_is_reported() throws Exception {
        FakeTransport t = new FakeTransport().on("/", (u, o) -> {
            String h = o.getHeaders().get("Host");
            if ("test.local".equals(h)) {
                return Responses.html(u, 200, "<html><head><title>Staging</title></head><body>hello</body></html>");
            }
            return Responses.html(u, 200, MAIN);
        });
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        PartialRecord pr = new VhostModule().analyze(Responses.html(URL, 200, MAIN), ctx);

        assertEquals(true, pr.get("is_vhost"));
        List<Map<String, Object>> alts = (List<Map<String, Object>>) pr.get("vhost_alternatives");
        assertThat(alts).hasSize(1);
        assertThat(alts.get(0)).containsEntry("host", "test.local").containsEntry("title", "Staging");
        // 기준 1회 + 대체 호스트 4회, 모두 리다이렉트 미추적
        assertThat(t.options()).hasSize(5).allMatch(o -> Boolean.FALSE.equals(o.getFollowRedirects()));
    }

    @Test
    void identical_answers_are_not_a_vhost() throws Exception {
        FakeTransport t = new FakeTransport().html("/", 200, MAIN);
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        PartialRecord pr = new VhostModule().analyze(Responses.html(URL, 200, MAIN), ctx);

        assertEquals(false, pr.get("is_vhost"));
    }

    @Test
    void baseline_failure_fails_the_module() {
        FakeTransport t = new FakeTransport()
                .on("/", (u, o) -> { throw new TransportException(ErrorKind.TIMEOUT, "slow"); });
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        assertThatThrownBy(() -> new VhostModule().analyze(Responses.html(URL, 200, MAIN), ctx))
                .isInstanceOf(TransportException.class);
    }

    @Test
    void probe_hosts_and_body_indicators() {
        assertThat(VhostModule.testHosts("api.example.com")).contains("api-example-com.test", "example.com");
        assertThat(VhostModule.indicators("Welcome to our shared hosting platform"))
                .containsExactly("shared hosting");
        assertThat(VhostModule.indicators("a.com b.org c.net d.io"))
                .containsExactly("multiple_domains_in_content");
    }
}
