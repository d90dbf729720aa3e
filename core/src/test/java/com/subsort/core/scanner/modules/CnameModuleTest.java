package com.subsort.core.scanner.modules;

import com.subsort.core.model.Host;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.scanner.ModuleException;
import com.subsort.core.support.FakeTransport;
import com.subsort.core.support.Responses;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class CnameModuleTest {

    /** 이름 → 응답 고정 테이블. 없으면 NO_CNAME */
    static final class FakeResolver implements CnameResolver {
        final Map<String, Answer> answers = new HashMap<>();
        final Map<String, List<String>> addresses = new HashMap<>();

        FakeResolver cname(String from, String to) { answers.put(from, Answer.cname(to)); return this; }
        FakeResolver status(String name, Status s) { answers.put(name, Answer.of(s)); return this; }
        FakeResolver a(String name, String... ips) { addresses.put(name, List.of(ips)); return this; }

        @Override public Answer cname(String name, Duration timeout) {
            return answers.getOrDefault(name, Answer.of(Status.NO_CNAME));
        }

        @Override public List<String> addresses(String name, Duration timeout) {
            return addresses.getOrDefault(name, List.of());
        }
    }

    private static PartialRecord analyze(String host, FakeResolver r) throws Exception {
        Host h = Host.of(host, "https");
        ModuleContext ctx = new ModuleContext(h, ScanConfig.defaults(), new FakeTransport());
        return new CnameModule(r).analyze(Responses.status(URI.create("https://" + host + "/"), 200), ctx);
    }

    @Test
    @SuppressWarnings("unchecked")
    void dangling_heroku_target_is_high_risk() throws Exception {
        FakeResolver r = new FakeResolver()
                .cname("shop.example.com", "Shop-Example.herokuapp.com")
                .status("Shop-Example.herokuapp.com", CnameResolver.Status.NXDOMAIN);

        PartialRecord pr = analyze("shop.example.com", r);

        List<Map<String, Object>> chain = (List<Map<String, Object>>) pr.get("cname_records");
        assertThat(chain).hasSize(1);
        assertThat(chain.get(0))
                .containsEntry("domain", "shop.example.com")
                .containsEntry("cname", "shop-example.herokuapp.com")
                .containsEntry("depth", 0)
                .containsEntry("nxdomain", true);
        assertEquals("Heroku", pr.get("cname_takeover_service"));
        assertEquals(true, pr.get("cname_takeover_possible"));
        assertEquals("high", pr.get("cname_risk_level"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void resolving_service_target_is_medium_risk() throws Exception {
        FakeResolver r = new FakeResolver()
                .cname("docs.example.com", "example.github.io")
                .a("example.github.io", "185.199.108.153");

        PartialRecord pr = analyze("docs.example.com", r);

        List<Map<String, Object>> chain = (List<Map<String, Object>>) pr.get("cname_records");
        assertThat(chain.get(0).get("resolved_ips")).isEqualTo(List.of("185.199.108.153"));
        assertEquals("GitHub Pages", pr.get("cname_takeover_service"));
        assertEquals(false, pr.get("cname_takeover_possible"));
        assertEquals("medium", pr.get("cname_risk_level"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void no_cname_is_low_risk() throws Exception {
        PartialRecord pr = analyze("www.example.com", new FakeResolver());

        assertThat((List<Object>) pr.get("cname_records")).isEmpty();
        assertNull(pr.get("cname_takeover_service"));
        assertEquals("low", pr.get("cname_risk_level"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void cname_loop_stops_at_max_depth() throws Exception {
        FakeResolver r = new FakeResolver()
                .cname("a.example.com", "b.example.com")
                .cname("b.example.com", "a.example.com");

        PartialRecord pr = analyze("a.example.com", r);

        assertThat((List<Object>) pr.get("cname_records")).hasSize(CnameModule.MAX_DEPTH);
    }

    @Test
    void exhausted_budget_is_a_module_failure() {
        Host h = Host.of("a.example.com", "https");
        ModuleContext ctx = new ModuleContext(h, ScanConfig.defaults(), new FakeTransport(), null, Duration.ZERO);

        assertThatThrownBy(() -> new CnameModule(new FakeResolver())
                .analyze(Responses.status(h.getUrl(), 200), ctx))
                .isInstanceOf(ModuleException.class);
    }
}
