package com.subsort.core.scanner.modules;

import com.subsort.core.model.Host;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.support.FakeTransport;
import org.junit.jupiter.api.Test;

import java.net.URI;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class StatusModuleTest {

    private static final URI URL = URI.create("https://app.example.com/");

    private final ModuleContext ctx =
            new ModuleContext(Host.of("app.example.com", "https"), ScanConfig.defaults(), new FakeTransport());

    @Test
    void ok_response_is_accessible_success_over_https() {
        HttpResponseData resp = HttpResponseData.builder().url(URL).statusCode(200).body("hello").build();

        PartialRecord pr = new StatusModule().analyze(resp, ctx);

        assertThat(pr.get("status_code")).isEqualTo(200);
        assertThat(pr.get("status_category")).isEqualTo("success");
        assertThat(pr.get("accessible")).isEqualTo(true);
        assertThat(pr.get("scheme")).isEqualTo("https");
        assertThat(pr.get("ssl_enabled")).isEqualTo(true);
        assertThat(pr.get("final_url")).isEqualTo("https://app.example.com/");
        assertThat(pr.get("response_size")).isEqualTo(5);
    }

    @Test
    void scheme_comes_from_final_url_after_redirect() {
        HttpResponseData resp = HttpResponseData.builder()
                .url(URL)
                .finalUrl(URI.create("http://app.example.com/home"))
                .statusCode(200)
                .redirectCount(1)
                .build();

        PartialRecord pr = new StatusModule().analyze(resp, ctx);

        assertThat(pr.get("scheme")).isEqualTo("http");
        assertThat(pr.get("ssl_enabled")).isEqualTo(false);
        assertThat(pr.get("final_url")).isEqualTo("http://app.example.com/home");
    }

    @Test
    void client_error_is_not_accessible() {
        HttpResponseData resp = HttpResponseData.builder().url(URL).statusCode(404).build();

        PartialRecord pr = new StatusModule().analyze(resp, ctx);

        assertThat(pr.get("accessible")).isEqualTo(false);
        assertThat(pr.get("status_category")).isEqualTo("client_error");
    }

    @Test
    void categories() {
        assertEquals("success", StatusModule.category(204));
        assertEquals("redirect", StatusModule.category(301));
        assertEquals("client_error", StatusModule.category(403));
        assertEquals("server_error", StatusModule.category(503));
        assertEquals("unknown", StatusModule.category(101));
    }

    @Test
    void every_declared_field_is_emitted() {
        HttpResponseData resp = HttpResponseData.builder().url(URL).statusCode(200).build();
        StatusModule m = new StatusModule();
        assertThat(m.analyze(resp, ctx).fields().keySet()).containsExactlyElementsOf(m.fields());
    }
}
