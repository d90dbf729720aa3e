package com.subsort.core.scanner.modules;

import com.google.common.hash.Hashing;
import com.subsort.core.model.Host;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.support.FakeTransport;
import com.subsort.core.support.Responses;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class FaviconModuleTest {

    private static final URI URL = URI.create("https://app.example.com/");
    private static final Host HOST = Host.of("app.example.com", "https");

    private static byte[] icon(int size) {
        byte[] b = new byte[size];
        for (int i = 0; i < size; i++) b[i] = (byte) (i * 31 + 7);
        return b;
    }

    @Test
    void hash_uses_76_column_base64_with_trailing_newlines() {
        byte[] data = icon(200);
        String flat = Base64.getEncoder().encodeToString(data);
        StringBuilder wrapped = new StringBuilder();
        for (int i = 0; i < flat.length(); i += 76) {
            wrapped.append(flat, i, Math.min(flat.length(), i + 76)).append('\n');
        }
        int expected = Hashing.murmur3_32_fixed()
                .hashBytes(wrapped.toString().getBytes(StandardCharsets.US_ASCII)).asInt();

        assertEquals(expected, FaviconModule.shodanHash(data));
    }

    @Test
    void md5_hex() {
        assertEquals("900150983cd24fb0d6963f7d28e17f72",
                FaviconModule.md5Hex("abc".getBytes(StandardCharsets.US_ASCII)));
    }

    @Test
    void link_icon_wins_over_common_paths() throws Exception {
        byte[] png = icon(64);
        FakeTransport t = new FakeTransport()
                .on("/assets/fav.png", (u, o) -> Responses.bytes(u, "image/png", png))
                .on("/favicon.ico", (u, o) -> Responses.bytes(u, "image/x-icon", icon(10)));
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        PartialRecord pr = new FaviconModule().analyze(Responses.html(URL, 200,
                "<html><head><link rel=\"shortcut icon\" href=\"/assets/fav.png\"></head></html>"), ctx);

        assertThat(pr.get("favicon_url")).isEqualTo("https://app.example.com/assets/fav.png");
        assertThat(pr.get("favicon_size")).isEqualTo(64);
        assertThat(pr.get("favicon_hash")).isEqualTo(FaviconModule.shodanHash(png));
        assertThat(t.callsTo("/favicon.ico")).isZero();
    }

    @Test
    void html_soft_404_is_skipped() throws Exception {
        FakeTransport t = new FakeTransport()
                .html("/favicon.ico", 200, "<html>not here</html>")
                .on("/favicon.png", (u, o) -> Responses.bytes(u, "image/png", icon(32)));
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), t);

        PartialRecord pr = new FaviconModule().analyze(Responses.text(URL, 200, "text/plain", "hi"), ctx);

        assertThat(pr.get("favicon_url")).isEqualTo("https://app.example.com/favicon.png");
    }

    @Test
    void nothing_found_gives_nulls() throws Exception {
        ModuleContext ctx = new ModuleContext(HOST, ScanConfig.defaults(), new FakeTransport());

        PartialRecord pr = new FaviconModule().analyze(Responses.html(URL, 200, "<p>x</p>"), ctx);

        assertNull(pr.get("favicon_url"));
        assertNull(pr.get("favicon_hash"));
        assertThat(pr.fields()).containsKeys("favicon_md5", "favicon_match", "favicon_size");
    }
}
