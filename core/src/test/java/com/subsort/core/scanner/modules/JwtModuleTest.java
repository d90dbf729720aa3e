package com.subsort.core.scanner.modules;

import com.subsort.core.model.Host;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.support.FakeTransport;
import com.subsort.core.support.Responses;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class JwtModuleTest {

    private static final URI URL = URI.create("https://app.example.com/");

    private final ModuleContext ctx =
            new ModuleContext(Host.of("app.example.com", "https"), ScanConfig.defaults(), new FakeTransport());

    private static String b64(String json) {
        return Base64.getUrlEncoder().withoutPadding().encodeToString(json.getBytes(StandardCharsets.UTF_8));
    }

    private static String token(String header, String payload, String sig) {
        return b64(header) + "." + b64(payload) + "." + sig;
    }

    @Test
    @SuppressWarnings("unchecked")
    void decodes_cookie_token_once_and_flags_missing_claims() {
        String jwt = token("{\"alg\":\"HS256\",\"typ\":\"JWT\"}", "{\"sub\":\"42\",\"iss\":\"auth.example.com\"}", "c2ln");
        HttpResponseData resp = HttpResponseData.builder()
                .url(URL)
                .statusCode(200)
                .header("Content-Type", "text/html")
                .header("Set-Cookie", "session=" + jwt + "; Path=/; HttpOnly")
                .body("<script>var t = '" + jwt + "';</script>")
                .build();

        PartialRecord pr = new JwtModule().analyze(resp, ctx);

        assertEquals(1, pr.get("jwt_token_count"));
        List<Map<String, Object>> tokens = (List<Map<String, Object>>) pr.get("jwt_tokens");
        assertThat(tokens.get(0)).containsEntry("source", "header:Set-Cookie");
        assertThat((Map<String, Object>) tokens.get(0).get("payload")).containsEntry("sub", "42");
        assertThat((List<String>) pr.get("jwt_algorithms")).containsExactly("HS256");
        assertThat((List<String>) pr.get("jwt_issues")).containsExactly(
                "HMAC algorithm detected (shared secret)",
                "No expiration time (exp) claim",
                "No issued at (iat) claim",
                "No audience (aud) claim");
    }

    @Test
    @SuppressWarnings("unchecked")
    void unsigned_token_in_body() {
        String jwt = token("{\"alg\":\"none\"}",
                "{\"exp\":1900000000,\"iat\":1700000000,\"aud\":\"web\",\"iss\":\"me\"}", "");
        HttpResponseData resp = Responses.text(URL, 200, "application/json", "{\"token\":\"" + jwt + "\"}");

        PartialRecord pr = new JwtModule().analyze(resp, ctx);

        assertEquals(1, pr.get("jwt_token_count"));
        assertThat((List<String>) pr.get("jwt_algorithms")).containsExactly("none");
        assertThat((List<String>) pr.get("jwt_issues")).containsExactly("No signature algorithm (alg: none)");
    }

    @Test
    void undecodable_lookalikes_are_ignored() {
        HttpResponseData resp = Responses.html(URL, 200, "<p>eyJub3QganNvbg.eyJhbHNvIG5vdA.xyz</p>");

        PartialRecord pr = new JwtModule().analyze(resp, ctx);

        assertEquals(0, pr.get("jwt_token_count"));
    }

    @Test
    void long_token_text_is_elided() {
        String jwt = token("{\"alg\":\"RS256\"}", "{\"sub\":\"" + "x".repeat(80) + "\"}", "c2lnbmF0dXJlLXZhbHVlLXRoYXQtaXMtbG9uZw");
        Map<String, Object> info = JwtModule.decode(jwt, "body");

        assertThat((String) info.get("token")).hasSize(53).endsWith("...");
        assertThat((String) info.get("signature")).hasSize(23).endsWith("...");
    }
}
