package dev;

import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.cert.X509Certificate;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class SmokeTargetTest {

    private HttpServer server;
    private ExecutorService pool;
    private String base;
    private final HttpClient client = HttpClient.newHttpClient();

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        SmokeTarget.wireEndpoints(server, false);
        pool = Executors.newCachedThreadPool();
        server.setExecutor(pool);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stop() {
        server.stop(0);
        pool.shutdownNow();
    }

    private HttpResponse<String> get(String path) throws Exception {
        return client.send(HttpRequest.newBuilder(URI.create(base + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void index_carries_module_fixtures() throws Exception {
        HttpResponse<String> r = get("/");

        assertEquals(200, r.statusCode());
        assertThat(r.headers().firstValue("Server")).hasValue("nginx/1.18.0");
        assertThat(r.headers().allValues("Set-Cookie")).anyMatch(c -> c.contains(SmokeTarget.DEMO_JWT));
        assertThat(r.body()).contains("<title>Smoke Recon Index</title>", "jquery-1.12.4.min.js");
    }

    @Test
    void unknown_path_is_404_and_robots_lists_disallows() throws Exception {
        assertEquals(404, get("/nope").statusCode());
        assertThat(get("/robots.txt").body()).contains("Disallow: /admin", "Sitemap: /sitemap.xml");
    }

    @Test
    void basic_auth_panel_challenges() throws Exception {
        HttpResponse<String> r = get("/dashboard");

        assertEquals(401, r.statusCode());
        assertThat(r.headers().firstValue("WWW-Authenticate")).hasValue("Basic realm=\"smoke\"");
    }

    @Test
    void self_signed_cert_covers_localhost() throws Exception {
        KeyPairGenerator kpg = KeyPairGenerator.getInstance("RSA");
        kpg.initialize(2048);
        KeyPair kp = kpg.generateKeyPair();

        X509Certificate cert = SmokeTarget.generateSelfSigned("localhost", kp);

        assertThat(cert.getSubjectX500Principal().getName()).isEqualTo("CN=localhost");
        assertThat(cert.getSubjectAlternativeNames()).hasSize(2);
    }
}
