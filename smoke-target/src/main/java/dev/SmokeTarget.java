package dev;

import com.sun.net.httpserver.*;
import javax.net.ssl.*;

import java.io.*;
import java.math.BigInteger;
import java.net.*;
import java.nio.charset.StandardCharsets;
import java.security.*;
import java.security.KeyStore;
import java.security.cert.X509Certificate;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.concurrent.Executors;

// BouncyCastle (표준 공개 API)
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

/**
 * 로컬 정찰 대상 서버. subsort 모듈이 한 번씩 반응하도록 픽스처를 배선한다.
 * 사용: java -jar subsort-smoke-target.jar [httpPort=8080] [httpsPort=8443]
 * 호스트 목록 예: localhost:8080, http://localhost:8080, https://localhost:8443
 */
public class SmokeTarget {

  // header.payload(alg=HS256, exp 없음).서명
  static final String DEMO_JWT =
      "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9"
      + ".eyJzdWIiOiIxMjM0NTY3ODkwIiwibmFtZSI6IlNtb2tlIFVzZXIiLCJyb2xlIjoiYWRtaW4ifQ"
      + ".c2lnbmF0dXJlLW5vdC12ZXJpZmllZA";

  static void add(HttpServer s, String path, HttpHandler h) { s.createContext(path, h); }

  public static void main(String[] args) throws Exception {
    int httpPort  = args.length > 0 ? Integer.parseInt(args[0]) : 8080;
    int httpsPort = args.length > 1 ? Integer.parseInt(args[1]) : 8443;

    HttpServer http = HttpServer.create(new InetSocketAddress(httpPort), 0);
    wireEndpoints(http, false);
    http.setExecutor(Executors.newFixedThreadPool(16));
    http.start();
    System.out.println("[subsort-smoke] HTTP  server on  http://localhost:" + httpPort);

    // 자가서명 p12 자동 생성/로드
    try {
      HttpsServer https = HttpsServer.create(new InetSocketAddress(httpsPort), 0);
      SSLContext ssl = buildOrLoadSSLContext(
          new File("smoke-keystore.p12"),
          "changeit".toCharArray(),
          "smoke"
      );
      https.setHttpsConfigurator(new HttpsConfigurator(ssl));
      wireEndpoints(https, true);
      https.setExecutor(Executors.newFixedThreadPool(16));
      https.start();
      System.out.println("[subsort-smoke] HTTPS server on https://localhost:" + httpsPort + " (self-signed, use --ignore-ssl)");
    } catch (Exception e) {
      System.out.println("[subsort-smoke] HTTPS disabled (" + e.getClass().getSimpleName() + ": " + e.getMessage() + ")");
    }
  }

  static void wireEndpoints(HttpServer s, boolean isHttps) {
    // 인덱스: server/techstack/title/js/jsvuln/jwt/auth/favicon/vhost 픽스처
    add(s, "/", ex -> {
      if (!"/".equals(ex.getRequestURI().getPath())) {
        resp(ex, 404, "text/html", "<html><head><title>404 Not Found</title></head><body>nope</body></html>");
        return;
      }
      String hostHeader = String.valueOf(ex.getRequestHeaders().getFirst("Host"));
      if (!hostHeader.startsWith("localhost") && !hostHeader.startsWith("127.0.0.1")) {
        // 기본 vhost 와 다른 가상 호스트
        resp(ex, 200, "text/html",
            "<html><head><title>Internal Staging Portal</title></head><body>staging for " + hostHeader + "</body></html>");
        return;
      }
      Headers h = ex.getResponseHeaders();
      h.set("X-Powered-By", "PHP/7.4.3");
      h.set("X-Frame-Options", "SAMEORIGIN");
      h.set("X-Content-Type-Options", "nosniff");
      h.add("Set-Cookie", "session=" + DEMO_JWT + "; Path=/; HttpOnly");
      h.add("Set-Cookie", "wordpress_test_cookie=WP+Cookie+check; Path=/");
      String html =
        "<!DOCTYPE html><html><head>" +
        "  <title>Smoke Recon Index</title>" +
        "  <meta name=\"description\" content=\"Local fixture for subsort modules\">" +
        "  <meta name=\"generator\" content=\"WordPress 5.8\">" +
        "  <meta property=\"og:title\" content=\"Smoke Recon\">" +
        "  <link rel=\"icon\" href=\"/favicon.ico\">" +
        "  <link rel=\"stylesheet\" href=\"/wp-content/themes/smoke/style.css\">" +
        "  <script src=\"/static/jquery-1.12.4.min.js\"></script>" +
        "  <script src=\"https://cdnjs.cloudflare.com/ajax/libs/angular.js/1.5.8/angular.min.js\"></script>" +
        "  <script src=\"/static/app.js\"></script>" +
        "</head><body>" +
        "  <h1>Smoke Recon Index</h1>" +
        "  <a href=\"https://accounts.google.com/o/oauth2/auth?client_id=demo\">Sign in with Google</a>" +
        "  <p>Mode: " + (isHttps ? "HTTPS" : "HTTP") + "</p>" +
        "  <script>var token = \"" + DEMO_JWT + "\";</script>" +
        "</body></html>";
      resp(ex, 200, "text/html", html);
    });

    add(s, "/robots.txt", ex -> resp(ex, 200, "text/plain", String.join("\n",
        "User-agent: *",
        "Disallow: /admin",
        "Disallow: /backup/",
        "Disallow: /.git/",
        "Allow: /public/",
        "Crawl-delay: 5",
        "",
        "User-agent: Googlebot",
        "Disallow: /private/",
        "",
        "Sitemap: /sitemap.xml",
        "")));

    add(s, "/sitemap.xml", ex -> resp(ex, 200, "application/xml",
        "<?xml version=\"1.0\" encoding=\"UTF-8\"?>" +
        "<urlset xmlns=\"http://www.sitemaps.org/schemas/sitemap/0.9\">" +
        "<url><loc>/</loc></url><url><loc>/public/</loc></url>" +
        "</urlset>"));

    add(s, "/favicon.ico", ex -> {
      byte[] icon = new byte[318];
      for (int i = 0; i < icon.length; i++) icon[i] = (byte) (i * 31 + 7);
      icon[0] = 0; icon[1] = 0; icon[2] = 1; icon[3] = 0;
      ex.getResponseHeaders().set("Content-Type", "image/x-icon");
      ex.sendResponseHeaders(200, icon.length);
      try (OutputStream os = ex.getResponseBody()) { os.write(icon); }
    });

    add(s, "/static/", ex -> resp(ex, 200, "application/javascript",
        "/*! jQuery v1.12.4 | (c) jQuery Foundation | jquery.org/license */ var smoke = 1;"));

    // 로그인 패널
    add(s, "/admin", ex -> resp(ex, 200, "text/html",
        "<html><head><title>Admin Login</title></head><body>" +
        "<form method=\"post\" action=\"/admin/login\">" +
        "<input type=\"text\" name=\"username\"><input type=\"password\" name=\"password\">" +
        "<button>Sign in</button></form></body></html>"));

    // Basic 인증 패널
    add(s, "/dashboard", ex -> {
      ex.getResponseHeaders().set("WWW-Authenticate", "Basic realm=\"smoke\"");
      resp(ex, 401, "text/html", "<html><head><title>401</title></head><body>auth required</body></html>");
    });

    // 리다이렉트 / 루프 / 지연 / 대용량
    add(s, "/moved", ex -> {
      ex.getResponseHeaders().set("Location", "/");
      ex.sendResponseHeaders(301, -1);
      ex.close();
    });
    add(s, "/loop", ex -> {
      ex.getResponseHeaders().set("Location", "/loop");
      ex.sendResponseHeaders(302, -1);
      ex.close();
    });
    add(s, "/slow", ex -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      resp(ex, 200, "text/plain", "slow");
    });
    add(s, "/big", ex -> resp(ex, 200, "text/plain", "x".repeat(4 * 1024 * 1024)));
  }

  // ===== HTTPS 유틸 (BC로 자가서명 p12 생성/로드) =====
  static SSLContext buildOrLoadSSLContext(File p12File, char[] password, String alias) throws Exception {
    if (Security.getProvider("BC") == null) {
      Security.addProvider(new BouncyCastleProvider());
    }

    KeyStore ks = KeyStore.getInstance("PKCS12");

    if (p12File.exists()) {
      try (InputStream in = new FileInputStream(p12File)) {
        ks.load(in, password);
      }
    } else {
      KeyPairGenerator kpg = KeyPairGenerator.getInstance("RSA");
      kpg.initialize(2048);
      KeyPair kp = kpg.generateKeyPair();

      X509Certificate cert = generateSelfSigned("localhost", kp);
      ks.load(null, null);
      ks.setKeyEntry(alias, kp.getPrivate(), password, new java.security.cert.Certificate[]{cert});

      try (OutputStream out = new FileOutputStream(p12File)) {
        ks.store(out, password);
      }
    }

    KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
    kmf.init(ks, password);

    SSLContext ssl = SSLContext.getInstance("TLS");
    ssl.init(kmf.getKeyManagers(), null, new SecureRandom());
    return ssl;
  }

  static X509Certificate generateSelfSigned(String cn, KeyPair kp) throws Exception {
    if (Security.getProvider("BC") == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
    X500Name subject = new X500Name("CN=" + cn);
    BigInteger serial = new BigInteger(64, new SecureRandom());
    Date notBefore = Date.from(ZonedDateTime.now().minus(1, ChronoUnit.DAYS).toInstant());
    Date notAfter  = Date.from(ZonedDateTime.now().plusYears(1).toInstant());

    GeneralNames subjectAltNames = new GeneralNames(new GeneralName[] {
        new GeneralName(GeneralName.dNSName, "localhost"),
        new GeneralName(GeneralName.iPAddress, "127.0.0.1")
    });

    JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
        subject, serial, notBefore, notAfter, subject, kp.getPublic());
    builder.addExtension(org.bouncycastle.asn1.x509.Extension.basicConstraints, true, new BasicConstraints(false));
    builder.addExtension(org.bouncycastle.asn1.x509.Extension.subjectAlternativeName, false, subjectAltNames);
    builder.addExtension(org.bouncycastle.asn1.x509.Extension.keyUsage, true,
        new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));

    ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(kp.getPrivate());
    return new JcaX509CertificateConverter().setProvider("BC").getCertificate(builder.build(signer));
  }

  static void resp(HttpExchange ex, int code, String ct, String body) throws IOException {
    byte[] b = body.getBytes(StandardCharsets.UTF_8);
    ex.getResponseHeaders().set("Content-Type", ct + "; charset=utf-8");
    ex.getResponseHeaders().set("Server", "nginx/1.18.0");
    ex.sendResponseHeaders(code, b.length);
    try (OutputStream os = ex.getResponseBody()) { os.write(b); }
  }
}
