package com.subsort.core.http;

import com.subsort.core.api.IHttpTransport;
import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509ExtendedTrustManager;
import java.io.ByteArrayOutputStream;
import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.Socket;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.ByteBuffer;
import java.nio.channels.UnresolvedAddressException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Flow;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * JDK HttpClient 기반 기본 전송 구현. 스캔 1회당 1개(커넥션 풀 공유).
 * - 리다이렉트는 수동 추적(최대 10회), 최종 URL 기록
 * - timeout = connect + 본문 수신 전체의 벽시계 상한
 * - ignoreSsl일 때만 검증 생략(trust-all)
 * - 본문은 maxBodyBytes에서 절단
 */
public class HttpTransport implements IHttpTransport {

    private static final Logger LOG = LoggerFactory.getLogger(HttpTransport.class);

    public static final int MAX_REDIRECTS = 10;
    private static final Set<Integer> REDIRECT_CODES = Set.of(301, 302, 303, 307, 308);

    static {
        // vhost 모듈의 Host 헤더 오버라이드 허용(HttpClient 내부 클래스 로딩 전에 설정되어야 함)
        if (System.getProperty("jdk.httpclient.allowRestrictedHeaders") == null) {
            System.setProperty("jdk.httpclient.allowRestrictedHeaders", "host");
        }
    }

    private final ScanConfig config;
    private final HttpClient client;
    private final ExecutorService executor;
    private final UserAgents userAgents;

    public HttpTransport(ScanConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.userAgents = new UserAgents(config.getUserAgent(), config.getUserAgents());
        this.executor = Executors.newCachedThreadPool(new NamedThreadFactory("subsort-http"));

        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .version(HttpClient.Version.HTTP_1_1)
                .executor(executor);
        if (config.isIgnoreSsl()) {
            b.sslContext(trustAllContext());
        }
        this.client = b.build();
    }

    @Override
    public HttpResponseData fetch(URI url, FetchOptions options) throws TransportException, InterruptedException {
        Objects.requireNonNull(url, "url");
        FetchOptions opts = (options == null ? FetchOptions.DEFAULT : options);
        Duration timeout = (opts.getTimeout() != null ? opts.getTimeout() : config.getTimeout());
        boolean follow = (opts.getFollowRedirects() != null ? opts.getFollowRedirects() : config.isFollowRedirects());

        long t0 = System.nanoTime();
        long deadline = t0 + timeout.toNanos();
        String method = (opts.getMethod() == null ? "GET" : opts.getMethod().toUpperCase(Locale.ROOT));
        String ua = userAgents.next();
        String lang = userAgents.nextAcceptLanguage();

        URI current = url;
        int redirects = 0;
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                throw new TransportException(ErrorKind.TIMEOUT, "timeout after " + timeout.toMillis() + "ms: " + current);
            }
            HttpRequest req = buildRequest(current, method, ua, lang, opts, Duration.ofNanos(remaining));
            HttpResponse<Body> resp = send(req, remaining, current);

            int sc = resp.statusCode();
            String location = resp.headers().firstValue("Location").orElse(null);
            if (follow && REDIRECT_CODES.contains(sc) && location != null && !location.isBlank()) {
                if (redirects >= MAX_REDIRECTS) {
                    throw new TransportException(ErrorKind.TOO_MANY_REDIRECTS,
                            "more than " + MAX_REDIRECTS + " redirects from " + url);
                }
                URI next;
                try {
                    next = current.resolve(location.trim());
                } catch (IllegalArgumentException e) {
                    throw new TransportException(ErrorKind.OTHER, "bad redirect location: " + location, e);
                }
                if (sc == 303 && !"HEAD".equals(method)) method = "GET";
                LOG.debug("Redirect {} {} -> {}", sc, current, next);
                current = next;
                redirects++;
                continue;
            }

            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);
            Body body = resp.body();
            return HttpResponseData.builder()
                    .url(url)
                    .finalUrl(current)
                    .statusCode(sc)
                    .headers(resp.headers().map())
                    .body(body.bytes())
                    .truncated(body.truncated())
                    .elapsedMs(elapsedMs)
                    .redirectCount(redirects)
                    .build();
        }
    }

    private HttpRequest buildRequest(URI uri, String method, String ua, String lang,
                                     FetchOptions opts, Duration remaining) throws TransportException {
        try {
            HttpRequest.Builder rb = HttpRequest.newBuilder(uri)
                    .timeout(remaining)
                    .method(method, HttpRequest.BodyPublishers.noBody())
                    .header("User-Agent", ua)
                    .header("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8")
                    .header("Accept-Language", lang);
            for (Map.Entry<String, String> e : config.getHeaders().entrySet()) {
                rb.setHeader(e.getKey(), e.getValue());
            }
            for (Map.Entry<String, String> e : opts.getHeaders().entrySet()) {
                rb.setHeader(e.getKey(), e.getValue());
            }
            return rb.build();
        } catch (IllegalArgumentException e) {
            throw new TransportException(ErrorKind.OTHER, "cannot build request for " + uri + ": " + e.getMessage(), e);
        }
    }

    private HttpResponse<Body> send(HttpRequest req, long remainingNanos, URI current)
            throws TransportException, InterruptedException {
        int limit = config.getMaxBodyBytes();
        CompletableFuture<HttpResponse<Body>> f =
                client.sendAsync(req, info -> new LimitedBodySubscriber(limit));
        try {
            return f.get(remainingNanos, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new TransportException(ErrorKind.TIMEOUT, "timeout: " + current, e);
        } catch (InterruptedException e) {
            f.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() != null ? e.getCause() : e);
            throw new TransportException(classify(cause), describe(cause, current), cause);
        }
    }

    /** 원인 체인을 훑어 ErrorKind로 분류 */
    static ErrorKind classify(Throwable t) {
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof UnresolvedAddressException || c instanceof UnknownHostException) return ErrorKind.OTHER;
        }
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof HttpTimeoutException || c instanceof TimeoutException) return ErrorKind.TIMEOUT;
            if (c instanceof SSLException) return ErrorKind.TLS_ERROR;
        }
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof ConnectException || c instanceof NoRouteToHostException) return ErrorKind.CONNECTION_REFUSED;
        }
        return ErrorKind.OTHER;
    }

    private static String describe(Throwable t, URI uri) {
        String msg = t.getMessage();
        return t.getClass().getSimpleName() + (msg == null ? "" : ": " + msg) + " (" + uri + ")";
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    // ===== 본문 수신(상한 절단) =====

    record Body(byte[] bytes, boolean truncated) {}

    static final class LimitedBodySubscriber implements HttpResponse.BodySubscriber<Body> {
        private final int limit;
        private final ByteArrayOutputStream buf = new ByteArrayOutputStream();
        private final CompletableFuture<Body> result = new CompletableFuture<>();
        private Flow.Subscription subscription;

        LimitedBodySubscriber(int limit) { this.limit = limit; }

        @Override public CompletionStage<Body> getBody() { return result; }

        @Override public void onSubscribe(Flow.Subscription s) {
            this.subscription = s;
            s.request(Long.MAX_VALUE);
        }

        @Override public void onNext(List<ByteBuffer> items) {
            if (result.isDone()) return;
            for (ByteBuffer bb : items) {
                int room = limit - buf.size();
                int n = bb.remaining();
                byte[] chunk = new byte[Math.min(n, room)];
                bb.get(chunk);
                buf.write(chunk, 0, chunk.length);
                if (n > room) {
                    subscription.cancel();
                    result.complete(new Body(buf.toByteArray(), true));
                    return;
                }
            }
        }

        @Override public void onError(Throwable t) { result.completeExceptionally(t); }

        @Override public void onComplete() { result.complete(new Body(buf.toByteArray(), false)); }
    }

    // ===== TLS: ignoreSsl 전용 =====

    static SSLContext trustAllContext() {
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, new TrustManager[]{new TrustAll()}, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot init trust-all SSLContext", e);
        }
    }

    /** Extended 구현이어야 JSSE가 호스트명 검증을 덧붙이지 않는다 */
    private static final class TrustAll extends X509ExtendedTrustManager {
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) {}
        @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
        @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
        @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
    }
}
