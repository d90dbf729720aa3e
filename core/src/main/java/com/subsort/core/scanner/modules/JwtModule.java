package com.subsort.core.scanner.modules;

import com.fasterxml.jackson.core.type.TypeReference;
import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** JWT 수집/디코드(서명 검증 없음) + 설정 취약점 플래그 */
public final class JwtModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(JwtModule.class);

    public static final String NAME = "jwt";

    private static final List<String> FIELDS = List.of(
            "jwt_tokens", "jwt_token_count", "jwt_algorithms", "jwt_issues");

    // 서명부는 alg:none 토큰을 위해 빈 값 허용
    static final Pattern JWT = Pattern.compile("eyJ[A-Za-z0-9_-]+\\.eyJ[A-Za-z0-9_-]+\\.[A-Za-z0-9_-]*");

    private static final TypeReference<LinkedHashMap<String, Object>> MAP = new TypeReference<>() {};

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) {
        List<Map<String, Object>> tokens = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();

        resp.getHeaders().forEach((name, values) -> {
            String ln = name.toLowerCase(Locale.ROOT);
            if (!(ln.contains("authorization") || ln.contains("token") || ln.equals("set-cookie"))) return;
            for (String v : values) collect(v, "header:" + name, seen, tokens);
        });
        collect(resp.bodyText(), "body", seen, tokens);

        Set<String> algs = new LinkedHashSet<>();
        Set<String> issues = new LinkedHashSet<>();
        for (Map<String, Object> t : tokens) {
            @SuppressWarnings("unchecked")
            Map<String, Object> header = (Map<String, Object>) t.get("header");
            @SuppressWarnings("unchecked")
            Map<String, Object> payload = (Map<String, Object>) t.get("payload");
            Object alg = header.get("alg");
            algs.add(alg == null ? "unknown" : String.valueOf(alg));
            issues.addAll(issues(header, payload));
        }

        return PartialRecord.of(NAME)
                .put("jwt_tokens", tokens)
                .put("jwt_token_count", tokens.size())
                .put("jwt_algorithms", List.copyOf(algs))
                .put("jwt_issues", List.copyOf(issues));
    }

    private static void collect(String text, String source, Set<String> seen, List<Map<String, Object>> out) {
        if (text == null || text.isEmpty()) return;
        Matcher m = JWT.matcher(text);
        while (m.find()) {
            String token = m.group();
            if (!seen.add(token)) continue;
            Map<String, Object> info = decode(token, source);
            if (info != null) out.add(info);
        }
    }

    /** 헤더/페이로드가 JSON 객체가 아니면 null */
    static Map<String, Object> decode(String token, String source) {
        String[] parts = token.split("\\.", -1);
        if (parts.length != 3) return null;
        try {
            Map<String, Object> header = Json.mapper().readValue(b64url(parts[0]), MAP);
            Map<String, Object> payload = Json.mapper().readValue(b64url(parts[1]), MAP);
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("token", elide(token, 50));
            info.put("source", source);
            info.put("header", header);
            info.put("payload", payload);
            info.put("signature", elide(parts[2], 20));
            return info;
        } catch (IOException | IllegalArgumentException e) {
            LOG.debug("not a decodable JWT ({}): {}", source, e.getMessage());
            return null;
        }
    }

    static List<String> issues(Map<String, Object> header, Map<String, Object> payload) {
        List<String> out = new ArrayList<>();
        String alg = String.valueOf(header.getOrDefault("alg", "")).toUpperCase(Locale.ROOT);
        if (alg.equals("NONE")) out.add("No signature algorithm (alg: none)");
        else if (alg.startsWith("HS")) out.add("HMAC algorithm detected (shared secret)");
        if (isEmpty(payload.get("exp"))) out.add("No expiration time (exp) claim");
        if (isEmpty(payload.get("iat"))) out.add("No issued at (iat) claim");
        if (isEmpty(payload.get("aud"))) out.add("No audience (aud) claim");
        if (isEmpty(payload.get("iss"))) out.add("No issuer (iss) claim");
        return out;
    }

    private static boolean isEmpty(Object v) {
        return v == null || (v instanceof String s && s.isEmpty());
    }

    private static byte[] b64url(String part) {
        return Base64.getUrlDecoder().decode(part); // 패딩 없어도 디코드됨
    }

    private static String elide(String s, int max) {
        return s.length() > max ? s.substring(0, max) + "..." : s;
    }
}
