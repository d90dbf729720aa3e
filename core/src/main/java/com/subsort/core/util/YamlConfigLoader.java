package com.subsort.core.util;

import com.subsort.core.config.ConfigException;
import com.subsort.core.model.ScanConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * scan.yml을 읽어 ScanConfig로 변환.
 *
 * 예상 YAML 키:
 * concurrency: 50
 * timeoutMs: 5000
 * maxRetries: 3
 * delayMs: 0
 * rps: 0
 * ignoreSsl: false
 * followRedirects: true
 * httpFallback: false
 * defaultScheme: https
 * maxBodyBytes: 1048576
 * userAgent: "Mozilla/5.0 ..."     # 없으면 로테이션
 * userAgents: ["ua1", "ua2"]
 * headers:
 *   X-Bug-Bounty: "researcher"
 * modules: [status, server, title]
 * ports: [80, 443, 8080]
 *
 * retry:
 *   baseMs: 1000
 *   multiplier: 2.0
 *   maxDelayMs: 30000
 *
 * module:
 *   timeoutFactor: 2
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    /** defaults() 위에 YAML 적용 후 validate */
    public static ScanConfig load(Path yamlPath) throws IOException {
        ScanConfig cfg = loadInto(yamlPath, ScanConfig.defaults());
        cfg.validate();
        return cfg;
    }

    /** 주어진 cfg에 YAML 값을 덮어쓴다(검증 없음, CLI 오버라이드 전 단계용) */
    public static ScanConfig loadInto(Path yamlPath, ScanConfig cfg) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(cfg, "cfg");
        if (!Files.exists(yamlPath)) {
            throw new IOException("scan.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            LoaderOptions opts = new LoaderOptions();
            Yaml yaml = new Yaml(new SafeConstructor(opts));
            Object root;
            try {
                root = yaml.load(in);
            } catch (YAMLException e) {
                throw new ConfigException("malformed YAML in " + yamlPath + ": " + e.getMessage(), e);
            }

            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 그대로
                return cfg;
            }
            try {
                apply(map, cfg);
            } catch (NumberFormatException | ClassCastException e) {
                throw new ConfigException("invalid value in " + yamlPath + ": " + e.getMessage(), e);
            }
            return cfg;
        }
    }

    private static void apply(Map<?, ?> map, ScanConfig cfg) {
        // 1) 평면 키
        setInt(map, "concurrency", cfg::setConcurrency);
        setMs(map, "timeoutMs", cfg::setTimeout);
        setInt(map, "maxRetries", cfg::setMaxRetries);
        setMs(map, "delayMs", cfg::setDelay);
        setInt(map, "rps", cfg::setRps);
        setBoolean(map, "ignoreSsl", cfg::setIgnoreSsl);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setBoolean(map, "httpFallback", cfg::setHttpFallback);
        setString(map, "defaultScheme", cfg::setDefaultScheme);
        setInt(map, "maxBodyBytes", cfg::setMaxBodyBytes);
        setString(map, "userAgent", cfg::setUserAgent);
        setStringList(map, "userAgents", cfg::setUserAgents);
        setStringList(map, "modules", cfg::setModules);
        setStringList(map, "ports", l -> cfg.setPorts(toPorts(l)));

        Map<String, Object> headers = getMap(map, "headers");
        if (headers != null) {
            headers.forEach((k, v) -> { if (v != null) cfg.addHeader(k, String.valueOf(v)); });
        }

        // 2) retry.*
        Map<String, Object> retry = getMap(map, "retry");
        if (retry != null) {
            setLong(retry, "baseMs", cfg::setRetryBaseMs);
            setDouble(retry, "multiplier", cfg::setRetryMultiplier);
            setMs(retry, "maxDelayMs", cfg::setRetryMaxDelay);
        }

        // 3) module.*
        Map<String, Object> module = getMap(map, "module");
        if (module != null) {
            setInt(module, "timeoutFactor", cfg::setModuleTimeoutFactor);
        }
    }

    // ------------ helpers ------------
    private static List<Integer> toPorts(List<String> raw) {
        List<Integer> out = new ArrayList<>();
        for (String s : raw) out.add(Integer.parseInt(s.trim()));
        return out;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            if (!out.isEmpty()) setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        if (!s.isEmpty()) {
            String[] parts = s.split("\\s*,\\s*");
            List<String> out = new ArrayList<>();
            for (String p : parts) if (!p.isEmpty()) out.add(p);
            if (!out.isEmpty()) setter.accept(List.copyOf(out));
        }
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.doubleValue());
        else if (v != null) setter.accept(Double.parseDouble(String.valueOf(v).trim()));
    }

    private static void setMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        setter.accept(Duration.ofMillis(ms));
    }
}
