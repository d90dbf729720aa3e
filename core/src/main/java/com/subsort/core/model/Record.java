package com.subsort.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 입력 호스트 1건당 정확히 1개. 필드 집합 = 활성 모듈 선언 필드의 합집합.
 * 실패 호스트도 accessible=false + error 로 남는다.
 */
public final class Record {

    private final String host;
    private final String url;
    private final boolean accessible;
    private final ScanError error;
    private final int attempts;
    private final Map<String, Object> fields;
    private final Map<String, String> moduleErrors;

    public Record(String host, String url, boolean accessible, ScanError error, int attempts,
                  Map<String, Object> fields, Map<String, String> moduleErrors) {
        this.host = Objects.requireNonNull(host, "host");
        this.url = url;
        this.accessible = accessible;
        this.error = error;
        this.attempts = attempts;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields == null ? Map.of() : fields));
        this.moduleErrors = Collections.unmodifiableMap(new LinkedHashMap<>(moduleErrors == null ? Map.of() : moduleErrors));
    }

    public String getHost() { return host; }
    public String getUrl() { return url; }
    public boolean isAccessible() { return accessible; }
    public ScanError getError() { return error; }
    public int getAttempts() { return attempts; }
    public Map<String, Object> getFields() { return fields; }
    public Map<String, String> getModuleErrors() { return moduleErrors; }

    public Object get(String field) { return fields.get(field); }

    /** 출력용 평탄화: host, url, accessible, error_kind, error, attempts, 모듈 필드, module_errors */
    public Map<String, Object> toFlatMap() {
        LinkedHashMap<String, Object> m = new LinkedHashMap<>();
        m.put("host", host);
        m.put("url", url);
        m.put("accessible", accessible);
        m.put("error_kind", error == null ? null : error.kind().name());
        m.put("error", error == null ? null : error.message());
        m.put("attempts", attempts);
        fields.forEach(m::putIfAbsent); // 상위 키는 덮지 않음
        if (!moduleErrors.isEmpty()) m.put("module_errors", moduleErrors);
        return m;
    }

    @Override
    public String toString() {
        return "Record{" + host + ", accessible=" + accessible + ", error=" + error + ", fields=" + fields + '}';
    }
}
