package com.subsort.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 모듈 1개가 호스트 1건에 대해 내놓은 필드 기여분(삽입 순서 유지, null 값 허용). */
public final class PartialRecord {

    private final String module;
    private final LinkedHashMap<String, Object> fields = new LinkedHashMap<>();

    public PartialRecord(String module) {
        this.module = Objects.requireNonNull(module, "module");
    }

    public static PartialRecord of(String module) {
        return new PartialRecord(module);
    }

    public PartialRecord put(String field, Object value) {
        fields.put(Objects.requireNonNull(field, "field"), value);
        return this;
    }

    public String module() { return module; }

    public Map<String, Object> fields() { return Collections.unmodifiableMap(fields); }

    public Object get(String field) { return fields.get(field); }

    public boolean has(String field) { return fields.containsKey(field); }

    @Override public String toString() { return module + fields; }
}
