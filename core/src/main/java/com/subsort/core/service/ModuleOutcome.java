package com.subsort.core.service;

import com.subsort.core.model.PartialRecord;

import java.util.Objects;

/** 모듈 1개 실행 결과: partial 또는 에러 메시지 중 하나 */
public record ModuleOutcome(String module, PartialRecord partial, String error) {

    public ModuleOutcome {
        Objects.requireNonNull(module, "module");
    }

    public static ModuleOutcome ok(PartialRecord partial) {
        return new ModuleOutcome(partial.module(), partial, null);
    }

    public static ModuleOutcome failed(String module, String error) {
        return new ModuleOutcome(module, null, error == null ? "failed" : error);
    }

    public boolean isFailed() { return error != null; }
}
