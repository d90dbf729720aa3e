package com.subsort.core.model;

import java.util.Objects;

/** 재시도 소진 후 Record에 남는 최종 오류 */
public record ScanError(ErrorKind kind, String message) {
    public ScanError {
        Objects.requireNonNull(kind, "kind");
        message = (message == null ? kind.name() : message);
    }
}
