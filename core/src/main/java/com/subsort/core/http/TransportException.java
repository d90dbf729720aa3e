package com.subsort.core.http;

import com.subsort.core.model.ErrorKind;

import java.io.IOException;
import java.util.Objects;

/** 전송 단계 실패. HTTP 응답(4xx/5xx 포함)을 받은 경우는 실패가 아니다. */
public class TransportException extends IOException {

    private final ErrorKind kind;

    public TransportException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public TransportException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() { return kind; }

    public boolean isRetryable() { return kind.isRetryable(); }
}
