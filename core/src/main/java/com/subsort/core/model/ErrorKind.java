package com.subsort.core.model;

/** 호스트 단위 실패 분류. TIMEOUT / CONNECTION_REFUSED 만 재시도 대상. */
public enum ErrorKind {
    TIMEOUT,
    CONNECTION_REFUSED,
    TLS_ERROR,
    TOO_MANY_REDIRECTS,
    OTHER;

    public boolean isRetryable() {
        return this == TIMEOUT || this == CONNECTION_REFUSED;
    }
}
