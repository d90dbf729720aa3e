package com.subsort.core.api;

import com.subsort.core.http.FetchOptions;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.HttpResponseData;

import java.net.URI;

/** HTTP 전송 계약: 블로킹 fetch. 실패는 TransportException(kind)으로만 알린다. 스레드 세이프해야 함. */
public interface IHttpTransport extends AutoCloseable {

    HttpResponseData fetch(URI url, FetchOptions options) throws TransportException, InterruptedException;

    default HttpResponseData fetch(URI url) throws TransportException, InterruptedException {
        return fetch(url, FetchOptions.DEFAULT);
    }

    /** 커넥션 풀 정리 */
    @Override default void close() {}
}
