package com.subsort.core.http;

import com.subsort.core.api.IHttpTransport;
import com.subsort.core.model.ScanConfig;

/** 스캔 1회당 transport 1개 생성(고정 설정 사본을 받는다) */
@FunctionalInterface
public interface TransportFactory {
    IHttpTransport create(ScanConfig config);

    TransportFactory DEFAULT = HttpTransport::new;
}
