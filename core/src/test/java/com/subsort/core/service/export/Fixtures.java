package com.subsort.core.service.export;

import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.Record;
import com.subsort.core.model.ScanError;
import com.subsort.core.model.ScanResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 내보내기 테스트 공용 결과: 성공 1건 + 타임아웃 1건 */
final class Fixtures {

    static final Instant STARTED = Instant.parse("2024-05-01T10:15:30Z");
    static final Instant FINISHED = Instant.parse("2024-05-01T10:15:42Z");

    private Fixtures() {}

    static Record ok() {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("status_code", 200);
        f.put("server", "nginx");
        f.put("title", "Hello, \"World\"");
        f.put("security_headers", List.of("X-Frame-Options"));
        return new Record("www.example.com", "https://www.example.com/", true, null, 1, f, Map.of());
    }

    static Record timedOut() {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("status_code", null);
        f.put("server", null);
        f.put("title", null);
        f.put("security_headers", null);
        return new Record("dead.example.com", "https://dead.example.com/", false,
                new ScanError(ErrorKind.TIMEOUT, "timeout after 5000ms"), 4, f, Map.of());
    }

    static ScanResult result() {
        return new ScanResult(List.of(ok(), timedOut()), STARTED, FINISHED, 2, false,
                List.of("status", "server", "title"));
    }

    static ScanResult cancelled() {
        return new ScanResult(List.of(ok()), STARTED, FINISHED, 5, true, List.of("status", "server", "title"));
    }
}
