package com.subsort.core.scanner.modules;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.scanner.ModuleContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/** 지연 측정: 공유 응답 1건 + 추가 GET 2건. 추가 샘플 실패는 건너뛴다. */
public final class ResponseTimeModule implements IAnalysisModule {

    private static final Logger LOG = LoggerFactory.getLogger(ResponseTimeModule.class);

    public static final String NAME = "responsetime";
    static final int EXTRA_SAMPLES = 2;

    private static final List<String> FIELDS = List.of(
            "response_time_ms", "avg_response_time_ms", "min_response_time_ms",
            "max_response_time_ms", "latency_category");

    @Override public String name() { return NAME; }
    @Override public List<String> fields() { return FIELDS; }

    @Override
    public PartialRecord analyze(HttpResponseData resp, ModuleContext ctx) throws Exception {
        List<Long> samples = new ArrayList<>();
        samples.add(resp.getElapsedMs());
        for (int i = 0; i < EXTRA_SAMPLES; i++) {
            try {
                samples.add(ctx.fetch(resp.getRequestedUrl()).getElapsedMs());
            } catch (TransportException e) {
                LOG.debug("latency sample {} failed for {}: {}", i + 1, ctx.host().getRaw(), e.getMessage());
            }
        }
        long min = samples.stream().mapToLong(Long::longValue).min().orElse(0);
        long max = samples.stream().mapToLong(Long::longValue).max().orElse(0);
        double avg = samples.stream().mapToLong(Long::longValue).average().orElse(0);

        return PartialRecord.of(NAME)
                .put("response_time_ms", samples.get(0))
                .put("avg_response_time_ms", Math.round(avg * 10) / 10.0)
                .put("min_response_time_ms", min)
                .put("max_response_time_ms", max)
                .put("latency_category", category(avg));
    }

    static String category(double avgMs) {
        if (avgMs < 100) return "excellent";
        if (avgMs < 300) return "good";
        if (avgMs < 1000) return "fair";
        if (avgMs < 3000) return "slow";
        return "very_slow";
    }
}
