package com.subsort.core.service.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.subsort.core.model.Record;
import com.subsort.core.model.ScanResult;
import com.subsort.core.model.ScanStats;
import com.subsort.core.service.ScanService;
import com.subsort.core.util.Json;

import java.io.IOException;
import java.io.Writer;
import java.time.Instant;

/**
 * JSON 결과 문서.
 * { timestamp, total_subdomains, completed, cancelled, modules, [runtime], results[] }
 * results의 각 원소는 Record.toFlatMap() 그대로(필드 순서 유지, null 포함).
 */
public class JsonResultExporter implements ResultExporter {

    // 런타임 텔레메트리를 가져오기 위한 선택적 소스
    private ScanService runtimeSource;

    /** 체이닝용: 생성 후 .withRuntime(scanService)로 런타임 값을 주입 */
    public JsonResultExporter withRuntime(ScanService svc) {
        this.runtimeSource = svc;
        return this;
    }

    @Override
    public void write(ScanResult result, Writer out) throws IOException {
        ObjectNode root = buildDocument(result);
        Json.mapper()
                .writer()
                .with(SerializationFeature.INDENT_OUTPUT)
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValue(out, root);
        out.write(System.lineSeparator());
    }

    ObjectNode buildDocument(ScanResult result) {
        ObjectNode root = Json.mapper().createObjectNode();
        root.put("timestamp", Instant.now().toString());
        root.put("started_at", result.getStartedAt().toString());
        root.put("finished_at", result.getFinishedAt().toString());
        root.put("total_subdomains", result.getTotal());
        root.put("completed", result.getCompleted());
        root.put("cancelled", result.isCancelled());
        ArrayNode mods = root.putArray("modules");
        result.getModules().forEach(mods::add);

        if (runtimeSource != null) {
            ScanStats.Snapshot rt = runtimeSource.getRuntimeSnapshot();
            ObjectNode runtime = root.putObject("runtime");
            runtime.put("requestsTotal", rt.requestsTotal);
            runtime.put("retriesTotal", rt.retriesTotal);
            runtime.put("maxObservedConcurrency", rt.maxObservedConcurrency);
            runtime.put("avgLatencyMs", rt.avgLatencyMs);
        }

        ArrayNode results = root.putArray("results");
        for (Record r : result.getRecords()) {
            results.add(Json.mapper().valueToTree(r.toFlatMap()));
        }
        return root;
    }
}
