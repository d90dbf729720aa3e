package com.subsort.core.service;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.model.Host;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.Record;
import com.subsort.core.model.ScanError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 모듈 partial → Record 병합(결정적).
 * 필드 순서 = 모듈 순서 × 선언 필드 순서. 선언됐지만 빠진 필드는 null.
 */
public final class ResultAggregator {

    private static final Logger LOG = LoggerFactory.getLogger(ResultAggregator.class);

    private final List<IAnalysisModule> modules;

    /** @param modules 실행 순서대로 정렬된 활성 모듈 */
    public ResultAggregator(List<IAnalysisModule> modules) {
        this.modules = List.copyOf(Objects.requireNonNull(modules, "modules"));
    }

    public Record merge(Host host, HostTask.Outcome outcome, List<ModuleOutcome> partials) {
        Objects.requireNonNull(host, "host");
        Objects.requireNonNull(outcome, "outcome");
        boolean fetched = outcome.isSuccess();

        Map<String, ModuleOutcome> byModule = new HashMap<>();
        if (partials != null) for (ModuleOutcome mo : partials) byModule.put(mo.module(), mo);

        LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
        LinkedHashMap<String, String> moduleErrors = new LinkedHashMap<>();
        for (IAnalysisModule m : modules) {
            List<String> declared = m.fields();
            for (String f : declared) fields.put(f, null);
            if (!fetched) continue;

            ModuleOutcome mo = byModule.get(m.name());
            if (mo == null) continue;
            if (mo.isFailed()) {
                moduleErrors.put(m.name(), mo.error());
                continue;
            }
            PartialRecord pr = mo.partial();
            for (String f : declared) {
                if (pr.has(f)) fields.put(f, pr.get(f));
            }
            for (String k : pr.fields().keySet()) {
                if (!declared.contains(k)) LOG.warn("Module {} returned undeclared field '{}' (dropped)", m.name(), k);
            }
        }

        boolean accessible = fetched;
        if (fetched && fields.get("accessible") instanceof Boolean b) accessible = b;

        String url = (outcome.response() != null)
                ? outcome.response().getRequestedUrl().toString()
                : outcome.host().getUrl().toString();
        return new Record(host.getRaw(), url, accessible, fetched ? null : outcome.error(),
                outcome.attempts(), fields, moduleErrors);
    }

    /** 정규화 불가 입력/예상 못한 실패: 모든 선언 필드 null */
    public Record failed(String raw, String url, ScanError error, int attempts) {
        LinkedHashMap<String, Object> fields = new LinkedHashMap<>();
        for (IAnalysisModule m : modules) for (String f : m.fields()) fields.put(f, null);
        return new Record(raw, url, false, error, attempts, fields, Map.of());
    }
}
