package com.subsort.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.subsort.core.model.Record;
import com.subsort.core.model.ScanResult;
import com.subsort.core.util.Json;

import java.io.IOException;
import java.io.Writer;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** 사람이 읽는 블록 형식. 호스트당 한 블록, 빈 줄로 구분 */
public class TxtResultExporter implements ResultExporter {

    static final DateTimeFormatter GENERATED_FMT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneId.systemDefault());

    private static final Set<String> HEADLINE = Set.of(
            "host", "url", "status_code", "status_message", "server", "title");

    @Override
    public void write(ScanResult result, Writer out) throws IOException {
        String nl = System.lineSeparator();
        out.write("SubSort Scan Results" + nl);
        out.write("Generated: " + GENERATED_FMT.format(result.getFinishedAt()) + nl);
        out.write("Total Subdomains: " + result.getTotal() + nl);
        if (result.isCancelled()) {
            out.write("Completed: " + result.getCompleted() + " (cancelled)" + nl);
        }
        out.write("Enabled Modules: " + String.join(", ", result.getModules()) + nl);
        out.write("-".repeat(80) + nl + nl);

        for (Record r : result.getRecords()) {
            Map<String, Object> m = r.toFlatMap();
            out.write("Subdomain: " + r.getHost() + nl);
            if (m.containsKey("status_code")) {
                Object msg = m.get("status_message");
                out.write("  Status: " + m.get("status_code")
                        + (msg == null ? "" : " " + msg)
                        + " (" + (r.getUrl() == null ? "" : r.getUrl()) + ")" + nl);
            }
            if (m.containsKey("server")) out.write("  Server: " + m.get("server") + nl);
            if (m.containsKey("title")) out.write("  Title: " + m.get("title") + nl);

            for (Map.Entry<String, Object> e : m.entrySet()) {
                if (HEADLINE.contains(e.getKey())) continue;
                if (e.getValue() == null && ("error".equals(e.getKey()) || "error_kind".equals(e.getKey()))) continue;
                out.write("  " + label(e.getKey()) + ": " + render(e.getValue()) + nl);
            }
            out.write(nl);
        }
    }

    /** security_headers → Security Headers */
    static String label(String key) {
        StringBuilder b = new StringBuilder();
        for (String part : key.split("_")) {
            if (part.isEmpty()) continue;
            if (b.length() > 0) b.append(' ');
            b.append(part.substring(0, 1).toUpperCase(Locale.ROOT)).append(part.substring(1));
        }
        return b.toString();
    }

    private static String render(Object v) throws JsonProcessingException {
        if (v instanceof Map<?, ?> || v instanceof Collection<?>) {
            return Json.mapper().writeValueAsString(v);
        }
        return String.valueOf(v);
    }
}
