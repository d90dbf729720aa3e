package com.subsort.core.service.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.subsort.core.model.Record;
import com.subsort.core.model.ScanResult;
import com.subsort.core.util.Json;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * CSV(RFC 4180). 헤더 = 모든 레코드 키의 합집합(정렬).
 * 리스트/맵 값은 JSON 문자열, null은 빈 칸. 레코드가 없으면 아무것도 쓰지 않는다.
 */
public class CsvResultExporter implements ResultExporter {

    private static final String EOL = "\r\n";

    @Override
    public void write(ScanResult result, Writer out) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        TreeSet<String> columns = new TreeSet<>();
        for (Record r : result.getRecords()) {
            Map<String, Object> m = r.toFlatMap();
            rows.add(m);
            columns.addAll(m.keySet());
        }
        if (rows.isEmpty()) return;

        writeLine(out, new ArrayList<>(columns));
        for (Map<String, Object> m : rows) {
            List<String> cells = new ArrayList<>(columns.size());
            for (String c : columns) cells.add(cell(m.get(c)));
            writeLine(out, cells);
        }
    }

    private static void writeLine(Writer out, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) out.write(',');
            out.write(quote(cells.get(i)));
        }
        out.write(EOL);
    }

    static String cell(Object v) {
        if (v == null) return "";
        if (v instanceof Map<?, ?> || v instanceof Collection<?>) {
            try {
                return Json.mapper().writeValueAsString(v);
            } catch (JsonProcessingException e) {
                throw new UncheckedIOException(e);
            }
        }
        return String.valueOf(v);
    }

    static String quote(String s) {
        if (s.isEmpty()) return s;
        boolean needs = s.indexOf(',') >= 0 || s.indexOf('"') >= 0
                || s.indexOf('\n') >= 0 || s.indexOf('\r') >= 0;
        if (!needs) return s;
        return '"' + s.replace("\"", "\"\"") + '"';
    }
}
