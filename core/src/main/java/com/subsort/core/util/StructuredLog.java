package com.subsort.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON 라인 기반 구조화 로거.
 * LogSetup(콘솔/파일 핸들러) 세팅 후 여기서 호출하면 JSON 문자열로 찍힘.
 */
public final class StructuredLog {
    private final Logger jul;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.jul = Logger.getLogger(cls.getName());
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) { log(Level.FINE,   event, null, kvs); }
    public void info (String event, Object... kvs) { log(Level.INFO,   event, null, kvs); }
    public void warn (String event, Object... kvs) { log(Level.WARNING,event, null, kvs); }
    public void error(String event, Throwable t, Object... kvs) { log(Level.SEVERE, event, t, kvs); }

    private void log(Level lvl, String event, Throwable t, Object... kvs) {
        if (!jul.isLoggable(lvl)) return;
        String line = buildJson(lvl, event, t, kvs);
        if (t == null) jul.log(lvl, line); else jul.log(lvl, line, t);
    }

    String buildJson(Level lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = Json.mapper().createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl.getName());
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null && kvs.length > 0) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                n.set(String.valueOf(kvs[i]), Json.mapper().valueToTree(kvs[i + 1]));
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return Json.mapper().writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // 직렬화 실패 시 최소 이벤트만
            return "{\"event\":\"" + event + "\",\"_json_error\":\"" + e.getOriginalMessage() + "\"}";
        }
    }
}
