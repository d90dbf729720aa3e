package com.subsort.core.scanner.modules;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** 스크립트 URL에서 라이브러리/버전 추정(파일명·경로 기반) */
final class JsLibraries {

    static final List<String> KNOWN = List.of("jquery", "angular", "react", "vue", "bootstrap");

    record Lib(String library, String version, String url) {}

    private JsLibraries() {}

    /** 알려진 라이브러리가 아니면 null. 버전을 못 찾으면 "unknown" */
    static Lib identify(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        String file = fileName(lower);
        for (String lib : KNOWN) {
            if (!lower.contains(lib)) continue;
            String v = version(lib, file);
            if (v == null) v = version(lib, lower);
            return new Lib(lib, v == null ? "unknown" : v, url);
        }
        return null;
    }

    private static String version(String lib, String s) {
        String q = Pattern.quote(lib);
        for (Pattern p : List.of(
                Pattern.compile(q + "[.\\-@]?v?(\\d+(?:\\.\\d+){0,5})"),
                Pattern.compile(q + "/v?(\\d+(?:\\.\\d+){0,5})"),
                Pattern.compile("(\\d+(?:\\.\\d+){1,5})[.\\-/]" + q))) {
            Matcher m = p.matcher(s);
            if (m.find()) return m.group(1);
        }
        return null;
    }

    private static String fileName(String url) {
        String path;
        try {
            path = URI.create(url).getPath();
        } catch (IllegalArgumentException e) {
            path = url;
        }
        if (path == null) path = url;
        int i = path.lastIndexOf('/');
        return i >= 0 ? path.substring(i + 1) : path;
    }
}
