package com.subsort.core.scanner.modules.robots;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * robots.txt 파서
 * - 지원 지시어: User-agent / Allow / Disallow / Crawl-delay / Sitemap (키 대소문자 무시)
 * - 연속된 User-agent 라인은 "같은 그룹"으로 취급, 그 뒤 Allow/Disallow 누적
 * - UA 키: 소문자. 원문 UA는 등장 순서대로 따로 보관
 * - Sitemap은 그룹과 무관한 전역 지시어
 */
public final class RobotsParser {

    private RobotsParser() {}

    private static final Pattern KV = Pattern.compile("^\\s*([A-Za-z-]+)\\s*:\\s*(.*?)\\s*$");
    private static final Pattern PCT = Pattern.compile("%[0-9a-fA-F]{2}");
    private static final String UA_ALL = "*";

    public static ParsedRobots parse(String robotsTxt) {
        if (robotsTxt == null) robotsTxt = "";

        Map<String, RobotsRules> byUa = new LinkedHashMap<>();
        Set<String> agents = new LinkedHashSet<>();
        Set<String> sitemaps = new LinkedHashSet<>();

        List<String> currentAgents = new ArrayList<>();
        boolean lastWasUA = false;

        for (String rawLine : robotsTxt.split("\\r?\\n")) {
            String line = stripComment(rawLine).trim();
            if (line.isEmpty()) continue;

            Matcher m = KV.matcher(line);
            if (!m.matches()) continue;

            String key = m.group(1).toLowerCase(Locale.ROOT);
            String val = m.group(2).trim();

            switch (key) {
                case "user-agent" -> {
                    String original = val.isEmpty() ? UA_ALL : val;
                    String ua = original.toLowerCase(Locale.ROOT);
                    if (!lastWasUA) {
                        // 새 그룹 시작
                        currentAgents = new ArrayList<>();
                    }
                    currentAgents.add(ua);
                    agents.add(original);
                    byUa.putIfAbsent(ua, new RobotsRules());
                    lastWasUA = true;
                }
                case "allow" -> {
                    ensureAgents(currentAgents, byUa);
                    if (!val.isEmpty()) {
                        String norm = normalizeRule(val);
                        for (String ua : currentAgents) byUa.get(ua).addAllow(norm);
                    }
                    lastWasUA = false;
                }
                case "disallow" -> {
                    ensureAgents(currentAgents, byUa);
                    if (!val.isEmpty()) {
                        String norm = normalizeRule(val);
                        for (String ua : currentAgents) byUa.get(ua).addDisallow(norm);
                    }
                    lastWasUA = false;
                }
                case "crawl-delay" -> {
                    ensureAgents(currentAgents, byUa);
                    Integer d = parseDelay(val);
                    for (String ua : currentAgents) byUa.get(ua).crawlDelay(d);
                    lastWasUA = false;
                }
                case "sitemap" -> {
                    if (!val.isEmpty()) sitemaps.add(val);
                    lastWasUA = false;
                }
                default -> lastWasUA = false; // 기타 지시어 무시
            }
        }

        return new ParsedRobots(byUa, List.copyOf(agents), List.copyOf(sitemaps));
    }

    private static void ensureAgents(List<String> currentAgents, Map<String, RobotsRules> byUa) {
        if (currentAgents.isEmpty()) {
            currentAgents.add(UA_ALL);
            byUa.putIfAbsent(UA_ALL, new RobotsRules());
        }
    }

    /** 정수 초만 인정("10", "2.5"는 내림). 해석 불가면 null */
    static Integer parseDelay(String v) {
        try {
            return (int) Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** 퍼센트 HEX 대문자 정규화만 수행 */
    static String normalizeRule(String v) {
        Matcher m = PCT.matcher(v);
        StringBuilder sb = new StringBuilder();
        while (m.find()) m.appendReplacement(sb, m.group().toUpperCase(Locale.ROOT));
        m.appendTail(sb);
        return sb.toString();
    }

    private static String stripComment(String s) {
        int i = s.indexOf('#');
        return i >= 0 ? s.substring(0, i) : s;
    }

    /** 파싱 결과. UA 그룹 + 전역 Sitemap */
    public record ParsedRobots(Map<String, RobotsRules> byUa, List<String> userAgents, List<String> sitemaps) {

        /** UA 정확 일치(대소문자 무시), 없으면 "*" 그룹 */
        public RobotsRules selectFor(String userAgent) {
            String uaLower = (userAgent == null || userAgent.isBlank())
                    ? UA_ALL
                    : userAgent.toLowerCase(Locale.ROOT);
            RobotsRules exact = byUa.get(uaLower);
            if (exact != null) return exact;
            RobotsRules star = byUa.get(UA_ALL);
            return (star != null ? star : new RobotsRules());
        }

        /** 모든 그룹의 Disallow 합집합(등장 순, 중복 제거) */
        public List<String> allDisallowed() {
            return union(byUa.values(), true);
        }

        public List<String> allAllowed() {
            return union(byUa.values(), false);
        }

        /** 처음 등장한 Crawl-delay. 없으면 null */
        public Integer crawlDelay() {
            for (RobotsRules r : byUa.values()) {
                if (r.crawlDelay() != null) return r.crawlDelay();
            }
            return null;
        }

        private static List<String> union(Collection<RobotsRules> groups, boolean disallow) {
            Set<String> out = new LinkedHashSet<>();
            for (RobotsRules r : groups) out.addAll(disallow ? r.disallow : r.allow);
            return List.copyOf(out);
        }
    }
}
