package com.subsort.core.scanner;

import com.subsort.core.model.HttpResponseData;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;

import java.util.Locale;

/** jsoup 기반 HTML 공통 유틸(제목/메타/로그인 폼) */
public final class HtmlSupport {

    public static final int MAX_TEXT = 200;

    private HtmlSupport() {}

    public static Document parse(HttpResponseData resp) {
        return Jsoup.parse(resp.bodyText(), resp.getFinalUrl().toString());
    }

    public static Document parse(String html, String baseUri) {
        return Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri);
    }

    /** 엔티티 해제 + 공백 압축 + 200자 절단(197 + "...") */
    public static String cleanText(String s) {
        if (s == null) return null;
        String t = Parser.unescapeEntities(s, false).replaceAll("\\s+", " ").trim();
        if (t.length() > MAX_TEXT) t = t.substring(0, MAX_TEXT - 3) + "...";
        return t;
    }

    /** <title> → og:title → twitter:title 순. 없으면 null */
    public static String title(Document doc) {
        String t = cleanText(doc.title());
        if (t != null && !t.isEmpty()) return t;
        t = metaContent(doc, "meta[property=og:title]");
        if (t != null) return t;
        return metaContent(doc, "meta[name=twitter:title]");
    }

    /** description → og:description → twitter:description 순. 없으면 null */
    public static String description(Document doc) {
        String d = metaContent(doc, "meta[name=description]");
        if (d != null) return d;
        d = metaContent(doc, "meta[property=og:description]");
        if (d != null) return d;
        return metaContent(doc, "meta[name=twitter:description]");
    }

    private static String metaContent(Document doc, String css) {
        Element e = doc.selectFirst(css);
        if (e == null) return null;
        String v = cleanText(e.attr("content"));
        return (v == null || v.isEmpty()) ? null : v;
    }

    /** password 입력 + 사용자명류 입력(name/id/placeholder에 user|login|mail, 또는 type=email)을 가진 폼 개수 */
    public static int countLoginForms(Document doc) {
        int n = 0;
        for (Element form : doc.select("form")) {
            if (form.selectFirst("input[type=password]") == null) continue;
            boolean userLike = false;
            for (Element in : form.select("input")) {
                String type = in.attr("type").toLowerCase(Locale.ROOT);
                if (type.equals("password") || type.equals("hidden") || type.equals("submit")) continue;
                String attrs = (in.attr("name") + " " + in.attr("id") + " " + in.attr("placeholder"))
                        .toLowerCase(Locale.ROOT);
                if (type.equals("email") || attrs.contains("user") || attrs.contains("login") || attrs.contains("mail")) {
                    userLike = true;
                    break;
                }
            }
            if (userLike) n++;
        }
        return n;
    }
}
