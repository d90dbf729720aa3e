package com.subsort.core.scanner;

import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class HtmlSupportTest {

    private static Document doc(String html) {
        return HtmlSupport.parse(html, "https://app.example.com/");
    }

    @Test
    void clean_text_collapses_whitespace_and_truncates() {
        assertEquals("a & b", HtmlSupport.cleanText("  a\n\t&amp;   b "));

        String out = HtmlSupport.cleanText("x".repeat(250));
        assertThat(out).hasSize(200).endsWith("...");
        assertNull(HtmlSupport.cleanText(null));
    }

    @Test
    void title_falls_back_to_og_then_twitter() {
        assertEquals("Real", HtmlSupport.title(doc("<title> Real </title><meta property=\"og:title\" content=\"Og\">")));
        assertEquals("Og", HtmlSupport.title(doc("<meta property=\"og:title\" content=\"Og\">")));
        assertEquals("Tw", HtmlSupport.title(doc("<meta name=\"twitter:title\" content=\"Tw\">")));
        assertNull(HtmlSupport.title(doc("<p>no title</p>")));
    }

    @Test
    void description_prefers_meta_description() {
        assertEquals("Desc", HtmlSupport.description(doc(
                "<meta name=\"description\" content=\"Desc\"><meta property=\"og:description\" content=\"Og\">")));
        assertEquals("Og", HtmlSupport.description(doc("<meta property=\"og:description\" content=\"Og\">")));
        assertNull(HtmlSupport.description(doc("<p>x</p>")));
    }

    @Test
    void login_form_needs_password_and_user_like_input() {
        assertEquals(1, HtmlSupport.countLoginForms(doc(
                "<form><input name=\"username\"><input type=\"password\"></form>"
                        + "<form><input type=\"search\" name=\"q\"></form>")));
        assertEquals(1, HtmlSupport.countLoginForms(doc(
                "<form><input type=\"email\" name=\"e\"><input type=\"password\"></form>")));
        assertEquals(0, HtmlSupport.countLoginForms(doc(
                "<form><input type=\"hidden\" name=\"user\"><input type=\"password\"></form>")));
    }
}
