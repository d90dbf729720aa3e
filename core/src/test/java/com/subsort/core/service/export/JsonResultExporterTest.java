package com.subsort.core.service.export;

import com.fasterxml.jackson.databind.JsonNode;
import com.subsort.core.util.Json;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonResultExporterTest {

    @Test
    void document_carries_metadata_and_ordered_records() throws Exception {
        StringWriter w = new StringWriter();
        new JsonResultExporter().write(Fixtures.result(), w);

        JsonNode root = Json.mapper().readTree(w.toString());
        assertEquals(2, root.get("total_subdomains").asInt());
        assertEquals(2, root.get("completed").asInt());
        assertFalse(root.get("cancelled").asBoolean());
        assertEquals("2024-05-01T10:15:30Z", root.get("started_at").asText());
        assertEquals("title", root.get("modules").get(2).asText());
        assertFalse(root.has("runtime"));

        JsonNode first = root.get("results").get(0);
        List<String> keys = new ArrayList<>();
        first.fieldNames().forEachRemaining(keys::add);
        assertThat(keys).startsWith("host", "url", "accessible", "error_kind", "error", "attempts", "status_code");
        assertEquals("Hello, \"World\"", first.get("title").asText());
        assertEquals("X-Frame-Options", first.get("security_headers").get(0).asText());

        JsonNode second = root.get("results").get(1);
        assertEquals("TIMEOUT", second.get("error_kind").asText());
        assertTrue(second.get("status_code").isNull());
        assertFalse(second.get("accessible").asBoolean());
    }

    @Test
    void cancelled_scan_reports_partial_counts() {
        JsonNode root = new JsonResultExporter().buildDocument(Fixtures.cancelled());

        assertTrue(root.get("cancelled").asBoolean());
        assertEquals(5, root.get("total_subdomains").asInt());
        assertEquals(1, root.get("results").size());
    }
}
