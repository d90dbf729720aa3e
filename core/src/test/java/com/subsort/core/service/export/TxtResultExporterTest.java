package com.subsort.core.service.export;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class TxtResultExporterTest {

    @Test
    void one_block_per_host() throws Exception {
        StringWriter w = new StringWriter();
        new TxtResultExporter().write(Fixtures.result(), w);
        String out = w.toString().replace("\r\n", "\n");

        assertThat(out).startsWith("SubSort Scan Results\n");
        assertThat(out).contains(
                "Total Subdomains: 2\n",
                "Enabled Modules: status, server, title\n",
                "Subdomain: www.example.com\n  Status: 200 (https://www.example.com/)\n  Server: nginx\n",
                "  Security Headers: [\"X-Frame-Options\"]\n",
                "Subdomain: dead.example.com\n",
                "  Error Kind: TIMEOUT\n",
                "  Attempts: 4\n");
        assertThat(out).doesNotContain("Completed:");

        String okBlock = out.substring(out.indexOf("Subdomain: www"), out.indexOf("Subdomain: dead"));
        assertThat(okBlock).doesNotContain("Error");
    }

    @Test
    void cancelled_run_says_so() throws Exception {
        StringWriter w = new StringWriter();
        new TxtResultExporter().write(Fixtures.cancelled(), w);

        assertThat(w.toString()).contains("Completed: 1 (cancelled)");
    }

    @Test
    void labels_are_title_cased() {
        assertEquals("Security Headers", TxtResultExporter.label("security_headers"));
        assertEquals("Cname Risk Level", TxtResultExporter.label("cname_risk_level"));
    }
}
