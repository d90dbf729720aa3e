package com.subsort.core.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HostListReaderTest {

    @Test
    void skips_blank_lines_and_comments_but_keeps_duplicates() throws Exception {
        List<String> hosts = HostListReader.read(new StringReader(
                "\uFEFFwww.example.com\n\n# staging\n  api.example.com  \r\nwww.example.com\n\t\n"));

        assertThat(hosts).containsExactly("www.example.com", "api.example.com", "www.example.com");
    }

    @Test
    void reads_stdin_style_stream_as_utf8() throws Exception {
        List<String> hosts = HostListReader.read(
                new ByteArrayInputStream("a.example.com\nb.example.com".getBytes(StandardCharsets.UTF_8)));

        assertThat(hosts).containsExactly("a.example.com", "b.example.com");
    }

    @Test
    void reads_file(@TempDir Path dir) throws Exception {
        Path f = dir.resolve("hosts.txt");
        Files.writeString(f, "one.example.com\ntwo.example.com\n");

        assertThat(HostListReader.read(f)).hasSize(2);
    }

    @Test
    void missing_file_is_io_error(@TempDir Path dir) {
        assertThrows(IOException.class, () -> HostListReader.read(dir.resolve("nope.txt")));
    }
}
