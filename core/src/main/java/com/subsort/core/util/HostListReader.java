package com.subsort.core.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 호스트 목록 입력: 한 줄에 하나, 공백 줄과 '#' 주석은 건너뜀.
 * 중복 줄도 유지한다(입력 1줄 = Record 1건). 정규화는 Host.of 책임.
 */
public final class HostListReader {
    private HostListReader() {}

    public static List<String> read(Path file) throws IOException {
        Objects.requireNonNull(file, "file");
        if (!Files.isRegularFile(file)) {
            throw new IOException("host list not found: " + file.toAbsolutePath());
        }
        try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(r);
        }
    }

    public static List<String> read(InputStream in) throws IOException {
        return read(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public static List<String> read(Reader reader) throws IOException {
        List<String> out = new ArrayList<>();
        BufferedReader br = (reader instanceof BufferedReader b) ? b : new BufferedReader(reader);
        String line;
        while ((line = br.readLine()) != null) {
            String s = line.replace("\uFEFF", "").strip();
            if (s.isEmpty() || s.startsWith("#")) continue;
            out.add(s);
        }
        return out;
    }
}
