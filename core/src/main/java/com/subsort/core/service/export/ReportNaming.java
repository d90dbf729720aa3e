package com.subsort.core.service.export;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;

/** -o 가 디렉터리일 때 쓰는 기본 파일명: subsort-yyyyMMdd-HHmmss.{ext} */
public final class ReportNaming {

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneId.systemDefault());

    private ReportNaming() {}

    public static String fileName(Instant startedAt, OutputFormat format) {
        return "subsort-" + TS_FMT.format(startedAt) + "." + format.extension();
    }

    /** 디렉터리면 그 아래 기본 파일명, 아니면 그대로 */
    public static Path resolve(Path output, Instant startedAt, OutputFormat format) {
        if (Files.isDirectory(output)) return output.resolve(fileName(startedAt, format));
        return output;
    }

    /** 확장자로 형식 추정(.json/.csv/.txt), 모르면 null */
    public static OutputFormat guess(Path output) {
        if (output == null || output.getFileName() == null) return null;
        String name = output.getFileName().toString();
        int dot = name.lastIndexOf('.');
        if (dot < 0) return null;
        try {
            return OutputFormat.of(name.substring(dot + 1));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
