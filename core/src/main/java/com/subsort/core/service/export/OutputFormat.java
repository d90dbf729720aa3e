package com.subsort.core.service.export;

import java.util.Locale;

public enum OutputFormat {
    TXT("txt"),
    JSON("json"),
    CSV("csv");

    private final String extension;

    OutputFormat(String extension) { this.extension = extension; }

    public String extension() { return extension; }

    public ResultExporter exporter() {
        return switch (this) {
            case TXT -> new TxtResultExporter();
            case JSON -> new JsonResultExporter();
            case CSV -> new CsvResultExporter();
        };
    }

    /** @throws IllegalArgumentException txt/json/csv 이외 */
    public static OutputFormat of(String name) {
        if (name == null || name.isBlank()) return TXT;
        String n = name.trim().toLowerCase(Locale.ROOT);
        for (OutputFormat f : values()) {
            if (f.extension.equals(n)) return f;
        }
        throw new IllegalArgumentException("unknown output format: " + name + " (txt, json, csv)");
    }
}
