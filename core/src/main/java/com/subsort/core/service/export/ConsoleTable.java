package com.subsort.core.service.export;

import com.subsort.core.model.Record;
import com.subsort.core.model.ScanResult;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * -o 없이 실행했을 때의 콘솔 표.
 * 열: Subdomain + (status: Status, URL) + (server: Server) + (title: Title, 40자 절단)
 */
public final class ConsoleTable {

    static final int TITLE_WIDTH = 40;
    static final String NA = "N/A";

    private final PrintStream out;

    public ConsoleTable(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    public void print(ScanResult result) {
        List<String> mods = result.getModules();
        boolean status = mods.contains("status");
        boolean server = mods.contains("server");
        boolean title = mods.contains("title");

        List<String> header = new ArrayList<>(List.of("Subdomain"));
        if (status) { header.add("Status"); header.add("URL"); }
        if (server) header.add("Server");
        if (title) header.add("Title");

        List<List<String>> rows = new ArrayList<>();
        for (Record r : result.getRecords()) {
            List<String> row = new ArrayList<>();
            row.add(r.getHost());
            if (status) {
                Object sc = r.get("status_code");
                row.add(sc == null ? (r.getError() != null ? r.getError().kind().name() : NA) : String.valueOf(sc));
                row.add(r.getUrl() == null ? NA : r.getUrl());
            }
            if (server) row.add(orNa(r.get("server")));
            if (title) row.add(truncate(orNa(r.get("title")), TITLE_WIDTH));
            rows.add(row);
        }

        int[] widths = new int[header.size()];
        for (int i = 0; i < header.size(); i++) widths[i] = header.get(i).length();
        for (List<String> row : rows) {
            for (int i = 0; i < row.size(); i++) widths[i] = Math.max(widths[i], row.get(i).length());
        }

        printRow(header, widths);
        StringBuilder sep = new StringBuilder();
        for (int i = 0; i < widths.length; i++) {
            if (i > 0) sep.append("-+-");
            sep.append("-".repeat(widths[i]));
        }
        out.println(sep);
        for (List<String> row : rows) printRow(row, widths);

        out.println();
        out.println("Total: " + result.getCompleted() + " subdomains processed"
                + (result.isCancelled() ? " (cancelled, " + result.getTotal() + " requested)" : ""));
    }

    private void printRow(List<String> cells, int[] widths) {
        StringBuilder b = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) b.append(" | ");
            String c = cells.get(i);
            b.append(c);
            if (i < cells.size() - 1) b.append(" ".repeat(widths[i] - c.length()));
        }
        out.println(b);
    }

    static String truncate(String s, int width) {
        if (s.length() <= width) return s;
        return s.substring(0, width - 3) + "...";
    }

    private static String orNa(Object v) {
        return (v == null ? NA : String.valueOf(v));
    }
}
