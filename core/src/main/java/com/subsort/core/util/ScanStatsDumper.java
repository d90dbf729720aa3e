package com.subsort.core.util;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.subsort.core.model.ScanStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 스캔 도중 런타임 텔레메트리를 NDJSON(라인당 JSON 1개)으로 덧붙인다.
 * close() 시 마지막 스냅샷을 한 줄 더 남긴다.
 */
public final class ScanStatsDumper implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(ScanStatsDumper.class);
    private static final long MIN_PERIOD_MS = 500L;

    private final Supplier<ScanStats.Snapshot> source;
    private final Path outFile;
    private final long periodMs;
    private final ScheduledExecutorService timer =
            Executors.newSingleThreadScheduledExecutor(new NamedThreadFactory("subsort-stats"));

    private BufferedWriter writer; // guarded by this
    private boolean started;
    private boolean closed;

    public ScanStatsDumper(Supplier<ScanStats.Snapshot> source, Path outFile, long periodMs) {
        this.source = Objects.requireNonNull(source, "source");
        this.outFile = Objects.requireNonNull(outFile, "outFile");
        this.periodMs = Math.max(MIN_PERIOD_MS, periodMs);
    }

    /** 파일을 열고 주기 기록을 시작한다. 두 번째 호출부터는 무시 */
    public synchronized void start() throws IOException {
        if (started || closed) return;
        Path parent = outFile.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        writer = Files.newBufferedWriter(outFile, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        timer.scheduleAtFixedRate(this::tick, 0L, periodMs, TimeUnit.MILLISECONDS);
        started = true;
    }

    private void tick() {
        try {
            emit(source.get());
        } catch (IOException | RuntimeException e) {
            LOG.warn("Stats dump failed: {}", e.toString());
        }
    }

    private synchronized void emit(ScanStats.Snapshot s) throws IOException {
        if (s == null || writer == null) return;
        writer.write(line(s));
        writer.newLine();
        writer.flush();
    }

    static String line(ScanStats.Snapshot s) throws IOException {
        ObjectNode n = Json.mapper().createObjectNode()
                .put("ts", Instant.now().toString())
                .put("requestsTotal", s.requestsTotal)
                .put("retriesTotal", s.retriesTotal)
                .put("avgLatencyMs", s.avgLatencyMs)
                .put("maxObservedConcurrency", s.maxObservedConcurrency)
                .put("hostsDone", s.hostsDone)
                .put("hostsFailed", s.hostsFailed);
        return Json.mapper().writeValueAsString(n);
    }

    @Override
    public void close() {
        timer.shutdownNow();
        synchronized (this) {
            if (closed) return;
            closed = true;
            if (writer == null) return;
            try {
                emit(source.get());
                writer.close();
            } catch (IOException e) {
                LOG.warn("Stats dump close failed: {}", e.toString());
            } finally {
                writer = null;
            }
        }
    }
}
