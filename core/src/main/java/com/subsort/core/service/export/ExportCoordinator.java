package com.subsort.core.service.export;

import com.subsort.core.model.ScanResult;
import com.subsort.core.service.ScanService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * 결과 출력 진입점.
 * - output 이 있으면 임시 파일에 쓴 뒤 원자적 이동(실패 시 임시 파일 삭제)
 * - 없으면 ConsoleTable 로 콘솔 출력
 */
public final class ExportCoordinator {

    private static final Logger LOG = LoggerFactory.getLogger(ExportCoordinator.class);

    private ScanService runtimeSource;

    /** 필요 시 런타임 통계 주입(JSON에만 반영) */
    public ExportCoordinator withRuntime(ScanService svc) {
        this.runtimeSource = svc;
        return this;
    }

    public ResultExporter exporterFor(OutputFormat format) {
        ResultExporter ex = format.exporter();
        if (ex instanceof JsonResultExporter json && runtimeSource != null) json.withRuntime(runtimeSource);
        return ex;
    }

    /**
     * @param output 파일 또는 디렉터리(디렉터리면 ReportNaming 기본 이름)
     * @return 실제로 쓴 파일
     */
    public Path export(ScanResult result, Path output, OutputFormat format) throws IOException {
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(output, "output");
        Objects.requireNonNull(format, "format");

        Path target = ReportNaming.resolve(output, result.getStartedAt(), format).toAbsolutePath();
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = target.resolveSibling(target.getFileName().toString() + ".tmp");
        try {
            try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                exporterFor(format).write(result, w);
            }
            moveIntoPlace(tmp, target);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(tmp);
            throw e;
        }
        LOG.info("Results written ({}): {} ({} records)", format.extension(), target, result.getCompleted());
        return target;
    }

    public void printTable(ScanResult result, PrintStream out) {
        new ConsoleTable(out).print(result);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            LOG.debug("Atomic move unsupported for {}; falling back to plain move", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path p) {
        try {
            Files.deleteIfExists(p);
        } catch (IOException e) {
            LOG.debug("Could not delete temp file {}: {}", p, e.toString());
        }
    }
}
