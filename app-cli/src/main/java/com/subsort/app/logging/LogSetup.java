package com.subsort.app.logging;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.ConsoleHandler;
import java.util.logging.FileHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * java.util.logging 전역 설정(SLF4J는 slf4j-jdk14 바인딩으로 여기로 모인다).
 * - 콘솔(stderr): 기본 WARNING, -v 면 FINE
 * - --log-file 지정 시 사이즈 롤링 파일(기본 2MB x 5)
 * System props:
 *  -Dsubsort.log.level=FINE|INFO|WARNING|SEVERE (CLI 플래그보다 우선)
 *  -Dsubsort.log.sizeMb=2
 *  -Dsubsort.log.files=5
 */
public final class LogSetup {
    private LogSetup() {}

    private static volatile boolean initialized = false; // 재초기화 방지
    private static final Formatter LINE_FORMATTER = new LineFormatter();

    /**
     * @param verbose -v 여부
     * @param logFile null이면 콘솔만
     */
    public static synchronized void init(boolean verbose, Path logFile) {
        if (initialized) return;
        initialized = true;

        Level level = resolveLevel(verbose);
        LogManager.getLogManager().reset();
        Logger root = Logger.getLogger("");

        ConsoleHandler console = new ConsoleHandler();
        console.setLevel(level);
        console.setFormatter(LINE_FORMATTER);
        root.addHandler(console);
        root.setLevel(level);

        if (logFile != null) {
            try {
                Path parent = logFile.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                int sizeMb = parseInt(System.getProperty("subsort.log.sizeMb"), 2);
                int fileCnt = parseInt(System.getProperty("subsort.log.files"), 5);
                FileHandler file = new FileHandler(logFile.toString(), sizeMb * 1024 * 1024, fileCnt, true);
                // 파일은 항상 INFO 이상을 남긴다
                Level fileLevel = level.intValue() < Level.INFO.intValue() ? level : Level.INFO;
                file.setLevel(fileLevel);
                file.setFormatter(LINE_FORMATTER);
                root.addHandler(file);
                if (fileLevel.intValue() < root.getLevel().intValue()) root.setLevel(fileLevel);
            } catch (IOException e) {
                // 콘솔에만 남기고 진행
                Logger.getLogger(LogSetup.class.getName()).log(Level.WARNING,
                        "Log file setup failed: " + e.getMessage(), e);
            }
        }

        Logger.getLogger(LogSetup.class.getName()).log(Level.FINE,
                () -> "Log initialized. level=" + level.getName() + ", file=" + logFile);
    }

    /** 런타임에 로그 레벨 변경 (모든 핸들러) */
    public static void setLevel(Level level) {
        if (level == null) level = Level.INFO;
        Logger root = Logger.getLogger("");
        root.setLevel(level);
        for (Handler h : root.getHandlers()) {
            h.setLevel(level);
        }
    }

    static Level resolveLevel(boolean verbose) {
        String sys = System.getProperty("subsort.log.level");
        if (sys != null && !sys.isBlank()) return levelOf(sys);
        return verbose ? Level.FINE : Level.WARNING;
    }

    /** 문자열을 Level로(DEBUG/WARN 별칭 허용, 실패 시 INFO) */
    public static Level levelOf(String name) {
        String s = String.valueOf(name).trim().toUpperCase(Locale.ROOT);
        switch (s) {
            case "DEBUG": return Level.FINE;
            case "TRACE": return Level.FINEST;
            case "WARN": return Level.WARNING;
            case "ERROR": return Level.SEVERE;
            default:
                try { return Level.parse(s); }
                catch (IllegalArgumentException e) { return Level.INFO; }
        }
    }

    private static int parseInt(String s, int def) {
        try { return (s == null || s.isBlank()) ? def : Integer.parseInt(s.trim()); }
        catch (NumberFormatException ignored) { return def; }
    }

    /** 한 줄 포맷 + 스레드명 + 예외 스택 */
    private static final class LineFormatter extends Formatter {
        @Override public String format(LogRecord r) {
            String msg = formatMessage(r);
            String base = String.format(Locale.ROOT,
                    "%1$tF %1$tT.%1$tL [%2$s] (%3$s) %4$s - %5$s%n",
                    r.getMillis(), r.getLevel().getName(),
                    Thread.currentThread().getName(),
                    r.getLoggerName(), msg);

            Throwable t = r.getThrown();
            if (t == null) return base;

            StringWriter sw = new StringWriter(256);
            t.printStackTrace(new PrintWriter(sw));
            return base + sw + System.lineSeparator();
        }
    }
}
