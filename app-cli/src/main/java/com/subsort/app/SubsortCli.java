package com.subsort.app;

import com.subsort.app.logging.LogSetup;
import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.config.ConfigException;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.model.ScanResult;
import com.subsort.core.scanner.ModuleRegistry;
import com.subsort.core.service.ScanService;
import com.subsort.core.service.export.ExportCoordinator;
import com.subsort.core.service.export.OutputFormat;
import com.subsort.core.service.export.ReportNaming;
import com.subsort.core.util.HostListReader;
import com.subsort.core.util.ProgressListener;
import com.subsort.core.util.ScanStatsDumper;
import com.subsort.core.util.YamlConfigLoader;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * subsort 명령행 진입점.
 * 종료 코드: 0 = 완료/취소(부분 결과 기록), 1 = 사용법/입력 오류, 2 = 설정 오류
 */
public final class SubsortCli {

    private static final Logger LOG = LoggerFactory.getLogger(SubsortCli.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_CONFIG = 2;

    private static final String USAGE = "subsort -i <hosts.txt> [--status] [--server] [--title] [options]";

    private static final String BANNER = String.join(System.lineSeparator(),
            " ____        _     ____             _   ",
            "/ ___| _   _| |__ / ___|  ___  _ __| |_ ",
            "\\___ \\| | | | '_ \\\\___ \\ / _ \\| '__| __|",
            " ___) | |_| | |_) |___) | (_) | |  | |_ ",
            "|____/ \\__,_|_.__/|____/ \\___/|_|   \\__|",
            "",
            "Concurrent subdomain recon scanner");

    private SubsortCli() {}

    public static void main(String[] args) {
        // vhost 모듈의 Host 헤더 오버라이드(HttpClient 로딩 전)
        if (System.getProperty("jdk.httpclient.allowRestrictedHeaders") == null) {
            System.setProperty("jdk.httpclient.allowRestrictedHeaders", "host");
        }
        AtomicBoolean cancel = new AtomicBoolean(false);
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            if (finished.getCount() == 0) return;
            cancel.set(true);
            System.err.println();
            System.err.println("Interrupted: finishing in-flight hosts and writing partial results...");
            try {
                finished.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "subsort-shutdown");
        Runtime.getRuntime().addShutdownHook(hook);

        int code;
        try {
            code = run(args, System.in, System.out, System.err, cancel);
        } finally {
            finished.countDown();
        }
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            // 이미 종료 중: 훅이 latch 해제를 기다리고 있으므로 그대로 빠진다
            LOG.debug("Shutdown in progress; exiting with {}", code);
            return;
        }
        System.exit(code);
    }

    /** 테스트용 진입점: System.exit 없이 종료 코드 반환 */
    static int run(String[] args, InputStream stdin, PrintStream out, PrintStream err, AtomicBoolean cancel) {
        Options options = options();
        CommandLine cmd;
        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (ParseException e) {
            err.println(e.getMessage());
            printHelp(options, err);
            return EXIT_USAGE;
        }
        if (cmd.hasOption("help")) {
            printHelp(options, out);
            return EXIT_OK;
        }
        if (cmd.hasOption("list-modules")) {
            listModules(out);
            return EXIT_OK;
        }

        boolean silent = cmd.hasOption("silent");
        if (!silent) {
            err.println(BANNER);
            err.println();
        }
        LogSetup.init(cmd.hasOption("verbose"),
                cmd.hasOption("log-file") ? Path.of(cmd.getOptionValue("log-file")) : null);

        ScanConfig cfg;
        OutputFormat format;
        try {
            cfg = buildConfig(cmd, err);
            format = resolveFormat(cmd);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        } catch (ConfigException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_CONFIG;
        } catch (IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }

        List<String> hosts;
        try {
            hosts = readHosts(cmd, stdin);
        } catch (UsageException | IOException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_USAGE;
        }
        if (hosts.isEmpty()) {
            err.println("Error: no hosts to scan");
            return EXIT_USAGE;
        }

        ScanService svc;
        try {
            svc = new ScanService(cfg);
        } catch (ConfigException e) {
            err.println("Config error: " + e.getMessage());
            return EXIT_CONFIG;
        }

        if (!silent) {
            err.println("Scanning " + hosts.size() + " hosts with modules " + cfg.getModules()
                    + " (threads=" + cfg.getConcurrency() + ", timeout=" + cfg.getTimeout().toSeconds() + "s)");
        }

        ProgressListener progress = (silent || cmd.hasOption("no-progress"))
                ? ProgressListener.NONE
                : new ProgressLine(err);

        ScanStatsDumper dumper = null;
        if (cmd.hasOption("stats-file")) {
            dumper = new ScanStatsDumper(svc::getRuntimeSnapshot, Path.of(cmd.getOptionValue("stats-file")), 1000);
            try {
                dumper.start();
            } catch (IOException e) {
                LOG.warn("Stats file disabled: {}", e.toString());
                dumper = null;
            }
        }

        ScanResult result;
        try {
            result = svc.run(hosts, progress, cancel);
        } finally {
            if (dumper != null) dumper.close();
        }
        if (progress instanceof ProgressLine pl) pl.finish();

        ExportCoordinator exports = new ExportCoordinator().withRuntime(svc);
        if (cmd.hasOption("output")) {
            try {
                Path written = exports.export(result, Path.of(cmd.getOptionValue("output")), format);
                if (!silent) err.println("Results saved to: " + written);
            } catch (IOException e) {
                err.println("Error: cannot write results: " + e.getMessage());
                return EXIT_USAGE;
            }
        } else {
            exports.printTable(result, out);
        }

        if (!silent) {
            err.printf(Locale.ROOT, "%s: %d/%d hosts, %d accessible, %d failed, %.1fs%n",
                    result.isCancelled() ? "Scan cancelled" : "Scan complete",
                    result.getCompleted(), result.getTotal(),
                    result.getAccessibleCount(), result.getFailedCount(),
                    result.getDuration().toMillis() / 1000.0);
        }
        return EXIT_OK;
    }

    /* ================= 옵션 ================= */

    static Options options() {
        Options o = new Options();
        o.addOption("h", "help", false, "Print this help message");
        o.addOption(Option.builder("i").longOpt("input").hasArg().argName("file")
                .desc("Input file with one host per line (default: stdin)").build());
        o.addOption(Option.builder("o").longOpt("output").hasArg().argName("file")
                .desc("Write results to a file or directory instead of the console table").build());
        o.addOption(Option.builder("f").longOpt("output-format").hasArg().argName("txt|json|csv")
                .desc("Output format (default: from the output file extension, else txt)").build());
        o.addOption(Option.builder().longOpt("config").hasArg().argName("scan.yml")
                .desc("Load defaults from a YAML file; command line options override it").build());

        o.addOption(null, "status", false, "Check HTTP status codes");
        o.addOption(null, "server", false, "Extract server information from headers");
        o.addOption(null, "title", false, "Extract page titles");
        o.addOption(Option.builder("m").longOpt("modules").hasArg().argName("a,b,c")
                .desc("Enable additional modules by name (see --list-modules)").build());
        o.addOption(null, "all-modules", false, "Enable every known module");
        o.addOption(null, "list-modules", false, "List known modules and their output fields");

        o.addOption(Option.builder("t").longOpt("threads").hasArg().argName("n")
                .desc("Concurrent hosts (default: 50, max: " + ScanConfig.MAX_CONCURRENCY + ")").build());
        o.addOption(Option.builder().longOpt("timeout").hasArg().argName("seconds")
                .desc("Request timeout in seconds (default: 5)").build());
        o.addOption(Option.builder().longOpt("retries").hasArg().argName("n")
                .desc("Retries after the first attempt (default: 3)").build());
        o.addOption(Option.builder().longOpt("delay").hasArg().argName("seconds")
                .desc("Delay before every request attempt (default: 0)").build());
        o.addOption(Option.builder().longOpt("rps").hasArg().argName("n")
                .desc("Global request rate limit, 0 = unlimited (default: 0)").build());
        o.addOption(Option.builder().longOpt("user-agent").hasArg().argName("ua")
                .desc("Fixed User-Agent (default: rotate a built-in pool)").build());
        o.addOption(null, "no-follow-redirects", false, "Do not follow HTTP redirects");
        o.addOption(null, "ignore-ssl", false, "Skip TLS certificate verification");
        o.addOption(null, "http-fallback", false, "Retry hosts without a scheme over http when https fails");
        o.addOption(Option.builder("H").longOpt("header").hasArg().argName("name:value")
                .desc("Extra request header (repeatable)").build());
        o.addOption(Option.builder().longOpt("ports").hasArg().argName("p1,p2")
                .desc("Ports probed by the ports module").build());

        o.addOption("v", "verbose", false, "Enable verbose logging");
        o.addOption(Option.builder().longOpt("log-file").hasArg().argName("file")
                .desc("Also write logs to a file").build());
        o.addOption(null, "silent", false, "Suppress the banner and progress output");
        o.addOption(null, "no-progress", false, "Do not draw the progress line");
        o.addOption(Option.builder().longOpt("stats-file").hasArg().argName("file")
                .desc("Append runtime telemetry as NDJSON every second").build());
        return o;
    }

    /** YAML(선택) 위에 CLI 값을 덮어쓴다. 검증은 ScanService 생성 시 */
    static ScanConfig buildConfig(CommandLine cmd, PrintStream err) throws IOException {
        ScanConfig cfg = cmd.hasOption("config")
                ? YamlConfigLoader.loadInto(Path.of(cmd.getOptionValue("config")), ScanConfig.defaults())
                : ScanConfig.defaults();

        if (cmd.hasOption("threads")) {
            int threads = parseInt(cmd, "threads");
            if (threads < 1) throw new UsageException("thread count must be at least 1");
            if (threads > ScanConfig.MAX_CONCURRENCY) {
                err.println("Warning: thread count limited to " + ScanConfig.MAX_CONCURRENCY + " for stability");
                LOG.warn("Thread count {} clamped to {}", threads, ScanConfig.MAX_CONCURRENCY);
                threads = ScanConfig.MAX_CONCURRENCY;
            }
            cfg.setConcurrency(threads);
        }
        if (cmd.hasOption("timeout")) {
            double sec = parseDouble(cmd, "timeout");
            if (sec <= 0) throw new UsageException("timeout must be > 0");
            cfg.setTimeoutMs(Math.round(sec * 1000));
        }
        if (cmd.hasOption("retries")) cfg.setMaxRetries(parseInt(cmd, "retries"));
        if (cmd.hasOption("delay")) {
            double sec = parseDouble(cmd, "delay");
            if (sec < 0) throw new UsageException("delay must be >= 0");
            cfg.setDelay(Duration.ofMillis(Math.round(sec * 1000)));
        }
        if (cmd.hasOption("rps")) cfg.setRps(parseInt(cmd, "rps"));
        if (cmd.hasOption("user-agent")) cfg.setUserAgent(cmd.getOptionValue("user-agent"));
        if (cmd.hasOption("no-follow-redirects")) cfg.setFollowRedirects(false);
        if (cmd.hasOption("ignore-ssl")) cfg.setIgnoreSsl(true);
        if (cmd.hasOption("http-fallback")) cfg.setHttpFallback(true);
        for (Map.Entry<String, String> h : parseHeaders(cmd.getOptionValues("header")).entrySet()) {
            cfg.addHeader(h.getKey(), h.getValue());
        }
        if (cmd.hasOption("ports")) cfg.setPorts(parsePorts(cmd.getOptionValue("ports")));

        Set<String> modules = selectedModules(cmd);
        if (!modules.isEmpty()) cfg.setModules(modules);
        return cfg;
    }

    /** 플래그/목록/--all-modules 의 합집합. 비어 있으면 설정값(기본 status) 유지 */
    static Set<String> selectedModules(CommandLine cmd) {
        Set<String> out = new LinkedHashSet<>();
        if (cmd.hasOption("all-modules")) {
            out.addAll(ModuleRegistry.defaultRegistry().names());
        }
        if (cmd.hasOption("status")) out.add("status");
        if (cmd.hasOption("server")) out.add("server");
        if (cmd.hasOption("title")) out.add("title");
        String[] lists = cmd.getOptionValues("modules");
        if (lists != null) {
            for (String list : lists) {
                for (String n : list.split(",")) {
                    String s = n.trim().toLowerCase(Locale.ROOT);
                    if (!s.isEmpty()) out.add(s);
                }
            }
        }
        return out;
    }

    static OutputFormat resolveFormat(CommandLine cmd) {
        if (cmd.hasOption("output-format")) {
            try {
                return OutputFormat.of(cmd.getOptionValue("output-format"));
            } catch (IllegalArgumentException e) {
                throw new UsageException(e.getMessage());
            }
        }
        if (cmd.hasOption("output")) {
            OutputFormat guessed = ReportNaming.guess(Path.of(cmd.getOptionValue("output")));
            if (guessed != null) return guessed;
        }
        return OutputFormat.TXT;
    }

    static Map<String, String> parseHeaders(String[] raw) {
        Map<String, String> out = new LinkedHashMap<>();
        if (raw == null) return out;
        for (String h : raw) {
            int idx = h.indexOf(':');
            if (idx <= 0) throw new UsageException("header must be name:value: " + h);
            String name = h.substring(0, idx).trim();
            if (name.isEmpty()) throw new UsageException("header must be name:value: " + h);
            out.put(name, h.substring(idx + 1).trim());
        }
        return out;
    }

    static List<Integer> parsePorts(String raw) {
        List<Integer> out = new ArrayList<>();
        for (String p : raw.split(",")) {
            String s = p.trim();
            if (s.isEmpty()) continue;
            try {
                out.add(Integer.parseInt(s));
            } catch (NumberFormatException e) {
                throw new UsageException("invalid port: " + s);
            }
        }
        return out;
    }

    private static List<String> readHosts(CommandLine cmd, InputStream stdin) throws IOException {
        if (cmd.hasOption("input")) {
            return HostListReader.read(Path.of(cmd.getOptionValue("input")));
        }
        if (stdin == System.in && System.console() != null) {
            throw new UsageException("no input: use -i <file> or pipe hosts on stdin");
        }
        return HostListReader.read(stdin);
    }

    private static int parseInt(CommandLine cmd, String opt) {
        String v = cmd.getOptionValue(opt);
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + opt + " expects an integer: " + v);
        }
    }

    private static double parseDouble(CommandLine cmd, String opt) {
        String v = cmd.getOptionValue(opt);
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("--" + opt + " expects a number: " + v);
        }
    }

    private static void listModules(PrintStream out) {
        for (IAnalysisModule m : ModuleRegistry.defaultRegistry().all()) {
            out.printf(Locale.ROOT, "%-14s %s%n", m.name(), String.join(", ", m.fields()));
        }
    }

    private static void printHelp(Options options, PrintStream to) {
        PrintWriter pw = new PrintWriter(to);
        new HelpFormatter().printHelp(pw, 119, USAGE, "", options, 2, 4, "");
        pw.flush();
    }

    /** 잘못된 명령행 값(종료 코드 1) */
    static final class UsageException extends IllegalArgumentException {
        UsageException(String message) { super(message); }
    }

    /** stderr 한 줄 진행 표시(\r 덮어쓰기) */
    static final class ProgressLine implements ProgressListener {
        private static final int WIDTH = 30;
        private final PrintStream err;
        private boolean drawn = false;

        ProgressLine(PrintStream err) { this.err = err; }

        @Override
        public synchronized void onProgress(double progress, String phase, long done, long total) {
            if (!"scan".equals(phase) || total <= 0) return;
            int filled = (int) Math.round(progress * WIDTH);
            err.print("\r[" + "#".repeat(filled) + ".".repeat(WIDTH - filled) + "] "
                    + done + "/" + total + String.format(Locale.ROOT, " (%.0f%%)", progress * 100));
            err.flush();
            drawn = true;
        }

        synchronized void finish() {
            if (drawn) err.println();
        }
    }
}
