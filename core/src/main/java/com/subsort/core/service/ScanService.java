package com.subsort.core.service;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.api.IHttpTransport;
import com.subsort.core.http.CountingRetryPolicy;
import com.subsort.core.http.DefaultRetryPolicy;
import com.subsort.core.http.TransportFactory;
import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.Host;
import com.subsort.core.model.PartialRecord;
import com.subsort.core.model.Record;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.model.ScanError;
import com.subsort.core.model.ScanResult;
import com.subsort.core.model.ScanStats;
import com.subsort.core.scanner.ModuleContext;
import com.subsort.core.scanner.ModuleRegistry;
import com.subsort.core.util.DefaultSleeper;
import com.subsort.core.util.NamedThreadFactory;
import com.subsort.core.util.ProgressListener;
import com.subsort.core.util.RateLimiter;
import com.subsort.core.util.Sleeper;
import com.subsort.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스캔 오케스트레이터:
 *  - 호스트별 파이프라인: fetch(+재시도) → 모듈(우선순위 순) → 병합
 *  - Semaphore(concurrency) + 고정 스레드풀로 동시 실행 상한
 *  - 결과는 완료 순서가 아니라 입력 인덱스 순
 *  - 취소 플래그/인터럽트 시 디스패치 중단, 진행 중 작업은 다음 루프에서 CANCELLED
 *
 * 설정 오류(ConfigException)만 배치를 중단시키며 fetch 전에 던져진다.
 */
public final class ScanService {

    private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanService.class);

    private static final long SLOT_POLL_MS = 100;

    private final ScanStats stats = new ScanStats();
    private final ScanConfig config;            // 검증된 고정 사본
    private final TransportFactory transportFactory;
    private final List<IAnalysisModule> modules;
    private final ResultAggregator aggregator;
    private final Sleeper sleeper;

    /** 기본 구현(HttpTransport + 전체 모듈 레지스트리) */
    public ScanService(ScanConfig config) {
        this(config, TransportFactory.DEFAULT);
    }

    public ScanService(ScanConfig config, TransportFactory transportFactory) {
        this(config, transportFactory, ModuleRegistry.defaultRegistry());
    }

    /** DI/테스트/플러그인용 */
    public ScanService(ScanConfig config, TransportFactory transportFactory, ModuleRegistry registry) {
        this(config, transportFactory, registry, DefaultSleeper.INSTANCE);
    }

    ScanService(ScanConfig config, TransportFactory transportFactory, ModuleRegistry registry, Sleeper sleeper) {
        Objects.requireNonNull(config, "config");
        config.validate();
        this.config = config.copy();
        this.transportFactory = Objects.requireNonNull(transportFactory, "transportFactory");
        this.modules = Objects.requireNonNull(registry, "registry").resolve(this.config.getModules());
        this.aggregator = new ResultAggregator(modules);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    /* =========================
       실행 API (오버로드 3종)
       ========================= */

    public ScanResult run(List<String> hosts) {
        return run(hosts, ProgressListener.NONE, null);
    }

    public ScanResult run(List<String> hosts, ProgressListener listener) {
        return run(hosts, listener, null);
    }

    /** 진행률 + 취소 플래그(옵션) */
    public ScanResult run(List<String> hosts, ProgressListener listener, AtomicBoolean cancelFlag) {
        Objects.requireNonNull(hosts, "hosts");
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        final AtomicBoolean cancel = (cancelFlag != null) ? cancelFlag : new AtomicBoolean(false);
        final List<String> moduleNames = modules.stream().map(IAnalysisModule::name).toList();

        final int total = hosts.size();
        final int cc = config.getConcurrency();
        final Instant startedAt = Instant.now();
        LOG.info("Scan start: hosts={}, cc={}, timeout={}ms, retries={}, modules={}",
                total, cc, config.getTimeoutMs(), config.getMaxRetries(), moduleNames);
        SLOG.info("scan-start",
                "hosts", total,
                "cc", cc,
                "timeoutMs", config.getTimeoutMs(),
                "maxRetries", config.getMaxRetries(),
                "rps", config.getRps(),
                "modules", moduleNames);

        if (total == 0) {
            notify(pl, 1.0, "done", 0, 0);
            SLOG.info("scan-done", "completed", 0, "total", 0, "maxObservedCC", 0);
            return new ScanResult(List.of(), startedAt, Instant.now(), 0, false, moduleNames);
        }

        final Record[] slots = new Record[total];
        final RateLimiter limiter = RateLimiter.perSecond(config.getRps());
        final Semaphore slotsFree = new Semaphore(cc);
        final AtomicInteger inFlight = new AtomicInteger(0);
        final AtomicInteger done = new AtomicInteger(0);

        notify(pl, 0.0, "scan", 0, total);

        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("scan-worker"));

        try (IHttpTransport transport = transportFactory.create(config)) {
            final List<Future<?>> futures = new ArrayList<>(total);
            try {
                // ---- 1) 디스패치: 슬롯 1개 = 파이프라인 1개 ----
                for (int i = 0; i < total; i++) {
                    if (!acquireSlot(slotsFree, cancel)) break;
                    final int index = i;
                    final String raw = hosts.get(i);
                    try {
                        futures.add(exec.submit(() -> {
                            int cur = inFlight.incrementAndGet();
                            stats.observeConcurrency(cur);
                            try {
                                Record r = scanSafely(raw, transport, limiter, cancel);
                                if (r != null) {
                                    stats.hostFinished(r.getError() != null);
                                    slots[index] = r;
                                    int d = done.incrementAndGet();
                                    notify(pl, (double) d / total, "scan", d, total);
                                }
                            } finally {
                                inFlight.decrementAndGet();
                                slotsFree.release();
                            }
                        }));
                    } catch (RuntimeException e) {
                        slotsFree.release();
                        throw e;
                    }
                }

                // ---- 2) 진행 중 작업 대기(각 요청은 timeout으로 보호됨) ----
                for (Future<?> f : futures) {
                    try {
                        f.get();
                    } catch (ExecutionException e) {
                        Throwable cause = (e.getCause() != null ? e.getCause() : e);
                        LOG.warn("Scan task failed: {}", cause.toString());
                        SLOG.error("task-failed", cause, "cause", cause.toString());
                    }
                }
            } catch (InterruptedException ie) {
                cancel.set(true);
                Thread.currentThread().interrupt();
                LOG.info("Scan interrupted; stopping workers");
            } finally {
                // ---- 3) 종료 ----
                exec.shutdown();
                try {
                    if (!exec.awaitTermination(config.getTimeoutMs() * 2 + 1000, TimeUnit.MILLISECONDS)) {
                        exec.shutdownNow();
                    }
                } catch (InterruptedException ie) {
                    exec.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }

        List<Record> records = new ArrayList<>(total);
        Arrays.stream(slots).filter(Objects::nonNull).forEach(records::add);
        boolean cancelled = cancel.get();
        Instant finishedAt = Instant.now();
        ScanStats.Snapshot snap = stats.snapshot();

        if (cancelled) {
            LOG.info("Scan cancelled: completed {}/{}", records.size(), total);
            SLOG.warn("scan-cancelled", "completed", records.size(), "total", total);
        }
        notify(pl, (double) records.size() / total, "done", records.size(), total);

        LOG.info("Scan done. completed={}/{}, accessible={}, maxObservedCC={}",
                records.size(), total, records.stream().filter(Record::isAccessible).count(),
                snap.maxObservedConcurrency);
        SLOG.info("scan-done",
                "completed", records.size(),
                "total", total,
                "requests", snap.requestsTotal,
                "retries", snap.retriesTotal,
                "maxObservedCC", snap.maxObservedConcurrency,
                "elapsedMs", finishedAt.toEpochMilli() - startedAt.toEpochMilli());
        return new ScanResult(records, startedAt, finishedAt, total, cancelled, moduleNames);
    }

    /* =========================
       호스트 1건 파이프라인
       ========================= */

    /** scanOne에서 새어 나온 Error도 실패 Record로 남긴다. 입력 1줄 = Record 1개 */
    private Record scanSafely(String raw, IHttpTransport transport, RateLimiter limiter, AtomicBoolean cancel) {
        try {
            return scanOne(raw, transport, limiter, cancel);
        } catch (Throwable t) {
            if (t instanceof VirtualMachineError && !(t instanceof StackOverflowError)) throw (VirtualMachineError) t;
            LOG.warn("Unexpected error scanning {}: {}", raw, t.toString());
            SLOG.error("host-failed", t, "host", raw, "kind", ErrorKind.OTHER.name());
            return aggregator.failed(raw, null, new ScanError(ErrorKind.OTHER, t.toString()), 0);
        }
    }

    /** @return 완료된 Record, 취소되면 null */
    private Record scanOne(String raw, IHttpTransport transport, RateLimiter limiter, AtomicBoolean cancel) {
        if (isCancelled(cancel)) return null;
        long t0 = System.nanoTime();
        int attempts = 0;
        int retries = 0;
        Host host = null;
        try {
            try {
                host = Host.of(raw, config.getDefaultScheme());
            } catch (IllegalArgumentException e) {
                LOG.debug("Invalid host '{}': {}", raw, e.getMessage());
                SLOG.warn("host-failed", "host", raw, "kind", ErrorKind.OTHER.name(), "error", e.getMessage());
                return aggregator.failed(raw, null, new ScanError(ErrorKind.OTHER, "invalid host: " + e.getMessage()), 0);
            }

            // ---- fetch(+재시도) ----
            CountingRetryPolicy policy = new CountingRetryPolicy(DefaultRetryPolicy.from(config));
            HostTask.Outcome outcome = new HostTask(host, config, transport, policy, limiter, sleeper, cancel).run();
            retries += policy.getRetryCount();

            if (outcome.state() == HostTask.State.FAILED && shouldFallback(host)) {
                LOG.debug("HTTPS failed for {} ({}); falling back to http", raw, outcome.error().kind());
                CountingRetryPolicy second = new CountingRetryPolicy(DefaultRetryPolicy.from(config));
                HostTask.Outcome plain = new HostTask(host.withScheme("http"), config, transport, second,
                        limiter, sleeper, cancel).run();
                retries += second.getRetryCount();
                outcome = plain.plusAttempts(outcome.attempts());
            }
            attempts = outcome.attempts();
            if (outcome.state() == HostTask.State.CANCELLED) return null;

            // ---- 모듈(고정 순서) ----
            List<ModuleOutcome> partials = new ArrayList<>(modules.size());
            if (outcome.isSuccess()) {
                // 취소 후에는 ctx.fetch가 즉시 실패하므로 남은 모듈은 module_errors로 표시된다
                for (IAnalysisModule m : modules) {
                    partials.add(runModule(m, outcome, transport, limiter, cancel));
                }
            }

            Record record = aggregator.merge(outcome.host(), outcome, partials);
            if (record.getError() != null) {
                SLOG.warn("host-failed",
                        "host", raw,
                        "kind", record.getError().kind().name(),
                        "error", record.getError().message(),
                        "attempts", attempts);
            } else {
                SLOG.debug("host-done",
                        "host", raw,
                        "status", record.get("status_code"),
                        "accessible", record.isAccessible(),
                        "attempts", attempts,
                        "moduleErrors", record.getModuleErrors().size());
            }
            return record;

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return null;
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure scanning {}: {}", raw, e.toString());
            SLOG.error("host-failed", e, "host", raw, "kind", ErrorKind.OTHER.name());
            String url = (host == null ? null : host.getUrl().toString());
            return aggregator.failed(raw, url, new ScanError(ErrorKind.OTHER, e.toString()), attempts);
        } finally {
            stats.addAttempts(attempts);
            stats.addRetries(retries);
            stats.addWallTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0));
        }
    }

    /** analyze 예외(스택 오버플로 포함)는 모듈 실패로만 기록. 인터럽트는 호스트 취소로 전파 */
    private ModuleOutcome runModule(IAnalysisModule m, HostTask.Outcome outcome,
                                    IHttpTransport transport, RateLimiter limiter,
                                    AtomicBoolean cancel) throws InterruptedException {
        ModuleContext ctx = new ModuleContext(outcome.host(), config, transport, limiter,
                config.getModuleBudget(), cancel);
        try {
            PartialRecord pr = m.analyze(outcome.response(), ctx);
            if (pr == null) return ModuleOutcome.ok(PartialRecord.of(m.name()));
            if (!m.name().equals(pr.module())) {
                return ModuleOutcome.ok(copyAs(m.name(), pr));
            }
            return ModuleOutcome.ok(pr);
        } catch (InterruptedException ie) {
            throw ie;
        } catch (Exception e) {
            String msg = (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            LOG.debug("Module {} failed for {}: {}", m.name(), outcome.host().getRaw(), msg);
            return ModuleOutcome.failed(m.name(), msg);
        } catch (StackOverflowError e) {
            LOG.warn("Module {} overflowed the stack for {}", m.name(), outcome.host().getRaw());
            return ModuleOutcome.failed(m.name(), "stack overflow while analyzing response");
        }
    }

    private static PartialRecord copyAs(String module, PartialRecord src) {
        PartialRecord out = PartialRecord.of(module);
        src.fields().forEach(out::put);
        return out;
    }

    private boolean shouldFallback(Host host) {
        return config.isHttpFallback()
                && !host.isSchemeExplicit()
                && "https".equals(host.getUrl().getScheme());
    }

    /* =========================
       공용 유틸 / 게터
       ========================= */

    /** 취소되면 false. 인터럽트는 호출자에게 그대로 전달 */
    private static boolean acquireSlot(Semaphore sem, AtomicBoolean cancel) throws InterruptedException {
        while (!isCancelled(cancel)) {
            if (sem.tryAcquire(SLOT_POLL_MS, TimeUnit.MILLISECONDS)) {
                if (isCancelled(cancel)) {
                    sem.release();
                    return false;
                }
                return true;
            }
        }
        if (Thread.currentThread().isInterrupted()) throw new InterruptedException("interrupted while dispatching");
        return false;
    }

    private static boolean isCancelled(AtomicBoolean flag) {
        return Thread.currentThread().isInterrupted() || (flag != null && flag.get());
    }

    private static void notify(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.warn("Progress listener failed: {}", e.toString());
        }
    }

    public ScanStats.Snapshot getRuntimeSnapshot() {
        return stats.snapshot();
    }

    /** 실행 순서대로 정렬된 활성 모듈 */
    public List<IAnalysisModule> getModules() {
        return modules;
    }

    public ScanConfig getConfig() {
        return config;
    }
}
