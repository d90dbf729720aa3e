package com.subsort.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/** 입력 순서대로 정렬된 Record 목록 + 실행 메타데이터 */
public final class ScanResult {

    private final List<Record> records;
    private final Instant startedAt;
    private final Instant finishedAt;
    private final int total;
    private final boolean cancelled;
    private final List<String> modules;

    public ScanResult(List<Record> records, Instant startedAt, Instant finishedAt,
                      int total, boolean cancelled, List<String> modules) {
        this.records = List.copyOf(Objects.requireNonNull(records, "records"));
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
        this.finishedAt = Objects.requireNonNull(finishedAt, "finishedAt");
        this.total = total;
        this.cancelled = cancelled;
        this.modules = List.copyOf(modules);
    }

    public List<Record> getRecords() { return records; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }
    public Duration getDuration() { return Duration.between(startedAt, finishedAt); }
    public int getTotal() { return total; }
    public int getCompleted() { return records.size(); }
    public boolean isCancelled() { return cancelled; }
    public List<String> getModules() { return modules; }

    public long getAccessibleCount() {
        return records.stream().filter(Record::isAccessible).count();
    }

    /** 전송 단계에서 실패한 호스트(에러 보유) 수 */
    public long getFailedCount() {
        return records.stream().filter(r -> r.getError() != null).count();
    }
}
