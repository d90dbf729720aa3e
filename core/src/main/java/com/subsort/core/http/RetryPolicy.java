package com.subsort.core.http;

import com.subsort.core.model.ErrorKind;

import java.time.Duration;
import java.util.Optional;

/** 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터 시작(방금 실패한 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(ErrorKind kind, int attempt);
    /** attempt번째 실패 뒤의 대기 시간. */
    Duration nextDelay(int attempt);
    /** 최대 시도 횟수(첫 시도 포함). 예: maxRetries=3이면 4. */
    int maxAttempts();

    /** 값이 있으면 그만큼 쉬고 재시도, 비어 있으면 종료 */
    default Optional<Duration> decide(int attempt, TransportException error) {
        ErrorKind kind = (error == null ? ErrorKind.OTHER : error.getKind());
        return shouldRetry(kind, attempt) ? Optional.of(nextDelay(attempt)) : Optional.empty();
    }
}
