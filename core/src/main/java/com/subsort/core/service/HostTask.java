package com.subsort.core.service;

import com.subsort.core.api.IHttpTransport;
import com.subsort.core.http.FetchOptions;
import com.subsort.core.http.RetryPolicy;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.Host;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.model.ScanError;
import com.subsort.core.util.RateLimiter;
import com.subsort.core.util.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 호스트 1건의 fetch + 재시도 상태 기계.
 * PENDING → FETCHING → (SUCCESS | RETRY_WAIT → FETCHING | FAILED | CANCELLED)
 * 매 시도 전: 취소 확인 → delay 대기 → 속도 제한 토큰 1개.
 */
public final class HostTask {

    private static final Logger LOG = LoggerFactory.getLogger(HostTask.class);

    public enum State { PENDING, FETCHING, RETRY_WAIT, SUCCESS, FAILED, CANCELLED }

    /** 종료 상태 + 응답(SUCCESS) 또는 에러(FAILED) */
    public record Outcome(Host host, State state, HttpResponseData response, ScanError error, int attempts) {
        public boolean isSuccess() { return state == State.SUCCESS; }

        /** 앞선 패스의 시도 횟수를 합산(http 폴백) */
        Outcome plusAttempts(int earlier) {
            return new Outcome(host, state, response, error, attempts + earlier);
        }
    }

    private final Host host;
    private final ScanConfig config;
    private final IHttpTransport transport;
    private final RetryPolicy policy;
    private final RateLimiter rateLimiter; // null이면 무제한
    private final Sleeper sleeper;
    private final AtomicBoolean cancel;

    private volatile State state = State.PENDING;

    public HostTask(Host host, ScanConfig config, IHttpTransport transport, RetryPolicy policy,
                    RateLimiter rateLimiter, Sleeper sleeper, AtomicBoolean cancel) {
        this.host = Objects.requireNonNull(host, "host");
        this.config = Objects.requireNonNull(config, "config");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.rateLimiter = rateLimiter;
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.cancel = (cancel == null ? new AtomicBoolean(false) : cancel);
    }

    public State state() { return state; }

    /** 인터럽트는 CANCELLED로 끝내고 인터럽트 플래그를 복원한다 */
    public Outcome run() {
        int attempt = 0;
        ScanError lastError = null;
        try {
            while (true) {
                if (cancelled()) return finish(State.CANCELLED, null, lastError, attempt);

                Duration delay = config.getDelay();
                if (!delay.isZero()) sleeper.sleep(delay);
                if (rateLimiter != null) rateLimiter.acquire();
                if (cancelled()) return finish(State.CANCELLED, null, lastError, attempt);

                attempt++;
                state = State.FETCHING;
                TransportException failure;
                try {
                    HttpResponseData resp = transport.fetch(host.getUrl(), FetchOptions.DEFAULT);
                    return finish(State.SUCCESS, resp, null, attempt);
                } catch (TransportException e) {
                    failure = e;
                } catch (RuntimeException e) {
                    LOG.warn("Unexpected transport failure for {}: {}", host.getRaw(), e.toString());
                    failure = new TransportException(ErrorKind.OTHER, e.toString(), e);
                }

                lastError = new ScanError(failure.getKind(), failure.getMessage());
                Optional<Duration> wait = policy.decide(attempt, failure);
                if (wait.isEmpty()) return finish(State.FAILED, null, lastError, attempt);

                LOG.debug("Retry {} for {} in {}ms ({})", attempt, host.getRaw(), wait.get().toMillis(), failure.getKind());
                state = State.RETRY_WAIT;
                sleeper.sleep(wait.get());
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return finish(State.CANCELLED, null, lastError, attempt);
        }
    }

    private boolean cancelled() {
        return cancel.get() || Thread.currentThread().isInterrupted();
    }

    private Outcome finish(State s, HttpResponseData resp, ScanError err, int attempts) {
        this.state = s;
        return new Outcome(host, s, resp, err, attempts);
    }
}
