package com.subsort.core.service;

import com.subsort.core.http.DefaultRetryPolicy;
import com.subsort.core.http.TransportException;
import com.subsort.core.model.ErrorKind;
import com.subsort.core.model.Host;
import com.subsort.core.model.ScanConfig;
import com.subsort.core.support.FakeTransport;
import com.subsort.core.support.RecordingSleeper;
import com.subsort.core.support.Responses;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HostTaskTest {

    private static final Host HOST = Host.of("app.example.com", "https");

    private static HostTask task(ScanConfig cfg, FakeTransport t, RecordingSleeper sleeper, AtomicBoolean cancel) {
        return new HostTask(HOST, cfg, t, DefaultRetryPolicy.from(cfg), null, sleeper, cancel);
    }

    private static FakeTransport failing(ErrorKind kind) {
        return new FakeTransport().otherwise((u, o) -> { throw new TransportException(kind, kind.name()); });
    }

    @Test
    void first_attempt_success() {
        FakeTransport t = new FakeTransport().html("/", 200, "<p>hi</p>");
        RecordingSleeper sleeper = new RecordingSleeper();

        HostTask task = task(ScanConfig.defaults(), t, sleeper, null);
        HostTask.Outcome out = task.run();

        assertTrue(out.isSuccess());
        assertEquals(1, out.attempts());
        assertEquals(200, out.response().getStatusCode());
        assertNull(out.error());
        assertEquals(HostTask.State.SUCCESS, task.state());
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void timeouts_use_every_retry_with_exponential_backoff() {
        RecordingSleeper sleeper = new RecordingSleeper();

        HostTask.Outcome out = task(ScanConfig.defaults(), failing(ErrorKind.TIMEOUT), sleeper, null).run();

        assertEquals(HostTask.State.FAILED, out.state());
        assertEquals(4, out.attempts());
        assertEquals(ErrorKind.TIMEOUT, out.error().kind());
        assertThat(sleeper.sleeps()).hasSize(3);
        assertThat(sleeper.sleeps().get(0).toMillis()).isBetween(900L, 1100L);
        assertThat(sleeper.sleeps().get(1).toMillis()).isBetween(1800L, 2200L);
        assertThat(sleeper.sleeps().get(2).toMillis()).isBetween(3600L, 4400L);
    }

    @Test
    void tls_error_is_not_retried() {
        FakeTransport t = failing(ErrorKind.TLS_ERROR);
        RecordingSleeper sleeper = new RecordingSleeper();

        HostTask.Outcome out = task(ScanConfig.defaults(), t, sleeper, null).run();

        assertEquals(1, out.attempts());
        assertEquals(ErrorKind.TLS_ERROR, out.error().kind());
        assertThat(t.calls()).hasSize(1);
        assertThat(sleeper.sleeps()).isEmpty();
    }

    @Test
    void recovers_after_a_refused_connection() {
        AtomicInteger n = new AtomicInteger();
        FakeTransport t = new FakeTransport().on("/", (u, o) -> {
            if (n.incrementAndGet() == 1) throw new TransportException(ErrorKind.CONNECTION_REFUSED, "refused");
            return Responses.status(u, 204);
        });

        HostTask.Outcome out = task(ScanConfig.defaults(), t, new RecordingSleeper(), null).run();

        assertTrue(out.isSuccess());
        assertEquals(2, out.attempts());
    }

    @Test
    void configured_delay_precedes_every_attempt() {
        ScanConfig cfg = ScanConfig.defaults().setMaxRetries(1).setDelay(Duration.ofMillis(250));
        RecordingSleeper sleeper = new RecordingSleeper();

        HostTask.Outcome out = task(cfg, failing(ErrorKind.TIMEOUT), sleeper, null).run();

        assertEquals(2, out.attempts());
        // delay, backoff, delay
        assertThat(sleeper.sleeps()).hasSize(3);
        assertEquals(Duration.ofMillis(250), sleeper.sleeps().get(0));
        assertEquals(Duration.ofMillis(250), sleeper.sleeps().get(2));
    }

    @Test
    void preset_cancel_makes_no_request() {
        FakeTransport t = new FakeTransport();

        HostTask.Outcome out = task(ScanConfig.defaults(), t, new RecordingSleeper(), new AtomicBoolean(true)).run();

        assertEquals(HostTask.State.CANCELLED, out.state());
        assertEquals(0, out.attempts());
        assertThat(t.calls()).isEmpty();
    }

    @Test
    void cancel_during_backoff_stops_retrying() {
        AtomicBoolean cancel = new AtomicBoolean(false);
        RecordingSleeper sleeper = new RecordingSleeper() {
            @Override public void sleep(Duration d) throws InterruptedException {
                super.sleep(d);
                cancel.set(true);
            }
        };
        FakeTransport t = failing(ErrorKind.TIMEOUT);

        HostTask.Outcome out = task(ScanConfig.defaults(), t, sleeper, cancel).run();

        assertEquals(HostTask.State.CANCELLED, out.state());
        assertEquals(1, out.attempts());
        assertEquals(ErrorKind.TIMEOUT, out.error().kind());
        assertThat(t.calls()).hasSize(1);
    }

    @Test
    void unexpected_runtime_failure_becomes_other() {
        FakeTransport t = new FakeTransport().otherwise((u, o) -> { throw new IllegalStateException("boom"); });

        HostTask.Outcome out = task(ScanConfig.defaults(), t, new RecordingSleeper(), null).run();

        assertEquals(HostTask.State.FAILED, out.state());
        assertEquals(ErrorKind.OTHER, out.error().kind());
        assertThat(out.error().message()).contains("boom");
    }
}
