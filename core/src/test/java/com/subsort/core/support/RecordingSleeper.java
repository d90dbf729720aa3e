package com.subsort.core.support;

import com.subsort.core.util.Sleeper;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** 실제로 자지 않고 요청된 대기만 기록 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> sleeps = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void sleep(Duration d) throws InterruptedException {
        sleeps.add(d);
    }

    public List<Duration> sleeps() {
        synchronized (sleeps) { return List.copyOf(sleeps); }
    }
}
