package com.subsort.core.util;

/** 진행률 콜백(관찰 전용). 리스너 예외는 스캔에 영향을 주지 않는다. */
@FunctionalInterface
public interface ProgressListener {
    /**
     * @param progress 0.0 ~ 1.0
     * @param phase    "scan" | "done"
     * @param done     완료 호스트 수
     * @param total    전체 호스트 수
     */
    void onProgress(double progress, String phase, long done, long total);

    ProgressListener NONE = (p, phase, d, t) -> {};
}
