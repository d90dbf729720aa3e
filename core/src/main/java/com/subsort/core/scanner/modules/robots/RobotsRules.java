package com.subsort.core.scanner.modules.robots;

import java.util.ArrayList;
import java.util.List;

/** User-agent 그룹 1개의 규칙 */
public final class RobotsRules {
    public final List<String> allow = new ArrayList<>();
    public final List<String> disallow = new ArrayList<>();
    private Integer crawlDelay;

    public RobotsRules addAllow(String path) {
        if (path != null && !path.isBlank()) allow.add(path.trim());
        return this;
    }

    public RobotsRules addDisallow(String path) {
        // Disallow: (빈값) 은 규칙으로 취급하지 않음
        if (path != null && !path.isBlank()) disallow.add(path.trim());
        return this;
    }

    public RobotsRules crawlDelay(Integer seconds) {
        if (seconds != null && crawlDelay == null) crawlDelay = seconds;
        return this;
    }

    public Integer crawlDelay() { return crawlDelay; }
}
