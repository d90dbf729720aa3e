package com.subsort.core.http;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/** UA / Accept-Language 로테이션 풀 */
public final class UserAgents {

    public static final List<String> DEFAULT_POOL = List.of(
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36",
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:125.0) Gecko/20100101 Firefox/125.0",
            "Mozilla/5.0 (Macintosh; Intel Mac OS X 10.15; rv:125.0) Gecko/20100101 Firefox/125.0"
    );

    public static final List<String> ACCEPT_LANGUAGES = List.of(
            "en-US,en;q=0.9",
            "en-GB,en;q=0.8",
            "en-US,en;q=0.5",
            "de-DE,de;q=0.8,en;q=0.5",
            "fr-FR,fr;q=0.8,en;q=0.5"
    );

    private final String fixed;
    private final List<String> pool;

    public UserAgents(String fixed, List<String> pool) {
        this.fixed = fixed;
        this.pool = (pool == null || pool.isEmpty()) ? DEFAULT_POOL : List.copyOf(pool);
    }

    public String next() {
        if (fixed != null) return fixed;
        return pool.get(ThreadLocalRandom.current().nextInt(pool.size()));
    }

    public String nextAcceptLanguage() {
        return ACCEPT_LANGUAGES.get(ThreadLocalRandom.current().nextInt(ACCEPT_LANGUAGES.size()));
    }
}
