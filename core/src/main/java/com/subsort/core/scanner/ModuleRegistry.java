package com.subsort.core.scanner;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.config.ConfigException;
import com.subsort.core.scanner.modules.AuthModule;
import com.subsort.core.scanner.modules.CnameModule;
import com.subsort.core.scanner.modules.FaviconModule;
import com.subsort.core.scanner.modules.JsModule;
import com.subsort.core.scanner.modules.JsVulnModule;
import com.subsort.core.scanner.modules.JwtModule;
import com.subsort.core.scanner.modules.LoginPanelsModule;
import com.subsort.core.scanner.modules.PortsModule;
import com.subsort.core.scanner.modules.ResponseTimeModule;
import com.subsort.core.scanner.modules.RobotsModule;
import com.subsort.core.scanner.modules.ServerModule;
import com.subsort.core.scanner.modules.StatusModule;
import com.subsort.core.scanner.modules.TechstackModule;
import com.subsort.core.scanner.modules.TitleModule;
import com.subsort.core.scanner.modules.VhostModule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * 알려진 모듈의 명시적 목록(런타임 탐색 없음).
 * resolve()는 설정 순서와 무관하게 priority → name 순으로 정렬해 돌려준다.
 */
public final class ModuleRegistry {

    private static final Comparator<IAnalysisModule> ORDER =
            Comparator.comparingInt(IAnalysisModule::priority).thenComparing(IAnalysisModule::name);

    private final Map<String, IAnalysisModule> known = new LinkedHashMap<>();

    public ModuleRegistry(List<? extends IAnalysisModule> modules) {
        for (IAnalysisModule m : modules) {
            String key = m.name().toLowerCase(Locale.ROOT);
            if (known.putIfAbsent(key, m) != null) {
                throw new IllegalArgumentException("duplicate module name: " + key);
            }
        }
    }

    public static ModuleRegistry defaultRegistry() {
        return new ModuleRegistry(List.of(
                new StatusModule(),
                new ServerModule(),
                new TitleModule(),
                new AuthModule(),
                new CnameModule(),
                new FaviconModule(),
                new JsModule(),
                new JsVulnModule(),
                new JwtModule(),
                new LoginPanelsModule(),
                new PortsModule(),
                new ResponseTimeModule(),
                new RobotsModule(),
                new TechstackModule(),
                new VhostModule()
        ));
    }

    /** 실행 순서대로 정렬된 전체 모듈 */
    public List<IAnalysisModule> all() {
        List<IAnalysisModule> out = new ArrayList<>(known.values());
        out.sort(ORDER);
        return out;
    }

    public List<String> names() {
        return all().stream().map(IAnalysisModule::name).toList();
    }

    public Optional<IAnalysisModule> find(String name) {
        if (name == null) return Optional.empty();
        return Optional.ofNullable(known.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * @throws ConfigException 알 수 없는 이름, 빈 목록, 모듈 간 필드 충돌
     */
    public List<IAnalysisModule> resolve(Collection<String> names) {
        if (names == null || names.isEmpty()) {
            throw new ConfigException("at least one module must be enabled");
        }
        List<IAnalysisModule> picked = new ArrayList<>();
        for (String n : names) {
            IAnalysisModule m = find(n).orElseThrow(() ->
                    new ConfigException("unknown module: " + n + " (known: " + String.join(", ", names()) + ")"));
            if (!picked.contains(m)) picked.add(m);
        }
        picked.sort(ORDER);

        Map<String, String> owner = new HashMap<>();
        for (IAnalysisModule m : picked) {
            for (String f : m.fields()) {
                String prev = owner.putIfAbsent(f, m.name());
                if (prev != null) {
                    throw new ConfigException("field collision: '" + f + "' declared by both "
                            + prev + " and " + m.name());
                }
            }
        }
        return List.copyOf(picked);
    }
}
