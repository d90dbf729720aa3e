package com.subsort.core.scanner;

import com.subsort.core.api.IAnalysisModule;
import com.subsort.core.config.ConfigException;
import com.subsort.core.model.HttpResponseData;
import com.subsort.core.model.PartialRecord;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ModuleRegistryTest {

    /** 이름/필드만 가진 테스트 모듈 */
    private static IAnalysisModule stub(String name, int priority, String... fields) {
        return new IAnalysisModule() {
            @Override public String name() { return name; }
            @Override public int priority() { return priority; }
            @Override public List<String> fields() { return List.of(fields); }
            @Override public PartialRecord analyze(HttpResponseData r, ModuleContext c) {
                return PartialRecord.of(name);
            }
        };
    }

    @Test
    void default_registry_lists_every_module_in_execution_order() {
        assertThat(ModuleRegistry.defaultRegistry().names()).containsExactly(
                "status", "server", "title",
                "auth", "cname", "favicon", "js", "jsvuln", "jwt", "loginpanels",
                "ports", "responsetime", "robots", "techstack", "vhost");
    }

    @Test
    void resolve_orders_by_priority_regardless_of_input_order() {
        List<IAnalysisModule> picked = ModuleRegistry.defaultRegistry()
                .resolve(List.of("robots", "TITLE", "status", "title"));

        assertThat(picked).extracting(IAnalysisModule::name).containsExactly("status", "title", "robots");
    }

    @Test
    void default_modules_do_not_collide() {
        ModuleRegistry reg = ModuleRegistry.defaultRegistry();
        assertThat(reg.resolve(reg.names())).hasSize(15);
    }

    @Test
    void unknown_module_is_a_config_error() {
        assertThatThrownBy(() -> ModuleRegistry.defaultRegistry().resolve(List.of("status", "bogus")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("unknown module: bogus");
    }

    @Test
    void empty_selection_is_a_config_error() {
        assertThrows(ConfigException.class, () -> ModuleRegistry.defaultRegistry().resolve(List.of()));
    }

    @Test
    void field_collision_is_rejected() {
        ModuleRegistry reg = new ModuleRegistry(List.of(
                stub("alpha", 1, "shared", "a"),
                stub("beta", 2, "shared")));

        assertThatThrownBy(() -> reg.resolve(List.of("alpha", "beta")))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("'shared'");
        assertThat(reg.resolve(List.of("beta"))).hasSize(1);
    }

    @Test
    void duplicate_names_are_rejected_at_construction() {
        assertThrows(IllegalArgumentException.class, () -> new ModuleRegistry(List.of(
                stub("dup", 1, "x"), stub("DUP", 2, "y"))));
    }
}
