package com.subsort.core.model;

import com.subsort.core.config.ConfigException;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ScanConfigTest {

    @Test
    void defaults_are_valid() {
        ScanConfig c = ScanConfig.defaults();

        assertDoesNotThrow(c::validate);
        assertEquals(50, c.getConcurrency());
        assertEquals(Duration.ofSeconds(5), c.getTimeout());
        assertEquals(3, c.getMaxRetries());
        assertThat(c.getModules()).containsExactly("status");
        assertEquals(Duration.ofSeconds(10), c.getModuleBudget());
    }

    @Test
    void concurrency_bounds() {
        assertThrows(ConfigException.class, () -> ScanConfig.defaults().setConcurrency(0).validate());
        assertThrows(ConfigException.class, () -> ScanConfig.defaults().setConcurrency(201).validate());
        assertDoesNotThrow(() -> ScanConfig.defaults().setConcurrency(200).validate());
    }

    @Test
    void rejects_bad_values() {
        assertThrows(ConfigException.class, () -> ScanConfig.defaults().setTimeout(Duration.ZERO).validate());
        assertThrows(ConfigException.class, () -> ScanConfig.defaults().setMaxRetries(-1).validate());
        assertThrows(ConfigException.class, () -> ScanConfig.defaults().setDelay(Duration.ofMillis(-5)).validate());
        assertThrows(ConfigException.class, () -> ScanConfig.defaults().setModules(List.of(" ")).validate());
        assertThatThrownBy(() -> ScanConfig.defaults().setDefaultScheme("ftp").validate())
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("defaultScheme");
        assertThatThrownBy(() -> ScanConfig.defaults().setPorts(List.of(80, 70000)).validate())
                .hasMessageContaining("70000");
    }

    @Test
    void modules_are_normalized() {
        ScanConfig c = ScanConfig.defaults().setModules(Arrays.asList(" Title ", null, "STATUS", "", "title"));

        assertThat(c.getModules()).containsExactly("title", "status");
    }

    @Test
    void empty_port_list_means_defaults() {
        assertEquals(ScanConfig.DEFAULT_PORTS, ScanConfig.defaults().setPorts(List.of()).getPorts());
    }

    @Test
    void copy_is_detached_and_frozen() {
        ScanConfig original = ScanConfig.defaults().addHeader("X-Team", "red").setModules(List.of("status"));
        ScanConfig snap = original.copy();

        original.addHeader("X-Late", "1").enableModule("title").setConcurrency(7);

        assertThat(snap.getHeaders()).containsOnlyKeys("X-Team");
        assertThat(snap.getModules()).containsExactly("status");
        assertEquals(50, snap.getConcurrency());
        assertThrows(UnsupportedOperationException.class, () -> snap.getModules().add("js"));
    }
}
