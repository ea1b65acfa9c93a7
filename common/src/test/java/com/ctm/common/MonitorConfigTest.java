package com.ctm.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MonitorConfigTest {

    @TempDir
    Path dir;

    @Test
    void missingFileFallsBackToClasspathDefaults() {
        MonitorConfig cfg = MonitorConfig.load(dir.resolve("absent.yml").toString());

        assertEquals(8095, cfg.port);
        assertEquals("/socket", cfg.socketPath);
        assertEquals("pmt_data.db", cfg.dbFile);
        assertTrue(cfg.debug);
    }

    @Test
    void fileValuesOverrideDefaults() throws Exception {
        Path file = dir.resolve("monitor.yml");
        Files.writeString(file, String.join("\n",
                "port: 9100",
                "dbFile: /tmp/runs.db",
                "debug: false",
                "metricsIntervalSecs: 0",
                ""));

        MonitorConfig cfg = MonitorConfig.load(file.toString());

        assertEquals(9100, cfg.port);
        assertEquals("/tmp/runs.db", cfg.dbFile);
        assertFalse(cfg.debug);
        assertEquals(0, cfg.metricsIntervalSecs);
        // untouched keys keep their defaults
        assertEquals("localhost", cfg.hostname);
    }

    @Test
    void unreadableYamlKeepsDefaults() throws Exception {
        Path file = dir.resolve("broken.yml");
        Files.writeString(file, "port: [unterminated");

        MonitorConfig cfg = MonitorConfig.load(file.toString());

        assertEquals(8095, cfg.port);
    }

    @Test
    void defaultHostnameYieldsToEnvironment() {
        MonitorConfig cfg = new MonitorConfig();
        assertEquals("box-7", cfg.advertisedHost(Map.of("HOSTNAME", "box-7")));
        assertEquals("localhost", cfg.advertisedHost(Map.of()));

        cfg.hostname = "monitor.internal";
        assertEquals("monitor.internal", cfg.advertisedHost(Map.of("HOSTNAME", "box-7")));
    }
}
