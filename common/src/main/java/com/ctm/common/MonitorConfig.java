package com.ctm.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Central configuration loaded from monitor.yml (or classpath default).
 * All fields have sensible defaults for localhost development.
 */
public final class MonitorConfig {

    private static final Logger log = LoggerFactory.getLogger(MonitorConfig.class);

    public static final String DEFAULT_HOSTNAME = "localhost";

    // HTTP / live channel
    public int port = 8095;
    public String hostname = DEFAULT_HOSTNAME;
    public String socketPath = "/socket";
    public int maxContentLength = 1 << 20;
    public int workerThreads = 4;
    public int queryThreads = 4;        // blocking record-store reads run here, off the I/O loops

    // Record store
    public String dbFile = "pmt_data.db";

    // Render diagnostic pages for unhandled request errors
    public boolean debug = true;

    // Metrics
    public int metricsIntervalSecs = 30;

    public static MonitorConfig load(String path) {
        MonitorConfig cfg = new MonitorConfig();
        try (InputStream is = path != null && Files.exists(Paths.get(path))
                ? Files.newInputStream(Paths.get(path))
                : MonitorConfig.class.getResourceAsStream("/monitor.yml")) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
        } catch (Exception e) {
            log.warn("Failed to load config from {}, using defaults: {}", path, e.getMessage());
        }
        return cfg;
    }

    /**
     * Host name to advertise in the startup banner. A default host name yields to $HOSTNAME
     * when the environment defines one.
     */
    public String advertisedHost(Map<String, String> env) {
        if (DEFAULT_HOSTNAME.equals(hostname) && env.containsKey("HOSTNAME")) {
            return env.get("HOSTNAME");
        }
        return hostname;
    }

    private static void applyMap(MonitorConfig cfg, Map<String, Object> map) {
        if (map.containsKey("port")) cfg.port = (int) map.get("port");
        if (map.containsKey("hostname")) cfg.hostname = (String) map.get("hostname");
        if (map.containsKey("socketPath")) cfg.socketPath = (String) map.get("socketPath");
        if (map.containsKey("maxContentLength")) cfg.maxContentLength = (int) map.get("maxContentLength");
        if (map.containsKey("workerThreads")) cfg.workerThreads = (int) map.get("workerThreads");
        if (map.containsKey("queryThreads")) cfg.queryThreads = (int) map.get("queryThreads");
        if (map.containsKey("dbFile")) cfg.dbFile = (String) map.get("dbFile");
        if (map.containsKey("debug")) cfg.debug = (boolean) map.get("debug");
        if (map.containsKey("metricsIntervalSecs")) cfg.metricsIntervalSecs = (int) map.get("metricsIntervalSecs");
    }
}
