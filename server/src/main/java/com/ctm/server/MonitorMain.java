package com.ctm.server;

import com.ctm.common.MonitorConfig;
import com.ctm.store.SqliteRecordStore;
import org.agrona.concurrent.ShutdownSignalBarrier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Task platform monitor: REST over recorded run data plus a live channel for dashboards.
 *
 * Usage:
 *   java -jar ctm-server.jar [config-path] [port]
 *
 * Defaults: http://localhost:8095, live channel ws://localhost:8095/socket, data in pmt_data.db.
 * Log level: -Dmonitor.log.level=DEBUG
 */
public final class MonitorMain {

    private static final Logger log = LoggerFactory.getLogger(MonitorMain.class);

    public static void main(String[] args) throws Exception {
        String configPath = args.length > 0 ? args[0] : null;
        MonitorConfig cfg = MonitorConfig.load(configPath);
        if (args.length > 1) cfg.port = Integer.parseInt(args[1]);

        SqliteRecordStore store = new SqliteRecordStore(Paths.get(cfg.dbFile));
        store.init();

        MonitorServer server = new MonitorServer(cfg, store);
        server.start();

        log.info("Application started. You can navigate to http://{}:{}",
                cfg.advertisedHost(System.getenv()), server.port());
        new ShutdownSignalBarrier().await();

        server.stop();
        log.info("Monitor exited.");
    }
}
