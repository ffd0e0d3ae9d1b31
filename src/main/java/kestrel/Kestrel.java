package kestrel;

import kestrel.commands.CommandRegistry;
import kestrel.db.KeyValueStore;
import kestrel.network.KestrelServer;
import kestrel.persistence.rdb.RdbReader;
import kestrel.persistence.rdb.ScanResult;
import kestrel.utils.Log;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Process entry point: reads the configuration, seeds the key space from the dump file,
 * starts the expiry janitor and serves clients until the JVM shuts down.
 */
public class Kestrel {

    public static void main(String[] args) throws Exception {
        Log.info("--- KESTREL v0.1.0 ---");

        Config config = Config.fromArgs(args);
        KeyValueStore store = new KeyValueStore();
        loadSnapshot(store, config);

        ScheduledExecutorService janitor = startJanitor(store, config.activeExpireIntervalMs);

        KestrelServer server = new KestrelServer(config, new CommandRegistry(new KestrelServerContext(store, config)));
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            Log.info("Shutting down...");
            if (janitor != null) janitor.shutdownNow();
            server.stop();
        }, "Shutdown"));

        server.awaitTermination();
    }

    static void loadSnapshot(KeyValueStore store, Config config) {
        Path file = Paths.get(config.get(Config.DIR).orElse("") + "/" + config.get(Config.DBFILENAME).orElse(""));
        if (!Files.exists(file)) {
            Log.info("No dump file at " + file + ", starting empty");
            return;
        }

        try {
            ScanResult result = RdbReader.scan(file);
            int loaded = store.loadFromSnapshot(result.getRecords());
            Log.info("Loaded " + loaded + " keys from " + file);
            if (result.stoppedAtUnsupportedType()) {
                Log.warn("Dump scan stopped early at unsupported record type " + result.getUnsupportedType());
            }
        } catch (IOException e) {
            Log.warn("Could not read dump file " + file + ": " + e.getMessage());
        }
    }

    static ScheduledExecutorService startJanitor(KeyValueStore store, long intervalMs) {
        if (intervalMs <= 0) return null;

        ScheduledExecutorService janitor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "Janitor");
            t.setDaemon(true);
            return t;
        });
        janitor.scheduleAtFixedRate(() -> {
            try {
                int removed = store.cleanup();
                if (removed > 0) {
                    Log.debug("[Janitor] Removed " + removed + " expired keys");
                }
            } catch (RuntimeException e) {
                Log.error("[Janitor] Cleanup failed", e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        return janitor;
    }
}
