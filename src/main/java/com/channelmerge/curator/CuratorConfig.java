package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Runtime settings for ingestion, probing and sinks.
 * <p>
 * Every value is looked up as a Java system property first, then as an environment variable, then falls back
 * to the default. Malformed numbers are logged and replaced by the default.
 *
 * @param probeTimeout per-probe timeout
 * @param poolSize maximum number of probes in flight
 * @param perHostLimit maximum probes in flight per host, 0 for no limit
 * @param batchSize groups (or entries) processed between checkpoint flushes
 * @param runDeadline global run deadline, or null for none
 * @param sinkRetries attempts per sink write
 * @param sinkBackoffMillis delay before the second sink attempt, doubled afterwards
 * @param mergeMode entry store merge semantics
 * @param dataDir working directory for JSON, CSV and playlist output
 * @param sourcesFile JSON object mapping labels to manifest URLs
 * @param dbUrl JDBC URL of an external database, empty to start embedded Postgres
 * @param dbUser database user
 * @param dbPassword database password
 * @param embeddedPort embedded Postgres port
 * @param embeddedDataDir embedded Postgres data directory
 */
public record CuratorConfig(
    Duration probeTimeout,
    int poolSize,
    int perHostLimit,
    int batchSize,
    Duration runDeadline,
    int sinkRetries,
    long sinkBackoffMillis,
    MergeMode mergeMode,
    Path dataDir,
    Path sourcesFile,
    String dbUrl,
    String dbUser,
    String dbPassword,
    int embeddedPort,
    String embeddedDataDir
) {
    private static final Logger logger = LoggerFactory.getLogger(CuratorConfig.class);

    public CuratorConfig {
        if (poolSize < 1) throw new IllegalArgumentException("Pool size must be at least 1");
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be at least 1");
        if (probeTimeout == null || probeTimeout.isNegative() || probeTimeout.isZero()) {
            throw new IllegalArgumentException("Probe timeout must be positive");
        }
    }

    /**
     * Defaults only, ignoring system properties and environment.
     */
    public static CuratorConfig defaults() {
        return new CuratorConfig(Duration.ofSeconds(10), 8, 0, 10, null, 3, 1000L,
            MergeMode.REPLACE_MANIFEST, Paths.get("curator-data"), Paths.get("channels_url.json"),
            "", "postgres", "postgres", 5432, "curator-data/pgdata");
    }

    /**
     * Reads every setting from system properties and environment variables.
     */
    public static CuratorConfig fromSystem() {
        long deadlineMs = readLong("CURATOR_RUN_DEADLINE_MS", 0);
        return new CuratorConfig(
            Duration.ofMillis(readLong("CURATOR_PROBE_TIMEOUT_MS", 10_000)),
            (int) readLong("CURATOR_POOL_SIZE", 8),
            (int) readLong("CURATOR_PER_HOST_LIMIT", 0),
            (int) readLong("CURATOR_BATCH_SIZE", 10),
            deadlineMs > 0 ? Duration.ofMillis(deadlineMs) : null,
            (int) readLong("CURATOR_SINK_RETRIES", 3),
            readLong("CURATOR_SINK_BACKOFF_MS", 1000),
            MergeMode.fromConfig(read("CURATOR_MERGE_MODE", "replace")),
            Paths.get(read("CURATOR_DATA_DIR", "curator-data")),
            Paths.get(read("CURATOR_SOURCES_FILE", "channels_url.json")),
            read("CURATOR_DB_URL", ""),
            read("CURATOR_DB_USER", "postgres"),
            read("CURATOR_DB_PASSWORD", "postgres"),
            (int) readLong("EMBEDDED_PG_PORT", 5432),
            read("EMBEDDED_PG_DATA_DIR", "curator-data/pgdata")
        );
    }

    static String read(String key, String defaultValue) {
        return System.getProperty(key, System.getenv().getOrDefault(key, defaultValue));
    }

    static long readLong(String key, long defaultValue) {
        String raw = read(key, null);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid value '{}' for {}, using default {}", raw, key, defaultValue);
            return defaultValue;
        }
    }
}
