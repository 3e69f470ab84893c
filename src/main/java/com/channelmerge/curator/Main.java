package com.channelmerge.curator;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for the channel curator.
 * <p>
 * The single optional argument selects the mode:
 * <ul>
 *   <li>{@code run} (default): ingest the manifests listed in the sources file, probe, group, repair and store.</li>
 *   <li>{@code recheck}: re-validate the arranged (or, if missing, the last final) document and store the result.</li>
 *   <li>{@code split}: write one playlist per channel of the last final document, without touching the database.</li>
 *   <li>{@code db}: start the embedded database only, for inspection.</li>
 * </ul>
 * Settings come from {@link CuratorConfig#fromSystem()}.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    /**
     * Creates the Postgres sink and ensures tables exist.
     * @param jdbcUrl JDBC URL
     * @param config settings holding credentials
     * @return sink ready for writes
     * @throws SinkWriteException if the schema could not be created
     */
    private static PostgresChannelSink createPostgresSink(String jdbcUrl, CuratorConfig config) throws SinkWriteException {
        PostgresChannelSink sink = new PostgresChannelSink(jdbcUrl, config.dbUser(), config.dbPassword());
        sink.createTables();
        return sink;
    }

    private static void logReport(RepairReport report) {
        logger.info("Channel groups checked: {}", report.groupsIn());
        logger.info("Kept: {}, promoted: {}, removed: {}", report.kept(), report.promoted(), report.removed());
        logger.info("Valid channel groups: {}", report.channels().size());
        if (report.transientErrors() > 0) {
            logger.warn("{} probes ended in indeterminate errors; see {}", report.transientErrors(), CurationService.REPORT_FILE);
        }
        if (report.deadlineExceeded()) {
            logger.warn("Run deadline exceeded; unfinished probes were counted as timeouts");
        }
    }

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase() : "run";
        if (!mode.equals("run") && !mode.equals("recheck") && !mode.equals("db") && !mode.equals("split")) {
            logger.error("Unknown mode '{}'. Expected run, recheck, split or db.", mode);
            System.exit(2);
        }
        CuratorConfig config = CuratorConfig.fromSystem();
        if (mode.equals("split")) {
            try {
                CurationService service = new CurationService(config, new HttpManifestFetcher(), new HttpProbeService(),
                    null, new CsvService(config.dataDir()));
                logger.info("Wrote {} per-channel playlists", service.split().size());
            } catch (Exception e) {
                logger.error("Split failed: {}", e.getMessage(), e);
                System.exit(1);
            }
            return;
        }
        EmbeddedPostgres postgres = null;
        int exitCode = 0;
        try {
            String jdbcUrl = config.dbUrl();
            if (jdbcUrl.isBlank()) {
                postgres = PostgresChannelSink.startEmbedded(config.embeddedDataDir(), config.embeddedPort());
                jdbcUrl = String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
            }

            if (mode.equals("db")) {
                createPostgresSink(jdbcUrl, config);
                System.out.println("Embedded Postgres started.");
                System.out.println("JDBC URL: " + jdbcUrl);
                System.out.println("Press Enter to stop the database and exit.");
                System.in.read();
                return;
            }

            ChannelSinkInterface sink = createPostgresSink(jdbcUrl, config);
            CurationService service = new CurationService(config, new HttpManifestFetcher(), new HttpProbeService(),
                sink, new CsvService(config.dataDir()));

            if (mode.equals("recheck")) {
                logReport(service.recheck());
            } else {
                var sources = CurationService.readSources(config.sourcesFile());
                logger.info("Loaded {} manifest sources from {}", sources.size(), config.sourcesFile());
                logReport(service.run(sources));
            }
        } catch (SinkWriteException e) {
            logger.error("Run halted, results could not be persisted: {}", e.getMessage(), e);
            exitCode = 1;
        } catch (Exception e) {
            logger.error("Run failed: {}", e.getMessage(), e);
            exitCode = 1;
        } finally {
            if (postgres != null) {
                try {
                    postgres.close();
                    logger.info("Embedded PostgreSQL stopped.");
                } catch (Exception e) {
                    logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
                }
            }
        }
        if (exitCode != 0) System.exit(exitCode);
    }
}
