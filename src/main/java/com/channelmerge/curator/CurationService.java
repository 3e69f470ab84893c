package com.channelmerge.curator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.concurrent.*;

/**
 * Runs the curation workflow end to end.
 * <p>
 * Workflow:
 * <ul>
 *   <li>{@link #ingest}: fetch and parse every manifest in parallel, merge into the {@link EntryStore} in declaration order; {@code channels.json}.</li>
 *   <li>{@link #filterReachable}: first probe pass keeping reachable entries; {@code playable_channels.json}, checkpointed per batch.</li>
 *   <li>{@link #arrange}: group and prioritize; {@code channels_arrange.json}.</li>
 *   <li>{@link #repair}: re-probe and narrow groups; {@code channels_final.json}, checkpointed per batch.</li>
 *   <li>The final map goes to the configured sink, the probe report to CSV and the channels to an M3U playlist.</li>
 *   <li>{@link #split}: one playlist per channel plus a summary, from the last final document.</li>
 * </ul>
 * A manifest that fails to download or lacks its header is logged and skipped. Only sink failures stop a run.
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class CurationService {
    private static final Logger logger = LoggerFactory.getLogger(CurationService.class);

    public static final String ENTRIES_FILE = "channels.json";
    public static final String PLAYABLE_FILE = "playable_channels.json";
    public static final String ARRANGED_FILE = "channels_arrange.json";
    public static final String FINAL_FILE = "channels_final.json";
    public static final String REPORT_FILE = "probe_report.csv";
    public static final String PLAYLIST_FILE = "channels_final.m3u";
    public static final String SPLIT_DIR = "split";

    private final CuratorConfig config;
    private final ManifestFetcherInterface fetcher;
    private final ProbeServiceInterface prober;
    private final ChannelSinkInterface finalSink;
    private final CsvServiceInterface csvService;
    private final ChannelJsonService jsonService = new ChannelJsonService();
    private final ManifestParser parser = new ManifestParser();
    private final ChannelGrouper grouper = new ChannelGrouper();
    private final PlaylistWriter playlistWriter = new PlaylistWriter();
    private final EntryStore store;

    /**
     * @param config runtime settings
     * @param fetcher manifest transport
     * @param prober reachability check
     * @param finalSink durable store for the final map, or null to skip it
     * @param csvService diagnostics export
     */
    public CurationService(CuratorConfig config, ManifestFetcherInterface fetcher, ProbeServiceInterface prober,
                           ChannelSinkInterface finalSink, CsvServiceInterface csvService) {
        this.config = config;
        this.fetcher = fetcher;
        this.prober = prober;
        this.finalSink = finalSink;
        this.csvService = csvService;
        this.store = new EntryStore(config.mergeMode());
    }

    /**
     * Reads the manifest source list: a JSON object mapping labels to URLs, in declaration order.
     */
    public static LinkedHashMap<String, String> readSources(Path file) throws IOException {
        return new ObjectMapper().readValue(file.toFile(), new TypeReference<LinkedHashMap<String, String>>() {});
    }

    /**
     * Full run: ingest, first probe pass, grouping, repair and export.
     * @param sources label to manifest URL
     * @return report of the repair stage
     * @throws IOException if an intermediate document could not be written
     * @throws SinkWriteException if a checkpoint or the final sink failed after retries
     */
    public RepairReport run(Map<String, String> sources) throws IOException, SinkWriteException {
        ingest(sources);
        try (ProbeExecutor executor = ProbeExecutor.fromConfig(prober, config)) {
            List<ChannelEntry> reachable = filterReachable(store.all(), executor);
            LinkedHashMap<String, ChannelGroup> groups = arrange(reachable);
            return repair(groups, executor);
        }
    }

    /**
     * Re-validates the arranged document, or the last final document if no arranged one exists.
     * The final document is only a fallback: after an interrupted repair it holds just the batches that finished.
     * @return report of the repair stage
     * @throws IOException if neither document exists or it could not be read
     * @throws SinkWriteException if a checkpoint or the final sink failed after retries
     */
    public RepairReport recheck() throws IOException, SinkWriteException {
        LinkedHashMap<String, ChannelGroup> groups = loadGroups();
        try (ProbeExecutor executor = ProbeExecutor.fromConfig(prober, config)) {
            return repair(groups, executor);
        }
    }

    /**
     * Writes one playlist per channel of the final document (or the arranged one) into {@code split/}.
     * @return the playlists written
     * @throws IOException if no document exists or a file could not be written
     */
    public List<Path> split() throws IOException {
        Path finalFile = config.dataDir().resolve(FINAL_FILE);
        Path input = Files.exists(finalFile) ? finalFile : config.dataDir().resolve(ARRANGED_FILE);
        if (!Files.exists(input)) throw new IOException("Nothing to split: " + input + " does not exist");
        return playlistWriter.writePerChannel(jsonService.readGroups(input), config.dataDir().resolve(SPLIT_DIR));
    }

    private LinkedHashMap<String, ChannelGroup> loadGroups() throws IOException {
        Path arrangedFile = config.dataDir().resolve(ARRANGED_FILE);
        Path finalFile = config.dataDir().resolve(FINAL_FILE);
        Path input = Files.exists(arrangedFile) ? arrangedFile : finalFile;
        if (!Files.exists(input)) {
            throw new IOException("Nothing to re-check: neither " + arrangedFile + " nor " + finalFile + " exists");
        }
        LinkedHashMap<String, ChannelGroup> groups = jsonService.readGroups(input);
        logger.info("Loaded {} channel groups from {}", groups.size(), input);
        return groups;
    }

    /**
     * Fetches and parses every manifest, merging the results into the entry store.
     * Downloads run in parallel; merges happen afterwards in declaration order, so store order never
     * depends on which download finished first.
     * @param sources label to manifest URL
     * @return the entry store after all merges
     * @throws IOException if the entry document could not be written
     */
    public EntryStore ingest(Map<String, String> sources) throws IOException {
        int threads = Math.max(1, Math.min(config.poolSize(), sources.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            Map<String, Future<List<ChannelEntry>>> tasks = new LinkedHashMap<>();
            for (Map.Entry<String, String> source : sources.entrySet()) {
                tasks.put(source.getValue(), pool.submit(() -> fetchAndParse(source.getKey(), source.getValue())));
            }
            for (Map.Entry<String, Future<List<ChannelEntry>>> task : tasks.entrySet()) {
                try {
                    List<ChannelEntry> entries = task.getValue().get();
                    if (entries != null) store.merge(task.getKey(), entries);
                } catch (ExecutionException e) {
                    logger.error("Manifest ingestion task failed for {}: {}", task.getKey(), String.valueOf(e.getCause()));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while ingesting manifests", e);
        } finally {
            pool.shutdownNow();
        }
        jsonService.writeEntries(store.all(), config.dataDir().resolve(ENTRIES_FILE));
        logger.info("Ingestion complete: {} entries from {} manifests", store.size(), store.manifests().size());
        return store;
    }

    /**
     * Downloads and parses one manifest.
     * @return parsed entries, or null if the manifest was skipped
     */
    private List<ChannelEntry> fetchAndParse(String label, String url) {
        try {
            return parser.parse(fetcher.fetch(url), url);
        } catch (ManifestFormatException e) {
            logger.warn("Skipping manifest '{}': {}", label, e.getMessage());
        } catch (IOException e) {
            logger.warn("Failed to download manifest '{}' ({}): {}", label, url, e.getMessage());
        }
        return null;
    }

    /**
     * First probe pass: keeps entries whose endpoint is reachable, in order.
     * The reachable set is checkpointed after every batch.
     * @param entries entries to check
     * @param executor probe scheduler for this run
     * @return reachable entries
     * @throws SinkWriteException if a checkpoint could not be written after retries
     */
    public List<ChannelEntry> filterReachable(List<ChannelEntry> entries, ProbeExecutor executor) throws SinkWriteException {
        logger.info("Checking {} endpoints...", entries.size());
        Path checkpoint = config.dataDir().resolve(PLAYABLE_FILE);
        List<ChannelEntry> reachable = new ArrayList<>();
        for (int from = 0; from < entries.size(); from += config.batchSize()) {
            List<ChannelEntry> batch = entries.subList(from, Math.min(from + config.batchSize(), entries.size()));
            List<String> endpoints = new ArrayList<>();
            for (ChannelEntry e : batch) endpoints.add(e.endpoint());
            Map<String, ProbeResult> results = executor.probeAll(endpoints);
            for (ChannelEntry e : batch) {
                ProbeResult r = results.get(e.endpoint());
                if (r != null && r.isReachable()) {
                    reachable.add(e);
                } else {
                    logger.debug("Dropping {} - {}: {}", e.channelName(), e.endpoint(), r == null ? "no result" : r.detail());
                }
            }
            writeEntriesCheckpoint(reachable, checkpoint);
            logger.info("Progress: {}/{}, reachable: {}", Math.min(from + config.batchSize(), entries.size()), entries.size(), reachable.size());
        }
        if (entries.isEmpty()) writeEntriesCheckpoint(reachable, checkpoint);
        return reachable;
    }

    /**
     * Groups reachable entries and writes the arranged document.
     */
    public LinkedHashMap<String, ChannelGroup> arrange(List<ChannelEntry> reachable) throws IOException {
        LinkedHashMap<String, ChannelGroup> groups = grouper.build(reachable);
        jsonService.writeGroups(groups, config.dataDir().resolve(ARRANGED_FILE));
        return groups;
    }

    /**
     * Repairs groups, then hands the result to the final sink and the exports.
     * @throws SinkWriteException if a checkpoint or the final sink failed after retries
     */
    public RepairReport repair(Map<String, ChannelGroup> groups, ProbeExecutor executor) throws SinkWriteException {
        SinkWriter checkpoint = new SinkWriter(new JsonCheckpointSink(jsonService, config.dataDir().resolve(FINAL_FILE)),
            config.sinkRetries(), config.sinkBackoffMillis());
        RepairPipeline pipeline = new RepairPipeline(executor, checkpoint, config.batchSize());
        RepairReport report = pipeline.repair(groups);
        if (groups.isEmpty()) checkpoint.flush(report.channels());

        if (finalSink != null) {
            new SinkWriter(finalSink, config.sinkRetries(), config.sinkBackoffMillis()).flush(report.channels());
        }
        exportDiagnostics(report);
        return report;
    }

    private void exportDiagnostics(RepairReport report) {
        try {
            csvService.writeProbeReport(report.probes(), REPORT_FILE);
        } catch (IOException e) {
            logger.error("Failed to write probe report: {}", e.getMessage());
        }
        try {
            playlistWriter.writePlaylist(report.channels(), config.dataDir().resolve(PLAYLIST_FILE));
        } catch (IOException e) {
            logger.error("Failed to write playlist export: {}", e.getMessage());
        }
    }

    private void writeEntriesCheckpoint(List<ChannelEntry> entries, Path file) throws SinkWriteException {
        try {
            Utils.retry(() -> {
                jsonService.writeEntries(entries, file);
                return null;
            }, config.sinkRetries(), config.sinkBackoffMillis(), "write to checkpoint " + file);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SinkWriteException("Interrupted while writing " + file, e);
        } catch (Exception e) {
            throw new SinkWriteException("Failed to write checkpoint " + file, e);
        }
    }

    public EntryStore getStore() {
        return store;
    }
}
