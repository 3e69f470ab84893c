package com.channelmerge.curator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Re-validates grouped channels and narrows every group to its live members.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Groups are taken in fixed-size batches; every member of every group in the batch is probed once
 *       through the {@link ProbeExecutor}, which returns only when the whole batch has results.</li>
 *   <li>{@link #decide} then runs single-threaded per group:
 *     <ul>
 *       <li>reachable primary: kept, overflow narrowed to its reachable members;</li>
 *       <li>dead primary with a reachable overflow member: the first such member is promoted;</li>
 *       <li>nothing reachable: the group is dropped.</li>
 *     </ul>
 *   </li>
 *   <li>After each batch the accumulated result, sorted by channel name, is flushed to the checkpoint writer,
 *       so a crash loses at most the batch in progress.</li>
 * </ul>
 *
 * @author Channel Merge Team
 * @since 1.0
 */
public class RepairPipeline {
    private static final Logger logger = LoggerFactory.getLogger(RepairPipeline.class);

    private final ProbeExecutor executor;
    private final SinkWriter checkpoint;
    private final int batchSize;

    /**
     * @param executor probe scheduler
     * @param checkpoint writer flushed after every batch, or null to skip checkpointing
     * @param batchSize groups per batch
     */
    public RepairPipeline(ProbeExecutor executor, SinkWriter checkpoint, int batchSize) {
        if (executor == null) throw new IllegalArgumentException("Probe executor cannot be null");
        if (batchSize < 1) throw new IllegalArgumentException("Batch size must be at least 1");
        this.executor = executor;
        this.checkpoint = checkpoint;
        this.batchSize = batchSize;
    }

    /**
     * Runs a full re-evaluation.
     * @param groups groups to repair, keyed by channel name
     * @return surviving groups plus counters and probe diagnostics
     * @throws SinkWriteException if a checkpoint flush failed after all retries
     */
    public RepairReport repair(Map<String, ChannelGroup> groups) throws SinkWriteException {
        logger.info("Re-checking {} channel groups...", groups.size());
        List<ChannelGroup> pending = new ArrayList<>(groups.values());
        SortedMap<String, ChannelGroup> result = new TreeMap<>();
        List<ProbeReportRow> rows = new ArrayList<>();
        int kept = 0;
        int promoted = 0;
        int removed = 0;
        int transientErrors = 0;
        int processed = 0;

        for (int from = 0; from < pending.size(); from += batchSize) {
            List<ChannelGroup> batch = pending.subList(from, Math.min(from + batchSize, pending.size()));
            List<String> endpoints = new ArrayList<>();
            for (ChannelGroup g : batch) {
                for (ChannelRecord r : g.members()) endpoints.add(r.endpoint());
            }
            Map<String, ProbeResult> probed = executor.probeAll(endpoints);

            for (ChannelGroup group : batch) {
                transientErrors += collectRows(group, probed, rows);
                Optional<ChannelGroup> repaired = decide(group, probed);
                if (repaired.isEmpty()) {
                    removed++;
                    logger.info("Removed '{}': no reachable endpoint left", group.channelName());
                } else if (isReachable(probed, group.primary())) {
                    kept++;
                    result.put(group.channelName(), repaired.get());
                    logger.debug("Kept '{}' with {} reachable alternates", group.channelName(), repaired.get().overflow().size());
                } else {
                    promoted++;
                    result.put(group.channelName(), repaired.get());
                    logger.info("Promoted alternate for '{}': {}", group.channelName(), repaired.get().primary().endpoint());
                }
            }
            processed += batch.size();
            if (checkpoint != null) checkpoint.flush(result);
            logger.info("Progress: {}/{}, valid channel groups: {}", processed, pending.size(), result.size());
        }

        boolean deadlineExceeded = executor.deadlineExceeded();
        if (deadlineExceeded) logger.warn("Repair finished after the run deadline; late probes were counted as timeouts");
        logger.info("Re-check complete: {} kept, {} promoted, {} removed, {} indeterminate probes",
            kept, promoted, removed, transientErrors);
        return new RepairReport(result, groups.size(), kept, promoted, removed, transientErrors, deadlineExceeded, rows);
    }

    /**
     * Derives the repaired group from probe results.
     * Members without a result count as unreachable.
     * @param group group as it was before this run
     * @param results probe result per endpoint
     * @return the narrowed group, or empty when no member is reachable
     */
    public static Optional<ChannelGroup> decide(ChannelGroup group, Map<String, ProbeResult> results) {
        List<ChannelRecord> liveOverflow = new ArrayList<>();
        for (ChannelRecord r : group.overflow()) {
            if (isReachable(results, r)) liveOverflow.add(r);
        }
        if (isReachable(results, group.primary())) {
            return Optional.of(new ChannelGroup(group.channelName(), group.primary(), liveOverflow));
        }
        if (liveOverflow.isEmpty()) return Optional.empty();
        ChannelRecord newPrimary = liveOverflow.remove(0);
        return Optional.of(new ChannelGroup(group.channelName(), newPrimary, liveOverflow));
    }

    private static boolean isReachable(Map<String, ProbeResult> results, ChannelRecord record) {
        ProbeResult r = results.get(record.endpoint());
        return r != null && r.isReachable();
    }

    private static int collectRows(ChannelGroup group, Map<String, ProbeResult> probed, List<ProbeReportRow> rows) {
        int transients = 0;
        List<ChannelRecord> members = group.members();
        for (int i = 0; i < members.size(); i++) {
            ChannelRecord r = members.get(i);
            ProbeResult result = probed.getOrDefault(r.endpoint(), ProbeResult.transientError("no result"));
            if (result.isTransient()) transients++;
            rows.add(new ProbeReportRow(group.channelName(), i == 0 ? "primary" : "overflow", r.endpoint(), result));
        }
        return transients;
    }
}
